package com.missionguard.domain.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of guardrail classification.
 *
 * <p>Either {@link Allow} or {@link Block}. Callers handle both cases through
 * {@link #fold(Function, Function)}; a block is a normal result, never an exception.
 */
public sealed interface Verdict permits Verdict.Allow, Verdict.Block {

    <R> R fold(Function<Allow, R> onAllow, Function<Block, R> onBlock);

    default boolean isBlocked() {
        return fold(allow -> false, block -> true);
    }

    /**
     * @param matchedRuleId rule that matched but whose category is allowed, or null
     * @param degraded true when the input could not be classified and was let through
     */
    record Allow(String matchedRuleId, boolean degraded) implements Verdict {

        public static Allow clean() {
            return new Allow(null, false);
        }

        public static Allow degradedInput() {
            return new Allow(null, true);
        }

        @Override
        public <R> R fold(Function<Allow, R> onAllow, Function<Block, R> onBlock) {
            return onAllow.apply(this);
        }
    }

    record Block(String actionCategory, String remediation, String ruleId, BlockReason reason) implements Verdict {

        public Block {
            Objects.requireNonNull(actionCategory, "actionCategory");
            Objects.requireNonNull(reason, "reason");
            if (remediation == null || remediation.isBlank()) {
                throw new IllegalArgumentException("A block must carry remediation text");
            }
        }

        @Override
        public <R> R fold(Function<Allow, R> onAllow, Function<Block, R> onBlock) {
            return onBlock.apply(this);
        }
    }

    enum BlockReason {
        RULE_MATCH,
        POLICY_CONFIG_ERROR
    }
}
