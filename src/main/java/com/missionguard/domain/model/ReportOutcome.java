package com.missionguard.domain.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of report synthesis: a product, or a guardrail block with no product.
 */
public sealed interface ReportOutcome permits ReportOutcome.Produced, ReportOutcome.Blocked {

    <R> R fold(Function<Produced, R> onProduced, Function<Blocked, R> onBlocked);

    record Produced(ReportProduct product) implements ReportOutcome {
        public Produced {
            Objects.requireNonNull(product, "product");
        }

        @Override
        public <R> R fold(Function<Produced, R> onProduced, Function<Blocked, R> onBlocked) {
            return onProduced.apply(this);
        }
    }

    /**
     * @param stage synthesis state in which the block occurred
     * @param sectionName offending section, null when blocked before rendering
     */
    record Blocked(String missionId, String templateId, Verdict.Block verdict, String stage, String sectionName)
            implements ReportOutcome {

        @Override
        public <R> R fold(Function<Produced, R> onProduced, Function<Blocked, R> onBlocked) {
            return onBlocked.apply(this);
        }
    }
}
