package com.missionguard.application.guardrail;

import com.missionguard.application.LogSafe;
import com.missionguard.config.EngineProperties;
import com.missionguard.config.PerformanceConfiguration.EngineMetrics;
import com.missionguard.domain.model.Authority;
import com.missionguard.domain.model.GuardrailRule;
import com.missionguard.domain.model.TextNormalization;
import com.missionguard.domain.model.Verdict;
import com.missionguard.infrastructure.audit.AuditEvent;
import com.missionguard.infrastructure.audit.AuditService;
import com.missionguard.infrastructure.policy.PolicyRegistry;
import com.missionguard.infrastructure.policy.PolicyRegistryHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Guardrail Classifier - screens request text against the policy registry.
 *
 * <p>Decision procedure, in order:
 * <ol>
 *   <li>Unknown mission authority: Block with reason POLICY_CONFIG_ERROR (fail closed).</li>
 *   <li>Malformed input: Allow flagged degraded (fail open; a block must be justified).</li>
 *   <li>Every rule is matched against the normalized text. Among rules whose category is
 *       blocked under the authority, the longest matched span wins; equal spans go to the
 *       rule declared first in the policy file.</li>
 *   <li>No blocked match: Allow.</li>
 * </ol>
 *
 * <p>Pure and synchronous. Runs before any generative call and never consults one.
 * Every verdict is audited.
 *
 * @since 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GuardrailClassifier {

    static final String POLICY_CONFIG_CATEGORY = "policy_config_error";

    private final PolicyRegistryHolder registryHolder;
    private final AuditService auditService;
    private final EngineProperties properties;
    private final EngineMetrics metrics;

    public Verdict classify(String requestText, String authorityId, String missionId) {
        return classify(requestText, authorityId, missionId, registryHolder.current());
    }

    /**
     * Classify against a registry snapshot the caller already holds.
     */
    public Verdict classify(String requestText, String authorityId, String missionId, PolicyRegistry registry) {
        Optional<Authority> authority = registry.findAuthority(authorityId);
        if (authority.isEmpty()) {
            log.error("Mission {} references unknown authority '{}', blocking", missionId, authorityId);
            Verdict verdict = new Verdict.Block(
                POLICY_CONFIG_CATEGORY,
                "Mission authority '" + authorityId + "' is not defined in policy version "
                    + registry.getVersion() + ". Requests are blocked until policy administrators configure it.",
                null,
                Verdict.BlockReason.POLICY_CONFIG_ERROR);
            return record(verdict, missionId);
        }

        if (isMalformed(requestText)) {
            log.warn("Classifier degraded for mission {}: malformed input treated as non-matching", missionId);
            return record(Verdict.Allow.degradedInput(), missionId);
        }

        String normalized = TextNormalization.normalize(requestText);
        if (log.isDebugEnabled()) {
            log.debug("Classifying for mission {} under {}: {}", missionId, authorityId, LogSafe.excerpt(normalized));
        }

        GuardrailRule winner = null;
        int winnerSpan = 0;
        GuardrailRule firstAllowedMatch = null;
        for (GuardrailRule rule : registry.getRules()) {
            int span = rule.match(normalized);
            if (span == 0) {
                continue;
            }
            if (authority.get().isBlocked(rule.getActionCategory())) {
                // Strictly greater: on equal spans the earlier declaration keeps the win.
                if (span > winnerSpan) {
                    winner = rule;
                    winnerSpan = span;
                }
            } else if (firstAllowedMatch == null) {
                firstAllowedMatch = rule;
            }
        }

        Verdict verdict;
        if (winner != null) {
            String referral = referralFor(winner, authority.get(), registry);
            verdict = new Verdict.Block(
                winner.getActionCategory(),
                winner.renderRemediation(authority.get(), referral),
                winner.getId(),
                Verdict.BlockReason.RULE_MATCH);
        } else {
            verdict = new Verdict.Allow(firstAllowedMatch != null ? firstAllowedMatch.getId() : null, false);
        }
        return record(verdict, missionId);
    }

    private String referralFor(GuardrailRule rule, Authority missionAuthority, PolicyRegistry registry) {
        Optional<Authority> target = rule.getReferTo() != null
            ? registry.findAuthority(rule.getReferTo())
            : registry.firstAuthorityAllowing(rule.getActionCategory(), missionAuthority.getId());
        return target
            .map(a -> a.getDisplayName() + " (" + a.getId() + ")")
            .orElse("an authority whose mandate covers " + rule.getActionCategory());
    }

    private boolean isMalformed(String text) {
        if (text == null || text.length() > properties.getGuardrail().getMaxInputLength()) {
            return true;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\u0000') {
                return true;
            }
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    return true;
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return true;
            }
        }
        return false;
    }

    private Verdict record(Verdict verdict, String missionId) {
        AuditEvent event = verdict.fold(
            allow -> AuditEvent.builder()
                .type(AuditEvent.GUARDRAIL_VERDICT)
                .missionId(missionId)
                .outcome("ALLOW")
                .ruleId(allow.matchedRuleId())
                .degraded(allow.degraded())
                .detail(allow.degraded() ? "classifier-degraded" : null)
                .build(),
            block -> AuditEvent.builder()
                .type(AuditEvent.GUARDRAIL_VERDICT)
                .missionId(missionId)
                .outcome("BLOCK")
                .ruleId(block.ruleId())
                .actionCategory(block.actionCategory())
                .detail(block.reason().name())
                .build());
        auditService.record(event);
        verdict.fold(
            allow -> {
                metrics.recordAllow(allow.degraded());
                return null;
            },
            block -> {
                metrics.recordBlock(block.actionCategory());
                if (log.isInfoEnabled()) {
                    log.info("GUARDRAIL BLOCK mission={} rule={} category={}",
                        missionId, block.ruleId(), block.actionCategory());
                }
                return null;
            });
        return verdict;
    }
}
