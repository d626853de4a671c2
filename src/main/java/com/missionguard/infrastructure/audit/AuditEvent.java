package com.missionguard.infrastructure.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Audit record handed to the audit sink. Carries identifiers and outcomes only,
 * never raw analyst text.
 */
@Value
@Builder
public class AuditEvent {

    public static final String GUARDRAIL_VERDICT = "guardrail.verdict";
    public static final String REPORT_PRODUCED = "report.produced";
    public static final String REPORT_BLOCKED = "report.blocked";
    public static final String REPORT_CANCELLED = "report.cancelled";
    public static final String GAP_ANALYSIS = "gap.analysis";
    public static final String POLICY_RELOAD = "policy.reload";

    String type;
    String missionId;
    String outcome;
    String ruleId;
    String actionCategory;
    boolean degraded;
    /** Whether a product was handed out; only set on report events. */
    Boolean produced;
    String detail;
    @Builder.Default
    Instant timestamp = Instant.now();
}
