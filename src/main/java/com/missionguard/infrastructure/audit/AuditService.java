package com.missionguard.infrastructure.audit;

/**
 * Audit sink for guardrail and synthesis decisions.
 * Fire-and-forget: implementations must not throw and must not block the caller.
 */
public interface AuditService {
    void record(AuditEvent event);
}
