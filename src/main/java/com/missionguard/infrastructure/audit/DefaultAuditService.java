package com.missionguard.infrastructure.audit;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Writes audit events to the {@code AUDIT} logger off the request thread.
 * Route the AUDIT logger to the audit sink in {@code logback-spring.xml}.
 */
@Service
@Slf4j
public class DefaultAuditService implements AuditService {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    private final Executor auditExecutor;

    public DefaultAuditService(@Qualifier("auditExecutor") Executor auditExecutor) {
        this.auditExecutor = auditExecutor;
    }

    @Override
    public void record(AuditEvent event) {
        try {
            auditExecutor.execute(() -> write(event));
        } catch (RejectedExecutionException e) {
            // Saturated: write inline rather than lose the record.
            log.warn("Audit executor saturated, writing {} inline", event.getType());
            write(event);
        }
    }

    private void write(AuditEvent event) {
        AUDIT.info("type={} mission={} outcome={} rule={} category={} degraded={} produced={} detail={} at={}",
            event.getType(),
            event.getMissionId(),
            event.getOutcome(),
            event.getRuleId(),
            event.getActionCategory(),
            event.isDegraded(),
            event.getProduced(),
            event.getDetail(),
            event.getTimestamp());
    }
}
