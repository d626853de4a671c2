package com.missionguard.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance Monitoring Configuration.
 *
 * Tracks:
 * - Guardrail classification latency
 * - Upstream fetch and generative gateway latency, by outcome
 * - Verdict, report and gap analysis counts
 *
 * No request text, prompts or generated content is ever placed in a tag.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Times guardrail classification.
     */
    @Aspect
    @Component
    public static class GuardrailPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public GuardrailPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.missionguard.application.guardrail.GuardrailClassifier.classify(..))")
        public Object timeClassification(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "guardrail.classify", joinPoint);
        }
    }

    /**
     * Times calls to the knowledge graph, profile service, mission service and generative gateway.
     */
    @Aspect
    @Component
    public static class UpstreamPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public UpstreamPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.missionguard.infrastructure.upstream.Http*.*(..))"
            + " || execution(* com.missionguard.infrastructure.persistence.RemoteMissionRepository.*(..))")
        public Object timeUpstreamCall(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "upstream.call", joinPoint);
        }
    }

    static Object timed(MeterRegistry meterRegistry, String name, ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Object result = joinPoint.proceed();
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", "success")
                .register(meterRegistry));
            return result;
        } catch (Exception e) {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", "failure")
                .register(meterRegistry));
            throw e;
        }
    }

    /**
     * Counters for engine outcomes.
     */
    @Component
    @Slf4j
    public static class EngineMetrics {

        private final MeterRegistry meterRegistry;

        public EngineMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized engine metrics");
        }

        public void recordAllow(boolean degraded) {
            meterRegistry.counter("guardrail.verdicts", "outcome", "allow",
                "degraded", Boolean.toString(degraded)).increment();
        }

        /**
         * Category names come from policy configuration, so cardinality is bounded.
         */
        public void recordBlock(String actionCategory) {
            meterRegistry.counter("guardrail.verdicts", "outcome", "block",
                "category", actionCategory).increment();
        }

        public void recordReport(String outcome) {
            meterRegistry.counter("reports.completed", "outcome", outcome).increment();
        }

        public void recordDegradedSection() {
            meterRegistry.counter("reports.sections.degraded").increment();
        }

        public void recordGapAnalysis(boolean partial) {
            meterRegistry.counter("gap.analyses", "partial", Boolean.toString(partial)).increment();
        }

        public void recordProductCacheHit(String productType) {
            meterRegistry.counter("products.cache.hits", "type", productType).increment();
        }
    }
}
