package com.missionguard.config;

import com.missionguard.application.gap.GapAnalysisMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine settings bound from {@code engine.*}.
 */
@Data
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private Policy policy = new Policy();
    private Guardrail guardrail = new Guardrail();
    private Gap gap = new Gap();
    private Synthesis synthesis = new Synthesis();
    private Upstream upstream = new Upstream();

    @Data
    public static class Policy {
        /** Spring resource location of the policy YAML. */
        private String location = "classpath:policy/default-policy.yml";
    }

    @Data
    public static class Guardrail {
        /** Requests longer than this are treated as malformed and let through degraded. */
        private int maxInputLength = 20_000;
    }

    @Data
    public static class Gap {
        private Duration bucketWidth = Duration.ofDays(1);
        private double qualityThreshold = 0.8;
        /** Relative difference above which two numeric assertions conflict. */
        private double numericTolerance = 0.05;
        private int priorityLimit = 5;
        private GapAnalysisMode mode = GapAnalysisMode.RULES;
        private Duration advisoryTimeout = Duration.ofSeconds(20);
    }

    @Data
    public static class Synthesis {
        private int maxConcurrentSections = 4;
        private Duration sectionTimeout = Duration.ofSeconds(30);
        private Duration reportDeadline = Duration.ofMinutes(3);
    }

    @Data
    public static class Upstream {
        private Endpoint kg = new Endpoint("http://localhost:8081");
        private Endpoint profiles = new Endpoint("http://localhost:8082");
        private Endpoint gateway = new Endpoint("http://localhost:8083");
        private Endpoint missions = new Endpoint("http://localhost:8084");
        private Duration fetchTimeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(3);
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Duration maxRetryDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class Endpoint {
        private String baseUrl;
        private String apiKey;

        public Endpoint() {}

        public Endpoint(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
