package com.missionguard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Main application class for the Mission Guardrail Engine.
 *
 * <p>Mediates between a mission's authority, the INT lanes available to it, analyst
 * requests and a generative text backend:
 *
 * <ul>
 *   <li><strong>Guardrail</strong>: deterministic allow/block of requested actions before any generative call</li>
 *   <li><strong>Templates</strong>: report templates filtered by authority and INT coverage</li>
 *   <li><strong>Gap analysis</strong>: structured findings on missing or conflicting information</li>
 *   <li><strong>Reports</strong>: multi-section products synthesized under policy, degrading per section</li>
 * </ul>
 *
 * <p>Startup fails if the policy configuration at {@code engine.policy.location} is invalid.
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class GuardrailEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardrailEngineApplication.class, args);
        log.info("Mission Guardrail Engine started");
    }
}
