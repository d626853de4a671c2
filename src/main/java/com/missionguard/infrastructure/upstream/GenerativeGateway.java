package com.missionguard.infrastructure.upstream;

import java.time.Duration;

/**
 * Stateless text completion backend.
 *
 * <p>Never consulted for guardrail decisions; its output is content, not policy.
 */
public interface GenerativeGateway {

    /**
     * @param prompt full prompt including the policy preamble
     * @param timeout how long the caller will wait
     * @return completion text
     * @throws com.missionguard.application.exceptions.UpstreamTimeoutException when the backend does not answer in time
     * @throws com.missionguard.application.exceptions.UpstreamUnavailableException on any other backend failure
     */
    String complete(String prompt, Duration timeout);
}
