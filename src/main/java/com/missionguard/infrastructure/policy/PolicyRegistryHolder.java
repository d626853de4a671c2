package com.missionguard.infrastructure.policy;

import com.missionguard.application.exceptions.PolicyConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Atomic handle on the active {@link PolicyRegistry}.
 *
 * <p>Readers take one snapshot per request via {@link #current()} and use it
 * throughout, so a concurrent reload never mixes two policies in one decision.
 */
@Component
@Slf4j
public class PolicyRegistryHolder {

    private final PolicyConfigurationLoader loader;
    private final AtomicReference<PolicyRegistry> active;

    public PolicyRegistryHolder(PolicyConfigurationLoader loader) {
        this.loader = loader;
        this.active = new AtomicReference<>(loader.load());
    }

    public PolicyRegistry current() {
        return active.get();
    }

    /**
     * Load the configuration again and swap it in. On failure the previous registry stays active.
     *
     * @return the new registry version
     * @throws PolicyConfigException when the new configuration is invalid
     */
    public String reload() {
        PolicyRegistry next;
        try {
            next = loader.load();
        } catch (PolicyConfigException e) {
            log.error("Policy reload rejected, keeping version {}: {}", active.get().getVersion(), e.getMessage());
            throw e;
        }
        PolicyRegistry previous = active.getAndSet(next);
        log.warn("Policy registry swapped: {} -> {}", previous.getVersion(), next.getVersion());
        return next.getVersion();
    }
}
