package com.missionguard.application.exceptions;

import lombok.Getter;

/**
 * An external collaborator (knowledge graph, profiler, generative gateway, mission
 * service) could not be reached or answered with an error.
 *
 * <p>Read paths degrade on this instead of failing.
 */
@Getter
public class UpstreamUnavailableException extends RuntimeException {

    private final String source;

    public UpstreamUnavailableException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public UpstreamUnavailableException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }
}
