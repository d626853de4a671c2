package com.missionguard.application.exceptions;

/**
 * Handled exactly like {@link UpstreamUnavailableException}.
 */
public class UpstreamTimeoutException extends UpstreamUnavailableException {

    public UpstreamTimeoutException(String source, String message) {
        super(source, message);
    }

    public UpstreamTimeoutException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
