package com.missionguard.application.exceptions;

/**
 * Missing or invalid authority, rule or template configuration.
 *
 * <p>Always fails closed: callers that screen requests turn this into a block.
 */
public class PolicyConfigException extends RuntimeException {

    public PolicyConfigException(String message) {
        super(message);
    }

    public PolicyConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
