package com.missionguard.application.exceptions;

/**
 * Template exists but the mission's authority or INT-lane coverage does not permit it.
 */
public class TemplateNotEligibleException extends RuntimeException {

    public TemplateNotEligibleException(String templateId, String missionId) {
        super("Template " + templateId + " is not selectable for mission " + missionId);
    }
}
