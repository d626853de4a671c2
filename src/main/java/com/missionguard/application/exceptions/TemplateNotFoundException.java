package com.missionguard.application.exceptions;

public class TemplateNotFoundException extends RuntimeException {

    public TemplateNotFoundException(String templateId) {
        super("Template not found: " + templateId);
    }
}
