package com.missionguard.application.exceptions;

/**
 * Report synthesis was cancelled before a product was assembled.
 */
public class ReportCancelledException extends RuntimeException {

    public ReportCancelledException(String missionId, String templateId) {
        super("Report " + templateId + " for mission " + missionId + " was cancelled");
    }
}
