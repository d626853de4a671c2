package com.missionguard.application.report;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Report generation request.
 */
@Value
@Builder
public class ReportRequest {
    String missionId;
    String templateId;
    /** Report-level analyst instructions; screened before template selection completes. */
    String instructions;
    /** Analyst notes keyed by section name; each screened before its section renders. */
    @Builder.Default
    Map<String, String> sectionNotes = Map.of();
}
