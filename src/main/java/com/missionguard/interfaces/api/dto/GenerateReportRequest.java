package com.missionguard.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for report generation. Instructions and section notes are screened by the
 * guardrail before they can reach a prompt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateReportRequest {

    @NotBlank(message = "Template id is required")
    private String templateId;

    private String instructions;

    /** Notes keyed by section name. */
    private Map<String, String> sectionNotes;
}
