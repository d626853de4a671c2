package com.missionguard.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.missionguard.domain.model.GuardrailPosture;
import com.missionguard.domain.model.RenderedSection;
import com.missionguard.domain.model.ReportOutcome;
import com.missionguard.domain.model.ReportProduct;
import com.missionguard.domain.model.SectionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Report outcome. {@code status} is PRODUCED with the product fields set, or BLOCKED
 * with {@code verdict} and the stage at which the request was blocked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReportResponse {

    private String status;
    private String missionId;
    private String templateId;

    private List<Section> sections;
    private GuardrailPosture guardrailPosture;
    private String gapSnapshotRef;
    private String kgSnapshotRef;
    private Instant generatedAt;
    private List<String> degradedSections;
    private Boolean partialContext;

    private VerdictResponse verdict;
    private String blockedAt;
    private String blockedSection;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Section {
        private String name;
        private String text;
        private SectionStatus status;
    }

    public static ReportResponse from(ReportOutcome outcome) {
        return outcome.fold(
            produced -> produced(produced.product()),
            blocked -> ReportResponse.builder()
                .status("BLOCKED")
                .missionId(blocked.missionId())
                .templateId(blocked.templateId())
                .verdict(VerdictResponse.from(blocked.verdict()))
                .blockedAt(blocked.stage())
                .blockedSection(blocked.sectionName())
                .build());
    }

    private static ReportResponse produced(ReportProduct product) {
        return ReportResponse.builder()
            .status("PRODUCED")
            .missionId(product.getMissionId())
            .templateId(product.getTemplateId())
            .sections(product.getSections().stream().map(ReportResponse::section).toList())
            .guardrailPosture(product.getGuardrailPosture())
            .gapSnapshotRef(product.getGapSnapshotRef())
            .kgSnapshotRef(product.getKgSnapshotRef())
            .generatedAt(product.getGeneratedAt())
            .degradedSections(product.getDegradedSections())
            .partialContext(product.isPartialContext())
            .build();
    }

    private static Section section(RenderedSection section) {
        return Section.builder()
            .name(section.getName())
            .text(section.getText())
            .status(section.getStatus())
            .build();
    }
}
