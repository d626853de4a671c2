package com.missionguard.interfaces.api.dto;

import com.missionguard.domain.model.GapAnalysisResult;
import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.GapKind;
import com.missionguard.domain.model.GapSubject;
import com.missionguard.domain.model.PriorityItem;
import com.missionguard.domain.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GapAnalysisResponse {

    private String missionId;
    private String snapshotRef;
    private String kgSnapshotRef;
    private List<String> datasetProfileRefs;
    private List<Finding> findings;
    private List<Priority> priorities;
    private boolean partial;
    private List<String> unavailableSources;
    private List<String> annotations;
    private Instant generatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Finding {
        private GapKind kind;
        private Severity severity;
        private String description;
        private String supportingReference;
        private String recommendedAction;
        private List<String> subjects;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Priority {
        private String subject;
        private String subjectType;
        private int score;
        private int openGaps;
        private String rationale;
    }

    public static GapAnalysisResponse from(GapAnalysisResult result) {
        return GapAnalysisResponse.builder()
            .missionId(result.getMissionId())
            .snapshotRef(result.getSnapshotRef())
            .kgSnapshotRef(result.getKgSnapshotRef())
            .datasetProfileRefs(result.getDatasetProfileRefs())
            .findings(result.getFindings().stream().map(GapAnalysisResponse::finding).toList())
            .priorities(result.getPriorities().stream().map(GapAnalysisResponse::priority).toList())
            .partial(result.isPartial())
            .unavailableSources(result.getUnavailableSources())
            .annotations(result.getAnnotations())
            .generatedAt(result.getGeneratedAt())
            .build();
    }

    private static Finding finding(GapFinding finding) {
        return Finding.builder()
            .kind(finding.getKind())
            .severity(finding.getSeverity())
            .description(finding.getDescription())
            .supportingReference(finding.getSupportingReference())
            .recommendedAction(finding.getRecommendedAction())
            .subjects(finding.getSubjects().stream().map(GapSubject::name).toList())
            .build();
    }

    private static Priority priority(PriorityItem item) {
        return Priority.builder()
            .subject(item.getSubject().name())
            .subjectType(item.getSubject().type().name())
            .score(item.getScore())
            .openGaps(item.getOpenGaps())
            .rationale(item.getRationale())
            .build();
    }
}
