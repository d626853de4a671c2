package com.missionguard.application.report;

import com.missionguard.domain.model.ColumnProfile;
import com.missionguard.domain.model.DataRequirement;
import com.missionguard.domain.model.DatasetProfile;
import com.missionguard.domain.model.GapAnalysisResult;
import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.KgEntity;
import com.missionguard.domain.model.KgEvent;
import com.missionguard.domain.model.KgSnapshot;
import com.missionguard.domain.model.MissionDocument;
import com.missionguard.domain.model.MissionPolicyContext;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evidence gathered in BUILD_CONTEXT for one report, sliced per data requirement.
 * A slice is empty when there is no evidence of that kind.
 */
@Value
@Builder
public class ContextBundle {

    MissionPolicyContext policyContext;
    /** Null when the knowledge graph was unavailable. */
    KgSnapshot kgSnapshot;
    @Builder.Default
    List<DatasetProfile> datasetProfiles = List.of();
    GapAnalysisResult gapResult;

    public boolean isPartial() {
        return gapResult != null && gapResult.isPartial();
    }

    public List<String> unavailableSources() {
        return gapResult != null ? gapResult.getUnavailableSources() : List.of();
    }

    /**
     * True when the section asks for data and every requested slice is empty.
     */
    public boolean hasNoEvidenceFor(Set<DataRequirement> requirements) {
        return !requirements.isEmpty() && requirements.stream().allMatch(r -> slice(r).isEmpty());
    }

    public String slice(DataRequirement requirement) {
        switch (requirement) {
            case DOCUMENTS:
                return policyContext.getMission().getDocuments().stream()
                    .filter(d -> d.getExcerpt() != null && !d.getExcerpt().isBlank())
                    .map(ContextBundle::document)
                    .collect(Collectors.joining("\n"));
            case ENTITIES:
                return kgSnapshot == null ? "" : kgSnapshot.getEntities().stream()
                    .map(ContextBundle::entity)
                    .collect(Collectors.joining("\n"));
            case EVENTS:
                return kgSnapshot == null ? "" : kgSnapshot.getEvents().stream()
                    .filter(e -> e.getTimestamp() != null)
                    .sorted(Comparator.comparing(KgEvent::getTimestamp))
                    .map(e -> "- " + e.getTimestamp() + " " + (e.getTitle() != null ? e.getTitle() : e.getId()))
                    .collect(Collectors.joining("\n"));
            case DATASETS:
                return datasetProfiles.stream()
                    .map(ContextBundle::dataset)
                    .collect(Collectors.joining("\n"));
            case GAPS:
                return gapResult == null ? "" : gapResult.getFindings().stream()
                    .map(ContextBundle::gap)
                    .collect(Collectors.joining("\n"));
            default:
                throw new IllegalArgumentException("Unknown data requirement " + requirement);
        }
    }

    private static String document(MissionDocument document) {
        String title = document.getTitle() != null ? document.getTitle() : document.getId();
        return "- " + title + ": " + document.getExcerpt().strip();
    }

    private static String entity(KgEntity entity) {
        StringBuilder line = new StringBuilder("- ").append(entity.getName());
        if (entity.getType() != null) {
            line.append(" (").append(entity.getType()).append(')');
        }
        if (!entity.getAliases().isEmpty()) {
            line.append(", also known as ").append(String.join(", ", entity.getAliases()));
        }
        line.append(entity.isCorroborated()
            ? ", " + entity.getSourceIds().size() + " corroborating source(s)"
            : ", uncorroborated");
        return line.toString();
    }

    private static String dataset(DatasetProfile profile) {
        Double completeness = profile.effectiveCompleteness();
        Double consistency = profile.effectiveConsistency();
        String columns = profile.getColumns().stream()
            .map(ColumnProfile::getName)
            .collect(Collectors.joining(", "));
        return "- " + profile.getDatasetId() + "/" + profile.getTable()
            + (completeness != null ? String.format(Locale.ROOT, ", completeness %.2f", completeness) : "")
            + (consistency != null ? String.format(Locale.ROOT, ", consistency %.2f", consistency) : "")
            + (columns.isEmpty() ? "" : ", columns: " + columns);
    }

    private static String gap(GapFinding finding) {
        return "- [" + finding.getSeverity().code() + "] " + finding.getKind().code() + ": "
            + finding.getDescription() + ". Recommended: " + finding.getRecommendedAction();
    }
}
