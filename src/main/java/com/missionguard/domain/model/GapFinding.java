package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.List;

/**
 * Structured record of missing or conflicting mission-relevant information.
 */
@Value
@Builder
public class GapFinding {

    /** Severity descending, then kind, then description. */
    public static final Comparator<GapFinding> REPORT_ORDER = Comparator
        .comparing(GapFinding::getSeverity, Comparator.reverseOrder())
        .thenComparing(GapFinding::getKind)
        .thenComparing(GapFinding::getDescription);

    GapKind kind;
    Severity severity;
    String description;
    String supportingReference;
    String recommendedAction;
    /** Entities or events this finding is about; feeds priority ranking. */
    @Builder.Default
    List<GapSubject> subjects = List.of();
}
