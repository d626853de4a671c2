package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Profiling summary of one mission dataset table.
 */
@Value
@Builder
@Jacksonized
public class DatasetProfile {

    String datasetId;
    String table;
    @Builder.Default
    List<ColumnProfile> columns = List.of();
    SemanticProfile semanticProfile;

    public String reference() {
        return "dataset:" + datasetId + "/" + table;
    }

    /**
     * Declared completeness, or one minus the mean column null fraction when the
     * profiler did not report one. Null when neither is available.
     */
    public Double effectiveCompleteness() {
        if (semanticProfile != null && semanticProfile.getCompleteness() != null) {
            return semanticProfile.getCompleteness();
        }
        if (columns.isEmpty()) {
            return null;
        }
        double meanNull = columns.stream().mapToDouble(ColumnProfile::getNullFraction).average().orElse(0.0);
        return 1.0 - meanNull;
    }

    public Double effectiveConsistency() {
        return semanticProfile != null ? semanticProfile.getConsistency() : null;
    }
}
