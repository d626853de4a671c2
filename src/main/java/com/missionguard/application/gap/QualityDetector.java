package com.missionguard.application.gap;

import com.missionguard.config.EngineProperties;
import com.missionguard.domain.model.DatasetProfile;
import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.GapKind;
import com.missionguard.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Dataset profiles whose completeness or consistency falls below the quality threshold.
 * Severity follows the deficit: 0.3 or more HIGH, 0.1 or more MEDIUM, otherwise LOW.
 */
@Component
public class QualityDetector implements GapDetector {

    private final EngineProperties properties;

    public QualityDetector(EngineProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<Source> requiredSources() {
        return List.of(Source.DATASET_PROFILES);
    }

    @Override
    public List<GapFinding> detect(GapDetectionContext context) {
        double threshold = properties.getGap().getQualityThreshold();
        List<GapFinding> findings = new ArrayList<>();
        for (DatasetProfile profile : context.getSources().datasetProfiles()) {
            check(profile, "completeness", profile.effectiveCompleteness(), threshold, findings);
            check(profile, "consistency", profile.effectiveConsistency(), threshold, findings);
        }
        return findings;
    }

    private void check(DatasetProfile profile, String measure, Double value, double threshold,
                       List<GapFinding> findings) {
        if (value == null || value >= threshold) {
            return;
        }
        double deficit = threshold - value;
        findings.add(GapFinding.builder()
            .kind(GapKind.QUALITY)
            .severity(deficit >= 0.3 ? Severity.HIGH : deficit >= 0.1 ? Severity.MEDIUM : Severity.LOW)
            .description(String.format(Locale.ROOT, "Dataset %s/%s %s %.2f below threshold %.2f",
                profile.getDatasetId(), profile.getTable(), measure, value, threshold))
            .supportingReference(profile.reference())
            .recommendedAction("Review " + measure + " of " + profile.getTable()
                + " before relying on it; re-profile after cleansing")
            .build());
    }
}
