package com.missionguard.application.gap;

import com.missionguard.domain.model.GapFinding;

import java.util.List;

/**
 * One deterministic gap detection rule.
 */
public interface GapDetector {

    /** Upstream sources this detector reads. */
    enum Source {
        KG,
        DATASET_PROFILES
    }

    List<Source> requiredSources();

    List<GapFinding> detect(GapDetectionContext context);
}
