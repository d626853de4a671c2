package com.missionguard.application.gap;

/**
 * How gap analysis is run.
 */
public enum GapAnalysisMode {
    /** Deterministic detectors only. */
    RULES,
    /**
     * Deterministic detectors, then a generative pass that annotates conflicts. Annotations
     * never add, remove or re-rank findings.
     */
    RULES_WITH_ADVISORY
}
