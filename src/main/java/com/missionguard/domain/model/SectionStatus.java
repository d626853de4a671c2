package com.missionguard.domain.model;

public enum SectionStatus {
    /** Text came from the generative backend. */
    RENDERED,
    /** Backend failed or timed out; the section's fallback text was used. */
    DEGRADED,
    /** No evidence for the section's data requirements; deterministic text, backend not called. */
    NO_EVIDENCE
}
