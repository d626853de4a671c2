package com.missionguard.domain.model;

/**
 * Slice of the mission context a template section draws on.
 */
public enum DataRequirement {
    DOCUMENTS,
    ENTITIES,
    EVENTS,
    DATASETS,
    GAPS
}
