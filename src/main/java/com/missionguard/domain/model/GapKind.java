package com.missionguard.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declaration order is the secondary sort key for findings.
 */
public enum GapKind {
    MISSING_INT("missing_int"),
    MISSING_TIME_WINDOW("missing_time_window"),
    MISSING_ENTITY_SUPPORT("missing_entity_support"),
    CONFLICT("conflict"),
    QUALITY("quality");

    private final String code;

    GapKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
