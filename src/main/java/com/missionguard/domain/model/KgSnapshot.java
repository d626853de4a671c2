package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time extract of mission-scoped entities, relations and events.
 */
@Value
@Builder
@Jacksonized
public class KgSnapshot {

    String projectId;
    Instant capturedAt;
    @Builder.Default
    List<KgEntity> entities = List.of();
    @Builder.Default
    List<KgRelation> relations = List.of();
    @Builder.Default
    List<KgEvent> events = List.of();

    public String reference() {
        return "kg:" + projectId + "@" + (capturedAt != null ? capturedAt : "unknown");
    }
}
