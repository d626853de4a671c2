package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;

/**
 * Mission as served by the external mission service.
 *
 * <p>The engine never persists missions; it reads them per request.
 */
@Value
@Builder
@Jacksonized
public class Mission {

    String id;
    String name;
    String authorityId;
    @Builder.Default
    Set<IntLane> intLanesPresent = Set.of();
    ObservationWindow observationWindow;
    String kgNamespace;
    @Builder.Default
    List<MissionDocument> documents = List.of();
    @Builder.Default
    List<ReferencedEntity> referencedEntities = List.of();

    /**
     * Knowledge-graph project id, falling back to {@code mission-<id>} when no namespace is set.
     */
    public String kgProjectId() {
        return kgNamespace != null && !kgNamespace.isBlank() ? kgNamespace : "mission-" + id;
    }
}
