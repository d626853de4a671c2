package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Entity named by a mission document or plan, which the knowledge graph is expected to support.
 */
@Value
@Builder
@Jacksonized
public class ReferencedEntity {
    String name;
    boolean priority;
    String documentId;
}
