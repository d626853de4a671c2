package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class KgRelation {
    String sourceEntityId;
    String targetEntityId;
    String type;
}
