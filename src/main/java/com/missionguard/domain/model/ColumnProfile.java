package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ColumnProfile {
    String name;
    String semanticType;
    double nullFraction;
    long distinctCount;
}
