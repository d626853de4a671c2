package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Jacksonized
public class KgEvent {
    String id;
    String title;
    Instant timestamp;
    @Builder.Default
    List<String> entityIds = List.of();
}
