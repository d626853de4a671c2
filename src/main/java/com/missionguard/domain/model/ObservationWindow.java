package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Half-open interval {@code [start, end)} a mission declares it observes.
 */
@Value
@Builder
@Jacksonized
public class ObservationWindow {

    Instant start;
    Instant end;

    public boolean isValid() {
        return start != null && end != null && end.isAfter(start);
    }
}
