package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One source's claim about an entity attribute, valid over {@code [validFrom, validTo)}.
 * Null bounds are open.
 */
@Value
@Builder
@Jacksonized
public class AttributeAssertion {

    String attribute;
    String value;
    String sourceId;
    Instant validFrom;
    Instant validTo;

    public boolean overlaps(AttributeAssertion other) {
        boolean startsBeforeOtherEnds = other.validTo == null || validFrom == null || validFrom.isBefore(other.validTo);
        boolean endsAfterOtherStarts = validTo == null || other.validFrom == null || other.validFrom.isBefore(validTo);
        return startsBeforeOtherEnds && endsAfterOtherStarts;
    }
}
