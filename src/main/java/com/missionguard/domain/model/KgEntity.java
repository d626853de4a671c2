package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Locale;

@Value
@Builder
@Jacksonized
public class KgEntity {

    String id;
    String name;
    String type;
    @Builder.Default
    List<String> aliases = List.of();
    /** Sources corroborating this entity; empty means nothing backs it. */
    @Builder.Default
    List<String> sourceIds = List.of();
    @Builder.Default
    List<AttributeAssertion> attributes = List.of();

    public boolean isKnownAs(String candidate) {
        String key = candidate.trim().toLowerCase(Locale.ROOT);
        if (name != null && name.trim().toLowerCase(Locale.ROOT).equals(key)) {
            return true;
        }
        return aliases.stream().anyMatch(alias -> alias.trim().toLowerCase(Locale.ROOT).equals(key));
    }

    public boolean isCorroborated() {
        return !sourceIds.isEmpty();
    }
}
