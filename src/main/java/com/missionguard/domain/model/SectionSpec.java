package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

@Value
public class SectionSpec {

    String name;
    String promptFragment;
    Set<DataRequirement> dataRequirements;
    String fallbackText;

    @Builder
    public SectionSpec(String name, String promptFragment, Set<DataRequirement> dataRequirements, String fallbackText) {
        this.name = Objects.requireNonNull(name, "Section name must not be null");
        this.promptFragment = promptFragment != null ? promptFragment : "";
        this.dataRequirements = dataRequirements == null || dataRequirements.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(DataRequirement.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(dataRequirements));
        if (fallbackText == null || fallbackText.isBlank()) {
            throw new IllegalArgumentException("Section " + name + " must declare fallback text");
        }
        this.fallbackText = fallbackText;
    }
}
