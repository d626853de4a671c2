package com.missionguard.domain.model;

import lombok.Value;

@Value
public class RenderedSection {
    int index;
    String name;
    String text;
    SectionStatus status;
}
