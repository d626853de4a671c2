package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PriorityItem {
    GapSubject subject;
    int score;
    int openGaps;
    String rationale;
}
