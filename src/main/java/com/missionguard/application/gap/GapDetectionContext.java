package com.missionguard.application.gap;

import com.missionguard.domain.model.Authority;
import com.missionguard.domain.model.IntLane;
import com.missionguard.domain.model.Mission;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Inputs shared by the detectors of one analysis run.
 */
@Value
@Builder
public class GapDetectionContext {
    Mission mission;
    Authority authority;
    /** Template coverage expectation, or the authority's generic coverage model. */
    Set<IntLane> expectedIntLanes;
    MissionSources sources;
}
