package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Policy view of a mission for one request. Rebuilt every time; never cached.
 */
@Value
@Builder
public class MissionPolicyContext {
    Mission mission;
    Authority authority;
    Set<IntLane> intLanesPresent;
    String kgSnapshotRef;
    List<String> datasetProfileRefs;
    List<GapFinding> gapFindings;
    String registryVersion;
}
