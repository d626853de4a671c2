package com.missionguard.application;

import com.missionguard.application.gap.MissionSources;
import com.missionguard.domain.model.Authority;
import com.missionguard.domain.model.GapAnalysisResult;
import com.missionguard.domain.model.IntLane;
import com.missionguard.domain.model.Mission;
import com.missionguard.domain.model.MissionPolicyContext;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;

/**
 * Assembles the per-request policy view of a mission. The result is never cached.
 */
@Component
public class MissionPolicyContextFactory {

    public MissionPolicyContext create(Mission mission, Authority authority, MissionSources sources,
                                       GapAnalysisResult gapResult, String registryVersion) {
        EnumSet<IntLane> lanes = EnumSet.noneOf(IntLane.class);
        lanes.addAll(mission.getIntLanesPresent());
        return MissionPolicyContext.builder()
            .mission(mission)
            .authority(authority)
            .intLanesPresent(Collections.unmodifiableSet(lanes))
            .kgSnapshotRef(sources.kgSnapshotRef())
            .datasetProfileRefs(sources.datasetProfileRefs())
            .gapFindings(gapResult.getFindings())
            .registryVersion(registryVersion)
            .build();
    }
}
