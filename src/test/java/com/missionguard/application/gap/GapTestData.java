package com.missionguard.application.gap;

import com.missionguard.TestFixtures;
import com.missionguard.domain.model.DatasetProfile;
import com.missionguard.domain.model.KgEntity;
import com.missionguard.domain.model.KgEvent;
import com.missionguard.domain.model.KgSnapshot;
import com.missionguard.domain.model.Mission;
import com.missionguard.infrastructure.policy.PolicyRegistry;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

final class GapTestData {

    static final PolicyRegistry REGISTRY = TestFixtures.defaultRegistry();

    private GapTestData() {}

    static KgEvent eventOnDay(int day) {
        return KgEvent.builder()
            .id("ev-" + day)
            .title("Event day " + day)
            .timestamp(TestFixtures.day(day).plus(Duration.ofHours(12)))
            .build();
    }

    static KgSnapshot snapshot(List<KgEntity> entities, int... eventDays) {
        return KgSnapshot.builder()
            .projectId("mission-m1")
            .capturedAt(TestFixtures.day(11))
            .entities(entities)
            .events(Arrays.stream(eventDays).mapToObj(GapTestData::eventOnDay).toList())
            .build();
    }

    static GapDetectionContext context(Mission mission, KgSnapshot snapshot, List<DatasetProfile> profiles) {
        return GapDetectionContext.builder()
            .mission(mission)
            .authority(REGISTRY.requireAuthority(mission.getAuthorityId()))
            .expectedIntLanes(REGISTRY.requireAuthority(mission.getAuthorityId()).getExpectedIntLanes())
            .sources(MissionSources.complete(snapshot, profiles))
            .build();
    }
}
