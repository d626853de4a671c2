package com.missionguard.application.gap;

import com.missionguard.TestFixtures;
import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.IntLane;
import com.missionguard.domain.model.Mission;
import com.missionguard.domain.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.missionguard.application.gap.GapTestData.context;
import static com.missionguard.application.gap.GapTestData.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class MissingIntDetectorTest {

    private final MissingIntDetector detector = new MissingIntDetector();

    @Test
    void foundationalLanesAreHighOthersMedium() {
        Mission mission = TestFixtures.mission("m1", "TITLE_10", IntLane.GEOINT).build();

        Map<String, GapFinding> byDescription = detector.detect(context(mission, snapshot(List.of()), List.of()))
            .stream()
            .collect(Collectors.toMap(GapFinding::getDescription, Function.identity()));

        assertEquals(3, byDescription.size());
        assertEquals(Severity.HIGH, byDescription.get("No SIGINT coverage (foundational to TITLE_10)").getSeverity());
        assertEquals(Severity.MEDIUM, byDescription.get("No IMINT coverage").getSeverity());
        assertEquals(Severity.MEDIUM, byDescription.get("No OSINT coverage").getSeverity());
    }

    @Test
    void templateExpectationReplacesAuthorityModel() {
        Mission mission = TestFixtures.mission("m1", "LEO", IntLane.LEO_CRIMINT).build();
        GapDetectionContext context = GapDetectionContext.builder()
            .mission(mission)
            .authority(GapTestData.REGISTRY.requireAuthority("LEO"))
            .expectedIntLanes(EnumSet.of(IntLane.OSINT))
            .sources(MissionSources.complete(snapshot(List.of()), List.of()))
            .build();

        List<GapFinding> findings = detector.detect(context);

        assertEquals(1, findings.size());
        assertEquals("No OSINT coverage", findings.get(0).getDescription());
    }

    @Test
    void needsNoUpstreamSource() {
        assertTrue(detector.requiredSources().isEmpty());
    }
}
