package com.missionguard.application.gap;

import com.missionguard.TestFixtures;
import com.missionguard.domain.model.ColumnProfile;
import com.missionguard.domain.model.DatasetProfile;
import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.Mission;
import com.missionguard.domain.model.SemanticProfile;
import com.missionguard.domain.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.missionguard.application.gap.GapTestData.context;
import static com.missionguard.application.gap.GapTestData.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class QualityDetectorTest {

    private final QualityDetector detector = new QualityDetector(TestFixtures.properties());
    private final Mission mission = TestFixtures.mission("m1", "LEO").build();

    private List<GapFinding> detect(DatasetProfile... profiles) {
        return detector.detect(context(mission, snapshot(List.of()), List.of(profiles)));
    }

    private static DatasetProfile declared(String table, Double completeness, Double consistency) {
        return DatasetProfile.builder()
            .datasetId("ds1")
            .table(table)
            .semanticProfile(SemanticProfile.builder().completeness(completeness).consistency(consistency).build())
            .build();
    }

    @Test
    void severityFollowsDeficitBelowThreshold() {
        List<GapFinding> findings = detect(
            declared("low", 0.75, null),
            declared("medium", 0.65, null),
            declared("high", 0.4, null));

        assertEquals(List.of(Severity.LOW, Severity.MEDIUM, Severity.HIGH),
            findings.stream().map(GapFinding::getSeverity).toList());
        assertEquals("Dataset ds1/high completeness 0.40 below threshold 0.80", findings.get(2).getDescription());
        assertEquals("dataset:ds1/high", findings.get(2).getSupportingReference());
    }

    @Test
    void consistencyIsCheckedToo() {
        List<GapFinding> findings = detect(declared("t", 0.95, 0.5));

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).getDescription().contains("consistency 0.50"));
    }

    @Test
    void completenessDerivedFromColumnNullFractions() {
        DatasetProfile profile = DatasetProfile.builder()
            .datasetId("ds1")
            .table("derived")
            .columns(List.of(
                ColumnProfile.builder().name("a").nullFraction(0.6).build(),
                ColumnProfile.builder().name("b").nullFraction(0.6).build()))
            .build();

        List<GapFinding> findings = detect(profile);

        assertEquals(1, findings.size());
        assertEquals(Severity.HIGH, findings.get(0).getSeverity());
    }

    @Test
    void healthyOrUnmeasuredProfilesPass() {
        assertTrue(detect(declared("ok", 0.9, 0.99), DatasetProfile.builder().datasetId("ds2").table("bare").build()).isEmpty());
    }
}
