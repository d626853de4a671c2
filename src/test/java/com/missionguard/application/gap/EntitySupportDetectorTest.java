package com.missionguard.application.gap;

import com.missionguard.TestFixtures;
import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.GapSubject;
import com.missionguard.domain.model.KgEntity;
import com.missionguard.domain.model.Mission;
import com.missionguard.domain.model.ReferencedEntity;
import com.missionguard.domain.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.missionguard.application.gap.GapTestData.context;
import static com.missionguard.application.gap.GapTestData.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class EntitySupportDetectorTest {

    private final EntitySupportDetector detector = new EntitySupportDetector();

    private final List<KgEntity> entities = List.of(
        KgEntity.builder().id("e1").name("Blue Harbor Shipping").aliases(List.of("BHS")).sourceIds(List.of("doc-1")).build(),
        KgEntity.builder().id("e2").name("Ivan Petrov").build());

    private Mission missionReferencing(ReferencedEntity... referenced) {
        return TestFixtures.mission("m1", "LEO").referencedEntities(List.of(referenced)).build();
    }

    @Test
    void corroboratedEntityMatchedByAliasHasNoFinding() {
        Mission mission = missionReferencing(ReferencedEntity.builder().name("bhs").build());

        assertTrue(detector.detect(context(mission, snapshot(entities), List.of())).isEmpty());
    }

    @Test
    void absentEntityIsMediumAndUncorroboratedIsLow() {
        Mission mission = missionReferencing(
            ReferencedEntity.builder().name("Northwind Ltd").documentId("doc-7").build(),
            ReferencedEntity.builder().name("Ivan Petrov").build());

        List<GapFinding> findings = detector.detect(context(mission, snapshot(entities), List.of()));

        assertEquals(2, findings.size());
        assertEquals(Severity.MEDIUM, findings.get(0).getSeverity());
        assertEquals("Entity Northwind Ltd is not present in the knowledge graph (referenced in doc-7)",
            findings.get(0).getDescription());
        assertEquals(Severity.LOW, findings.get(1).getSeverity());
        assertEquals(List.of(GapSubject.entity("Ivan Petrov")), findings.get(1).getSubjects());
    }

    @Test
    void priorityEntityIsHigh() {
        Mission mission = missionReferencing(ReferencedEntity.builder().name("Ivan Petrov").priority(true).build());

        assertEquals(Severity.HIGH, detector.detect(context(mission, snapshot(entities), List.of())).get(0).getSeverity());
    }

    @Test
    void duplicateReferencesProduceOneFinding() {
        Mission mission = missionReferencing(
            ReferencedEntity.builder().name("Northwind Ltd").build(),
            ReferencedEntity.builder().name(" northwind ltd ").build(),
            ReferencedEntity.builder().name(" ").build());

        assertEquals(1, detector.detect(context(mission, snapshot(entities), List.of())).size());
    }
}
