package com.missionguard.application.gap;

import com.missionguard.TestFixtures;
import com.missionguard.TestFixtures.RecordingAuditService;
import com.missionguard.config.EngineProperties;
import com.missionguard.domain.model.AttributeAssertion;
import com.missionguard.domain.model.Authority;
import com.missionguard.domain.model.DatasetProfile;
import com.missionguard.domain.model.GapAnalysisResult;
import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.GapKind;
import com.missionguard.domain.model.IntLane;
import com.missionguard.domain.model.KgEntity;
import com.missionguard.domain.model.KgSnapshot;
import com.missionguard.domain.model.Mission;
import com.missionguard.domain.model.ReferencedEntity;
import com.missionguard.domain.model.SemanticProfile;
import com.missionguard.domain.model.Severity;
import com.missionguard.infrastructure.audit.AuditEvent;
import com.missionguard.infrastructure.persistence.CaffeineProductStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.caffeine.CaffeineCacheManager;

import java.util.List;

import static com.missionguard.application.gap.GapTestData.snapshot;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GapAnalysisEngineTest {

    private EngineProperties properties;
    private ConflictAnnotator annotator;
    private MissionSourceFetcher fetcher;
    private RecordingAuditService audit;
    private GapAnalysisEngine engine;

    private final Mission mission = TestFixtures.mission("m1", "TITLE_10", IntLane.SIGINT, IntLane.GEOINT)
        .referencedEntities(List.of(ReferencedEntity.builder().name("MV Aurora").priority(true).build()))
        .build();
    private final Authority authority = GapTestData.REGISTRY.requireAuthority("TITLE_10");

    private final KgSnapshot kg = snapshot(List.of(KgEntity.builder()
        .id("v1")
        .name("MV Aurora")
        .attributes(List.of(
            AttributeAssertion.builder().attribute("flag").value("Panama").sourceId("src-a").build(),
            AttributeAssertion.builder().attribute("flag").value("Liberia").sourceId("src-b").build()))
        .build()), 1, 2, 3, 8, 9, 10);

    private final List<DatasetProfile> profiles = List.of(DatasetProfile.builder()
        .datasetId("ds1")
        .table("port_calls")
        .semanticProfile(SemanticProfile.builder().completeness(0.4).build())
        .build());

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        annotator = mock(ConflictAnnotator.class);
        fetcher = mock(MissionSourceFetcher.class);
        audit = new RecordingAuditService();
        engine = new GapAnalysisEngine(
            List.of(
                new MissingIntDetector(),
                new TimeWindowDetector(properties),
                new EntitySupportDetector(),
                new ConflictDetector(properties),
                new QualityDetector(properties)),
            new PriorityRanker(),
            annotator,
            fetcher,
            new CaffeineProductStore(new CaffeineCacheManager("products")),
            audit,
            properties,
            TestFixtures.metrics());
    }

    @Test
    void findingsAreSortedBySeverityThenKind() {
        GapAnalysisResult result = engine.analyze(mission, authority, null, MissionSources.complete(kg, profiles));

        List<GapFinding> findings = result.getFindings();
        assertEquals(List.of(GapKind.MISSING_TIME_WINDOW, GapKind.MISSING_ENTITY_SUPPORT, GapKind.QUALITY,
                GapKind.MISSING_INT, GapKind.MISSING_INT, GapKind.CONFLICT),
            findings.stream().map(GapFinding::getKind).toList());
        assertEquals(Severity.HIGH, findings.get(0).getSeverity());
        assertEquals("MV Aurora", result.getPriorities().get(0).getSubject().name());
        assertFalse(result.isPartial());
        assertEquals(List.of("dataset:ds1/port_calls"), result.getDatasetProfileRefs());
    }

    @Test
    void analysisIsDeterministic() {
        MissionSources sources = MissionSources.complete(kg, profiles);

        GapAnalysisResult first = engine.analyze(mission, authority, null, sources);
        GapAnalysisResult second = engine.analyze(mission, authority, null, sources);

        assertEquals(first.getFindings(), second.getFindings());
        assertEquals(first.getPriorities(), second.getPriorities());
    }

    @Test
    void missingKnowledgeGraphYieldsPartialResultWithDatasetFindings() {
        MissionSources sources = new MissionSources(null, profiles, List.of(MissionSourceFetcher.KG_SOURCE));

        GapAnalysisResult result = engine.analyze(mission, authority, null, sources);

        assertTrue(result.isPartial());
        assertEquals(List.of("kg_snapshot"), result.getUnavailableSources());
        assertNull(result.getKgSnapshotRef());
        assertTrue(result.getFindings().stream().anyMatch(f -> f.getKind() == GapKind.QUALITY));
        assertTrue(result.getFindings().stream().anyMatch(f -> f.getKind() == GapKind.MISSING_INT));
        assertTrue(result.getFindings().stream().noneMatch(f -> f.getKind() == GapKind.CONFLICT
            || f.getKind() == GapKind.MISSING_TIME_WINDOW
            || f.getKind() == GapKind.MISSING_ENTITY_SUPPORT));
    }

    @Test
    void templateCoverageReplacesAuthorityModel() {
        GapAnalysisResult result = engine.analyze(mission, authority,
            GapTestData.REGISTRY.findTemplate("network_analysis").orElseThrow(),
            MissionSources.complete(kg, profiles));

        List<String> missingInt = result.getFindings().stream()
            .filter(f -> f.getKind() == GapKind.MISSING_INT)
            .map(GapFinding::getDescription)
            .toList();
        assertEquals(List.of("No HUMINT coverage"), missingInt);
        assertTrue(result.getSnapshotRef().startsWith("gap:m1/network_analysis@"));
    }

    @Test
    void runServesStoredResultUnlessForced() {
        when(fetcher.fetch(mission)).thenReturn(MissionSources.complete(kg, profiles));

        GapAnalysisResult first = engine.run(mission, authority, null, "v1", false);
        GapAnalysisResult cached = engine.run(mission, authority, null, "v1", false);
        GapAnalysisResult forced = engine.run(mission, authority, null, "v1", true);
        GapAnalysisResult otherVersion = engine.run(mission, authority, null, "v2", false);

        assertSame(first, cached);
        assertNotSame(first, forced);
        assertNotSame(forced, otherVersion);
        verify(fetcher, times(3)).fetch(mission);
        assertEquals(3, audit.ofType(AuditEvent.GAP_ANALYSIS).size());
    }

    @Test
    void advisoryAnnotationsNeverChangeFindings() {
        MissionSources sources = MissionSources.complete(kg, profiles);
        GapAnalysisResult rulesOnly = engine.compute(mission, authority, null, "v1", sources);

        properties.getGap().setMode(GapAnalysisMode.RULES_WITH_ADVISORY);
        when(annotator.annotate(eq("m1"), anyList())).thenReturn(List.of("src-a is the registry of record"));
        GapAnalysisResult advised = engine.compute(mission, authority, null, "v1", sources);

        assertEquals(rulesOnly.getFindings(), advised.getFindings());
        assertEquals(rulesOnly.getPriorities(), advised.getPriorities());
        assertTrue(rulesOnly.getAnnotations().isEmpty());
        assertEquals(List.of("src-a is the registry of record"), advised.getAnnotations());
    }

    @Test
    void rulesModeNeverCallsAnnotator() {
        engine.compute(mission, authority, null, "v1", MissionSources.complete(kg, profiles));

        verify(annotator, never()).annotate(any(), anyList());
    }
}
