package com.missionguard.application;

import com.missionguard.TestFixtures;
import com.missionguard.TestFixtures.RecordingAuditService;
import com.missionguard.application.exceptions.MissionNotFoundException;
import com.missionguard.application.exceptions.PolicyConfigException;
import com.missionguard.application.exceptions.TemplateNotFoundException;
import com.missionguard.application.gap.GapAnalysisEngine;
import com.missionguard.application.guardrail.GuardrailClassifier;
import com.missionguard.application.report.ReportSynthesisOrchestrator;
import com.missionguard.application.template.TemplateSelector;
import com.missionguard.config.EngineProperties;
import com.missionguard.domain.model.GapAnalysisResult;
import com.missionguard.domain.model.IntLane;
import com.missionguard.domain.model.Mission;
import com.missionguard.domain.model.Template;
import com.missionguard.domain.model.Verdict;
import com.missionguard.domain.repository.MissionRepository;
import com.missionguard.infrastructure.audit.AuditEvent;
import com.missionguard.infrastructure.policy.PolicyRegistryHolder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MissionGuardrailServiceTest {

    private EngineProperties properties;
    private PolicyRegistryHolder registryHolder;
    private MissionRepository missionRepository;
    private GapAnalysisEngine gapEngine;
    private RecordingAuditService audit;
    private MissionGuardrailService service;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        registryHolder = new PolicyRegistryHolder(TestFixtures.loader(properties));
        missionRepository = mock(MissionRepository.class);
        gapEngine = mock(GapAnalysisEngine.class);
        audit = new RecordingAuditService();
        GuardrailClassifier classifier = new GuardrailClassifier(registryHolder, audit, properties, TestFixtures.metrics());
        service = new MissionGuardrailService(registryHolder, missionRepository, classifier, new TemplateSelector(),
            gapEngine, mock(ReportSynthesisOrchestrator.class), audit);

        when(missionRepository.findById("t10")).thenReturn(Optional.of(
            TestFixtures.mission("t10", "TITLE_10", IntLane.SIGINT, IntLane.GEOINT).build()));
        when(missionRepository.findById("leo")).thenReturn(Optional.of(
            TestFixtures.mission("leo", "LEO", IntLane.LEO_CRIMINT, IntLane.OSINT).build()));
        when(missionRepository.findById("rogue")).thenReturn(Optional.of(
            TestFixtures.mission("rogue", "UNKNOWN_AUTHORITY", IntLane.OSINT).build()));
    }

    @Test
    void classifiesUnderTheMissionAuthority() {
        String text = "Recommend arrest and prosecution options for these individuals inside the U.S.";

        assertTrue(service.classifyRequest(text, "t10").isBlocked());
        assertFalse(service.classifyRequest(text, "leo").isBlocked());
    }

    @Test
    void unknownAuthorityBlocksClassificationAndFailsTemplateListing() {
        Verdict verdict = service.classifyRequest("hello", "rogue");

        assertEquals(Verdict.BlockReason.POLICY_CONFIG_ERROR, ((Verdict.Block) verdict).reason());
        assertThrows(PolicyConfigException.class, () -> service.listTemplates("rogue"));
    }

    @Test
    void unknownMissionIsNotFound() {
        assertThrows(MissionNotFoundException.class, () -> service.classifyRequest("hello", "ghost"));
    }

    @Test
    void listsSelectableTemplates() {
        assertEquals(List.of("situation_report", "network_analysis", "geospatial_brief"),
            service.listTemplates("t10").stream().map(Template::getId).toList());
    }

    @Test
    void gapAnalysisResolvesTemplateAndPolicyVersion() {
        GapAnalysisResult result = GapAnalysisResult.builder().missionId("leo").build();
        String version = registryHolder.current().getVersion();
        when(gapEngine.run(any(Mission.class), any(), any(Template.class), eq(version), eq(true))).thenReturn(result);
        when(gapEngine.run(any(Mission.class), any(), isNull(), eq(version), eq(false))).thenReturn(result);

        assertSame(result, service.runGapAnalysis("leo", "case_summary", true));
        assertSame(result, service.runGapAnalysis("leo", false));
        assertThrows(TemplateNotFoundException.class, () -> service.runGapAnalysis("leo", "nope", false));
    }

    @Test
    void reloadIsAudited() {
        properties.getPolicy().setLocation("classpath:policy/alt-policy.yml");
        assertEquals("alt-1", service.reloadPolicy());

        properties.getPolicy().setLocation("classpath:policy/overlapping-categories.yml");
        assertThrows(PolicyConfigException.class, service::reloadPolicy);

        List<AuditEvent> events = audit.ofType(AuditEvent.POLICY_RELOAD);
        assertEquals(List.of("APPLIED", "REJECTED"), events.stream().map(AuditEvent::getOutcome).toList());
        assertEquals("alt-1", registryHolder.current().getVersion());
    }
}
