package com.missionguard.application;

import com.missionguard.application.exceptions.MissionNotFoundException;
import com.missionguard.application.exceptions.PolicyConfigException;
import com.missionguard.application.exceptions.TemplateNotFoundException;
import com.missionguard.application.gap.GapAnalysisEngine;
import com.missionguard.application.guardrail.GuardrailClassifier;
import com.missionguard.application.report.ReportRequest;
import com.missionguard.application.report.ReportSynthesisOrchestrator;
import com.missionguard.application.template.TemplateSelector;
import com.missionguard.domain.model.Authority;
import com.missionguard.domain.model.GapAnalysisResult;
import com.missionguard.domain.model.Mission;
import com.missionguard.domain.model.ReportOutcome;
import com.missionguard.domain.model.Template;
import com.missionguard.domain.model.Verdict;
import com.missionguard.domain.repository.MissionRepository;
import com.missionguard.infrastructure.audit.AuditEvent;
import com.missionguard.infrastructure.audit.AuditService;
import com.missionguard.infrastructure.policy.PolicyRegistry;
import com.missionguard.infrastructure.policy.PolicyRegistryHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for mission guardrail operations.
 *
 * Resolves the mission and the active policy registry once per call and hands them to
 * the classifier, template selector, gap analysis engine or report orchestrator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MissionGuardrailService {

    private final PolicyRegistryHolder registryHolder;
    private final MissionRepository missionRepository;
    private final GuardrailClassifier classifier;
    private final TemplateSelector templateSelector;
    private final GapAnalysisEngine gapAnalysisEngine;
    private final ReportSynthesisOrchestrator orchestrator;
    private final AuditService auditService;

    /**
     * Screen free text against the mission's authority. Never throws for a block;
     * an unknown authority yields a POLICY_CONFIG_ERROR block.
     */
    public Verdict classifyRequest(String text, String missionId) {
        PolicyRegistry registry = registryHolder.current();
        Mission mission = loadMission(missionId);
        return classifier.classify(text, mission.getAuthorityId(), missionId, registry);
    }

    /**
     * Templates selectable by the mission, in display order.
     *
     * @throws PolicyConfigException when the mission's authority is not configured
     */
    public List<Template> listTemplates(String missionId) {
        PolicyRegistry registry = registryHolder.current();
        Mission mission = loadMission(missionId);
        Authority authority = registry.requireAuthority(mission.getAuthorityId());
        return templateSelector.filter(registry, authority.getId(), mission.getIntLanesPresent());
    }

    public GapAnalysisResult runGapAnalysis(String missionId, boolean forceRegen) {
        return runGapAnalysis(missionId, null, forceRegen);
    }

    /**
     * @param templateId template whose INT coverage expectation applies; null for the authority's generic model
     */
    public GapAnalysisResult runGapAnalysis(String missionId, String templateId, boolean forceRegen) {
        PolicyRegistry registry = registryHolder.current();
        Mission mission = loadMission(missionId);
        Authority authority = registry.requireAuthority(mission.getAuthorityId());
        Template template = templateId == null ? null : registry.findTemplate(templateId)
            .orElseThrow(() -> new TemplateNotFoundException(templateId));
        return gapAnalysisEngine.run(mission, authority, template, registry.getVersion(), forceRegen);
    }

    public ReportOutcome generateReport(String missionId, String templateId) {
        return generateReport(ReportRequest.builder().missionId(missionId).templateId(templateId).build());
    }

    public ReportOutcome generateReport(ReportRequest request) {
        return orchestrator.generate(request);
    }

    /**
     * Reload policy configuration and swap it in atomically.
     *
     * @return the version now in force
     * @throws PolicyConfigException when the new configuration is invalid; the old one stays active
     */
    public String reloadPolicy() {
        String previous = registryHolder.current().getVersion();
        try {
            String version = registryHolder.reload();
            auditService.record(AuditEvent.builder()
                .type(AuditEvent.POLICY_RELOAD)
                .outcome("APPLIED")
                .detail(previous + " -> " + version)
                .build());
            return version;
        } catch (PolicyConfigException e) {
            auditService.record(AuditEvent.builder()
                .type(AuditEvent.POLICY_RELOAD)
                .outcome("REJECTED")
                .detail("kept " + previous)
                .build());
            throw e;
        }
    }

    private Mission loadMission(String missionId) {
        return missionRepository.findById(missionId)
            .orElseThrow(() -> new MissionNotFoundException(missionId));
    }
}
