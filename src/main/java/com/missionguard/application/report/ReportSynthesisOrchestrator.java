package com.missionguard.application.report;

import com.missionguard.application.MissionPolicyContextFactory;
import com.missionguard.application.exceptions.MissionNotFoundException;
import com.missionguard.application.exceptions.ReportCancelledException;
import com.missionguard.application.exceptions.TemplateNotEligibleException;
import com.missionguard.application.exceptions.TemplateNotFoundException;
import com.missionguard.application.exceptions.UpstreamUnavailableException;
import com.missionguard.application.gap.GapAnalysisEngine;
import com.missionguard.application.gap.MissionSourceFetcher;
import com.missionguard.application.gap.MissionSources;
import com.missionguard.application.guardrail.GuardrailClassifier;
import com.missionguard.config.EngineProperties;
import com.missionguard.config.PerformanceConfiguration.EngineMetrics;
import com.missionguard.domain.model.Authority;
import com.missionguard.domain.model.GapAnalysisResult;
import com.missionguard.domain.model.GuardrailPosture;
import com.missionguard.domain.model.Mission;
import com.missionguard.domain.model.RenderedSection;
import com.missionguard.domain.model.ReportOutcome;
import com.missionguard.domain.model.ReportProduct;
import com.missionguard.domain.model.SectionSpec;
import com.missionguard.domain.model.SectionStatus;
import com.missionguard.domain.model.Template;
import com.missionguard.domain.model.Verdict;
import com.missionguard.domain.repository.MissionRepository;
import com.missionguard.domain.repository.ProductStore;
import com.missionguard.domain.repository.ProductStore.ProductKey;
import com.missionguard.infrastructure.audit.AuditEvent;
import com.missionguard.infrastructure.audit.AuditService;
import com.missionguard.infrastructure.policy.PolicyRegistry;
import com.missionguard.infrastructure.policy.PolicyRegistryHolder;
import com.missionguard.infrastructure.upstream.TimeLimitedGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Report Synthesis Orchestrator.
 *
 * <p>Drives one report through SELECT_TEMPLATE, BUILD_CONTEXT, RENDER_SECTIONS and
 * ASSEMBLE to DONE, or stops in BLOCKED or CANCELLED with no product.
 *
 * <p>Analyst free text is screened by the guardrail classifier before it can reach a
 * prompt: report instructions at SELECT_TEMPLATE, every section note before the first
 * section is dispatched. Sections render concurrently, bounded per report, each gateway call
 * under its own timeout; a failed call degrades that section to its fallback text and
 * leaves the rest untouched. Sections are reassembled in template order.
 *
 * @since 1.0.0
 */
@Service
@Slf4j
public class ReportSynthesisOrchestrator {

    static final String NO_EVIDENCE_TEXT = "None available based on current evidence.";

    private final PolicyRegistryHolder registryHolder;
    private final MissionRepository missionRepository;
    private final GuardrailClassifier classifier;
    private final MissionSourceFetcher sourceFetcher;
    private final GapAnalysisEngine gapAnalysisEngine;
    private final MissionPolicyContextFactory policyContextFactory;
    private final PromptComposer promptComposer;
    private final ReportSanitizer sanitizer;
    private final TimeLimitedGateway gateway;
    private final ProductStore productStore;
    private final AuditService auditService;
    private final EngineProperties properties;
    private final EngineMetrics metrics;
    private final AsyncTaskExecutor synthesisExecutor;
    private final Executor reportExecutor;

    public ReportSynthesisOrchestrator(PolicyRegistryHolder registryHolder,
                                       MissionRepository missionRepository,
                                       GuardrailClassifier classifier,
                                       MissionSourceFetcher sourceFetcher,
                                       GapAnalysisEngine gapAnalysisEngine,
                                       MissionPolicyContextFactory policyContextFactory,
                                       PromptComposer promptComposer,
                                       ReportSanitizer sanitizer,
                                       TimeLimitedGateway gateway,
                                       ProductStore productStore,
                                       AuditService auditService,
                                       EngineProperties properties,
                                       EngineMetrics metrics,
                                       @Qualifier("synthesisExecutor") AsyncTaskExecutor synthesisExecutor,
                                       @Qualifier("reportExecutor") Executor reportExecutor) {
        this.registryHolder = registryHolder;
        this.missionRepository = missionRepository;
        this.classifier = classifier;
        this.sourceFetcher = sourceFetcher;
        this.gapAnalysisEngine = gapAnalysisEngine;
        this.policyContextFactory = policyContextFactory;
        this.promptComposer = promptComposer;
        this.sanitizer = sanitizer;
        this.gateway = gateway;
        this.productStore = productStore;
        this.auditService = auditService;
        this.properties = properties;
        this.metrics = metrics;
        this.synthesisExecutor = synthesisExecutor;
        this.reportExecutor = reportExecutor;
    }

    /**
     * Generate a report on the calling thread.
     *
     * @throws ReportCancelledException if the calling thread is interrupted before assembly
     */
    public ReportOutcome generate(ReportRequest request) {
        ReportJob job = new ReportJob(request.getMissionId(), request.getTemplateId());
        return run(job, request)
            .orElseThrow(() -> new ReportCancelledException(request.getMissionId(), request.getTemplateId()));
    }

    /**
     * Start a report in the background. The returned job can be cancelled.
     */
    public ReportJob start(ReportRequest request) {
        ReportJob job = new ReportJob(request.getMissionId(), request.getTemplateId());
        reportExecutor.execute(() -> {
            try {
                job.result().complete(run(job, request));
            } catch (RuntimeException e) {
                job.cancelInFlight();
                job.result().completeExceptionally(e);
            }
        });
        return job;
    }

    Optional<ReportOutcome> run(ReportJob job, ReportRequest request) {
        PolicyRegistry registry = registryHolder.current();
        Screening screening = new Screening();

        // SELECT_TEMPLATE
        Mission mission = missionRepository.findById(request.getMissionId())
            .orElseThrow(() -> new MissionNotFoundException(request.getMissionId()));
        String instructions = request.getInstructions();
        Verdict instructionVerdict = classifier.classify(
            instructions != null ? instructions : "", mission.getAuthorityId(), mission.getId(), registry);
        if (hasText(instructions)) {
            screening.count(instructionVerdict);
        }
        if (instructionVerdict instanceof Verdict.Block block) {
            return blocked(job, mission.getId(), request.getTemplateId(), block, SynthesisState.SELECT_TEMPLATE, null);
        }
        Authority authority = registry.requireAuthority(mission.getAuthorityId());
        Template template = registry.findTemplate(request.getTemplateId())
            .orElseThrow(() -> new TemplateNotFoundException(request.getTemplateId()));
        if (!template.isSelectableBy(authority.getId(), mission.getIntLanesPresent())) {
            throw new TemplateNotEligibleException(template.getId(), mission.getId());
        }
        if (!job.moveTo(SynthesisState.BUILD_CONTEXT)) {
            return cancelled(job);
        }

        // BUILD_CONTEXT
        MissionSources sources = sourceFetcher.fetch(mission);
        GapAnalysisResult gapResult =
            gapAnalysisEngine.compute(mission, authority, template, registry.getVersion(), sources);
        ContextBundle context = ContextBundle.builder()
            .policyContext(policyContextFactory.create(mission, authority, sources, gapResult, registry.getVersion()))
            .kgSnapshot(sources.kgSnapshot())
            .datasetProfiles(sources.hasDatasetProfiles() ? sources.datasetProfiles() : List.of())
            .gapResult(gapResult)
            .build();
        if (!job.moveTo(SynthesisState.RENDER_SECTIONS)) {
            return cancelled(job);
        }

        // RENDER_SECTIONS
        List<SectionSpec> specs = template.getSections();
        List<RenderedSection> sections = new ArrayList<>(specs.size());
        try {
            Dispatch dispatch = dispatch(job, request, mission, authority, specs, context, screening, registry);
            if (dispatch.halted()) {
                return dispatch.outcome();
            }
            Instant deadline = Instant.now().plus(properties.getSynthesis().getReportDeadline());
            for (int i = 0; i < specs.size(); i++) {
                sections.add(await(dispatch.futures().get(i), specs.get(i), i, deadline, mission.getId()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.cancel();
            return cancelled(job);
        } catch (RuntimeException e) {
            job.cancelInFlight();
            throw e;
        }
        if (job.isCancelled() || !job.moveTo(SynthesisState.ASSEMBLE)) {
            return cancelled(job);
        }

        // ASSEMBLE
        List<String> degraded = sections.stream()
            .filter(s -> s.getStatus() == SectionStatus.DEGRADED)
            .map(RenderedSection::getName)
            .toList();
        ReportProduct product = ReportProduct.builder()
            .missionId(mission.getId())
            .templateId(template.getId())
            .sections(List.copyOf(sections))
            .guardrailPosture(GuardrailPosture.builder()
                .authorityId(authority.getId())
                .disclaimer(authority.getDisclaimer())
                .blockedCategories(List.copyOf(authority.getBlockedActionCategories()))
                .screenedInputs(screening.screened)
                .degradedScreens(screening.degraded)
                .registryVersion(registry.getVersion())
                .build())
            .gapSnapshotRef(gapResult.getSnapshotRef())
            .kgSnapshotRef(gapResult.getKgSnapshotRef())
            .generatedAt(Instant.now())
            .degradedSections(degraded)
            .partialContext(gapResult.isPartial())
            .build();
        if (!job.moveTo(SynthesisState.DONE)) {
            return cancelled(job);
        }

        productStore.put(ProductKey.report(mission.getId(), template.getId(), registry.getVersion()), product);
        degraded.forEach(name -> metrics.recordDegradedSection());
        metrics.recordReport("produced");
        auditService.record(AuditEvent.builder()
            .type(AuditEvent.REPORT_PRODUCED)
            .missionId(mission.getId())
            .outcome("PRODUCED")
            .produced(true)
            .degraded(!degraded.isEmpty() || product.isPartialContext())
            .detail("template=" + template.getId() + " degradedSections=" + degraded)
            .build());
        log.info("Report {} produced for mission {} ({} sections, {} degraded)",
            template.getId(), mission.getId(), sections.size(), degraded.size());
        return Optional.of(new ReportOutcome.Produced(product));
    }

    /**
     * Screens every section note, then submits renders in template order, holding at most
     * {@code max-concurrent-sections} in flight.
     *
     * @return one future per section, or the blocked outcome when a section note was blocked
     */
    private Dispatch dispatch(ReportJob job, ReportRequest request, Mission mission,
                              Authority authority, List<SectionSpec> specs,
                              ContextBundle context, Screening screening,
                              PolicyRegistry registry) throws InterruptedException {
        Map<String, String> notes = request.getSectionNotes() != null ? request.getSectionNotes() : Map.of();
        for (SectionSpec spec : specs) {
            String sectionNotes = notes.get(spec.getName());
            if (!hasText(sectionNotes)) {
                continue;
            }
            Verdict verdict = classifier.classify(sectionNotes, authority.getId(), mission.getId(), registry);
            screening.count(verdict);
            if (verdict instanceof Verdict.Block block) {
                return Dispatch.stoppedWith(blocked(job, mission.getId(), request.getTemplateId(), block,
                    SynthesisState.RENDER_SECTIONS, spec.getName()));
            }
        }

        Semaphore permits = new Semaphore(Math.max(1, properties.getSynthesis().getMaxConcurrentSections()));
        List<Future<RenderedSection>> futures = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            SectionSpec spec = specs.get(i);
            int index = i;
            if (context.hasNoEvidenceFor(spec.getDataRequirements())) {
                futures.add(CompletableFuture.completedFuture(
                    new RenderedSection(index, spec.getName(), NO_EVIDENCE_TEXT, SectionStatus.NO_EVIDENCE)));
                continue;
            }

            String prompt = promptComposer.compose(
                authority, spec, context, request.getInstructions(), notes.get(spec.getName()));
            permits.acquire();
            if (job.isCancelled()) {
                permits.release();
                futures.add(CompletableFuture.completedFuture(fallback(index, spec)));
                continue;
            }
            // done() runs on completion and on cancel, including a cancel while still queued.
            Callable<RenderedSection> renderSection = () -> render(index, spec, prompt, mission.getId());
            FutureTask<RenderedSection> task = new FutureTask<>(renderSection) {
                @Override
                protected void done() {
                    permits.release();
                }
            };
            Future<RenderedSection> future = task;
            try {
                synthesisExecutor.execute(task);
            } catch (TaskRejectedException e) {
                permits.release();
                log.warn("Section '{}' of mission {} not scheduled: {}", spec.getName(), mission.getId(), e.getMessage());
                future = CompletableFuture.completedFuture(fallback(index, spec));
            }
            job.track(future);
            futures.add(future);
        }
        return new Dispatch(futures, false, Optional.empty());
    }

    private RenderedSection render(int index, SectionSpec spec, String prompt, String missionId) {
        Duration timeout = properties.getSynthesis().getSectionTimeout();
        try {
            String text = sanitizer.sanitize(gateway.complete(prompt, timeout));
            if (text == null || text.isBlank()) {
                log.warn("Section '{}' of mission {} came back empty after sanitizing", spec.getName(), missionId);
                return fallback(index, spec);
            }
            return new RenderedSection(index, spec.getName(), text, SectionStatus.RENDERED);
        } catch (UpstreamUnavailableException e) {
            log.warn("Section '{}' of mission {} degraded: {}", spec.getName(), missionId, e.getMessage());
            return fallback(index, spec);
        }
    }

    private RenderedSection await(Future<RenderedSection> future, SectionSpec spec, int index,
                                  Instant deadline, String missionId) throws InterruptedException {
        long remaining = Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
        try {
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Section '{}' of mission {} missed the report deadline", spec.getName(), missionId);
            return fallback(index, spec);
        } catch (CancellationException e) {
            return fallback(index, spec);
        } catch (ExecutionException e) {
            log.error("Section '{}' of mission {} failed", spec.getName(), missionId, e.getCause());
            return fallback(index, spec);
        }
    }

    private static RenderedSection fallback(int index, SectionSpec spec) {
        return new RenderedSection(index, spec.getName(), spec.getFallbackText(), SectionStatus.DEGRADED);
    }

    private Optional<ReportOutcome> blocked(ReportJob job, String missionId, String templateId, Verdict.Block block,
                                            SynthesisState stage, String sectionName) {
        if (!job.moveTo(SynthesisState.BLOCKED)) {
            return cancelled(job);
        }
        metrics.recordReport("blocked");
        auditService.record(AuditEvent.builder()
            .type(AuditEvent.REPORT_BLOCKED)
            .missionId(missionId)
            .outcome("BLOCKED")
            .produced(false)
            .ruleId(block.ruleId())
            .actionCategory(block.actionCategory())
            .detail("template=" + templateId + " stage=" + stage + (sectionName != null ? " section=" + sectionName : ""))
            .build());
        log.info("Report {} for mission {} blocked at {} ({})", templateId, missionId, stage, block.actionCategory());
        return Optional.of(new ReportOutcome.Blocked(missionId, templateId, block, stage.name(), sectionName));
    }

    private Optional<ReportOutcome> cancelled(ReportJob job) {
        metrics.recordReport("cancelled");
        auditService.record(AuditEvent.builder()
            .type(AuditEvent.REPORT_CANCELLED)
            .missionId(job.getMissionId())
            .outcome("CANCELLED")
            .produced(false)
            .detail("template=" + job.getTemplateId() + " job=" + job.getJobId())
            .build());
        log.info("Report {} for mission {} cancelled", job.getTemplateId(), job.getMissionId());
        return Optional.empty();
    }

    private static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }

    /** Section futures in template order, or the outcome that stopped dispatch. */
    private record Dispatch(List<Future<RenderedSection>> futures, boolean halted, Optional<ReportOutcome> outcome) {

        static Dispatch stoppedWith(Optional<ReportOutcome> outcome) {
            return new Dispatch(List.of(), true, outcome);
        }
    }

    /** Screening tally for the guardrail posture. */
    private static final class Screening {
        int screened;
        int degraded;

        void count(Verdict verdict) {
            screened++;
            if (verdict instanceof Verdict.Allow allow && allow.degraded()) {
                degraded++;
            }
        }
    }
}
