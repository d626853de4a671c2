package com.missionguard.application.gap;

import com.missionguard.config.EngineProperties;
import com.missionguard.config.PerformanceConfiguration.EngineMetrics;
import com.missionguard.domain.model.Authority;
import com.missionguard.domain.model.GapAnalysisResult;
import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.IntLane;
import com.missionguard.domain.model.Mission;
import com.missionguard.domain.model.Template;
import com.missionguard.domain.repository.ProductStore;
import com.missionguard.domain.repository.ProductStore.ProductKey;
import com.missionguard.infrastructure.audit.AuditEvent;
import com.missionguard.infrastructure.audit.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Gap Analysis Engine.
 *
 * <p>Runs every detector whose sources are available over one set of fetched mission
 * sources. Findings and priorities are a pure function of those inputs; with advisory
 * mode on, conflict annotations are attached afterwards and never touch findings.
 *
 * <p>Results are written through to the product store under the mission, the template
 * (or the generic coverage model) and the policy version in force.
 *
 * @since 1.0.0
 */
@Service
@Slf4j
public class GapAnalysisEngine {

    private final List<GapDetector> detectors;
    private final PriorityRanker priorityRanker;
    private final ConflictAnnotator conflictAnnotator;
    private final MissionSourceFetcher sourceFetcher;
    private final ProductStore productStore;
    private final AuditService auditService;
    private final EngineProperties properties;
    private final EngineMetrics metrics;

    public GapAnalysisEngine(List<GapDetector> detectors,
                             PriorityRanker priorityRanker,
                             ConflictAnnotator conflictAnnotator,
                             MissionSourceFetcher sourceFetcher,
                             ProductStore productStore,
                             AuditService auditService,
                             EngineProperties properties,
                             EngineMetrics metrics) {
        this.detectors = List.copyOf(detectors);
        this.priorityRanker = priorityRanker;
        this.conflictAnnotator = conflictAnnotator;
        this.sourceFetcher = sourceFetcher;
        this.productStore = productStore;
        this.auditService = auditService;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Cached entry point. Returns the stored result for this mission, template and policy
     * version unless {@code forceRegen} is set; otherwise fetches sources and recomputes.
     *
     * @param template template whose coverage expectation applies, or null for the generic model
     */
    public GapAnalysisResult run(Mission mission, Authority authority, Template template,
                                 String registryVersion, boolean forceRegen) {
        ProductKey key = ProductKey.gapAnalysis(mission.getId(), templateId(template), registryVersion);
        if (!forceRegen) {
            Optional<GapAnalysisResult> cached = productStore.get(key, GapAnalysisResult.class);
            if (cached.isPresent()) {
                metrics.recordProductCacheHit("gap");
                return cached.get();
            }
        }
        return compute(mission, authority, template, registryVersion, sourceFetcher.fetch(mission));
    }

    /**
     * Analyse already-fetched sources and write the result through.
     */
    public GapAnalysisResult compute(Mission mission, Authority authority, Template template,
                                     String registryVersion, MissionSources sources) {
        GapAnalysisResult result = analyze(mission, authority, template, sources);
        if (properties.getGap().getMode() == GapAnalysisMode.RULES_WITH_ADVISORY) {
            List<String> annotations = conflictAnnotator.annotate(mission.getId(), result.getFindings());
            result = result.toBuilder().annotations(annotations).build();
        }

        productStore.put(ProductKey.gapAnalysis(mission.getId(), templateId(template), registryVersion), result);
        metrics.recordGapAnalysis(result.isPartial());
        auditService.record(AuditEvent.builder()
            .type(AuditEvent.GAP_ANALYSIS)
            .missionId(mission.getId())
            .outcome(result.isPartial() ? "PARTIAL" : "COMPLETE")
            .degraded(result.isPartial())
            .detail("findings=" + result.getFindings().size()
                + (result.isPartial() ? " unavailable=" + result.getUnavailableSources() : ""))
            .build());
        return result;
    }

    /**
     * Deterministic part of the analysis: findings in report order and ranked priorities.
     */
    public GapAnalysisResult analyze(Mission mission, Authority authority, Template template, MissionSources sources) {
        Set<IntLane> expected = template != null ? template.getExpectedIntCoverage() : authority.getExpectedIntLanes();
        GapDetectionContext context = GapDetectionContext.builder()
            .mission(mission)
            .authority(authority)
            .expectedIntLanes(expected)
            .sources(sources)
            .build();

        List<GapFinding> findings = new ArrayList<>();
        for (GapDetector detector : detectors) {
            if (!canRun(detector, sources)) {
                log.debug("Skipping {} for mission {}: source unavailable",
                    detector.getClass().getSimpleName(), mission.getId());
                continue;
            }
            findings.addAll(detector.detect(context));
        }
        findings.sort(GapFinding.REPORT_ORDER);

        if (sources.isPartial()) {
            log.warn("Gap analysis for mission {} is partial, unavailable: {}",
                mission.getId(), sources.unavailableSources());
        }

        Instant generatedAt = Instant.now();
        return GapAnalysisResult.builder()
            .missionId(mission.getId())
            .snapshotRef("gap:" + mission.getId() + "/" + templateId(template) + "@" + generatedAt)
            .kgSnapshotRef(sources.kgSnapshotRef())
            .datasetProfileRefs(sources.datasetProfileRefs())
            .findings(List.copyOf(findings))
            .priorities(priorityRanker.rank(findings, properties.getGap().getPriorityLimit()))
            .partial(sources.isPartial())
            .unavailableSources(sources.unavailableSources())
            .generatedAt(generatedAt)
            .build();
    }

    private static boolean canRun(GapDetector detector, MissionSources sources) {
        for (GapDetector.Source source : detector.requiredSources()) {
            if (source == GapDetector.Source.KG && !sources.hasKg()) {
                return false;
            }
            if (source == GapDetector.Source.DATASET_PROFILES && !sources.hasDatasetProfiles()) {
                return false;
            }
        }
        return true;
    }

    private static String templateId(Template template) {
        return template != null ? template.getId() : "generic";
    }
}
