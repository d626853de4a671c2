package com.missionguard.application.gap;

import com.missionguard.config.EngineProperties;
import com.missionguard.domain.model.DatasetProfile;
import com.missionguard.domain.model.KgSnapshot;
import com.missionguard.domain.model.Mission;
import com.missionguard.infrastructure.upstream.DatasetProfileProvider;
import com.missionguard.infrastructure.upstream.KgSnapshotProvider;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Fetches the knowledge-graph snapshot and dataset profiles for a mission concurrently.
 *
 * <p>Each fetch runs on the upstream executor under a time limiter. A failed or timed out
 * fetch never propagates; the source is left null and named as unavailable.
 */
@Component
@Slf4j
public class MissionSourceFetcher {

    static final String KG_SOURCE = "kg_snapshot";
    static final String PROFILES_SOURCE = "dataset_profiles";

    private final KgSnapshotProvider kgSnapshotProvider;
    private final DatasetProfileProvider datasetProfileProvider;
    private final Executor upstreamExecutor;
    private final TimeLimiter timeLimiter;

    public MissionSourceFetcher(KgSnapshotProvider kgSnapshotProvider,
                                DatasetProfileProvider datasetProfileProvider,
                                @Qualifier("upstreamExecutor") Executor upstreamExecutor,
                                EngineProperties properties) {
        this.kgSnapshotProvider = kgSnapshotProvider;
        this.datasetProfileProvider = datasetProfileProvider;
        this.upstreamExecutor = upstreamExecutor;
        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(properties.getUpstream().getFetchTimeout())
            .cancelRunningFuture(true)
            .build());
    }

    public MissionSources fetch(Mission mission) {
        CompletableFuture<KgSnapshot> kg = start(() -> kgSnapshotProvider.getMissionKgSnapshot(mission));
        CompletableFuture<List<DatasetProfile>> profiles =
            start(() -> datasetProfileProvider.getDatasetProfiles(mission.getId()));

        List<String> unavailable = new ArrayList<>();
        KgSnapshot snapshot = await(KG_SOURCE, mission.getId(), kg, unavailable);
        List<DatasetProfile> profileList = await(PROFILES_SOURCE, mission.getId(), profiles, unavailable);
        if (snapshot == null && !unavailable.contains(KG_SOURCE)) {
            // Provider answered with no body.
            unavailable.add(KG_SOURCE);
        }
        if (profileList == null && !unavailable.contains(PROFILES_SOURCE)) {
            profileList = List.of();
        }
        return new MissionSources(snapshot, profileList, unavailable);
    }

    private <T> CompletableFuture<T> start(Supplier<T> fetch) {
        try {
            return CompletableFuture.supplyAsync(fetch, upstreamExecutor);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> T await(String source, String missionId, CompletableFuture<T> future, List<String> unavailable) {
        try {
            return TimeLimiter.decorateFutureSupplier(timeLimiter, () -> future).call();
        } catch (TimeoutException e) {
            log.warn("Upstream {} timed out for mission {}", source, missionId);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Upstream {} unavailable for mission {}: {}", source, missionId, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while fetching {} for mission {}", source, missionId);
        } catch (Exception e) {
            log.warn("Upstream {} failed for mission {}: {}", source, missionId, e.getMessage());
        }
        unavailable.add(source);
        return null;
    }
}
