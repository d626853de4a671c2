package com.missionguard.application.report;

import com.missionguard.domain.model.ReportOutcome;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle on one report synthesis run.
 *
 * <p>{@link #cancel()} abandons outstanding section renders. A cancelled job completes
 * with an empty result: no product is produced or stored.
 */
public final class ReportJob {

    private final String jobId = UUID.randomUUID().toString();
    private final String missionId;
    private final String templateId;
    private final AtomicReference<SynthesisState> state = new AtomicReference<>(SynthesisState.SELECT_TEMPLATE);
    private final List<Future<?>> inFlight = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Optional<ReportOutcome>> result = new CompletableFuture<>();

    ReportJob(String missionId, String templateId) {
        this.missionId = missionId;
        this.templateId = templateId;
    }

    public String getJobId() {
        return jobId;
    }

    public String getMissionId() {
        return missionId;
    }

    public String getTemplateId() {
        return templateId;
    }

    public SynthesisState state() {
        return state.get();
    }

    public boolean isCancelled() {
        return state.get() == SynthesisState.CANCELLED;
    }

    /**
     * Completes with the outcome, or empty when the job was cancelled.
     */
    public CompletableFuture<Optional<ReportOutcome>> result() {
        return result;
    }

    /**
     * @return false when the job had already finished
     */
    public boolean cancel() {
        if (!moveTo(SynthesisState.CANCELLED)) {
            return false;
        }
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
        return true;
    }

    /**
     * Advance to {@code next} unless the job is already terminal.
     */
    boolean moveTo(SynthesisState next) {
        while (true) {
            SynthesisState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    void track(Future<?> future) {
        inFlight.add(future);
        // Registered after a concurrent cancel() finished its sweep.
        if (isCancelled()) {
            future.cancel(true);
        }
    }

    void cancelInFlight() {
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
    }
}
