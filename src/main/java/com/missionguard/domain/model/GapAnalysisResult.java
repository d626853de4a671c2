package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Output of a gap analysis run.
 *
 * <p>{@code findings} and {@code priorities} are deterministic for a given input.
 * {@code annotations} holds advisory generative commentary and is never consulted
 * when computing findings.
 */
@Value
@Builder(toBuilder = true)
public class GapAnalysisResult {

    String missionId;
    String snapshotRef;
    String kgSnapshotRef;
    @Builder.Default
    List<String> datasetProfileRefs = List.of();
    @Builder.Default
    List<GapFinding> findings = List.of();
    @Builder.Default
    List<PriorityItem> priorities = List.of();
    boolean partial;
    @Builder.Default
    List<String> unavailableSources = List.of();
    @Builder.Default
    List<String> annotations = List.of();
    Instant generatedAt;
}
