package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ReportProduct {
    String missionId;
    String templateId;
    List<RenderedSection> sections;
    GuardrailPosture guardrailPosture;
    String gapSnapshotRef;
    String kgSnapshotRef;
    Instant generatedAt;
    List<String> degradedSections;
    boolean partialContext;
}
