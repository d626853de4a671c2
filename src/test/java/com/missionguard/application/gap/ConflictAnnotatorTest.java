package com.missionguard.application.gap;

import com.missionguard.TestFixtures;
import com.missionguard.application.exceptions.UpstreamTimeoutException;
import com.missionguard.application.report.ReportSanitizer;
import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.GapKind;
import com.missionguard.domain.model.Severity;
import com.missionguard.infrastructure.upstream.TimeLimitedGateway;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConflictAnnotatorTest {

    private final TimeLimitedGateway gateway = mock(TimeLimitedGateway.class);
    private final ConflictAnnotator annotator =
        new ConflictAnnotator(gateway, new ReportSanitizer(), TestFixtures.properties());

    private final GapFinding conflict = GapFinding.builder()
        .kind(GapKind.CONFLICT)
        .severity(Severity.MEDIUM)
        .description("Conflicting flag for MV Aurora: Liberia (src-b), Panama (src-a)")
        .build();

    @Test
    void returnsSanitizedLines() {
        when(gateway.complete(contains("Conflicting flag for MV Aurora"), any(Duration.class)))
            .thenReturn("- Prefer src-a, it is the registry of record.\n\n- Per evidence.vessels[0] src-b is stale.");

        List<String> annotations = annotator.annotate("m1", List.of(conflict));

        assertEquals(2, annotations.size());
        assertEquals("Prefer src-a, it is the registry of record.", annotations.get(0));
        assertFalse(annotations.get(1).contains("evidence."));
    }

    @Test
    void gatewayFailureYieldsNoAnnotations() {
        when(gateway.complete(anyString(), any(Duration.class)))
            .thenThrow(new UpstreamTimeoutException("gateway", "no completion"));

        assertTrue(annotator.annotate("m1", List.of(conflict)).isEmpty());
    }

    @Test
    void withoutConflictsTheGatewayIsNotCalled() {
        GapFinding quality = GapFinding.builder().kind(GapKind.QUALITY).severity(Severity.LOW).description("q").build();

        assertTrue(annotator.annotate("m1", List.of(quality)).isEmpty());
        verify(gateway, never()).complete(anyString(), any(Duration.class));
    }
}
