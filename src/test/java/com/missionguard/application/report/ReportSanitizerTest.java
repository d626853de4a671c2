package com.missionguard.application.report;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReportSanitizerTest {

    private final ReportSanitizer sanitizer = new ReportSanitizer();

    @Test
    void stripsPipelineMarkers() {
        String cleaned = sanitizer.sanitize(
            "Evidence from Agent Run Advisory referencing evidence.incidents[0] and Event ID 4 in provided JSON context.");

        assertFalse(cleaned.toLowerCase().contains("agent run advisory"), cleaned);
        assertFalse(cleaned.contains("evidence.incidents"), cleaned);
        assertFalse(cleaned.contains("Event ID"), cleaned);
        assertFalse(cleaned.toLowerCase().contains("provided json"), cleaned);
        assertEquals("Evidence and.", cleaned);
    }

    @Test
    void keepsOrdinaryProse() {
        String text = "The idea of an event horizon is provided by physics; evidence suggests otherwise.";

        assertEquals(text, sanitizer.sanitize(text));
    }

    @Test
    void tidiesSpacingLeftBehind() {
        assertEquals("Two vessels arrived (see timeline).",
            sanitizer.sanitize("Two vessels arrived  from the agent run advisory (see timeline) ."));
    }

    @Test
    void nullAndEmptyPassThrough() {
        assertNull(sanitizer.sanitize(null));
        assertEquals("", sanitizer.sanitize(""));
    }
}
