package com.missionguard.application.gap;

import com.missionguard.application.exceptions.UpstreamUnavailableException;
import com.missionguard.application.report.ReportSanitizer;
import com.missionguard.config.EngineProperties;
import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.GapKind;
import com.missionguard.infrastructure.upstream.TimeLimitedGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Advisory commentary on conflict findings from the generative gateway.
 *
 * <p>Output is free text for analysts only. It is never parsed back into findings,
 * and any gateway failure simply yields no annotations.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConflictAnnotator {

    private final TimeLimitedGateway gateway;
    private final ReportSanitizer sanitizer;
    private final EngineProperties properties;

    public List<String> annotate(String missionId, List<GapFinding> findings) {
        List<GapFinding> conflicts = findings.stream()
            .filter(f -> f.getKind() == GapKind.CONFLICT)
            .toList();
        if (conflicts.isEmpty()) {
            return List.of();
        }

        StringBuilder prompt = new StringBuilder()
            .append("For each conflict below, suggest in one line which source is more likely reliable and why. ")
            .append("Do not introduce facts that are not listed.\n");
        for (GapFinding conflict : conflicts) {
            prompt.append("- ").append(conflict.getDescription()).append('\n');
        }

        try {
            String text = gateway.complete(prompt.toString(), properties.getGap().getAdvisoryTimeout());
            return Arrays.stream(sanitizer.sanitize(text).split("\\R"))
                .map(String::strip)
                .map(line -> line.startsWith("- ") ? line.substring(2) : line)
                .filter(line -> !line.isEmpty())
                .toList();
        } catch (UpstreamUnavailableException e) {
            log.warn("Conflict annotation skipped for mission {}: {}", missionId, e.getMessage());
            return List.of();
        }
    }
}
