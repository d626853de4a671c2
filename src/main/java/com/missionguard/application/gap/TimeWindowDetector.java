package com.missionguard.application.gap;

import com.missionguard.config.EngineProperties;
import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.GapKind;
import com.missionguard.domain.model.GapSubject;
import com.missionguard.domain.model.KgEvent;
import com.missionguard.domain.model.ObservationWindow;
import com.missionguard.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stretches of the observation window with no supporting events.
 *
 * <p>The window is cut into fixed-width buckets; a run of contiguous empty buckets is
 * one finding. Weight is the run length, plus two when the run ends in the most recent
 * quarter of the window. Weight 4 or more is HIGH, 2 or more MEDIUM, otherwise LOW.
 */
@Component
@Slf4j
public class TimeWindowDetector implements GapDetector {

    static final int MAX_BUCKETS = 10_000;

    private final EngineProperties properties;

    public TimeWindowDetector(EngineProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<Source> requiredSources() {
        return List.of(Source.KG);
    }

    @Override
    public List<GapFinding> detect(GapDetectionContext context) {
        ObservationWindow window = context.getMission().getObservationWindow();
        if (window == null || !window.isValid()) {
            return List.of();
        }
        Duration width = properties.getGap().getBucketWidth();
        long windowMillis = Duration.between(window.getStart(), window.getEnd()).toMillis();
        long widthMillis = width.toMillis();
        if (widthMillis <= 0) {
            log.warn("Ignoring non-positive gap bucket width {}", width);
            return List.of();
        }
        long bucketCount = (windowMillis + widthMillis - 1) / widthMillis;
        if (bucketCount > MAX_BUCKETS) {
            log.warn("Observation window of mission {} spans {} buckets, skipping time-window detection",
                context.getMission().getId(), bucketCount);
            return List.of();
        }

        List<KgEvent> events = context.getSources().kgSnapshot().getEvents().stream()
            .filter(e -> e.getTimestamp() != null)
            .sorted(Comparator.comparing(KgEvent::getTimestamp))
            .toList();

        boolean[] supported = new boolean[(int) bucketCount];
        for (KgEvent event : events) {
            Instant t = event.getTimestamp();
            if (t.isBefore(window.getStart()) || !t.isBefore(window.getEnd())) {
                continue;
            }
            int bucket = (int) (Duration.between(window.getStart(), t).toMillis() / widthMillis);
            supported[bucket] = true;
        }

        Instant recentQuarter = window.getStart().plusMillis(windowMillis * 3 / 4);
        List<GapFinding> findings = new ArrayList<>();
        int i = 0;
        while (i < supported.length) {
            if (supported[i]) {
                i++;
                continue;
            }
            int runStart = i;
            while (i < supported.length && !supported[i]) {
                i++;
            }
            findings.add(finding(context, window, events, runStart, i, widthMillis, recentQuarter));
        }
        return findings;
    }

    private GapFinding finding(GapDetectionContext context, ObservationWindow window, List<KgEvent> events,
                               int firstBucket, int endBucket, long widthMillis, Instant recentQuarter) {
        Instant from = window.getStart().plusMillis(firstBucket * widthMillis);
        Instant to = min(window.getStart().plusMillis(endBucket * widthMillis), window.getEnd());
        int runLength = endBucket - firstBucket;
        int weight = runLength + (to.isAfter(recentQuarter) ? 2 : 0);

        List<GapSubject> subjects = new ArrayList<>();
        events.stream()
            .filter(e -> e.getTimestamp().isBefore(from))
            .reduce((first, second) -> second)
            .ifPresent(e -> subjects.add(GapSubject.event(label(e))));
        events.stream()
            .filter(e -> !e.getTimestamp().isBefore(to))
            .findFirst()
            .ifPresent(e -> subjects.add(GapSubject.event(label(e))));

        return GapFinding.builder()
            .kind(GapKind.MISSING_TIME_WINDOW)
            .severity(weight >= 4 ? Severity.HIGH : weight >= 2 ? Severity.MEDIUM : Severity.LOW)
            .description("No supporting events from " + from + " to " + to
                + " (" + runLength + (runLength == 1 ? " bucket)" : " buckets)"))
            .supportingReference(context.getSources().kgSnapshotRef())
            .recommendedAction("Collect or backfill reporting covering " + from + " to " + to)
            .subjects(List.copyOf(subjects))
            .build();
    }

    private static String label(KgEvent event) {
        return event.getTitle() != null && !event.getTitle().isBlank() ? event.getTitle() : event.getId();
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
