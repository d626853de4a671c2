package com.missionguard.application.gap;

import com.missionguard.config.EngineProperties;
import com.missionguard.domain.model.AttributeAssertion;
import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.GapKind;
import com.missionguard.domain.model.GapSubject;
import com.missionguard.domain.model.KgEntity;
import com.missionguard.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Attribute assertions from different sources that disagree over overlapping validity.
 *
 * <p>Numeric values disagree when their relative difference exceeds the configured
 * tolerance; other values when they differ ignoring case and surrounding whitespace.
 * HIGH when three or more sources are involved or a numeric difference exceeds 50%.
 */
@Component
public class ConflictDetector implements GapDetector {

    static final double HIGH_RELATIVE_DIFFERENCE = 0.5;

    private final EngineProperties properties;

    public ConflictDetector(EngineProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<Source> requiredSources() {
        return List.of(Source.KG);
    }

    @Override
    public List<GapFinding> detect(GapDetectionContext context) {
        double tolerance = properties.getGap().getNumericTolerance();
        List<GapFinding> findings = new ArrayList<>();
        for (KgEntity entity : context.getSources().kgSnapshot().getEntities()) {
            Map<String, List<AttributeAssertion>> byAttribute = entity.getAttributes().stream()
                .filter(a -> a.getAttribute() != null && a.getValue() != null && a.getSourceId() != null)
                .collect(Collectors.groupingBy(
                    a -> a.getAttribute().trim().toLowerCase(Locale.ROOT), TreeMap::new, Collectors.toList()));

            byAttribute.forEach((attribute, assertions) -> {
                List<AttributeAssertion> sorted = assertions.stream()
                    .sorted(Comparator.comparing(AttributeAssertion::getSourceId)
                        .thenComparing(AttributeAssertion::getValue))
                    .toList();
                Set<String> disagreeing = new TreeSet<>();
                Set<String> values = new TreeSet<>();
                double maxRelativeDifference = 0.0;
                for (int i = 0; i < sorted.size(); i++) {
                    for (int j = i + 1; j < sorted.size(); j++) {
                        AttributeAssertion a = sorted.get(i);
                        AttributeAssertion b = sorted.get(j);
                        if (Objects.equals(a.getSourceId(), b.getSourceId()) || !a.overlaps(b)) {
                            continue;
                        }
                        Double relative = relativeDifference(a.getValue(), b.getValue());
                        boolean conflicting = relative != null
                            ? relative > tolerance
                            : !normalize(a.getValue()).equals(normalize(b.getValue()));
                        if (conflicting) {
                            disagreeing.add(a.getSourceId());
                            disagreeing.add(b.getSourceId());
                            values.add(a.getValue().trim() + " (" + a.getSourceId() + ")");
                            values.add(b.getValue().trim() + " (" + b.getSourceId() + ")");
                            if (relative != null) {
                                maxRelativeDifference = Math.max(maxRelativeDifference, relative);
                            }
                        }
                    }
                }
                if (disagreeing.isEmpty()) {
                    return;
                }
                boolean high = disagreeing.size() >= 3 || maxRelativeDifference > HIGH_RELATIVE_DIFFERENCE;
                String entityName = entity.getName() != null ? entity.getName() : entity.getId();
                findings.add(GapFinding.builder()
                    .kind(GapKind.CONFLICT)
                    .severity(high ? Severity.HIGH : Severity.MEDIUM)
                    .description("Conflicting " + attribute + " for " + entityName + ": " + String.join(", ", values))
                    .supportingReference(context.getSources().kgSnapshotRef())
                    .recommendedAction("Adjudicate " + attribute + " for " + entityName + " across sources "
                        + String.join(", ", disagreeing))
                    .subjects(List.of(GapSubject.entity(entityName)))
                    .build());
            });
        }
        return findings;
    }

    /**
     * Relative difference of two numeric values, or null when either is not numeric.
     */
    static Double relativeDifference(String left, String right) {
        Double a = parse(left);
        Double b = parse(right);
        if (a == null || b == null) {
            return null;
        }
        double scale = Math.max(Math.abs(a), Math.abs(b));
        return scale == 0.0 ? 0.0 : Math.abs(a - b) / scale;
    }

    private static Double parse(String value) {
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
