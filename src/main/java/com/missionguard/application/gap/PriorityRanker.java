package com.missionguard.application.gap;

import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.GapSubject;
import com.missionguard.domain.model.PriorityItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks the entities and events findings refer to by the summed severity weight of
 * those findings, ties broken by name.
 */
@Component
public class PriorityRanker {

    public List<PriorityItem> rank(List<GapFinding> findings, int limit) {
        Map<GapSubject, List<GapFinding>> bySubject = new LinkedHashMap<>();
        for (GapFinding finding : findings) {
            for (GapSubject subject : finding.getSubjects()) {
                bySubject.computeIfAbsent(subject, s -> new ArrayList<>()).add(finding);
            }
        }

        List<PriorityItem> items = new ArrayList<>();
        bySubject.forEach((subject, referencing) -> items.add(PriorityItem.builder()
            .subject(subject)
            .score(referencing.stream().mapToInt(f -> f.getSeverity().weight()).sum())
            .openGaps(referencing.size())
            .rationale(rationale(referencing))
            .build()));

        items.sort(Comparator.comparingInt(PriorityItem::getScore).reversed()
            .thenComparing(item -> item.getSubject().name())
            .thenComparing(item -> item.getSubject().type()));
        return items.size() > limit ? List.copyOf(items.subList(0, limit)) : List.copyOf(items);
    }

    private static String rationale(List<GapFinding> referencing) {
        List<String> parts = new ArrayList<>();
        for (GapFinding finding : referencing) {
            parts.add(finding.getKind().code() + " " + finding.getSeverity().code());
        }
        return referencing.size() + (referencing.size() == 1 ? " open gap: " : " open gaps: ")
            + String.join(", ", parts);
    }
}
