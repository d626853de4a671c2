package com.missionguard.application.gap;

import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.GapKind;
import com.missionguard.domain.model.GapSubject;
import com.missionguard.domain.model.KgEntity;
import com.missionguard.domain.model.ReferencedEntity;
import com.missionguard.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Entities the mission references that the knowledge graph does not support: absent,
 * or present with no corroborating source.
 */
@Component
public class EntitySupportDetector implements GapDetector {

    @Override
    public List<Source> requiredSources() {
        return List.of(Source.KG);
    }

    @Override
    public List<GapFinding> detect(GapDetectionContext context) {
        List<KgEntity> entities = context.getSources().kgSnapshot().getEntities();
        Set<String> seen = new HashSet<>();
        List<GapFinding> findings = new ArrayList<>();
        for (ReferencedEntity referenced : context.getMission().getReferencedEntities()) {
            if (referenced.getName() == null || referenced.getName().isBlank()
                    || !seen.add(referenced.getName().trim().toLowerCase(Locale.ROOT))) {
                continue;
            }
            Optional<KgEntity> match = entities.stream()
                .filter(e -> e.isKnownAs(referenced.getName()))
                .findFirst();
            if (match.isPresent() && match.get().isCorroborated()) {
                continue;
            }
            boolean absent = match.isEmpty();
            Severity severity = referenced.isPriority() ? Severity.HIGH : absent ? Severity.MEDIUM : Severity.LOW;
            String where = referenced.getDocumentId() != null ? " (referenced in " + referenced.getDocumentId() + ")" : "";
            findings.add(GapFinding.builder()
                .kind(GapKind.MISSING_ENTITY_SUPPORT)
                .severity(severity)
                .description(absent
                    ? "Entity " + referenced.getName() + " is not present in the knowledge graph" + where
                    : "Entity " + referenced.getName() + " has no corroborating source" + where)
                .supportingReference(context.getSources().kgSnapshotRef())
                .recommendedAction(absent
                    ? "Resolve " + referenced.getName() + " into the knowledge graph from mission sources"
                    : "Corroborate " + referenced.getName() + " with an independent source")
                .subjects(List.of(GapSubject.entity(referenced.getName())))
                .build());
        }
        return findings;
    }
}
