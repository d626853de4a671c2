package com.missionguard.application.gap;

import com.missionguard.domain.model.GapFinding;
import com.missionguard.domain.model.GapKind;
import com.missionguard.domain.model.IntLane;
import com.missionguard.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Expected INT lanes the mission has no coverage for. HIGH when the lane is foundational
 * to the mission authority, otherwise MEDIUM.
 */
@Component
public class MissingIntDetector implements GapDetector {

    @Override
    public List<Source> requiredSources() {
        return List.of();
    }

    @Override
    public List<GapFinding> detect(GapDetectionContext context) {
        List<GapFinding> findings = new ArrayList<>();
        for (IntLane lane : context.getExpectedIntLanes()) {
            if (context.getMission().getIntLanesPresent().contains(lane)) {
                continue;
            }
            boolean foundational = context.getAuthority().isFoundational(lane);
            findings.add(GapFinding.builder()
                .kind(GapKind.MISSING_INT)
                .severity(foundational ? Severity.HIGH : Severity.MEDIUM)
                .description("No " + lane + " coverage"
                    + (foundational ? " (foundational to " + context.getAuthority().getId() + ")" : ""))
                .supportingReference("mission:" + context.getMission().getId() + "/int-lanes")
                .recommendedAction("Task " + lane + " collection or attach existing " + lane + " sources to the mission")
                .build());
        }
        return findings;
    }
}
