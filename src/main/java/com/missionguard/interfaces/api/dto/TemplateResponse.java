package com.missionguard.interfaces.api.dto;

import com.missionguard.domain.model.IntLane;
import com.missionguard.domain.model.SectionSpec;
import com.missionguard.domain.model.Template;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateResponse {

    private String id;
    private String name;
    private int priority;
    private Set<IntLane> requiredIntLanes;
    private Set<IntLane> expectedIntCoverage;
    private List<String> sections;

    public static TemplateResponse from(Template template) {
        return TemplateResponse.builder()
            .id(template.getId())
            .name(template.getName())
            .priority(template.getPriority())
            .requiredIntLanes(template.getRequiredIntLanes())
            .expectedIntCoverage(template.getExpectedIntCoverage())
            .sections(template.getSections().stream().map(SectionSpec::getName).toList())
            .build();
    }
}
