package com.missionguard.application.template;

import com.missionguard.domain.model.IntLane;
import com.missionguard.domain.model.Template;
import com.missionguard.infrastructure.policy.PolicyRegistry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Templates a mission may use: the authority is allowed and every required INT lane is
 * present. Ordered by priority, then name, then id.
 */
@Component
public class TemplateSelector {

    public List<Template> filter(PolicyRegistry registry, String authorityId, Set<IntLane> intLanesPresent) {
        return registry.getTemplates().values().stream()
            .filter(template -> template.isSelectableBy(authorityId, intLanesPresent))
            .sorted(Template.DISPLAY_ORDER)
            .toList();
    }
}
