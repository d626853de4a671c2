package com.missionguard.infrastructure.policy;

import com.missionguard.application.exceptions.PolicyConfigException;
import com.missionguard.domain.model.Authority;
import com.missionguard.domain.model.GuardrailRule;
import com.missionguard.domain.model.Template;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable authority, rule and template table.
 *
 * <p>Built once per load and never mutated; a reload builds a new instance and
 * {@link PolicyRegistryHolder} swaps it in. Rules keep their declaration order,
 * which the classifier uses to break ties.
 *
 * @since 1.0.0
 */
@Getter
public final class PolicyRegistry {

    private final String version;
    private final Instant loadedAt;
    private final Map<String, Authority> authorities;
    private final List<GuardrailRule> rules;
    private final Map<String, Template> templates;

    private PolicyRegistry(
            String version,
            Map<String, Authority> authorities,
            List<GuardrailRule> rules,
            Map<String, Template> templates) {

        this.version = version;
        this.loadedAt = Instant.now();
        this.authorities = Collections.unmodifiableMap(authorities);
        this.rules = List.copyOf(rules);
        this.templates = Collections.unmodifiableMap(templates);
    }

    /**
     * Validate and assemble a registry.
     *
     * @throws PolicyConfigException on duplicate ids, dangling references or contradictory categories
     */
    public static PolicyRegistry of(
            String version,
            Collection<Authority> authorities,
            List<GuardrailRule> rules,
            Collection<Template> templates) {

        List<String> problems = new ArrayList<>();

        Map<String, Authority> authorityIndex = new LinkedHashMap<>();
        for (Authority authority : authorities) {
            if (authorityIndex.putIfAbsent(authority.getId(), authority) != null) {
                problems.add("duplicate authority id " + authority.getId());
            }
            Set<String> overlap = new HashSet<>(authority.getAllowedActionCategories());
            overlap.retainAll(authority.getBlockedActionCategories());
            if (!overlap.isEmpty()) {
                problems.add("authority " + authority.getId() + " both allows and blocks " + overlap);
            }
            if (!authority.getAllowedIntLanes().containsAll(authority.getFoundationalIntLanes())) {
                problems.add("authority " + authority.getId() + " has foundational lanes outside its allowed lanes");
            }
        }

        Set<String> ruleIds = new HashSet<>();
        for (GuardrailRule rule : rules) {
            if (!ruleIds.add(rule.getId())) {
                problems.add("duplicate rule id " + rule.getId());
            }
            if (rule.getReferTo() != null && !authorityIndex.containsKey(rule.getReferTo())) {
                problems.add("rule " + rule.getId() + " refers to unknown authority " + rule.getReferTo());
            }
        }

        Map<String, Template> templateIndex = new LinkedHashMap<>();
        for (Template template : templates) {
            if (templateIndex.putIfAbsent(template.getId(), template) != null) {
                problems.add("duplicate template id " + template.getId());
            }
            for (String authorityId : template.getAllowedAuthorities()) {
                if (!authorityIndex.containsKey(authorityId)) {
                    problems.add("template " + template.getId() + " allows unknown authority " + authorityId);
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new PolicyConfigException("Invalid policy configuration: " + String.join("; ", problems));
        }
        return new PolicyRegistry(version, authorityIndex, rules, templateIndex);
    }

    public Optional<Authority> findAuthority(String authorityId) {
        return authorityId == null ? Optional.empty() : Optional.ofNullable(authorities.get(authorityId));
    }

    /**
     * @throws PolicyConfigException when a mission references an authority the policy does not define
     */
    public Authority requireAuthority(String authorityId) {
        return findAuthority(authorityId).orElseThrow(() ->
            new PolicyConfigException("Mission references unknown authority '" + authorityId + "'"));
    }

    public Optional<Template> findTemplate(String templateId) {
        return templateId == null ? Optional.empty() : Optional.ofNullable(templates.get(templateId));
    }

    /**
     * First authority, in declaration order, other than {@code excludingId} that allows the category.
     */
    public Optional<Authority> firstAuthorityAllowing(String actionCategory, String excludingId) {
        return authorities.values().stream()
            .filter(a -> !a.getId().equals(excludingId))
            .filter(a -> a.allows(actionCategory))
            .findFirst();
    }
}
