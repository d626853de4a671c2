package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Policy-gated specification of an intelligence product.
 */
@Value
public class Template {

    /** Priority ascending, then name, then id. */
    public static final Comparator<Template> DISPLAY_ORDER = Comparator
        .comparingInt(Template::getPriority)
        .thenComparing(Template::getName)
        .thenComparing(Template::getId);

    String id;
    String name;
    int priority;
    Set<IntLane> requiredIntLanes;
    Set<IntLane> expectedIntCoverage;
    Set<String> allowedAuthorities;
    List<SectionSpec> sections;

    @Builder
    public Template(
            String id,
            String name,
            int priority,
            Set<IntLane> requiredIntLanes,
            Set<IntLane> expectedIntCoverage,
            Set<String> allowedAuthorities,
            List<SectionSpec> sections) {

        this.id = Objects.requireNonNull(id, "Template id must not be null");
        this.name = name != null ? name : id;
        this.priority = priority;
        this.requiredIntLanes = requiredIntLanes == null || requiredIntLanes.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(IntLane.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(requiredIntLanes));
        EnumSet<IntLane> expected = EnumSet.noneOf(IntLane.class);
        expected.addAll(this.requiredIntLanes);
        if (expectedIntCoverage != null) {
            expected.addAll(expectedIntCoverage);
        }
        this.expectedIntCoverage = Collections.unmodifiableSet(expected);
        this.allowedAuthorities = allowedAuthorities != null ? Set.copyOf(allowedAuthorities) : Set.of();
        if (sections == null || sections.isEmpty()) {
            throw new IllegalArgumentException("Template " + id + " declares no sections");
        }
        this.sections = List.copyOf(sections);
    }

    /**
     * A template is selectable iff the authority is allowed and every required lane is present.
     */
    public boolean isSelectableBy(String authorityId, Set<IntLane> intLanesPresent) {
        return allowedAuthorities.contains(authorityId) && intLanesPresent.containsAll(requiredIntLanes);
    }
}
