package com.missionguard.infrastructure.policy;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.missionguard.domain.model.DataRequirement;
import com.missionguard.domain.model.IntLane;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * YAML binding for the declarative policy file. Converted to domain objects by
 * {@link PolicyConfigurationLoader}; never handed to application code.
 *
 * <p>Category and authority sets bind as {@link LinkedHashSet} to keep file order.
 */
@Data
@NoArgsConstructor
public class PolicyDocument {

    private String version;
    private List<AuthorityEntry> authorities = new ArrayList<>();
    private List<RuleEntry> rules = new ArrayList<>();
    private List<TemplateEntry> templates = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class AuthorityEntry {
        private String id;
        private String displayName;
        private String jurisdictionScope;
        private Set<IntLane> allowedIntLanes = new LinkedHashSet<>();
        private Set<IntLane> foundationalIntLanes = new LinkedHashSet<>();
        private Set<IntLane> expectedIntLanes = new LinkedHashSet<>();
        @JsonDeserialize(as = LinkedHashSet.class)
        private Set<String> allowedActionCategories = new LinkedHashSet<>();
        @JsonDeserialize(as = LinkedHashSet.class)
        private Set<String> blockedActionCategories = new LinkedHashSet<>();
        private String disclaimer;
    }

    @Data
    @NoArgsConstructor
    public static class RuleEntry {
        private String id;
        private String actionCategory;
        /** Single phrases; any one matching fires the rule. */
        private List<String> phrases = new ArrayList<>();
        /** Compound triggers; every term of one entry must co-occur. */
        private List<List<String>> compounds = new ArrayList<>();
        private String remediation;
        private String referTo;
    }

    @Data
    @NoArgsConstructor
    public static class TemplateEntry {
        private String id;
        private String name;
        private int priority = 100;
        private Set<IntLane> requiredIntLanes = new LinkedHashSet<>();
        private Set<IntLane> expectedIntCoverage = new LinkedHashSet<>();
        @JsonDeserialize(as = LinkedHashSet.class)
        private Set<String> allowedAuthorities = new LinkedHashSet<>();
        private List<SectionEntry> sections = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class SectionEntry {
        private String name;
        private String prompt;
        private Set<DataRequirement> dataRequirements = new LinkedHashSet<>();
        private String fallback;
    }
}
