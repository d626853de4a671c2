package com.missionguard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Deterministic rule mapping trigger patterns to an action category.
 *
 * <p>The rule only fires when its category is blocked under the mission's authority;
 * that decision belongs to the classifier, the rule itself only reports how much of
 * the request it matched.
 */
@Value
public class GuardrailRule {

    String id;
    String actionCategory;
    List<TriggerPattern> triggers;
    String remediationTemplate;
    /** Explicit referral authority; when null the classifier derives one. */
    String referTo;
    /** Position in the policy file, used to break span ties. */
    int declarationIndex;

    @Builder
    public GuardrailRule(
            String id,
            String actionCategory,
            List<TriggerPattern> triggers,
            String remediationTemplate,
            String referTo,
            int declarationIndex) {

        this.id = Objects.requireNonNull(id, "Rule id must not be null");
        this.actionCategory = Objects.requireNonNull(actionCategory, "Rule action category must not be null");
        if (triggers == null || triggers.isEmpty()) {
            throw new IllegalArgumentException("Rule " + id + " declares no triggers");
        }
        this.triggers = List.copyOf(triggers);
        this.remediationTemplate = remediationTemplate != null && !remediationTemplate.isBlank()
            ? remediationTemplate
            : "Requests for {category} are outside the {authority} lane. Refer this request to {referTo}.";
        this.referTo = referTo;
        this.declarationIndex = declarationIndex;
    }

    /**
     * Longest span matched by any trigger of this rule; 0 when nothing matches.
     */
    public int match(String normalizedText) {
        int best = 0;
        for (TriggerPattern trigger : triggers) {
            best = Math.max(best, trigger.matchSpan(normalizedText));
        }
        return best;
    }

    /**
     * Remediation text for a mission under {@code missionAuthority}. The mission authority
     * is always named, even when the configured template omits the placeholder.
     */
    public String renderRemediation(Authority missionAuthority, String referralName) {
        String authorityName = missionAuthority.getDisplayName() + " (" + missionAuthority.getId() + ")";
        String text = remediationTemplate
            .replace("{authority}", authorityName)
            .replace("{category}", actionCategory)
            .replace("{referTo}", referralName);
        if (!remediationTemplate.contains("{authority}")) {
            text = text + " Mission authority: " + authorityName + ".";
        }
        return text;
    }
}
