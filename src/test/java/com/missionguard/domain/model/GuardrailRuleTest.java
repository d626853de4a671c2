package com.missionguard.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GuardrailRuleTest {

    private final Authority leo = Authority.builder()
        .id("LEO")
        .displayName("Law Enforcement")
        .allowedActionCategories(Set.of("domestic_arrest"))
        .build();

    @Test
    void matchReturnsLongestTriggerSpan() {
        GuardrailRule rule = GuardrailRule.builder()
            .id("r1")
            .actionCategory("military_deployment")
            .triggers(List.of(
                TriggerPattern.phrase("military forces"),
                TriggerPattern.allOf(List.of("deploy", "military"))))
            .build();

        assertEquals(17, rule.match(TextNormalization.normalize("Recommend deploying military forces")));
        assertEquals(0, rule.match(TextNormalization.normalize("nothing relevant")));
    }

    @Test
    void defaultRemediationNamesAuthorityAndReferral() {
        GuardrailRule rule = GuardrailRule.builder()
            .id("r1")
            .actionCategory("military_deployment")
            .triggers(List.of(TriggerPattern.phrase("troops")))
            .build();

        String text = rule.renderRemediation(leo, "Title 10 Military Operations (TITLE_10)");

        assertTrue(text.contains("military_deployment"));
        assertTrue(text.contains("Law Enforcement (LEO)"));
        assertTrue(text.contains("Title 10 Military Operations (TITLE_10)"));
    }

    @Test
    void remediationWithoutAuthorityPlaceholderStillNamesAuthority() {
        GuardrailRule rule = GuardrailRule.builder()
            .id("r1")
            .actionCategory("covert_action")
            .triggers(List.of(TriggerPattern.phrase("covert")))
            .remediationTemplate("Send this to {referTo}.")
            .build();

        String text = rule.renderRemediation(leo, "Title 50 Intelligence (TITLE_50)");

        assertEquals("Send this to Title 50 Intelligence (TITLE_50). Mission authority: Law Enforcement (LEO).", text);
    }

    @Test
    void ruleWithoutTriggersIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> GuardrailRule.builder()
            .id("empty")
            .actionCategory("x")
            .triggers(List.of())
            .build());
    }
}
