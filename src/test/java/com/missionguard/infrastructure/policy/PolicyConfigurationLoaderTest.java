package com.missionguard.infrastructure.policy;

import com.missionguard.TestFixtures;
import com.missionguard.application.exceptions.PolicyConfigException;
import com.missionguard.config.EngineProperties;
import com.missionguard.domain.model.Authority;
import com.missionguard.domain.model.IntLane;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyConfigurationLoaderTest {

    private static PolicyConfigurationLoader loaderFor(String location) {
        EngineProperties properties = TestFixtures.properties();
        properties.getPolicy().setLocation(location);
        return TestFixtures.loader(properties);
    }

    @Test
    void loadsBundledPolicy() {
        PolicyRegistry registry = TestFixtures.defaultRegistry();

        assertEquals(4, registry.getAuthorities().size());
        assertEquals("domestic_arrest", registry.getRules().get(0).getId());
        assertTrue(registry.getVersion().startsWith("sha256:"));

        Authority title10 = registry.requireAuthority("TITLE_10");
        assertTrue(title10.isFoundational(IntLane.SIGINT));
        assertTrue(title10.isBlocked("domestic_arrest"));
        assertTrue(title10.allows("military_deployment"));
    }

    @Test
    void rulesKeepDeclarationOrder() {
        PolicyRegistry registry = TestFixtures.defaultRegistry();

        for (int i = 0; i < registry.getRules().size(); i++) {
            assertEquals(i, registry.getRules().get(i).getDeclarationIndex());
        }
    }

    @Test
    void actionCategoriesKeepFileOrder() {
        Authority title10 = TestFixtures.defaultRegistry().requireAuthority("TITLE_10");

        assertEquals(List.of("domestic_arrest", "domestic_surveillance", "covert_action", "asset_seizure"),
            new ArrayList<>(title10.getBlockedActionCategories()));
        assertEquals(List.of("military_deployment", "kinetic_targeting", "force_protection"),
            new ArrayList<>(title10.getAllowedActionCategories()));
    }

    @Test
    void explicitVersionIsUsed() {
        PolicyRegistry registry = loaderFor("classpath:policy/alt-policy.yml").load();

        assertEquals("alt-1", registry.getVersion());
        assertTrue(registry.findTemplate("brief").isPresent());
    }

    @Test
    void derivedVersionChangesWithContent() {
        PolicyConfigurationLoader loader = TestFixtures.loader(TestFixtures.properties());
        String base = """
            authorities:
              - id: HOME
            templates:
              - id: brief
                allowedAuthorities: [HOME]
                sections:
                  - name: Overview
                    fallback: Overview unavailable.
            """;

        String first = loader.parse(base.getBytes(StandardCharsets.UTF_8)).getVersion();
        String again = loader.parse(base.getBytes(StandardCharsets.UTF_8)).getVersion();
        String edited = loader.parse(base.replace("Overview unavailable.", "No overview.")
            .getBytes(StandardCharsets.UTF_8)).getVersion();

        assertEquals(first, again);
        assertNotEquals(first, edited);
    }

    @Test
    void rejectsCategoryBothAllowedAndBlocked() {
        PolicyConfigException e = assertThrows(PolicyConfigException.class,
            () -> loaderFor("classpath:policy/overlapping-categories.yml").load());

        assertTrue(e.getMessage().contains("both allows and blocks"), e.getMessage());
    }

    @Test
    void rejectsTemplateWithUnknownAuthority() {
        PolicyConfigException e = assertThrows(PolicyConfigException.class,
            () -> loaderFor("classpath:policy/unknown-template-authority.yml").load());

        assertTrue(e.getMessage().contains("ELSEWHERE"), e.getMessage());
    }

    @Test
    void rejectsSectionWithoutFallback() {
        assertThrows(PolicyConfigException.class,
            () -> loaderFor("classpath:policy/missing-fallback.yml").load());
    }

    @Test
    void rejectsMissingFileAndUnknownKeys() {
        assertThrows(PolicyConfigException.class, () -> loaderFor("classpath:policy/nope.yml").load());
        PolicyConfigurationLoader loader = TestFixtures.loader(TestFixtures.properties());
        assertThrows(PolicyConfigException.class,
            () -> loader.parse("authorities: []\nbogus: 1\n".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void malformedYamlIsReportedAsPolicyError() {
        PolicyConfigurationLoader loader = TestFixtures.loader(TestFixtures.properties());

        PolicyConfigException e = assertThrows(PolicyConfigException.class,
            () -> loader.parse("authorities: [\n  - id: HOME\n".getBytes(StandardCharsets.UTF_8)));

        assertTrue(e.getMessage().startsWith("Malformed policy configuration"), e.getMessage());
    }
}
