package com.missionguard.infrastructure.policy;

import com.missionguard.TestFixtures;
import com.missionguard.application.exceptions.PolicyConfigException;
import com.missionguard.config.EngineProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PolicyRegistryHolderTest {

    @Test
    void reloadSwapsInNewRegistry() {
        EngineProperties properties = TestFixtures.properties();
        PolicyRegistryHolder holder = new PolicyRegistryHolder(TestFixtures.loader(properties));
        PolicyRegistry before = holder.current();

        properties.getPolicy().setLocation("classpath:policy/alt-policy.yml");
        String version = holder.reload();

        assertEquals("alt-1", version);
        assertNotSame(before, holder.current());
        assertTrue(holder.current().findAuthority("HOME").isPresent());
        // the old snapshot is untouched
        assertTrue(before.findAuthority("TITLE_10").isPresent());
        assertTrue(before.findAuthority("HOME").isEmpty());
    }

    @Test
    void invalidReloadKeepsPreviousRegistry() {
        EngineProperties properties = TestFixtures.properties();
        PolicyRegistryHolder holder = new PolicyRegistryHolder(TestFixtures.loader(properties));
        PolicyRegistry before = holder.current();

        properties.getPolicy().setLocation("classpath:policy/overlapping-categories.yml");

        assertThrows(PolicyConfigException.class, holder::reload);
        assertSame(before, holder.current());
    }
}
