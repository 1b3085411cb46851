package me.christianrobert.policyguard.config.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(ConfigService.POLICY_LOG_SQL);
        System.clearProperty(ConfigService.POSTGRES_URL);
    }

    @Test
    void defaults() {
        ConfigService config = new ConfigService();

        assertEquals("postgresql", config.getConfigValueAsString(ConfigService.POLICY_DIALECT));
        assertTrue(config.getConfigValueAsBoolean(ConfigService.POLICY_MUTATION_TRANSACTIONAL));
        assertFalse(config.getConfigValueAsBoolean(ConfigService.POLICY_LOG_SQL, true));
        assertTrue(config.hasConfigKey(ConfigService.POSTGRES_URL));
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty(ConfigService.POLICY_LOG_SQL, "TRUE");
        System.setProperty(ConfigService.POSTGRES_URL, "jdbc:postgresql://db:5432/app");

        ConfigService config = new ConfigService();

        assertEquals(Boolean.TRUE, config.getConfigValue(ConfigService.POLICY_LOG_SQL));
        assertEquals("jdbc:postgresql://db:5432/app", config.getConfigValueAsString(ConfigService.POSTGRES_URL));
    }

    @Test
    void stringFlagsAreStoredAsBooleans() {
        ConfigService config = new ConfigService();

        config.updateConfiguration(Map.of(ConfigService.POLICY_MUTATION_TRANSACTIONAL, "false"));

        assertEquals(Boolean.FALSE, config.getConfigValue(ConfigService.POLICY_MUTATION_TRANSACTIONAL));
        assertThrows(IllegalArgumentException.class,
                () -> config.setConfigValue(ConfigService.POLICY_LOG_SQL, "sometimes"));
        assertThrows(IllegalArgumentException.class, () -> config.setConfigValue(ConfigService.POSTGRES_URL, null));
    }

    @Test
    void missingBooleanFallsBackToDefault() {
        ConfigService config = new ConfigService();

        assertNull(config.getConfigValueAsBoolean("policy.unknown"));
        assertTrue(config.getConfigValueAsBoolean("policy.unknown", true));
    }

    @Test
    void passwordsAreMaskedInSnapshot() {
        ConfigService config = new ConfigService();
        config.setConfigValue(ConfigService.POSTGRES_PASSWORD, "secret");

        assertEquals("****", config.getAllConfiguration().get(ConfigService.POSTGRES_PASSWORD));
        assertEquals("secret", config.getConfigValueAsString(ConfigService.POSTGRES_PASSWORD));
    }

    @Test
    void resetRestoresDefaults() {
        ConfigService config = new ConfigService();
        config.setConfigValue(ConfigService.POLICY_DIALECT, "mysql");
        config.setConfigValue("custom.key", "value");

        config.resetToDefaults();

        assertEquals("postgresql", config.getConfigValueAsString(ConfigService.POLICY_DIALECT));
        assertFalse(config.hasConfigKey("custom.key"));
    }
}
