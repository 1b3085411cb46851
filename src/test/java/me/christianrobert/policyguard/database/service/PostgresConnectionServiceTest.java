package me.christianrobert.policyguard.database.service;

import me.christianrobert.policyguard.config.service.ConfigService;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PostgresConnectionServiceTest {

    @Test
    void blankUrlIsNotConfigured() {
        ConfigService config = new ConfigService();
        config.setConfigValue(ConfigService.POSTGRES_URL, "  ");

        assertFalse(new PostgresConnectionService(config).isConfigured());
    }

    @Test
    void defaultsAreConfigured() {
        assertTrue(new PostgresConnectionService(new ConfigService()).isConfigured());
    }

    @Test
    void failedConnectionIsReportedNotThrown() {
        ConfigService config = new ConfigService();
        config.setConfigValue(ConfigService.POSTGRES_URL, "jdbc:postgresql://127.0.0.1:1/none?connectTimeout=1");

        Map<String, Object> result = new PostgresConnectionService(config).testConnection();

        assertEquals("error", result.get("status"));
        assertEquals(false, result.get("connected"));
        assertTrue(result.containsKey("message"));
    }
}
