package me.christianrobert.policyguard.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime configuration of the policy engine and its database connection.
 *
 * <p>Values are seeded with defaults, then overridden by JVM system properties of the same name
 * (for example {@code -Dpostgres.url=...}), and can be changed at runtime. Clients read the
 * {@code policy.*} keys when they are created; later changes only affect clients created afterwards.
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String POLICY_DIALECT = "policy.dialect";
    public static final String POLICY_MUTATION_TRANSACTIONAL = "policy.mutation.transactional";
    public static final String POLICY_LOG_SQL = "policy.log-sql";
    public static final String POSTGRES_URL = "postgres.url";
    public static final String POSTGRES_USERNAME = "postgres.username";
    public static final String POSTGRES_PASSWORD = "postgres.password";

    private static final Set<String> BOOLEAN_KEYS = Set.of(POLICY_MUTATION_TRANSACTIONAL, POLICY_LOG_SQL);

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
        applySystemPropertyOverrides();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(POLICY_DIALECT, "postgresql");
        configuration.put(POLICY_MUTATION_TRANSACTIONAL, true);
        configuration.put(POLICY_LOG_SQL, false);
        configuration.put(POSTGRES_URL, "jdbc:postgresql://localhost:5432/postgres");
        configuration.put(POSTGRES_USERNAME, "postgres");
        configuration.put(POSTGRES_PASSWORD, "postgres");

        log.info("Configuration service initialized with default values");
    }

    private void applySystemPropertyOverrides() {
        int applied = 0;
        for (String key : configuration.keySet()) {
            String override = System.getProperty(key);
            if (override != null) {
                configuration.put(key, coerce(key, override));
                applied++;
            }
        }
        if (applied > 0) {
            log.info("Applied {} configuration override(s) from system properties", applied);
        }
    }

    /**
     * @return a copy of the configuration with passwords masked
     */
    public Map<String, Object> getAllConfiguration() {
        Map<String, Object> copy = new LinkedHashMap<>();
        configuration.forEach((key, value) -> copy.put(key, maskSecret(key, value)));
        return copy;
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    public boolean getConfigValueAsBoolean(String key, boolean defaultValue) {
        Boolean value = getConfigValueAsBoolean(key);
        return value != null ? value : defaultValue;
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());
        newConfig.forEach(this::setConfigValue);
        log.info("Configuration updated successfully");
    }

    /**
     * Sets one value. Flags given as strings are stored as booleans.
     *
     * @throws IllegalArgumentException for a null value, or a flag that is neither {@code true} nor {@code false}
     */
    public void setConfigValue(String key, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Configuration value for '" + key + "' must not be null");
        }
        if (!configuration.containsKey(key)) {
            log.warn("Setting unknown configuration key '{}'", key);
        }
        Object coerced = value instanceof String ? coerce(key, (String) value) : value;
        Object oldValue = configuration.put(key, coerced);
        log.debug("Config value set: {} = {} (was: {})", key, maskSecret(key, coerced), maskSecret(key, oldValue));
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }

    private static Object coerce(String key, String value) {
        if (!BOOLEAN_KEYS.contains(key)) {
            return value;
        }
        String trimmed = value.trim();
        if (!"true".equalsIgnoreCase(trimmed) && !"false".equalsIgnoreCase(trimmed)) {
            throw new IllegalArgumentException("Configuration flag '" + key + "' expects true or false, got '"
                    + value + "'");
        }
        return Boolean.parseBoolean(trimmed);
    }

    private static Object maskSecret(String key, Object value) {
        return key.endsWith(".password") && value != null ? "****" : value;
    }
}
