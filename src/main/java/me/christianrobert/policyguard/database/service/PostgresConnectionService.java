package me.christianrobert.policyguard.database.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.policyguard.config.service.ConfigService;
import me.christianrobert.policyguard.executor.ConnectionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Opens PostgreSQL connections from the {@code postgres.*} configuration keys.
 */
@ApplicationScoped
public class PostgresConnectionService implements ConnectionProvider {

    private static final Logger log = LoggerFactory.getLogger(PostgresConnectionService.class);

    @Inject
    ConfigService configService;

    public PostgresConnectionService() {
    }

    public PostgresConnectionService(ConfigService configService) {
        this.configService = configService;
    }

    @Override
    public Connection getConnection() throws SQLException {
        String url = configService.getConfigValueAsString(ConfigService.POSTGRES_URL);
        String user = configService.getConfigValueAsString(ConfigService.POSTGRES_USERNAME);
        String password = configService.getConfigValueAsString(ConfigService.POSTGRES_PASSWORD);

        if (url == null || user == null || password == null) {
            throw new IllegalStateException("PostgreSQL connection parameters not configured");
        }

        log.debug("Creating PostgreSQL database connection to: {}", url);
        return DriverManager.getConnection(url, user, password);
    }

    /**
     * Opens and closes one connection, reporting server and driver details or the failure.
     */
    public Map<String, Object> testConnection() {
        Map<String, Object> result = new HashMap<>();
        long startTime = System.currentTimeMillis();

        try (Connection connection = getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            long connectionTime = System.currentTimeMillis() - startTime;

            result.put("status", "success");
            result.put("connected", true);
            result.put("connectionTimeMs", connectionTime);
            result.put("databaseProductVersion", metaData.getDatabaseProductVersion());
            result.put("driverVersion", metaData.getDriverVersion());

            log.info("PostgreSQL connection test successful - Connected in {}ms", connectionTime);
        } catch (SQLException e) {
            log.error("PostgreSQL connection test failed with SQL error", e);
            result.put("status", "error");
            result.put("connected", false);
            result.put("message", "Database connection failed: " + e.getMessage());
            result.put("sqlState", e.getSQLState());
        } catch (IllegalStateException e) {
            log.error("PostgreSQL connection test failed: {}", e.getMessage());
            result.put("status", "error");
            result.put("connected", false);
            result.put("message", e.getMessage());
        }

        return result;
    }

    public boolean isConfigured() {
        String url = configService.getConfigValueAsString(ConfigService.POSTGRES_URL);
        String user = configService.getConfigValueAsString(ConfigService.POSTGRES_USERNAME);

        return url != null && !url.trim().isEmpty() &&
               user != null && !user.trim().isEmpty();
    }
}
