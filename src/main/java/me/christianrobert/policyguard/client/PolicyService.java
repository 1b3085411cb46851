package me.christianrobert.policyguard.client;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.policyguard.config.service.ConfigService;
import me.christianrobert.policyguard.database.service.PostgresConnectionService;
import me.christianrobert.policyguard.executor.JdbcQueryExecutor;
import me.christianrobert.policyguard.policy.function.FunctionRegistry;
import me.christianrobert.policyguard.policy.handler.PolicyHandler;
import me.christianrobert.policyguard.policy.registry.PolicyRegistry;
import me.christianrobert.policyguard.schema.model.SchemaDefinition;
import me.christianrobert.policyguard.sql.dialect.PostgresDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires schema, policy registry, handler and executor into {@link PolicyClient}s.
 */
@ApplicationScoped
public class PolicyService {

    private static final Logger log = LoggerFactory.getLogger(PolicyService.class);

    @Inject
    ConfigService configService;

    @Inject
    PostgresConnectionService connectionService;

    @Inject
    PostgresDialect dialect;

    public PolicyService() {
    }

    public PolicyService(ConfigService configService, PostgresConnectionService connectionService,
                         PostgresDialect dialect) {
        this.configService = configService;
        this.connectionService = connectionService;
        this.dialect = dialect;
    }

    public PolicyClient createClient(SchemaDefinition schema) {
        return createClient(schema, FunctionRegistry.builtins());
    }

    /**
     * @param functions functions available to policy expressions, usually the builtins plus custom ones
     */
    public PolicyClient createClient(SchemaDefinition schema, FunctionRegistry functions) {
        String dialectName = configService.getConfigValueAsString(ConfigService.POLICY_DIALECT);
        if (!dialect.getName().equals(dialectName)) {
            throw new IllegalStateException("Unsupported SQL dialect: " + dialectName);
        }
        boolean transactional = configService.getConfigValueAsBoolean(ConfigService.POLICY_MUTATION_TRANSACTIONAL,
                true);
        boolean logSql = configService.getConfigValueAsBoolean(ConfigService.POLICY_LOG_SQL, false);

        PolicyRegistry registry = new PolicyRegistry(schema, dialect, functions);
        PolicyHandler handler = new PolicyHandler(registry, transactional);
        JdbcQueryExecutor executor = new JdbcQueryExecutor(connectionService, dialect, logSql);

        log.info("Created policy client for {} models (dialect: {}, transactional mutations: {})",
                schema.getModels().size(), dialectName, transactional);
        return new PolicyClient(registry, handler, executor);
    }
}
