package me.christianrobert.policyguard.client;

import me.christianrobert.policyguard.executor.QueryExecutor;
import me.christianrobert.policyguard.executor.QueryResult;
import me.christianrobert.policyguard.policy.handler.PolicyHandler;
import me.christianrobert.policyguard.policy.registry.PolicyRegistry;
import me.christianrobert.policyguard.schema.model.ModelDefinition;
import me.christianrobert.policyguard.sql.node.SqlStatement;

import java.util.Collections;
import java.util.Map;

/**
 * Entry point for policy-checked data access on behalf of one principal.
 *
 * <p>Instances are immutable; {@link #withPrincipal(Map)} returns a new client bound to another principal
 * that shares the compiled policies.
 */
public class PolicyClient {

    private final PolicyRegistry registry;
    private final PolicyHandler handler;
    private final QueryExecutor executor;
    private final JsonValueCodec jsonCodec;
    private final Map<String, Object> principal;

    public PolicyClient(PolicyRegistry registry, PolicyHandler handler, QueryExecutor executor) {
        this(registry, handler, executor, new JsonValueCodec(), null);
    }

    private PolicyClient(PolicyRegistry registry, PolicyHandler handler, QueryExecutor executor,
                         JsonValueCodec jsonCodec, Map<String, Object> principal) {
        this.registry = registry;
        this.handler = handler;
        this.executor = executor;
        this.jsonCodec = jsonCodec;
        this.principal = principal == null ? null : Collections.unmodifiableMap(principal);
    }

    /**
     * @param principal the principal, or {@code null} for anonymous access
     */
    public PolicyClient withPrincipal(Map<String, Object> principal) {
        return new PolicyClient(registry, handler, executor, jsonCodec, principal);
    }

    public Map<String, Object> getPrincipal() {
        return principal;
    }

    /**
     * @throws IllegalArgumentException if the schema has no such model
     */
    public ModelClient model(String name) {
        ModelDefinition model = registry.getSchema().getModel(name);
        if (model == null) {
            throw new IllegalArgumentException("Unknown model: " + name);
        }
        return new ModelClient(model, registry.getDialect(), jsonCodec, this);
    }

    /**
     * Runs an arbitrary statement tree under this client's principal.
     */
    public QueryResult execute(SqlStatement statement) {
        return handler.handle(statement, principal, executor);
    }

    /**
     * @return the policy-filtered form of a select, without running it
     */
    public SqlStatement transformQuery(SqlStatement select) {
        return handler.transformQuery(select, principal);
    }
}
