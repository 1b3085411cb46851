package me.christianrobert.policyguard.policy.function;

import me.christianrobert.policyguard.expression.CallExpression;
import me.christianrobert.policyguard.policy.transformer.ExpressionTransformer;
import me.christianrobert.policyguard.policy.transformer.PolicyFilterProvider;
import me.christianrobert.policyguard.schema.model.PolicyOperation;
import me.christianrobert.policyguard.schema.model.SchemaDefinition;
import me.christianrobert.policyguard.sql.dialect.SqlDialect;

import java.util.Map;

/**
 * Everything a {@link PolicyFunction} may look at while it is compiled.
 */
public class FunctionContext {

    private final SchemaDefinition schema;
    private final SqlDialect dialect;
    private final String model;
    private final String modelAlias;
    private final PolicyOperation operation;
    private final Map<String, Object> principal;
    private final PolicyFilterProvider policyFilters;
    private final CallExpression call;
    private final int depth;

    public FunctionContext(SchemaDefinition schema, SqlDialect dialect, String model, String modelAlias,
                           PolicyOperation operation, Map<String, Object> principal,
                           PolicyFilterProvider policyFilters, CallExpression call, int depth) {
        this.schema = schema;
        this.dialect = dialect;
        this.model = model;
        this.modelAlias = modelAlias;
        this.operation = operation;
        this.principal = principal;
        this.policyFilters = policyFilters;
        this.call = call;
        this.depth = depth;
    }

    public SchemaDefinition getSchema() {
        return schema;
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    /**
     * Model or type the call is compiled in.
     */
    public String getModel() {
        return model;
    }

    /**
     * Alias (or table name) the model's rows are referenced by.
     */
    public String getModelAlias() {
        return modelAlias;
    }

    public PolicyOperation getOperation() {
        return operation;
    }

    public Map<String, Object> getPrincipal() {
        return principal;
    }

    public PolicyFilterProvider getPolicyFilters() {
        return policyFilters;
    }

    public CallExpression getCall() {
        return call;
    }

    /**
     * Number of relation subqueries enclosing the call.
     */
    public int getDepth() {
        return depth;
    }

    /**
     * Alias for a related table the function reads from in a subquery of its own.
     */
    public String relationAlias() {
        return ExpressionTransformer.RELATION_ALIAS_PREFIX + (depth + 1);
    }
}
