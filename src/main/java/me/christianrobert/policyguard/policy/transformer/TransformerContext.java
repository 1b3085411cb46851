package me.christianrobert.policyguard.policy.transformer;

import me.christianrobert.policyguard.schema.model.PolicyOperation;
import me.christianrobert.policyguard.sql.node.SqlNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable compilation context of {@link ExpressionTransformer}. Every {@code with...} method returns a copy.
 *
 * <ul>
 *   <li>{@code modelOrType}/{@code alias}: where unqualified field names resolve;</li>
 *   <li>{@code thisType}/{@code thisAlias}: what {@code this} refers to, fixed for the whole compilation;</li>
 *   <li>{@code memberFilter}/{@code memberSelect}: filter and projection for the innermost relation subquery
 *       of the expression being compiled;</li>
 *   <li>{@code contextValue}: a principal-data element fields are read from instead of columns;</li>
 *   <li>{@code depth}: how many relation subqueries enclose the current position. A subquery opened at
 *       depth {@code d} aliases its table {@code $r<d+1>}, so aliases never repeat along a nesting path.</li>
 * </ul>
 */
public class TransformerContext {

    private final String modelOrType;
    private final String alias;
    private final PolicyOperation operation;
    private final Map<String, Object> principal;
    private final SqlNode memberFilter;
    private final SqlNode memberSelect;
    private final Object contextValue;
    private final boolean hasContextValue;
    private final Map<String, BindingScope> bindings;
    private final String thisType;
    private final String thisAlias;
    private final int depth;

    private TransformerContext(String modelOrType, String alias, PolicyOperation operation,
                               Map<String, Object> principal, SqlNode memberFilter, SqlNode memberSelect,
                               Object contextValue, boolean hasContextValue, Map<String, BindingScope> bindings,
                               String thisType, String thisAlias, int depth) {
        this.modelOrType = modelOrType;
        this.alias = alias;
        this.operation = operation;
        this.principal = principal;
        this.memberFilter = memberFilter;
        this.memberSelect = memberSelect;
        this.contextValue = contextValue;
        this.hasContextValue = hasContextValue;
        this.bindings = bindings;
        this.thisType = thisType;
        this.thisAlias = thisAlias;
        this.depth = depth;
    }

    /**
     * Root context for compiling a policy of {@code model}.
     *
     * @param alias     alias the model's table is referenced by, or {@code null} for its table name
     * @param principal the current principal, or {@code null} when anonymous
     */
    public static TransformerContext forModel(String model, String alias, PolicyOperation operation,
                                              Map<String, Object> principal) {
        return forModel(model, alias, operation, principal, 0);
    }

    /**
     * Root context for a policy compiled inside {@code depth} enclosing relation subqueries.
     */
    public static TransformerContext forModel(String model, String alias, PolicyOperation operation,
                                              Map<String, Object> principal, int depth) {
        return new TransformerContext(model, alias, operation, principal, null, null, null, false,
                Collections.emptyMap(), model, alias, depth);
    }

    // ========== Copies ==========

    public TransformerContext withModel(String newModelOrType, String newAlias) {
        return new TransformerContext(newModelOrType, newAlias, operation, principal, memberFilter, memberSelect,
                contextValue, hasContextValue, bindings, thisType, thisAlias, depth);
    }

    public TransformerContext withMemberFilter(SqlNode filter) {
        return new TransformerContext(modelOrType, alias, operation, principal, filter, memberSelect,
                contextValue, hasContextValue, bindings, thisType, thisAlias, depth);
    }

    public TransformerContext withMemberSelect(SqlNode select) {
        return new TransformerContext(modelOrType, alias, operation, principal, memberFilter, select,
                contextValue, hasContextValue, bindings, thisType, thisAlias, depth);
    }

    public TransformerContext withoutMember() {
        return new TransformerContext(modelOrType, alias, operation, principal, null, null,
                contextValue, hasContextValue, bindings, thisType, thisAlias, depth);
    }

    public TransformerContext withContextValue(Object value) {
        return new TransformerContext(modelOrType, alias, operation, principal, memberFilter, memberSelect,
                value, true, bindings, thisType, thisAlias, depth);
    }

    public TransformerContext withoutContextValue() {
        return new TransformerContext(modelOrType, alias, operation, principal, memberFilter, memberSelect,
                null, false, bindings, thisType, thisAlias, depth);
    }

    /**
     * Copy positioned {@code levels} relation subqueries deeper.
     */
    public TransformerContext nested(int levels) {
        return new TransformerContext(modelOrType, alias, operation, principal, memberFilter, memberSelect,
                contextValue, hasContextValue, bindings, thisType, thisAlias, depth + levels);
    }

    public TransformerContext withBinding(String name, BindingScope scope) {
        Map<String, BindingScope> newBindings = new LinkedHashMap<>(bindings);
        newBindings.put(name, scope);
        return new TransformerContext(modelOrType, alias, operation, principal, memberFilter, memberSelect,
                contextValue, hasContextValue, Collections.unmodifiableMap(newBindings), thisType, thisAlias, depth);
    }

    // ========== Accessors ==========

    public String getModelOrType() {
        return modelOrType;
    }

    public String getAlias() {
        return alias;
    }

    public PolicyOperation getOperation() {
        return operation;
    }

    public Map<String, Object> getPrincipal() {
        return principal;
    }

    public SqlNode getMemberFilter() {
        return memberFilter;
    }

    public SqlNode getMemberSelect() {
        return memberSelect;
    }

    public Object getContextValue() {
        return contextValue;
    }

    public boolean hasContextValue() {
        return hasContextValue;
    }

    public Map<String, BindingScope> getBindings() {
        return bindings;
    }

    public BindingScope getBinding(String name) {
        return bindings.get(name);
    }

    public String getThisType() {
        return thisType;
    }

    public String getThisAlias() {
        return thisAlias;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Alias of the table of a relation subquery opened at this depth.
     */
    public String relationAlias() {
        return ExpressionTransformer.RELATION_ALIAS_PREFIX + (depth + 1);
    }

    /**
     * Alias of the join table of a many-to-many subquery opened at this depth.
     */
    public String joinTableAlias() {
        return ExpressionTransformer.JOIN_TABLE_ALIAS_PREFIX + (depth + 1);
    }

    /**
     * Values of the bindings that stand for plain values, for compile-time evaluation.
     */
    public Map<String, Object> getBindingValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, BindingScope> entry : bindings.entrySet()) {
            if (entry.getValue().hasValue()) {
                values.put(entry.getKey(), entry.getValue().getValue());
            }
        }
        return values;
    }

    @Override
    public String toString() {
        return "TransformerContext{modelOrType='" + modelOrType + "', alias='" + alias + "', operation=" + operation
                + ", thisType='" + thisType + "', depth=" + depth + ", bindings=" + bindings.keySet() + "}";
    }
}
