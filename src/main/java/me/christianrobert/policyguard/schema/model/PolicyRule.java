package me.christianrobert.policyguard.schema.model;

import me.christianrobert.policyguard.expression.Expression;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One {@code @@allow}/{@code @@deny} (model-level) or {@code @allow}/{@code @deny} (field-level) rule.
 */
public class PolicyRule {

    private final PolicyKind kind;
    private final Set<PolicyOperation> operations;
    private final Expression condition;
    private final String source;

    public PolicyRule(PolicyKind kind, Set<PolicyOperation> operations, Expression condition, String source) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.operations = Collections.unmodifiableSet(EnumSet.copyOf(operations));
        this.condition = Objects.requireNonNull(condition, "condition");
        this.source = source;
    }

    public PolicyKind getKind() {
        return kind;
    }

    public boolean isAllow() {
        return kind == PolicyKind.ALLOW;
    }

    public boolean isDeny() {
        return kind == PolicyKind.DENY;
    }

    public Set<PolicyOperation> getOperations() {
        return operations;
    }

    public boolean appliesTo(PolicyOperation operation) {
        return operations.contains(operation);
    }

    public Expression getCondition() {
        return condition;
    }

    /**
     * @return the condition text the rule was declared with, or {@code null} for programmatic rules
     */
    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return (kind == PolicyKind.ALLOW ? "@@allow" : "@@deny") + "(" + operations + ", "
                + (source != null ? source : condition) + ")";
    }
}
