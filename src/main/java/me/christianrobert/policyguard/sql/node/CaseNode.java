package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

/**
 * {@code CASE WHEN condition THEN result ELSE otherwise END}.
 */
public class CaseNode implements SqlNode {

    private final SqlNode condition;
    private final SqlNode result;
    private final SqlNode otherwise;

    public CaseNode(SqlNode condition, SqlNode result, SqlNode otherwise) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.result = Objects.requireNonNull(result, "result");
        this.otherwise = Objects.requireNonNull(otherwise, "otherwise");
    }

    public SqlNode getCondition() {
        return condition;
    }

    public SqlNode getResult() {
        return result;
    }

    public SqlNode getOtherwise() {
        return otherwise;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitCase(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CaseNode)) return false;
        CaseNode that = (CaseNode) o;
        return condition.equals(that.condition) && result.equals(that.result) && otherwise.equals(that.otherwise);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, result, otherwise);
    }

    @Override
    public String toString() {
        return "CASE WHEN " + condition + " THEN " + result + " ELSE " + otherwise + " END";
    }
}
