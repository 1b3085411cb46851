package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

public class OrderByNode {

    private final SqlNode expression;
    private final boolean descending;

    public OrderByNode(SqlNode expression, boolean descending) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.descending = descending;
    }

    public SqlNode getExpression() {
        return expression;
    }

    public boolean isDescending() {
        return descending;
    }

    public OrderByNode withExpression(SqlNode newExpression) {
        return new OrderByNode(newExpression, descending);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderByNode)) return false;
        OrderByNode that = (OrderByNode) o;
        return descending == that.descending && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, descending);
    }

    @Override
    public String toString() {
        return expression + (descending ? " DESC" : " ASC");
    }
}
