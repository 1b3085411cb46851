package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

public class ExistsNode implements SqlNode {

    private final SelectQueryNode query;

    public ExistsNode(SelectQueryNode query) {
        this.query = Objects.requireNonNull(query, "query");
    }

    public SelectQueryNode getQuery() {
        return query;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitExists(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExistsNode)) return false;
        return query.equals(((ExistsNode) o).query);
    }

    @Override
    public int hashCode() {
        return query.hashCode();
    }

    @Override
    public String toString() {
        return "EXISTS(" + query + ")";
    }
}
