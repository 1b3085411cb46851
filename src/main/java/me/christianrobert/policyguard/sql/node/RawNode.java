package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

/**
 * SQL fragment rendered verbatim, e.g. {@code CURRENT_TIMESTAMP}. Never built from user input.
 */
public class RawNode implements SqlNode {

    private final String sql;

    public RawNode(String sql) {
        this.sql = Objects.requireNonNull(sql, "sql");
    }

    public String getSql() {
        return sql;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitRaw(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawNode)) return false;
        return sql.equals(((RawNode) o).sql);
    }

    @Override
    public int hashCode() {
        return sql.hashCode();
    }

    @Override
    public String toString() {
        return sql;
    }
}
