package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

/**
 * {@code *} or {@code table.*}.
 */
public class SelectAllNode implements SqlNode {

    private final String table;

    public SelectAllNode(String table) {
        this.table = table;
    }

    public static SelectAllNode all() {
        return new SelectAllNode(null);
    }

    public String getTable() {
        return table;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitSelectAll(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectAllNode)) return false;
        return Objects.equals(table, ((SelectAllNode) o).table);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(table);
    }

    @Override
    public String toString() {
        return table != null ? table + ".*" : "*";
    }
}
