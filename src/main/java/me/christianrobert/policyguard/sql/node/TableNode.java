package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

public class TableNode implements SqlNode {

    private final String table;

    public TableNode(String table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public static TableNode of(String table) {
        return new TableNode(table);
    }

    public String getTable() {
        return table;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitTable(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableNode)) return false;
        return table.equals(((TableNode) o).table);
    }

    @Override
    public int hashCode() {
        return table.hashCode();
    }

    @Override
    public String toString() {
        return table;
    }
}
