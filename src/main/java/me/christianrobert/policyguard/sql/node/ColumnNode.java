package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

/**
 * Column reference, optionally qualified with a table name or alias.
 */
public class ColumnNode implements SqlNode {

    private final String table;
    private final String column;

    public ColumnNode(String table, String column) {
        this.table = table;
        this.column = Objects.requireNonNull(column, "column");
    }

    public static ColumnNode of(String column) {
        return new ColumnNode(null, column);
    }

    public static ColumnNode of(String table, String column) {
        return new ColumnNode(table, column);
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitColumn(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnNode)) return false;
        ColumnNode that = (ColumnNode) o;
        return Objects.equals(table, that.table) && column.equals(that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, column);
    }

    @Override
    public String toString() {
        return table != null ? table + "." + column : column;
    }
}
