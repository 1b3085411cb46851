package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

/**
 * {@code column = value} assignment of an update or an upsert.
 */
public class ColumnUpdateNode {

    private final String column;
    private final SqlNode value;

    public ColumnUpdateNode(String column, SqlNode value) {
        this.column = Objects.requireNonNull(column, "column");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getColumn() {
        return column;
    }

    public SqlNode getValue() {
        return value;
    }

    public ColumnUpdateNode withValue(SqlNode newValue) {
        return new ColumnUpdateNode(column, newValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnUpdateNode)) return false;
        ColumnUpdateNode that = (ColumnUpdateNode) o;
        return column.equals(that.column) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, value);
    }

    @Override
    public String toString() {
        return column + " = " + value;
    }
}
