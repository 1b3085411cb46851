package me.christianrobert.policyguard.sql.node;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Constant row source {@code (VALUES (...), (...))}. When aliased, the column names are rendered as the
 * alias column list: {@code (VALUES ...) AS "t"("a", "b")}.
 */
public class ValuesNode implements SqlNode {

    private final List<List<SqlNode>> rows;
    private final List<String> columnNames;

    public ValuesNode(List<List<SqlNode>> rows, List<String> columnNames) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("VALUES requires at least one row");
        }
        for (List<SqlNode> row : rows) {
            if (row.size() != columnNames.size()) {
                throw new IllegalArgumentException("VALUES row width does not match column count");
            }
        }
        this.rows = rows.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
        this.columnNames = List.copyOf(columnNames);
    }

    public List<List<SqlNode>> getRows() {
        return rows;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitValues(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValuesNode)) return false;
        ValuesNode that = (ValuesNode) o;
        return rows.equals(that.rows) && columnNames.equals(that.columnNames);
    }

    @Override
    public int hashCode() {
        return rows.hashCode() * 31 + columnNames.hashCode();
    }

    @Override
    public String toString() {
        return "VALUES" + rows;
    }
}
