package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

/**
 * Join clause of a select. The table is a {@link TableNode}, or an {@link AliasNode} over a table,
 * a sub-select or a {@link ValuesNode}.
 */
public class JoinNode {

    public enum JoinType {
        INNER("INNER JOIN"),
        LEFT("LEFT JOIN");

        private final String sql;

        JoinType(String sql) {
            this.sql = sql;
        }

        public String getSql() {
            return sql;
        }
    }

    private final JoinType type;
    private final SqlNode table;
    private final SqlNode on;

    public JoinNode(JoinType type, SqlNode table, SqlNode on) {
        this.type = Objects.requireNonNull(type, "type");
        this.table = Objects.requireNonNull(table, "table");
        this.on = Objects.requireNonNull(on, "on");
    }

    public JoinType getType() {
        return type;
    }

    public SqlNode getTable() {
        return table;
    }

    public SqlNode getOn() {
        return on;
    }

    public JoinNode withTable(SqlNode newTable) {
        return new JoinNode(type, newTable, on);
    }

    public JoinNode withOn(SqlNode newOn) {
        return new JoinNode(type, table, newOn);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JoinNode)) return false;
        JoinNode that = (JoinNode) o;
        return type == that.type && table.equals(that.table) && on.equals(that.on);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, table, on);
    }

    @Override
    public String toString() {
        return type.getSql() + " " + table + " ON " + on;
    }
}
