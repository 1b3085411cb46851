package me.christianrobert.policyguard.sql.node;

import java.util.List;
import java.util.Objects;

/**
 * {@code UPDATE table [AS alias] SET updates [FROM from] [WHERE where] [RETURNING ...]}.
 */
public class UpdateQueryNode implements MutationStatement {

    private final TableNode table;
    private final String alias;
    private final List<ColumnUpdateNode> updates;
    private final List<SqlNode> from;
    private final SqlNode where;
    private final List<SqlNode> returning;

    public UpdateQueryNode(TableNode table, String alias, List<ColumnUpdateNode> updates, List<SqlNode> from,
                           SqlNode where, List<SqlNode> returning) {
        this.table = Objects.requireNonNull(table, "table");
        this.alias = alias;
        if (updates.isEmpty()) {
            throw new IllegalArgumentException("Update requires at least one assignment");
        }
        this.updates = List.copyOf(updates);
        this.from = from == null ? List.of() : List.copyOf(from);
        this.where = where;
        this.returning = returning == null ? List.of() : List.copyOf(returning);
    }

    public TableNode getTable() {
        return table;
    }

    public String getAlias() {
        return alias;
    }

    public List<ColumnUpdateNode> getUpdates() {
        return updates;
    }

    public List<SqlNode> getFrom() {
        return from;
    }

    public SqlNode getWhere() {
        return where;
    }

    @Override
    public List<SqlNode> getReturning() {
        return returning;
    }

    @Override
    public TableNode getTargetTable() {
        return table;
    }

    @Override
    public String getTargetAlias() {
        return alias;
    }

    public UpdateQueryNode withWhere(SqlNode newWhere) {
        return new UpdateQueryNode(table, alias, updates, from, newWhere, returning);
    }

    @Override
    public UpdateQueryNode withReturning(List<SqlNode> newReturning) {
        return new UpdateQueryNode(table, alias, updates, from, where, newReturning);
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.UPDATE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitUpdate(this);
    }

    @Override
    public String toString() {
        return "UPDATE " + table + " SET " + updates + (where != null ? " WHERE " + where : "");
    }
}
