package me.christianrobert.policyguard.sql.node;

import java.util.List;
import java.util.Objects;

/**
 * {@code DELETE FROM table [AS alias] [USING using] [WHERE where] [RETURNING ...]}.
 */
public class DeleteQueryNode implements MutationStatement {

    private final TableNode table;
    private final String alias;
    private final List<SqlNode> using;
    private final SqlNode where;
    private final List<SqlNode> returning;

    public DeleteQueryNode(TableNode table, String alias, List<SqlNode> using, SqlNode where,
                           List<SqlNode> returning) {
        this.table = Objects.requireNonNull(table, "table");
        this.alias = alias;
        this.using = using == null ? List.of() : List.copyOf(using);
        this.where = where;
        this.returning = returning == null ? List.of() : List.copyOf(returning);
    }

    public TableNode getTable() {
        return table;
    }

    public String getAlias() {
        return alias;
    }

    public List<SqlNode> getUsing() {
        return using;
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

    public DeleteQueryNode withWhere(SqlNode newWhere) {
        return new DeleteQueryNode(table, alias, using, newWhere, returning);
    }

    @Override
    public DeleteQueryNode withReturning(List<SqlNode> newReturning) {
        return new DeleteQueryNode(table, alias, using, where, newReturning);
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.DELETE;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitDelete(this);
    }

    @Override
    public String toString() {
        return "DELETE FROM " + table + (where != null ? " WHERE " + where : "");
    }
}
