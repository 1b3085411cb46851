package me.christianrobert.policyguard.sql.node;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code INSERT INTO table (columns) VALUES rows [ON CONFLICT ...] [RETURNING ...]}.
 */
public class InsertQueryNode implements MutationStatement {

    private final TableNode into;
    private final List<String> columns;
    private final List<List<SqlNode>> rows;
    private final OnConflictNode onConflict;
    private final List<SqlNode> returning;

    public InsertQueryNode(TableNode into, List<String> columns, List<List<SqlNode>> rows,
                           OnConflictNode onConflict, List<SqlNode> returning) {
        this.into = Objects.requireNonNull(into, "into");
        this.columns = List.copyOf(columns);
        this.rows = rows.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
        for (List<SqlNode> row : this.rows) {
            if (row.size() != this.columns.size()) {
                throw new IllegalArgumentException("Insert row width does not match column count");
            }
        }
        this.onConflict = onConflict;
        this.returning = returning == null ? List.of() : List.copyOf(returning);
    }

    public TableNode getInto() {
        return into;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<SqlNode>> getRows() {
        return rows;
    }

    /**
     * @return the conflict clause, or {@code null}
     */
    public OnConflictNode getOnConflict() {
        return onConflict;
    }

    @Override
    public List<SqlNode> getReturning() {
        return returning;
    }

    @Override
    public TableNode getTargetTable() {
        return into;
    }

    @Override
    public String getTargetAlias() {
        return null;
    }

    public InsertQueryNode withOnConflict(OnConflictNode newOnConflict) {
        return new InsertQueryNode(into, columns, rows, newOnConflict, returning);
    }

    @Override
    public InsertQueryNode withReturning(List<SqlNode> newReturning) {
        return new InsertQueryNode(into, columns, rows, onConflict, newReturning);
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.INSERT;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitInsert(this);
    }

    @Override
    public String toString() {
        return "INSERT INTO " + into + " " + columns + " VALUES " + rows;
    }
}
