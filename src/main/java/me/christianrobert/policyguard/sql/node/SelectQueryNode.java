package me.christianrobert.policyguard.sql.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code SELECT selections FROM from joins WHERE where ORDER BY orderBy LIMIT limit}.
 *
 * <p>Used both as a top-level statement and nested (sub-selects in expressions and table sources).
 * An empty selection list renders as {@code SELECT 1}.
 */
public class SelectQueryNode implements SqlStatement {

    private final List<SqlNode> from;
    private final List<JoinNode> joins;
    private final List<SqlNode> selections;
    private final SqlNode where;
    private final List<OrderByNode> orderBy;
    private final Integer limit;

    private SelectQueryNode(Builder builder) {
        this.from = List.copyOf(builder.from);
        this.joins = List.copyOf(builder.joins);
        this.selections = List.copyOf(builder.selections);
        this.where = builder.where;
        this.orderBy = List.copyOf(builder.orderBy);
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * {@code SELECT * FROM table}.
     */
    public static SelectQueryNode selectAllFrom(String table) {
        return builder().from(TableNode.of(table)).select(SelectAllNode.all()).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.from.addAll(from);
        builder.joins.addAll(joins);
        builder.selections.addAll(selections);
        builder.where = where;
        builder.orderBy.addAll(orderBy);
        builder.limit = limit;
        return builder;
    }

    public List<SqlNode> getFrom() {
        return from;
    }

    public List<JoinNode> getJoins() {
        return joins;
    }

    public List<SqlNode> getSelections() {
        return selections;
    }

    /**
     * @return the WHERE predicate, or {@code null}
     */
    public SqlNode getWhere() {
        return where;
    }

    public List<OrderByNode> getOrderBy() {
        return orderBy;
    }

    public Integer getLimit() {
        return limit;
    }

    public SelectQueryNode withWhere(SqlNode newWhere) {
        return toBuilder().where(newWhere).build();
    }

    public SelectQueryNode withSelections(List<SqlNode> newSelections) {
        return toBuilder().select(newSelections).build();
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.SELECT;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitSelect(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectQueryNode)) return false;
        SelectQueryNode that = (SelectQueryNode) o;
        return from.equals(that.from) && joins.equals(that.joins) && selections.equals(that.selections)
                && Objects.equals(where, that.where) && orderBy.equals(that.orderBy)
                && Objects.equals(limit, that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, joins, selections, where, orderBy, limit);
    }

    @Override
    public String toString() {
        return "SELECT " + selections + " FROM " + from + (joins.isEmpty() ? "" : " " + joins)
                + (where != null ? " WHERE " + where : "");
    }

    public static class Builder {
        private final List<SqlNode> from = new ArrayList<>();
        private final List<JoinNode> joins = new ArrayList<>();
        private final List<SqlNode> selections = new ArrayList<>();
        private SqlNode where;
        private final List<OrderByNode> orderBy = new ArrayList<>();
        private Integer limit;

        public Builder from(SqlNode... tables) {
            from.addAll(List.of(tables));
            return this;
        }

        public Builder from(List<? extends SqlNode> tables) {
            from.clear();
            from.addAll(tables);
            return this;
        }

        public Builder join(JoinNode join) {
            joins.add(join);
            return this;
        }

        public Builder joins(List<JoinNode> newJoins) {
            joins.clear();
            joins.addAll(newJoins);
            return this;
        }

        public Builder select(SqlNode... columns) {
            selections.addAll(List.of(columns));
            return this;
        }

        public Builder select(List<? extends SqlNode> columns) {
            selections.clear();
            selections.addAll(columns);
            return this;
        }

        public Builder where(SqlNode predicate) {
            this.where = predicate;
            return this;
        }

        public Builder orderBy(OrderByNode order) {
            orderBy.add(order);
            return this;
        }

        public Builder orderBy(List<OrderByNode> orders) {
            orderBy.clear();
            orderBy.addAll(orders);
            return this;
        }

        public Builder limit(Integer newLimit) {
            this.limit = newLimit;
            return this;
        }

        public SelectQueryNode build() {
            return new SelectQueryNode(this);
        }
    }
}
