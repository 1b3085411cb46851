package me.christianrobert.policyguard.sql.render;

import me.christianrobert.policyguard.sql.dialect.SqlDialect;
import me.christianrobert.policyguard.sql.node.AliasNode;
import me.christianrobert.policyguard.sql.node.AndNode;
import me.christianrobert.policyguard.sql.node.ArrayNode;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.CaseNode;
import me.christianrobert.policyguard.sql.node.CastNode;
import me.christianrobert.policyguard.sql.node.ColumnNode;
import me.christianrobert.policyguard.sql.node.ColumnUpdateNode;
import me.christianrobert.policyguard.sql.node.DeleteQueryNode;
import me.christianrobert.policyguard.sql.node.ExistsNode;
import me.christianrobert.policyguard.sql.node.FunctionNode;
import me.christianrobert.policyguard.sql.node.InsertQueryNode;
import me.christianrobert.policyguard.sql.node.JoinNode;
import me.christianrobert.policyguard.sql.node.LikeNode;
import me.christianrobert.policyguard.sql.node.NotNode;
import me.christianrobert.policyguard.sql.node.OnConflictNode;
import me.christianrobert.policyguard.sql.node.OrNode;
import me.christianrobert.policyguard.sql.node.OrderByNode;
import me.christianrobert.policyguard.sql.node.RawNode;
import me.christianrobert.policyguard.sql.node.RawStatementNode;
import me.christianrobert.policyguard.sql.node.SelectAllNode;
import me.christianrobert.policyguard.sql.node.SelectQueryNode;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.node.SqlNodeVisitor;
import me.christianrobert.policyguard.sql.node.TableNode;
import me.christianrobert.policyguard.sql.node.UpdateQueryNode;
import me.christianrobert.policyguard.sql.node.ValueListNode;
import me.christianrobert.policyguard.sql.node.ValueNode;
import me.christianrobert.policyguard.sql.node.ValuesNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a node tree into SQL text with positional {@code ?} parameters.
 *
 * <p>Identifiers are always quoted. Nested selects are parenthesized; AND/OR groups are parenthesized
 * whenever they have more than one operand, so operator precedence never depends on the tree shape.
 * Instances are single-use and not thread-safe.
 */
public class SqlRenderer implements SqlNodeVisitor<Void> {

    private final SqlDialect dialect;
    private final StringBuilder sql = new StringBuilder();
    private final List<Object> parameters = new ArrayList<>();
    private int depth;

    public SqlRenderer(SqlDialect dialect) {
        this.dialect = dialect;
    }

    public CompiledQuery render(SqlNode node) {
        node.accept(this);
        return new CompiledQuery(sql.toString(), parameters);
    }

    /**
     * Renders a predicate or value fragment. Selects inside it are treated as subqueries.
     */
    public CompiledQuery renderExpression(SqlNode node) {
        depth = 1;
        node.accept(this);
        return new CompiledQuery(sql.toString(), parameters);
    }

    // ========== Statements ==========

    @Override
    public Void visitSelect(SelectQueryNode node) {
        boolean nested = depth > 0;
        depth++;
        if (nested) {
            sql.append('(');
        }
        sql.append("SELECT ");
        if (node.getSelections().isEmpty()) {
            sql.append('1');
        } else {
            renderList(node.getSelections());
        }
        if (!node.getFrom().isEmpty()) {
            sql.append(" FROM ");
            renderList(node.getFrom());
        }
        for (JoinNode join : node.getJoins()) {
            sql.append(' ').append(join.getType().getSql()).append(' ');
            join.getTable().accept(this);
            sql.append(" ON ");
            join.getOn().accept(this);
        }
        renderWhere(node.getWhere());
        if (!node.getOrderBy().isEmpty()) {
            sql.append(" ORDER BY ");
            for (int i = 0; i < node.getOrderBy().size(); i++) {
                if (i > 0) {
                    sql.append(", ");
                }
                OrderByNode order = node.getOrderBy().get(i);
                order.getExpression().accept(this);
                sql.append(order.isDescending() ? " DESC" : " ASC");
            }
        }
        if (node.getLimit() != null) {
            sql.append(" LIMIT ").append(node.getLimit().intValue());
        }
        if (nested) {
            sql.append(')');
        }
        depth--;
        return null;
    }

    @Override
    public Void visitInsert(InsertQueryNode node) {
        depth++;
        sql.append("INSERT INTO ");
        node.getInto().accept(this);
        if (node.getColumns().isEmpty()) {
            sql.append(" DEFAULT VALUES");
        } else {
            sql.append(" (");
            renderIdentifiers(node.getColumns());
            sql.append(") VALUES ");
            renderRows(node.getRows());
        }
        OnConflictNode onConflict = node.getOnConflict();
        if (onConflict != null) {
            sql.append(" ON CONFLICT");
            if (!onConflict.getConflictColumns().isEmpty()) {
                sql.append(" (");
                renderIdentifiers(onConflict.getConflictColumns());
                sql.append(')');
            }
            if (onConflict.isDoNothing()) {
                sql.append(" DO NOTHING");
            } else {
                sql.append(" DO UPDATE SET ");
                renderAssignments(onConflict.getUpdates());
                renderWhere(onConflict.getUpdateWhere());
            }
        }
        renderReturning(node.getReturning());
        depth--;
        return null;
    }

    @Override
    public Void visitUpdate(UpdateQueryNode node) {
        depth++;
        sql.append("UPDATE ");
        node.getTable().accept(this);
        renderTargetAlias(node.getAlias());
        sql.append(" SET ");
        renderAssignments(node.getUpdates());
        if (!node.getFrom().isEmpty()) {
            sql.append(" FROM ");
            renderList(node.getFrom());
        }
        renderWhere(node.getWhere());
        renderReturning(node.getReturning());
        depth--;
        return null;
    }

    @Override
    public Void visitDelete(DeleteQueryNode node) {
        depth++;
        sql.append("DELETE FROM ");
        node.getTable().accept(this);
        renderTargetAlias(node.getAlias());
        if (!node.getUsing().isEmpty()) {
            sql.append(" USING ");
            renderList(node.getUsing());
        }
        renderWhere(node.getWhere());
        renderReturning(node.getReturning());
        depth--;
        return null;
    }

    @Override
    public Void visitRawStatement(RawStatementNode node) {
        sql.append(node.getSql());
        parameters.addAll(node.getParameters());
        return null;
    }

    // ========== Expressions ==========

    @Override
    public Void visitValue(ValueNode node) {
        Object value = node.getValue();
        if (value == null) {
            sql.append("NULL");
        } else if (node.isImmediate() && value instanceof Boolean) {
            sql.append(dialect.renderBoolean((Boolean) value));
        } else if (node.isImmediate() && value instanceof BigDecimal) {
            sql.append(((BigDecimal) value).toPlainString());
        } else if (node.isImmediate()) {
            sql.append(value);
        } else {
            sql.append('?');
            parameters.add(value);
        }
        return null;
    }

    @Override
    public Void visitColumn(ColumnNode node) {
        if (node.getTable() != null) {
            sql.append(dialect.quoteIdentifier(node.getTable())).append('.');
        }
        sql.append(dialect.quoteIdentifier(node.getColumn()));
        return null;
    }

    @Override
    public Void visitTable(TableNode node) {
        sql.append(dialect.quoteIdentifier(node.getTable()));
        return null;
    }

    @Override
    public Void visitAlias(AliasNode node) {
        if (node.getNode() instanceof ValuesNode) {
            ValuesNode values = (ValuesNode) node.getNode();
            values.accept(this);
            sql.append(" AS ").append(dialect.quoteIdentifier(node.getAlias())).append('(');
            renderIdentifiers(values.getColumnNames());
            sql.append(')');
            return null;
        }
        node.getNode().accept(this);
        sql.append(" AS ").append(dialect.quoteIdentifier(node.getAlias()));
        return null;
    }

    @Override
    public Void visitBinaryOperation(BinaryOperationNode node) {
        renderOperand(node.getLeft());
        sql.append(' ').append(node.getOperator().getSql()).append(' ');
        renderOperand(node.getRight());
        return null;
    }

    @Override
    public Void visitAnd(AndNode node) {
        renderJunction(node.getOperands(), " AND ");
        return null;
    }

    @Override
    public Void visitOr(OrNode node) {
        renderJunction(node.getOperands(), " OR ");
        return null;
    }

    @Override
    public Void visitNot(NotNode node) {
        sql.append("NOT (");
        node.getOperand().accept(this);
        sql.append(')');
        return null;
    }

    @Override
    public Void visitFunction(FunctionNode node) {
        sql.append(node.getName()).append('(');
        renderList(node.getArgs());
        sql.append(')');
        return null;
    }

    @Override
    public Void visitRaw(RawNode node) {
        sql.append(node.getSql());
        return null;
    }

    @Override
    public Void visitValueList(ValueListNode node) {
        sql.append('(');
        if (node.getValues().isEmpty()) {
            sql.append("NULL");
        } else {
            renderList(node.getValues());
        }
        sql.append(')');
        return null;
    }

    @Override
    public Void visitArray(ArrayNode node) {
        sql.append("ARRAY[");
        renderList(node.getElements());
        sql.append(']');
        if (node.getElementSqlType() != null) {
            sql.append("::").append(node.getElementSqlType()).append("[]");
        }
        return null;
    }

    @Override
    public Void visitCast(CastNode node) {
        sql.append("CAST(");
        node.getOperand().accept(this);
        sql.append(" AS ").append(node.getSqlType()).append(')');
        return null;
    }

    @Override
    public Void visitCase(CaseNode node) {
        sql.append("CASE WHEN ");
        node.getCondition().accept(this);
        sql.append(" THEN ");
        node.getResult().accept(this);
        sql.append(" ELSE ");
        node.getOtherwise().accept(this);
        sql.append(" END");
        return null;
    }

    @Override
    public Void visitSelectAll(SelectAllNode node) {
        if (node.getTable() != null) {
            sql.append(dialect.quoteIdentifier(node.getTable())).append('.');
        }
        sql.append('*');
        return null;
    }

    @Override
    public Void visitValues(ValuesNode node) {
        sql.append("(VALUES ");
        renderRows(node.getRows());
        sql.append(')');
        return null;
    }

    @Override
    public Void visitLike(LikeNode node) {
        renderOperand(node.getOperand());
        sql.append(node.isCaseInsensitive() ? " ILIKE " : " LIKE ");
        renderOperand(node.getPattern());
        sql.append(" ESCAPE '\\'");
        return null;
    }

    @Override
    public Void visitExists(ExistsNode node) {
        sql.append("EXISTS ");
        depth++;
        node.getQuery().accept(this);
        depth--;
        return null;
    }

    // ========== Helpers ==========

    private void renderOperand(SqlNode operand) {
        boolean wrap = operand instanceof BinaryOperationNode
                || operand instanceof NotNode
                || operand instanceof LikeNode
                || operand instanceof CaseNode;
        if (wrap) {
            sql.append('(');
        }
        operand.accept(this);
        if (wrap) {
            sql.append(')');
        }
    }

    private void renderJunction(List<SqlNode> operands, String separator) {
        sql.append('(');
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                sql.append(separator);
            }
            operands.get(i).accept(this);
        }
        sql.append(')');
    }

    private void renderList(List<SqlNode> nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            nodes.get(i).accept(this);
        }
    }

    private void renderRows(List<List<SqlNode>> rows) {
        for (int i = 0; i < rows.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append('(');
            renderList(rows.get(i));
            sql.append(')');
        }
    }

    private void renderIdentifiers(List<String> identifiers) {
        for (int i = 0; i < identifiers.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(dialect.quoteIdentifier(identifiers.get(i)));
        }
    }

    private void renderAssignments(List<ColumnUpdateNode> updates) {
        for (int i = 0; i < updates.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            ColumnUpdateNode update = updates.get(i);
            sql.append(dialect.quoteIdentifier(update.getColumn())).append(" = ");
            update.getValue().accept(this);
        }
    }

    private void renderTargetAlias(String alias) {
        if (alias != null) {
            sql.append(" AS ").append(dialect.quoteIdentifier(alias));
        }
    }

    private void renderWhere(SqlNode where) {
        if (where != null) {
            sql.append(" WHERE ");
            where.accept(this);
        }
    }

    private void renderReturning(List<SqlNode> returning) {
        if (!returning.isEmpty()) {
            sql.append(" RETURNING ");
            renderList(returning);
        }
    }
}
