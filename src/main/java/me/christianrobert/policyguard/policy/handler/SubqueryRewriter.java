package me.christianrobert.policyguard.policy.handler;

import me.christianrobert.policyguard.sql.node.AliasNode;
import me.christianrobert.policyguard.sql.node.AndNode;
import me.christianrobert.policyguard.sql.node.ArrayNode;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.CaseNode;
import me.christianrobert.policyguard.sql.node.CastNode;
import me.christianrobert.policyguard.sql.node.ColumnNode;
import me.christianrobert.policyguard.sql.node.DeleteQueryNode;
import me.christianrobert.policyguard.sql.node.ExistsNode;
import me.christianrobert.policyguard.sql.node.FunctionNode;
import me.christianrobert.policyguard.sql.node.InsertQueryNode;
import me.christianrobert.policyguard.sql.node.LikeNode;
import me.christianrobert.policyguard.sql.node.NotNode;
import me.christianrobert.policyguard.sql.node.OrNode;
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

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Rebuilds an expression tree with every nested select replaced by {@code selectRewriter}'s result.
 * Nodes without nested selects are returned unchanged.
 */
class SubqueryRewriter implements SqlNodeVisitor<SqlNode> {

    private final UnaryOperator<SelectQueryNode> selectRewriter;

    SubqueryRewriter(UnaryOperator<SelectQueryNode> selectRewriter) {
        this.selectRewriter = selectRewriter;
    }

    SqlNode rewrite(SqlNode node) {
        return node == null ? null : node.accept(this);
    }

    List<SqlNode> rewriteAll(List<SqlNode> nodes) {
        List<SqlNode> result = new ArrayList<>(nodes.size());
        for (SqlNode node : nodes) {
            result.add(rewrite(node));
        }
        return result;
    }

    @Override
    public SqlNode visitSelect(SelectQueryNode node) {
        return selectRewriter.apply(node);
    }

    @Override
    public SqlNode visitExists(ExistsNode node) {
        return new ExistsNode(selectRewriter.apply(node.getQuery()));
    }

    @Override
    public SqlNode visitAlias(AliasNode node) {
        return new AliasNode(rewrite(node.getNode()), node.getAlias());
    }

    @Override
    public SqlNode visitBinaryOperation(BinaryOperationNode node) {
        return new BinaryOperationNode(rewrite(node.getLeft()), node.getOperator(), rewrite(node.getRight()));
    }

    @Override
    public SqlNode visitAnd(AndNode node) {
        return new AndNode(rewriteAll(node.getOperands()));
    }

    @Override
    public SqlNode visitOr(OrNode node) {
        return new OrNode(rewriteAll(node.getOperands()));
    }

    @Override
    public SqlNode visitNot(NotNode node) {
        return new NotNode(rewrite(node.getOperand()));
    }

    @Override
    public SqlNode visitFunction(FunctionNode node) {
        return new FunctionNode(node.getName(), rewriteAll(node.getArgs()));
    }

    @Override
    public SqlNode visitValueList(ValueListNode node) {
        return new ValueListNode(rewriteAll(node.getValues()));
    }

    @Override
    public SqlNode visitArray(ArrayNode node) {
        return new ArrayNode(rewriteAll(node.getElements()), node.getElementSqlType());
    }

    @Override
    public SqlNode visitCast(CastNode node) {
        return new CastNode(rewrite(node.getOperand()), node.getSqlType());
    }

    @Override
    public SqlNode visitCase(CaseNode node) {
        return new CaseNode(rewrite(node.getCondition()), rewrite(node.getResult()), rewrite(node.getOtherwise()));
    }

    @Override
    public SqlNode visitLike(LikeNode node) {
        return new LikeNode(rewrite(node.getOperand()), rewrite(node.getPattern()), node.isCaseInsensitive());
    }

    @Override
    public SqlNode visitValues(ValuesNode node) {
        List<List<SqlNode>> rows = new ArrayList<>();
        for (List<SqlNode> row : node.getRows()) {
            rows.add(rewriteAll(row));
        }
        return new ValuesNode(rows, node.getColumnNames());
    }

    // ========== Leaves ==========

    @Override
    public SqlNode visitValue(ValueNode node) {
        return node;
    }

    @Override
    public SqlNode visitColumn(ColumnNode node) {
        return node;
    }

    @Override
    public SqlNode visitTable(TableNode node) {
        return node;
    }

    @Override
    public SqlNode visitRaw(RawNode node) {
        return node;
    }

    @Override
    public SqlNode visitSelectAll(SelectAllNode node) {
        return node;
    }

    // statements never appear inside expressions

    @Override
    public SqlNode visitInsert(InsertQueryNode node) {
        return node;
    }

    @Override
    public SqlNode visitUpdate(UpdateQueryNode node) {
        return node;
    }

    @Override
    public SqlNode visitDelete(DeleteQueryNode node) {
        return node;
    }

    @Override
    public SqlNode visitRawStatement(RawStatementNode node) {
        return node;
    }
}
