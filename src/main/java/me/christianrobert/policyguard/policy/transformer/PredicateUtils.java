package me.christianrobert.policyguard.policy.transformer;

import me.christianrobert.policyguard.sql.dialect.SqlDialect;
import me.christianrobert.policyguard.sql.node.AndNode;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.FunctionNode;
import me.christianrobert.policyguard.sql.node.NotNode;
import me.christianrobert.policyguard.sql.node.OrNode;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.node.SqlOperator;
import me.christianrobert.policyguard.sql.node.ValueNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Boolean algebra over SQL predicate nodes with constant folding.
 *
 * <p>Folding follows SQL three-valued logic: {@code FALSE AND x} is {@code FALSE}, {@code TRUE OR x} is
 * {@code TRUE}, and a {@code NULL} constant stays in the junction otherwise.
 */
public final class PredicateUtils {

    private PredicateUtils() {
    }

    // ========== Constant checks ==========

    public static boolean isTrue(SqlNode node) {
        return node instanceof ValueNode && Boolean.TRUE.equals(((ValueNode) node).getValue());
    }

    public static boolean isFalse(SqlNode node) {
        return node instanceof ValueNode && Boolean.FALSE.equals(((ValueNode) node).getValue());
    }

    public static boolean isNullNode(SqlNode node) {
        return node instanceof ValueNode && ((ValueNode) node).isNull();
    }

    // ========== Junctions ==========

    public static SqlNode conjunction(SqlDialect dialect, List<SqlNode> nodes) {
        List<SqlNode> operands = new ArrayList<>();
        for (SqlNode node : nodes) {
            if (isFalse(node)) {
                return dialect.falseNode();
            }
            if (isTrue(node)) {
                continue;
            }
            if (node instanceof AndNode) {
                operands.addAll(((AndNode) node).getOperands());
            } else {
                operands.add(node);
            }
        }
        if (operands.isEmpty()) {
            return dialect.trueNode();
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }
        return new AndNode(operands);
    }

    public static SqlNode conjunction(SqlDialect dialect, SqlNode... nodes) {
        return conjunction(dialect, List.of(nodes));
    }

    public static SqlNode disjunction(SqlDialect dialect, List<SqlNode> nodes) {
        List<SqlNode> operands = new ArrayList<>();
        for (SqlNode node : nodes) {
            if (isTrue(node)) {
                return dialect.trueNode();
            }
            if (isFalse(node)) {
                continue;
            }
            if (node instanceof OrNode) {
                operands.addAll(((OrNode) node).getOperands());
            } else {
                operands.add(node);
            }
        }
        if (operands.isEmpty()) {
            return dialect.falseNode();
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }
        return new OrNode(operands);
    }

    public static SqlNode disjunction(SqlDialect dialect, SqlNode... nodes) {
        return disjunction(dialect, List.of(nodes));
    }

    // ========== Negation ==========

    public static SqlNode logicalNot(SqlDialect dialect, SqlNode node) {
        if (isTrue(node)) {
            return dialect.falseNode();
        }
        if (isFalse(node)) {
            return dialect.trueNode();
        }
        if (isNullNode(node)) {
            return ValueNode.NULL;
        }
        if (node instanceof NotNode) {
            return ((NotNode) node).getOperand();
        }
        if (node instanceof BinaryOperationNode) {
            BinaryOperationNode binary = (BinaryOperationNode) node;
            if (isNullNode(binary.getRight())) {
                if (binary.getOperator() == SqlOperator.IS) {
                    return BinaryOperationNode.of(binary.getLeft(), SqlOperator.IS_NOT, ValueNode.NULL);
                }
                if (binary.getOperator() == SqlOperator.IS_NOT) {
                    return BinaryOperationNode.of(binary.getLeft(), SqlOperator.IS, ValueNode.NULL);
                }
            }
        }
        return new NotNode(node);
    }

    // ========== Null-safe truth tests ==========

    /**
     * {@code COALESCE(node, FALSE) = FALSE}: true when the predicate is false or unknown.
     */
    public static SqlNode buildIsFalse(SqlDialect dialect, SqlNode node) {
        if (isFalse(node) || isNullNode(node)) {
            return dialect.trueNode();
        }
        if (isTrue(node)) {
            return dialect.falseNode();
        }
        return BinaryOperationNode.of(FunctionNode.of("COALESCE", node, dialect.falseNode()),
                SqlOperator.EQ, dialect.falseNode());
    }

    /**
     * {@code COALESCE(node, FALSE) = TRUE}: true only when the predicate is known to be true.
     */
    public static SqlNode buildIsTrue(SqlDialect dialect, SqlNode node) {
        if (isTrue(node)) {
            return dialect.trueNode();
        }
        if (isFalse(node) || isNullNode(node)) {
            return dialect.falseNode();
        }
        return BinaryOperationNode.of(FunctionNode.of("COALESCE", node, dialect.falseNode()),
                SqlOperator.EQ, dialect.trueNode());
    }
}
