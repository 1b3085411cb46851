package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

public class BinaryOperationNode implements SqlNode {

    private final SqlNode left;
    private final SqlOperator operator;
    private final SqlNode right;

    public BinaryOperationNode(SqlNode left, SqlOperator operator, SqlNode right) {
        this.left = Objects.requireNonNull(left, "left");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = Objects.requireNonNull(right, "right");
    }

    public static BinaryOperationNode of(SqlNode left, SqlOperator operator, SqlNode right) {
        return new BinaryOperationNode(left, operator, right);
    }

    public SqlNode getLeft() {
        return left;
    }

    public SqlOperator getOperator() {
        return operator;
    }

    public SqlNode getRight() {
        return right;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitBinaryOperation(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryOperationNode)) return false;
        BinaryOperationNode that = (BinaryOperationNode) o;
        return left.equals(that.left) && operator == that.operator && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSql() + " " + right + ")";
    }
}
