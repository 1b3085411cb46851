package me.christianrobert.policyguard.expression;

import java.util.Objects;

/**
 * Binary operation. For collection predicates the optional binding names the current element
 * of the left operand inside the right operand ({@code posts?[p, p.published]}).
 */
public class BinaryExpression implements Expression {

    private final BinaryOperator operator;
    private final Expression left;
    private final Expression right;
    private final String binding;

    public BinaryExpression(BinaryOperator operator, Expression left, Expression right) {
        this(operator, left, right, null);
    }

    public BinaryExpression(BinaryOperator operator, Expression left, Expression right, String binding) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        if (binding != null && !operator.isCollectionPredicate()) {
            throw new IllegalArgumentException("Only collection predicates can declare a binding");
        }
        this.binding = binding;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    /**
     * @return binding name, or {@code null} when the predicate declares none
     */
    public String getBinding() {
        return binding;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right)
                && Objects.equals(binding, that.binding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right, binding);
    }

    @Override
    public String toString() {
        if (operator.isCollectionPredicate()) {
            return left + operator.getSymbol() + "[" + (binding != null ? binding + ", " : "") + right + "]";
        }
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
