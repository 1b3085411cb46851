package me.christianrobert.policyguard.expression;

import java.util.Objects;

/**
 * String, number or boolean constant.
 */
public class LiteralExpression implements Expression {

    private final Object value;

    public LiteralExpression(Object value) {
        if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw new IllegalArgumentException("Literal must be a string, number or boolean: " + value);
        }
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    public boolean isTrue() {
        return Boolean.TRUE.equals(value);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LiteralExpression)) return false;
        return value.equals(((LiteralExpression) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
