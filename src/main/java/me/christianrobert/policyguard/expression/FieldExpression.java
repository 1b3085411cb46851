package me.christianrobert.policyguard.expression;

import java.util.Objects;

/**
 * Reference to a field of the model (or type) the expression is evaluated against.
 */
public class FieldExpression implements Expression {

    private final String field;

    public FieldExpression(String field) {
        this.field = Objects.requireNonNull(field, "field");
    }

    public String getField() {
        return field;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitField(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldExpression)) return false;
        return field.equals(((FieldExpression) o).field);
    }

    @Override
    public int hashCode() {
        return field.hashCode();
    }

    @Override
    public String toString() {
        return field;
    }
}
