package me.christianrobert.policyguard.expression;

import java.util.Objects;

/**
 * Reference to a name bound by an enclosing collection predicate.
 */
public class BindingExpression implements Expression {

    private final String name;

    public BindingExpression(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitBinding(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BindingExpression)) return false;
        return name.equals(((BindingExpression) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
