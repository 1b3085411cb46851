package me.christianrobert.policyguard.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Array literal. The item type is the builtin type name of the elements when known, {@code null} otherwise.
 */
public class ArrayExpression implements Expression {

    private final String itemType;
    private final List<Expression> items;

    public ArrayExpression(String itemType, List<Expression> items) {
        this.itemType = itemType;
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public String getItemType() {
        return itemType;
    }

    public List<Expression> getItems() {
        return items;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitArray(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayExpression)) return false;
        ArrayExpression that = (ArrayExpression) o;
        return Objects.equals(itemType, that.itemType) && items.equals(that.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(itemType, items);
    }

    @Override
    public String toString() {
        return items.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
    }
}
