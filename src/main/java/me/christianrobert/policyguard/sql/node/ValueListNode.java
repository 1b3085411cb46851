package me.christianrobert.policyguard.sql.node;

import java.util.List;

/**
 * Parenthesized list of values, the right operand of {@code IN}.
 */
public class ValueListNode implements SqlNode {

    private final List<SqlNode> values;

    public ValueListNode(List<SqlNode> values) {
        this.values = List.copyOf(values);
    }

    public List<SqlNode> getValues() {
        return values;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitValueList(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueListNode)) return false;
        return values.equals(((ValueListNode) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "(" + values + ")";
    }
}
