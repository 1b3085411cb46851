package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

/**
 * Constant value. Immediate values (numbers, booleans, null) are rendered inline; other values are
 * rendered as positional parameters.
 */
public class ValueNode implements SqlNode {

    public static final ValueNode NULL = new ValueNode(null, true);

    private final Object value;
    private final boolean immediate;

    private ValueNode(Object value, boolean immediate) {
        this.value = value;
        this.immediate = immediate;
    }

    /**
     * Value bound as a statement parameter.
     */
    public static ValueNode create(Object value) {
        return value == null ? NULL : new ValueNode(value, false);
    }

    /**
     * Value rendered inline. Only numbers, booleans and null are accepted.
     */
    public static ValueNode createImmediate(Object value) {
        if (value == null) {
            return NULL;
        }
        if (!(value instanceof Number || value instanceof Boolean)) {
            throw new IllegalArgumentException("Immediate values must be numbers or booleans: " + value);
        }
        return new ValueNode(value, true);
    }

    public Object getValue() {
        return value;
    }

    public boolean isImmediate() {
        return immediate;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitValue(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueNode)) return false;
        ValueNode that = (ValueNode) o;
        return immediate == that.immediate && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, immediate);
    }

    @Override
    public String toString() {
        return "ValueNode{" + value + (immediate ? ", immediate" : "") + "}";
    }
}
