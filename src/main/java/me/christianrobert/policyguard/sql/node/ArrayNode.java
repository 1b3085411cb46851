package me.christianrobert.policyguard.sql.node;

import java.util.List;
import java.util.Objects;

/**
 * Array constructor {@code ARRAY[...]}, cast to {@code elementSqlType[]} when the element type is known.
 */
public class ArrayNode implements SqlNode {

    private final List<SqlNode> elements;
    private final String elementSqlType;

    public ArrayNode(List<SqlNode> elements, String elementSqlType) {
        this.elements = List.copyOf(elements);
        this.elementSqlType = elementSqlType;
    }

    public List<SqlNode> getElements() {
        return elements;
    }

    /**
     * @return SQL element type, or {@code null} when unknown
     */
    public String getElementSqlType() {
        return elementSqlType;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayNode)) return false;
        ArrayNode that = (ArrayNode) o;
        return elements.equals(that.elements) && Objects.equals(elementSqlType, that.elementSqlType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements, elementSqlType);
    }

    @Override
    public String toString() {
        return "ARRAY" + elements;
    }
}
