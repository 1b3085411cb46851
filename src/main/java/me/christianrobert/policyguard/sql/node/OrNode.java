package me.christianrobert.policyguard.sql.node;

import java.util.List;

/**
 * Disjunction of two or more operands.
 */
public class OrNode implements SqlNode {

    private final List<SqlNode> operands;

    public OrNode(List<SqlNode> operands) {
        if (operands.size() < 2) {
            throw new IllegalArgumentException("OR requires at least two operands");
        }
        this.operands = List.copyOf(operands);
    }

    public List<SqlNode> getOperands() {
        return operands;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitOr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrNode)) return false;
        return operands.equals(((OrNode) o).operands);
    }

    @Override
    public int hashCode() {
        return operands.hashCode();
    }

    @Override
    public String toString() {
        return "OR" + operands;
    }
}
