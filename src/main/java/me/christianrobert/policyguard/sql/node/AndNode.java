package me.christianrobert.policyguard.sql.node;

import java.util.List;

/**
 * Conjunction of two or more operands.
 */
public class AndNode implements SqlNode {

    private final List<SqlNode> operands;

    public AndNode(List<SqlNode> operands) {
        if (operands.size() < 2) {
            throw new IllegalArgumentException("AND requires at least two operands");
        }
        this.operands = List.copyOf(operands);
    }

    public List<SqlNode> getOperands() {
        return operands;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AndNode)) return false;
        return operands.equals(((AndNode) o).operands);
    }

    @Override
    public int hashCode() {
        return operands.hashCode();
    }

    @Override
    public String toString() {
        return "AND" + operands;
    }
}
