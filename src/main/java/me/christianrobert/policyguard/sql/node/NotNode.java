package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

public class NotNode implements SqlNode {

    private final SqlNode operand;

    public NotNode(SqlNode operand) {
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public SqlNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotNode)) return false;
        return operand.equals(((NotNode) o).operand);
    }

    @Override
    public int hashCode() {
        return operand.hashCode();
    }

    @Override
    public String toString() {
        return "NOT(" + operand + ")";
    }
}
