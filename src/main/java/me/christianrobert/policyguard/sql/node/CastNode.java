package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

public class CastNode implements SqlNode {

    private final SqlNode operand;
    private final String sqlType;

    public CastNode(SqlNode operand, String sqlType) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.sqlType = Objects.requireNonNull(sqlType, "sqlType");
    }

    public SqlNode getOperand() {
        return operand;
    }

    public String getSqlType() {
        return sqlType;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitCast(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CastNode)) return false;
        CastNode that = (CastNode) o;
        return operand.equals(that.operand) && sqlType.equals(that.sqlType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operand, sqlType);
    }

    @Override
    public String toString() {
        return "CAST(" + operand + " AS " + sqlType + ")";
    }
}
