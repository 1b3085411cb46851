package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

/**
 * {@code operand LIKE pattern}; case-insensitive matching is rendered by the dialect.
 */
public class LikeNode implements SqlNode {

    private final SqlNode operand;
    private final SqlNode pattern;
    private final boolean caseInsensitive;

    public LikeNode(SqlNode operand, SqlNode pattern, boolean caseInsensitive) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.caseInsensitive = caseInsensitive;
    }

    public SqlNode getOperand() {
        return operand;
    }

    public SqlNode getPattern() {
        return pattern;
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitLike(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LikeNode)) return false;
        LikeNode that = (LikeNode) o;
        return caseInsensitive == that.caseInsensitive && operand.equals(that.operand) && pattern.equals(that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operand, pattern, caseInsensitive);
    }

    @Override
    public String toString() {
        return operand + (caseInsensitive ? " ILIKE " : " LIKE ") + pattern;
    }
}
