package me.christianrobert.policyguard.expression;

public final class NullExpression implements Expression {

    public static final NullExpression INSTANCE = new NullExpression();

    private NullExpression() {
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitNull(this, context);
    }

    @Override
    public String toString() {
        return "null";
    }
}
