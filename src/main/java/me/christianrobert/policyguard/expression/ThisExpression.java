package me.christianrobert.policyguard.expression;

/**
 * The {@code this} keyword: the model instance the policy is attached to.
 */
public final class ThisExpression implements Expression {

    public static final ThisExpression INSTANCE = new ThisExpression();

    private ThisExpression() {
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitThis(this, context);
    }

    @Override
    public String toString() {
        return "this";
    }
}
