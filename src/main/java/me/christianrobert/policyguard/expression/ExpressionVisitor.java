package me.christianrobert.policyguard.expression;

/**
 * Visitor over the closed set of policy expression variants.
 *
 * @param <R> result type
 * @param <C> context type
 */
public interface ExpressionVisitor<R, C> {

    R visitLiteral(LiteralExpression expr, C context);

    R visitField(FieldExpression expr, C context);

    R visitMember(MemberExpression expr, C context);

    R visitThis(ThisExpression expr, C context);

    R visitNull(NullExpression expr, C context);

    R visitArray(ArrayExpression expr, C context);

    R visitUnary(UnaryExpression expr, C context);

    R visitBinary(BinaryExpression expr, C context);

    R visitCall(CallExpression expr, C context);

    R visitBinding(BindingExpression expr, C context);
}
