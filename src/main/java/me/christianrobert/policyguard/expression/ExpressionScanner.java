package me.christianrobert.policyguard.expression;

/**
 * Visitor that walks the whole tree depth-first. Subclasses override the variants they are interested in
 * and call {@code super} to keep descending.
 */
public abstract class ExpressionScanner implements ExpressionVisitor<Void, Void> {

    public void scan(Expression expr) {
        expr.accept(this, null);
    }

    @Override
    public Void visitLiteral(LiteralExpression expr, Void context) {
        return null;
    }

    @Override
    public Void visitField(FieldExpression expr, Void context) {
        return null;
    }

    @Override
    public Void visitMember(MemberExpression expr, Void context) {
        expr.getReceiver().accept(this, context);
        return null;
    }

    @Override
    public Void visitThis(ThisExpression expr, Void context) {
        return null;
    }

    @Override
    public Void visitNull(NullExpression expr, Void context) {
        return null;
    }

    @Override
    public Void visitArray(ArrayExpression expr, Void context) {
        expr.getItems().forEach(item -> item.accept(this, context));
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpression expr, Void context) {
        expr.getOperand().accept(this, context);
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpression expr, Void context) {
        expr.getLeft().accept(this, context);
        expr.getRight().accept(this, context);
        return null;
    }

    @Override
    public Void visitCall(CallExpression expr, Void context) {
        expr.getArgs().forEach(arg -> arg.accept(this, context));
        return null;
    }

    @Override
    public Void visitBinding(BindingExpression expr, Void context) {
        return null;
    }
}
