package me.christianrobert.policyguard.expression.parser;

import me.christianrobert.policyguard.antlr.PolicyExpressionBaseVisitor;
import me.christianrobert.policyguard.antlr.PolicyExpressionParser;
import me.christianrobert.policyguard.expression.ArrayExpression;
import me.christianrobert.policyguard.expression.BinaryExpression;
import me.christianrobert.policyguard.expression.BinaryOperator;
import me.christianrobert.policyguard.expression.BindingExpression;
import me.christianrobert.policyguard.expression.CallExpression;
import me.christianrobert.policyguard.expression.Expression;
import me.christianrobert.policyguard.expression.Expressions;
import me.christianrobert.policyguard.expression.FieldExpression;
import me.christianrobert.policyguard.expression.LiteralExpression;
import me.christianrobert.policyguard.expression.NullExpression;
import me.christianrobert.policyguard.expression.ThisExpression;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Converts a PolicyExpression parse tree into the immutable {@link Expression} model.
 *
 * <p>Keeps a stack of the binding names declared by enclosing collection predicates so an identifier
 * resolves to a {@link BindingExpression} when bound, and to a {@link FieldExpression} otherwise.
 * Instances are single-use.
 */
class ExpressionTreeBuilder extends PolicyExpressionBaseVisitor<Expression> {

    private final Deque<String> bindings = new ArrayDeque<>();

    Expression build(PolicyExpressionParser.PolicyExpressionContext ctx) {
        return visit(ctx.expression());
    }

    // ========== Operators ==========

    @Override
    public Expression visitPrimaryExpression(PolicyExpressionParser.PrimaryExpressionContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public Expression visitMemberAccess(PolicyExpressionParser.MemberAccessContext ctx) {
        Expression receiver = visit(ctx.expression());
        return Expressions.appendMember(receiver, ctx.IDENTIFIER().getText());
    }

    @Override
    public Expression visitCollectionPredicate(PolicyExpressionParser.CollectionPredicateContext ctx) {
        Expression collection = visit(ctx.expression(0));
        String binding = ctx.binding != null ? ctx.binding.getText() : null;
        if (binding != null) {
            bindings.push(binding);
        }
        try {
            Expression predicate = visit(ctx.expression(1));
            return new BinaryExpression(BinaryOperator.collectionPredicateFromSymbol(ctx.op.getText()),
                    collection, predicate, binding);
        } finally {
            if (binding != null) {
                bindings.pop();
            }
        }
    }

    @Override
    public Expression visitNotExpression(PolicyExpressionParser.NotExpressionContext ctx) {
        return Expressions.not(visit(ctx.expression()));
    }

    @Override
    public Expression visitComparison(PolicyExpressionParser.ComparisonContext ctx) {
        return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
    }

    @Override
    public Expression visitInExpression(PolicyExpressionParser.InExpressionContext ctx) {
        return binary(ctx.expression(0), "in", ctx.expression(1));
    }

    @Override
    public Expression visitEquality(PolicyExpressionParser.EqualityContext ctx) {
        return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
    }

    @Override
    public Expression visitAndExpression(PolicyExpressionParser.AndExpressionContext ctx) {
        return binary(ctx.expression(0), "&&", ctx.expression(1));
    }

    @Override
    public Expression visitOrExpression(PolicyExpressionParser.OrExpressionContext ctx) {
        return binary(ctx.expression(0), "||", ctx.expression(1));
    }

    private Expression binary(PolicyExpressionParser.ExpressionContext left, String op,
                              PolicyExpressionParser.ExpressionContext right) {
        return new BinaryExpression(BinaryOperator.fromSymbol(op), visit(left), visit(right));
    }

    // ========== Primaries ==========

    @Override
    public Expression visitStringLiteral(PolicyExpressionParser.StringLiteralContext ctx) {
        return new LiteralExpression(unquote(ctx.STRING().getText()));
    }

    @Override
    public Expression visitNumberLiteral(PolicyExpressionParser.NumberLiteralContext ctx) {
        return new LiteralExpression(parseNumber(ctx.NUMBER().getText()));
    }

    @Override
    public Expression visitBooleanLiteral(PolicyExpressionParser.BooleanLiteralContext ctx) {
        return new LiteralExpression(Boolean.parseBoolean(ctx.value.getText()));
    }

    @Override
    public Expression visitNullLiteral(PolicyExpressionParser.NullLiteralContext ctx) {
        return NullExpression.INSTANCE;
    }

    @Override
    public Expression visitThisReference(PolicyExpressionParser.ThisReferenceContext ctx) {
        return ThisExpression.INSTANCE;
    }

    @Override
    public Expression visitFunctionCall(PolicyExpressionParser.FunctionCallContext ctx) {
        List<Expression> args = new ArrayList<>();
        for (PolicyExpressionParser.ExpressionContext arg : ctx.expression()) {
            args.add(visit(arg));
        }
        return new CallExpression(ctx.IDENTIFIER().getText(), args);
    }

    @Override
    public Expression visitIdentifierReference(PolicyExpressionParser.IdentifierReferenceContext ctx) {
        String name = ctx.IDENTIFIER().getText();
        if (bindings.contains(name)) {
            return new BindingExpression(name);
        }
        return new FieldExpression(name);
    }

    @Override
    public Expression visitArrayLiteral(PolicyExpressionParser.ArrayLiteralContext ctx) {
        List<Expression> items = new ArrayList<>();
        for (PolicyExpressionParser.ExpressionContext item : ctx.expression()) {
            items.add(visit(item));
        }
        return new ArrayExpression(inferItemType(items), items);
    }

    @Override
    public Expression visitParenthesized(PolicyExpressionParser.ParenthesizedContext ctx) {
        return visit(ctx.expression());
    }

    // ========== Helpers ==========

    private static String inferItemType(List<Expression> items) {
        String type = null;
        for (Expression item : items) {
            if (!(item instanceof LiteralExpression)) {
                return null;
            }
            Object value = ((LiteralExpression) item).getValue();
            String itemType = value instanceof String ? "String"
                    : value instanceof Boolean ? "Boolean"
                    : value instanceof BigDecimal ? "Decimal"
                    : "Int";
            if (type != null && !type.equals(itemType)) {
                return null;
            }
            type = itemType;
        }
        return type;
    }

    static Number parseNumber(String text) {
        if (text.contains(".")) {
            return new BigDecimal(text);
        }
        long value = Long.parseLong(text);
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return (int) value;
        }
        return value;
    }

    static String unquote(String quoted) {
        String body = quoted.substring(1, quoted.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
