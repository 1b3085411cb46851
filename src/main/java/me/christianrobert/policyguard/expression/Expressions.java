package me.christianrobert.policyguard.expression;

import java.util.Arrays;
import java.util.List;

/**
 * Static factories and shape predicates for {@link Expression} trees.
 */
public final class Expressions {

    public static final String AUTH_FUNCTION = "auth";
    public static final String BEFORE_FUNCTION = "before";

    private Expressions() {
    }

    // ========== Factories ==========

    public static LiteralExpression literal(Object value) {
        return new LiteralExpression(value);
    }

    public static FieldExpression field(String name) {
        return new FieldExpression(name);
    }

    public static MemberExpression member(Expression receiver, String... members) {
        return new MemberExpression(receiver, Arrays.asList(members));
    }

    public static BinaryExpression binary(Expression left, BinaryOperator op, Expression right) {
        return new BinaryExpression(op, left, right);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(UnaryOperator.NOT, operand);
    }

    public static CallExpression call(String function, Expression... args) {
        return new CallExpression(function, Arrays.asList(args));
    }

    public static CallExpression auth() {
        return new CallExpression(AUTH_FUNCTION, List.of());
    }

    /**
     * Left-folds the given conditions with {@code &&}; an empty list yields {@code true}.
     */
    public static Expression and(List<? extends Expression> conditions) {
        if (conditions.isEmpty()) {
            return literal(true);
        }
        Expression result = conditions.get(0);
        for (int i = 1; i < conditions.size(); i++) {
            result = binary(result, BinaryOperator.AND, conditions.get(i));
        }
        return result;
    }

    /**
     * Appends {@code member} to a member chain, or starts a new chain on any other receiver.
     */
    public static MemberExpression appendMember(Expression expr, String member) {
        if (expr instanceof MemberExpression) {
            return ((MemberExpression) expr).append(member);
        }
        return member(expr, member);
    }

    // ========== Predicates ==========

    public static boolean isNull(Expression expr) {
        return expr instanceof NullExpression;
    }

    public static boolean isThis(Expression expr) {
        return expr instanceof ThisExpression;
    }

    public static boolean isTrueLiteral(Expression expr) {
        return expr instanceof LiteralExpression && ((LiteralExpression) expr).isTrue();
    }

    public static boolean isAuthCall(Expression expr) {
        return expr instanceof CallExpression && AUTH_FUNCTION.equals(((CallExpression) expr).getFunction());
    }

    public static boolean isBeforeCall(Expression expr) {
        return expr instanceof CallExpression && BEFORE_FUNCTION.equals(((CallExpression) expr).getFunction());
    }

    public static boolean isAuthMember(Expression expr) {
        return expr instanceof MemberExpression && isAuthCall(((MemberExpression) expr).getReceiver());
    }

    /**
     * Whether {@code this} occurs anywhere in the tree.
     */
    public static boolean referencesThis(Expression expr) {
        boolean[] found = {false};
        new ExpressionScanner() {
            @Override
            public Void visitThis(ThisExpression e, Void context) {
                found[0] = true;
                return null;
            }
        }.scan(expr);
        return found[0];
    }
}
