package me.christianrobert.policyguard.policy.transformer;

import me.christianrobert.policyguard.expression.ArrayExpression;
import me.christianrobert.policyguard.expression.BinaryExpression;
import me.christianrobert.policyguard.expression.BinaryOperator;
import me.christianrobert.policyguard.expression.BindingExpression;
import me.christianrobert.policyguard.expression.CallExpression;
import me.christianrobert.policyguard.expression.Expression;
import me.christianrobert.policyguard.expression.ExpressionVisitor;
import me.christianrobert.policyguard.expression.Expressions;
import me.christianrobert.policyguard.expression.FieldExpression;
import me.christianrobert.policyguard.expression.LiteralExpression;
import me.christianrobert.policyguard.expression.MemberExpression;
import me.christianrobert.policyguard.expression.NullExpression;
import me.christianrobert.policyguard.expression.ThisExpression;
import me.christianrobert.policyguard.expression.UnaryExpression;
import me.christianrobert.policyguard.policy.exception.InvalidPolicyExpressionException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates an expression in memory against principal data, without touching the database.
 *
 * <p>Used for the parts of a policy that only depend on the principal, e.g.
 * {@code auth().roles?[name == 'admin']}. Field references resolve against the current element
 * ({@code thisValue}), which must be a map.
 */
public class ExpressionEvaluator implements ExpressionVisitor<Object, ExpressionEvaluator.Scope> {

    public Object evaluate(Expression expr, Map<String, Object> principal, Object thisValue,
                           Map<String, Object> bindings) {
        return expr.accept(this, new Scope(principal, thisValue, bindings));
    }

    public Object evaluate(Expression expr, Map<String, Object> principal) {
        return evaluate(expr, principal, null, Collections.emptyMap());
    }

    // ========== Variants ==========

    @Override
    public Object visitLiteral(LiteralExpression expr, Scope scope) {
        return expr.getValue();
    }

    @Override
    public Object visitField(FieldExpression expr, Scope scope) {
        return readMember(scope.thisValue, expr.getField());
    }

    @Override
    public Object visitMember(MemberExpression expr, Scope scope) {
        Object current = expr.getReceiver().accept(this, scope);
        for (String member : expr.getMembers()) {
            current = readMember(current, member);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    @Override
    public Object visitThis(ThisExpression expr, Scope scope) {
        return scope.thisValue;
    }

    @Override
    public Object visitNull(NullExpression expr, Scope scope) {
        return null;
    }

    @Override
    public Object visitArray(ArrayExpression expr, Scope scope) {
        List<Object> items = new ArrayList<>();
        for (Expression item : expr.getItems()) {
            items.add(item.accept(this, scope));
        }
        return items;
    }

    @Override
    public Object visitUnary(UnaryExpression expr, Scope scope) {
        return !isTruthy(expr.getOperand().accept(this, scope));
    }

    @Override
    public Object visitBinary(BinaryExpression expr, Scope scope) {
        if (expr.getOperator().isCollectionPredicate()) {
            return evaluateCollectionPredicate(expr, scope);
        }

        Object left = expr.getLeft().accept(this, scope);
        switch (expr.getOperator()) {
            case AND:
                return isTruthy(left) && isTruthy(expr.getRight().accept(this, scope));
            case OR:
                return isTruthy(left) || isTruthy(expr.getRight().accept(this, scope));
            default:
                break;
        }

        Object right = expr.getRight().accept(this, scope);
        switch (expr.getOperator()) {
            case EQ:
                return valuesEqual(left, right);
            case NE:
                return !valuesEqual(left, right);
            case LT:
            case LE:
            case GT:
            case GE:
                Integer cmp = compareValues(left, right);
                if (cmp == null) {
                    return false;
                }
                return switch (expr.getOperator()) {
                    case LT -> cmp < 0;
                    case LE -> cmp <= 0;
                    case GT -> cmp > 0;
                    default -> cmp >= 0;
                };
            case IN:
                if (!(right instanceof Collection)) {
                    return false;
                }
                for (Object item : (Collection<?>) right) {
                    if (valuesEqual(left, item)) {
                        return true;
                    }
                }
                return false;
            default:
                throw new InvalidPolicyExpressionException("Unsupported operator: " + expr.getOperator());
        }
    }

    private Object evaluateCollectionPredicate(BinaryExpression expr, Scope scope) {
        Object left = expr.getLeft().accept(this, scope);
        if (left == null) {
            return false;
        }
        if (!(left instanceof Collection)) {
            throw new InvalidPolicyExpressionException("Collection predicate \"" + expr.getOperator().getSymbol()
                    + "\" requires a list value, got: " + left.getClass().getSimpleName());
        }
        Collection<?> items = (Collection<?>) left;
        for (Object item : items) {
            boolean matches = isTruthy(expr.getRight().accept(this, scope.forItem(item, expr.getBinding())));
            switch (expr.getOperator()) {
                case SOME:
                    if (matches) {
                        return true;
                    }
                    break;
                case EVERY:
                    if (!matches) {
                        return false;
                    }
                    break;
                default:
                    if (matches) {
                        return false;
                    }
                    break;
            }
        }
        return expr.getOperator() != BinaryOperator.SOME;
    }

    @Override
    public Object visitCall(CallExpression expr, Scope scope) {
        if (Expressions.isAuthCall(expr)) {
            return scope.principal;
        }
        throw new InvalidPolicyExpressionException(
                "Function \"" + expr.getFunction() + "\" cannot be evaluated without a database");
    }

    @Override
    public Object visitBinding(BindingExpression expr, Scope scope) {
        if (!scope.bindings.containsKey(expr.getName())) {
            throw new InvalidPolicyExpressionException("Unbound name: " + expr.getName());
        }
        return scope.bindings.get(expr.getName());
    }

    // ========== Value semantics ==========

    public static boolean isTruthy(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null;
    }

    /**
     * Equality with numbers compared by value, so {@code 1 == 1L == 1.0}.
     */
    public static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return toBigDecimal((Number) left).compareTo(toBigDecimal((Number) right)) == 0;
        }
        return Objects.equals(left, right);
    }

    /**
     * @return the comparison result, or {@code null} when the values are not comparable with each other
     */
    @SuppressWarnings("unchecked")
    public static Integer compareValues(Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        if (left instanceof Number && right instanceof Number) {
            return toBigDecimal((Number) left).compareTo(toBigDecimal((Number) right));
        }
        if (left instanceof Comparable && left.getClass().equals(right.getClass())) {
            return ((Comparable<Object>) left).compareTo(right);
        }
        return null;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }

    private static Object readMember(Object receiver, String member) {
        if (receiver instanceof Map) {
            return ((Map<?, ?>) receiver).get(member);
        }
        return null;
    }

    public static final class Scope {
        private final Map<String, Object> principal;
        private final Object thisValue;
        private final Map<String, Object> bindings;

        Scope(Map<String, Object> principal, Object thisValue, Map<String, Object> bindings) {
            this.principal = principal;
            this.thisValue = thisValue;
            this.bindings = bindings != null ? bindings : Collections.emptyMap();
        }

        Scope forItem(Object item, String binding) {
            if (binding == null) {
                return new Scope(principal, item, bindings);
            }
            Map<String, Object> newBindings = new LinkedHashMap<>(bindings);
            newBindings.put(binding, item);
            return new Scope(principal, item, newBindings);
        }
    }
}
