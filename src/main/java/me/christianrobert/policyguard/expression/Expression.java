package me.christianrobert.policyguard.expression;

/**
 * Base interface for all nodes of the policy expression language.
 *
 * <p>Expressions are immutable and may be shared freely between threads. Every concrete variant
 * dispatches to exactly one method of {@link ExpressionVisitor}, so a consumer that implements
 * the visitor handles the complete set of variants (adding a variant breaks compilation of every
 * visitor until it is handled).
 */
public interface Expression {

    /**
     * Dispatches this expression to the matching visitor method.
     *
     * @param visitor the visitor
     * @param context caller-supplied context passed through unchanged
     * @param <R> result type
     * @param <C> context type
     * @return the visitor's result
     */
    <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);
}
