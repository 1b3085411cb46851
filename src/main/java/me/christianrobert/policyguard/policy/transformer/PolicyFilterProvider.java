package me.christianrobert.policyguard.policy.transformer;

import me.christianrobert.policyguard.schema.model.PolicyOperation;
import me.christianrobert.policyguard.sql.node.SqlNode;

import java.util.Map;

/**
 * Source of a model's combined policy predicate. Lets functions such as {@code check()} delegate to
 * another model's policies without depending on the registry directly.
 */
public interface PolicyFilterProvider {

    /**
     * @param alias alias the model's table is referenced by, or {@code null} for its table name
     */
    SqlNode buildPolicyFilter(String model, String alias, PolicyOperation operation, Map<String, Object> principal);

    /**
     * Same as {@link #buildPolicyFilter}, for a predicate placed inside {@code depth} relation subqueries of
     * another policy. Its own subqueries are aliased deeper than the enclosing ones.
     */
    SqlNode buildNestedPolicyFilter(String model, String alias, PolicyOperation operation,
                                    Map<String, Object> principal, int depth);
}
