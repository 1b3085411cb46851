package me.christianrobert.policyguard.policy.function;

import me.christianrobert.policyguard.sql.node.SqlNode;

import java.util.List;

/**
 * A function callable from policy expressions, compiled to a SQL predicate or value.
 * Arguments arrive already compiled; field arguments are plain column references.
 */
@FunctionalInterface
public interface PolicyFunction {

    SqlNode apply(List<SqlNode> args, FunctionContext context);
}
