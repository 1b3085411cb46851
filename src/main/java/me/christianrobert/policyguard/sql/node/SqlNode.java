package me.christianrobert.policyguard.sql.node;

/**
 * Base interface for all SQL tree nodes. Nodes are immutable values; rewriting produces new trees.
 */
public interface SqlNode {

    <R> R accept(SqlNodeVisitor<R> visitor);
}
