package me.christianrobert.policyguard.sql.node;

/**
 * Root node of an executable statement.
 */
public interface SqlStatement extends SqlNode {

    StatementKind getKind();
}
