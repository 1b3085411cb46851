package me.christianrobert.policyguard.sql.node;

import java.util.List;

/**
 * Insert, update or delete statement targeting a single table.
 */
public interface MutationStatement extends SqlStatement {

    /**
     * @return the mutated table
     */
    TableNode getTargetTable();

    /**
     * @return alias of the target table, or {@code null}
     */
    String getTargetAlias();

    /**
     * @return RETURNING selections; empty when nothing is returned
     */
    List<SqlNode> getReturning();

    MutationStatement withReturning(List<SqlNode> returning);
}
