package me.christianrobert.policyguard.executor;

import me.christianrobert.policyguard.sql.node.SqlStatement;

import java.util.function.Function;

/**
 * Runs statement trees against a database.
 */
public interface QueryExecutor {

    /**
     * Executes one statement. Selects and mutations with RETURNING produce rows; other mutations
     * only report the affected row count.
     *
     * @throws QueryExecutionException when the database rejects the statement
     */
    QueryResult execute(SqlStatement statement);

    /**
     * Runs {@code work} with an executor bound to a single transaction. Commits when {@code work} returns,
     * rolls back when it throws. Nested calls join the running transaction.
     */
    <T> T inTransaction(Function<QueryExecutor, T> work);
}
