package me.christianrobert.policyguard.executor;

import me.christianrobert.policyguard.sql.dialect.PostgresDialect;
import me.christianrobert.policyguard.sql.node.SelectQueryNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class JdbcQueryExecutorTest {

    private ConnectionProvider connectionProvider;
    private Connection connection;
    private JdbcQueryExecutor executor;

    @BeforeEach
    void setUp() throws SQLException {
        connectionProvider = mock(ConnectionProvider.class);
        connection = mock(Connection.class);
        when(connectionProvider.getConnection()).thenReturn(connection);
        executor = new JdbcQueryExecutor(connectionProvider, new PostgresDialect(), false);
    }

    @Test
    void failureToDisableAutoCommitClosesTheConnection() throws SQLException {
        doThrow(new SQLException("connection reset", "08006")).when(connection).setAutoCommit(false);
        AtomicBoolean ran = new AtomicBoolean();

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> executor.inTransaction(tx -> ran.getAndSet(true)));

        assertEquals("08006", e.getSqlState());
        assertFalse(ran.get());
        verify(connection).close();
        verify(connection, never()).commit();
    }

    @Test
    void closeFailureIsKeptAsSuppressed() throws SQLException {
        doThrow(new SQLException("connection reset", "08006")).when(connection).setAutoCommit(false);
        doThrow(new SQLException("already closed")).when(connection).close();

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> executor.inTransaction(tx -> 1));

        assertEquals(1, e.getCause().getSuppressed().length);
        assertEquals("already closed", e.getCause().getSuppressed()[0].getMessage());
    }

    @Test
    void successfulWorkIsCommitted() throws SQLException {
        assertEquals("done", executor.inTransaction(tx -> "done"));

        verify(connection).setAutoCommit(false);
        verify(connection).commit();
        verify(connection, never()).rollback();
        verify(connection).close();
    }

    @Test
    void failingWorkIsRolledBack() throws SQLException {
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> executor.inTransaction(tx -> {
                    throw failure;
                }));

        assertSame(failure, e);
        verify(connection).rollback();
        verify(connection, never()).commit();
        verify(connection).close();
    }

    @Test
    void statementsInsideTransactionShareOneConnection() throws SQLException {
        PreparedStatement statement = mock(PreparedStatement.class);
        ResultSet resultSet = mock(ResultSet.class);
        ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(1);
        when(metaData.getColumnLabel(1)).thenReturn("x");
        when(resultSet.next()).thenReturn(true, false, true, false);
        when(resultSet.getObject(1)).thenReturn(7);

        List<QueryResult> results = executor.inTransaction(tx -> List.of(
                tx.execute(SelectQueryNode.selectAllFrom("Foo")),
                tx.execute(SelectQueryNode.selectAllFrom("Foo"))));

        assertEquals(List.of(Map.of("x", 7)), results.get(0).getRows());
        assertEquals(List.of(Map.of("x", 7)), results.get(1).getRows());
        verify(connectionProvider, times(1)).getConnection();
        verify(connection, times(2)).prepareStatement("SELECT * FROM \"Foo\"");
        verify(connection, times(1)).close();
    }
}
