package me.christianrobert.policyguard.executor;

import me.christianrobert.policyguard.sql.dialect.SqlDialect;
import me.christianrobert.policyguard.sql.node.MutationStatement;
import me.christianrobert.policyguard.sql.node.SqlStatement;
import me.christianrobert.policyguard.sql.node.StatementKind;
import me.christianrobert.policyguard.sql.render.CompiledQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link QueryExecutor} over plain JDBC. Without a bound connection every statement runs on a fresh
 * auto-commit connection; inside {@link #inTransaction} all statements share one connection.
 */
public class JdbcQueryExecutor implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private final ConnectionProvider connectionProvider;
    private final SqlDialect dialect;
    private final boolean logSql;
    private final Connection boundConnection;

    public JdbcQueryExecutor(ConnectionProvider connectionProvider, SqlDialect dialect, boolean logSql) {
        this(connectionProvider, dialect, logSql, null);
    }

    private JdbcQueryExecutor(ConnectionProvider connectionProvider, SqlDialect dialect, boolean logSql,
                              Connection boundConnection) {
        this.connectionProvider = connectionProvider;
        this.dialect = dialect;
        this.logSql = logSql;
        this.boundConnection = boundConnection;
    }

    @Override
    public QueryResult execute(SqlStatement statement) {
        CompiledQuery query = dialect.compile(statement);
        if (logSql) {
            log.info("SQL: {} {}", query.getSql(), query.getParameters());
        } else if (log.isTraceEnabled()) {
            log.trace("SQL: {} {}", query.getSql(), query.getParameters());
        }

        if (boundConnection != null) {
            return run(boundConnection, statement, query);
        }
        try (Connection connection = connectionProvider.getConnection()) {
            return run(connection, statement, query);
        } catch (SQLException e) {
            throw wrap("Failed to obtain database connection", query, e);
        }
    }

    @Override
    public <T> T inTransaction(Function<QueryExecutor, T> work) {
        if (boundConnection != null) {
            return work.apply(this);
        }

        Connection connection;
        try {
            connection = connectionProvider.getConnection();
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to begin transaction: " + e.getMessage(),
                    null, null, e.getSQLState(), e);
        }
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            closeQuietly(connection, e);
            throw new QueryExecutionException("Failed to begin transaction: " + e.getMessage(),
                    null, null, e.getSQLState(), e);
        }

        try {
            T result = work.apply(new JdbcQueryExecutor(connectionProvider, dialect, logSql, connection));
            connection.commit();
            log.debug("Transaction committed");
            return result;
        } catch (SQLException e) {
            rollback(connection);
            throw new QueryExecutionException("Failed to commit transaction: " + e.getMessage(),
                    null, null, e.getSQLState(), e);
        } catch (RuntimeException e) {
            rollback(connection);
            throw e;
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to close transaction connection: {}", e.getMessage());
            }
        }
    }

    private QueryResult run(Connection connection, SqlStatement statement, CompiledQuery query) {
        try (PreparedStatement ps = connection.prepareStatement(query.getSql())) {
            List<Object> parameters = query.getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                ps.setObject(i + 1, parameters.get(i));
            }

            if (producesRows(statement)) {
                try (ResultSet rs = ps.executeQuery()) {
                    List<Map<String, Object>> rows = readRows(rs);
                    return statement.getKind() == StatementKind.SELECT
                            ? QueryResult.ofRows(rows)
                            : new QueryResult(rows, rows.size());
                }
            }
            return QueryResult.ofAffected(ps.executeUpdate());
        } catch (SQLException e) {
            log.error("Statement failed [{}]: {}", e.getSQLState(), query.getSql());
            throw wrap("Statement failed: " + e.getMessage(), query, e);
        }
    }

    private static boolean producesRows(SqlStatement statement) {
        if (statement instanceof MutationStatement) {
            return !((MutationStatement) statement).getReturning().isEmpty();
        }
        return statement.getKind() == StatementKind.SELECT;
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                Object value = rs.getObject(i);
                if (value instanceof Array) {
                    value = new ArrayList<>(Arrays.asList((Object[]) ((Array) value).getArray()));
                }
                row.put(metaData.getColumnLabel(i), value);
            }
            rows.add(row);
        }
        return rows;
    }

    private static void rollback(Connection connection) {
        try {
            connection.rollback();
            log.debug("Transaction rolled back");
        } catch (SQLException rollbackException) {
            log.error("Failed to rollback transaction: {}", rollbackException.getMessage());
        }
    }

    private static void closeQuietly(Connection connection, SQLException cause) {
        try {
            connection.close();
        } catch (SQLException closeException) {
            cause.addSuppressed(closeException);
        }
    }

    private static QueryExecutionException wrap(String message, CompiledQuery query, SQLException e) {
        return new QueryExecutionException(message, query.getSql(), query.getParameters(), e.getSQLState(), e);
    }
}
