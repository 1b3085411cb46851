package me.christianrobert.policyguard.executor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A statement failed in the database. Carries the rendered SQL, its parameters and the SQLState.
 */
public class QueryExecutionException extends RuntimeException {

    private final String sql;
    private final List<Object> parameters;
    private final String sqlState;

    public QueryExecutionException(String message, String sql, List<Object> parameters, String sqlState,
                                   Throwable cause) {
        super(message, cause);
        this.sql = sql;
        this.parameters = parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
        this.sqlState = sqlState;
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    public String getSqlState() {
        return sqlState;
    }

    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (sqlState != null) {
            sb.append(" [SQLState ").append(sqlState).append(']');
        }
        if (sql != null) {
            sb.append("\nSQL: ").append(sql);
            sb.append("\nParameters: ").append(parameters);
        }
        return sb.toString();
    }
}
