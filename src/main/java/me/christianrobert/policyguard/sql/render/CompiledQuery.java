package me.christianrobert.policyguard.sql.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL text with {@code ?} placeholders and the positional parameters to bind.
 */
public class CompiledQuery {

    private final String sql;
    private final List<Object> parameters;

    public CompiledQuery(String sql, List<Object> parameters) {
        this.sql = sql;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return sql + (parameters.isEmpty() ? "" : " -- " + parameters);
    }
}
