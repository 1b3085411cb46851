package me.christianrobert.policyguard.sql.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Statement given as SQL text. Executable directly, but never accepted by the policy handler.
 */
public class RawStatementNode implements SqlStatement {

    private final String sql;
    private final List<Object> parameters;

    public RawStatementNode(String sql, List<Object> parameters) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.OTHER;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitRawStatement(this);
    }

    @Override
    public String toString() {
        return sql;
    }
}
