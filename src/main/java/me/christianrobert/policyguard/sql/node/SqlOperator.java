package me.christianrobert.policyguard.sql.node;

public enum SqlOperator {
    EQ("="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    IS("IS"),
    IS_NOT("IS NOT"),
    IN("IN"),
    /** Array containment (PostgreSQL {@code @>}). */
    CONTAINS("@>"),
    /** Array overlap (PostgreSQL {@code &&}). */
    OVERLAPS("&&");

    private final String sql;

    SqlOperator(String sql) {
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }

    @Override
    public String toString() {
        return sql;
    }
}
