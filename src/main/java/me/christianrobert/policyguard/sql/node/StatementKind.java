package me.christianrobert.policyguard.sql.node;

public enum StatementKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    OTHER;

    public boolean isMutation() {
        return this == INSERT || this == UPDATE || this == DELETE;
    }
}
