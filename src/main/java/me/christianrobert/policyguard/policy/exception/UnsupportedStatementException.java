package me.christianrobert.policyguard.policy.exception;

/**
 * Thrown for statements the policy handler refuses to pass through (DDL, raw SQL, etc.).
 */
public class UnsupportedStatementException extends PolicyException {

    private final String statementKind;

    public UnsupportedStatementException(String statementKind, String message) {
        super(PolicyErrorCode.UNSUPPORTED_STATEMENT, null, message);
        this.statementKind = statementKind;
    }

    public String getStatementKind() {
        return statementKind;
    }
}
