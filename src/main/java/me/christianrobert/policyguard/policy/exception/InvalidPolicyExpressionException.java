package me.christianrobert.policyguard.policy.exception;

/**
 * Thrown when a policy expression cannot be parsed or compiled to SQL.
 * Never retried: the schema itself has to be fixed.
 */
public class InvalidPolicyExpressionException extends PolicyException {

    private final String expression;

    public InvalidPolicyExpressionException(String message) {
        this(null, message, null, null);
    }

    public InvalidPolicyExpressionException(String model, String message) {
        this(model, message, null, null);
    }

    public InvalidPolicyExpressionException(String model, String message, String expression, Throwable cause) {
        super(PolicyErrorCode.INVALID_POLICY_EXPRESSION, model, message, cause);
        this.expression = expression;
    }

    /**
     * @return the offending expression source, when known
     */
    public String getExpression() {
        return expression;
    }

    @Override
    public String getDetailedMessage() {
        String base = super.getDetailedMessage();
        return expression != null ? base + "\nExpression: " + expression : base;
    }
}
