package me.christianrobert.policyguard.policy.exception;

/**
 * Thrown when an operation is rejected by access policies.
 */
public class PolicyDeniedException extends PolicyException {

    private static final String DEFAULT_MESSAGE = "operation is rejected by access policies";

    private final RejectedReason reason;

    public PolicyDeniedException(String model, RejectedReason reason) {
        this(model, reason, DEFAULT_MESSAGE);
    }

    public PolicyDeniedException(String model, RejectedReason reason, String message) {
        super(PolicyErrorCode.POLICY_DENIED, model, message != null ? message : DEFAULT_MESSAGE);
        this.reason = reason;
    }

    public RejectedReason getReason() {
        return reason;
    }

    @Override
    public String getDetailedMessage() {
        return super.getDetailedMessage() + "\nReason: " + reason;
    }
}
