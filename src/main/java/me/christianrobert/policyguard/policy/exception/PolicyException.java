package me.christianrobert.policyguard.policy.exception;

/**
 * Base class of every exception raised by the policy layer.
 * Carries the error category and, where known, the model the failure relates to.
 */
public abstract class PolicyException extends RuntimeException {

    private final PolicyErrorCode code;
    private final String model;

    protected PolicyException(PolicyErrorCode code, String model, String message) {
        super(message);
        this.code = code;
        this.model = model;
    }

    protected PolicyException(PolicyErrorCode code, String model, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.model = model;
    }

    public PolicyErrorCode getCode() {
        return code;
    }

    /**
     * @return the model name, or {@code null} when the failure is not tied to a model
     */
    public String getModel() {
        return model;
    }

    /**
     * Gets a detailed error message including the error code and model.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        sb.append("\nCode: ").append(code);
        if (model != null) {
            sb.append("\nModel: ").append(model);
        }
        return sb.toString();
    }
}
