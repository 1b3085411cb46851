package me.christianrobert.policyguard.policy.exception;

/**
 * Closed set of failure categories raised by the policy layer.
 */
public enum PolicyErrorCode {
    /** Operation rejected by access policies. */
    POLICY_DENIED,
    /** Statement kind cannot be policy-checked (anything other than select/insert/update/delete). */
    UNSUPPORTED_STATEMENT,
    /** Policy expression cannot be compiled. */
    INVALID_POLICY_EXPRESSION
}
