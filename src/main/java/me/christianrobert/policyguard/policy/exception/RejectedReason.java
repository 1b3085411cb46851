package me.christianrobert.policyguard.policy.exception;

public enum RejectedReason {
    /** The principal is not allowed to perform the operation. */
    NO_ACCESS,
    /** The mutation succeeded but its result is not readable by the principal. */
    CANNOT_READ_BACK,
    OTHER
}
