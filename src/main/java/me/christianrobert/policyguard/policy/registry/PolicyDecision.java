package me.christianrobert.policyguard.policy.registry;

/**
 * Outcome of a policy that can be decided from its rules alone.
 */
public enum PolicyDecision {
    /** An unconditional allow and no deny rules. */
    ALWAYS_ALLOW,
    /** No allow rules, or an unconditional deny. */
    ALWAYS_DENY,
    /** Depends on the principal or row data; must be compiled. */
    CONDITIONAL
}
