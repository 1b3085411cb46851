package me.christianrobert.policyguard.schema.model;

public enum PolicyKind {
    ALLOW,
    DENY
}
