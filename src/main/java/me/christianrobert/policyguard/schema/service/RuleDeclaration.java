package me.christianrobert.policyguard.schema.service;

import me.christianrobert.policyguard.schema.model.PolicyKind;

/**
 * Unparsed rule as declared on a builder.
 */
class RuleDeclaration {

    final PolicyKind kind;
    final String operations;
    final String condition;

    RuleDeclaration(PolicyKind kind, String operations, String condition) {
        this.kind = kind;
        this.operations = operations;
        this.condition = condition;
    }
}
