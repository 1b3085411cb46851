package me.christianrobert.policyguard.schema.service;

import me.christianrobert.policyguard.schema.model.PolicyKind;
import me.christianrobert.policyguard.schema.model.RelationDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Fluent declaration of one field, including its field-level {@code @allow}/{@code @deny} rules.
 */
public class FieldBuilder {

    final String name;
    final String type;
    boolean id;
    boolean optional;
    boolean array;
    RelationDefinition relation;
    final List<RuleDeclaration> rules = new ArrayList<>();

    FieldBuilder(String name, String type) {
        this.name = name;
        this.type = type;
    }

    public FieldBuilder id() {
        this.id = true;
        return this;
    }

    public FieldBuilder optional() {
        this.optional = true;
        return this;
    }

    public FieldBuilder array() {
        this.array = true;
        return this;
    }

    /**
     * Owning side of a relation: {@code fields} on this model reference {@code references} on the target.
     */
    public FieldBuilder references(List<String> fields, List<String> references) {
        this.relation = new RelationDefinition(fields, references, null);
        return this;
    }

    /**
     * Non-owning side of a relation; the foreign key lives on the target's {@code opposite} field.
     */
    public FieldBuilder opposite(String opposite) {
        this.relation = new RelationDefinition(null, null, opposite);
        return this;
    }

    /**
     * Non-owning side of a named relation. For a many-to-many relation the name gives the join table.
     */
    public FieldBuilder opposite(String opposite, String relationName) {
        this.relation = new RelationDefinition(null, null, opposite, relationName);
        return this;
    }

    public FieldBuilder allow(String operations, String condition) {
        rules.add(new RuleDeclaration(PolicyKind.ALLOW, operations, condition));
        return this;
    }

    public FieldBuilder deny(String operations, String condition) {
        rules.add(new RuleDeclaration(PolicyKind.DENY, operations, condition));
        return this;
    }
}
