package me.christianrobert.policyguard.schema.model;

import java.util.List;
import java.util.Objects;

public class FieldDefinition {

    private final String name;
    private final String type;
    private final boolean id;
    private final boolean optional;
    private final boolean array;
    private final RelationDefinition relation;
    private final List<PolicyRule> rules;
    private final String originModel;

    public FieldDefinition(String name, String type, boolean id, boolean optional, boolean array,
                           RelationDefinition relation, List<PolicyRule> rules, String originModel) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.id = id;
        this.optional = optional;
        this.array = array;
        this.relation = relation;
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.originModel = originModel;
    }

    /**
     * Returns a copy declared on another model, used when aggregating mixins and base models.
     */
    public FieldDefinition withOriginModel(String origin) {
        return new FieldDefinition(name, type, id, optional, array, relation, rules, origin);
    }

    public String getName() {
        return name;
    }

    /**
     * @return builtin type name ({@code String}, {@code Int}, ...) or the name of a model or type
     */
    public String getType() {
        return type;
    }

    /**
     * @return the builtin type, or {@code null} for relation and typed fields
     */
    public BuiltinType getBuiltinType() {
        return BuiltinType.fromTypeName(type);
    }

    public boolean isId() {
        return id;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isArray() {
        return array;
    }

    public boolean isRelation() {
        return relation != null;
    }

    public RelationDefinition getRelation() {
        return relation;
    }

    /**
     * Field-level {@code @allow}/{@code @deny} rules.
     */
    public List<PolicyRule> getRules() {
        return rules;
    }

    public boolean hasPolicies() {
        return !rules.isEmpty();
    }

    /**
     * @return the mixin or base model the field was declared on, or {@code null} when declared directly
     */
    public String getOriginModel() {
        return originModel;
    }

    @Override
    public String toString() {
        return name + ": " + type + (array ? "[]" : "") + (optional ? "?" : "") + (id ? " @id" : "");
    }
}
