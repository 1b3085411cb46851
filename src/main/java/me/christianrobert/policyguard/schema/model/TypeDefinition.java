package me.christianrobert.policyguard.schema.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured type without a backing table. Used as a mixin for models and as the auth type.
 */
public class TypeDefinition {

    private final String name;
    private final Map<String, FieldDefinition> fields;

    public TypeDefinition(String name, Map<String, FieldDefinition> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String getName() {
        return name;
    }

    public Map<String, FieldDefinition> getFields() {
        return fields;
    }

    public Collection<FieldDefinition> getFieldList() {
        return fields.values();
    }

    public FieldDefinition getField(String fieldName) {
        return fields.get(fieldName);
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    /**
     * Whether any field declares field-level policies.
     */
    public boolean hasFieldLevelPolicies() {
        return fields.values().stream().anyMatch(FieldDefinition::hasPolicies);
    }

    public boolean isModel() {
        return false;
    }

    @Override
    public String toString() {
        return "type " + name + " " + fields.values();
    }
}
