package me.christianrobert.policyguard.schema.model;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Table-backed model with id fields and model-level policy rules.
 */
public class ModelDefinition extends TypeDefinition {

    private final String tableName;
    private final List<String> idFields;
    private final List<PolicyRule> rules;

    public ModelDefinition(String name, String tableName, Map<String, FieldDefinition> fields,
                           List<String> idFields, List<PolicyRule> rules) {
        super(name, fields);
        this.tableName = tableName != null ? tableName : name;
        this.idFields = List.copyOf(idFields);
        this.rules = List.copyOf(rules);
    }

    public String getTableName() {
        return tableName;
    }

    public List<String> getIdFields() {
        return idFields;
    }

    public List<PolicyRule> getRules() {
        return rules;
    }

    /**
     * Scalar (non-relation) fields in declaration order, i.e. the table's columns.
     */
    public List<FieldDefinition> getScalarFields() {
        return getFieldList().stream().filter(f -> !f.isRelation()).collect(Collectors.toList());
    }

    @Override
    public boolean isModel() {
        return true;
    }

    @Override
    public String toString() {
        return "model " + getName() + " (" + tableName + ") " + getFieldList();
    }
}
