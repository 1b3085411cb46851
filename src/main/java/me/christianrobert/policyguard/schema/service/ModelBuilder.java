package me.christianrobert.policyguard.schema.service;

import me.christianrobert.policyguard.schema.model.PolicyKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Fluent declaration of a model or a type definition. Table, id and model-level rule settings are
 * rejected for type definitions when the schema is built.
 */
public class ModelBuilder {

    final String name;
    final boolean typeDefinition;
    String tableName;
    String baseModel;
    final List<String> mixins = new ArrayList<>();
    final Map<String, FieldBuilder> fields = new LinkedHashMap<>();
    final List<String> compoundId = new ArrayList<>();
    final List<RuleDeclaration> rules = new ArrayList<>();

    ModelBuilder(String name, boolean typeDefinition) {
        this.name = name;
        this.typeDefinition = typeDefinition;
    }

    public ModelBuilder table(String tableName) {
        this.tableName = tableName;
        return this;
    }

    /**
     * Inherits fields, field-level rules and model-level rules from another model.
     */
    public ModelBuilder extendsModel(String baseModel) {
        this.baseModel = baseModel;
        return this;
    }

    /**
     * Includes the fields (and their field-level rules) of one or more type definitions.
     */
    public ModelBuilder mixin(String... typeNames) {
        mixins.addAll(Arrays.asList(typeNames));
        return this;
    }

    public ModelBuilder field(String fieldName, String type) {
        return field(fieldName, type, f -> { });
    }

    public ModelBuilder field(String fieldName, String type, Consumer<FieldBuilder> config) {
        FieldBuilder field = new FieldBuilder(fieldName, type);
        config.accept(field);
        fields.put(fieldName, field);
        return this;
    }

    public ModelBuilder idField(String fieldName, String type) {
        return field(fieldName, type, FieldBuilder::id);
    }

    /**
     * Compound id over several scalar fields.
     */
    public ModelBuilder id(String... fieldNames) {
        compoundId.clear();
        compoundId.addAll(Arrays.asList(fieldNames));
        return this;
    }

    /**
     * To-one relation whose foreign key columns live on this model.
     */
    public ModelBuilder toOne(String fieldName, String target, List<String> fkFields, List<String> references) {
        return field(fieldName, target, f -> f.references(fkFields, references));
    }

    public ModelBuilder optionalToOne(String fieldName, String target, List<String> fkFields, List<String> references) {
        return field(fieldName, target, f -> f.optional().references(fkFields, references));
    }

    /**
     * Optional to-one relation whose foreign key lives on the target's {@code opposite} field.
     */
    public ModelBuilder toOneBackref(String fieldName, String target, String opposite) {
        return field(fieldName, target, f -> f.optional().opposite(opposite));
    }

    public ModelBuilder toMany(String fieldName, String target, String opposite) {
        return field(fieldName, target, f -> f.array().opposite(opposite));
    }

    /**
     * Implicit many-to-many relation: {@code opposite} must be a list relation of the target pointing back here.
     * Rows are linked through the join table {@code _<Model1>To<Model2>}.
     */
    public ModelBuilder manyToMany(String fieldName, String target, String opposite) {
        return field(fieldName, target, f -> f.array().opposite(opposite));
    }

    /**
     * Named implicit many-to-many relation, linked through the join table {@code _<relationName>}.
     * Both sides must use the same name.
     */
    public ModelBuilder manyToMany(String fieldName, String target, String opposite, String relationName) {
        return field(fieldName, target, f -> f.array().opposite(opposite, relationName));
    }

    public ModelBuilder allow(String operations, String condition) {
        rules.add(new RuleDeclaration(PolicyKind.ALLOW, operations, condition));
        return this;
    }

    public ModelBuilder deny(String operations, String condition) {
        rules.add(new RuleDeclaration(PolicyKind.DENY, operations, condition));
        return this;
    }
}
