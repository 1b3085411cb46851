package me.christianrobert.policyguard.schema.model;

import me.christianrobert.policyguard.policy.exception.InvalidPolicyExpressionException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved, read-only schema: models, type definitions and the auth type.
 * Built by {@link me.christianrobert.policyguard.schema.service.SchemaBuilder}; safe to share between threads.
 */
public class SchemaDefinition {

    private final Map<String, ModelDefinition> models;
    private final Map<String, TypeDefinition> types;
    private final Map<String, ModelDefinition> modelsByTable;
    private final Map<String, JoinTableDefinition> joinTables;
    private final String authType;

    public SchemaDefinition(Map<String, ModelDefinition> models, Map<String, TypeDefinition> types, String authType) {
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        Map<String, ModelDefinition> byTable = new LinkedHashMap<>();
        for (ModelDefinition model : models.values()) {
            byTable.put(model.getTableName(), model);
        }
        this.modelsByTable = Collections.unmodifiableMap(byTable);
        this.authType = authType;
        this.joinTables = Collections.unmodifiableMap(indexJoinTables());
    }

    private Map<String, JoinTableDefinition> indexJoinTables() {
        Map<String, JoinTableDefinition> result = new LinkedHashMap<>();
        for (ModelDefinition model : models.values()) {
            for (FieldDefinition field : model.getFieldList()) {
                ManyToManyRelation m2m = getManyToManyRelation(model.getName(), field.getName());
                if (m2m == null || result.containsKey(m2m.getJoinTable())) {
                    continue;
                }
                boolean parentFirst = JoinTableDefinition.FIRST_COLUMN.equals(m2m.getParentFk());
                result.put(m2m.getJoinTable(), parentFirst
                        ? new JoinTableDefinition(m2m.getJoinTable(), model.getName(), m2m.getParentPk(),
                                m2m.getOtherModel(), m2m.getOtherPk())
                        : new JoinTableDefinition(m2m.getJoinTable(), m2m.getOtherModel(), m2m.getOtherPk(),
                                model.getName(), m2m.getParentPk()));
            }
        }
        return result;
    }

    public Collection<ModelDefinition> getModels() {
        return models.values();
    }

    public Collection<TypeDefinition> getTypes() {
        return types.values();
    }

    /**
     * @return the auth type name, or {@code null} when the schema declares none
     */
    public String getAuthType() {
        return authType;
    }

    public String requireAuthType() {
        if (authType == null) {
            throw new InvalidPolicyExpressionException("Schema does not declare an auth type, auth() cannot be used");
        }
        return authType;
    }

    public boolean hasModel(String name) {
        return models.containsKey(name);
    }

    public ModelDefinition getModel(String name) {
        return models.get(name);
    }

    public ModelDefinition requireModel(String name) {
        ModelDefinition model = models.get(name);
        if (model == null) {
            throw new InvalidPolicyExpressionException(name, "Model not found: " + name);
        }
        return model;
    }

    /**
     * @return the model stored in the given table, or {@code null} if the table is not a model
     */
    public ModelDefinition findModelByTable(String tableName) {
        return modelsByTable.get(tableName);
    }

    /**
     * @return the join table of an implicit many-to-many relation, or {@code null} if {@code tableName} is none
     */
    public JoinTableDefinition findJoinTable(String tableName) {
        return joinTables.get(tableName);
    }

    public Collection<JoinTableDefinition> getJoinTables() {
        return joinTables.values();
    }

    /**
     * Looks up a model first, then a type definition.
     */
    public TypeDefinition getModelOrType(String name) {
        ModelDefinition model = models.get(name);
        return model != null ? model : types.get(name);
    }

    public TypeDefinition requireModelOrType(String name) {
        TypeDefinition def = getModelOrType(name);
        if (def == null) {
            throw new InvalidPolicyExpressionException(name, "Model or type not found: " + name);
        }
        return def;
    }

    public FieldDefinition getField(String modelOrType, String field) {
        TypeDefinition def = getModelOrType(modelOrType);
        return def != null ? def.getField(field) : null;
    }

    public FieldDefinition requireField(String modelOrType, String field) {
        FieldDefinition def = requireModelOrType(modelOrType).getField(field);
        if (def == null) {
            throw new InvalidPolicyExpressionException(modelOrType,
                    "Field \"" + field + "\" not found in \"" + modelOrType + "\"");
        }
        return def;
    }

    /**
     * Id fields of a model, or of a type definition (its fields flagged as id).
     */
    public List<String> requireIdFields(String modelOrType) {
        TypeDefinition def = requireModelOrType(modelOrType);
        List<String> ids;
        if (def instanceof ModelDefinition) {
            ids = ((ModelDefinition) def).getIdFields();
        } else {
            ids = new ArrayList<>();
            for (FieldDefinition field : def.getFieldList()) {
                if (field.isId()) {
                    ids.add(field.getName());
                }
            }
        }
        if (ids.isEmpty()) {
            throw new InvalidPolicyExpressionException(modelOrType, "\"" + modelOrType + "\" has no id fields");
        }
        return ids;
    }

    /**
     * Resolves an implicit many-to-many relation: a list relation field whose opposite field is a list too.
     * The join table is {@code _<name>} for a named relation, otherwise {@code _<Model1>To<Model2>} with the
     * model names in sorted order. Models whose id is not a single field are not supported and yield
     * {@code null}.
     *
     * @return the relation, or {@code null} when the field is not a many-to-many relation
     */
    public ManyToManyRelation getManyToManyRelation(String model, String field) {
        FieldDefinition fieldDef = getField(model, field);
        if (fieldDef == null || !fieldDef.isArray() || fieldDef.getRelation() == null
                || fieldDef.getRelation().getOpposite() == null) {
            return null;
        }
        String otherModel = fieldDef.getType();
        FieldDefinition opposite = getField(otherModel, fieldDef.getRelation().getOpposite());
        if (opposite == null || !opposite.isArray() || opposite.getRelation() == null) {
            return null;
        }
        ModelDefinition parent = models.get(model);
        ModelDefinition other = models.get(otherModel);
        if (parent == null || other == null || parent.getIdFields().size() != 1 || other.getIdFields().size() != 1) {
            return null;
        }

        // fk order follows the model names, or the field names for a self-relation
        boolean parentFirst = model.equals(otherModel)
                ? field.compareTo(opposite.getName()) < 0
                : model.compareTo(otherModel) < 0;
        String parentFk = parentFirst ? JoinTableDefinition.FIRST_COLUMN : JoinTableDefinition.SECOND_COLUMN;
        String otherFk = parentFirst ? JoinTableDefinition.SECOND_COLUMN : JoinTableDefinition.FIRST_COLUMN;

        String relationName = fieldDef.getRelation().getName();
        String joinTable;
        if (relationName != null) {
            joinTable = "_" + relationName;
        } else {
            String first = model.compareTo(otherModel) <= 0 ? model : otherModel;
            String second = first.equals(model) ? otherModel : model;
            joinTable = "_" + first + "To" + second;
        }
        return new ManyToManyRelation(parentFk, parent.getIdFields().get(0), otherModel, opposite.getName(),
                otherFk, other.getIdFields().get(0), joinTable);
    }

    /**
     * Resolves the key columns that join {@code model} with the target of its relation field {@code field}.
     */
    public RelationKeys getRelationKeys(String model, String field) {
        FieldDefinition fieldDef = requireField(model, field);
        RelationDefinition relation = fieldDef.getRelation();
        if (relation == null) {
            throw new InvalidPolicyExpressionException(model, "Field \"" + field + "\" is not a relation");
        }
        List<RelationKeys.KeyPair> pairs = new ArrayList<>();
        if (relation.isOwner()) {
            for (int i = 0; i < relation.getFields().size(); i++) {
                pairs.add(new RelationKeys.KeyPair(relation.getFields().get(i), relation.getReferences().get(i)));
            }
            return new RelationKeys(pairs, true);
        }

        FieldDefinition opposite = requireField(fieldDef.getType(), relation.getOpposite());
        if (opposite.getRelation() == null || !opposite.getRelation().isOwner()) {
            throw new InvalidPolicyExpressionException(model,
                    "Relation \"" + model + "." + field + "\" has no owning side");
        }
        RelationDefinition owning = opposite.getRelation();
        for (int i = 0; i < owning.getFields().size(); i++) {
            pairs.add(new RelationKeys.KeyPair(owning.getFields().get(i), owning.getReferences().get(i)));
        }
        return new RelationKeys(pairs, false);
    }
}
