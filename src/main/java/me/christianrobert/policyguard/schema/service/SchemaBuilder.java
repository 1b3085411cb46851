package me.christianrobert.policyguard.schema.service;

import me.christianrobert.policyguard.expression.Expression;
import me.christianrobert.policyguard.expression.parser.AntlrPolicyParser;
import me.christianrobert.policyguard.policy.exception.InvalidPolicyExpressionException;
import me.christianrobert.policyguard.schema.model.BuiltinType;
import me.christianrobert.policyguard.schema.model.FieldDefinition;
import me.christianrobert.policyguard.schema.model.ManyToManyRelation;
import me.christianrobert.policyguard.schema.model.ModelDefinition;
import me.christianrobert.policyguard.schema.model.PolicyOperation;
import me.christianrobert.policyguard.schema.model.PolicyRule;
import me.christianrobert.policyguard.schema.model.RelationDefinition;
import me.christianrobert.policyguard.schema.model.SchemaDefinition;
import me.christianrobert.policyguard.schema.model.TypeDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Programmatic schema declaration.
 *
 * <p>Policy conditions are given as text and parsed with {@link AntlrPolicyParser}. On {@link #build()}
 * mixins and base models are resolved by aggregation: an including or deriving model receives copies of
 * the inherited fields (with their field-level rules) and, for base models, the model-level rules.
 * The resulting {@link SchemaDefinition} is fully resolved and read-only.
 *
 * <pre>{@code
 * SchemaDefinition schema = new SchemaBuilder()
 *     .authType("User")
 *     .model("User", m -> m.idField("id", "Int").toMany("posts", "Post", "author").allow("all", "true"))
 *     .model("Post", m -> m
 *         .idField("id", "Int")
 *         .field("published", "Boolean")
 *         .field("authorId", "Int")
 *         .toOne("author", "User", List.of("authorId"), List.of("id"))
 *         .allow("read", "published || author == auth()"))
 *     .build();
 * }</pre>
 */
public class SchemaBuilder {

    private static final Logger log = LoggerFactory.getLogger(SchemaBuilder.class);

    private final AntlrPolicyParser parser;
    private final Map<String, ModelBuilder> modelBuilders = new LinkedHashMap<>();
    private final Map<String, ModelBuilder> typeBuilders = new LinkedHashMap<>();
    private String authType;

    public SchemaBuilder() {
        this(new AntlrPolicyParser());
    }

    public SchemaBuilder(AntlrPolicyParser parser) {
        this.parser = parser;
    }

    public SchemaBuilder authType(String authType) {
        this.authType = authType;
        return this;
    }

    public SchemaBuilder model(String name, Consumer<ModelBuilder> config) {
        ModelBuilder builder = new ModelBuilder(name, false);
        config.accept(builder);
        modelBuilders.put(name, builder);
        return this;
    }

    public SchemaBuilder type(String name, Consumer<ModelBuilder> config) {
        ModelBuilder builder = new ModelBuilder(name, true);
        config.accept(builder);
        typeBuilders.put(name, builder);
        return this;
    }

    /**
     * Resolves inheritance, parses all policy conditions and validates cross references.
     *
     * @throws IllegalStateException on structural schema errors (unknown types, dangling relations)
     * @throws InvalidPolicyExpressionException on unparsable policy conditions
     */
    public SchemaDefinition build() {
        Map<String, TypeDefinition> types = new LinkedHashMap<>();
        for (ModelBuilder typeBuilder : typeBuilders.values()) {
            if (typeBuilder.tableName != null || !typeBuilder.rules.isEmpty() || typeBuilder.baseModel != null) {
                throw new IllegalStateException("Type \"" + typeBuilder.name
                        + "\" cannot declare a table, a base model or model-level rules");
            }
            types.put(typeBuilder.name, new TypeDefinition(typeBuilder.name, ownFields(typeBuilder)));
        }

        Map<String, ModelDefinition> models = new LinkedHashMap<>();
        for (String modelName : modelBuilders.keySet()) {
            resolveModel(modelName, types, models, new HashSet<>());
        }

        if (authType != null && !models.containsKey(authType) && !types.containsKey(authType)) {
            throw new IllegalStateException("Auth type \"" + authType + "\" is neither a model nor a type");
        }

        SchemaDefinition schema = new SchemaDefinition(models, types, authType);
        validateFieldTypes(schema);

        log.debug("Built schema with {} models and {} types (auth type: {})",
                models.size(), types.size(), authType);
        return schema;
    }

    // ========== Inheritance resolution ==========

    private ModelDefinition resolveModel(String name, Map<String, TypeDefinition> types,
                                         Map<String, ModelDefinition> resolved, Set<String> inProgress) {
        ModelDefinition existing = resolved.get(name);
        if (existing != null) {
            return existing;
        }
        ModelBuilder builder = modelBuilders.get(name);
        if (builder == null) {
            throw new IllegalStateException("Unknown base model: " + name);
        }
        if (!inProgress.add(name)) {
            throw new IllegalStateException("Cyclic model inheritance involving \"" + name + "\"");
        }

        Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        List<PolicyRule> rules = new ArrayList<>();
        List<String> idFields = new ArrayList<>();

        if (builder.baseModel != null) {
            ModelDefinition base = resolveModel(builder.baseModel, types, resolved, inProgress);
            for (FieldDefinition field : base.getFieldList()) {
                fields.put(field.getName(), field.getOriginModel() != null ? field : field.withOriginModel(base.getName()));
            }
            rules.addAll(base.getRules());
            idFields.addAll(base.getIdFields());
        }

        for (String mixin : builder.mixins) {
            TypeDefinition type = types.get(mixin);
            if (type == null) {
                throw new IllegalStateException("Model \"" + name + "\" includes unknown type \"" + mixin + "\"");
            }
            for (FieldDefinition field : type.getFieldList()) {
                fields.put(field.getName(), field.withOriginModel(type.getName()));
            }
        }

        fields.putAll(ownFields(builder));
        rules.addAll(parseRules(name, builder.rules));

        if (!builder.compoundId.isEmpty()) {
            idFields = new ArrayList<>(builder.compoundId);
        } else {
            List<String> flagged = new ArrayList<>();
            for (FieldDefinition field : fields.values()) {
                if (field.isId()) {
                    flagged.add(field.getName());
                }
            }
            if (!flagged.isEmpty()) {
                idFields = flagged;
            }
        }
        for (String idField : idFields) {
            FieldDefinition def = fields.get(idField);
            if (def == null || def.isRelation()) {
                throw new IllegalStateException("Id field \"" + idField + "\" of model \"" + name
                        + "\" must be a scalar field");
            }
        }
        if (idFields.isEmpty()) {
            throw new IllegalStateException("Model \"" + name + "\" has no id fields");
        }

        ModelDefinition model = new ModelDefinition(name, builder.tableName, fields, idFields, rules);
        inProgress.remove(name);
        resolved.put(name, model);
        return model;
    }

    private Map<String, FieldDefinition> ownFields(ModelBuilder builder) {
        Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        for (FieldBuilder field : builder.fields.values()) {
            List<PolicyRule> rules = parseRules(builder.name + "." + field.name, field.rules);
            fields.put(field.name, new FieldDefinition(field.name, field.type, field.id, field.optional,
                    field.array, field.relation, rules, null));
        }
        return fields;
    }

    private List<PolicyRule> parseRules(String owner, List<RuleDeclaration> declarations) {
        List<PolicyRule> rules = new ArrayList<>();
        for (RuleDeclaration declaration : declarations) {
            Expression condition;
            try {
                condition = parser.parse(declaration.condition);
            } catch (InvalidPolicyExpressionException e) {
                throw new InvalidPolicyExpressionException(owner,
                        "Invalid policy on \"" + owner + "\": " + e.getMessage(), declaration.condition, e);
            }
            rules.add(new PolicyRule(declaration.kind, PolicyOperation.parseList(declaration.operations),
                    condition, declaration.condition));
        }
        return rules;
    }

    // ========== Validation ==========

    private void validateFieldTypes(SchemaDefinition schema) {
        List<TypeDefinition> all = new ArrayList<>(schema.getModels());
        all.addAll(schema.getTypes());
        for (TypeDefinition def : all) {
            for (FieldDefinition field : def.getFieldList()) {
                if (BuiltinType.fromTypeName(field.getType()) == null
                        && schema.getModelOrType(field.getType()) == null) {
                    throw new IllegalStateException("Field \"" + def.getName() + "." + field.getName()
                            + "\" has unknown type \"" + field.getType() + "\"");
                }
                RelationDefinition relation = field.getRelation();
                if (relation == null) {
                    continue;
                }
                ModelDefinition target = schema.getModel(field.getType());
                if (target == null) {
                    throw new IllegalStateException("Relation \"" + def.getName() + "." + field.getName()
                            + "\" must target a model");
                }
                if (relation.isOwner()) {
                    for (String fk : relation.getFields()) {
                        if (!def.hasField(fk)) {
                            throw new IllegalStateException("Foreign key field \"" + fk + "\" not found in \""
                                    + def.getName() + "\"");
                        }
                    }
                    for (String pk : relation.getReferences()) {
                        if (!target.hasField(pk)) {
                            throw new IllegalStateException("Referenced field \"" + pk + "\" not found in \""
                                    + target.getName() + "\"");
                        }
                    }
                } else {
                    FieldDefinition opposite = target.getField(relation.getOpposite());
                    if (opposite != null && opposite.getRelation() != null && field.isArray() && opposite.isArray()) {
                        validateManyToMany(schema, def, field, target, opposite);
                    } else if (opposite == null || opposite.getRelation() == null
                            || !opposite.getRelation().isOwner()) {
                        throw new IllegalStateException("Relation \"" + def.getName() + "." + field.getName()
                                + "\" needs an owning opposite field \"" + relation.getOpposite() + "\" on \""
                                + target.getName() + "\"");
                    }
                }
            }
        }
    }

    private void validateManyToMany(SchemaDefinition schema, TypeDefinition def, FieldDefinition field,
                                    ModelDefinition target, FieldDefinition opposite) {
        String relation = def.getName() + "." + field.getName();
        if (!(def instanceof ModelDefinition)) {
            throw new IllegalStateException("Many-to-many relation \"" + relation + "\" must be declared on a model");
        }
        if (!field.getName().equals(opposite.getRelation().getOpposite())) {
            throw new IllegalStateException("Many-to-many relation \"" + relation + "\" and its opposite \""
                    + target.getName() + "." + opposite.getName() + "\" must point at each other");
        }
        if (((ModelDefinition) def).getIdFields().size() != 1 || target.getIdFields().size() != 1) {
            throw new IllegalStateException("Many-to-many relation \"" + relation
                    + "\" requires both models to have a single id field");
        }
        if (!Objects.equals(field.getRelation().getName(), opposite.getRelation().getName())) {
            throw new IllegalStateException("Many-to-many relation \"" + relation
                    + "\" and its opposite must declare the same relation name");
        }
        ManyToManyRelation m2m = schema.getManyToManyRelation(def.getName(), field.getName());
        if (schema.findModelByTable(m2m.getJoinTable()) != null) {
            throw new IllegalStateException("Join table \"" + m2m.getJoinTable() + "\" of relation \"" + relation
                    + "\" clashes with a model table");
        }
    }
}
