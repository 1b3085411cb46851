package me.christianrobert.policyguard.policy.registry;

import me.christianrobert.policyguard.expression.Expressions;
import me.christianrobert.policyguard.policy.exception.InvalidPolicyExpressionException;
import me.christianrobert.policyguard.policy.function.FunctionRegistry;
import me.christianrobert.policyguard.policy.transformer.ExpressionTransformer;
import me.christianrobert.policyguard.policy.transformer.PolicyFilterProvider;
import me.christianrobert.policyguard.policy.transformer.PredicateUtils;
import me.christianrobert.policyguard.policy.transformer.TransformerContext;
import me.christianrobert.policyguard.schema.model.FieldDefinition;
import me.christianrobert.policyguard.schema.model.JoinTableDefinition;
import me.christianrobert.policyguard.schema.model.ModelDefinition;
import me.christianrobert.policyguard.schema.model.PolicyOperation;
import me.christianrobert.policyguard.schema.model.PolicyRule;
import me.christianrobert.policyguard.schema.model.SchemaDefinition;
import me.christianrobert.policyguard.sql.dialect.SqlDialect;
import me.christianrobert.policyguard.sql.node.AliasNode;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.ColumnNode;
import me.christianrobert.policyguard.sql.node.SelectQueryNode;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.node.SqlOperator;
import me.christianrobert.policyguard.sql.node.TableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Looks up the policy rules of models and fields and compiles them into combined predicates.
 *
 * <p>Rule lists are resolved lazily and cached per (model, operation) and (model, field, operation).
 * Compiled predicates are not cached since they depend on the principal.
 */
public class PolicyRegistry implements PolicyFilterProvider {

    private static final Logger log = LoggerFactory.getLogger(PolicyRegistry.class);

    private final SchemaDefinition schema;
    private final SqlDialect dialect;
    private final ExpressionTransformer transformer;

    private final Map<String, List<PolicyRule>> modelRuleCache = new ConcurrentHashMap<>();
    private final Map<String, List<PolicyRule>> fieldRuleCache = new ConcurrentHashMap<>();

    public PolicyRegistry(SchemaDefinition schema, SqlDialect dialect, FunctionRegistry functions) {
        this.schema = schema;
        this.dialect = dialect;
        this.transformer = new ExpressionTransformer(schema, dialect, functions, this);
    }

    public SchemaDefinition getSchema() {
        return schema;
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    public ExpressionTransformer getTransformer() {
        return transformer;
    }

    // ========== Rule lookup ==========

    public List<PolicyRule> getModelPolicies(String model, PolicyOperation operation) {
        return modelRuleCache.computeIfAbsent(model + ":" + operation.getKeyword(), key -> {
            ModelDefinition def = schema.requireModel(model);
            List<PolicyRule> rules = new ArrayList<>();
            for (PolicyRule rule : def.getRules()) {
                if (rule.appliesTo(operation)) {
                    rules.add(rule);
                }
            }
            log.debug("Resolved {} {} rule(s) for model {}", rules.size(), operation, model);
            return List.copyOf(rules);
        });
    }

    public List<PolicyRule> getFieldPolicies(String model, String field, PolicyOperation operation) {
        return fieldRuleCache.computeIfAbsent(model + ":" + field + ":" + operation.getKeyword(), key -> {
            FieldDefinition def = schema.requireField(model, field);
            List<PolicyRule> rules = new ArrayList<>();
            for (PolicyRule rule : def.getRules()) {
                if (rule.appliesTo(operation)) {
                    rules.add(rule);
                }
            }
            return List.copyOf(rules);
        });
    }

    public boolean hasFieldPolicies(String model, String field, PolicyOperation operation) {
        return !getFieldPolicies(model, field, operation).isEmpty();
    }

    /**
     * Whether any field of the model carries rules for the operation.
     */
    public boolean hasAnyFieldPolicies(String model, PolicyOperation operation) {
        for (FieldDefinition field : schema.requireModel(model).getFieldList()) {
            if (!field.isRelation() && hasFieldPolicies(model, field.getName(), operation)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Decides a model's policy without compiling it, when its rules allow that.
     */
    public PolicyDecision getConstantDecision(String model, PolicyOperation operation) {
        List<PolicyRule> rules = getModelPolicies(model, operation);
        boolean hasAllow = false;
        boolean hasDeny = false;
        boolean unconditionalAllow = false;
        for (PolicyRule rule : rules) {
            if (rule.isAllow()) {
                hasAllow = true;
                if (Expressions.isTrueLiteral(rule.getCondition())) {
                    unconditionalAllow = true;
                }
            } else {
                hasDeny = true;
                if (Expressions.isTrueLiteral(rule.getCondition())) {
                    return PolicyDecision.ALWAYS_DENY;
                }
            }
        }
        if (!hasAllow) {
            return PolicyDecision.ALWAYS_DENY;
        }
        if (!hasDeny && unconditionalAllow) {
            return PolicyDecision.ALWAYS_ALLOW;
        }
        return PolicyDecision.CONDITIONAL;
    }

    // ========== Compilation ==========

    /**
     * Combined model predicate: {@code OR(allows) AND AND(COALESCE(deny, FALSE) = FALSE)}.
     * Without allow rules the predicate is {@code FALSE}, except for post-update where it is {@code TRUE}.
     */
    @Override
    public SqlNode buildPolicyFilter(String model, String alias, PolicyOperation operation,
                                     Map<String, Object> principal) {
        return buildNestedPolicyFilter(model, alias, operation, principal, 0);
    }

    @Override
    public SqlNode buildNestedPolicyFilter(String model, String alias, PolicyOperation operation,
                                           Map<String, Object> principal, int depth) {
        List<PolicyRule> rules = getModelPolicies(model, operation);
        boolean emptyAllowIsTrue = operation == PolicyOperation.POST_UPDATE;
        SqlNode filter = combine(model, alias, operation, principal, rules, emptyAllowIsTrue, depth);
        if (log.isDebugEnabled()) {
            log.debug("Policy filter for {} {} (alias {}): {}", model, operation, alias, filter);
        }
        return filter;
    }

    /**
     * Combined predicate of a field's own rules. Field rules only restrict, so no allow rule means {@code TRUE}.
     */
    public SqlNode buildFieldPolicyFilter(String model, String alias, String field, PolicyOperation operation,
                                          Map<String, Object> principal) {
        List<PolicyRule> rules = getFieldPolicies(model, field, operation);
        return combine(model, alias, operation, principal, rules, true, 0);
    }

    /**
     * Predicate over the rows of a many-to-many join table: a link is readable when both linked rows are
     * readable, and may be created, changed or removed only when both linked rows are updatable.
     *
     * @param alias alias the join table is referenced by, or {@code null} for its table name
     */
    public SqlNode buildJoinTableFilter(JoinTableDefinition joinTable, String alias, PolicyOperation operation,
                                        Map<String, Object> principal) {
        String ref = alias != null ? alias : joinTable.getTableName();
        PolicyOperation sideOperation = operation == PolicyOperation.READ
                ? PolicyOperation.READ
                : PolicyOperation.UPDATE;
        SqlNode first = joinSideCondition(joinTable.getFirstModel(), joinTable.getFirstIdField(),
                ColumnNode.of(ref, JoinTableDefinition.FIRST_COLUMN), sideOperation, principal);
        SqlNode second = joinSideCondition(joinTable.getSecondModel(), joinTable.getSecondIdField(),
                ColumnNode.of(ref, JoinTableDefinition.SECOND_COLUMN), sideOperation, principal);
        return PredicateUtils.conjunction(dialect, first, second);
    }

    /**
     * {@code (SELECT <policy> FROM model AS $r1 WHERE $r1.id = <key>)}: the policy of the row with the given id,
     * {@code NULL} when there is no such row.
     */
    public SqlNode joinSideCondition(String model, String idField, SqlNode key, PolicyOperation operation,
                                     Map<String, Object> principal) {
        String sideAlias = ExpressionTransformer.RELATION_ALIAS_PREFIX + 1;
        SqlNode filter = buildNestedPolicyFilter(model, sideAlias, operation, principal, 1);
        if (PredicateUtils.isFalse(filter)) {
            return filter;
        }
        return SelectQueryNode.builder()
                .from(AliasNode.of(TableNode.of(schema.requireModel(model).getTableName()), sideAlias))
                .select(AliasNode.of(filter, ExpressionTransformer.SCALAR_COLUMN))
                .where(BinaryOperationNode.of(ColumnNode.of(sideAlias, idField), SqlOperator.EQ, key))
                .build();
    }

    private SqlNode combine(String model, String alias, PolicyOperation operation, Map<String, Object> principal,
                            List<PolicyRule> rules, boolean emptyAllowIsTrue, int depth) {
        TransformerContext context = TransformerContext.forModel(model, alias, operation, principal, depth);
        List<SqlNode> allows = new ArrayList<>();
        List<SqlNode> denies = new ArrayList<>();
        for (PolicyRule rule : rules) {
            SqlNode compiled = compileRule(model, rule, context);
            if (rule.isAllow()) {
                allows.add(compiled);
            } else {
                denies.add(PredicateUtils.buildIsFalse(dialect, compiled));
            }
        }

        SqlNode allowFilter;
        if (allows.isEmpty()) {
            allowFilter = emptyAllowIsTrue ? dialect.trueNode() : dialect.falseNode();
        } else {
            allowFilter = PredicateUtils.disjunction(dialect, allows);
        }
        SqlNode denyFilter = PredicateUtils.conjunction(dialect, denies);
        return PredicateUtils.conjunction(dialect, allowFilter, denyFilter);
    }

    private SqlNode compileRule(String model, PolicyRule rule, TransformerContext context) {
        try {
            return transformer.transform(rule.getCondition(), context);
        } catch (InvalidPolicyExpressionException e) {
            if (e.getExpression() != null) {
                throw e;
            }
            throw new InvalidPolicyExpressionException(model, e.getMessage(), rule.getSource(), e);
        }
    }
}
