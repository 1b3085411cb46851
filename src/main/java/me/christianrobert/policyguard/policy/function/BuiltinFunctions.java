package me.christianrobert.policyguard.policy.function;

import me.christianrobert.policyguard.policy.exception.InvalidPolicyExpressionException;
import me.christianrobert.policyguard.policy.transformer.PredicateUtils;
import me.christianrobert.policyguard.schema.model.BuiltinType;
import me.christianrobert.policyguard.schema.model.FieldDefinition;
import me.christianrobert.policyguard.schema.model.ModelDefinition;
import me.christianrobert.policyguard.schema.model.PolicyOperation;
import me.christianrobert.policyguard.schema.model.RelationKeys;
import me.christianrobert.policyguard.sql.dialect.SqlDialect;
import me.christianrobert.policyguard.sql.node.AliasNode;
import me.christianrobert.policyguard.sql.node.ArrayNode;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.ColumnNode;
import me.christianrobert.policyguard.sql.node.FunctionNode;
import me.christianrobert.policyguard.sql.node.RawNode;
import me.christianrobert.policyguard.sql.node.SelectQueryNode;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.node.SqlOperator;
import me.christianrobert.policyguard.sql.node.TableNode;
import me.christianrobert.policyguard.sql.node.ValueNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Functions available to every policy expression.
 */
public final class BuiltinFunctions {

    private static final Logger log = LoggerFactory.getLogger(BuiltinFunctions.class);

    public static final String CONDITION_COLUMN = "$condition";

    private static final Set<PolicyOperation> CHECKABLE_OPERATIONS =
            EnumSet.of(PolicyOperation.CREATE, PolicyOperation.READ, PolicyOperation.UPDATE, PolicyOperation.DELETE);

    private BuiltinFunctions() {
    }

    static void registerAll(FunctionRegistry.Builder builder) {
        builder.register("contains", (args, ctx) -> stringMatch("contains", args, ctx, true, true));
        builder.register("startsWith", (args, ctx) -> stringMatch("startsWith", args, ctx, false, true));
        builder.register("endsWith", (args, ctx) -> stringMatch("endsWith", args, ctx, true, false));
        builder.register("has", BuiltinFunctions::has);
        builder.register("hasEvery", BuiltinFunctions::hasEvery);
        builder.register("hasSome", BuiltinFunctions::hasSome);
        builder.register("isEmpty", BuiltinFunctions::isEmpty);
        builder.register("now", (args, ctx) -> {
            requireArgCount("now", args, 0, 0);
            return new RawNode("CURRENT_TIMESTAMP");
        });
        builder.register("currentModel", (args, ctx) -> {
            requireArgCount("currentModel", args, 0, 1);
            return ValueNode.create(applyCasing(ctx.getModel(), casingArg("currentModel", args)));
        });
        builder.register("currentOperation", (args, ctx) -> {
            requireArgCount("currentOperation", args, 0, 1);
            return ValueNode.create(applyCasing(ctx.getOperation().getKeyword(), casingArg("currentOperation", args)));
        });
        builder.register("check", BuiltinFunctions::check);
    }

    // ========== String matching ==========

    private static SqlNode stringMatch(String name, List<SqlNode> args, FunctionContext ctx,
                                       boolean wildcardBefore, boolean wildcardAfter) {
        requireArgCount(name, args, 2, 3);
        SqlDialect dialect = ctx.getDialect();
        SqlNode field = args.get(0);
        SqlNode search = args.get(1);
        boolean caseInsensitive = args.size() > 2 && booleanArg(name, args.get(2));

        if (PredicateUtils.isNullNode(search)) {
            return ValueNode.NULL;
        }

        SqlNode pattern;
        if (search instanceof ValueNode && ((ValueNode) search).getValue() instanceof String) {
            String escaped = escapeLike((String) ((ValueNode) search).getValue());
            pattern = ValueNode.create((wildcardBefore ? "%" : "") + escaped + (wildcardAfter ? "%" : ""));
        } else {
            List<SqlNode> parts = new ArrayList<>();
            if (wildcardBefore) {
                parts.add(new RawNode("'%'"));
            }
            parts.add(dialect.escapeLikePattern(dialect.castText(search)));
            if (wildcardAfter) {
                parts.add(new RawNode("'%'"));
            }
            pattern = new FunctionNode("CONCAT", parts);
        }
        return dialect.buildLike(field, pattern, caseInsensitive);
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    // ========== Array fields ==========

    private static SqlNode has(List<SqlNode> args, FunctionContext ctx) {
        requireArgCount("has", args, 2, 2);
        if (PredicateUtils.isNullNode(args.get(1))) {
            return ValueNode.NULL;
        }
        return ctx.getDialect().buildArrayContains(args.get(0), args.get(1), elementType(args.get(0), ctx));
    }

    private static SqlNode hasEvery(List<SqlNode> args, FunctionContext ctx) {
        requireArgCount("hasEvery", args, 2, 2);
        SqlNode elements = args.get(1);
        if (PredicateUtils.isNullNode(elements)) {
            return ValueNode.NULL;
        }
        if (elements instanceof ArrayNode && ((ArrayNode) elements).getElements().isEmpty()) {
            return ctx.getDialect().trueNode();
        }
        return ctx.getDialect().buildArrayContainsAll(args.get(0), elements);
    }

    private static SqlNode hasSome(List<SqlNode> args, FunctionContext ctx) {
        requireArgCount("hasSome", args, 2, 2);
        SqlNode elements = args.get(1);
        if (PredicateUtils.isNullNode(elements)) {
            return ValueNode.NULL;
        }
        if (elements instanceof ArrayNode && ((ArrayNode) elements).getElements().isEmpty()) {
            return ctx.getDialect().falseNode();
        }
        return ctx.getDialect().buildArrayContainsAny(args.get(0), elements);
    }

    private static SqlNode isEmpty(List<SqlNode> args, FunctionContext ctx) {
        requireArgCount("isEmpty", args, 1, 1);
        return ctx.getDialect().buildArrayIsEmpty(args.get(0));
    }

    private static BuiltinType elementType(SqlNode arrayArg, FunctionContext ctx) {
        if (arrayArg instanceof ColumnNode) {
            FieldDefinition field = ctx.getSchema().getField(ctx.getModel(), ((ColumnNode) arrayArg).getColumn());
            if (field != null) {
                return field.getBuiltinType();
            }
        }
        return null;
    }

    // ========== check() ==========

    /**
     * {@code check(relation[, operation])}: the related row must satisfy its own model's policy for the
     * given operation, or for the operation being compiled when none is given.
     */
    private static SqlNode check(List<SqlNode> args, FunctionContext ctx) {
        requireArgCount("check", args, 1, 2);
        if (!(args.get(0) instanceof ColumnNode)) {
            throw new InvalidPolicyExpressionException(ctx.getModel(),
                    "check() expects a relation field as its first argument");
        }
        String fieldName = ((ColumnNode) args.get(0)).getColumn();
        FieldDefinition field = ctx.getSchema().requireField(ctx.getModel(), fieldName);
        if (!field.isRelation() || field.isArray()) {
            throw new InvalidPolicyExpressionException(ctx.getModel(),
                    "check() requires a to-one relation field, \"" + fieldName + "\" is not one");
        }

        PolicyOperation operation = ctx.getOperation();
        if (args.size() > 1) {
            SqlNode opArg = args.get(1);
            Object value = opArg instanceof ValueNode ? ((ValueNode) opArg).getValue() : null;
            PolicyOperation requested = null;
            if (value instanceof String) {
                try {
                    requested = PolicyOperation.fromKeyword((String) value);
                } catch (IllegalArgumentException e) {
                    log.debug("check() called with unknown operation '{}'", value);
                }
            }
            if (requested == null || !CHECKABLE_OPERATIONS.contains(requested)) {
                throw new InvalidPolicyExpressionException(ctx.getModel(),
                        "check() operation must be one of create, read, update, delete");
            }
            operation = requested;
        }

        ModelDefinition related = ctx.getSchema().requireModel(field.getType());
        String relatedAlias = ctx.relationAlias();
        SqlNode relatedFilter = ctx.getPolicyFilters().buildNestedPolicyFilter(related.getName(), relatedAlias,
                operation, ctx.getPrincipal(), ctx.getDepth() + 1);

        RelationKeys keys = ctx.getSchema().getRelationKeys(ctx.getModel(), fieldName);
        List<SqlNode> joinConditions = new ArrayList<>();
        for (RelationKeys.KeyPair pair : keys.getKeyPairs()) {
            if (keys.isOwnedByModel()) {
                joinConditions.add(BinaryOperationNode.of(ColumnNode.of(ctx.getModelAlias(), pair.getFk()),
                        SqlOperator.EQ, ColumnNode.of(relatedAlias, pair.getPk())));
            } else {
                joinConditions.add(BinaryOperationNode.of(ColumnNode.of(ctx.getModelAlias(), pair.getPk()),
                        SqlOperator.EQ, ColumnNode.of(relatedAlias, pair.getFk())));
            }
        }

        SelectQueryNode inner = SelectQueryNode.builder()
                .from(AliasNode.of(TableNode.of(related.getTableName()), relatedAlias))
                .select(AliasNode.of(relatedFilter, CONDITION_COLUMN))
                .where(PredicateUtils.conjunction(ctx.getDialect(), joinConditions))
                .build();
        return SelectQueryNode.builder()
                .from(AliasNode.of(inner, "$sub"))
                .select(ColumnNode.of("$sub", CONDITION_COLUMN))
                .build();
    }

    // ========== Argument helpers ==========

    private static void requireArgCount(String name, List<SqlNode> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw new InvalidPolicyExpressionException(
                    "Function \"" + name + "\" expects " + expected + " argument(s), got " + args.size());
        }
    }

    private static boolean booleanArg(String name, SqlNode arg) {
        if (arg instanceof ValueNode && ((ValueNode) arg).getValue() instanceof Boolean) {
            return (Boolean) ((ValueNode) arg).getValue();
        }
        throw new InvalidPolicyExpressionException("Function \"" + name + "\" expects a boolean literal argument");
    }

    private static String casingArg(String name, List<SqlNode> args) {
        if (args.isEmpty()) {
            return "original";
        }
        SqlNode arg = args.get(0);
        if (arg instanceof ValueNode && ((ValueNode) arg).getValue() instanceof String) {
            return (String) ((ValueNode) arg).getValue();
        }
        throw new InvalidPolicyExpressionException("Function \"" + name + "\" expects a string literal casing");
    }

    static String applyCasing(String value, String casing) {
        switch (casing) {
            case "original":
                return value;
            case "upper":
                return value.toUpperCase(Locale.ROOT);
            case "lower":
                return value.toLowerCase(Locale.ROOT);
            case "capitalize":
                return value.isEmpty() ? value : value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
            case "uncapitalize":
                return value.isEmpty() ? value : value.substring(0, 1).toLowerCase(Locale.ROOT) + value.substring(1);
            default:
                throw new InvalidPolicyExpressionException("Unsupported casing \"" + casing
                        + "\", expected one of original, upper, lower, capitalize, uncapitalize");
        }
    }
}
