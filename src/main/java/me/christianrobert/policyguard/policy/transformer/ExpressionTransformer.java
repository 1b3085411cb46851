package me.christianrobert.policyguard.policy.transformer;

import me.christianrobert.policyguard.expression.ArrayExpression;
import me.christianrobert.policyguard.expression.BinaryExpression;
import me.christianrobert.policyguard.expression.BinaryOperator;
import me.christianrobert.policyguard.expression.BindingExpression;
import me.christianrobert.policyguard.expression.CallExpression;
import me.christianrobert.policyguard.expression.Expression;
import me.christianrobert.policyguard.expression.ExpressionVisitor;
import me.christianrobert.policyguard.expression.Expressions;
import me.christianrobert.policyguard.expression.FieldExpression;
import me.christianrobert.policyguard.expression.LiteralExpression;
import me.christianrobert.policyguard.expression.MemberExpression;
import me.christianrobert.policyguard.expression.NullExpression;
import me.christianrobert.policyguard.expression.ThisExpression;
import me.christianrobert.policyguard.expression.UnaryExpression;
import me.christianrobert.policyguard.policy.exception.InvalidPolicyExpressionException;
import me.christianrobert.policyguard.policy.function.FunctionContext;
import me.christianrobert.policyguard.policy.function.FunctionRegistry;
import me.christianrobert.policyguard.policy.function.PolicyFunction;
import me.christianrobert.policyguard.schema.model.BuiltinType;
import me.christianrobert.policyguard.schema.model.FieldDefinition;
import me.christianrobert.policyguard.schema.model.ManyToManyRelation;
import me.christianrobert.policyguard.schema.model.ModelDefinition;
import me.christianrobert.policyguard.schema.model.PolicyOperation;
import me.christianrobert.policyguard.schema.model.RelationKeys;
import me.christianrobert.policyguard.schema.model.SchemaDefinition;
import me.christianrobert.policyguard.schema.model.TypeDefinition;
import me.christianrobert.policyguard.sql.dialect.SqlDialect;
import me.christianrobert.policyguard.sql.node.AliasNode;
import me.christianrobert.policyguard.sql.node.ArrayNode;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.ColumnNode;
import me.christianrobert.policyguard.sql.node.FunctionNode;
import me.christianrobert.policyguard.sql.node.JoinNode;
import me.christianrobert.policyguard.sql.node.SelectQueryNode;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.node.SqlOperator;
import me.christianrobert.policyguard.sql.node.TableNode;
import me.christianrobert.policyguard.sql.node.ValueListNode;
import me.christianrobert.policyguard.sql.node.ValueNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Compiles a policy expression into a SQL predicate tree.
 *
 * <p>Scalar fields become column references of the model being checked, relation traversals become
 * correlated subqueries against the related tables, and everything that only depends on the principal
 * is evaluated at compile time and folded into constants.
 *
 * <p>Stateless apart from its collaborators; one instance can compile concurrently for any number of
 * requests.
 */
public class ExpressionTransformer implements ExpressionVisitor<SqlNode, TransformerContext> {

    /** Column alias of the single value projected by a correlated scalar subquery. */
    public static final String SCALAR_COLUMN = "$t";

    /** Row source holding the pre-update values in post-update checks. */
    public static final String BEFORE_ALIAS = "$before";

    /** Prefix of the aliases given to related tables in relation subqueries. */
    public static final String RELATION_ALIAS_PREFIX = "$r";

    /** Prefix of the aliases given to join tables of many-to-many relations. */
    public static final String JOIN_TABLE_ALIAS_PREFIX = "$j";

    private final SchemaDefinition schema;
    private final SqlDialect dialect;
    private final FunctionRegistry functions;
    private final PolicyFilterProvider policyFilters;
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    public ExpressionTransformer(SchemaDefinition schema, SqlDialect dialect, FunctionRegistry functions,
                                 PolicyFilterProvider policyFilters) {
        this.schema = schema;
        this.dialect = dialect;
        this.functions = functions;
        this.policyFilters = policyFilters;
    }

    public SqlNode transform(Expression expr, TransformerContext context) {
        return expr.accept(this, context);
    }

    // ========== Leaves ==========

    @Override
    public SqlNode visitLiteral(LiteralExpression expr, TransformerContext context) {
        return transformValue(expr.getValue(), literalType(expr.getValue()));
    }

    @Override
    public SqlNode visitNull(NullExpression expr, TransformerContext context) {
        return ValueNode.NULL;
    }

    @Override
    public SqlNode visitArray(ArrayExpression expr, TransformerContext context) {
        List<SqlNode> items = new ArrayList<>();
        for (Expression item : expr.getItems()) {
            items.add(transform(item, context));
        }
        return dialect.buildArrayValue(items, BuiltinType.fromTypeName(expr.getItemType()));
    }

    @Override
    public SqlNode visitThis(ThisExpression expr, TransformerContext context) {
        throw new InvalidPolicyExpressionException(context.getThisType(),
                "\"this\" can only be used as the receiver of a member access or in a comparison with auth()");
    }

    @Override
    public SqlNode visitBinding(BindingExpression expr, TransformerContext context) {
        throw new InvalidPolicyExpressionException(context.getThisType(),
                "Binding \"" + expr.getName() + "\" can only be used as the receiver of a member access");
    }

    // ========== Fields ==========

    @Override
    public SqlNode visitField(FieldExpression expr, TransformerContext context) {
        FieldDefinition fieldDef = schema.requireField(context.getModelOrType(), expr.getField());

        if (context.hasContextValue()) {
            Object value = context.getContextValue() instanceof Map
                    ? ((Map<?, ?>) context.getContextValue()).get(expr.getField())
                    : null;
            return transformValue(value, fieldDef.getBuiltinType());
        }

        if (!fieldDef.isRelation()) {
            return ColumnNode.of(tableRef(context.getModelOrType(), context.getAlias()), expr.getField());
        }

        SelectQueryNode relation = transformRelationAccess(expr.getField(), fieldDef.getType(),
                context.withoutMember());
        return applyMemberContext(relation, context);
    }

    /**
     * {@code SELECT FROM related AS $r<n> WHERE <key pairs>}, correlated with the rows of the context model.
     * Many-to-many relations go through their join table.
     */
    SelectQueryNode transformRelationAccess(String field, String relationModel, TransformerContext context) {
        String fromRef = tableRef(context.getModelOrType(), context.getAlias());
        String relatedAlias = context.relationAlias();

        ManyToManyRelation m2m = schema.getManyToManyRelation(context.getModelOrType(), field);
        if (m2m != null) {
            return transformManyToManyAccess(m2m, fromRef, relatedAlias, context.joinTableAlias());
        }

        RelationKeys keys = schema.getRelationKeys(context.getModelOrType(), field);
        List<SqlNode> conditions = new ArrayList<>();
        for (RelationKeys.KeyPair pair : keys.getKeyPairs()) {
            if (keys.isOwnedByModel()) {
                conditions.add(BinaryOperationNode.of(ColumnNode.of(fromRef, pair.getFk()), SqlOperator.EQ,
                        ColumnNode.of(relatedAlias, pair.getPk())));
            } else {
                conditions.add(BinaryOperationNode.of(ColumnNode.of(fromRef, pair.getPk()), SqlOperator.EQ,
                        ColumnNode.of(relatedAlias, pair.getFk())));
            }
        }
        return SelectQueryNode.builder()
                .from(AliasNode.of(TableNode.of(tableName(relationModel)), relatedAlias))
                .where(PredicateUtils.conjunction(dialect, conditions))
                .build();
    }

    /**
     * {@code SELECT FROM other AS $r<n> INNER JOIN join_table AS $j<n> ON other.pk = $j<n>.otherFk
     * WHERE $j<n>.parentFk = parent.pk}.
     */
    private SelectQueryNode transformManyToManyAccess(ManyToManyRelation m2m, String fromRef, String relatedAlias,
                                                      String joinAlias) {
        SqlNode joinOn = BinaryOperationNode.of(ColumnNode.of(relatedAlias, m2m.getOtherPk()), SqlOperator.EQ,
                ColumnNode.of(joinAlias, m2m.getOtherFk()));
        return SelectQueryNode.builder()
                .from(AliasNode.of(TableNode.of(tableName(m2m.getOtherModel())), relatedAlias))
                .join(new JoinNode(JoinNode.JoinType.INNER,
                        AliasNode.of(TableNode.of(m2m.getJoinTable()), joinAlias), joinOn))
                .where(BinaryOperationNode.of(ColumnNode.of(joinAlias, m2m.getParentFk()), SqlOperator.EQ,
                        ColumnNode.of(fromRef, m2m.getParentPk())))
                .build();
    }

    private SelectQueryNode applyMemberContext(SelectQueryNode relation, TransformerContext context) {
        SelectQueryNode result = relation;
        if (context.getMemberFilter() != null) {
            result = result.withWhere(PredicateUtils.conjunction(dialect, result.getWhere(), context.getMemberFilter()));
        }
        if (context.getMemberSelect() != null) {
            result = result.withSelections(List.of(context.getMemberSelect()));
        }
        return result;
    }

    // ========== Member access ==========

    @Override
    public SqlNode visitMember(MemberExpression expr, TransformerContext context) {
        Expression receiver = expr.getReceiver();
        List<String> members = expr.getMembers();

        if (receiver instanceof BindingExpression) {
            BindingScope scope = requireBinding((BindingExpression) receiver, context);
            if (scope.hasValue()) {
                return valueMemberAccess(scope.getValue(), members, scope.getType());
            }
        }
        if (Expressions.isAuthCall(receiver)) {
            return valueMemberAccess(context.getPrincipal(), members, schema.requireAuthType());
        }
        if (receiver instanceof FieldExpression && context.hasContextValue()) {
            List<String> fullPath = new ArrayList<>();
            fullPath.add(((FieldExpression) receiver).getField());
            fullPath.addAll(members);
            return valueMemberAccess(context.getContextValue(), fullPath, context.getModelOrType());
        }
        if (Expressions.isBeforeCall(receiver)) {
            if (context.getOperation() != PolicyOperation.POST_UPDATE) {
                throw new InvalidPolicyExpressionException(context.getThisType(),
                        "before() is only allowed in post-update policies");
            }
            if (members.size() != 1) {
                throw new InvalidPolicyExpressionException(context.getThisType(),
                        "Only single-level member access is supported on before()");
            }
            return ColumnNode.of(BEFORE_ALIAS, members.get(0));
        }

        // context for the receiver itself: no inherited filter/projection
        TransformerContext restContext = context.withoutMember();
        SelectQueryNode receiverQuery;
        String startType;
        List<String> path;

        if (receiver instanceof ThisExpression || receiver instanceof BindingExpression) {
            String type;
            String alias;
            if (receiver instanceof ThisExpression) {
                type = context.getThisType();
                alias = context.getThisAlias();
            } else {
                BindingScope scope = requireBinding((BindingExpression) receiver, context);
                type = scope.getType();
                alias = scope.getAlias();
            }
            if (members.size() == 1) {
                return visitField(Expressions.field(members.get(0)),
                        context.withModel(type, alias).withoutContextValue());
            }
            FieldDefinition first = schema.requireField(type, members.get(0));
            if (!first.isRelation()) {
                throw new InvalidPolicyExpressionException(type,
                        "Member access on non-relation field \"" + members.get(0) + "\"");
            }
            receiverQuery = transformRelationAccess(members.get(0), first.getType(),
                    restContext.withModel(type, alias).withoutContextValue());
            startType = first.getType();
            path = members.subList(1, members.size());
        } else if (receiver instanceof FieldExpression) {
            FieldDefinition receiverField = schema.requireField(context.getModelOrType(),
                    ((FieldExpression) receiver).getField());
            SqlNode receiverNode = transform(receiver, restContext);
            if (!(receiverNode instanceof SelectQueryNode)) {
                throw new InvalidPolicyExpressionException(context.getModelOrType(),
                        "Member access on non-relation field \"" + receiverField.getName() + "\"");
            }
            receiverQuery = (SelectQueryNode) receiverNode;
            startType = receiverField.getType();
            path = members;
        } else {
            throw new InvalidPolicyExpressionException(context.getThisType(),
                    "Unsupported member access receiver: " + receiver);
        }

        // resolve the declaring type of every path segment
        List<String> owners = new ArrayList<>();
        List<FieldDefinition> fields = new ArrayList<>();
        String currentType = startType;
        for (String member : path) {
            FieldDefinition fieldDef = schema.requireField(currentType, member);
            owners.add(currentType);
            fields.add(fieldDef);
            currentType = fieldDef.getType();
        }

        // build innermost first: the last segment carries the inherited filter/projection.
        // segment i reads from the subquery opened one level above it
        SqlNode current = null;
        for (int i = path.size() - 1; i >= 0; i--) {
            FieldDefinition fieldDef = fields.get(i);
            String owner = owners.get(i);
            String ownerAlias = restContext.nested(i).relationAlias();
            if (fieldDef.isRelation()) {
                SelectQueryNode relation = transformRelationAccess(path.get(i), fieldDef.getType(),
                        restContext.withModel(owner, ownerAlias).nested(i + 1).withoutContextValue());
                if (current != null) {
                    current = relation.withSelections(List.of(AliasNode.of(current, path.get(i + 1))));
                } else {
                    current = applyMemberContext(relation, context);
                }
            } else {
                if (current != null) {
                    throw new InvalidPolicyExpressionException(owner,
                            "Scalar field \"" + path.get(i) + "\" cannot be followed by a member access");
                }
                current = ColumnNode.of(ownerAlias, path.get(i));
            }
        }

        return receiverQuery.withSelections(List.of(AliasNode.of(current, SCALAR_COLUMN)));
    }

    /**
     * Member access on a plain value (principal data or a bound element), folded to a constant.
     * A missing path yields {@code NULL}.
     */
    private SqlNode valueMemberAccess(Object receiver, List<String> members, String receiverType) {
        Object current = receiver;
        String currentType = receiverType;
        for (String member : members) {
            if (!(current instanceof Map)) {
                return ValueNode.NULL;
            }
            FieldDefinition fieldDef = schema.requireField(currentType, member);
            current = ((Map<?, ?>) current).get(member);
            currentType = fieldDef.getType();
        }
        return transformValue(current, BuiltinType.fromTypeName(currentType));
    }

    // ========== Operators ==========

    @Override
    public SqlNode visitUnary(UnaryExpression expr, TransformerContext context) {
        return PredicateUtils.logicalNot(dialect, transform(expr.getOperand(), context));
    }

    @Override
    public SqlNode visitBinary(BinaryExpression expr, TransformerContext context) {
        BinaryOperator op = expr.getOperator();

        if (op == BinaryOperator.AND) {
            return PredicateUtils.conjunction(dialect,
                    transform(expr.getLeft(), context), transform(expr.getRight(), context));
        }
        if (op == BinaryOperator.OR) {
            return PredicateUtils.disjunction(dialect,
                    transform(expr.getLeft(), context), transform(expr.getRight(), context));
        }
        if (Expressions.isAuthCall(expr.getLeft()) || Expressions.isAuthCall(expr.getRight())) {
            return transformAuthBinary(expr, context);
        }
        if (op.isCollectionPredicate()) {
            return transformCollectionPredicate(expr, context);
        }

        Expression leftExpr = normalizeRelationOperand(expr.getLeft(), expr.getRight(), context);
        Expression rightExpr = normalizeRelationOperand(expr.getRight(), expr.getLeft(), context);
        SqlNode left = transform(leftExpr, context);
        SqlNode right = transform(rightExpr, context);

        if (op == BinaryOperator.IN) {
            return transformIn(left, right);
        }
        if (PredicateUtils.isNullNode(right)) {
            return transformNullCheck(left, op);
        }
        if (PredicateUtils.isNullNode(left)) {
            return transformNullCheck(right, op);
        }

        SqlNode folded = foldConstantComparison(left, op, right);
        if (folded != null) {
            return folded;
        }
        return BinaryOperationNode.of(left, toSqlOperator(op), right);
    }

    private SqlNode transformIn(SqlNode left, SqlNode right) {
        if (PredicateUtils.isNullNode(left) || PredicateUtils.isNullNode(right)) {
            return dialect.falseNode();
        }
        if (right instanceof ArrayNode) {
            List<SqlNode> items = ((ArrayNode) right).getElements();
            if (items.isEmpty()) {
                return dialect.falseNode();
            }
            if (left instanceof ValueNode && items.stream().allMatch(item -> item instanceof ValueNode)) {
                Object leftValue = ((ValueNode) left).getValue();
                for (SqlNode item : items) {
                    if (ExpressionEvaluator.valuesEqual(leftValue, ((ValueNode) item).getValue())) {
                        return dialect.trueNode();
                    }
                }
                return dialect.falseNode();
            }
            return BinaryOperationNode.of(left, SqlOperator.IN, new ValueListNode(items));
        }
        return BinaryOperationNode.of(left, SqlOperator.EQ, FunctionNode.of("ANY", right));
    }

    private SqlNode transformNullCheck(SqlNode operand, BinaryOperator op) {
        if (op == BinaryOperator.EQ || op == BinaryOperator.NE) {
            boolean isEq = op == BinaryOperator.EQ;
            if (operand instanceof ValueNode) {
                boolean isNull = ((ValueNode) operand).isNull();
                return isNull == isEq ? dialect.trueNode() : dialect.falseNode();
            }
            return BinaryOperationNode.of(operand, isEq ? SqlOperator.IS : SqlOperator.IS_NOT, ValueNode.NULL);
        }
        // ordering against null is unknown
        return ValueNode.NULL;
    }

    private SqlNode foldConstantComparison(SqlNode left, BinaryOperator op, SqlNode right) {
        if (!(left instanceof ValueNode) || !(right instanceof ValueNode)) {
            return null;
        }
        Object l = ((ValueNode) left).getValue();
        Object r = ((ValueNode) right).getValue();
        if (!isFoldable(l) || !isFoldable(r)) {
            return null;
        }
        boolean result;
        switch (op) {
            case EQ:
                result = ExpressionEvaluator.valuesEqual(l, r);
                break;
            case NE:
                result = !ExpressionEvaluator.valuesEqual(l, r);
                break;
            default:
                Integer cmp = ExpressionEvaluator.compareValues(l, r);
                if (cmp == null) {
                    return null;
                }
                result = switch (op) {
                    case LT -> cmp < 0;
                    case LE -> cmp <= 0;
                    case GT -> cmp > 0;
                    default -> cmp >= 0;
                };
                break;
        }
        return result ? dialect.trueNode() : dialect.falseNode();
    }

    private static boolean isFoldable(Object value) {
        return value instanceof Number || value instanceof String || value instanceof Boolean;
    }

    /**
     * A to-one relation compared with {@code null} is compared through its first id field instead.
     */
    private Expression normalizeRelationOperand(Expression operand, Expression other, TransformerContext context) {
        if (context.hasContextValue()) {
            return operand;
        }
        FieldDefinition relationField = relationFieldRef(operand, context);
        if (relationField == null) {
            return operand;
        }
        if (!Expressions.isNull(other)) {
            throw new InvalidPolicyExpressionException(context.getThisType(),
                    "Relation field \"" + relationField.getName() + "\" can only be compared with null");
        }
        String firstId = schema.requireIdFields(relationField.getType()).get(0);
        return Expressions.appendMember(operand, firstId);
    }

    private FieldDefinition relationFieldRef(Expression expr, TransformerContext context) {
        FieldDefinition fieldDef = null;
        if (expr instanceof FieldExpression) {
            fieldDef = schema.getField(context.getModelOrType(), ((FieldExpression) expr).getField());
        } else if (expr instanceof MemberExpression) {
            MemberExpression member = (MemberExpression) expr;
            if (member.getReceiver() instanceof ThisExpression && member.getMembers().size() == 1) {
                fieldDef = schema.getField(context.getThisType(), member.getMembers().get(0));
            }
        }
        return fieldDef != null && fieldDef.isRelation() ? fieldDef : null;
    }

    /**
     * {@code auth() == x} / {@code auth() != x}: presence test against {@code null}, otherwise an
     * id-by-id equality between the principal and {@code x}.
     */
    private SqlNode transformAuthBinary(BinaryExpression expr, TransformerContext context) {
        BinaryOperator op = expr.getOperator();
        if (op != BinaryOperator.EQ && op != BinaryOperator.NE) {
            throw new InvalidPolicyExpressionException(context.getThisType(),
                    "auth() can only be compared with == or !=");
        }
        Expression other = Expressions.isAuthCall(expr.getLeft()) ? expr.getRight() : expr.getLeft();
        Map<String, Object> principal = context.getPrincipal();
        boolean isEq = op == BinaryOperator.EQ;

        if (Expressions.isNull(other)) {
            boolean absent = principal == null;
            return absent == isEq ? dialect.trueNode() : dialect.falseNode();
        }

        String authType = schema.requireAuthType();
        List<String> idFields = schema.requireIdFields(authType);
        if (principal == null || !hasAllIds(principal, idFields)) {
            return isEq ? dialect.falseNode() : dialect.trueNode();
        }

        List<Expression> conditions = new ArrayList<>();
        for (String id : idFields) {
            conditions.add(Expressions.binary(Expressions.member(Expressions.auth(), id), BinaryOperator.EQ,
                    Expressions.appendMember(other, id)));
        }
        Expression rewritten = Expressions.and(conditions);
        if (!isEq) {
            rewritten = Expressions.not(rewritten);
        }
        return transform(rewritten, context);
    }

    private static boolean hasAllIds(Map<String, Object> principal, List<String> idFields) {
        for (String id : idFields) {
            if (principal.get(id) == null) {
                return false;
            }
        }
        return true;
    }

    // ========== Collection predicates ==========

    private SqlNode transformCollectionPredicate(BinaryExpression expr, TransformerContext context) {
        Expression left = expr.getLeft();

        if (Expressions.isAuthMember(left) || context.hasContextValue()) {
            if (!(left instanceof MemberExpression) && !(left instanceof FieldExpression)) {
                throw new InvalidPolicyExpressionException(context.getThisType(),
                        "Collection predicate expects a field or member access on its left side");
            }
            Object receiver = evaluator.evaluate(left, context.getPrincipal(), context.getContextValue(),
                    context.getBindingValues());
            String baseType = Expressions.isAuthMember(left) ? schema.requireAuthType() : context.getModelOrType();
            String elementType = memberType(baseType, left);
            return transformValueCollectionPredicate(receiver, expr, elementType, context);
        }

        // the predicate runs inside the innermost relation subquery of the left side
        String relatedModel = relationTarget(left, context);
        int levels = relationDepth(left);
        String relatedAlias = context.nested(levels - 1).relationAlias();
        TransformerContext predicateContext = context.withModel(relatedModel, relatedAlias)
                .nested(levels)
                .withoutMember()
                .withoutContextValue();
        if (expr.getBinding() != null) {
            predicateContext = predicateContext.withBinding(expr.getBinding(),
                    BindingScope.ofRows(relatedModel, relatedAlias));
        }
        SqlNode predicate = transform(expr.getRight(), predicateContext);
        if (expr.getOperator() == BinaryOperator.EVERY) {
            predicate = PredicateUtils.logicalNot(dialect, predicate);
        }

        SqlNode count = FunctionNode.of("COUNT", ValueNode.createImmediate(1));
        SqlNode result = expr.getOperator() == BinaryOperator.SOME
                ? BinaryOperationNode.of(count, SqlOperator.GT, ValueNode.createImmediate(0))
                : BinaryOperationNode.of(count, SqlOperator.EQ, ValueNode.createImmediate(0));

        return transform(left, context.withoutContextValue()
                .withMemberFilter(predicate)
                .withMemberSelect(AliasNode.of(result, SCALAR_COLUMN)));
    }

    /**
     * Collection predicate over a plain list value: evaluated in memory when the predicate does not refer to
     * {@code this}, otherwise expanded into one compiled predicate per element.
     */
    private SqlNode transformValueCollectionPredicate(Object receiver, BinaryExpression expr, String elementType,
                                                      TransformerContext context) {
        if (receiver == null) {
            return ValueNode.NULL;
        }
        if (!Expressions.referencesThis(expr.getRight())) {
            Object value = evaluator.evaluate(expr, context.getPrincipal(), context.getContextValue(),
                    context.getBindingValues());
            return transformValue(value, BuiltinType.BOOLEAN);
        }
        if (!(receiver instanceof Collection)) {
            throw new InvalidPolicyExpressionException(context.getThisType(),
                    "Collection predicate requires a list value");
        }

        List<SqlNode> components = new ArrayList<>();
        for (Object item : (Collection<?>) receiver) {
            TransformerContext itemContext = context.withModel(elementType, null)
                    .withoutMember()
                    .withContextValue(item);
            if (expr.getBinding() != null) {
                itemContext = itemContext.withBinding(expr.getBinding(),
                        BindingScope.ofValue(elementType, null, item));
            }
            components.add(transform(expr.getRight(), itemContext));
        }

        switch (expr.getOperator()) {
            case SOME:
                return PredicateUtils.disjunction(dialect, components);
            case EVERY:
                return PredicateUtils.conjunction(dialect, components);
            default:
                return PredicateUtils.logicalNot(dialect, PredicateUtils.disjunction(dialect, components));
        }
    }

    private String relationTarget(Expression left, TransformerContext context) {
        FieldDefinition direct = relationFieldRef(left, context);
        if (direct != null) {
            return direct.getType();
        }
        if (left instanceof FieldExpression) {
            throw new InvalidPolicyExpressionException(context.getModelOrType(),
                    "Collection predicate expects a relation or list field, \""
                            + ((FieldExpression) left).getField() + "\" is neither");
        }
        if (!(left instanceof MemberExpression)) {
            throw new InvalidPolicyExpressionException(context.getThisType(),
                    "Collection predicate expects a field or member access on its left side");
        }

        MemberExpression member = (MemberExpression) left;
        String currentType;
        Expression receiver = member.getReceiver();
        if (receiver instanceof FieldExpression) {
            currentType = schema.requireField(context.getModelOrType(), ((FieldExpression) receiver).getField())
                    .getType();
        } else if (receiver instanceof BindingExpression) {
            currentType = requireBinding((BindingExpression) receiver, context).getType();
        } else if (receiver instanceof ThisExpression) {
            currentType = context.getThisType();
        } else {
            throw new InvalidPolicyExpressionException(context.getThisType(),
                    "Unsupported collection predicate receiver: " + receiver);
        }
        FieldDefinition fieldDef = null;
        for (String name : member.getMembers()) {
            fieldDef = schema.requireField(currentType, name);
            currentType = fieldDef.getType();
        }
        if (fieldDef == null || !fieldDef.isRelation()) {
            throw new InvalidPolicyExpressionException(context.getThisType(),
                    "Collection predicate expects a relation on its left side: " + left);
        }
        return currentType;
    }

    /**
     * Number of relation subqueries a relation reference opens: one per relation segment.
     */
    private static int relationDepth(Expression relation) {
        if (!(relation instanceof MemberExpression)) {
            return 1;
        }
        MemberExpression member = (MemberExpression) relation;
        int segments = member.getMembers().size();
        return member.getReceiver() instanceof FieldExpression ? segments + 1 : segments;
    }

    private String memberType(String baseType, Expression expr) {
        if (expr instanceof FieldExpression) {
            return schema.requireField(baseType, ((FieldExpression) expr).getField()).getType();
        }
        String currentType = baseType;
        for (String name : ((MemberExpression) expr).getMembers()) {
            currentType = schema.requireField(currentType, name).getType();
        }
        return currentType;
    }

    // ========== Calls ==========

    @Override
    public SqlNode visitCall(CallExpression expr, TransformerContext context) {
        PolicyFunction function = functions.get(expr.getFunction());
        if (function == null) {
            if (Expressions.isAuthCall(expr)) {
                throw new InvalidPolicyExpressionException(context.getThisType(),
                        "auth() can only be used in comparisons or member access");
            }
            if (Expressions.isBeforeCall(expr)) {
                throw new InvalidPolicyExpressionException(context.getThisType(),
                        "before() can only be used in member access");
            }
            throw new InvalidPolicyExpressionException(context.getThisType(),
                    "Function \"" + expr.getFunction() + "\" is not supported");
        }

        String modelRef = tableRef(context.getModelOrType(), context.getAlias());
        List<SqlNode> args = new ArrayList<>();
        for (Expression arg : expr.getArgs()) {
            if (arg instanceof FieldExpression && !context.hasContextValue()) {
                args.add(ColumnNode.of(modelRef, ((FieldExpression) arg).getField()));
            } else {
                args.add(transform(arg, context));
            }
        }
        FunctionContext functionContext = new FunctionContext(schema, dialect, context.getModelOrType(), modelRef,
                context.getOperation(), context.getPrincipal(), policyFilters, expr, context.getDepth());
        return function.apply(args, functionContext);
    }

    // ========== Values ==========

    /**
     * Compiles a Java value: booleans to the dialect's constants, lists to array values, numbers inline and
     * everything else as a bound parameter.
     */
    public SqlNode transformValue(Object value, BuiltinType type) {
        if (value == null) {
            return ValueNode.NULL;
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? dialect.trueNode() : dialect.falseNode();
        }
        if (value instanceof Collection) {
            List<SqlNode> items = new ArrayList<>();
            BuiltinType itemType = type;
            for (Object item : (Collection<?>) value) {
                if (itemType == null && item != null) {
                    itemType = literalType(item);
                }
                items.add(transformValue(item, itemType));
            }
            return dialect.buildArrayValue(items, itemType);
        }
        if (value instanceof Map) {
            throw new InvalidPolicyExpressionException("Object values cannot be used as SQL values: " + value);
        }
        Object converted = dialect.transformInput(value, type);
        if (converted instanceof Number) {
            return ValueNode.createImmediate(converted);
        }
        return ValueNode.create(converted);
    }

    private static BuiltinType literalType(Object value) {
        if (value instanceof String) {
            return BuiltinType.STRING;
        }
        if (value instanceof Boolean) {
            return BuiltinType.BOOLEAN;
        }
        if (value instanceof Integer) {
            return BuiltinType.INT;
        }
        if (value instanceof Long) {
            return BuiltinType.BIGINT;
        }
        if (value instanceof Number) {
            return BuiltinType.DECIMAL;
        }
        return null;
    }

    // ========== Helpers ==========

    private BindingScope requireBinding(BindingExpression binding, TransformerContext context) {
        BindingScope scope = context.getBinding(binding.getName());
        if (scope == null) {
            throw new InvalidPolicyExpressionException(context.getThisType(),
                    "Unbound name: " + binding.getName());
        }
        return scope;
    }

    private String tableRef(String modelOrType, String alias) {
        return alias != null ? alias : tableName(modelOrType);
    }

    private String tableName(String modelOrType) {
        TypeDefinition def = schema.requireModelOrType(modelOrType);
        return def instanceof ModelDefinition ? ((ModelDefinition) def).getTableName() : def.getName();
    }

    private static SqlOperator toSqlOperator(BinaryOperator op) {
        return switch (op) {
            case EQ -> SqlOperator.EQ;
            case NE -> SqlOperator.NE;
            case LT -> SqlOperator.LT;
            case LE -> SqlOperator.LE;
            case GT -> SqlOperator.GT;
            case GE -> SqlOperator.GE;
            default -> throw new InvalidPolicyExpressionException("Unsupported comparison operator: " + op);
        };
    }
}
