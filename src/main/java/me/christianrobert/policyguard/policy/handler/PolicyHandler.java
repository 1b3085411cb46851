package me.christianrobert.policyguard.policy.handler;

import me.christianrobert.policyguard.executor.QueryExecutor;
import me.christianrobert.policyguard.executor.QueryResult;
import me.christianrobert.policyguard.expression.Expressions;
import me.christianrobert.policyguard.expression.ExpressionScanner;
import me.christianrobert.policyguard.expression.MemberExpression;
import me.christianrobert.policyguard.policy.exception.PolicyDeniedException;
import me.christianrobert.policyguard.policy.exception.RejectedReason;
import me.christianrobert.policyguard.policy.exception.UnsupportedStatementException;
import me.christianrobert.policyguard.policy.registry.PolicyDecision;
import me.christianrobert.policyguard.policy.registry.PolicyRegistry;
import me.christianrobert.policyguard.policy.transformer.ExpressionTransformer;
import me.christianrobert.policyguard.policy.transformer.PredicateUtils;
import me.christianrobert.policyguard.schema.model.FieldDefinition;
import me.christianrobert.policyguard.schema.model.JoinTableDefinition;
import me.christianrobert.policyguard.schema.model.ModelDefinition;
import me.christianrobert.policyguard.schema.model.PolicyOperation;
import me.christianrobert.policyguard.schema.model.PolicyRule;
import me.christianrobert.policyguard.sql.dialect.SqlDialect;
import me.christianrobert.policyguard.sql.node.AliasNode;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.ColumnNode;
import me.christianrobert.policyguard.sql.node.ColumnUpdateNode;
import me.christianrobert.policyguard.sql.node.DeleteQueryNode;
import me.christianrobert.policyguard.sql.node.FunctionNode;
import me.christianrobert.policyguard.sql.node.InsertQueryNode;
import me.christianrobert.policyguard.sql.node.JoinNode;
import me.christianrobert.policyguard.sql.node.MutationStatement;
import me.christianrobert.policyguard.sql.node.OnConflictNode;
import me.christianrobert.policyguard.sql.node.SelectAllNode;
import me.christianrobert.policyguard.sql.node.SelectQueryNode;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.node.SqlOperator;
import me.christianrobert.policyguard.sql.node.SqlStatement;
import me.christianrobert.policyguard.sql.node.StatementKind;
import me.christianrobert.policyguard.sql.node.TableNode;
import me.christianrobert.policyguard.sql.node.UpdateQueryNode;
import me.christianrobert.policyguard.sql.node.ValueNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enforces access policies on every statement before and after it reaches the database.
 *
 * <p>Selects are rewritten so that only readable rows and fields are returned. Mutations are filtered by
 * their operation's policy and, depending on the statement, surrounded by extra round-trips:
 * <ul>
 *   <li>insert: pre-create admission check per value row;</li>
 *   <li>update: field-level update check, before-image load and post-update check;</li>
 *   <li>all mutations returning more than ids: a policy-filtered read-back of the affected rows.</li>
 * </ul>
 * By default all round-trips of one mutation share a transaction so a failed check rolls the write back.
 */
public class PolicyHandler {

    private static final Logger log = LoggerFactory.getLogger(PolicyHandler.class);

    static final String CONDITION_COLUMN = "$condition";
    static final String COUNT_COLUMN = "$count";
    static final String ID_COLUMN_PREFIX = "$id.";

    private final PolicyRegistry registry;
    private final PolicyQueryRewriter rewriter;
    private final SqlDialect dialect;
    private final boolean transactional;

    public PolicyHandler(PolicyRegistry registry, boolean transactional) {
        this.registry = registry;
        this.rewriter = new PolicyQueryRewriter(registry);
        this.dialect = registry.getDialect();
        this.transactional = transactional;
        if (!transactional) {
            log.warn("Mutations are not wrapped in transactions: read-back and post-update checks are best-effort "
                    + "and cannot undo a write that fails them");
        }
    }

    // ========== Entry points ==========

    /**
     * Runs {@code statement} under the policies of the principal.
     *
     * @param principal the current principal, or {@code null} when anonymous
     * @throws PolicyDeniedException        when the policies reject the operation
     * @throws UnsupportedStatementException for anything other than select, insert, update and delete
     */
    public QueryResult handle(SqlStatement statement, Map<String, Object> principal, QueryExecutor executor) {
        log.debug("Handling {} statement", statement.getKind());
        switch (statement.getKind()) {
            case SELECT:
                return executor.execute(transformQuery(statement, principal));
            case INSERT:
            case UPDATE:
            case DELETE:
                MutationStatement mutation = (MutationStatement) statement;
                String table = mutation.getTargetTable().getTable();
                PolicyQueryRewriter.TableRef target = rewriter.requireTable(table, table);
                if (transactional) {
                    return executor.inTransaction(tx -> handleMutation(mutation, target, principal, tx));
                }
                return handleMutation(mutation, target, principal, executor);
            default:
                throw new UnsupportedStatementException(statement.getKind().name(),
                        "only select, insert, update and delete statements are supported");
        }
    }

    /**
     * Returns the policy-filtered version of a select without executing it.
     */
    public SqlStatement transformQuery(SqlStatement statement, Map<String, Object> principal) {
        if (!(statement instanceof SelectQueryNode)) {
            throw new UnsupportedStatementException(statement.getKind().name(),
                    "only select statements can be transformed without execution");
        }
        return rewriter.rewriteSelect((SelectQueryNode) statement, principal);
    }

    private QueryResult handleMutation(MutationStatement mutation, PolicyQueryRewriter.TableRef target,
                                       Map<String, Object> principal, QueryExecutor executor) {
        if (target.isJoinTable()) {
            return handleJoinTableMutation(mutation, target.getJoinTable(), principal, executor);
        }
        ModelDefinition model = target.getModel();
        if (mutation instanceof InsertQueryNode) {
            return handleInsert((InsertQueryNode) mutation, model, principal, executor);
        }
        if (mutation instanceof UpdateQueryNode) {
            return handleUpdate((UpdateQueryNode) mutation, model, principal, executor);
        }
        return handleDelete((DeleteQueryNode) mutation, model, principal, executor);
    }

    // ========== Insert ==========

    private QueryResult handleInsert(InsertQueryNode insert, ModelDefinition model, Map<String, Object> principal,
                                     QueryExecutor executor) {
        PolicyDecision decision = registry.getConstantDecision(model.getName(), PolicyOperation.CREATE);
        if (decision == PolicyDecision.ALWAYS_DENY) {
            log.debug("Create on {} rejected without evaluation", model.getName());
            throw new PolicyDeniedException(model.getName(), RejectedReason.NO_ACCESS);
        }
        if (decision == PolicyDecision.CONDITIONAL) {
            // rules that only depend on the principal fold to a constant here
            SqlNode createFilter = registry.buildPolicyFilter(model.getName(), null, PolicyOperation.CREATE,
                    principal);
            if (PredicateUtils.isFalse(createFilter) || PredicateUtils.isNullNode(createFilter)) {
                log.debug("Create on {} rejected for the current principal without evaluation", model.getName());
                throw new PolicyDeniedException(model.getName(), RejectedReason.NO_ACCESS);
            }
            if (!PredicateUtils.isTrue(createFilter)) {
                for (List<SqlNode> row : insert.getRows()) {
                    preCreateCheck(model, insert.getColumns(), row, createFilter, executor);
                }
            }
        }

        InsertQueryNode statement = insert;
        OnConflictNode onConflict = insert.getOnConflict();
        if (onConflict != null && !onConflict.isDoNothing()) {
            SqlNode updateFilter = registry.buildPolicyFilter(model.getName(), null, PolicyOperation.UPDATE,
                    principal);
            List<SqlNode> conditions = new ArrayList<>();
            if (onConflict.getUpdateWhere() != null) {
                conditions.add(onConflict.getUpdateWhere());
            }
            conditions.add(updateFilter);
            statement = statement.withOnConflict(
                    onConflict.withUpdateWhere(PredicateUtils.conjunction(dialect, conditions)));
        }

        return executeWithReadBack(statement, model, null, principal, executor);
    }

    /**
     * Evaluates the compiled create policy against one value row presented as a constant table named like
     * the model.
     */
    private void preCreateCheck(ModelDefinition model, List<String> columns, List<SqlNode> row, SqlNode filter,
                                QueryExecutor executor) {
        Map<String, SqlNode> supplied = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            supplied.put(columns.get(i), row.get(i));
        }

        List<String> names = new ArrayList<>();
        List<String> types = new ArrayList<>();
        List<SqlNode> values = new ArrayList<>();
        for (FieldDefinition field : model.getScalarFields()) {
            names.add(field.getName());
            types.add(dialect.getSqlType(field));
            values.add(supplied.getOrDefault(field.getName(), ValueNode.NULL));
        }

        SelectQueryNode check = SelectQueryNode.builder()
                .from(dialect.buildConstantRows(model.getTableName(), names, types, List.of(values)))
                .select(AliasNode.of(BinaryOperationNode.of(count(), SqlOperator.GT, ValueNode.createImmediate(0)),
                        CONDITION_COLUMN))
                .where(filter)
                .build();

        if (!isTrue(executor.execute(check).firstRow(), CONDITION_COLUMN)) {
            log.debug("Pre-create check failed for {}", model.getName());
            throw new PolicyDeniedException(model.getName(), RejectedReason.NO_ACCESS);
        }
    }

    // ========== Update ==========

    private QueryResult handleUpdate(UpdateQueryNode update, ModelDefinition model, Map<String, Object> principal,
                                     QueryExecutor executor) {
        String alias = update.getAlias() != null ? update.getAlias() : model.getTableName();

        PolicyQueryRewriter.SourceRewrite sources = rewriter.rewriteSources(update.getFrom(), principal);
        SubqueryRewriter nested = new SubqueryRewriter(sub -> rewriter.rewriteSelect(sub, principal));

        List<SqlNode> conditions = new ArrayList<>();
        if (update.getWhere() != null) {
            conditions.add(nested.rewrite(update.getWhere()));
        }
        conditions.add(registry.buildPolicyFilter(model.getName(), alias, PolicyOperation.UPDATE, principal));
        conditions.addAll(sources.getFilters());
        SqlNode where = PredicateUtils.conjunction(dialect, conditions);

        SqlNode target = update.getAlias() != null
                ? AliasNode.of(update.getTable(), update.getAlias())
                : update.getTable();
        List<SqlNode> scanFrom = new ArrayList<>();
        scanFrom.add(target);
        scanFrom.addAll(sources.getSources());

        for (ColumnUpdateNode assignment : update.getUpdates()) {
            fieldUpdateCheck(model, alias, assignment.getColumn(), scanFrom, where, principal, executor);
        }

        List<PolicyRule> postUpdateRules = registry.getModelPolicies(model.getName(), PolicyOperation.POST_UPDATE);
        boolean hasPostUpdate = !postUpdateRules.isEmpty();
        List<String> beforeFields = new ArrayList<>(collectBeforeFields(postUpdateRules));
        List<Map<String, Object>> beforeRows = List.of();
        if (hasPostUpdate && !beforeFields.isEmpty()) {
            beforeRows = loadBeforeRows(model, alias, beforeFields, scanFrom, where, executor);
        }

        UpdateQueryNode statement = new UpdateQueryNode(update.getTable(), update.getAlias(), update.getUpdates(),
                sources.getSources(), where, update.getReturning());

        if (!hasPostUpdate) {
            return executeWithReadBack(statement, model, update.getAlias(), principal, executor);
        }

        // post-update checks need the ids of the updated rows whether or not the caller asked for them
        List<SqlNode> requested = update.getReturning();
        QueryResult result = executor.execute(statement.withReturning(idColumns(model, update.getAlias())));
        long affected = result.getNumAffectedRows();
        if (affected > 0) {
            postUpdateCheck(model, beforeFields, beforeRows, result.getRows(), principal, executor);
        }
        return finishReturning(requested, result, model, principal, executor);
    }

    private void fieldUpdateCheck(ModelDefinition model, String alias, String column, List<SqlNode> scanFrom,
                                  SqlNode where, Map<String, Object> principal, QueryExecutor executor) {
        if (!model.hasField(column) || !registry.hasFieldPolicies(model.getName(), column, PolicyOperation.UPDATE)) {
            return;
        }
        SqlNode fieldFilter = registry.buildFieldPolicyFilter(model.getName(), alias, column,
                PolicyOperation.UPDATE, principal);
        if (PredicateUtils.isTrue(fieldFilter)) {
            return;
        }

        SelectQueryNode check = SelectQueryNode.builder()
                .from(scanFrom)
                .select(AliasNode.of(count(), COUNT_COLUMN))
                .where(PredicateUtils.conjunction(dialect, where, PredicateUtils.buildIsFalse(dialect, fieldFilter)))
                .build();
        long violations = asLong(executor.execute(check).firstRow(), COUNT_COLUMN);
        if (violations > 0) {
            log.debug("Field update check failed for {}.{} on {} row(s)", model.getName(), column, violations);
            throw new PolicyDeniedException(model.getName(), RejectedReason.NO_ACCESS,
                    "field \"" + column + "\" is not updatable");
        }
    }

    /**
     * Fields referenced through {@code before()} in post-update rules.
     */
    private static Set<String> collectBeforeFields(List<PolicyRule> rules) {
        Set<String> fields = new LinkedHashSet<>();
        ExpressionScanner scanner = new ExpressionScanner() {
            @Override
            public Void visitMember(MemberExpression expr, Void context) {
                if (Expressions.isBeforeCall(expr.getReceiver())) {
                    fields.add(expr.getMembers().get(0));
                }
                return super.visitMember(expr, context);
            }
        };
        for (PolicyRule rule : rules) {
            scanner.scan(rule.getCondition());
        }
        return fields;
    }

    private List<Map<String, Object>> loadBeforeRows(ModelDefinition model, String alias, List<String> beforeFields,
                                                     List<SqlNode> scanFrom, SqlNode where,
                                                     QueryExecutor executor) {
        List<SqlNode> selections = new ArrayList<>();
        for (String column : beforeColumns(model, beforeFields)) {
            selections.add(ColumnNode.of(alias, column));
        }
        SelectQueryNode load = SelectQueryNode.builder()
                .from(scanFrom)
                .select(selections)
                .where(where)
                .build();
        List<Map<String, Object>> rows = executor.execute(load).getRows();
        log.debug("Loaded {} before-update row(s) of {}", rows.size(), model.getName());
        return rows;
    }

    private static List<String> beforeColumns(ModelDefinition model, List<String> beforeFields) {
        Set<String> columns = new LinkedHashSet<>(model.getIdFields());
        columns.addAll(beforeFields);
        return new ArrayList<>(columns);
    }

    /**
     * All updated rows must satisfy the post-update policy, evaluated against their new values with the
     * before-image joined as {@code $before}.
     */
    private void postUpdateCheck(ModelDefinition model, List<String> beforeFields,
                                 List<Map<String, Object>> beforeRows, List<Map<String, Object>> idRows,
                                 Map<String, Object> principal, QueryExecutor executor) {
        String table = model.getTableName();
        SelectQueryNode.Builder check = SelectQueryNode.builder().from(TableNode.of(table));

        if (!beforeFields.isEmpty()) {
            List<String> columns = beforeColumns(model, beforeFields);
            if (beforeRows.isEmpty()) {
                // nothing was visible before the update, so no row can pass a before() comparison
                throw new PolicyDeniedException(model.getName(), RejectedReason.NO_ACCESS);
            }
            List<String> types = new ArrayList<>();
            for (String column : columns) {
                types.add(dialect.getSqlType(model.getField(column)));
            }
            List<List<SqlNode>> rows = new ArrayList<>();
            for (Map<String, Object> beforeRow : beforeRows) {
                List<SqlNode> values = new ArrayList<>();
                for (String column : columns) {
                    values.add(toConstant(beforeRow.get(column)));
                }
                rows.add(values);
            }
            List<SqlNode> joinOn = new ArrayList<>();
            for (String id : model.getIdFields()) {
                joinOn.add(BinaryOperationNode.of(ColumnNode.of(table, id), SqlOperator.EQ,
                        ColumnNode.of(ExpressionTransformer.BEFORE_ALIAS, id)));
            }
            check.join(new JoinNode(JoinNode.JoinType.LEFT,
                    dialect.buildConstantRows(ExpressionTransformer.BEFORE_ALIAS, columns, types, rows),
                    PredicateUtils.conjunction(dialect, joinOn)));
        }

        SqlNode postFilter = registry.buildPolicyFilter(model.getName(), null, PolicyOperation.POST_UPDATE,
                principal);
        check.select(AliasNode.of(BinaryOperationNode.of(count(), SqlOperator.EQ,
                        ValueNode.createImmediate(idRows.size())), CONDITION_COLUMN))
                .where(PredicateUtils.conjunction(dialect, idCondition(model, table, idRows), postFilter));

        if (!isTrue(executor.execute(check.build()).firstRow(), CONDITION_COLUMN)) {
            log.debug("Post-update check failed for {}", model.getName());
            throw new PolicyDeniedException(model.getName(), RejectedReason.NO_ACCESS,
                    "post-update policy check failed");
        }
    }

    // ========== Delete ==========

    private QueryResult handleDelete(DeleteQueryNode delete, ModelDefinition model, Map<String, Object> principal,
                                     QueryExecutor executor) {
        String alias = delete.getAlias() != null ? delete.getAlias() : model.getTableName();

        PolicyQueryRewriter.SourceRewrite sources = rewriter.rewriteSources(delete.getUsing(), principal);
        SubqueryRewriter nested = new SubqueryRewriter(sub -> rewriter.rewriteSelect(sub, principal));

        List<SqlNode> conditions = new ArrayList<>();
        if (delete.getWhere() != null) {
            conditions.add(nested.rewrite(delete.getWhere()));
        }
        conditions.add(registry.buildPolicyFilter(model.getName(), alias, PolicyOperation.DELETE, principal));
        conditions.addAll(sources.getFilters());
        SqlNode where = PredicateUtils.conjunction(dialect, conditions);

        DeleteQueryNode statement = new DeleteQueryNode(delete.getTable(), delete.getAlias(), sources.getSources(),
                where, delete.getReturning());
        List<SqlNode> requested = delete.getReturning();
        if (requested.isEmpty() || returnsOnlyIds(requested, model)) {
            return executor.execute(statement);
        }

        // the rows are gone after the delete, so read them first
        SqlNode target = delete.getAlias() != null
                ? AliasNode.of(delete.getTable(), delete.getAlias())
                : delete.getTable();
        List<SqlNode> scanFrom = new ArrayList<>();
        scanFrom.add(target);
        scanFrom.addAll(sources.getSources());

        Map<String, ModelDefinition> visible = new LinkedHashMap<>();
        visible.put(alias, model);
        List<SqlNode> selections = new ArrayList<>(
                rewriter.maskSelections(qualify(requested, alias), visible, principal));
        for (String id : model.getIdFields()) {
            selections.add(AliasNode.of(ColumnNode.of(alias, id), ID_COLUMN_PREFIX + id));
        }
        SelectQueryNode preRead = SelectQueryNode.builder()
                .from(scanFrom)
                .select(selections)
                .where(PredicateUtils.conjunction(dialect, where,
                        registry.buildPolicyFilter(model.getName(), alias, PolicyOperation.READ, principal)))
                .build();
        List<Map<String, Object>> readable = executor.execute(preRead).getRows();

        QueryResult deleted = executor.execute(statement.withReturning(idColumns(model, delete.getAlias())));
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : readable) {
            if (containsIds(deleted.getRows(), row, model)) {
                rows.add(stripIdColumns(row));
            }
        }
        if (rows.size() < deleted.getNumAffectedRows()) {
            throw new PolicyDeniedException(model.getName(), RejectedReason.CANNOT_READ_BACK,
                    "result is not allowed to be read back");
        }
        return new QueryResult(rows, deleted.getNumAffectedRows());
    }

    private static boolean containsIds(List<Map<String, Object>> idRows, Map<String, Object> row,
                                       ModelDefinition model) {
        for (Map<String, Object> idRow : idRows) {
            boolean matches = true;
            for (String id : model.getIdFields()) {
                Object value = idRow.get(id);
                if (value == null || !value.equals(row.get(ID_COLUMN_PREFIX + id))) {
                    matches = false;
                    break;
                }
            }
            if (matches) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Object> stripIdColumns(Map<String, Object> row) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (!entry.getKey().startsWith(ID_COLUMN_PREFIX)) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    // ========== Many-to-many join tables ==========

    /**
     * Mutations of a join table: every link written or removed must connect rows that are both updatable.
     * RETURNING may only ask for the key columns, and the returned links must be readable.
     */
    private QueryResult handleJoinTableMutation(MutationStatement mutation, JoinTableDefinition joinTable,
                                                Map<String, Object> principal, QueryExecutor executor) {
        List<String> requested = joinTableReturning(mutation.getReturning(), joinTable);
        String alias = mutation.getTargetAlias() != null ? mutation.getTargetAlias() : joinTable.getTableName();

        MutationStatement statement;
        if (mutation instanceof InsertQueryNode) {
            InsertQueryNode insert = (InsertQueryNode) mutation;
            if (insert.getOnConflict() != null && !insert.getOnConflict().isDoNothing()) {
                throw new UnsupportedStatementException(StatementKind.INSERT.name(),
                        "join table \"" + joinTable.getTableName() + "\" only supports ON CONFLICT DO NOTHING");
            }
            for (List<SqlNode> row : insert.getRows()) {
                joinTableLinkCheck(joinTable, insert.getColumns(), row, mutation, principal, executor);
            }
            statement = insert;
        } else if (mutation instanceof UpdateQueryNode) {
            UpdateQueryNode update = (UpdateQueryNode) mutation;
            List<String> columns = new ArrayList<>();
            List<SqlNode> values = new ArrayList<>();
            for (ColumnUpdateNode assignment : update.getUpdates()) {
                columns.add(assignment.getColumn());
                values.add(assignment.getValue());
            }
            joinTableLinkCheck(joinTable, columns, values, mutation, principal, executor);
            PolicyQueryRewriter.SourceRewrite sources = rewriter.rewriteSources(update.getFrom(), principal);
            SqlNode where = joinTableWhere(update.getWhere(), sources, joinTable, alias, PolicyOperation.UPDATE,
                    principal);
            statement = new UpdateQueryNode(update.getTable(), update.getAlias(), update.getUpdates(),
                    sources.getSources(), where, update.getReturning());
        } else {
            DeleteQueryNode delete = (DeleteQueryNode) mutation;
            PolicyQueryRewriter.SourceRewrite sources = rewriter.rewriteSources(delete.getUsing(), principal);
            SqlNode where = joinTableWhere(delete.getWhere(), sources, joinTable, alias, PolicyOperation.DELETE,
                    principal);
            statement = new DeleteQueryNode(delete.getTable(), delete.getAlias(), sources.getSources(), where,
                    delete.getReturning());
        }

        if (requested.isEmpty()) {
            return executor.execute(statement);
        }
        QueryResult result = executor.execute(statement.withReturning(List.of(
                ColumnNode.of(alias, JoinTableDefinition.FIRST_COLUMN),
                ColumnNode.of(alias, JoinTableDefinition.SECOND_COLUMN))));
        if (!result.getRows().isEmpty()) {
            joinTableReadBackCheck(joinTable, result.getRows(), principal, executor);
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : result.getRows()) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (String column : requested) {
                projected.put(column, row.get(column));
            }
            rows.add(projected);
        }
        return new QueryResult(rows, result.getNumAffectedRows());
    }

    private SqlNode joinTableWhere(SqlNode where, PolicyQueryRewriter.SourceRewrite sources,
                                   JoinTableDefinition joinTable, String alias, PolicyOperation operation,
                                   Map<String, Object> principal) {
        SubqueryRewriter nested = new SubqueryRewriter(sub -> rewriter.rewriteSelect(sub, principal));
        List<SqlNode> conditions = new ArrayList<>();
        if (where != null) {
            conditions.add(nested.rewrite(where));
        }
        conditions.add(registry.buildJoinTableFilter(joinTable, alias, operation, principal));
        conditions.addAll(sources.getFilters());
        return PredicateUtils.conjunction(dialect, conditions);
    }

    /**
     * Both rows a new link points at must be updatable. Only constant key values can be checked.
     */
    private void joinTableLinkCheck(JoinTableDefinition joinTable, List<String> columns, List<SqlNode> values,
                                    MutationStatement mutation, Map<String, Object> principal,
                                    QueryExecutor executor) {
        List<SqlNode> conditions = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i);
            boolean first = JoinTableDefinition.FIRST_COLUMN.equals(column);
            if (!first && !JoinTableDefinition.SECOND_COLUMN.equals(column)) {
                throw new UnsupportedStatementException(mutation.getKind().name(),
                        "join table \"" + joinTable.getTableName() + "\" has no column \"" + column + "\"");
            }
            SqlNode value = values.get(i);
            if (!(value instanceof ValueNode) || ((ValueNode) value).isNull()) {
                throw new UnsupportedStatementException(mutation.getKind().name(),
                        "join table \"" + joinTable.getTableName() + "\" keys must be non-null constant values");
            }
            conditions.add(registry.joinSideCondition(
                    first ? joinTable.getFirstModel() : joinTable.getSecondModel(),
                    first ? joinTable.getFirstIdField() : joinTable.getSecondIdField(),
                    value, PolicyOperation.UPDATE, principal));
        }
        if (conditions.isEmpty()) {
            return;
        }
        SqlNode condition = PredicateUtils.conjunction(dialect, conditions);
        if (PredicateUtils.isFalse(condition)) {
            log.debug("Link in {} rejected without evaluation", joinTable.getTableName());
            throw new PolicyDeniedException(joinTable.getTableName(), RejectedReason.NO_ACCESS,
                    "many-to-many relation participants are not updatable");
        }
        SelectQueryNode check = SelectQueryNode.builder()
                .select(AliasNode.of(PredicateUtils.buildIsTrue(dialect, condition), CONDITION_COLUMN))
                .build();
        if (!isTrue(executor.execute(check).firstRow(), CONDITION_COLUMN)) {
            log.debug("Link check failed for {}", joinTable.getTableName());
            throw new PolicyDeniedException(joinTable.getTableName(), RejectedReason.NO_ACCESS,
                    "many-to-many relation participants are not updatable");
        }
    }

    /**
     * Returned links must be readable: evaluated over the returned keys as a constant table named like the
     * join table.
     */
    private void joinTableReadBackCheck(JoinTableDefinition joinTable, List<Map<String, Object>> links,
                                        Map<String, Object> principal, QueryExecutor executor) {
        List<String> columns = List.of(JoinTableDefinition.FIRST_COLUMN, JoinTableDefinition.SECOND_COLUMN);
        List<String> types = List.of(
                dialect.getSqlType(registry.getSchema().requireField(joinTable.getFirstModel(),
                        joinTable.getFirstIdField())),
                dialect.getSqlType(registry.getSchema().requireField(joinTable.getSecondModel(),
                        joinTable.getSecondIdField())));
        List<List<SqlNode>> rows = new ArrayList<>();
        for (Map<String, Object> link : links) {
            rows.add(List.of(ValueNode.create(link.get(JoinTableDefinition.FIRST_COLUMN)),
                    ValueNode.create(link.get(JoinTableDefinition.SECOND_COLUMN))));
        }
        SelectQueryNode check = SelectQueryNode.builder()
                .from(dialect.buildConstantRows(joinTable.getTableName(), columns, types, rows))
                .select(AliasNode.of(BinaryOperationNode.of(count(), SqlOperator.EQ,
                        ValueNode.createImmediate(links.size())), CONDITION_COLUMN))
                .where(registry.buildJoinTableFilter(joinTable, null, PolicyOperation.READ, principal))
                .build();
        if (!isTrue(executor.execute(check).firstRow(), CONDITION_COLUMN)) {
            throw new PolicyDeniedException(joinTable.getTableName(), RejectedReason.CANNOT_READ_BACK,
                    "result is not allowed to be read back");
        }
    }

    private static List<String> joinTableReturning(List<SqlNode> returning, JoinTableDefinition joinTable) {
        Set<String> columns = new LinkedHashSet<>();
        for (SqlNode node : returning) {
            if (node instanceof SelectAllNode) {
                columns.add(JoinTableDefinition.FIRST_COLUMN);
                columns.add(JoinTableDefinition.SECOND_COLUMN);
            } else if (node instanceof ColumnNode
                    && (JoinTableDefinition.FIRST_COLUMN.equals(((ColumnNode) node).getColumn())
                    || JoinTableDefinition.SECOND_COLUMN.equals(((ColumnNode) node).getColumn()))) {
                columns.add(((ColumnNode) node).getColumn());
            } else {
                throw new UnsupportedStatementException("RETURNING",
                        "join table \"" + joinTable.getTableName() + "\" can only return its key columns");
            }
        }
        return new ArrayList<>(columns);
    }

    // ========== Returning / read-back ==========

    /**
     * Executes a mutation; when it asks for more than id columns, returns only ids from the mutation and
     * reads the requested columns back under the read policy.
     */
    private QueryResult executeWithReadBack(MutationStatement statement, ModelDefinition model, String alias,
                                            Map<String, Object> principal, QueryExecutor executor) {
        List<SqlNode> requested = statement.getReturning();
        if (requested.isEmpty() || returnsOnlyIds(requested, model)) {
            return executor.execute(statement);
        }
        QueryResult result = executor.execute(statement.withReturning(idColumns(model, alias)));
        return finishReturning(requested, result, model, principal, executor);
    }

    private QueryResult finishReturning(List<SqlNode> requested, QueryResult idResult, ModelDefinition model,
                                        Map<String, Object> principal, QueryExecutor executor) {
        long affected = idResult.getNumAffectedRows();
        if (requested.isEmpty()) {
            return QueryResult.ofAffected(affected);
        }
        if (returnsOnlyIds(requested, model)) {
            return idResult;
        }
        if (idResult.getRows().isEmpty()) {
            return new QueryResult(List.of(), affected);
        }

        String table = model.getTableName();
        Map<String, ModelDefinition> visible = new LinkedHashMap<>();
        visible.put(table, model);
        SelectQueryNode readBack = SelectQueryNode.builder()
                .from(TableNode.of(table))
                .select(rewriter.maskSelections(qualify(requested, table), visible, principal))
                .where(PredicateUtils.conjunction(dialect, idCondition(model, table, idResult.getRows()),
                        registry.buildPolicyFilter(model.getName(), null, PolicyOperation.READ, principal)))
                .build();
        List<Map<String, Object>> rows = executor.execute(readBack).getRows();
        if (rows.size() < affected) {
            log.debug("Read-back of {} returned {} of {} row(s)", model.getName(), rows.size(), affected);
            throw new PolicyDeniedException(model.getName(), RejectedReason.CANNOT_READ_BACK,
                    "result is not allowed to be read back");
        }
        return new QueryResult(rows, affected);
    }

    private static boolean returnsOnlyIds(List<SqlNode> returning, ModelDefinition model) {
        for (SqlNode node : returning) {
            if (!(node instanceof ColumnNode) || !model.getIdFields().contains(((ColumnNode) node).getColumn())) {
                return false;
            }
        }
        return true;
    }

    private static List<SqlNode> idColumns(ModelDefinition model, String alias) {
        List<SqlNode> columns = new ArrayList<>();
        for (String id : model.getIdFields()) {
            columns.add(ColumnNode.of(alias, id));
        }
        return columns;
    }

    /**
     * Re-targets RETURNING selections at {@code ref}, since the mutation's own alias is not in scope
     * of the follow-up select.
     */
    private static List<SqlNode> qualify(List<SqlNode> returning, String ref) {
        List<SqlNode> result = new ArrayList<>();
        for (SqlNode node : returning) {
            if (node instanceof ColumnNode) {
                result.add(ColumnNode.of(ref, ((ColumnNode) node).getColumn()));
            } else if (node instanceof SelectAllNode) {
                result.add(new SelectAllNode(ref));
            } else if (node instanceof AliasNode && ((AliasNode) node).getNode() instanceof ColumnNode) {
                AliasNode alias = (AliasNode) node;
                result.add(AliasNode.of(ColumnNode.of(ref, ((ColumnNode) alias.getNode()).getColumn()),
                        alias.getAlias()));
            } else {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * {@code (id1 = v1 AND id2 = v2) OR ...} over the given id rows.
     */
    private SqlNode idCondition(ModelDefinition model, String ref, List<Map<String, Object>> idRows) {
        List<SqlNode> perRow = new ArrayList<>();
        for (Map<String, Object> row : idRows) {
            List<SqlNode> equalities = new ArrayList<>();
            for (String id : model.getIdFields()) {
                equalities.add(BinaryOperationNode.of(ColumnNode.of(ref, id), SqlOperator.EQ,
                        ValueNode.create(row.get(id))));
            }
            perRow.add(PredicateUtils.conjunction(dialect, equalities));
        }
        return PredicateUtils.disjunction(dialect, perRow);
    }

    // ========== Helpers ==========

    private static SqlNode count() {
        return FunctionNode.of("COUNT", ValueNode.createImmediate(1));
    }

    /**
     * Array column values read back from the driver come as lists and must be re-bound element-wise.
     */
    private SqlNode toConstant(Object value) {
        if (value instanceof List) {
            List<SqlNode> elements = new ArrayList<>();
            for (Object item : (List<?>) value) {
                elements.add(ValueNode.create(item));
            }
            return dialect.buildArrayValue(elements, null);
        }
        return ValueNode.create(value);
    }

    private static boolean isTrue(Map<String, Object> row, String column) {
        return row != null && Boolean.TRUE.equals(row.get(column));
    }

    private static long asLong(Map<String, Object> row, String column) {
        if (row == null || !(row.get(column) instanceof Number)) {
            return 0;
        }
        return ((Number) row.get(column)).longValue();
    }
}
