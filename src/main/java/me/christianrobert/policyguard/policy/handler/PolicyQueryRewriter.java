package me.christianrobert.policyguard.policy.handler;

import me.christianrobert.policyguard.policy.exception.PolicyDeniedException;
import me.christianrobert.policyguard.policy.exception.RejectedReason;
import me.christianrobert.policyguard.policy.registry.PolicyRegistry;
import me.christianrobert.policyguard.policy.transformer.PredicateUtils;
import me.christianrobert.policyguard.schema.model.FieldDefinition;
import me.christianrobert.policyguard.schema.model.JoinTableDefinition;
import me.christianrobert.policyguard.schema.model.ModelDefinition;
import me.christianrobert.policyguard.schema.model.PolicyOperation;
import me.christianrobert.policyguard.schema.model.SchemaDefinition;
import me.christianrobert.policyguard.sql.dialect.SqlDialect;
import me.christianrobert.policyguard.sql.node.AliasNode;
import me.christianrobert.policyguard.sql.node.CaseNode;
import me.christianrobert.policyguard.sql.node.ColumnNode;
import me.christianrobert.policyguard.sql.node.JoinNode;
import me.christianrobert.policyguard.sql.node.OrderByNode;
import me.christianrobert.policyguard.sql.node.SelectAllNode;
import me.christianrobert.policyguard.sql.node.SelectQueryNode;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.node.TableNode;
import me.christianrobert.policyguard.sql.node.ValueNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-path rewriting: injects read policies into every table source of a select (including nested
 * selects) and masks columns guarded by field-level read policies.
 */
public class PolicyQueryRewriter {

    private static final Logger log = LoggerFactory.getLogger(PolicyQueryRewriter.class);

    private final PolicyRegistry registry;
    private final SchemaDefinition schema;
    private final SqlDialect dialect;

    public PolicyQueryRewriter(PolicyRegistry registry) {
        this.registry = registry;
        this.schema = registry.getSchema();
        this.dialect = registry.getDialect();
    }

    // ========== Select ==========

    /**
     * Returns a copy of {@code select} that only sees rows and fields the principal may read.
     */
    public SelectQueryNode rewriteSelect(SelectQueryNode select, Map<String, Object> principal) {
        SubqueryRewriter nested = new SubqueryRewriter(sub -> rewriteSelect(sub, principal));

        SourceRewrite sources = rewriteSources(select.getFrom(), principal);
        Map<String, ModelDefinition> visible = new LinkedHashMap<>(sources.getModels());

        List<JoinNode> joins = new ArrayList<>();
        for (JoinNode join : select.getJoins()) {
            SqlNode on = nested.rewrite(join.getOn());
            TableRef ref = resolveTableRef(join.getTable());
            if (ref == null) {
                joins.add(new JoinNode(join.getType(), rewriteNonTableSource(join.getTable(), principal), on));
                continue;
            }
            if (!ref.isJoinTable()) {
                visible.put(ref.getRef(), ref.getModel());
            }
            SqlNode filter = buildFilter(ref, null, PolicyOperation.READ, principal);
            if (PredicateUtils.isTrue(filter)) {
                joins.add(new JoinNode(join.getType(), join.getTable(), on));
            } else {
                SelectQueryNode filtered = SelectQueryNode.builder()
                        .from(TableNode.of(ref.getTableName()))
                        .select(SelectAllNode.all())
                        .where(filter)
                        .build();
                joins.add(new JoinNode(join.getType(), AliasNode.of(filtered, ref.getRef()), on));
            }
        }

        List<SqlNode> conditions = new ArrayList<>();
        if (select.getWhere() != null) {
            conditions.add(nested.rewrite(select.getWhere()));
        }
        conditions.addAll(sources.getFilters());
        SqlNode where = conditions.isEmpty() ? null : PredicateUtils.conjunction(dialect, conditions);
        if (PredicateUtils.isTrue(where)) {
            where = null;
        }

        List<OrderByNode> orderBy = new ArrayList<>();
        for (OrderByNode order : select.getOrderBy()) {
            orderBy.add(order.withExpression(nested.rewrite(order.getExpression())));
        }

        List<SqlNode> selections = maskSelections(nested.rewriteAll(select.getSelections()), visible, principal);

        SelectQueryNode rewritten = select.toBuilder()
                .from(sources.getSources())
                .joins(joins)
                .select(selections)
                .where(where)
                .orderBy(orderBy)
                .build();
        log.debug("Rewrote select over {} with read policies", visible.keySet());
        return rewritten;
    }

    // ========== Table sources ==========

    /**
     * Resolves the read filters of a FROM/USING list. Plain tables keep their place and contribute a filter
     * for the enclosing WHERE; sub-selects are rewritten recursively.
     */
    SourceRewrite rewriteSources(List<SqlNode> from, Map<String, Object> principal) {
        SourceRewrite result = new SourceRewrite();
        for (SqlNode source : from) {
            TableRef ref = resolveTableRef(source);
            if (ref == null) {
                result.sources.add(rewriteNonTableSource(source, principal));
                continue;
            }
            result.sources.add(source);
            if (!ref.isJoinTable()) {
                result.models.put(ref.getRef(), ref.getModel());
            }
            result.filters.add(buildFilter(ref, ref.getRef(), PolicyOperation.READ, principal));
        }
        return result;
    }

    /**
     * Policy filter of a table source: its model's policy, or the both-sides rule of a join table.
     */
    SqlNode buildFilter(TableRef ref, String alias, PolicyOperation operation, Map<String, Object> principal) {
        if (ref.isJoinTable()) {
            return registry.buildJoinTableFilter(ref.getJoinTable(), alias, operation, principal);
        }
        return registry.buildPolicyFilter(ref.getModel().getName(), alias, operation, principal);
    }

    private SqlNode rewriteNonTableSource(SqlNode source, Map<String, Object> principal) {
        if (source instanceof AliasNode && ((AliasNode) source).getNode() instanceof SelectQueryNode) {
            AliasNode alias = (AliasNode) source;
            return AliasNode.of(rewriteSelect((SelectQueryNode) alias.getNode(), principal), alias.getAlias());
        }
        return new SubqueryRewriter(sub -> rewriteSelect(sub, principal)).rewrite(source);
    }

    /**
     * @return the model or join table behind a table source, or {@code null} when the source is not a plain table
     * @throws PolicyDeniedException when the table is neither a model nor a join table
     */
    TableRef resolveTableRef(SqlNode source) {
        if (source instanceof TableNode) {
            String table = ((TableNode) source).getTable();
            return requireTable(table, table);
        }
        if (source instanceof AliasNode && ((AliasNode) source).getNode() instanceof TableNode) {
            AliasNode alias = (AliasNode) source;
            return requireTable(((TableNode) alias.getNode()).getTable(), alias.getAlias());
        }
        return null;
    }

    /**
     * @param ref alias of the table, or the table name itself
     */
    TableRef requireTable(String table, String ref) {
        ModelDefinition model = schema.findModelByTable(table);
        if (model != null) {
            return new TableRef(model, null, ref);
        }
        JoinTableDefinition joinTable = schema.findJoinTable(table);
        if (joinTable != null) {
            return new TableRef(null, joinTable, ref);
        }
        log.debug("Rejecting access to table {} which is not a model", table);
        throw new PolicyDeniedException(table, RejectedReason.NO_ACCESS,
                "table \"" + table + "\" is not a model and cannot be accessed");
    }

    // ========== Field masking ==========

    /**
     * Replaces columns guarded by field-level read policies with
     * {@code CASE WHEN <field policy> THEN col ELSE NULL END}. {@code *} is expanded when a source has such fields.
     */
    List<SqlNode> maskSelections(List<SqlNode> selections, Map<String, ModelDefinition> sources,
                                 Map<String, Object> principal) {
        boolean anyMasked = false;
        for (ModelDefinition model : sources.values()) {
            if (registry.hasAnyFieldPolicies(model.getName(), PolicyOperation.READ)) {
                anyMasked = true;
                break;
            }
        }
        if (!anyMasked) {
            return selections;
        }

        List<SqlNode> result = new ArrayList<>();
        for (SqlNode selection : selections) {
            if (selection instanceof SelectAllNode) {
                expandSelectAll((SelectAllNode) selection, sources, principal, result);
            } else if (selection instanceof ColumnNode) {
                ColumnNode column = (ColumnNode) selection;
                result.add(maskColumn(column, column.getColumn(), sources, principal));
            } else if (selection instanceof AliasNode && ((AliasNode) selection).getNode() instanceof ColumnNode) {
                AliasNode alias = (AliasNode) selection;
                result.add(maskColumn((ColumnNode) alias.getNode(), alias.getAlias(), sources, principal));
            } else {
                result.add(selection);
            }
        }
        return result;
    }

    private void expandSelectAll(SelectAllNode selectAll, Map<String, ModelDefinition> sources,
                                 Map<String, Object> principal, List<SqlNode> result) {
        Map<String, ModelDefinition> targets = new LinkedHashMap<>();
        if (selectAll.getTable() == null) {
            targets.putAll(sources);
        } else if (sources.containsKey(selectAll.getTable())) {
            targets.put(selectAll.getTable(), sources.get(selectAll.getTable()));
        }

        boolean needsExpansion = false;
        for (ModelDefinition model : targets.values()) {
            needsExpansion |= registry.hasAnyFieldPolicies(model.getName(), PolicyOperation.READ);
        }
        if (!needsExpansion) {
            result.add(selectAll);
            return;
        }

        for (Map.Entry<String, ModelDefinition> entry : targets.entrySet()) {
            for (FieldDefinition field : entry.getValue().getScalarFields()) {
                result.add(maskedColumn(entry.getValue(), entry.getKey(), field.getName(), field.getName(),
                        principal));
            }
        }
    }

    private SqlNode maskColumn(ColumnNode column, String outputName, Map<String, ModelDefinition> sources,
                               Map<String, Object> principal) {
        String ref = column.getTable();
        ModelDefinition model = null;
        if (ref != null) {
            model = sources.get(ref);
        } else {
            for (Map.Entry<String, ModelDefinition> entry : sources.entrySet()) {
                if (entry.getValue().hasField(column.getColumn())) {
                    ref = entry.getKey();
                    model = entry.getValue();
                    break;
                }
            }
        }
        if (model == null || !model.hasField(column.getColumn())) {
            return outputName.equals(column.getColumn()) ? column : AliasNode.of(column, outputName);
        }
        return maskedColumn(model, ref, column.getColumn(), outputName, principal);
    }

    private SqlNode maskedColumn(ModelDefinition model, String ref, String field, String outputName,
                                 Map<String, Object> principal) {
        ColumnNode column = ColumnNode.of(ref, field);
        if (!registry.hasFieldPolicies(model.getName(), field, PolicyOperation.READ)) {
            return AliasNode.of(column, outputName);
        }
        SqlNode filter = registry.buildFieldPolicyFilter(model.getName(), ref, field, PolicyOperation.READ,
                principal);
        if (PredicateUtils.isTrue(filter)) {
            return AliasNode.of(column, outputName);
        }
        if (PredicateUtils.isFalse(filter) || PredicateUtils.isNullNode(filter)) {
            return AliasNode.of(ValueNode.NULL, outputName);
        }
        return AliasNode.of(new CaseNode(filter, column, ValueNode.NULL), outputName);
    }

    // ========== Result holders ==========

    static final class TableRef {
        private final ModelDefinition model;
        private final JoinTableDefinition joinTable;
        private final String ref;

        TableRef(ModelDefinition model, JoinTableDefinition joinTable, String ref) {
            this.model = model;
            this.joinTable = joinTable;
            this.ref = ref;
        }

        /** The model, {@code null} for a join table. */
        ModelDefinition getModel() {
            return model;
        }

        JoinTableDefinition getJoinTable() {
            return joinTable;
        }

        boolean isJoinTable() {
            return joinTable != null;
        }

        String getTableName() {
            return joinTable != null ? joinTable.getTableName() : model.getTableName();
        }

        /** Alias, or table name when the source is not aliased. */
        String getRef() {
            return ref;
        }
    }

    static final class SourceRewrite {
        private final List<SqlNode> sources = new ArrayList<>();
        private final List<SqlNode> filters = new ArrayList<>();
        private final Map<String, ModelDefinition> models = new LinkedHashMap<>();

        List<SqlNode> getSources() {
            return sources;
        }

        List<SqlNode> getFilters() {
            return filters;
        }

        Map<String, ModelDefinition> getModels() {
            return models;
        }
    }
}
