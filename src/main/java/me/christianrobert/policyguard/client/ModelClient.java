package me.christianrobert.policyguard.client;

import me.christianrobert.policyguard.executor.QueryResult;
import me.christianrobert.policyguard.schema.model.BuiltinType;
import me.christianrobert.policyguard.schema.model.FieldDefinition;
import me.christianrobert.policyguard.schema.model.ModelDefinition;
import me.christianrobert.policyguard.sql.dialect.SqlDialect;
import me.christianrobert.policyguard.sql.node.AliasNode;
import me.christianrobert.policyguard.sql.node.AndNode;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.CastNode;
import me.christianrobert.policyguard.sql.node.ColumnNode;
import me.christianrobert.policyguard.sql.node.ColumnUpdateNode;
import me.christianrobert.policyguard.sql.node.DeleteQueryNode;
import me.christianrobert.policyguard.sql.node.FunctionNode;
import me.christianrobert.policyguard.sql.node.InsertQueryNode;
import me.christianrobert.policyguard.sql.node.OrderByNode;
import me.christianrobert.policyguard.sql.node.SelectAllNode;
import me.christianrobert.policyguard.sql.node.SelectQueryNode;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.node.SqlOperator;
import me.christianrobert.policyguard.sql.node.TableNode;
import me.christianrobert.policyguard.sql.node.UpdateQueryNode;
import me.christianrobert.policyguard.sql.node.ValueNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CRUD operations on one model. Every operation is turned into a statement tree and run through the
 * policy handler, so rows the principal may not see behave as if they did not exist.
 *
 * <p>Filters ({@code where}) are maps of field name to value, combined with AND; a {@code null} value
 * matches {@code IS NULL}.
 */
public class ModelClient {

    private static final Logger log = LoggerFactory.getLogger(ModelClient.class);

    private static final String COUNT_COLUMN = "count";

    private final ModelDefinition model;
    private final SqlDialect dialect;
    private final JsonValueCodec jsonCodec;
    private final PolicyClient client;

    ModelClient(ModelDefinition model, SqlDialect dialect, JsonValueCodec jsonCodec, PolicyClient client) {
        this.model = model;
        this.dialect = dialect;
        this.jsonCodec = jsonCodec;
        this.client = client;
    }

    public String getModelName() {
        return model.getName();
    }

    // ========== Create ==========

    /**
     * Inserts one row and returns it as the principal may read it.
     *
     * @throws me.christianrobert.policyguard.policy.exception.PolicyDeniedException when creation is not allowed,
     *         or the created row cannot be read back
     */
    public Map<String, Object> create(Map<String, Object> data) {
        List<String> columns = new ArrayList<>();
        List<SqlNode> values = new ArrayList<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            FieldDefinition field = requireScalarField(entry.getKey());
            columns.add(field.getName());
            values.add(toValueNode(field, entry.getValue()));
        }

        InsertQueryNode insert = new InsertQueryNode(TableNode.of(model.getTableName()), columns, List.of(values),
                null, List.of(SelectAllNode.all()));
        QueryResult result = client.execute(insert);
        log.debug("Created {} row in {}", result.getNumAffectedRows(), model.getName());
        return decode(result.firstRow());
    }

    // ========== Read ==========

    public List<Map<String, Object>> findMany() {
        return findMany(Map.of());
    }

    public List<Map<String, Object>> findMany(Map<String, Object> where) {
        SelectQueryNode.Builder select = SelectQueryNode.builder()
                .from(TableNode.of(model.getTableName()))
                .select(SelectAllNode.all())
                .where(buildWhere(where));
        for (String id : model.getIdFields()) {
            select.orderBy(new OrderByNode(ColumnNode.of(model.getTableName(), id), false));
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : client.execute(select.build()).getRows()) {
            rows.add(decode(row));
        }
        return rows;
    }

    public Optional<Map<String, Object>> findUnique(Map<String, Object> where) {
        List<Map<String, Object>> rows = findMany(where);
        if (rows.size() > 1) {
            throw new IllegalArgumentException("Filter " + where.keySet() + " matches more than one "
                    + model.getName());
        }
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public long count(Map<String, Object> where) {
        SelectQueryNode select = SelectQueryNode.builder()
                .from(TableNode.of(model.getTableName()))
                .select(AliasNode.of(FunctionNode.of("COUNT", ValueNode.createImmediate(1)), COUNT_COLUMN))
                .where(buildWhere(where))
                .build();
        Map<String, Object> row = client.execute(select).firstRow();
        return row == null ? 0 : ((Number) row.get(COUNT_COLUMN)).longValue();
    }

    // ========== Update ==========

    /**
     * Updates the row matching {@code where}.
     *
     * @return the updated row, or empty when no row matched or the update policy filtered it out
     */
    public Optional<Map<String, Object>> update(Map<String, Object> where, Map<String, Object> data) {
        QueryResult result = client.execute(buildUpdate(where, data, List.of(SelectAllNode.all())));
        return result.getRows().isEmpty() ? Optional.empty() : Optional.of(decode(result.firstRow()));
    }

    /**
     * @return number of updated rows
     */
    public long updateMany(Map<String, Object> where, Map<String, Object> data) {
        return client.execute(buildUpdate(where, data, List.of())).getNumAffectedRows();
    }

    private UpdateQueryNode buildUpdate(Map<String, Object> where, Map<String, Object> data,
                                        List<SqlNode> returning) {
        if (data.isEmpty()) {
            throw new IllegalArgumentException("Update of " + model.getName() + " requires at least one field");
        }
        List<ColumnUpdateNode> updates = new ArrayList<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            FieldDefinition field = requireScalarField(entry.getKey());
            updates.add(new ColumnUpdateNode(field.getName(), toValueNode(field, entry.getValue())));
        }
        return new UpdateQueryNode(TableNode.of(model.getTableName()), null, updates, List.of(), buildWhere(where),
                returning);
    }

    // ========== Delete ==========

    /**
     * @return the deleted row, or empty when no row matched or the delete policy filtered it out
     */
    public Optional<Map<String, Object>> delete(Map<String, Object> where) {
        DeleteQueryNode delete = new DeleteQueryNode(TableNode.of(model.getTableName()), null, List.of(),
                buildWhere(where), List.of(SelectAllNode.all()));
        QueryResult result = client.execute(delete);
        return result.getRows().isEmpty() ? Optional.empty() : Optional.of(decode(result.firstRow()));
    }

    /**
     * @return number of deleted rows
     */
    public long deleteMany(Map<String, Object> where) {
        DeleteQueryNode delete = new DeleteQueryNode(TableNode.of(model.getTableName()), null, List.of(),
                buildWhere(where), List.of());
        return client.execute(delete).getNumAffectedRows();
    }

    // ========== Value conversion ==========

    private SqlNode buildWhere(Map<String, Object> where) {
        if (where.isEmpty()) {
            return null;
        }
        List<SqlNode> conditions = new ArrayList<>();
        for (Map.Entry<String, Object> entry : where.entrySet()) {
            FieldDefinition field = requireScalarField(entry.getKey());
            ColumnNode column = ColumnNode.of(model.getTableName(), field.getName());
            if (entry.getValue() == null) {
                conditions.add(BinaryOperationNode.of(column, SqlOperator.IS, ValueNode.NULL));
            } else {
                conditions.add(BinaryOperationNode.of(column, SqlOperator.EQ,
                        toValueNode(field, entry.getValue())));
            }
        }
        return conditions.size() == 1 ? conditions.get(0) : new AndNode(conditions);
    }

    private FieldDefinition requireScalarField(String name) {
        FieldDefinition field = model.getField(name);
        if (field == null) {
            throw new IllegalArgumentException("Unknown field " + model.getName() + "." + name);
        }
        if (field.isRelation()) {
            throw new IllegalArgumentException("Relation field " + model.getName() + "." + name
                    + " cannot be used directly; use its foreign key fields");
        }
        return field;
    }

    SqlNode toValueNode(FieldDefinition field, Object value) {
        if (value == null) {
            return ValueNode.NULL;
        }
        BuiltinType type = field.getBuiltinType();
        boolean json = type == null || type == BuiltinType.JSON;

        if (field.isArray()) {
            if (!(value instanceof List)) {
                throw new IllegalArgumentException("Field " + model.getName() + "." + field.getName()
                        + " expects a list value");
            }
            List<SqlNode> elements = new ArrayList<>();
            for (Object item : (List<?>) value) {
                elements.add(json ? toJsonNode(item) : ValueNode.create(dialect.transformInput(item, type)));
            }
            return dialect.buildArrayValue(elements, json ? null : type);
        }
        if (json) {
            return toJsonNode(value);
        }
        if (value instanceof Map || value instanceof List) {
            throw new IllegalArgumentException("Field " + model.getName() + "." + field.getName()
                    + " expects a scalar value");
        }
        return ValueNode.create(dialect.transformInput(value, type));
    }

    private SqlNode toJsonNode(Object value) {
        return new CastNode(ValueNode.create(jsonCodec.toJson(value)), dialect.getSqlType(BuiltinType.JSON));
    }

    private Map<String, Object> decode(Map<String, Object> row) {
        return row == null ? null : jsonCodec.decodeRow(row);
    }
}
