package me.christianrobert.policyguard.sql.dialect;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.policyguard.schema.model.BuiltinType;
import me.christianrobert.policyguard.schema.model.FieldDefinition;
import me.christianrobert.policyguard.sql.node.AliasNode;
import me.christianrobert.policyguard.sql.node.ArrayNode;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.CastNode;
import me.christianrobert.policyguard.sql.node.FunctionNode;
import me.christianrobert.policyguard.sql.node.LikeNode;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.node.SqlOperator;
import me.christianrobert.policyguard.sql.node.ValueNode;
import me.christianrobert.policyguard.sql.node.ValuesNode;
import me.christianrobert.policyguard.sql.render.CompiledQuery;
import me.christianrobert.policyguard.sql.render.SqlRenderer;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * PostgreSQL implementation of the dialect capability surface.
 */
@ApplicationScoped
public class PostgresDialect implements SqlDialect {

    public static final String NAME = "postgresql";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SqlNode trueNode() {
        return ValueNode.createImmediate(true);
    }

    @Override
    public SqlNode falseNode() {
        return ValueNode.createImmediate(false);
    }

    @Override
    public String getSqlType(FieldDefinition field) {
        BuiltinType type = field.getBuiltinType();
        if (type == null) {
            // typed (non-relation) fields are stored as JSON
            return field.isArray() ? "jsonb[]" : "jsonb";
        }
        String base = getSqlType(type);
        return field.isArray() ? base + "[]" : base;
    }

    @Override
    public String getSqlType(BuiltinType type) {
        return switch (type) {
            case STRING -> "text";
            case INT -> "integer";
            case BIGINT -> "bigint";
            case FLOAT -> "double precision";
            case DECIMAL -> "decimal";
            case BOOLEAN -> "boolean";
            case DATETIME -> "timestamp(3)";
            case JSON -> "jsonb";
            case BYTES -> "bytea";
        };
    }

    @Override
    public Object transformInput(Object value, BuiltinType type) {
        if (value == null) {
            return null;
        }
        if (type == BuiltinType.DATETIME) {
            if (value instanceof Instant) {
                return Timestamp.from((Instant) value);
            }
            if (value instanceof OffsetDateTime) {
                return Timestamp.from(((OffsetDateTime) value).toInstant());
            }
            if (value instanceof ZonedDateTime) {
                return Timestamp.from(((ZonedDateTime) value).toInstant());
            }
            if (value instanceof LocalDateTime) {
                return Timestamp.valueOf((LocalDateTime) value);
            }
            if (value instanceof Date && !(value instanceof Timestamp)) {
                return new Timestamp(((Date) value).getTime());
            }
        }
        if (value instanceof Enum<?>) {
            return ((Enum<?>) value).name();
        }
        return value;
    }

    @Override
    public SqlNode buildArrayValue(List<SqlNode> elements, BuiltinType elementType) {
        return new ArrayNode(elements, elementType != null ? getSqlType(elementType) : null);
    }

    @Override
    public SqlNode buildConstantRows(String alias, List<String> columns, List<String> sqlTypes,
                                     List<List<SqlNode>> rows) {
        List<List<SqlNode>> casted = new ArrayList<>();
        for (List<SqlNode> row : rows) {
            List<SqlNode> castedRow = new ArrayList<>();
            for (int i = 0; i < row.size(); i++) {
                castedRow.add(new CastNode(row.get(i), sqlTypes.get(i)));
            }
            casted.add(castedRow);
        }
        return new AliasNode(new ValuesNode(casted, columns), alias);
    }

    @Override
    public SqlNode buildLike(SqlNode operand, SqlNode pattern, boolean caseInsensitive) {
        return new LikeNode(operand, pattern, caseInsensitive);
    }

    @Override
    public SqlNode escapeLikePattern(SqlNode value) {
        // backslash first, then the two wildcards
        SqlNode escaped = FunctionNode.of("REPLACE", value, ValueNode.create("\\"), ValueNode.create("\\\\"));
        escaped = FunctionNode.of("REPLACE", escaped, ValueNode.create("%"), ValueNode.create("\\%"));
        return FunctionNode.of("REPLACE", escaped, ValueNode.create("_"), ValueNode.create("\\_"));
    }

    @Override
    public SqlNode buildArrayContains(SqlNode array, SqlNode element, BuiltinType elementType) {
        return BinaryOperationNode.of(array, SqlOperator.CONTAINS, buildArrayValue(List.of(element), elementType));
    }

    @Override
    public SqlNode buildArrayContainsAll(SqlNode array, SqlNode elements) {
        return BinaryOperationNode.of(array, SqlOperator.CONTAINS, elements);
    }

    @Override
    public SqlNode buildArrayContainsAny(SqlNode array, SqlNode elements) {
        return BinaryOperationNode.of(array, SqlOperator.OVERLAPS, elements);
    }

    @Override
    public SqlNode buildArrayIsEmpty(SqlNode array) {
        return BinaryOperationNode.of(
                FunctionNode.of("COALESCE", FunctionNode.of("CARDINALITY", array), ValueNode.createImmediate(0)),
                SqlOperator.EQ,
                ValueNode.createImmediate(0));
    }

    @Override
    public SqlNode castText(SqlNode operand) {
        return new CastNode(operand, "text");
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String renderBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    @Override
    public CompiledQuery compile(SqlNode statement) {
        return new SqlRenderer(this).render(statement);
    }
}
