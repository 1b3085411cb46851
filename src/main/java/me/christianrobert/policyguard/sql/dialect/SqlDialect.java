package me.christianrobert.policyguard.sql.dialect;

import me.christianrobert.policyguard.schema.model.BuiltinType;
import me.christianrobert.policyguard.schema.model.FieldDefinition;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.render.CompiledQuery;

import java.util.List;

/**
 * Database capability surface used by the policy compiler.
 *
 * <p>Everything that differs between databases (boolean representation, type names, array operations,
 * case-insensitive matching, identifier quoting) goes through this interface so the compiler itself
 * only builds dialect-neutral node trees.
 */
public interface SqlDialect {

    String getName();

    // ========== Constants ==========

    SqlNode trueNode();

    SqlNode falseNode();

    // ========== Types and values ==========

    /**
     * SQL column type of a scalar field, including the array suffix for list fields.
     */
    String getSqlType(FieldDefinition field);

    String getSqlType(BuiltinType type);

    /**
     * Converts a Java value into the form bound as a statement parameter for the given type.
     */
    Object transformInput(Object value, BuiltinType type);

    /**
     * Array value constructor.
     *
     * @param elementType element type, or {@code null} when unknown
     */
    SqlNode buildArrayValue(List<SqlNode> elements, BuiltinType elementType);

    /**
     * Row source of constant rows aliased as {@code alias}, each value cast to its column type.
     * Used to evaluate policies against values that are not stored yet.
     */
    SqlNode buildConstantRows(String alias, List<String> columns, List<String> sqlTypes, List<List<SqlNode>> rows);

    // ========== Predicates ==========

    SqlNode buildLike(SqlNode operand, SqlNode pattern, boolean caseInsensitive);

    /**
     * Escapes the LIKE wildcards in a search value.
     */
    SqlNode escapeLikePattern(SqlNode value);

    /**
     * @param elementType element type of the array column, or {@code null} when unknown
     */
    SqlNode buildArrayContains(SqlNode array, SqlNode element, BuiltinType elementType);

    SqlNode buildArrayContainsAll(SqlNode array, SqlNode elements);

    SqlNode buildArrayContainsAny(SqlNode array, SqlNode elements);

    SqlNode buildArrayIsEmpty(SqlNode array);

    SqlNode castText(SqlNode operand);

    // ========== Rendering ==========

    String quoteIdentifier(String identifier);

    String renderBoolean(boolean value);

    CompiledQuery compile(SqlNode statement);
}
