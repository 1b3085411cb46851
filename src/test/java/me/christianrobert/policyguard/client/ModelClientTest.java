package me.christianrobert.policyguard.client;

import me.christianrobert.policyguard.executor.QueryExecutor;
import me.christianrobert.policyguard.executor.QueryResult;
import me.christianrobert.policyguard.policy.function.FunctionRegistry;
import me.christianrobert.policyguard.policy.handler.PolicyHandler;
import me.christianrobert.policyguard.policy.registry.PolicyRegistry;
import me.christianrobert.policyguard.schema.model.SchemaDefinition;
import me.christianrobert.policyguard.schema.service.SchemaBuilder;
import me.christianrobert.policyguard.sql.dialect.PostgresDialect;
import me.christianrobert.policyguard.sql.node.SqlStatement;
import me.christianrobert.policyguard.sql.render.CompiledQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.postgresql.util.PGobject;

import java.sql.SQLException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ModelClientTest {

    private PostgresDialect dialect;
    private QueryExecutor executor;
    private PolicyClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        dialect = new PostgresDialect();
        executor = mock(QueryExecutor.class);
        when(executor.inTransaction(any())).thenAnswer(invocation ->
                ((Function<QueryExecutor, Object>) invocation.getArgument(0)).apply(executor));

        SchemaDefinition schema = new SchemaBuilder()
                .model("Owner", m -> m.idField("id", "Int").allow("all", "true"))
                .model("Item", m -> m
                        .idField("id", "Int")
                        .field("meta", "Json")
                        .field("labels", "String", f -> f.array())
                        .field("ownerId", "Int", f -> f.optional())
                        .optionalToOne("owner", "Owner", List.of("ownerId"), List.of("id"))
                        .allow("all", "true"))
                .build();
        PolicyRegistry registry = new PolicyRegistry(schema, dialect, FunctionRegistry.builtins());
        client = new PolicyClient(registry, new PolicyHandler(registry, true), executor);
    }

    private List<CompiledQuery> executed(int times) {
        ArgumentCaptor<SqlStatement> captor = ArgumentCaptor.forClass(SqlStatement.class);
        verify(executor, times(times)).execute(captor.capture());
        return captor.getAllValues().stream().map(dialect::compile).toList();
    }

    @Test
    void findManyFiltersAndOrdersById() {
        when(executor.execute(any())).thenReturn(QueryResult.ofRows(List.of()));
        Map<String, Object> where = new LinkedHashMap<>();
        where.put("id", 1);
        where.put("ownerId", null);

        assertTrue(client.model("Item").findMany(where).isEmpty());

        CompiledQuery query = executed(1).get(0);
        assertEquals("SELECT * FROM \"Item\" WHERE (\"Item\".\"id\" = ? AND \"Item\".\"ownerId\" IS NULL) "
                + "ORDER BY \"Item\".\"id\" ASC", query.getSql());
        assertEquals(List.of(1), query.getParameters());
    }

    @Test
    void jsonValuesAreSerializedAndDecoded() throws SQLException {
        PGobject meta = new PGobject();
        meta.setType("jsonb");
        meta.setValue("{\"color\":\"red\"}");
        Map<String, Object> stored = new HashMap<>();
        stored.put("id", 1);
        stored.put("meta", meta);
        when(executor.execute(any())).thenReturn(
                QueryResult.ofRows(List.of(Map.of("id", 1))),
                QueryResult.ofRows(List.of(stored)));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", 1);
        data.put("meta", Map.of("color", "red"));

        Map<String, Object> created = client.model("Item").create(data);

        assertEquals(Map.of("color", "red"), created.get("meta"));
        List<CompiledQuery> queries = executed(2);
        assertEquals("INSERT INTO \"Item\" (\"id\", \"meta\") VALUES (?, CAST(? AS jsonb)) RETURNING \"id\"",
                queries.get(0).getSql());
        assertEquals(List.of(1, "{\"color\":\"red\"}"), queries.get(0).getParameters());
        assertEquals("SELECT \"Item\".* FROM \"Item\" WHERE \"Item\".\"id\" = ?", queries.get(1).getSql());
    }

    @Test
    void arrayFieldsBindAsTypedArrays() {
        when(executor.execute(any())).thenReturn(QueryResult.ofAffected(1));

        long updated = client.model("Item").updateMany(Map.of("id", 1), Map.of("labels", List.of("a", "b")));

        assertEquals(1, updated);
        assertEquals("UPDATE \"Item\" SET \"labels\" = ARRAY[?, ?]::text[] WHERE \"Item\".\"id\" = ?",
                executed(1).get(0).getSql());
    }

    @Test
    void countReadsAliasedColumn() {
        when(executor.execute(any())).thenReturn(QueryResult.ofRows(List.of(Map.of("count", 3L))));

        assertEquals(3, client.model("Item").count(Map.of()));
        assertEquals("SELECT COUNT(1) AS \"count\" FROM \"Item\"", executed(1).get(0).getSql());
    }

    @Test
    void findUniqueRejectsAmbiguousFilter() {
        when(executor.execute(any())).thenReturn(QueryResult.ofRows(List.of(Map.of("id", 1), Map.of("id", 2))));

        assertThrows(IllegalArgumentException.class, () -> client.model("Item").findUnique(Map.of("ownerId", 7)));
    }

    @Test
    void invalidInputIsRejectedBeforeQuerying() {
        ModelClient items = client.model("Item");

        assertThrows(IllegalArgumentException.class, () -> items.findMany(Map.of("missing", 1)));
        assertThrows(IllegalArgumentException.class, () -> items.findMany(Map.of("owner", 1)));
        assertThrows(IllegalArgumentException.class, () -> items.updateMany(Map.of(), Map.of("labels", "a")));
        assertThrows(IllegalArgumentException.class, () -> items.updateMany(Map.of(), Map.of("ownerId", Map.of())));
        assertThrows(IllegalArgumentException.class, () -> items.updateMany(Map.of(), Map.of()));
        assertThrows(IllegalArgumentException.class, () -> client.model("Missing"));
        verify(executor, never()).execute(any());
    }

    @Test
    void principalIsBoundPerClient() {
        PolicyClient bound = client.withPrincipal(Map.of("id", 1));

        assertNull(client.getPrincipal());
        assertEquals(Map.of("id", 1), bound.getPrincipal());
        assertEquals("Item", bound.model("Item").getModelName());
    }
}
