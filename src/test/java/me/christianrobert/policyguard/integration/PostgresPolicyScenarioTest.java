package me.christianrobert.policyguard.integration;

import me.christianrobert.policyguard.TestSchemas;
import me.christianrobert.policyguard.client.ModelClient;
import me.christianrobert.policyguard.client.PolicyClient;
import me.christianrobert.policyguard.config.service.ConfigService;
import me.christianrobert.policyguard.executor.QueryExecutionException;
import me.christianrobert.policyguard.policy.exception.PolicyDeniedException;
import me.christianrobert.policyguard.policy.exception.RejectedReason;
import me.christianrobert.policyguard.schema.model.SchemaDefinition;
import me.christianrobert.policyguard.schema.service.SchemaBuilder;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.ColumnNode;
import me.christianrobert.policyguard.sql.node.DeleteQueryNode;
import me.christianrobert.policyguard.sql.node.InsertQueryNode;
import me.christianrobert.policyguard.sql.node.SelectQueryNode;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.node.SqlOperator;
import me.christianrobert.policyguard.sql.node.TableNode;
import me.christianrobert.policyguard.sql.node.ValueNode;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end policy scenarios: statements go through the policy client into PostgreSQL and the
 * resulting database state is checked with unfiltered JDBC.
 */
public class PostgresPolicyScenarioTest extends PostgresPolicyTestBase {

    private static final Map<String, Object> USER_1 = Map.of("id", 1);
    private static final Map<String, Object> USER_2 = Map.of("id", 2);

    private PolicyClient blog() throws SQLException {
        executeBatch("""
                CREATE TABLE "User" ("id" integer PRIMARY KEY, "email" text, "role" text, "tags" text[]);
                CREATE TABLE "posts" ("id" integer PRIMARY KEY, "title" text, "published" boolean,
                    "authorId" integer REFERENCES "User"("id"));
                CREATE TABLE "Comment" ("id" integer PRIMARY KEY, "content" text, "postId" integer,
                    "authorId" integer);
                INSERT INTO "User" VALUES (1, 'a@example.com', 'USER', '{news}'), (2, 'b@example.com', 'ADMIN', '{}');
                INSERT INTO "posts" VALUES (1, 'published by 2', true, 2), (2, 'draft by 1', false, 1),
                    (3, 'draft by 2', false, 2);
                INSERT INTO "Comment" VALUES (1, 'on published', 1, 1), (2, 'on draft', 3, 2)
                """);
        return createClient(TestSchemas.blog());
    }

    private static List<Object> ids(List<Map<String, Object>> rows) {
        return rows.stream().map(row -> row.get("id")).toList();
    }

    private static Map<String, Object> data(Object... keyValues) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            result.put((String) keyValues[i], keyValues[i + 1]);
        }
        return result;
    }

    // ========== Read ==========

    @Test
    void readPolicy_filtersRowsPerPrincipal() throws SQLException {
        PolicyClient client = blog();

        assertEquals(List.of(1), ids(client.model("Post").findMany()));
        assertEquals(List.of(1, 2), ids(client.withPrincipal(USER_1).model("Post").findMany()));
        assertEquals(List.of(1, 3), ids(client.withPrincipal(USER_2).model("Post").findMany()));
        assertEquals(1, client.withPrincipal(USER_1).model("Post").count(Map.of("published", false)));
    }

    @Test
    void fieldReadPolicy_masksOtherUsersEmail() throws SQLException {
        List<Map<String, Object>> users = blog().withPrincipal(USER_1).model("User").findMany();

        assertEquals(2, users.size());
        assertEquals("a@example.com", users.get(0).get("email"));
        assertNull(users.get(1).get("email"));
        assertEquals("ADMIN", users.get(1).get("role"));
        assertEquals(List.of("news"), users.get(0).get("tags"));
    }

    @Test
    void checkFunction_commentsFollowPostVisibility() throws SQLException {
        PolicyClient client = blog();

        assertEquals(List.of(1), ids(client.withPrincipal(USER_1).model("Comment").findMany()));
        assertEquals(List.of(1, 2), ids(client.withPrincipal(USER_2).model("Comment").findMany()));
    }

    @Test
    void relationChain_threeLevelsDeep() throws SQLException {
        executeBatch("""
                CREATE TABLE "Company" ("id" integer PRIMARY KEY, "listed" boolean);
                CREATE TABLE "Department" ("id" integer PRIMARY KEY, "companyId" integer);
                CREATE TABLE "Employee" ("id" integer PRIMARY KEY, "name" text, "departmentId" integer);
                INSERT INTO "Company" VALUES (1, true), (2, false);
                INSERT INTO "Department" VALUES (10, 1), (20, 2);
                INSERT INTO "Employee" VALUES (100, 'visible', 10), (200, 'hidden', 20), (300, 'no department', NULL)
                """);
        SchemaDefinition schema = new SchemaBuilder()
                .model("Company", m -> m.idField("id", "Int").field("listed", "Boolean").allow("read", "true"))
                .model("Department", m -> m
                        .idField("id", "Int")
                        .field("companyId", "Int")
                        .toOne("company", "Company", List.of("companyId"), List.of("id"))
                        .allow("read", "true"))
                .model("Employee", m -> m
                        .idField("id", "Int")
                        .field("name", "String")
                        .field("departmentId", "Int")
                        .toOne("department", "Department", List.of("departmentId"), List.of("id"))
                        .allow("read", "department.company.listed"))
                .build();

        List<Map<String, Object>> employees = createClient(schema).model("Employee").findMany();

        assertEquals(List.of(100), ids(employees));
    }

    @Test
    void selfRelation_policyReadsTheManagerRow() throws SQLException {
        executeBatch("""
                CREATE TABLE "Emp" ("id" integer PRIMARY KEY, "name" text, "managerId" integer REFERENCES "Emp"("id"));
                INSERT INTO "Emp" VALUES (1, 'boss', NULL), (2, 'alice', 1), (3, 'bob', 2), (4, 'carol', NULL)
                """);

        List<Map<String, Object>> visible = createClient(TestSchemas.staff()).model("Emp").findMany();

        assertEquals(List.of(2), ids(visible));
    }

    // ========== Many-to-many ==========

    private PolicyClient tagging(SchemaDefinition schema) throws SQLException {
        executeBatch("""
                CREATE TABLE "Article" ("id" integer PRIMARY KEY, "title" text, "published" boolean);
                CREATE TABLE "Tag" ("id" integer PRIMARY KEY, "name" text, "locked" boolean);
                CREATE TABLE "_ArticleToTag" ("A" integer NOT NULL REFERENCES "Article"("id"),
                    "B" integer NOT NULL REFERENCES "Tag"("id"), UNIQUE ("A", "B"));
                INSERT INTO "Article" VALUES (1, 'out', true), (2, 'draft', false);
                INSERT INTO "Tag" VALUES (10, 'open', false), (20, 'frozen', true);
                INSERT INTO "_ArticleToTag" VALUES (1, 20), (2, 10)
                """);
        return createClient(schema);
    }

    private static SqlNode linkColumn(String column, int value) {
        return BinaryOperationNode.of(ColumnNode.of("_ArticleToTag", column), SqlOperator.EQ, ValueNode.create(value));
    }

    @Test
    void manyToMany_relationAccessGoesThroughJoinTable() throws SQLException {
        SchemaDefinition schema = new SchemaBuilder()
                .model("Article", m -> m
                        .idField("id", "Int")
                        .field("published", "Boolean")
                        .manyToMany("tags", "Tag", "articles")
                        .allow("read", "true"))
                .model("Tag", m -> m
                        .idField("id", "Int")
                        .field("name", "String")
                        .manyToMany("articles", "Article", "tags")
                        .allow("read", "articles?[published]"))
                .build();

        PolicyClient client = tagging(schema);

        assertEquals(List.of(20), ids(client.model("Tag").findMany()));
    }

    @Test
    void manyToMany_joinTableRowsFollowBothSides() throws SQLException {
        PolicyClient client = tagging(TestSchemas.tagging());

        List<Map<String, Object>> links = client.execute(SelectQueryNode.selectAllFrom("_ArticleToTag")).getRows();

        assertEquals(1, links.size());
        assertEquals(1, links.get(0).get("A"));
        assertEquals(20, links.get(0).get("B"));
    }

    @Test
    void manyToMany_linkingRequiresBothSidesUpdatable() throws SQLException {
        PolicyClient client = tagging(TestSchemas.tagging()).withPrincipal(USER_1);
        InsertQueryNode toLocked = new InsertQueryNode(TableNode.of("_ArticleToTag"), List.of("A", "B"),
                List.of(List.of(ValueNode.create(2), ValueNode.create(20))), null, null);
        InsertQueryNode toOpen = new InsertQueryNode(TableNode.of("_ArticleToTag"), List.of("A", "B"),
                List.of(List.of(ValueNode.create(1), ValueNode.create(10))), null, null);

        PolicyDeniedException e = assertThrows(PolicyDeniedException.class, () -> client.execute(toLocked));
        assertEquals(RejectedReason.NO_ACCESS, e.getReason());
        assertEquals(2L, countRows("_ArticleToTag"));

        assertEquals(1, client.execute(toOpen).getNumAffectedRows());
        assertEquals(3L, countRows("_ArticleToTag"));
    }

    @Test
    void manyToMany_unlinkingSkipsLinksToLockedRows() throws SQLException {
        PolicyClient client = tagging(TestSchemas.tagging());

        DeleteQueryNode all = new DeleteQueryNode(TableNode.of("_ArticleToTag"), null, null, null, null);
        assertEquals(0, client.execute(all).getNumAffectedRows());

        PolicyClient signedIn = client.withPrincipal(USER_1);
        assertEquals(0, signedIn.execute(new DeleteQueryNode(TableNode.of("_ArticleToTag"), null, null,
                linkColumn("B", 20), null)).getNumAffectedRows());
        assertEquals(1, signedIn.execute(all).getNumAffectedRows());
        assertEquals(1L, countRows("_ArticleToTag"));
    }

    // ========== Create ==========

    @Test
    void create_ownPostIsReturned() throws SQLException {
        ModelClient posts = blog().withPrincipal(USER_1).model("Post");

        Map<String, Object> created = posts.create(data("id", 4, "title", "new", "published", false, "authorId", 1));

        assertEquals(4, created.get("id"));
        assertEquals("new", created.get("title"));
        assertEquals(4L, countRows("posts"));
    }

    @Test
    void create_forAnotherAuthorIsRejectedWithoutWriting() throws SQLException {
        ModelClient posts = blog().withPrincipal(USER_1).model("Post");

        PolicyDeniedException e = assertThrows(PolicyDeniedException.class,
                () -> posts.create(data("id", 4, "title", "forged", "published", true, "authorId", 2)));

        assertEquals(RejectedReason.NO_ACCESS, e.getReason());
        assertEquals(3L, countRows("posts"));
    }

    @Test
    void create_unreadableResultIsRolledBack() throws SQLException {
        executeUpdate("CREATE TABLE \"Inbox\" (\"id\" integer PRIMARY KEY, \"message\" text)");
        SchemaDefinition schema = new SchemaBuilder()
                .model("Inbox", m -> m.idField("id", "Int").field("message", "String").allow("create", "true"))
                .build();
        ModelClient inbox = createClient(schema).model("Inbox");

        PolicyDeniedException e = assertThrows(PolicyDeniedException.class,
                () -> inbox.create(data("id", 1, "message", "hello")));

        assertEquals(RejectedReason.CANNOT_READ_BACK, e.getReason());
        assertEquals(0L, countRows("Inbox"));
    }

    @Test
    void create_withoutTransactionsKeepsUnreadableRow() throws SQLException {
        executeUpdate("CREATE TABLE \"Inbox\" (\"id\" integer PRIMARY KEY, \"message\" text)");
        configService.setConfigValue(ConfigService.POLICY_MUTATION_TRANSACTIONAL, false);
        SchemaDefinition schema = new SchemaBuilder()
                .model("Inbox", m -> m.idField("id", "Int").field("message", "String").allow("create", "true"))
                .build();
        ModelClient inbox = createClient(schema).model("Inbox");

        assertThrows(PolicyDeniedException.class, () -> inbox.create(data("id", 1, "message", "hello")));

        assertEquals(1L, countRows("Inbox"));
    }

    @Test
    void create_constraintViolationSurfacesAsQueryExecutionException() throws SQLException {
        ModelClient posts = blog().withPrincipal(USER_1).model("Post");

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> posts.create(data("id", 2, "title", "duplicate", "published", false, "authorId", 1)));

        assertEquals("23505", e.getSqlState());
    }

    // ========== Update ==========

    @Test
    void update_onlyTouchesRowsPassingUpdatePolicy() throws SQLException {
        executeBatch("""
                CREATE TABLE "Foo" ("id" integer PRIMARY KEY, "x" integer);
                INSERT INTO "Foo" VALUES (1, 0), (2, 1)
                """);
        ModelClient foo = createClient(TestSchemas.foo("x > 0")).model("Foo");

        assertEquals(Optional.empty(), foo.update(Map.of("id", 1), Map.of("x", 5)));
        assertEquals(0, queryScalar("SELECT \"x\" FROM \"Foo\" WHERE \"id\" = 1"));

        Optional<Map<String, Object>> updated = foo.update(Map.of("id", 2), Map.of("x", 2));
        assertTrue(updated.isPresent());
        assertEquals(2, updated.get().get("x"));
        assertEquals(0, foo.updateMany(Map.of("id", 1), Map.of("x", 10)));
    }

    @Test
    void allowAndDeny_denyWinsWhereBothMatch() throws SQLException {
        executeBatch("""
                CREATE TABLE "Foo" ("id" integer PRIMARY KEY, "x" integer);
                INSERT INTO "Foo" VALUES (1, 0), (2, 1), (3, 2)
                """);
        SchemaDefinition schema = new SchemaBuilder()
                .model("Foo", m -> m
                        .idField("id", "Int")
                        .field("x", "Int")
                        .allow("read", "this.x <= 0 || this.x > 1")
                        .deny("read", "this.x <= 0"))
                .build();

        assertEquals(List.of(3), ids(createClient(schema).model("Foo").findMany()));
    }

    @Test
    void postUpdate_comparesWithBeforeImageAndRollsBack() throws SQLException {
        executeBatch("""
                CREATE TABLE "Counter" ("id" integer PRIMARY KEY, "x" integer);
                INSERT INTO "Counter" VALUES (1, 5)
                """);
        SchemaDefinition schema = new SchemaBuilder()
                .model("Counter", m -> m
                        .idField("id", "Int")
                        .field("x", "Int")
                        .allow("all", "true")
                        .allow("post-update", "x >= before().x"))
                .build();
        ModelClient counter = createClient(schema).model("Counter");

        PolicyDeniedException e = assertThrows(PolicyDeniedException.class,
                () -> counter.update(Map.of("id", 1), Map.of("x", 3)));
        assertEquals(RejectedReason.NO_ACCESS, e.getReason());
        assertEquals(5, queryScalar("SELECT \"x\" FROM \"Counter\""));

        Optional<Map<String, Object>> updated = counter.update(Map.of("id", 1), Map.of("x", 7));
        assertTrue(updated.isPresent());
        assertEquals(7, updated.get().get("x"));
    }

    @Test
    void mixinFieldRule_blocksUpdatesOfLockedRows() throws SQLException {
        executeBatch("""
                CREATE TABLE "Doc" ("id" integer PRIMARY KEY, "locked" boolean, "note" text);
                INSERT INTO "Doc" VALUES (1, true, 'frozen'), (2, false, 'open')
                """);
        SchemaDefinition schema = new SchemaBuilder()
                .type("Lockable", t -> t
                        .field("locked", "Boolean")
                        .field("note", "String", f -> f.deny("update", "locked")))
                .model("Doc", m -> m.idField("id", "Int").mixin("Lockable").allow("all", "true"))
                .build();
        ModelClient docs = createClient(schema).model("Doc");

        PolicyDeniedException e = assertThrows(PolicyDeniedException.class,
                () -> docs.updateMany(Map.of("id", 1), Map.of("note", "changed")));
        assertTrue(e.getMessage().contains("note"));
        assertEquals("frozen", queryScalar("SELECT \"note\" FROM \"Doc\" WHERE \"id\" = 1"));

        assertEquals(1, docs.updateMany(Map.of("id", 2), Map.of("note", "changed")));
        assertEquals(1, docs.updateMany(Map.of("id", 1), Map.of("locked", false)));
    }

    // ========== Delete ==========

    @Test
    void delete_denyRuleOverridesAllow() throws SQLException {
        PolicyClient client = blog();
        ModelClient asAuthor = client.withPrincipal(USER_2).model("Post");

        assertEquals(0, asAuthor.deleteMany(Map.of("id", 1)));
        assertEquals(Optional.empty(), client.withPrincipal(USER_1).model("Post").delete(Map.of("id", 3)));

        Optional<Map<String, Object>> deleted = asAuthor.delete(Map.of("id", 3));
        assertTrue(deleted.isPresent());
        assertEquals("draft by 2", deleted.get().get("title"));
        assertEquals(2L, countRows("posts"));
    }
}
