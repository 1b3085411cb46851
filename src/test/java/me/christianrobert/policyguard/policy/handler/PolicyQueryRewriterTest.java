package me.christianrobert.policyguard.policy.handler;

import me.christianrobert.policyguard.TestSchemas;
import me.christianrobert.policyguard.policy.exception.PolicyDeniedException;
import me.christianrobert.policyguard.policy.exception.RejectedReason;
import me.christianrobert.policyguard.policy.function.FunctionRegistry;
import me.christianrobert.policyguard.policy.registry.PolicyRegistry;
import me.christianrobert.policyguard.sql.dialect.PostgresDialect;
import me.christianrobert.policyguard.sql.node.AliasNode;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.ColumnNode;
import me.christianrobert.policyguard.sql.node.ExistsNode;
import me.christianrobert.policyguard.sql.node.JoinNode;
import me.christianrobert.policyguard.sql.node.SelectAllNode;
import me.christianrobert.policyguard.sql.node.SelectQueryNode;
import me.christianrobert.policyguard.sql.node.SqlOperator;
import me.christianrobert.policyguard.sql.node.TableNode;
import me.christianrobert.policyguard.sql.node.ValueNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PolicyQueryRewriterTest {

    private static final Map<String, Object> USER_1 = Map.of("id", 1);

    private PostgresDialect dialect;
    private PolicyQueryRewriter rewriter;

    @BeforeEach
    void setUp() {
        dialect = new PostgresDialect();
        rewriter = new PolicyQueryRewriter(new PolicyRegistry(TestSchemas.blog(), dialect, FunctionRegistry.builtins()));
    }

    private String rewrite(SelectQueryNode select, Map<String, Object> principal) {
        return dialect.compile(rewriter.rewriteSelect(select, principal)).getSql();
    }

    @Test
    void readPolicyIsAddedToWhere() {
        SelectQueryNode select = SelectQueryNode.selectAllFrom("posts");

        assertEquals("SELECT * FROM \"posts\" WHERE (\"posts\".\"published\" OR 1 = (SELECT \"$r1\".\"id\" AS \"$t\" "
                + "FROM \"User\" AS \"$r1\" WHERE \"posts\".\"authorId\" = \"$r1\".\"id\"))", rewrite(select, USER_1));
    }

    @Test
    void existingConditionIsKept() {
        SelectQueryNode select = SelectQueryNode.builder()
                .from(TableNode.of("posts"))
                .select(SelectAllNode.all())
                .where(BinaryOperationNode.of(ColumnNode.of("posts", "title"), SqlOperator.EQ, ValueNode.create("x")))
                .build();

        assertEquals("SELECT * FROM \"posts\" WHERE (\"posts\".\"title\" = ? AND \"posts\".\"published\")",
                rewrite(select, null));
    }

    @Test
    void aliasedSourceIsFilteredThroughItsAlias() {
        SelectQueryNode select = SelectQueryNode.builder()
                .from(AliasNode.of(TableNode.of("posts"), "p"))
                .select(ColumnNode.of("p", "title"))
                .build();

        assertEquals("SELECT \"p\".\"title\" FROM \"posts\" AS \"p\" WHERE \"p\".\"published\"", rewrite(select, null));
    }

    @Test
    void allowAllPolicyLeavesQueryUnfiltered() {
        PolicyQueryRewriter foo = new PolicyQueryRewriter(
                new PolicyRegistry(TestSchemas.foo("true"), dialect, FunctionRegistry.builtins()));

        String result = dialect.compile(foo.rewriteSelect(SelectQueryNode.selectAllFrom("Foo"), null)).getSql();

        assertEquals("SELECT * FROM \"Foo\"", result);
    }

    @Test
    void guardedFieldsAreMaskedWhenStarIsExpanded() {
        assertEquals("SELECT \"User\".\"id\" AS \"id\", CASE WHEN 1 = \"User\".\"id\" THEN \"User\".\"email\" ELSE NULL END "
                + "AS \"email\", \"User\".\"role\" AS \"role\", \"User\".\"tags\" AS \"tags\" FROM \"User\"",
                rewrite(SelectQueryNode.selectAllFrom("User"), USER_1));
    }

    @Test
    void guardedFieldIsNullForAnonymousReader() {
        SelectQueryNode select = SelectQueryNode.builder()
                .from(TableNode.of("User"))
                .select(ColumnNode.of("email"))
                .build();

        assertEquals("SELECT NULL AS \"email\" FROM \"User\"", rewrite(select, null));
    }

    @Test
    void joinedTablesAreReplacedWithFilteredSubqueries() {
        SelectQueryNode select = SelectQueryNode.builder()
                .from(TableNode.of("User"))
                .join(new JoinNode(JoinNode.JoinType.INNER, AliasNode.of(TableNode.of("posts"), "p"),
                        BinaryOperationNode.of(ColumnNode.of("p", "authorId"), SqlOperator.EQ,
                                ColumnNode.of("User", "id"))))
                .select(ColumnNode.of("User", "id"))
                .build();

        assertEquals("SELECT \"User\".\"id\" AS \"id\" FROM \"User\" INNER JOIN (SELECT * FROM \"posts\" "
                + "WHERE \"posts\".\"published\") AS \"p\" ON \"p\".\"authorId\" = \"User\".\"id\"", rewrite(select, null));
    }

    @Test
    void nestedSelectsAreRewritten() {
        SelectQueryNode sub = SelectQueryNode.builder()
                .from(TableNode.of("posts"))
                .where(BinaryOperationNode.of(ColumnNode.of("posts", "authorId"), SqlOperator.EQ,
                        ColumnNode.of("User", "id")))
                .build();
        SelectQueryNode select = SelectQueryNode.builder()
                .from(TableNode.of("User"))
                .select(ColumnNode.of("User", "role"))
                .where(new ExistsNode(sub))
                .build();

        assertEquals("SELECT \"User\".\"role\" AS \"role\" FROM \"User\" WHERE EXISTS (SELECT 1 FROM \"posts\" "
                + "WHERE (\"posts\".\"authorId\" = \"User\".\"id\" AND \"posts\".\"published\"))", rewrite(select, null));
    }

    @Test
    void tablesOutsideTheSchemaAreRejected() {
        PolicyDeniedException e = assertThrows(PolicyDeniedException.class,
                () -> rewriter.rewriteSelect(SelectQueryNode.selectAllFrom("pg_user"), USER_1));

        assertEquals(RejectedReason.NO_ACCESS, e.getReason());
        assertEquals("pg_user", e.getModel());
    }

    // ========== Many-to-many join tables ==========

    private String rewriteTagging(SelectQueryNode select, Map<String, Object> principal) {
        PolicyQueryRewriter tagging = new PolicyQueryRewriter(
                new PolicyRegistry(TestSchemas.tagging(), dialect, FunctionRegistry.builtins()));
        return dialect.compile(tagging.rewriteSelect(select, principal)).getSql();
    }

    @Test
    void joinTableRowsAreVisibleOnlyWhenBothSidesAre() {
        assertEquals("SELECT * FROM \"_ArticleToTag\" WHERE ((SELECT \"$r1\".\"published\" AS \"$t\" "
                + "FROM \"Article\" AS \"$r1\" WHERE \"$r1\".\"id\" = \"_ArticleToTag\".\"A\") "
                + "AND (SELECT TRUE AS \"$t\" FROM \"Tag\" AS \"$r1\" WHERE \"$r1\".\"id\" = \"_ArticleToTag\".\"B\"))",
                rewriteTagging(SelectQueryNode.selectAllFrom("_ArticleToTag"), null));
    }

    @Test
    void joinedJoinTableIsFilteredUnderItsAlias() {
        SelectQueryNode select = SelectQueryNode.builder()
                .from(TableNode.of("Tag"))
                .join(new JoinNode(JoinNode.JoinType.INNER, AliasNode.of(TableNode.of("_ArticleToTag"), "l"),
                        BinaryOperationNode.of(ColumnNode.of("l", "B"), SqlOperator.EQ, ColumnNode.of("Tag", "id"))))
                .select(ColumnNode.of("l", "A"))
                .build();

        String sql = rewriteTagging(select, null);

        assertTrue(sql.startsWith("SELECT \"l\".\"A\" FROM \"Tag\" INNER JOIN (SELECT * FROM \"_ArticleToTag\" "
                + "WHERE ((SELECT \"$r1\".\"published\" AS \"$t\" FROM \"Article\" AS \"$r1\" "
                + "WHERE \"$r1\".\"id\" = \"_ArticleToTag\".\"A\")"), sql);
        assertTrue(sql.endsWith(") AS \"l\" ON \"l\".\"B\" = \"Tag\".\"id\""), sql);
    }
}
