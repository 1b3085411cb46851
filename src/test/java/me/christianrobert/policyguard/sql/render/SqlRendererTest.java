package me.christianrobert.policyguard.sql.render;

import me.christianrobert.policyguard.sql.dialect.PostgresDialect;
import me.christianrobert.policyguard.sql.node.AliasNode;
import me.christianrobert.policyguard.sql.node.AndNode;
import me.christianrobert.policyguard.sql.node.ArrayNode;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.CaseNode;
import me.christianrobert.policyguard.sql.node.ColumnNode;
import me.christianrobert.policyguard.sql.node.ColumnUpdateNode;
import me.christianrobert.policyguard.sql.node.DeleteQueryNode;
import me.christianrobert.policyguard.sql.node.ExistsNode;
import me.christianrobert.policyguard.sql.node.FunctionNode;
import me.christianrobert.policyguard.sql.node.InsertQueryNode;
import me.christianrobert.policyguard.sql.node.JoinNode;
import me.christianrobert.policyguard.sql.node.LikeNode;
import me.christianrobert.policyguard.sql.node.NotNode;
import me.christianrobert.policyguard.sql.node.OnConflictNode;
import me.christianrobert.policyguard.sql.node.OrNode;
import me.christianrobert.policyguard.sql.node.OrderByNode;
import me.christianrobert.policyguard.sql.node.SelectAllNode;
import me.christianrobert.policyguard.sql.node.SelectQueryNode;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.node.SqlOperator;
import me.christianrobert.policyguard.sql.node.TableNode;
import me.christianrobert.policyguard.sql.node.UpdateQueryNode;
import me.christianrobert.policyguard.sql.node.ValueListNode;
import me.christianrobert.policyguard.sql.node.ValueNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlRendererTest {

    private PostgresDialect dialect;

    @BeforeEach
    void setUp() {
        dialect = new PostgresDialect();
    }

    @Test
    void rendersSelectWithParameters() {
        SelectQueryNode select = SelectQueryNode.builder()
                .from(TableNode.of("posts"))
                .select(ColumnNode.of("posts", "id"), AliasNode.of(ColumnNode.of("title"), "t"))
                .where(BinaryOperationNode.of(ColumnNode.of("posts", "published"), SqlOperator.EQ,
                        ValueNode.create(true)))
                .orderBy(new OrderByNode(ColumnNode.of("posts", "id"), true))
                .limit(10)
                .build();

        CompiledQuery query = dialect.compile(select);

        assertEquals("SELECT \"posts\".\"id\", \"title\" AS \"t\" FROM \"posts\" WHERE \"posts\".\"published\" = ? "
                + "ORDER BY \"posts\".\"id\" DESC LIMIT 10", query.getSql());
        assertEquals(List.of(true), query.getParameters());
    }

    @Test
    void immediateValuesAreInlined() {
        SqlNode predicate = new AndNode(List.of(
                BinaryOperationNode.of(ColumnNode.of("x", "a"), SqlOperator.EQ, ValueNode.createImmediate(1)),
                new OrNode(List.of(
                        BinaryOperationNode.of(ColumnNode.of("x", "b"), SqlOperator.GT,
                                ValueNode.createImmediate(new BigDecimal("2.50"))),
                        BinaryOperationNode.of(ColumnNode.of("x", "c"), SqlOperator.IS, ValueNode.NULL),
                        dialect.trueNode()))));

        CompiledQuery query = new SqlRenderer(dialect).renderExpression(predicate);

        assertEquals("(\"x\".\"a\" = 1 AND (\"x\".\"b\" > 2.50 OR \"x\".\"c\" IS NULL OR TRUE))", query.getSql());
        assertTrue(query.getParameters().isEmpty());
    }

    @Test
    void nestedSelectsAreParenthesized() {
        SelectQueryNode sub = SelectQueryNode.builder()
                .from(TableNode.of("User"))
                .where(BinaryOperationNode.of(ColumnNode.of("posts", "authorId"), SqlOperator.EQ,
                        ColumnNode.of("User", "id")))
                .build();
        SelectQueryNode select = SelectQueryNode.builder()
                .from(TableNode.of("posts"))
                .select(SelectAllNode.all())
                .where(new ExistsNode(sub))
                .build();

        assertEquals("SELECT * FROM \"posts\" WHERE EXISTS (SELECT 1 FROM \"User\" "
                + "WHERE \"posts\".\"authorId\" = \"User\".\"id\")", dialect.compile(select).getSql());
    }

    @Test
    void scalarSubqueryOperandIsParenthesized() {
        SelectQueryNode sub = SelectQueryNode.builder()
                .from(TableNode.of("User"))
                .select(AliasNode.of(ColumnNode.of("User", "id"), "$t"))
                .build();
        SqlNode predicate = BinaryOperationNode.of(ValueNode.create(7), SqlOperator.EQ, sub);

        CompiledQuery query = new SqlRenderer(dialect).renderExpression(predicate);

        assertEquals("? = (SELECT \"User\".\"id\" AS \"$t\" FROM \"User\")", query.getSql());
        assertEquals(List.of(7), query.getParameters());
    }

    @Test
    void rendersJoins() {
        SelectQueryNode select = SelectQueryNode.builder()
                .from(AliasNode.of(TableNode.of("posts"), "p"))
                .join(new JoinNode(JoinNode.JoinType.LEFT, AliasNode.of(TableNode.of("User"), "u"),
                        BinaryOperationNode.of(ColumnNode.of("p", "authorId"), SqlOperator.EQ,
                                ColumnNode.of("u", "id"))))
                .select(new SelectAllNode("p"))
                .build();

        assertEquals("SELECT \"p\".* FROM \"posts\" AS \"p\" LEFT JOIN \"User\" AS \"u\" "
                + "ON \"p\".\"authorId\" = \"u\".\"id\"", dialect.compile(select).getSql());
    }

    @Test
    void rendersInsertWithConflictClauseAndReturning() {
        InsertQueryNode insert = new InsertQueryNode(TableNode.of("Foo"), List.of("id", "x"),
                List.of(List.of(ValueNode.create(1), ValueNode.create(2))),
                new OnConflictNode(List.of("id"), List.of(new ColumnUpdateNode("x", ValueNode.create(3))),
                        BinaryOperationNode.of(ColumnNode.of("Foo", "x"), SqlOperator.GT,
                                ValueNode.createImmediate(0))),
                List.of(ColumnNode.of("id")));

        CompiledQuery query = dialect.compile(insert);

        assertEquals("INSERT INTO \"Foo\" (\"id\", \"x\") VALUES (?, ?) ON CONFLICT (\"id\") DO UPDATE SET \"x\" = ? "
                + "WHERE \"Foo\".\"x\" > 0 RETURNING \"id\"", query.getSql());
        assertEquals(List.of(1, 2, 3), query.getParameters());
    }

    @Test
    void rendersDoNothingConflict() {
        InsertQueryNode insert = new InsertQueryNode(TableNode.of("Foo"), List.of("id"),
                List.of(List.of(ValueNode.create(1))), new OnConflictNode(List.of(), null, null), null);

        assertEquals("INSERT INTO \"Foo\" (\"id\") VALUES (?) ON CONFLICT DO NOTHING",
                dialect.compile(insert).getSql());
    }

    @Test
    void rendersUpdateWithAliasFromAndReturning() {
        UpdateQueryNode update = new UpdateQueryNode(TableNode.of("Foo"), "f",
                List.of(new ColumnUpdateNode("x", ValueNode.create(5))),
                List.of(TableNode.of("Bar")),
                BinaryOperationNode.of(ColumnNode.of("f", "id"), SqlOperator.EQ, ColumnNode.of("Bar", "fooId")),
                List.of(ColumnNode.of("f", "id")));

        assertEquals("UPDATE \"Foo\" AS \"f\" SET \"x\" = ? FROM \"Bar\" WHERE \"f\".\"id\" = \"Bar\".\"fooId\" "
                + "RETURNING \"f\".\"id\"", dialect.compile(update).getSql());
    }

    @Test
    void rendersDeleteWithUsing() {
        DeleteQueryNode delete = new DeleteQueryNode(TableNode.of("Foo"), null, List.of(TableNode.of("Bar")),
                BinaryOperationNode.of(ColumnNode.of("Foo", "id"), SqlOperator.EQ, ColumnNode.of("Bar", "fooId")),
                null);

        assertEquals("DELETE FROM \"Foo\" USING \"Bar\" WHERE \"Foo\".\"id\" = \"Bar\".\"fooId\"",
                dialect.compile(delete).getSql());
    }

    @Test
    void rendersConstantRowsWithColumnTypes() {
        SqlNode rows = dialect.buildConstantRows("Foo", List.of("id", "x"), List.of("integer", "integer"),
                List.of(List.of(ValueNode.create(1), ValueNode.NULL)));
        SelectQueryNode check = SelectQueryNode.builder()
                .from(rows)
                .select(AliasNode.of(BinaryOperationNode.of(FunctionNode.of("COUNT", ValueNode.createImmediate(1)),
                        SqlOperator.GT, ValueNode.createImmediate(0)), "$condition"))
                .build();

        assertEquals("SELECT COUNT(1) > 0 AS \"$condition\" FROM (VALUES (CAST(? AS integer), CAST(NULL AS integer))) "
                + "AS \"Foo\"(\"id\", \"x\")", dialect.compile(check).getSql());
    }

    @Test
    void rendersLikeWithEscapeClause() {
        SqlNode like = new LikeNode(ColumnNode.of("p", "title"), ValueNode.create("%a\\_b%"), true);

        CompiledQuery query = new SqlRenderer(dialect).renderExpression(like);

        assertEquals("\"p\".\"title\" ILIKE ? ESCAPE '\\'", query.getSql());
        assertEquals(List.of("%a\\_b%"), query.getParameters());
    }

    @Test
    void rendersArraysCastsAndCase() {
        SqlNode array = new ArrayNode(List.of(ValueNode.create("a"), ValueNode.create("b")), "text");
        SqlNode masked = AliasNode.of(new CaseNode(
                BinaryOperationNode.of(ColumnNode.of("u", "id"), SqlOperator.EQ, ValueNode.create(1)),
                ColumnNode.of("u", "email"), ValueNode.NULL), "email");

        assertEquals("ARRAY[?, ?]::text[]", new SqlRenderer(dialect).renderExpression(array).getSql());
        assertEquals("CASE WHEN \"u\".\"id\" = ? THEN \"u\".\"email\" ELSE NULL END AS \"email\"",
                new SqlRenderer(dialect).renderExpression(masked).getSql());
    }

    @Test
    void rendersNotAndValueLists() {
        SqlNode in = BinaryOperationNode.of(ColumnNode.of("u", "role"), SqlOperator.IN,
                new ValueListNode(List.of(ValueNode.create("A"), ValueNode.create("B"))));
        SqlNode empty = BinaryOperationNode.of(ColumnNode.of("u", "role"), SqlOperator.IN,
                new ValueListNode(List.of()));

        assertEquals("NOT (\"u\".\"role\" IN (?, ?))", new SqlRenderer(dialect).renderExpression(new NotNode(in)).getSql());
        assertEquals("\"u\".\"role\" IN (NULL)", new SqlRenderer(dialect).renderExpression(empty).getSql());
    }

    @Test
    void nestedComparisonOperandsAreParenthesized() {
        SqlNode nested = BinaryOperationNode.of(
                BinaryOperationNode.of(ColumnNode.of("a"), SqlOperator.GT, ValueNode.createImmediate(1)),
                SqlOperator.EQ, dialect.falseNode());

        assertEquals("(\"a\" > 1) = FALSE", new SqlRenderer(dialect).renderExpression(nested).getSql());
    }

    @Test
    void identifiersAreQuotedAndEscaped() {
        assertEquals("\"we\"\"ird\"", dialect.quoteIdentifier("we\"ird"));
    }
}
