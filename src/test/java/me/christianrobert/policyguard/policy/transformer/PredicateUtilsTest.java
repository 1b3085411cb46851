package me.christianrobert.policyguard.policy.transformer;

import me.christianrobert.policyguard.sql.dialect.PostgresDialect;
import me.christianrobert.policyguard.sql.node.AndNode;
import me.christianrobert.policyguard.sql.node.BinaryOperationNode;
import me.christianrobert.policyguard.sql.node.ColumnNode;
import me.christianrobert.policyguard.sql.node.FunctionNode;
import me.christianrobert.policyguard.sql.node.NotNode;
import me.christianrobert.policyguard.sql.node.OrNode;
import me.christianrobert.policyguard.sql.node.SqlNode;
import me.christianrobert.policyguard.sql.node.SqlOperator;
import me.christianrobert.policyguard.sql.node.ValueNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PredicateUtilsTest {

    private final PostgresDialect dialect = new PostgresDialect();
    private final SqlNode a = BinaryOperationNode.of(ColumnNode.of("t", "a"), SqlOperator.EQ, ValueNode.create(1));
    private final SqlNode b = BinaryOperationNode.of(ColumnNode.of("t", "b"), SqlOperator.GT, ValueNode.create(2));

    @Test
    void conjunctionFoldsConstants() {
        assertEquals(dialect.falseNode(), PredicateUtils.conjunction(dialect, a, dialect.falseNode(), b));
        assertEquals(a, PredicateUtils.conjunction(dialect, dialect.trueNode(), a));
        assertEquals(dialect.trueNode(), PredicateUtils.conjunction(dialect, List.of()));
    }

    @Test
    void conjunctionFlattensNestedAnds() {
        SqlNode c = BinaryOperationNode.of(ColumnNode.of("t", "c"), SqlOperator.IS, ValueNode.NULL);

        SqlNode result = PredicateUtils.conjunction(dialect, new AndNode(List.of(a, b)), c);

        assertEquals(new AndNode(List.of(a, b, c)), result);
    }

    @Test
    void disjunctionFoldsConstants() {
        assertEquals(dialect.trueNode(), PredicateUtils.disjunction(dialect, a, dialect.trueNode()));
        assertEquals(b, PredicateUtils.disjunction(dialect, dialect.falseNode(), b));
        assertEquals(dialect.falseNode(), PredicateUtils.disjunction(dialect, List.of()));
        assertEquals(new OrNode(List.of(a, b)), PredicateUtils.disjunction(dialect, a, b));
    }

    @Test
    void nullConstantStaysInJunction() {
        SqlNode result = PredicateUtils.conjunction(dialect, a, ValueNode.NULL);

        assertEquals(new AndNode(List.of(a, ValueNode.NULL)), result);
    }

    @Test
    void logicalNotFoldsAndFlipsNullTests() {
        SqlNode isNull = BinaryOperationNode.of(ColumnNode.of("t", "c"), SqlOperator.IS, ValueNode.NULL);

        assertEquals(dialect.falseNode(), PredicateUtils.logicalNot(dialect, dialect.trueNode()));
        assertEquals(dialect.trueNode(), PredicateUtils.logicalNot(dialect, dialect.falseNode()));
        assertSame(ValueNode.NULL, PredicateUtils.logicalNot(dialect, ValueNode.NULL));
        assertEquals(BinaryOperationNode.of(ColumnNode.of("t", "c"), SqlOperator.IS_NOT, ValueNode.NULL),
                PredicateUtils.logicalNot(dialect, isNull));
        assertEquals(new NotNode(a), PredicateUtils.logicalNot(dialect, a));
        assertEquals(a, PredicateUtils.logicalNot(dialect, new NotNode(a)));
    }

    @Test
    void isFalseTreatsUnknownAsFalse() {
        assertEquals(dialect.trueNode(), PredicateUtils.buildIsFalse(dialect, ValueNode.NULL));
        assertEquals(dialect.falseNode(), PredicateUtils.buildIsFalse(dialect, dialect.trueNode()));
        assertEquals(BinaryOperationNode.of(FunctionNode.of("COALESCE", a, dialect.falseNode()), SqlOperator.EQ,
                dialect.falseNode()), PredicateUtils.buildIsFalse(dialect, a));
    }

    @Test
    void isTrueRequiresKnownTruth() {
        assertEquals(dialect.falseNode(), PredicateUtils.buildIsTrue(dialect, ValueNode.NULL));
        assertEquals(BinaryOperationNode.of(FunctionNode.of("COALESCE", a, dialect.falseNode()), SqlOperator.EQ,
                dialect.trueNode()), PredicateUtils.buildIsTrue(dialect, a));
    }
}
