package me.christianrobert.policyguard.policy.transformer;

import me.christianrobert.policyguard.expression.parser.AntlrPolicyParser;
import me.christianrobert.policyguard.policy.exception.InvalidPolicyExpressionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {

    private AntlrPolicyParser parser;
    private ExpressionEvaluator evaluator;
    private Map<String, Object> principal;

    @BeforeEach
    void setUp() {
        parser = new AntlrPolicyParser();
        evaluator = new ExpressionEvaluator();
        principal = Map.of(
                "id", 1,
                "role", "ADMIN",
                "level", 3,
                "roles", List.of(Map.of("name", "admin"), Map.of("name", "editor")),
                "tags", List.of("a", "b"));
    }

    private Object eval(String source) {
        return evaluator.evaluate(parser.parse(source), principal);
    }

    @Test
    void comparesPrincipalMembers() {
        assertEquals(true, eval("auth().role == 'ADMIN'"));
        assertEquals(false, eval("auth().role != 'ADMIN'"));
        assertEquals(true, eval("auth().level >= 3 && auth().level < 4"));
    }

    @Test
    void numbersCompareByValue() {
        assertEquals(true, eval("auth().level == 3.0"));
        assertTrue(ExpressionEvaluator.valuesEqual(1L, new BigDecimal("1.00")));
        assertEquals(0, ExpressionEvaluator.compareValues(2, 2.0));
    }

    @Test
    void sameTypeComparablesCompareNaturally() {
        assertTrue(ExpressionEvaluator.compareValues("apple", "banana") < 0);
        assertEquals(true, eval("auth().role > 'AAA'"));
        assertTrue(ExpressionEvaluator.compareValues(true, false) > 0);
    }

    @Test
    void incomparableValuesAreNeverOrdered() {
        assertEquals(false, eval("auth().role > 1"));
        assertEquals(false, eval("auth().missing < 1"));
        assertNull(ExpressionEvaluator.compareValues("a", 1));
    }

    @Test
    void collectionPredicatesOverPrincipalLists() {
        assertEquals(true, eval("auth().roles?[name == 'admin']"));
        assertEquals(false, eval("auth().roles![name == 'admin']"));
        assertEquals(true, eval("auth().roles^[name == 'guest']"));
        assertEquals(true, eval("auth().roles?[r, r.name == 'editor']"));
    }

    @Test
    void collectionPredicateOnMissingListIsFalse() {
        assertEquals(false, eval("auth().groups?[true]"));
        assertEquals(false, eval("auth().groups![true]"));
    }

    @Test
    void collectionPredicateOnScalarIsRejected() {
        assertThrows(InvalidPolicyExpressionException.class, () -> eval("auth().role?[true]"));
    }

    @Test
    void inChecksMembership() {
        assertEquals(true, eval("auth().role in ['USER', 'ADMIN']"));
        assertEquals(true, eval("'b' in auth().tags"));
        assertEquals(false, eval("'c' in auth().tags"));
    }

    @Test
    void negationAndTruthiness() {
        assertEquals(false, eval("!auth()"));
        assertEquals(true, eval("!auth().missing"));
        assertTrue(ExpressionEvaluator.isTruthy("x"));
        assertFalse(ExpressionEvaluator.isTruthy(null));
    }

    @Test
    void absentPrincipalEvaluatesToNull() {
        Object result = evaluator.evaluate(parser.parse("auth() == null"), null);

        assertEquals(true, result);
    }

    @Test
    void databaseFunctionsCannotBeEvaluated() {
        assertThrows(InvalidPolicyExpressionException.class, () -> eval("contains(auth().role, 'A')"));
    }
}
