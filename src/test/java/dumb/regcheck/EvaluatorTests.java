package dumb.regcheck;

import dumb.regcheck.Facts.Fact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EvaluatorTests extends AbstractTest {

    private static final Domain DOMAIN = Domain.of("hospital", "alice", "bob", "phi");

    private static final Facts FACTS = Facts.of(
            Fact.of("coveredEntity", "hospital"),
            Fact.of("disclose", "hospital", "bob", "phi"),
            Fact.of("Person", "alice"),
            Fact.of("Person", "bob"),
            Fact.of("trained", "alice"),
            Fact.of("raining"));

    private static final FunctionTable FUNCTIONS = FunctionTable.EMPTY
            .with("age", List.of("alice"), "30")
            .with("age", List.of("bob"), "25")
            .with("name", List.of("bob"), "Bob");

    private final Evaluator evaluator = new Evaluator(DOMAIN, FACTS, FUNCTIONS);

    private boolean eval(String src) {
        return evaluator.eval(formula(src));
    }

    @Test
    void groundConjunctionOfFacts() {
        assertTrue(eval("coveredEntity(@hospital) and disclose(@hospital, @bob, @phi)"));
    }

    @Test
    void universalFailsOnAnUntrainedPerson() {
        var onlyPeople = new Evaluator(Domain.of("alice", "bob"), FACTS, FUNCTIONS);
        assertFalse(onlyPeople.eval(formula("forall x. Person(x) implies trained(x)")));
        assertTrue(new Evaluator(Domain.of("alice"), FACTS, FUNCTIONS).eval(formula("forall x. Person(x) -> trained(x)")));
    }

    @Test
    void orderingOverFunctionValues() {
        assertFalse(eval("age(@alice) < age(@bob)"));
        assertTrue(eval("age(@alice) > age(@bob)"));
        assertTrue(eval("age(@bob) >= 25 and age(@bob) <= 25"));
    }

    @ParameterizedTest
    @CsvSource({
            "'a', '=', 'a', true",
            "'a', '!=', 'a', false",
            "'07', '=', '7', false",
            "'07', '<=', '7', true",
            "'-3', '<', '2', true",
            "'x', '<', '2', false",
            "'x', '>=', 'x', false",
            "'10', '>', '9', true"
    })
    void comparisonSemantics(String a, String op, String b, boolean expected) {
        assertEquals(expected, Evaluator.compare(op, a, b));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "disclose(@hospital, @alice, @phi)",
            "P(@bob)",
            "age(@carol) = age(@carol)",
            "age(@carol) != 3",
            "coveredEntity(x)",
            "trained(name(@alice))"
    })
    void closedWorld(String src) {
        assertFalse(eval(src), src);
    }

    @Test
    void functionValuesFeedPredicates() {
        var facts = FACTS.with(Fact.of("trained", "Bob"));
        assertTrue(new Evaluator(DOMAIN, facts, FUNCTIONS).eval(formula("trained(name(@bob))")));
    }

    @Test
    void connectives() {
        assertTrue(eval("not P(@bob)"));
        assertTrue(eval("P(@bob) or raining"));
        assertTrue(eval("P(@bob) -> P(@alice)"));
        assertFalse(eval("raining -> P(@alice)"));
        assertTrue(eval("P(@bob) <-> P(@alice)"));
        assertTrue(eval("raining xor P(@bob)"));
        assertFalse(eval("raining xor trained(@alice)"));
        assertTrue(eval("true and not false"));
    }

    @Test
    void temporalOperatorsAreStructural() {
        assertTrue(eval("raining until[0,3] trained(@alice)"));
        assertFalse(eval("raining since P(@bob)"));
        assertTrue(eval("always[0,9] raining"));
        assertFalse(eval("eventually P(@bob)"));
        assertEquals(eval("trained(@alice)"), eval("yesterday once historically next trained(@alice)"));
    }

    @Test
    void quantifierDuality() {
        for (var body : List.of("trained(x)", "Person(x) -> trained(x)", "exists y. disclose(y, x, @phi)", "raining")) {
            assertEquals(eval("forall x. " + body), eval("not exists x. not (" + body + ")"), body);
            assertEquals(eval("exists x. " + body), eval("not forall x. not (" + body + ")"), body);
        }
    }

    @Test
    void multipleVariables() {
        assertTrue(eval("exists e, p, d. disclose(e, p, d)"));
        assertFalse(eval("forall e, p. Person(p) -> disclose(e, p, @phi)"));
        assertTrue(eval("exists x, y. Person(x) and Person(y) and x != y"));
    }

    @Test
    void innerQuantifierShadowsOuter() {
        assertTrue(eval("exists x. coveredEntity(x) and exists x. Person(x)"));
        assertTrue(evaluator.eval(Map.of("x", "hospital"), formula("coveredEntity(x) and exists x. trained(x)")));
    }

    @Test
    void emptyDomain() {
        var empty = new Evaluator(Domain.EMPTY, FACTS, FUNCTIONS);
        assertTrue(empty.eval(formula("forall x. P(x)")));
        assertFalse(empty.eval(formula("exists x. true")));
    }

    @Test
    void terms() {
        assertEquals("30", evaluator.term(Map.of(), Term.func("age", at("alice"))));
        assertEquals("alice", evaluator.term(Map.of("x", "alice"), x()));
        assertNull(evaluator.term(Map.of(), x()));
        assertNull(evaluator.term(Map.of(), Term.func("age", x())));
    }

    @Test
    void policyResultsAreLabelled() {
        var results = evaluator.evalPolicy(List.of(formula("raining"), formula("P(@bob)")));
        assertEquals(List.of(new Evaluator.Result("Formula 1", true), new Evaluator.Result("Formula 2", false)), results);
        assertEquals("Formula 2: ✗ False", results.get(1).toString());
    }

    @Test
    void annotationsAreTransparent() {
        assertTrue(eval("@[\"§1 - rule\"] coveredEntity(@hospital)"));
    }
}
