package dumb.regcheck;

import dumb.regcheck.TypeError.ArityMismatch;
import dumb.regcheck.TypeError.InvalidArgumentType;
import dumb.regcheck.TypeError.InvalidQuantifierBinding;
import dumb.regcheck.TypeError.InvalidTemporalBound;
import dumb.regcheck.TypeError.TypeMismatch;
import dumb.regcheck.TypeError.UnboundVariable;
import dumb.regcheck.TypeError.UnknownConst;
import dumb.regcheck.TypeError.UnknownFunction;
import dumb.regcheck.TypeError.UnknownPredicate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypeCheckerTests extends AbstractTest {

    private static List<TypeError> check(String src) {
        return TypeChecker.check(formula(src), ENV);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "true",
            "coveredEntity(@hospital) and disclose(@hospital, @bob, @phi)",
            "forall x. Person(x) -> trained(x)",
            "forall x. exists y. hasConsent(x, y) or not P(y)",
            "exists x. forall x. P(x)",
            "forall x. age(x) >= 18 -> trained(x)",
            "age(@alice) < age(@bob)",
            "forall x. age(x) = @adult",
            "eventually[0,0] raining until[2,7] always P(@bob)",
            "@[\"§1 - cite\"] forall x. P(x)"
    })
    void wellTyped(String src) {
        assertEquals(List.of(), check(src), src);
    }

    @Test
    void invalidTemporalBound() {
        var errors = check("eventually[5,2] P(x)");
        assertEquals(List.of(new InvalidTemporalBound("bounds must be: 0 <= l <= u, got [5,2]")), errors);
        assertEquals("Invalid temporal bound: bounds must be: 0 <= l <= u, got [5,2]", errors.get(0).message());
        assertInstanceOf(InvalidTemporalBound.class, check("P(@bob) since[3,1] P(@alice)").get(0));
    }

    @Test
    void unboundVariable() {
        assertEquals(List.of(new UnboundVariable("x")), check("P(x)"));
        assertEquals(List.of(new UnboundVariable("y")), check("forall x. hasConsent(x, y)"));
    }

    @Test
    void quantifierScopeEndsWithItsBody() {
        assertEquals(List.of(new UnboundVariable("x")), check("(forall x. P(x)) and Q(x)"));
    }

    @Test
    void unknownSymbols() {
        assertEquals(List.of(new UnknownPredicate("audited")), check("audited(@bob)"));
        assertEquals(List.of(new UnknownFunction("height")), check("P(height(@bob))"));
        assertEquals(List.of(new UnknownConst("carol")), check("P(@carol)"));
        assertEquals(List.of(new UnknownConst("free text")), check("P(\"free text\")"));
    }

    @Test
    void arityMismatch() {
        var errors = check("hasConsent(@bob)");
        assertEquals(List.of(new ArityMismatch("hasConsent", 2, 1)), errors);
        assertEquals("hasConsent expects 2 arguments, got 1", errors.get(0).message());
        assertEquals(List.of(new ArityMismatch("age", 1, 2)), check("age(@bob, @alice) > 3"));
    }

    @Test
    void argumentTypes() {
        assertEquals(List.of(new InvalidArgumentType(0, Type.ENTITY, Type.INT)), check("P(age(@bob))"));
        assertEquals(List.of(new InvalidArgumentType(1, Type.ENTITY, Type.INT)), check("hasConsent(@bob, 3)"));
    }

    @Test
    void comparisonSidesMustAgree() {
        assertEquals(List.of(new TypeMismatch(Type.INT, Type.STRING)), check("age(@bob) = name(@bob)"));
        assertEquals(List.of(new TypeMismatch(Type.ENTITY, Type.INT)), check("@bob < 3"));
    }

    @Test
    void duplicateQuantifiedVariable() {
        var errors = check("forall x, x. P(x)");
        assertEquals(1, errors.size());
        assertInstanceOf(InvalidQuantifierBinding.class, errors.get(0));
    }

    @Test
    void singleFormulaStopsAtFirstError() {
        assertEquals(List.of(new UnknownPredicate("a")), check("a(@bob) and b(@bob)"));
    }

    @Test
    void policyFileCollectsEveryFailingFormula() {
        var pf = policyFile("""
                policy starts
                  P(@bob);
                  audited(@bob);
                  forall x. trained(x);
                  eventually[4,1] P(y)
                policy ends
                """);
        var failures = TypeChecker.checkPolicyFile(pf, ENV);
        assertEquals(List.of(1, 3), failures.stream().map(TypeChecker.FormulaErrors::index).toList());
        assertEquals(List.of(new UnknownPredicate("audited")), failures.get(0).errors());
        assertInstanceOf(InvalidTemporalBound.class, failures.get(1).errors().get(0));
        assertEquals(pf.policies().get(3), failures.get(1).formula());
    }

    @Test
    void policyFileWithoutErrors() {
        assertTrue(TypeChecker.checkPolicyFile(policyFile("policy starts P(@bob); Q(@alice) policy ends"), ENV).isEmpty());
    }

    @Test
    void emptyEnvironmentKnowsOnlyLiteralsAndComparisons() {
        assertEquals(List.of(), TypeChecker.check(formula("1 < 2 and true"), TypeEnvironment.EMPTY));
        assertEquals(List.of(new UnknownPredicate("P")), TypeChecker.check(formula("P(@bob)"), TypeEnvironment.EMPTY));
    }
}
