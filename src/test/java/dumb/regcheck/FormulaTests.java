package dumb.regcheck;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static dumb.regcheck.Term.func;
import static dumb.regcheck.Term.var;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FormulaTests extends AbstractTest {

    @Test
    void predicatesInOrderOfFirstOccurrence() {
        var f = formula("forall x. Q(x) -> (P(x) until Q(@bob)) and not always raining");
        assertEquals(List.of("Q", "P", "raining"), List.copyOf(f.predicates()));
        assertEquals(Set.of(), formula("true or false").predicates());
    }

    @Test
    void termText() {
        assertEquals("x", var("x").toText());
        assertEquals("@bob", at("bob").toText());
        assertEquals("42", at("42").toText());
        assertEquals("\"two words\"", at("two words").toText());
        assertEquals("\"say \\\"hi\\\"\"", at("say \"hi\"").toText());
        assertEquals("f(x, @a, 3)", func("f", x(), at("a"), at("3")).toText());
        assertEquals(Set.of("x", "y"), func("f", x(), func("g", var("y"), at("c"))).vars());
    }

    @Test
    void formulaText() {
        assertEquals("∀x. P(x) → Q(x)", formula("forall x. P(x) implies Q(x)").toText());
        assertEquals("¬(age(x) >= 18)", formula("not age(x) >= 18").toText());
        assertEquals("(a ∨ b) ∧ c", formula("(a or b) and c").toText());
        assertEquals("always[0,5] (eventually P(@bob))", formula("□[0,5] ◇ P(@bob)").toText());
        assertEquals("P(x) until[1,2] Q(x)", formula("P(x) until[1,2] Q(x)").toText());
        assertEquals("@[\"§1 - cite\"] ⊤", formula("@[\"§1 - cite\"] true").toText());
    }

    @Test
    void citationParts() {
        var a = new Formula.Annotated(new Formula.True(), "  §164.502(b)  ");
        assertEquals("§164.502(b)", a.section());
        assertEquals("No description", a.description());
    }

    @Test
    void quantifierNeedsVariables() {
        assertThrows(IllegalArgumentException.class, () -> Formula.forall(List.of(), new Formula.True()));
    }

    @Test
    void boundWellFormedness() {
        assertEquals(true, new Formula.Bound(0, 0).wellFormed());
        assertEquals(true, new Formula.Bound(2, 9).wellFormed());
        assertEquals(false, new Formula.Bound(5, 2).wellFormed());
        assertEquals(false, new Formula.Bound(-1, 2).wellFormed());
    }

    @Test
    void domainKeepsFirstOccurrence() {
        var d = Domain.of("b", "a", "b");
        assertEquals(List.of("b", "a"), d.entities());
        assertEquals(List.of("b", "a", "c"), d.with("c").with("a").entities());
    }

    @Test
    void typeNames() {
        assertEquals(Type.INT, Type.parse("Int"));
        assertEquals(Type.ENTITY, Type.parse("PHI"));
        assertEquals(Type.BOOL, Type.parse(" Bool "));
    }
}
