package dumb.tdfol.expand;

import dumb.tdfol.AbstractProverTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static dumb.tdfol.expand.SignedFormula.neg;
import static dumb.tdfol.expand.SignedFormula.pos;
import static org.junit.jupiter.api.Assertions.*;

class ExpansionRulesTest extends AbstractProverTest {

    private static Expansion expand(SignedFormula f) {
        return ExpansionRules.expand(f).orElseThrow(() -> new AssertionError("No rule for " + f));
    }

    @Test
    void conjunctionStaysOnBranch() {
        var e = expand(pos(parse("A & B")));
        assertInstanceOf(Expansion.Linear.class, e);
        assertEquals(List.of(List.of(pos(parse("A")), pos(parse("B")))), e.branches());
    }

    @Test
    void negatedConjunctionForks() {
        var e = expand(neg(parse("A & B")));
        assertInstanceOf(Expansion.Branching.class, e);
        assertEquals(List.of(List.of(neg(parse("A"))), List.of(neg(parse("B")))), e.branches());
    }

    @Test
    void disjunction() {
        assertEquals(2, expand(pos(parse("A | B"))).branches().size());
        assertEquals(List.of(List.of(neg(parse("A")), neg(parse("B")))), expand(neg(parse("A | B"))).branches());
    }

    @Test
    void implication() {
        assertEquals(List.of(List.of(neg(parse("A"))), List.of(pos(parse("B")))),
                expand(pos(parse("A -> B"))).branches());
        assertEquals(List.of(List.of(pos(parse("A")), neg(parse("B")))),
                expand(neg(parse("A -> B"))).branches());
    }

    @Test
    void biconditional() {
        var a = parse("A");
        var b = parse("B");
        assertEquals(List.of(List.of(pos(a), pos(b)), List.of(neg(a), neg(b))),
                expand(pos(parse("A <-> B"))).branches());
        assertEquals(List.of(List.of(pos(a), neg(b)), List.of(neg(a), pos(b))),
                expand(neg(parse("A <-> B"))).branches());
    }

    @Test
    void negationFlipsSign() {
        assertEquals(List.of(List.of(neg(parse("A")))), expand(pos(parse("~A"))).branches());
        assertEquals(List.of(List.of(pos(parse("A")))), expand(neg(parse("~A"))).branches());
    }

    @ParameterizedTest
    @ValueSource(strings = {"A", "Human(socrates)", "[]A", "<>A", "O(A)", "X(A)", "A U B", "forall x. Human(x)"})
    void nonPropositionalFormulasHaveNoRule(String text) {
        assertTrue(ExpansionRules.select(pos(parse(text))).isEmpty());
        assertTrue(ExpansionRules.select(neg(parse(text))).isEmpty());
    }

    @Test
    void ruleMetadata() {
        var r = ExpansionRules.select(neg(parse("A -> B"))).orElseThrow();
        assertEquals("ImpliesNegative", r.name());
        assertTrue(r.negated());
    }

    @Test
    void linearExpansionRejectsEmptyList() {
        assertThrows(IllegalArgumentException.class, () -> new Expansion.Linear(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Expansion.Branching(List.of(List.of(pos(parse("A"))))));
    }
}
