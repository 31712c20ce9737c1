package dumb.tdfol.convert;

import dumb.tdfol.AbstractProverTest;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FormulaConvertersTest extends AbstractProverTest {

    @Test
    void firstOrderProjection() {
        assertEquals(parse("forall x. (Human(x) -> Mortal(x))"),
                FormulaConverters.toFol(parse("forall x. O(Human(x) -> []Mortal(x))")));
        assertEquals(parse("A & B"), FormulaConverters.toFol(parse("A U B")));
        assertEquals(parse("~A"), FormulaConverters.toFol(parse("~X(A)")));
    }

    @Test
    void tptp() {
        assertEquals("fof(ax1, axiom, ![X] : (human(X) => mortal(X))).",
                FormulaConverters.toTptp(parse("forall x. (Human(x) -> Mortal(x))"), "Ax1", "axiom"));
        assertEquals("fof(goal, conjecture, ~(human(socrates))).",
                FormulaConverters.toTptp(parse("~Human(socrates)"), "goal", "conjecture"));
        assertEquals("fof(e, axiom, ?[Y] : loves(Y,john)).",
                FormulaConverters.toTptp(parse("exists y. Loves(y, john)"), "e", "axiom"));
        assertEquals("fof(t, axiom, ((a | b) <=> c)).",
                FormulaConverters.toTptp(parse("(A | B) <-> []C"), "t", "axiom"));
    }

    @Test
    void prolog() {
        assertEquals(Optional.of("human(socrates)."), FormulaConverters.toProlog(parse("Human(socrates)")));
        assertEquals(Optional.of("human(X)."), FormulaConverters.toProlog(parse("forall x. Human(x)")));
        assertEquals(Optional.of("mortal(X) :- human(X), greek(X)."),
                FormulaConverters.toProlog(parse("forall x. ((Human(x) & Greek(x)) -> Mortal(x))")));
        assertTrue(FormulaConverters.toProlog(parse("A | B")).isEmpty());
        assertTrue(FormulaConverters.toProlog(parse("(A | B) -> C")).isEmpty());
        assertTrue(FormulaConverters.toProlog(parse("O(A)")).isEmpty());
    }

    @Test
    void identifiers() {
        assertEquals("ax_1", FormulaConverters.lowerWord("Ax-1"));
        assertEquals("'1abc'", FormulaConverters.lowerWord("1abc"));
        assertEquals("X", FormulaConverters.upperWord("x"));
        assertEquals("V_a", FormulaConverters.upperWord("_a"));
    }

    @Test
    void json() {
        var j = FormulaConverters.toJson(parse("Human(socrates)"));
        assertEquals("predicate", j.getString("type"));
        assertEquals("Human", j.getString("name"));
        assertEquals(1, j.getJSONArray("args").length());
    }
}
