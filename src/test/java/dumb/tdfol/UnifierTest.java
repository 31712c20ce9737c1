package dumb.tdfol;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class UnifierTest extends AbstractProverTest {

    @Test
    void matchBindsPatternVariables() {
        var m = Unifier.match(parse("Loves(?x, ?y)"), parse("Loves(john, mary)"), Set.of("x", "y"), Map.of());
        assertNotNull(m);
        assertEquals(Term.constant("john"), m.get("x"));
        assertEquals(Term.constant("mary"), m.get("y"));
    }

    @Test
    void matchIsConsistent() {
        assertNull(Unifier.match(parse("Loves(?x, ?x)"), parse("Loves(john, mary)"), Set.of("x"), Map.of()));
        assertNotNull(Unifier.match(parse("Loves(?x, ?x)"), parse("Loves(john, john)"), Set.of("x"), Map.of()));
    }

    @Test
    void matchDescendsThroughConnectives() {
        var m = Unifier.match(parse("O(Human(?x) -> Mortal(?x))"), parse("O(Human(bob) -> Mortal(bob))"), Set.of("x"), Map.of());
        assertNotNull(m);
        assertEquals(Term.constant("bob"), m.get("x"));
        assertNull(Unifier.match(parse("O(Human(?x))"), parse("P(Human(bob))"), Set.of("x"), Map.of()));
    }

    @Test
    void unboundVariablesActAsConstants() {
        assertNull(Unifier.match(parse("Human(?x)"), parse("Human(bob)"), Set.of(), Map.of()));
    }

    @Test
    void unifyWithOccursCheck() {
        var x = Term.var("x");
        var fx = Term.fn("f", x);
        assertNull(Unifier.unify(x, fx, Set.of("x"), Map.of()));
        var m = Unifier.unify(Term.fn("f", x), Term.fn("f", Term.constant("a")), Set.of("x"), Map.of());
        assertNotNull(m);
        assertEquals(Term.constant("a"), Unifier.subst(x, m));
    }

    @Test
    void substitution() {
        var f = Unifier.subst(parse("Loves(?x, ?y)"), Map.of("x", Term.constant("john"), "y", Term.constant("mary")));
        assertEquals(parse("Loves(john, mary)"), f);
    }
}
