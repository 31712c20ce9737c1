package dumb.tdfol.tableau;

import dumb.tdfol.AbstractProverTest;
import dumb.tdfol.ProofStep;
import dumb.tdfol.UnsupportedConstructException;
import dumb.tdfol.prove.Budget;
import dumb.tdfol.tableau.TableauxBranch.Relation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModalTableauxTest extends AbstractProverTest {

    private static TableauxResult prove(ModalLogicType logic, String goal, String... assumptions) {
        var premises = java.util.Arrays.stream(assumptions).map(AbstractProverTest::parse).toList();
        return new ModalTableaux(logic).prove(parse(goal), premises, Budget.of(5000, 10));
    }

    @ParameterizedTest
    @ValueSource(strings = {"A -> A", "A | ~A", "~(A & ~A)", "(A -> B) -> (~B -> ~A)", "((A -> B) & (B -> C)) -> (A -> C)",
            "(A <-> B) -> (B <-> A)"})
    void propositionalTautologiesCloseInK(String goal) {
        var r = prove(ModalLogicType.K, goal);
        assertTrue(r.valid(), goal);
        assertTrue(r.complete());
        assertEquals(r.totalBranches(), r.closedBranches());
    }

    @Test
    void stepsStartAtRootAndEndWithClosures() {
        var r = prove(ModalLogicType.K, "A -> A");
        assertEquals("Root", r.steps().get(0).ruleName());
        assertEquals("Closure", r.steps().get(r.steps().size() - 1).ruleName());
    }

    @Test
    void reflexivitySeparatesTFromK() {
        assertTrue(prove(ModalLogicType.T, "[]A -> A").valid());
        var k = prove(ModalLogicType.K, "[]A -> A");
        assertFalse(k.valid());
        assertTrue(k.complete());
        assertTrue(k.countermodel().isPresent());
    }

    @Test
    void transitivitySeparatesS4FromK() {
        assertTrue(prove(ModalLogicType.S4, "[]A -> [][]A").valid());
        assertFalse(prove(ModalLogicType.K, "[]A -> [][]A").valid());
    }

    @Test
    void obligationImpliesPermissionInD() {
        assertTrue(prove(ModalLogicType.D, "O(A) -> P(A)").valid());
        assertTrue(prove(ModalLogicType.D, "O(A) -> ~O(~A)").valid());
        assertTrue(prove(ModalLogicType.D, "F(A) <-> O(~A)").valid());
    }

    @Test
    void serialityMakesBoxImplyDiamond() {
        assertTrue(prove(ModalLogicType.D, "[]A -> <>A").valid());
        assertFalse(prove(ModalLogicType.K, "[]A -> <>A").valid());
    }

    @Test
    void bareEventualityHasCountermodel() {
        var r = prove(ModalLogicType.S4, "<>A");
        assertFalse(r.valid());
        assertTrue(r.complete());
        var model = r.countermodel().orElseThrow();
        assertFalse(model.isClosed());
        assertTrue(model.worldCount() >= 1);
    }

    @Test
    void countermodelIsReadOffOpenBranch() {
        var r = prove(ModalLogicType.S4, "[]A");
        var model = Countermodel.of(ModalLogicType.S4, r.countermodel().orElseThrow());
        assertTrue(model.world(0).fails().contains(parse("[]A")));
        var witness = model.successors(0, Relation.TEMPORAL).stream().filter(v -> v != 0).findFirst().orElseThrow();
        assertTrue(model.world(witness).fails().contains(parse("A")));
        assertTrue(model.isReflexive(Relation.TEMPORAL));
        assertTrue(model.isTransitive(Relation.TEMPORAL));
        assertTrue(model.toText().startsWith("Countermodel in S4 with " + model.worlds().size() + " world(s)"));
        assertTrue(model.toDot().contains("w0 -> w" + witness + " [label=\"T\"]"), model.toDot());
    }

    @Test
    void deonticCountermodelIsSerial() {
        var r = prove(ModalLogicType.D, "O(A)", "P(A)");
        var model = Countermodel.of(ModalLogicType.D, r.countermodel().orElseThrow());
        assertFalse(model.successors(0, Relation.DEONTIC).isEmpty());
        assertFalse(model.isReflexive(Relation.DEONTIC));
        assertTrue(model.world(0).holds().contains(parse("P(A)")));
    }

    @Test
    void closedBranchHasNoModel() {
        var r = prove(ModalLogicType.K, "A -> A");
        assertTrue(r.countermodel().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> Countermodel.of(ModalLogicType.K, closedBranch()));
    }

    private static TableauxBranch closedBranch() {
        var b = new TableauxBranch(0);
        b.close(new ProofStep(parse("A"), "test", "Closure"));
        return b;
    }

    @Test
    void assumptionsHoldAtRootWorld() {
        assertTrue(prove(ModalLogicType.K, "Mortal(socrates)",
                "forall x. (Human(x) -> Mortal(x))", "Human(socrates)").valid());
        assertFalse(prove(ModalLogicType.K, "Mortal(plato)",
                "forall x. (Human(x) -> Mortal(x))", "Human(socrates)").valid());
    }

    @Test
    void quantifiers() {
        assertTrue(prove(ModalLogicType.K, "(forall x. Human(x)) -> Human(socrates)").valid());
        assertTrue(prove(ModalLogicType.K, "Human(socrates) -> exists x. Human(x)").valid());
        var r = prove(ModalLogicType.K, "(exists x. Human(x)) -> Human(socrates)");
        assertFalse(r.valid());
        assertTrue(r.complete());
    }

    @Test
    void untilUnfolds() {
        assertTrue(prove(ModalLogicType.S4, "(A U B) -> (A | B)").valid());
        assertTrue(prove(ModalLogicType.S4, "B -> (A U B)").valid());
    }

    @Test
    void weakUntilAndRelease() {
        assertTrue(prove(ModalLogicType.S4, "[]A -> (A W B)").valid());
        assertTrue(prove(ModalLogicType.S4, "(A R B) -> B").valid());
    }

    @Test
    void unfoldingBoundLeavesResultIncomplete() {
        var r = new ModalTableaux(ModalLogicType.S4).prove(parse("<>B"), List.of(parse("A U B")), Budget.of(5000, 3));
        assertFalse(r.valid());
        assertFalse(r.complete());
        assertTrue(r.countermodel().isEmpty());
    }

    @Test
    void worldLimitLeavesResultIncomplete() {
        var r = new ModalTableaux(ModalLogicType.K, 2000, 1).prove(parse("<>A -> A"), List.of(), Budget.of(5000, 10));
        assertFalse(r.valid());
        assertFalse(r.complete());
    }

    @Test
    void sinceIsUnsupported() {
        var e = assertThrows(UnsupportedConstructException.class,
                () -> prove(ModalLogicType.S4, "(A S B) -> B"));
        assertNotNull(e.construct());
    }

    @Test
    void expiredBudgetAborts() {
        assertThrows(Budget.Exhausted.class,
                () -> new ModalTableaux(ModalLogicType.K).prove(parse("A -> A"), List.of(), Budget.of(0, 10)));
    }
}
