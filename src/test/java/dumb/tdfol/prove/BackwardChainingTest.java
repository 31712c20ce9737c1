package dumb.tdfol.prove;

import dumb.tdfol.AbstractProverTest;
import dumb.tdfol.ProofResult;
import dumb.tdfol.ProofStatus;
import dumb.tdfol.ProofStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackwardChainingTest extends AbstractProverTest {

    private final BackwardChainingStrategy backward = new BackwardChainingStrategy();

    private ProofResult run(String goal) {
        return backward.prove(parse(goal), kb, 5000, 10);
    }

    private static List<String> rules(ProofResult r) {
        return r.proofSteps().stream().map(ProofStep::ruleName).toList();
    }

    @Test
    void universalRule() {
        axioms("forall x. (Human(x) -> Mortal(x))", "Human(socrates)");
        var r = run("Mortal(socrates)");
        assertEquals(ProofStatus.PROVED, r.status());
        assertEquals(BackwardChainingStrategy.NAME, r.method());
        assertEquals(List.of("UniversalInstantiation", "ModusPonens"), rules(r));
    }

    @Test
    void implicationChain() {
        axioms("A -> B", "B -> C", "A");
        var r = run("C");
        assertTrue(r.isProved());
        assertEquals(List.of("ModusPonens", "ModusPonens"), rules(r));
    }

    @Test
    void connectives() {
        axioms("A", "B", "C | D", "~C", "E -> H", "~H");
        assertTrue(run("A & B").isProved());
        assertTrue(run("Z | B").isProved());
        assertTrue(run("D").isProved());
        assertTrue(run("~E").isProved());
        assertTrue(run("~~A").isProved());
    }

    @Test
    void complementDisproves() {
        axioms("A -> B", "~B");
        var r = run("A");
        assertEquals(ProofStatus.DISPROVED, r.status());
        assertEquals("ModusTollens", rules(r).get(rules(r).size() - 1));
    }

    @Test
    void cyclicImplicationsTerminate() {
        axioms("A -> B", "B -> A");
        var r = run("A");
        assertEquals(ProofStatus.UNKNOWN, r.status());
        assertEquals("No backward derivation found", r.message());
    }

    @Test
    void failureInsideCycleIsRetriedFromOtherBranch() {
        // B first fails while A is still open, then holds once K establishes A
        axioms("B -> A", "K -> A", "A -> B", "B -> C", "K");
        var r = run("A & C");
        assertEquals(ProofStatus.PROVED, r.status(), r.message());
        assertEquals(List.of("ModusPonens", "ModusPonens", "ModusPonens", "ConjunctionIntroduction"), rules(r));
    }

    @Test
    void depthLimitIsReported() {
        axioms("A -> B", "B -> C", "C -> D", "A");
        var r = backward.prove(parse("D"), kb, 5000, 1);
        assertEquals(ProofStatus.UNKNOWN, r.status());
        assertEquals("Depth limit 1 reached", r.message());
    }

    @Test
    void modalDistribution() {
        axioms("[](A -> B)", "[]A", "O(C -> D)", "O(C)");
        var t = run("[]B");
        assertTrue(t.isProved());
        assertEquals("TemporalKAxiom", rules(t).get(rules(t).size() - 1));
        var o = run("O(D)");
        assertTrue(o.isProved());
        assertEquals("DeonticKAxiom", rules(o).get(rules(o).size() - 1));
    }

    @Test
    void contraryToDutyObligation() {
        axioms("O(A)", "~A", "~A -> O(B)");
        assertTrue(run("O(B)").isProved());
    }

    @Test
    void unaryRuleOnKnowledge() {
        axioms("O(A)");
        var r = run("P(A)");
        assertTrue(r.isProved());
        assertEquals(List.of("DeonticDAxiom"), rules(r));
    }
}
