package dumb.tdfol.prove;

import dumb.tdfol.AbstractProverTest;
import dumb.tdfol.KnowledgeBase;
import dumb.tdfol.ProofResult;
import dumb.tdfol.ProofStatus;
import dumb.tdfol.ProofStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ForwardChainingTest extends AbstractProverTest {

    private final ForwardChainingStrategy forward = new ForwardChainingStrategy();

    private ProofResult run(String goal) {
        return run(goal, 10);
    }

    private ProofResult run(String goal, int maxDepth) {
        return forward.prove(parse(goal), kb, 5000, maxDepth);
    }

    @Test
    void instantiatesThenDetaches() {
        axioms("forall x. (Human(x) -> Mortal(x))", "Human(socrates)");
        var r = run("Mortal(socrates)");
        assertEquals(ProofStatus.PROVED, r.status());
        assertEquals(ForwardChainingStrategy.NAME, r.method());
        assertEquals(List.of("UniversalInstantiation", "ModusPonens"),
                r.proofSteps().stream().map(ProofStep::ruleName).toList());
        assertEquals(parse("Mortal(socrates)"), r.proofSteps().get(1).formula());
    }

    @Test
    void goalInKnowledgeBaseIsLookedUp() {
        axioms("Human(socrates)");
        var r = run("Human(socrates)");
        assertTrue(r.isProved());
        assertEquals("axiom_lookup", r.method());
        assertEquals(1, r.proofSteps().size());
    }

    @Test
    void derivedNegationDisproves() {
        axioms("A -> B", "~B");
        var r = run("A");
        assertEquals(ProofStatus.DISPROVED, r.status());
        assertEquals("Negation of the goal derived", r.message());
        assertEquals("ModusTollens", r.proofSteps().get(r.proofSteps().size() - 1).ruleName());
    }

    @Test
    void fixpointWithoutGoalIsUnknown() {
        axioms("A");
        var r = run("B");
        assertEquals(ProofStatus.UNKNOWN, r.status());
        assertTrue(r.message().startsWith("Fixpoint"), r.message());
    }

    @Test
    void contradictionDoesNotProveEverything() {
        axioms("A", "~A");
        var r = run("B");
        assertEquals(ProofStatus.UNKNOWN, r.status());
        assertTrue(r.message().contains("inconsistent knowledge base"), r.message());
    }

    @Test
    void introductionsAreGoalDirected() {
        axioms("A", "B");
        assertTrue(run("A & B").isProved());
        assertTrue(run("A | C").isProved());
    }

    @Test
    void existentialGeneralization() {
        axioms("Human(socrates)");
        var r = run("exists x. Human(x)");
        assertTrue(r.isProved());
        assertEquals("ExistentialGeneralization", r.proofSteps().get(0).ruleName());
    }

    @Test
    void modalRules() {
        axioms("[](A -> B)", "[]A", "O(C)");
        assertTrue(run("[]B").isProved());
        assertTrue(run("P(C)").isProved());
    }

    @Test
    void necessitationOnlyFromTheorems() {
        kb.addTheorem(parse("A"));
        var r = run("[]A");
        assertTrue(r.isProved());
        assertEquals("AlwaysNecessitation", r.proofSteps().get(0).ruleName());

        kb = new KnowledgeBase();
        axioms("A");
        assertEquals(ProofStatus.UNKNOWN, run("[]A").status());
    }

    @Test
    void depthLimit() {
        axioms("forall x. (Human(x) -> Mortal(x))", "Human(socrates)");
        var r = run("Mortal(socrates)", 1);
        assertEquals(ProofStatus.UNKNOWN, r.status());
        assertEquals("Depth limit 1 reached", r.message());
    }

    @Test
    void knowledgeBaseIsNotMutated() {
        axioms("forall x. (Human(x) -> Mortal(x))", "Human(socrates)");
        run("Mortal(socrates)");
        assertEquals(2, kb.size());
        assertFalse(kb.isAxiom(parse("Mortal(socrates)")));
    }

    @Test
    void zeroTimeoutIsTimeout() {
        axioms("A");
        var r = forward.prove(parse("B"), kb, 0, 10);
        assertEquals(ProofStatus.TIMEOUT, r.status());
    }

    @Test
    void requiresKnowledge() {
        assertFalse(forward.canHandle(parse("A"), kb));
        axioms("A");
        assertTrue(forward.canHandle(parse("A"), kb));
        assertTrue(forward.estimateCost(parse("[]A"), kb) > forward.estimateCost(parse("A"), kb));
    }
}
