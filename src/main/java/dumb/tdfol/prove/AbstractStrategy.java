package dumb.tdfol.prove;

import dumb.tdfol.*;
import dumb.tdfol.util.Log;

import java.util.List;

/**
 * Budget handling and knowledge-base lookup shared by the built-in strategies.
 */
abstract class AbstractStrategy implements ProofStrategy {

    private final String name;
    private final int priority;

    AbstractStrategy(String name, int priority) {
        this.name = name;
        this.priority = priority;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final int priority() {
        return priority;
    }

    @Override
    public final ProofResult prove(Formula goal, KnowledgeBase kb, long timeoutMs, int maxDepth) {
        var budget = Budget.of(timeoutMs, maxDepth);
        var snapshot = kb.snapshot();
        try {
            budget.check();
            if (snapshot.isAxiom(goal))
                return ProofResult.proved(goal, List.of(new ProofStep(goal, "Axiom in knowledge base", "Given")),
                        "axiom_lookup", budget.elapsedMillis());
            if (snapshot.isTheorem(goal))
                return ProofResult.proved(goal, List.of(new ProofStep(goal, "Theorem in knowledge base", "Given")),
                        "theorem_lookup", budget.elapsedMillis());
            return search(goal, snapshot, budget).withElapsed(budget.elapsedMillis());
        } catch (Budget.Exhausted e) {
            Log.debug(name + " ran out of budget on " + goal.toText());
            return ProofResult.timeout(goal, name, budget.elapsedMillis());
        } catch (UnsupportedConstructException e) {
            Log.debug(name + ": " + e.getMessage());
            return ProofResult.unknown(goal, name, budget.elapsedMillis(), e.getMessage());
        }
    }

    protected abstract ProofResult search(Formula goal, KnowledgeBase.Snapshot kb, Budget budget);

    static Formula complement(Formula f) {
        return f instanceof Formula.UnaryFormula u ? u.formula() : Formula.not(f);
    }

    @Override
    public String toString() {
        return name;
    }
}
