package dumb.tdfol.prove;

import dumb.tdfol.Formula;
import dumb.tdfol.KnowledgeBase;
import dumb.tdfol.ProofResult;

import java.util.List;

/**
 * Combines several strategies into one verdict. {@link Prover} falls back to a built-in consensus when no
 * coordinator is registered.
 */
@FunctionalInterface
public interface HybridCoordinator {

    ProofResult coordinate(Formula goal, KnowledgeBase kb, List<ProofStrategy> strategies, long timeoutMs, int maxDepth);
}
