package dumb.tdfol.prove;

import dumb.tdfol.Formula;
import dumb.tdfol.KnowledgeBase;
import dumb.tdfol.ProofResult;

/**
 * A proof-search procedure. Implementations never mutate the knowledge base and report an exhausted
 * budget as a TIMEOUT result rather than an exception.
 */
public interface ProofStrategy {

    String name();

    /** Tie-breaker among strategies of equal cost; higher wins. */
    int priority();

    boolean canHandle(Formula goal, KnowledgeBase kb);

    /** Relative cost; lower is tried first. */
    double estimateCost(Formula goal, KnowledgeBase kb);

    ProofResult prove(Formula goal, KnowledgeBase kb, long timeoutMs, int maxDepth);
}
