package dumb.tdfol.expand;

import dumb.tdfol.Formula;

/**
 * Tableau expansion of one propositional connective under one sign.
 */
public interface ExpansionRule {
    String name();

    Formula.LogicOperator operator();

    /** Sign this rule applies to; the NOT rule serves both. */
    boolean negated();

    Expansion expand(SignedFormula f);
}
