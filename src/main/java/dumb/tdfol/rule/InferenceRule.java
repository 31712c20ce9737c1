package dumb.tdfol.rule;

import dumb.tdfol.Formula;

/**
 * A sound inference rule over formulas.
 * <p>
 * {@link #canApply} is a cheap structural check without side effects. {@link #apply} derives the conclusion
 * and throws {@link RuleApplicationException} when {@code canApply} would have returned false.
 */
public interface InferenceRule {

    String name();

    String description();

    /** Number of premises {@link #apply} expects. */
    int arity();

    Category category();

    /** Rules that are only valid for theorems, never for contingent axioms. */
    default boolean necessitation() {
        return false;
    }

    boolean canApply(Formula... premises);

    Formula apply(Formula... premises);

    enum Category {BASIC, TEMPORAL, DEONTIC, COMBINED}
}
