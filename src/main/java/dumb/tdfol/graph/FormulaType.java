package dumb.tdfol.graph;

/** Role of a formula in a dependency graph. */
public enum FormulaType {
    AXIOM, THEOREM, DERIVED, PREMISE, GOAL, LEMMA;

    /** Roles that count as a use of the formulas they depend on. */
    public boolean conclusion() {
        return this == DERIVED || this == THEOREM || this == GOAL || this == LEMMA;
    }
}
