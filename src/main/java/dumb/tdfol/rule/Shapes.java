package dumb.tdfol.rule;

import dumb.tdfol.Formula;
import dumb.tdfol.Formula.DeonticOperator;
import dumb.tdfol.Formula.LogicOperator;
import dumb.tdfol.Formula.TemporalOperator;

/**
 * Structural tests used by rule shape checks.
 */
final class Shapes {

    private Shapes() {
    }

    static boolean is(Formula f, LogicOperator op) {
        if (op == LogicOperator.NOT) return f instanceof Formula.UnaryFormula;
        return f instanceof Formula.BinaryFormula b && b.operator() == op;
    }

    static boolean is(Formula f, TemporalOperator op) {
        return (f instanceof Formula.TemporalFormula t && t.operator() == op)
                || (f instanceof Formula.BinaryTemporalFormula bt && bt.operator() == op);
    }

    static boolean is(Formula f, DeonticOperator op) {
        return f instanceof Formula.DeonticFormula d && d.operator() == op;
    }

    /** Operand of a one-place connective. */
    static Formula inner(Formula f) {
        return f.children().get(0);
    }

    static Formula left(Formula f) {
        return f.children().get(0);
    }

    static Formula right(Formula f) {
        return f.children().get(1);
    }

    static boolean isNegationOf(Formula negated, Formula f) {
        return is(negated, LogicOperator.NOT) && inner(negated).equals(f);
    }
}
