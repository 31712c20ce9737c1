package dumb.tdfol.prove;

import dumb.tdfol.Formula;
import dumb.tdfol.tableau.ModalLogicType;

import java.util.function.Predicate;

/**
 * Structural queries that drive logic-type selection and cost estimates.
 */
public enum FormulaAnalysis {
    ;

    public static boolean hasDeontic(Formula f) {
        return any(f, g -> g instanceof Formula.DeonticFormula);
    }

    public static boolean hasTemporal(Formula f) {
        return any(f, FormulaAnalysis::isTemporal);
    }

    /** A temporal operator whose direct operand is itself temporal, as in ◊□P. */
    public static boolean hasNestedTemporal(Formula f) {
        return any(f, g -> isTemporal(g) && g.children().stream().anyMatch(FormulaAnalysis::isTemporal));
    }

    public static boolean hasQuantifier(Formula f) {
        return any(f, g -> g instanceof Formula.QuantifiedFormula);
    }

    public static boolean isTemporal(Formula f) {
        return f instanceof Formula.TemporalFormula || f instanceof Formula.BinaryTemporalFormula;
    }

    public static boolean any(Formula f, Predicate<Formula> test) {
        return f.subformulas().stream().anyMatch(test);
    }

    /**
     * Deontic operators anywhere select D; otherwise any temporal operator selects S4; plain formulas use K.
     */
    public static ModalLogicType selectLogicType(Formula f) {
        if (hasDeontic(f)) return ModalLogicType.D;
        if (hasTemporal(f)) return ModalLogicType.S4;
        return ModalLogicType.K;
    }

    /** Tableau cost: base 2.0, doubled for nested temporal operators, ×1.5 when deontic and temporal mix. */
    public static double tableauxCost(Formula f) {
        var cost = 2.0;
        if (hasNestedTemporal(f)) cost *= 2.0;
        if (hasDeontic(f) && hasTemporal(f)) cost *= 1.5;
        return cost;
    }
}
