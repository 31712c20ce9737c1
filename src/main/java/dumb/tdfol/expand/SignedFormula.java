package dumb.tdfol.expand;

import dumb.tdfol.Formula;

import static java.util.Objects.requireNonNull;

/**
 * A tableau obligation: {@code formula} must hold ({@code negated == false}) or must fail.
 */
public record SignedFormula(Formula formula, boolean negated) {

    public SignedFormula {
        requireNonNull(formula);
    }

    public static SignedFormula pos(Formula f) {
        return new SignedFormula(f, false);
    }

    public static SignedFormula neg(Formula f) {
        return new SignedFormula(f, true);
    }

    public SignedFormula flip() {
        return new SignedFormula(formula, !negated);
    }

    @Override
    public String toString() {
        return (negated ? "F: " : "T: ") + formula.toText();
    }
}
