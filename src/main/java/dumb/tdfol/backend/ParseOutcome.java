package dumb.tdfol.backend;

import dumb.tdfol.Formula;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Result of parsing through an optional syntax bridge. Never thrown; absence of the bridge is {@link Status#UNSUPPORTED}.
 */
public record ParseOutcome(Status status, @Nullable Formula formula, String message) {

    public static ParseOutcome success(Formula f) {
        return new ParseOutcome(Status.SUCCESS, f, "");
    }

    public static ParseOutcome unsupported(String bridge) {
        return new ParseOutcome(Status.UNSUPPORTED, null, "Syntax bridge '" + bridge + "' is not available");
    }

    public static ParseOutcome error(String message) {
        return new ParseOutcome(Status.ERROR, null, message);
    }

    public Optional<Formula> result() {
        return Optional.ofNullable(formula);
    }

    public enum Status {SUCCESS, UNSUPPORTED, ERROR}
}
