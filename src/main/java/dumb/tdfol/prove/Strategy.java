package dumb.tdfol.prove;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Strategy selection for {@link Prover}.
 */
public enum Strategy {
    AUTO, FORWARD, BACKWARD, MODAL_TABLEAUX, HYBRID;

    /** Accepts enum names and strategy names, case-insensitively: {@code forward}, {@code forward_chaining}, {@code modal-tableaux}. */
    @JsonCreator
    public static Strategy parse(String name) {
        var n = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (n) {
            case "FORWARD_CHAINING" -> FORWARD;
            case "BACKWARD_CHAINING" -> BACKWARD;
            case "TABLEAUX", "TABLEAU", "MODAL_TABLEAU" -> MODAL_TABLEAUX;
            default -> Strategy.valueOf(n);
        };
    }
}
