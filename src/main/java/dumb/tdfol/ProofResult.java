package dumb.tdfol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.tdfol.tableau.Countermodel;
import dumb.tdfol.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of one proof call. A tableau search that saturates an open branch also carries the countermodel it
 * found.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProofResult(ProofStatus status, @JsonIgnore Formula formula, List<ProofStep> proofSteps,
                          String method, long elapsedMillis, boolean fromCache, @Nullable String message,
                          @Nullable Countermodel countermodel) {

    public ProofResult {
        requireNonNull(status);
        requireNonNull(formula);
        requireNonNull(method);
        proofSteps = List.copyOf(proofSteps);
    }

    public ProofResult(ProofStatus status, Formula formula, List<ProofStep> proofSteps,
                       String method, long elapsedMillis, boolean fromCache, @Nullable String message) {
        this(status, formula, proofSteps, method, elapsedMillis, fromCache, message, null);
    }

    public static ProofResult proved(Formula goal, List<ProofStep> steps, String method, long elapsedMillis) {
        return new ProofResult(ProofStatus.PROVED, goal, steps, method, elapsedMillis, false, null);
    }

    public static ProofResult unknown(Formula goal, String method, long elapsedMillis, @Nullable String message) {
        return new ProofResult(ProofStatus.UNKNOWN, goal, List.of(), method, elapsedMillis, false, message);
    }

    public static ProofResult timeout(Formula goal, String method, long elapsedMillis) {
        return new ProofResult(ProofStatus.TIMEOUT, goal, List.of(), method, elapsedMillis, false, "Budget exhausted");
    }

    @JsonIgnore
    public boolean isProved() {
        return status == ProofStatus.PROVED;
    }

    @JsonProperty("formula")
    public String formulaText() {
        return formula.toText();
    }

    public ProofResult withFromCache(boolean cached) {
        return cached == fromCache ? this : new ProofResult(status, formula, proofSteps, method, elapsedMillis, cached, message, countermodel);
    }

    public ProofResult withMessage(@Nullable String msg) {
        return new ProofResult(status, formula, proofSteps, method, elapsedMillis, fromCache, msg, countermodel);
    }

    public ProofResult withElapsed(long millis) {
        return new ProofResult(status, formula, proofSteps, method, millis, fromCache, message, countermodel);
    }

    public ProofResult withCountermodel(@Nullable Countermodel model) {
        return new ProofResult(status, formula, proofSteps, method, elapsedMillis, fromCache, message, model);
    }

    public JsonNode toJson() {
        return Json.tree(this);
    }
}
