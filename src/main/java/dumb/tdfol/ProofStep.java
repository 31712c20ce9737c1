package dumb.tdfol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * One justified line of a derivation.
 */
public record ProofStep(@JsonIgnore Formula formula, String justification, String ruleName,
                        @JsonIgnore List<Formula> premises) {

    public ProofStep {
        requireNonNull(formula);
        requireNonNull(justification);
        requireNonNull(ruleName);
        premises = List.copyOf(premises);
    }

    public ProofStep(Formula formula, String justification, String ruleName) {
        this(formula, justification, ruleName, List.of());
    }

    @JsonProperty("formula")
    public String formulaText() {
        return formula.toText();
    }

    @JsonProperty("premises")
    public List<String> premiseTexts() {
        return premises.stream().map(Formula::toText).toList();
    }
}
