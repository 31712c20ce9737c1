package dumb.tdfol.rule;

import dumb.tdfol.Formula;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * A rule was applied to premises that do not have its required shape.
 */
public class RuleApplicationException extends RuntimeException {
    private final String ruleName;

    public RuleApplicationException(String ruleName, Formula... premises) {
        super(ruleName + " cannot be applied to [" + (premises == null ? "" :
                Arrays.stream(premises).map(p -> p == null ? "null" : p.toText()).collect(Collectors.joining(", "))) + "]");
        this.ruleName = ruleName;
    }

    public String ruleName() {
        return ruleName;
    }
}
