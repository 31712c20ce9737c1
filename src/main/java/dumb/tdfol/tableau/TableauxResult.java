package dumb.tdfol.tableau;

import dumb.tdfol.ProofStep;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * @param valid     every branch closed
 * @param complete  no bound cut the search short, so an open branch is a genuine countermodel
 * @param openBranch a saturated open branch, if one was found
 */
public record TableauxResult(boolean valid, boolean complete, int totalBranches, int closedBranches,
                             List<ProofStep> steps, @Nullable TableauxBranch openBranch) {

    public TableauxResult {
        steps = List.copyOf(steps);
    }

    public Optional<TableauxBranch> countermodel() {
        return complete && !valid ? Optional.ofNullable(openBranch) : Optional.empty();
    }
}
