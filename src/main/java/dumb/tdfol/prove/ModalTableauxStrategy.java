package dumb.tdfol.prove;

import dumb.tdfol.Formula;
import dumb.tdfol.KnowledgeBase;
import dumb.tdfol.ProofResult;
import dumb.tdfol.ProofStatus;
import dumb.tdfol.tableau.Countermodel;
import dumb.tdfol.tableau.ModalLogicType;
import dumb.tdfol.tableau.ModalTableaux;
import dumb.tdfol.util.Log;
import org.jetbrains.annotations.Nullable;

/**
 * Refutation through {@link ModalTableaux}. Knowledge-base formulas are assumed at the root world only.
 * <p>
 * A saturated open branch after a complete search means the goal does not follow; the negated goal is then
 * tried, and DISPROVED is reported if it closes.
 */
public class ModalTableauxStrategy extends AbstractStrategy {

    public static final String NAME = "modal_tableaux";

    private final @Nullable ModalLogicType forcedLogic;
    private final int maxBranches;
    private final int maxWorlds;

    public ModalTableauxStrategy() {
        this(null, 2000, 64);
    }

    public ModalTableauxStrategy(ModalLogicType logic) {
        this(logic, 2000, 64);
    }

    public ModalTableauxStrategy(@Nullable ModalLogicType forcedLogic, int maxBranches, int maxWorlds) {
        super(NAME, 3);
        this.forcedLogic = forcedLogic;
        this.maxBranches = maxBranches;
        this.maxWorlds = maxWorlds;
    }

    @Override
    public boolean canHandle(Formula goal, KnowledgeBase kb) {
        return true;
    }

    @Override
    public double estimateCost(Formula goal, KnowledgeBase kb) {
        return FormulaAnalysis.tableauxCost(goal);
    }

    /** The forced logic, or the one selected from the goal and the premises together. */
    public ModalLogicType logicFor(Formula goal, KnowledgeBase.Snapshot kb) {
        if (forcedLogic != null) return forcedLogic;
        var combined = goal;
        for (var f : kb.all()) combined = Formula.and(combined, f);
        return FormulaAnalysis.selectLogicType(combined);
    }

    @Override
    protected ProofResult search(Formula goal, KnowledgeBase.Snapshot kb, Budget budget) {
        var logic = logicFor(goal, kb);
        var tableaux = new ModalTableaux(logic, maxBranches, maxWorlds);

        var result = tableaux.prove(goal, kb.all(), budget);
        if (result.valid())
            return ProofResult.proved(goal, result.steps(), NAME, budget.elapsedMillis())
                    .withMessage(logic + ": all " + result.totalBranches() + " branches closed");
        if (!result.complete())
            return ProofResult.unknown(goal, NAME, budget.elapsedMillis(),
                    logic + ": search bounded before saturation (" + result.closedBranches() + "/" + result.totalBranches() + " branches closed)");

        var countermodel = result.countermodel().map(b -> Countermodel.of(logic, b)).orElse(null);
        var worlds = countermodel == null ? 0 : countermodel.worlds().size();
        var negated = complement(goal);
        var refutation = tableaux.prove(negated, kb.all(), budget);
        if (refutation.valid()) {
            Log.debug("Tableau refuted " + goal.toText() + " in " + logic);
            return new ProofResult(ProofStatus.DISPROVED, goal, refutation.steps(), NAME, budget.elapsedMillis(), false,
                    logic + ": negation valid; countermodel with " + worlds + " world(s)", countermodel);
        }
        return ProofResult.unknown(goal, NAME, budget.elapsedMillis(),
                logic + ": not valid, countermodel with " + worlds + " world(s)").withCountermodel(countermodel);
    }
}
