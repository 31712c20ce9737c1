package dumb.tdfol.rule;

import dumb.tdfol.Formula;

import java.util.List;

import static dumb.tdfol.Formula.*;
import static dumb.tdfol.Formula.LogicOperator.*;
import static dumb.tdfol.Formula.TemporalOperator.*;
import static dumb.tdfol.rule.AbstractRule.define;
import static dumb.tdfol.rule.AbstractRule.necessitation;
import static dumb.tdfol.rule.InferenceRule.Category.TEMPORAL;
import static dumb.tdfol.rule.Shapes.*;

/**
 * Linear-time rules over □ (always), ◊ (eventually), X (next), U, W and R.
 */
public final class TemporalRules {

    public static final InferenceRule TEMPORAL_K_AXIOM = define(TEMPORAL, "TemporalKAxiom",
            "From □(φ → ψ) and □φ, derive □ψ", 2,
            p -> is(p[0], ALWAYS) && is(inner(p[0]), IMPLIES) && p[1].equals(always(left(inner(p[0])))),
            p -> always(right(inner(p[0]))));

    public static final InferenceRule TEMPORAL_T_AXIOM = define(TEMPORAL, "TemporalTAxiom",
            "From □φ, derive φ", 1,
            p -> is(p[0], ALWAYS),
            p -> inner(p[0]));

    public static final InferenceRule TEMPORAL_S4_AXIOM = define(TEMPORAL, "TemporalS4Axiom",
            "From □φ, derive □□φ", 1,
            p -> is(p[0], ALWAYS),
            p -> always(p[0]));

    public static final InferenceRule TEMPORAL_S5_AXIOM = define(TEMPORAL, "TemporalS5Axiom",
            "From ◊φ, derive □◊φ", 1,
            p -> is(p[0], EVENTUALLY),
            p -> always(p[0]));

    public static final InferenceRule ALWAYS_NECESSITATION = necessitation(TEMPORAL, "AlwaysNecessitation",
            "From a theorem φ, derive □φ", Formula::always);

    public static final InferenceRule ALWAYS_DISTRIBUTION = define(TEMPORAL, "AlwaysDistribution",
            "From □(φ ∧ ψ), derive □φ ∧ □ψ", 1,
            p -> is(p[0], ALWAYS) && is(inner(p[0]), AND),
            p -> and(always(left(inner(p[0]))), always(right(inner(p[0])))));

    public static final InferenceRule EVENTUALLY_INTRODUCTION = define(TEMPORAL, "EventuallyIntroduction",
            "From φ, derive ◊φ", 1,
            p -> true,
            p -> eventually(p[0]));

    public static final InferenceRule EVENTUALLY_EXPANSION = define(TEMPORAL, "EventuallyExpansion",
            "From ◊φ, derive φ ∨ X◊φ", 1,
            p -> is(p[0], EVENTUALLY),
            p -> or(inner(p[0]), next(p[0])));

    public static final InferenceRule EVENTUALLY_AGGREGATION = define(TEMPORAL, "EventuallyAggregation",
            "From ◊φ ∨ ◊ψ, derive ◊(φ ∨ ψ)", 1,
            p -> is(p[0], OR) && is(left(p[0]), EVENTUALLY) && is(right(p[0]), EVENTUALLY),
            p -> eventually(or(inner(left(p[0])), inner(right(p[0])))));

    public static final InferenceRule ALWAYS_EVENTUALLY_CONTRACTION = define(TEMPORAL, "AlwaysEventuallyContraction",
            "From ¬◊¬φ, derive □φ", 1,
            p -> is(p[0], NOT) && is(inner(p[0]), EVENTUALLY) && is(inner(inner(p[0])), NOT),
            p -> always(inner(inner(inner(p[0])))));

    public static final InferenceRule ALWAYS_EVENTUALLY_EXPANSION = define(TEMPORAL, "AlwaysEventuallyExpansion",
            "From □φ, derive ¬◊¬φ", 1,
            p -> is(p[0], ALWAYS),
            p -> not(eventually(not(inner(p[0])))));

    public static final InferenceRule NEXT_DISTRIBUTION = define(TEMPORAL, "NextDistribution",
            "From X(φ ∧ ψ), derive Xφ ∧ Xψ", 1,
            p -> is(p[0], NEXT) && is(inner(p[0]), AND),
            p -> and(next(left(inner(p[0]))), next(right(inner(p[0])))));

    public static final InferenceRule UNTIL_UNFOLDING = define(TEMPORAL, "UntilUnfolding",
            "From φ U ψ, derive ψ ∨ (φ ∧ X(φ U ψ))", 1,
            p -> is(p[0], UNTIL),
            p -> or(right(p[0]), and(left(p[0]), next(p[0]))));

    public static final InferenceRule UNTIL_INDUCTION = define(TEMPORAL, "UntilInduction",
            "From ψ ∨ (φ ∧ X(φ U ψ)), derive φ U ψ", 1,
            TemporalRules::isUntilUnfolding,
            p -> inner(right(right(p[0]))));

    public static final InferenceRule UNTIL_INDUCTION_STEP = define(TEMPORAL, "UntilInductionStep",
            "From ψ and φ, derive φ U ψ", 2,
            p -> true,
            p -> until(p[1], p[0]));

    public static final InferenceRule UNTIL_RELEASE_DUALITY = define(TEMPORAL, "UntilReleaseDuality",
            "From φ U ψ, derive ¬(¬φ R ¬ψ)", 1,
            p -> is(p[0], UNTIL),
            p -> not(release(not(left(p[0])), not(right(p[0])))));

    public static final InferenceRule WEAK_UNTIL_EXPANSION = define(TEMPORAL, "WeakUntilExpansion",
            "From φ W ψ, derive (φ U ψ) ∨ □φ", 1,
            p -> is(p[0], WEAK_UNTIL),
            p -> or(until(left(p[0]), right(p[0])), always(left(p[0]))));

    public static final InferenceRule RELEASE_COINDUCTION = define(TEMPORAL, "ReleaseCoinduction",
            "From φ R ψ, derive ψ ∧ (φ ∨ X(φ R ψ))", 1,
            p -> is(p[0], RELEASE),
            p -> and(right(p[0]), or(left(p[0]), next(p[0]))));

    public static final InferenceRule TEMPORAL_INDUCTION = define(TEMPORAL, "TemporalInduction",
            "From φ and □(φ → Xφ), derive □φ", 2,
            p -> p[1].equals(always(implies(p[0], next(p[0])))),
            p -> always(p[0]));

    public static final InferenceRule UNTIL_EVENTUALITY = define(TEMPORAL, "UntilEventuality",
            "From φ U ψ, derive ◊ψ", 1,
            p -> is(p[0], UNTIL),
            p -> eventually(right(p[0])));

    static final List<InferenceRule> ALL = List.of(
            TEMPORAL_K_AXIOM, TEMPORAL_T_AXIOM, TEMPORAL_S4_AXIOM, TEMPORAL_S5_AXIOM, ALWAYS_NECESSITATION,
            ALWAYS_DISTRIBUTION, EVENTUALLY_INTRODUCTION, EVENTUALLY_EXPANSION, EVENTUALLY_AGGREGATION,
            ALWAYS_EVENTUALLY_CONTRACTION, ALWAYS_EVENTUALLY_EXPANSION, NEXT_DISTRIBUTION, UNTIL_UNFOLDING,
            UNTIL_INDUCTION, UNTIL_INDUCTION_STEP, UNTIL_RELEASE_DUALITY, WEAK_UNTIL_EXPANSION,
            RELEASE_COINDUCTION, TEMPORAL_INDUCTION, UNTIL_EVENTUALITY);

    private TemporalRules() {
    }

    /** ψ ∨ (φ ∧ X(φ U ψ)) */
    private static boolean isUntilUnfolding(Formula[] p) {
        var f = p[0];
        if (!is(f, OR) || !is(right(f), AND)) return false;
        var conj = right(f);
        if (!is(right(conj), NEXT)) return false;
        var u = inner(right(conj));
        return is(u, UNTIL) && left(u).equals(left(conj)) && right(u).equals(left(f));
    }
}
