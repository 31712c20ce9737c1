package dumb.tdfol.rule;

import java.util.List;

import static dumb.tdfol.Formula.*;
import static dumb.tdfol.Formula.DeonticOperator.*;
import static dumb.tdfol.Formula.LogicOperator.*;
import static dumb.tdfol.Formula.TemporalOperator.*;
import static dumb.tdfol.rule.AbstractRule.define;
import static dumb.tdfol.rule.InferenceRule.Category.COMBINED;
import static dumb.tdfol.rule.Shapes.*;

/**
 * Interaction of deontic and temporal operators.
 */
public final class CombinedRules {

    public static final InferenceRule ALWAYS_OBLIGATION_DISTRIBUTION = define(COMBINED, "AlwaysObligationDistribution",
            "From □O(φ ∧ ψ), derive □Oφ ∧ □Oψ", 1,
            p -> is(p[0], ALWAYS) && is(inner(p[0]), OBLIGATION) && is(inner(inner(p[0])), AND),
            p -> {
                var conj = inner(inner(p[0]));
                return and(always(obligation(left(conj))), always(obligation(right(conj))));
            });

    public static final InferenceRule ALWAYS_PERMISSION = define(COMBINED, "AlwaysPermission",
            "From P□φ, derive □Pφ", 1,
            p -> is(p[0], PERMISSION) && is(inner(p[0]), ALWAYS),
            p -> always(permission(inner(inner(p[0])))));

    public static final InferenceRule CONTRARY_TO_DUTY = define(COMBINED, "ContraryToDuty",
            "From Oφ, ¬φ and ¬φ → Oψ, derive Oψ", 3,
            p -> is(p[0], OBLIGATION) && isNegationOf(p[1], inner(p[0]))
                    && is(p[2], IMPLIES) && left(p[2]).equals(p[1]) && is(right(p[2]), OBLIGATION),
            p -> right(p[2]));

    public static final InferenceRule DEONTIC_TEMPORAL_INTRODUCTION = define(COMBINED, "DeonticTemporalIntroduction",
            "From Oφ, derive O(Xφ)", 1,
            p -> is(p[0], OBLIGATION),
            p -> obligation(next(inner(p[0]))));

    public static final InferenceRule TEMPORAL_OBLIGATION_PERSISTENCE = define(COMBINED, "TemporalObligationPersistence",
            "From O□φ, derive □Oφ", 1,
            p -> is(p[0], OBLIGATION) && is(inner(p[0]), ALWAYS),
            p -> always(obligation(inner(inner(p[0])))));

    public static final InferenceRule FUTURE_TEMPORAL_OBLIGATION_PERSISTENCE = define(COMBINED, "FutureTemporalObligationPersistence",
            "From □Oφ, derive X□Oφ", 1,
            p -> is(p[0], ALWAYS) && is(inner(p[0]), OBLIGATION),
            p -> next(p[0]));

    public static final InferenceRule UNTIL_OBLIGATION = define(COMBINED, "UntilObligation",
            "From O(φ U ψ), derive ◊Oψ", 1,
            p -> is(p[0], OBLIGATION) && is(inner(p[0]), UNTIL),
            p -> eventually(obligation(right(inner(p[0])))));

    public static final InferenceRule OBLIGATION_EVENTUALLY = define(COMBINED, "ObligationEventually",
            "From O◊φ, derive ◊Oφ", 1,
            p -> is(p[0], OBLIGATION) && is(inner(p[0]), EVENTUALLY),
            p -> eventually(obligation(inner(inner(p[0])))));

    public static final InferenceRule EVENTUALLY_FORBIDDEN = define(COMBINED, "EventuallyForbidden",
            "From F◊φ, derive □Fφ", 1,
            p -> is(p[0], PROHIBITION) && is(inner(p[0]), EVENTUALLY),
            p -> always(prohibition(inner(inner(p[0])))));

    static final List<InferenceRule> ALL = List.of(
            ALWAYS_OBLIGATION_DISTRIBUTION, ALWAYS_PERMISSION, CONTRARY_TO_DUTY, DEONTIC_TEMPORAL_INTRODUCTION,
            TEMPORAL_OBLIGATION_PERSISTENCE, FUTURE_TEMPORAL_OBLIGATION_PERSISTENCE, UNTIL_OBLIGATION,
            OBLIGATION_EVENTUALLY, EVENTUALLY_FORBIDDEN);

    private CombinedRules() {
    }
}
