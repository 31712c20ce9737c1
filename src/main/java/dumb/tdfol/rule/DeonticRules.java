package dumb.tdfol.rule;

import dumb.tdfol.Formula;

import java.util.List;

import static dumb.tdfol.Formula.*;
import static dumb.tdfol.Formula.DeonticOperator.*;
import static dumb.tdfol.Formula.LogicOperator.*;
import static dumb.tdfol.rule.AbstractRule.define;
import static dumb.tdfol.rule.AbstractRule.necessitation;
import static dumb.tdfol.rule.InferenceRule.Category.DEONTIC;
import static dumb.tdfol.rule.Shapes.*;

/**
 * Standard deontic logic (KD) over O (obligation), P (permission) and F (prohibition).
 */
public final class DeonticRules {

    public static final InferenceRule DEONTIC_D_AXIOM = define(DEONTIC, "DeonticDAxiom",
            "From Oφ, derive Pφ", 1,
            p -> is(p[0], OBLIGATION),
            p -> permission(inner(p[0])));

    public static final InferenceRule DEONTIC_K_AXIOM = define(DEONTIC, "DeonticKAxiom",
            "From O(φ → ψ) and Oφ, derive Oψ", 2,
            p -> is(p[0], OBLIGATION) && is(inner(p[0]), IMPLIES) && p[1].equals(obligation(left(inner(p[0])))),
            p -> obligation(right(inner(p[0]))));

    public static final InferenceRule DEONTIC_NECESSITATION = necessitation(DEONTIC, "DeonticNecessitation",
            "From a theorem φ, derive Oφ", Formula::obligation);

    public static final InferenceRule DEONTIC_DETACHMENT = define(DEONTIC, "DeonticDetachment",
            "From φ and φ → Oψ, derive Oψ", 2,
            p -> is(p[1], IMPLIES) && left(p[1]).equals(p[0]) && is(right(p[1]), OBLIGATION),
            p -> right(p[1]));

    public static final InferenceRule PERMISSION_INTRODUCTION = define(DEONTIC, "PermissionIntroduction",
            "From φ, derive Pφ", 1,
            p -> true,
            p -> permission(p[0]));

    public static final InferenceRule PERMISSION_STRENGTHENING = define(DEONTIC, "PermissionStrengthening",
            "From P(φ ∧ ψ), derive Pφ", 1,
            p -> is(p[0], PERMISSION) && is(inner(p[0]), AND),
            p -> permission(left(inner(p[0]))));

    public static final InferenceRule PERMISSION_NEGATION = define(DEONTIC, "PermissionNegation",
            "From Pφ, derive ¬O¬φ", 1,
            p -> is(p[0], PERMISSION),
            p -> not(obligation(not(inner(p[0])))));

    public static final InferenceRule PERMISSION_TEMPORAL_WEAKENING = define(DEONTIC, "PermissionTemporalWeakening",
            "From Pφ, derive P◊φ", 1,
            p -> is(p[0], PERMISSION),
            p -> permission(eventually(inner(p[0]))));

    public static final InferenceRule PROHIBITION_FROM_OBLIGATION = define(DEONTIC, "ProhibitionFromObligation",
            "From O¬φ, derive Fφ", 1,
            p -> is(p[0], OBLIGATION) && is(inner(p[0]), NOT),
            p -> prohibition(inner(inner(p[0]))));

    public static final InferenceRule PROHIBITION_EQUIVALENCE = define(DEONTIC, "ProhibitionEquivalence",
            "From Fφ, derive O¬φ", 1,
            p -> is(p[0], PROHIBITION),
            p -> obligation(not(inner(p[0]))));

    public static final InferenceRule OBLIGATION_WEAKENING = define(DEONTIC, "ObligationWeakening",
            "From O(φ ∧ ψ), derive Oφ", 1,
            p -> is(p[0], OBLIGATION) && is(inner(p[0]), AND),
            p -> obligation(left(inner(p[0]))));

    public static final InferenceRule OBLIGATION_CONSISTENCY = define(DEONTIC, "ObligationConsistency",
            "From Oφ, derive ¬O¬φ", 1,
            p -> is(p[0], OBLIGATION),
            p -> not(obligation(not(inner(p[0])))));

    public static final InferenceRule OBLIGATION_EVENTUALLY_WEAKENING = define(DEONTIC, "ObligationEventuallyWeakening",
            "From Oφ, derive O◊φ", 1,
            p -> is(p[0], OBLIGATION),
            p -> obligation(eventually(inner(p[0]))));

    public static final InferenceRule OBLIGATION_AGGREGATION = define(DEONTIC, "ObligationAggregation",
            "From Oφ and Oψ, derive O(φ ∧ ψ)", 2,
            p -> is(p[0], OBLIGATION) && is(p[1], OBLIGATION),
            p -> obligation(and(inner(p[0]), inner(p[1]))));

    public static final InferenceRule PROHIBITION_NOT_PERMITTED = define(DEONTIC, "ProhibitionNotPermitted",
            "From Fφ, derive ¬Pφ", 1,
            p -> is(p[0], PROHIBITION),
            p -> not(permission(inner(p[0]))));

    public static final InferenceRule PERMISSION_FROM_NEGATED_OBLIGATION = define(DEONTIC, "PermissionFromNegatedObligation",
            "From ¬O¬φ, derive Pφ", 1,
            p -> is(p[0], NOT) && is(inner(p[0]), OBLIGATION) && is(inner(inner(p[0])), NOT),
            p -> permission(inner(inner(inner(p[0])))));

    static final List<InferenceRule> ALL = List.of(
            DEONTIC_D_AXIOM, DEONTIC_K_AXIOM, DEONTIC_NECESSITATION, DEONTIC_DETACHMENT, PERMISSION_INTRODUCTION,
            PERMISSION_STRENGTHENING, PERMISSION_NEGATION, PERMISSION_TEMPORAL_WEAKENING, PROHIBITION_FROM_OBLIGATION,
            PROHIBITION_EQUIVALENCE, OBLIGATION_WEAKENING, OBLIGATION_CONSISTENCY, OBLIGATION_EVENTUALLY_WEAKENING,
            OBLIGATION_AGGREGATION, PROHIBITION_NOT_PERMITTED, PERMISSION_FROM_NEGATED_OBLIGATION);

    private DeonticRules() {
    }
}
