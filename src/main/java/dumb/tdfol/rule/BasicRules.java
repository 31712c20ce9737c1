package dumb.tdfol.rule;

import dumb.tdfol.Formula;
import dumb.tdfol.Term;

import java.util.HashSet;
import java.util.List;

import static dumb.tdfol.Formula.*;
import static dumb.tdfol.Formula.LogicOperator.*;
import static dumb.tdfol.rule.AbstractRule.define;
import static dumb.tdfol.rule.InferenceRule.Category.BASIC;
import static dumb.tdfol.rule.Shapes.*;

/**
 * Propositional and first-order rules.
 */
public final class BasicRules {

    public static final InferenceRule MODUS_PONENS = define(BASIC, "ModusPonens",
            "From φ and φ → ψ, derive ψ", 2,
            p -> is(p[1], IMPLIES) && left(p[1]).equals(p[0]),
            p -> right(p[1]));

    public static final InferenceRule MODUS_TOLLENS = define(BASIC, "ModusTollens",
            "From φ → ψ and ¬ψ, derive ¬φ", 2,
            p -> is(p[0], IMPLIES) && isNegationOf(p[1], right(p[0])),
            p -> not(left(p[0])));

    public static final InferenceRule CONJUNCTION_INTRODUCTION = define(BASIC, "ConjunctionIntroduction",
            "From φ and ψ, derive φ ∧ ψ", 2,
            p -> true,
            p -> and(p[0], p[1]));

    public static final InferenceRule CONJUNCTION_ELIMINATION_LEFT = define(BASIC, "ConjunctionEliminationLeft",
            "From φ ∧ ψ, derive φ", 1,
            p -> is(p[0], AND),
            p -> left(p[0]));

    public static final InferenceRule CONJUNCTION_ELIMINATION_RIGHT = define(BASIC, "ConjunctionEliminationRight",
            "From φ ∧ ψ, derive ψ", 1,
            p -> is(p[0], AND),
            p -> right(p[0]));

    public static final InferenceRule DISJUNCTION_INTRODUCTION = define(BASIC, "DisjunctionIntroduction",
            "From φ, derive φ ∨ ψ for a given ψ", 2,
            p -> true,
            p -> or(p[0], p[1]));

    public static final InferenceRule DISJUNCTIVE_SYLLOGISM = define(BASIC, "DisjunctiveSyllogism",
            "From φ ∨ ψ and ¬φ, derive ψ (or from ¬ψ, derive φ)", 2,
            p -> is(p[0], OR) && (isNegationOf(p[1], left(p[0])) || isNegationOf(p[1], right(p[0]))),
            p -> isNegationOf(p[1], left(p[0])) ? right(p[0]) : left(p[0]));

    public static final InferenceRule HYPOTHETICAL_SYLLOGISM = define(BASIC, "HypotheticalSyllogism",
            "From φ → ψ and ψ → χ, derive φ → χ", 2,
            p -> is(p[0], IMPLIES) && is(p[1], IMPLIES) && right(p[0]).equals(left(p[1])),
            p -> implies(left(p[0]), right(p[1])));

    public static final InferenceRule CONTRAPOSITION = define(BASIC, "Contraposition",
            "From φ → ψ, derive ¬ψ → ¬φ", 1,
            p -> is(p[0], IMPLIES),
            p -> implies(not(right(p[0])), not(left(p[0]))));

    public static final InferenceRule DOUBLE_NEGATION_INTRODUCTION = define(BASIC, "DoubleNegationIntroduction",
            "From φ, derive ¬¬φ", 1,
            p -> true,
            p -> not(not(p[0])));

    public static final InferenceRule DOUBLE_NEGATION_ELIMINATION = define(BASIC, "DoubleNegationElimination",
            "From ¬¬φ, derive φ", 1,
            p -> is(p[0], NOT) && is(inner(p[0]), NOT),
            p -> inner(inner(p[0])));

    public static final InferenceRule DE_MORGAN_AND = define(BASIC, "DeMorganAnd",
            "From ¬(φ ∧ ψ), derive ¬φ ∨ ¬ψ", 1,
            p -> is(p[0], NOT) && is(inner(p[0]), AND),
            p -> or(not(left(inner(p[0]))), not(right(inner(p[0])))));

    public static final InferenceRule DE_MORGAN_OR = define(BASIC, "DeMorganOr",
            "From ¬(φ ∨ ψ), derive ¬φ ∧ ¬ψ", 1,
            p -> is(p[0], NOT) && is(inner(p[0]), OR),
            p -> and(not(left(inner(p[0]))), not(right(inner(p[0])))));

    public static final UniversalInstantiation UNIVERSAL_INSTANTIATION = new UniversalInstantiation();

    public static final ExistentialGeneralization EXISTENTIAL_GENERALIZATION = new ExistentialGeneralization();

    static final List<InferenceRule> ALL = List.of(
            MODUS_PONENS, MODUS_TOLLENS, CONJUNCTION_INTRODUCTION, CONJUNCTION_ELIMINATION_LEFT,
            CONJUNCTION_ELIMINATION_RIGHT, DISJUNCTION_INTRODUCTION, DISJUNCTIVE_SYLLOGISM, HYPOTHETICAL_SYLLOGISM,
            CONTRAPOSITION, DOUBLE_NEGATION_INTRODUCTION, DOUBLE_NEGATION_ELIMINATION, DE_MORGAN_AND, DE_MORGAN_OR,
            UNIVERSAL_INSTANTIATION, EXISTENTIAL_GENERALIZATION);

    private BasicRules() {
    }

    /**
     * ∀x φ ⊢ φ[x := t]. Without an explicit term the variable is replaced by a constant of the same name.
     */
    public static final class UniversalInstantiation extends AbstractRule {

        UniversalInstantiation() {
            super(BASIC, "UniversalInstantiation", "From ∀x φ, derive φ[x := t]", 1);
        }

        @Override
        protected boolean applicable(Formula[] p) {
            return p[0] instanceof QuantifiedFormula q && q.quantifier() == Quantifier.FORALL;
        }

        @Override
        protected Formula derive(Formula[] p) {
            var q = (QuantifiedFormula) p[0];
            return q.instantiate(Term.constant(q.variable().name()));
        }

        public Formula instantiate(Formula universal, Term term) {
            if (!canApply(universal)) throw new RuleApplicationException(name(), universal);
            return ((QuantifiedFormula) universal).instantiate(term);
        }
    }

    /**
     * φ ⊢ ∃x φ[t := x]. Without an explicit term the first ground term is abstracted, or the
     * quantifier is vacuous when there is none.
     */
    public static final class ExistentialGeneralization extends AbstractRule {

        ExistentialGeneralization() {
            super(BASIC, "ExistentialGeneralization", "From φ(t), derive ∃x φ(x)", 1);
        }

        @Override
        protected boolean applicable(Formula[] p) {
            return true;
        }

        @Override
        protected Formula derive(Formula[] p) {
            var f = p[0];
            var v = Term.var(freshVariable(f));
            return f.terms().stream().filter(Term::isGround).findFirst()
                    .map(t -> generalize(f, t, v))
                    .orElseGet(() -> exists(v, f));
        }

        public Formula generalize(Formula f, Term term, Term.Variable variable) {
            if (!canApply(f)) throw new RuleApplicationException(name(), f);
            return exists(variable, f.replaceTerm(term, variable));
        }

        private static String freshVariable(Formula f) {
            var taken = new HashSet<String>();
            for (var sub : f.subformulas()) {
                taken.addAll(sub.freeVariables());
                if (sub instanceof QuantifiedFormula q) taken.add(q.variable().name());
            }
            if (!taken.contains("x")) return "x";
            for (var i = 1; ; i++) if (!taken.contains("x" + i)) return "x" + i;
        }
    }
}
