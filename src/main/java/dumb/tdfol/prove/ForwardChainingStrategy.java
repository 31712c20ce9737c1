package dumb.tdfol.prove;

import dumb.tdfol.Formula;
import dumb.tdfol.KnowledgeBase;
import dumb.tdfol.ProofResult;
import dumb.tdfol.ProofStatus;
import dumb.tdfol.Term;
import dumb.tdfol.rule.BasicRules;
import dumb.tdfol.rule.InferenceRule;
import dumb.tdfol.rule.InferenceRules;
import dumb.tdfol.util.Log;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Saturates the knowledge base with the rule library, one depth level per round, until the goal or its
 * negation appears.
 * <p>
 * A derivation larger than its premises combined is only kept when it is a subformula of the goal; any other
 * derivation must not exceed the largest formula of the goal or knowledge base. The space is therefore finite
 * and the search reaches a fixpoint. Contradictory premises are reported, never used to derive arbitrary goals.
 */
public class ForwardChainingStrategy extends AbstractStrategy {

    public static final String NAME = "forward_chaining";

    private final List<InferenceRule> rules;
    private final int maxKnownFormulas;

    public ForwardChainingStrategy() {
        this(InferenceRules.all(), 5000);
    }

    public ForwardChainingStrategy(List<InferenceRule> rules, int maxKnownFormulas) {
        super(NAME, 2);
        this.rules = List.copyOf(rules);
        this.maxKnownFormulas = maxKnownFormulas;
    }

    @Override
    public boolean canHandle(Formula goal, KnowledgeBase kb) {
        return !kb.isEmpty();
    }

    @Override
    public double estimateCost(Formula goal, KnowledgeBase kb) {
        var cost = 1.0 + 0.05 * kb.size();
        return goal.isModal() || FormulaAnalysis.hasDeontic(goal) || FormulaAnalysis.hasTemporal(goal) ? cost * 2 : cost;
    }

    @Override
    protected ProofResult search(Formula goal, KnowledgeBase.Snapshot kb, Budget budget) {
        return new Saturation(goal, kb, budget).run();
    }

    private final class Saturation {
        final Formula goal;
        final Formula negatedGoal;
        final KnowledgeBase.Snapshot kb;
        final Budget budget;
        final ProofTrace trace = new ProofTrace();
        final Set<Formula> known = new LinkedHashSet<>();
        final Set<Formula> goalParts;
        final Set<Term> groundTerms = new LinkedHashSet<>();
        final int sizeCap;
        final List<Formula> fresh = new ArrayList<>();
        boolean inconsistent;
        int found = -1;
        ProofStatus outcome = ProofStatus.UNKNOWN;

        Saturation(Formula goal, KnowledgeBase.Snapshot kb, Budget budget) {
            this.goal = goal;
            this.negatedGoal = complement(goal);
            this.kb = kb;
            this.budget = budget;
            this.goalParts = new HashSet<>(goal.subformulas());
            var cap = goal.size();
            for (var f : kb.all()) cap = Math.max(cap, f.size());
            this.sizeCap = cap;
            collectGroundTerms(goal);
        }

        private void collectGroundTerms(Formula f) {
            for (var t : f.terms()) if (t.isGround()) groundTerms.add(t);
        }

        ProofResult run() {
            for (var a : kb.axioms()) given(a, "Axiom");
            for (var t : kb.theorems()) given(t, "Theorem");
            checkConsistency(known);

            for (var depth = 1; !budget.depthExceeded(depth); depth++) {
                var snapshot = List.copyOf(known);
                fresh.clear();
                for (var rule : rules) {
                    budget.check();
                    if (fire(rule, snapshot)) return finish();
                }
                if (fresh.isEmpty())
                    return unknown("Fixpoint reached after " + (depth - 1) + " rounds without deriving the goal");
                known.addAll(fresh);
                checkConsistency(fresh);
                if (known.size() >= maxKnownFormulas) {
                    Log.warning("Forward chaining stopped at " + known.size() + " known formulas");
                    return unknown("Known-formula limit " + maxKnownFormulas + " reached");
                }
            }
            return unknown("Depth limit " + budget.maxDepth() + " reached");
        }

        private void given(Formula f, String kind) {
            trace.given(f, kind);
            known.add(f);
            collectGroundTerms(f);
        }

        private void checkConsistency(Collection<Formula> added) {
            if (inconsistent) return;
            for (var f : added) {
                if (known.contains(Formula.not(f)) || f instanceof Formula.UnaryFormula u && known.contains(u.formula())) {
                    inconsistent = true;
                    Log.warning("Knowledge base is inconsistent: both " + f.toText() + " and its negation are known");
                    return;
                }
            }
        }

        /** @return true once the goal or its negation has been derived */
        private boolean fire(InferenceRule rule, List<Formula> snapshot) {
            if (rule == BasicRules.UNIVERSAL_INSTANTIATION) return instantiate(snapshot);
            if (rule == BasicRules.EXISTENTIAL_GENERALIZATION) return generalize();
            if (rule == BasicRules.DISJUNCTION_INTRODUCTION || rule == BasicRules.CONJUNCTION_INTRODUCTION)
                return introduce(rule);
            if (rule.necessitation()) {
                for (var f : snapshot)
                    if (kb.isTheorem(f) && add(rule, rule.apply(f), f)) return true;
                return false;
            }
            switch (rule.arity()) {
                case 1 -> {
                    for (var f : snapshot)
                        if (rule.canApply(f) && add(rule, rule.apply(f), f)) return true;
                }
                case 2 -> {
                    for (var a : snapshot) {
                        budget.check();
                        for (var b : snapshot)
                            if (a != b && rule.canApply(a, b) && add(rule, rule.apply(a, b), a, b)) return true;
                    }
                }
                case 3 -> {
                    for (var a : snapshot) {
                        budget.check();
                        for (var b : snapshot) {
                            if (a == b) continue;
                            for (var c : snapshot)
                                if (c != a && c != b && rule.canApply(a, b, c) && add(rule, rule.apply(a, b, c), a, b, c))
                                    return true;
                        }
                    }
                }
                default -> Log.debug("Skipping rule " + rule.name() + " of arity " + rule.arity());
            }
            return false;
        }

        private boolean instantiate(List<Formula> snapshot) {
            var ui = BasicRules.UNIVERSAL_INSTANTIATION;
            for (var f : snapshot) {
                if (!ui.canApply(f)) continue;
                if (groundTerms.isEmpty()) {
                    if (add(ui, ui.apply(f), f)) return true;
                    continue;
                }
                for (var t : List.copyOf(groundTerms))
                    if (add(ui, ui.instantiate(f, t), f)) return true;
            }
            return false;
        }

        /** ∃-introduction, only towards existential subformulas of the goal. */
        private boolean generalize() {
            var eg = BasicRules.EXISTENTIAL_GENERALIZATION;
            for (var part : goalParts) {
                if (!(part instanceof Formula.QuantifiedFormula q) || q.quantifier() != Formula.Quantifier.EXISTS) continue;
                for (var t : List.copyOf(groundTerms)) {
                    var witness = q.instantiate(t);
                    if (known.contains(witness)) {
                        var g = eg.generalize(witness, t, q.variable());
                        if (g.equals(q) && add(eg, g, witness)) return true;
                    }
                }
            }
            return false;
        }

        /** ∧- and ∨-introduction, only towards subformulas of the goal. */
        private boolean introduce(InferenceRule rule) {
            var op = rule == BasicRules.CONJUNCTION_INTRODUCTION ? Formula.LogicOperator.AND : Formula.LogicOperator.OR;
            for (var part : goalParts) {
                if (!(part instanceof Formula.BinaryFormula b) || b.operator() != op || known.contains(part)) continue;
                if (op == Formula.LogicOperator.AND) {
                    if (known.contains(b.left()) && known.contains(b.right())
                            && add(rule, rule.apply(b.left(), b.right()), b.left(), b.right())) return true;
                } else if (known.contains(b.left())) {
                    if (add(rule, rule.apply(b.left(), b.right()), b.left())) return true;
                }
            }
            return false;
        }

        /** Records an admissible new derivation; true if it settles the goal. */
        private boolean add(InferenceRule rule, Formula result, Formula... premises) {
            if (known.contains(result) || trace.contains(result)) return false;
            var premiseSize = 0;
            for (var p : premises) premiseSize += p.size();
            var size = result.size();
            if (size > premiseSize ? !goalParts.contains(result) : size > sizeCap) return false;

            var handles = new int[premises.length];
            for (var i = 0; i < premises.length; i++) handles[i] = trace.handle(premises[i]).orElseThrow();
            var h = trace.derive(result, rule.name(), "By " + rule.name() + ": " + rule.description(), handles);
            fresh.add(result);
            collectGroundTerms(result);

            if (result.equals(goal)) {
                found = h;
                outcome = ProofStatus.PROVED;
                return true;
            }
            if (result.equals(negatedGoal)) {
                found = h;
                outcome = ProofStatus.DISPROVED;
                return true;
            }
            return false;
        }

        private ProofResult finish() {
            var msg = outcome == ProofStatus.DISPROVED ? "Negation of the goal derived" : null;
            return new ProofResult(outcome, goal, trace.chain(found), NAME, budget.elapsedMillis(), false, annotate(msg));
        }

        private ProofResult unknown(String msg) {
            return ProofResult.unknown(goal, NAME, budget.elapsedMillis(), annotate(msg));
        }

        private @Nullable String annotate(@Nullable String msg) {
            if (!inconsistent) return msg;
            return msg == null ? "inconsistent knowledge base" : msg + "; inconsistent knowledge base";
        }
    }
}
