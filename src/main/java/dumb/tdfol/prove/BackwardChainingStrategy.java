package dumb.tdfol.prove;

import dumb.tdfol.*;
import dumb.tdfol.Formula.BinaryFormula;
import dumb.tdfol.Formula.LogicOperator;
import dumb.tdfol.Formula.QuantifiedFormula;
import dumb.tdfol.rule.BasicRules;
import dumb.tdfol.rule.CombinedRules;
import dumb.tdfol.rule.DeonticRules;
import dumb.tdfol.rule.InferenceRule;
import dumb.tdfol.rule.InferenceRules;
import dumb.tdfol.rule.TemporalRules;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Goal-directed search: decomposes the goal and chains backwards through the implications of the knowledge
 * base. Subgoals already on the proof stack are rejected, and recursion stops at {@code maxDepth}. When the goal
 * cannot be established its complement is tried, which yields DISPROVED.
 */
public class BackwardChainingStrategy extends AbstractStrategy {

    public static final String NAME = "backward_chaining";

    /** Unary rules tried in one step against knowledge-base formulas. */
    private final List<InferenceRule> unaryRules;

    public BackwardChainingStrategy() {
        super(NAME, 1);
        this.unaryRules = InferenceRules.all().stream()
                .filter(r -> r.arity() == 1 && r != BasicRules.UNIVERSAL_INSTANTIATION)
                .toList();
    }

    @Override
    public boolean canHandle(Formula goal, KnowledgeBase kb) {
        return !kb.isEmpty();
    }

    @Override
    public double estimateCost(Formula goal, KnowledgeBase kb) {
        var cost = 0.8 + 0.05 * kb.size();
        return FormulaAnalysis.hasDeontic(goal) || FormulaAnalysis.hasTemporal(goal) ? cost * 2 : cost;
    }

    @Override
    protected ProofResult search(Formula goal, KnowledgeBase.Snapshot kb, Budget budget) {
        var s = new Search(kb, budget, goal);
        var h = s.solve(goal, 0);
        if (h != null)
            return ProofResult.proved(goal, s.trace.chain(h), NAME, budget.elapsedMillis());

        var negated = complement(goal);
        s.failed.clear();
        h = s.solve(negated, 0);
        if (h != null)
            return new ProofResult(ProofStatus.DISPROVED, goal, s.trace.chain(h), NAME, budget.elapsedMillis(), false,
                    "Derived " + negated.toText());

        return ProofResult.unknown(goal, NAME, budget.elapsedMillis(),
                s.depthLimited ? "Depth limit " + budget.maxDepth() + " reached" : "No backward derivation found");
    }

    /** A formula with its leading universal quantifiers removed. */
    private record Universal(Formula original, List<Term.Variable> variables, Formula body) {
        static Universal of(Formula f) {
            var vars = new ArrayList<Term.Variable>();
            var body = f;
            while (body instanceof QuantifiedFormula q && q.quantifier() == Formula.Quantifier.FORALL) {
                vars.add(q.variable());
                body = q.formula();
            }
            return new Universal(f, vars, body);
        }

        Set<String> names() {
            var s = new HashSet<String>();
            for (var v : variables) s.add(v.name());
            return s;
        }
    }

    private final class Search {
        final KnowledgeBase.Snapshot kb;
        final Budget budget;
        final ProofTrace trace = new ProofTrace();
        final Set<Formula> stack = new HashSet<>();
        /** Subgoal → shallowest depth at which it has already failed. */
        final Map<Formula, Integer> failed = new HashMap<>();
        /** Count of subgoals rejected because they were already on the proof stack. */
        int cycleCuts;
        final List<Universal> universals = new ArrayList<>();
        final Set<Term> groundTerms = new LinkedHashSet<>();
        boolean depthLimited;

        Search(KnowledgeBase.Snapshot kb, Budget budget, Formula goal) {
            this.kb = kb;
            this.budget = budget;
            for (var a : kb.axioms()) trace.given(a, "Axiom");
            for (var t : kb.theorems()) trace.given(t, "Theorem");
            for (var f : kb.all()) {
                if (f instanceof QuantifiedFormula) universals.add(Universal.of(f));
                for (var t : f.terms()) if (t.isGround()) groundTerms.add(t);
            }
            for (var t : goal.terms()) if (t.isGround()) groundTerms.add(t);
        }

        @Nullable Integer solve(Formula g, int depth) {
            budget.check();
            var known = trace.handle(g);
            if (known.isPresent()) return known.get();
            if (budget.depthExceeded(depth)) {
                depthLimited = true;
                return null;
            }
            var failedAt = failed.get(g);
            if (failedAt != null && failedAt <= depth) return null;
            if (!stack.add(g)) {
                cycleCuts++;
                return null;
            }
            var cutsBefore = cycleCuts;
            try {
                var h = expand(g, depth + 1);
                // a failure that leaned on the current stack may succeed from another branch
                if (h == null && cycleCuts == cutsBefore) failed.merge(g, depth, Math::min);
                return h;
            } finally {
                stack.remove(g);
            }
        }

        private @Nullable Integer expand(Formula g, int d) {
            Integer h;
            if ((h = decompose(g, d)) != null) return h;
            if ((h = modusPonens(g, d)) != null) return h;
            if ((h = universal(g, d)) != null) return h;
            if ((h = modusTollens(g, d)) != null) return h;
            if ((h = disjunctiveSyllogism(g, d)) != null) return h;
            if ((h = unary(g)) != null) return h;
            return modal(g, d);
        }

        private int derive(Formula g, InferenceRule rule, String justification, int... premises) {
            return trace.derive(g, rule.name(), justification, premises);
        }

        private @Nullable Integer decompose(Formula g, int d) {
            if (g instanceof BinaryFormula b) {
                switch (b.operator()) {
                    case AND -> {
                        var l = solve(b.left(), d);
                        var r = l == null ? null : solve(b.right(), d);
                        if (r != null)
                            return derive(g, BasicRules.CONJUNCTION_INTRODUCTION, "Both conjuncts hold", l, r);
                    }
                    case OR -> {
                        var l = solve(b.left(), d);
                        if (l != null)
                            return derive(g, BasicRules.DISJUNCTION_INTRODUCTION, "Left disjunct holds", l);
                        var r = solve(b.right(), d);
                        if (r != null)
                            return derive(g, BasicRules.DISJUNCTION_INTRODUCTION, "Right disjunct holds", r);
                    }
                    case IFF -> {
                        var l = solve(Formula.implies(b.left(), b.right()), d);
                        var r = l == null ? null : solve(Formula.implies(b.right(), b.left()), d);
                        if (r != null)
                            return trace.derive(g, "BiconditionalIntroduction", "Both directions hold", l, r);
                    }
                    case IMPLIES -> {
                        // φ → χ from φ → ψ in the knowledge base and ψ → χ
                        for (var p : kb.all()) {
                            if (p instanceof BinaryFormula pb && pb.operator() == LogicOperator.IMPLIES
                                    && pb.left().equals(b.left()) && !pb.right().equals(b.right())) {
                                var rest = solve(Formula.implies(pb.right(), b.right()), d);
                                if (rest != null)
                                    return derive(g, BasicRules.HYPOTHETICAL_SYLLOGISM, "Chained implications",
                                            trace.handle(p).orElseThrow(), rest);
                            }
                        }
                    }
                    default -> {
                    }
                }
            } else if (g instanceof Formula.UnaryFormula u && u.formula() instanceof Formula.UnaryFormula uu) {
                var inner = solve(uu.formula(), d);
                if (inner != null)
                    return derive(g, BasicRules.DOUBLE_NEGATION_INTRODUCTION, "Double negation", inner);
            }
            return null;
        }

        /** ψ from φ → ψ in the knowledge base and φ. */
        private @Nullable Integer modusPonens(Formula g, int d) {
            for (var p : kb.all()) {
                if (p instanceof BinaryFormula b && b.operator() == LogicOperator.IMPLIES && b.right().equals(g)) {
                    var ante = solve(b.left(), d);
                    if (ante != null)
                        return derive(g, BasicRules.MODUS_PONENS, "Antecedent established", ante, trace.handle(p).orElseThrow());
                }
            }
            return null;
        }

        /** Goals matching a universally quantified fact, or the consequent of a universal implication. */
        private @Nullable Integer universal(Formula g, int d) {
            for (var u : universals) {
                budget.check();
                var vars = u.names();
                var fact = Unifier.match(u.body(), g, vars, Map.of());
                if (fact != null) {
                    for (var binding : complete(u, fact)) {
                        var inst = instantiate(u, binding);
                        if (inst != null && trace.step(inst).formula().equals(g)) return inst;
                    }
                }
                if (u.body() instanceof BinaryFormula b && b.operator() == LogicOperator.IMPLIES) {
                    var m = Unifier.match(b.right(), g, vars, Map.of());
                    if (m == null) continue;
                    for (var binding : complete(u, m)) {
                        var antecedent = Unifier.subst(b.left(), binding);
                        var ante = solve(antecedent, d);
                        if (ante == null) continue;
                        var inst = instantiate(u, binding);
                        if (inst == null) continue;
                        return derive(g, BasicRules.MODUS_PONENS, "Antecedent of instantiated rule established", ante, inst);
                    }
                }
            }
            return null;
        }

        /** Extends a partial binding to every quantified variable, enumerating ground terms for unbound ones. */
        private List<Map<String, Term>> complete(Universal u, Map<String, Term> partial) {
            var out = new ArrayList<Map<String, Term>>();
            out.add(new HashMap<>(partial));
            for (var v : u.variables()) {
                if (partial.containsKey(v.name())) continue;
                var candidates = groundTerms.isEmpty() ? List.<Term>of(Term.constant(v.name())) : List.copyOf(groundTerms);
                var next = new ArrayList<Map<String, Term>>();
                for (var m : out)
                    for (var t : candidates) {
                        var e = new HashMap<>(m);
                        e.put(v.name(), t);
                        next.add(e);
                    }
                out = next;
            }
            return out;
        }

        /** Records one universal-instantiation step per quantifier; returns the handle of the instance. */
        private @Nullable Integer instantiate(Universal u, Map<String, Term> binding) {
            var ui = BasicRules.UNIVERSAL_INSTANTIATION;
            var current = u.original();
            var h = trace.handle(current).orElseThrow();
            for (var v : u.variables()) {
                var t = binding.get(v.name());
                if (t == null) return null;
                current = ui.instantiate(current, t);
                h = trace.derive(current, ui.name(), "Instantiate " + v.name() + " with " + t.name(), h);
            }
            return h;
        }

        /** ¬φ from φ → ψ in the knowledge base and ¬ψ. */
        private @Nullable Integer modusTollens(Formula g, int d) {
            if (!(g instanceof Formula.UnaryFormula u)) return null;
            for (var p : kb.all()) {
                if (p instanceof BinaryFormula b && b.operator() == LogicOperator.IMPLIES && b.left().equals(u.formula())) {
                    var neg = solve(Formula.not(b.right()), d);
                    if (neg != null)
                        return derive(g, BasicRules.MODUS_TOLLENS, "Consequent refuted", trace.handle(p).orElseThrow(), neg);
                }
            }
            return null;
        }

        /** ψ from φ ∨ ψ in the knowledge base and ¬φ (either side). */
        private @Nullable Integer disjunctiveSyllogism(Formula g, int d) {
            for (var p : kb.all()) {
                if (!(p instanceof BinaryFormula b) || b.operator() != LogicOperator.OR) continue;
                Formula other = b.right().equals(g) ? b.left() : b.left().equals(g) ? b.right() : null;
                if (other == null) continue;
                var neg = solve(Formula.not(other), d);
                if (neg != null)
                    return derive(g, BasicRules.DISJUNCTIVE_SYLLOGISM, "Other disjunct refuted", trace.handle(p).orElseThrow(), neg);
            }
            return null;
        }

        /** One application of a unary rule to a knowledge-base formula. */
        private @Nullable Integer unary(Formula g) {
            for (var p : kb.all()) {
                for (var rule : unaryRules) {
                    if (rule.necessitation() && !kb.isTheorem(p)) continue;
                    if (rule.canApply(p) && rule.apply(p).equals(g))
                        return derive(g, rule, "By " + rule.name() + ": " + rule.description(), trace.handle(p).orElseThrow());
                }
            }
            return null;
        }

        /** □ψ from □(φ → ψ) and □φ; likewise for O. Also Oψ through contrary-to-duty obligations. */
        private @Nullable Integer modal(Formula g, int d) {
            if (g instanceof Formula.TemporalFormula t && t.operator() == Formula.TemporalOperator.ALWAYS) {
                for (var p : kb.all()) {
                    if (p instanceof Formula.TemporalFormula pt && pt.operator() == Formula.TemporalOperator.ALWAYS
                            && pt.formula() instanceof BinaryFormula b && b.operator() == LogicOperator.IMPLIES
                            && b.right().equals(t.formula())) {
                        var ante = solve(Formula.always(b.left()), d);
                        if (ante != null)
                            return derive(g, TemporalRules.TEMPORAL_K_AXIOM, "Necessary implication with necessary antecedent",
                                    trace.handle(p).orElseThrow(), ante);
                    }
                }
            }
            if (g instanceof Formula.DeonticFormula o && o.operator() == Formula.DeonticOperator.OBLIGATION) {
                for (var p : kb.all()) {
                    if (p instanceof Formula.DeonticFormula po && po.operator() == Formula.DeonticOperator.OBLIGATION
                            && po.formula() instanceof BinaryFormula b && b.operator() == LogicOperator.IMPLIES
                            && b.right().equals(o.formula())) {
                        var ante = solve(Formula.obligation(b.left()), d);
                        if (ante != null)
                            return derive(g, DeonticRules.DEONTIC_K_AXIOM, "Obligatory implication with obligatory antecedent",
                                    trace.handle(p).orElseThrow(), ante);
                    }
                    // Oφ, ¬φ, ¬φ → Oψ ⊢ Oψ
                    if (p instanceof BinaryFormula b && b.operator() == LogicOperator.IMPLIES && b.right().equals(g)
                            && b.left() instanceof Formula.UnaryFormula violated) {
                        var duty = solve(Formula.obligation(violated.formula()), d);
                        var violation = duty == null ? null : solve(b.left(), d);
                        if (violation != null)
                            return derive(g, CombinedRules.CONTRARY_TO_DUTY, "Primary obligation violated",
                                    duty, violation, trace.handle(p).orElseThrow());
                    }
                }
            }
            return null;
        }
    }
}
