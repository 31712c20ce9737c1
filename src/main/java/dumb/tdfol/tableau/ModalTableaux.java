package dumb.tdfol.tableau;

import dumb.tdfol.Formula;
import dumb.tdfol.Formula.BinaryTemporalFormula;
import dumb.tdfol.Formula.DeonticFormula;
import dumb.tdfol.Formula.QuantifiedFormula;
import dumb.tdfol.Formula.TemporalFormula;
import dumb.tdfol.ProofStep;
import dumb.tdfol.Term;
import dumb.tdfol.UnsupportedConstructException;
import dumb.tdfol.expand.Expansion;
import dumb.tdfol.expand.ExpansionRules;
import dumb.tdfol.expand.SignedFormula;
import dumb.tdfol.prove.Budget;
import dumb.tdfol.tableau.TableauxBranch.Box;
import dumb.tdfol.tableau.TableauxBranch.Gamma;
import dumb.tdfol.tableau.TableauxBranch.Pending;
import dumb.tdfol.tableau.TableauxBranch.Relation;
import dumb.tdfol.util.Log;
import org.jetbrains.annotations.Nullable;

import java.util.*;

import static dumb.tdfol.expand.SignedFormula.neg;
import static dumb.tdfol.expand.SignedFormula.pos;

/**
 * Labelled tableau prover over Kripke frames with a temporal and a deontic accessibility relation.
 * <p>
 * A proof is a refutation: the goal is asserted false at the root world, and the goal is valid when every
 * branch closes. Branches wait on an explicit work-list and are expanded depth first; within a branch the
 * non-branching obligations are exhausted before a fork is taken. Eventualities (U, and W and R through it) are
 * unfolded at most {@code maxDepth} times per branch; a branch that hits that bound, or the world limit, is
 * marked incomplete and never counts as a countermodel.
 */
public class ModalTableaux {

    private final ModalLogicType logic;
    private final int maxBranches;
    private final int maxWorlds;

    public ModalTableaux(ModalLogicType logic) {
        this(logic, 2000, 64);
    }

    public ModalTableaux(ModalLogicType logic, int maxBranches, int maxWorlds) {
        this.logic = Objects.requireNonNull(logic);
        this.maxBranches = maxBranches;
        this.maxWorlds = maxWorlds;
    }

    public ModalLogicType logic() {
        return logic;
    }

    /** Tries to close every branch rooted at the assumptions (true at world 0) and the negated goal. */
    public TableauxResult prove(Formula goal, Collection<Formula> assumptions, Budget budget) {
        var roots = new ArrayList<SignedFormula>();
        for (var a : assumptions) roots.add(pos(a));
        roots.add(neg(goal));
        return refute(roots, budget);
    }

    public TableauxResult refute(List<SignedFormula> roots, Budget budget) {
        return new Run(budget).run(roots);
    }

    private final class Run {
        private final Budget budget;
        private final List<ProofStep> steps = new ArrayList<>();
        private int branchIds;

        Run(Budget budget) {
            this.budget = budget;
        }

        TableauxResult run(List<SignedFormula> roots) {
            var root = new TableauxBranch(branchIds++);
            root.createWorld(-1);
            for (var r : roots) {
                root.alpha.add(new Pending(0, r));
                steps.add(new ProofStep(r.formula(), r.negated() ? "Assumed false at w0" : "Assumed true at w0", "Root"));
            }

            var work = new ArrayDeque<TableauxBranch>();
            work.push(root);
            int total = 1, closed = 0;
            var incomplete = false;
            TableauxBranch open = null;

            while (!work.isEmpty()) {
                budget.check();
                var b = work.pop();
                var forks = saturate(b);
                if (b.isClosed()) {
                    closed++;
                    b.closure().ifPresent(steps::add);
                } else if (forks != null) {
                    total += forks.size() - 1;
                    if (total > maxBranches) {
                        Log.warning("Tableau branch limit " + maxBranches + " reached");
                        incomplete = true;
                        break;
                    }
                    for (var i = forks.size() - 1; i >= 0; i--) work.push(forks.get(i));
                } else if (!b.isIncomplete()) {
                    return new TableauxResult(false, true, total, closed, steps, b);
                } else {
                    incomplete = true;
                    if (open == null) open = b;
                }
            }
            var valid = !incomplete && work.isEmpty();
            return new TableauxResult(valid, valid, total, closed, steps, open);
        }

        /**
         * Expands until the branch closes, saturates (returns null) or forks (returns the alternatives,
         * the first of which is {@code b} itself).
         */
        @Nullable List<TableauxBranch> saturate(TableauxBranch b) {
            while (!b.isClosed()) {
                budget.check();
                var p = b.alpha.poll();
                if (p != null) {
                    process(b, p);
                    continue;
                }
                if (instantiateGammas(b)) continue;

                var q = b.beta.poll();
                if (q == null) return null;
                var alternatives = alternatives(b, q.formula());
                if (alternatives == null) continue;

                var out = new ArrayList<TableauxBranch>(alternatives.size());
                out.add(b);
                for (var i = 1; i < alternatives.size(); i++) out.add(b.copy(branchIds++));
                for (var i = 0; i < alternatives.size(); i++)
                    for (var f : alternatives.get(i)) out.get(i).alpha.add(new Pending(q.world(), f));
                return out;
            }
            return null;
        }

        private void process(TableauxBranch b, Pending p) {
            var w = b.world(p.world());
            var s = p.formula();
            if (!w.add(s)) return;
            if (w.contains(s.flip())) {
                b.close(new ProofStep(s.formula(), "Branch " + b.id() + " closed: asserted and denied at w" + w.id(), "Closure"));
                return;
            }

            var f = s.formula();
            if (f instanceof Formula.Predicate pr) {
                for (var t : pr.terms()) if (t.isGround()) addTerm(b, t);
            } else if (f instanceof Formula.UnaryFormula || f instanceof Formula.BinaryFormula) {
                var e = ExpansionRules.expand(s).orElseThrow();
                if (e instanceof Expansion.Linear l) {
                    for (var x : l.formulas()) b.alpha.add(new Pending(w.id(), x));
                } else {
                    b.beta.add(p);
                }
            } else if (f instanceof QuantifiedFormula q) {
                quantified(b, w.id(), s, q);
            } else if (f instanceof DeonticFormula d) {
                deontic(b, w.id(), s, d);
            } else if (f instanceof TemporalFormula t) {
                temporal(b, w.id(), s, t);
            } else if (f instanceof BinaryTemporalFormula bt) {
                binaryTemporal(b, w.id(), s, bt);
            }
        }

        private void addTerm(TableauxBranch b, Term t) {
            if (b.constants.contains(t)) return;
            if (b.constants.size() >= maxWorlds) {
                b.markIncomplete();
                return;
            }
            b.constants.add(t);
        }

        private void quantified(TableauxBranch b, int w, SignedFormula s, QuantifiedFormula q) {
            var universal = (q.quantifier() == Formula.Quantifier.FORALL) != s.negated();
            if (universal) {
                b.gammas.add(new Gamma(w, s, q));
                return;
            }
            if (b.skolems() >= maxWorlds) {
                b.markIncomplete();
                return;
            }
            var c = Term.constant("sk_" + b.nextSkolem());
            b.constants.add(c);
            b.alpha.add(new Pending(w, new SignedFormula(q.instantiate(c), s.negated())));
        }

        private boolean instantiateGammas(TableauxBranch b) {
            if (b.gammas.isEmpty()) return false;
            if (b.constants.isEmpty()) b.constants.add(Term.constant("c"));
            var any = false;
            for (var g : b.gammas) {
                for (var c : List.copyOf(b.constants)) {
                    if (g.used.add(c)) {
                        b.alpha.add(new Pending(g.world, new SignedFormula(g.quantified.instantiate(c), g.formula.negated())));
                        any = true;
                    }
                }
            }
            return any;
        }

        private void deontic(TableauxBranch b, int w, SignedFormula s, DeonticFormula d) {
            var body = d.formula();
            switch (d.operator()) {
                case OBLIGATION -> {
                    if (s.negated()) diamond(b, w, Relation.DEONTIC, neg(body));
                    else box(b, w, Relation.DEONTIC, pos(body), s);
                }
                case PERMISSION -> {
                    if (s.negated()) box(b, w, Relation.DEONTIC, neg(body), s);
                    else diamond(b, w, Relation.DEONTIC, pos(body));
                }
                case PROHIBITION -> {
                    if (s.negated()) diamond(b, w, Relation.DEONTIC, pos(body));
                    else box(b, w, Relation.DEONTIC, neg(body), s);
                }
            }
        }

        private void temporal(TableauxBranch b, int w, SignedFormula s, TemporalFormula t) {
            var body = t.formula();
            switch (t.operator()) {
                case ALWAYS -> {
                    if (s.negated()) diamond(b, w, Relation.TEMPORAL, neg(body));
                    else box(b, w, Relation.TEMPORAL, pos(body), s);
                }
                case EVENTUALLY -> {
                    if (s.negated()) box(b, w, Relation.TEMPORAL, neg(body), s);
                    else diamond(b, w, Relation.TEMPORAL, pos(body));
                }
                case NEXT -> next(b, w, new SignedFormula(body, s.negated()));
                default -> throw new IllegalStateException("Binary operator in unary position: " + t.operator());
            }
        }

        private void binaryTemporal(TableauxBranch b, int w, SignedFormula s, BinaryTemporalFormula bt) {
            switch (bt.operator()) {
                case UNTIL -> b.beta.add(new Pending(w, s));
                case WEAK_UNTIL -> {
                    if (s.negated()) {
                        b.alpha.add(new Pending(w, neg(Formula.until(bt.left(), bt.right()))));
                        b.alpha.add(new Pending(w, neg(Formula.always(bt.left()))));
                    } else {
                        b.beta.add(new Pending(w, s));
                    }
                }
                // φRψ ≡ ¬(¬φ U ¬ψ)
                case RELEASE -> b.alpha.add(new Pending(w,
                        new SignedFormula(Formula.until(Formula.not(bt.left()), Formula.not(bt.right())), !s.negated())));
                case SINCE -> throw new UnsupportedConstructException("Past-time operator not supported by the tableau", bt);
                default -> throw new IllegalStateException("Unary operator in binary position: " + bt.operator());
            }
        }

        private @Nullable List<List<SignedFormula>> alternatives(TableauxBranch b, SignedFormula s) {
            if (s.formula() instanceof BinaryTemporalFormula bt) {
                var l = bt.left();
                var r = bt.right();
                if (bt.operator() == Formula.TemporalOperator.WEAK_UNTIL)
                    return List.of(List.of(pos(Formula.until(l, r))), List.of(pos(Formula.always(l))));
                if (!b.unfold(s, budget.maxDepth())) {
                    b.markIncomplete();
                    return null;
                }
                var again = Formula.next(bt);
                return s.negated()
                        ? List.of(List.of(neg(r), neg(l)), List.of(neg(r), neg(again)))
                        : List.of(List.of(pos(r)), List.of(pos(l), pos(again)));
            }
            return ExpansionRules.expand(s).orElseThrow().branches();
        }

        private void box(TableauxBranch b, int w, Relation rel, SignedFormula body, SignedFormula origin) {
            var box = new Box(w, rel, body, origin);
            b.boxes.add(box);
            if (rel == Relation.TEMPORAL && logic.reflexive) b.alpha.add(new Pending(w, body));
            var successors = b.accessibleWorlds(w, rel);
            for (var v : successors) propagate(b, box, v);
            if (successors.isEmpty() && serial(rel)) {
                if (b.worldCount() >= maxWorlds) {
                    b.markIncomplete();
                    return;
                }
                addEdge(b, w, b.createWorld(w), rel);
            }
        }

        private boolean serial(Relation rel) {
            return rel == Relation.DEONTIC || logic.serial;
        }

        private void propagate(TableauxBranch b, Box box, int v) {
            b.alpha.add(new Pending(v, box.body()));
            if (box.relation() == Relation.TEMPORAL && logic.transitive) b.alpha.add(new Pending(v, box.origin()));
        }

        private void addEdge(TableauxBranch b, int from, int to, Relation rel) {
            if (!b.addAccessibility(from, to, rel)) return;
            for (var i = 0; i < b.boxes.size(); i++) {
                var box = b.boxes.get(i);
                if (box.world() == from && box.relation() == rel) propagate(b, box, to);
            }
            if (rel == Relation.TEMPORAL && logic.symmetric) addEdge(b, to, from, rel);
        }

        private void diamond(TableauxBranch b, int w, Relation rel, SignedFormula body) {
            for (var v : b.accessibleWorlds(w, rel))
                if (b.world(v).contains(body)) return;

            if (rel == Relation.TEMPORAL && logic.transitive) {
                // subset blocking: an ancestor already holding everything the witness would start with
                var needed = new ArrayList<SignedFormula>();
                needed.add(body);
                for (var box : b.boxes)
                    if (box.world() == w && box.relation() == rel) {
                        needed.add(box.body());
                        needed.add(box.origin());
                    }
                for (Integer u = logic.reflexive ? Integer.valueOf(w) : b.parent(w); u != null; u = b.parent(u)) {
                    if (b.world(u).containsAll(needed)) {
                        addEdge(b, w, u, rel);
                        return;
                    }
                }
            }

            if (b.worldCount() >= maxWorlds) {
                b.markIncomplete();
                return;
            }
            var v = b.createWorld(w);
            addEdge(b, w, v, rel);
            b.alpha.add(new Pending(v, body));
        }

        private void next(TableauxBranch b, int w, SignedFormula body) {
            var v = b.next(w);
            if (v == null) {
                if (b.worldCount() >= maxWorlds) {
                    b.markIncomplete();
                    return;
                }
                v = b.createWorld(w);
                b.setNext(w, v);
                addEdge(b, w, v, Relation.TEMPORAL);
            }
            b.alpha.add(new Pending(v, body));
        }
    }
}
