package dumb.tdfol;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNullElse;

/**
 * Matching and unification over terms and formulas. Only variables whose names are in the supplied
 * set are bindable; every other variable behaves like a constant. Failure is signalled by {@code null}.
 */
public enum Unifier {
    ;

    private static final int MAX_SUBST_DEPTH = 50;

    @Nullable
    public static Map<String, Term> unify(Term x, Term y, Set<String> vars, Map<String, Term> bindings) {
        return unifyRecursive(x, y, vars, bindings, 0);
    }

    /** One-way match: binds variables of {@code pattern} only. */
    @Nullable
    public static Map<String, Term> match(Formula pattern, Formula target, Set<String> vars, Map<String, Term> bindings) {
        return matchFormula(pattern, target, vars, bindings, 0);
    }

    public static Term subst(Term term, Map<String, Term> bindings) {
        return substRecursive(term, bindings, 0);
    }

    public static Formula subst(Formula f, Map<String, Term> bindings) {
        var out = f;
        for (var e : bindings.entrySet()) out = out.substitute(e.getKey(), subst(e.getValue(), bindings));
        return out;
    }

    @Nullable
    private static Map<String, Term> matchFormula(Formula p, Formula t, Set<String> vars, Map<String, Term> b, int depth) {
        if (b == null || depth > MAX_SUBST_DEPTH) return null;
        if (p instanceof Formula.Predicate pp && t instanceof Formula.Predicate tp) {
            if (!pp.name().equals(tp.name()) || pp.arity() != tp.arity()) return null;
            var cur = b;
            for (var i = 0; i < pp.arity() && cur != null; i++)
                cur = matchTerm(pp.args().get(i), tp.args().get(i), vars, cur, depth + 1);
            return cur;
        }
        if (p instanceof Formula.QuantifiedFormula pq && t instanceof Formula.QuantifiedFormula tq) {
            if (pq.quantifier() != tq.quantifier()) return null;
            // align bound variables before descending
            var body = tq.instantiate(pq.variable());
            return vars.contains(pq.variable().name()) ? null : matchFormula(pq.formula(), body, vars, b, depth + 1);
        }
        if (!sameShape(p, t)) return null;
        var pc = p.children();
        var tc = t.children();
        var cur = b;
        for (var i = 0; i < pc.size() && cur != null; i++)
            cur = matchFormula(pc.get(i), tc.get(i), vars, cur, depth + 1);
        return cur;
    }

    private static boolean sameShape(Formula p, Formula t) {
        if (p.getClass() != t.getClass()) return false;
        if (p instanceof Formula.UnaryFormula) return true;
        if (p instanceof Formula.BinaryFormula pb) return pb.operator() == ((Formula.BinaryFormula) t).operator();
        if (p instanceof Formula.DeonticFormula pd) return pd.operator() == ((Formula.DeonticFormula) t).operator();
        if (p instanceof Formula.TemporalFormula pt) return pt.operator() == ((Formula.TemporalFormula) t).operator();
        if (p instanceof Formula.BinaryTemporalFormula pbt)
            return pbt.operator() == ((Formula.BinaryTemporalFormula) t).operator();
        return false;
    }

    @Nullable
    private static Map<String, Term> matchTerm(Term pattern, Term term, Set<String> vars, Map<String, Term> bindings, int depth) {
        if (bindings == null || depth > MAX_SUBST_DEPTH) return null;
        var p = substRecursive(pattern, bindings, depth + 1);
        if (p instanceof Term.Variable v && vars.contains(v.name())) return bind(v.name(), term, vars, bindings, false, depth);
        if (p.equals(term)) return bindings;
        if (p instanceof Term.FunctionApplication fp && term instanceof Term.FunctionApplication ft
                && fp.name().equals(ft.name()) && fp.args().size() == ft.args().size()) {
            var cur = bindings;
            for (var i = 0; i < fp.args().size() && cur != null; i++)
                cur = matchTerm(fp.args().get(i), ft.args().get(i), vars, cur, depth + 1);
            return cur;
        }
        return null;
    }

    @Nullable
    private static Map<String, Term> unifyRecursive(Term x, Term y, Set<String> vars, Map<String, Term> bindings, int depth) {
        if (bindings == null || depth > MAX_SUBST_DEPTH) return null;
        var xs = substRecursive(x, bindings, depth + 1);
        var ys = substRecursive(y, bindings, depth + 1);
        if (xs.equals(ys)) return bindings;
        if (xs instanceof Term.Variable vx && vars.contains(vx.name())) return bind(vx.name(), ys, vars, bindings, true, depth);
        if (ys instanceof Term.Variable vy && vars.contains(vy.name())) return bind(vy.name(), xs, vars, bindings, true, depth);
        if (xs instanceof Term.FunctionApplication fx && ys instanceof Term.FunctionApplication fy
                && fx.name().equals(fy.name()) && fx.args().size() == fy.args().size()) {
            var cur = bindings;
            for (var i = 0; i < fx.args().size() && cur != null; i++)
                cur = unifyRecursive(fx.args().get(i), fy.args().get(i), vars, cur, depth + 1);
            return cur;
        }
        return null;
    }

    @Nullable
    private static Map<String, Term> bind(String var, Term value, Set<String> vars, Map<String, Term> bindings, boolean occursCheck, int depth) {
        if (bindings.containsKey(var))
            return occursCheck ? unifyRecursive(bindings.get(var), value, vars, bindings, depth + 1)
                    : matchTerm(bindings.get(var), value, vars, bindings, depth + 1);
        var finalValue = substRecursive(value, bindings, depth + 1);
        if (occursCheck && finalValue.freeVariables().contains(var)) return null;
        var newBindings = new HashMap<>(bindings);
        newBindings.put(var, finalValue);
        return Collections.unmodifiableMap(newBindings);
    }

    private static Term substRecursive(Term term, Map<String, Term> bindings, int depth) {
        if (bindings.isEmpty() || depth > MAX_SUBST_DEPTH || term.isGround()) return term;
        if (term instanceof Term.Variable v) {
            var b = bindings.get(v.name());
            return b != null && !b.equals(v) ? substRecursive(b, bindings, depth + 1) : requireNonNullElse(b, v);
        }
        var fa = (Term.FunctionApplication) term;
        return new Term.FunctionApplication(fa.name(), fa.args().stream().map(a -> substRecursive(a, bindings, depth + 1)).toList());
    }
}
