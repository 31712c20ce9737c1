package dumb.tdfol.convert;

import dumb.tdfol.Formula;
import dumb.tdfol.Formula.*;
import dumb.tdfol.Term;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Exports to other logical notations: plain first-order logic, TPTP {@code fof} and Prolog clauses.
 */
public enum FormulaConverters {
    ;

    /** Drops deontic and temporal operators; U, S, W and R become the conjunction of their sides. */
    public static Formula toFol(Formula f) {
        if (f instanceof Predicate) return f;
        if (f instanceof UnaryFormula u) return Formula.not(toFol(u.formula()));
        if (f instanceof BinaryFormula b) return new BinaryFormula(b.operator(), toFol(b.left()), toFol(b.right()));
        if (f instanceof QuantifiedFormula q) return new QuantifiedFormula(q.quantifier(), q.variable(), toFol(q.formula()));
        if (f instanceof DeonticFormula d) return toFol(d.formula());
        if (f instanceof TemporalFormula t) return toFol(t.formula());
        var bt = (BinaryTemporalFormula) f;
        return Formula.and(toFol(bt.left()), toFol(bt.right()));
    }

    /** {@code fof(name, role, formula).} over the first-order projection of {@code f}. */
    public static String toTptp(Formula f, String name, String role) {
        return "fof(" + lowerWord(name) + ", " + role + ", " + tptp(toFol(f)) + ").";
    }

    private static String tptp(Formula f) {
        if (f instanceof Predicate p) {
            var head = lowerWord(p.name());
            if (p.args().isEmpty()) return head;
            return head + p.args().stream().map(FormulaConverters::tptp).collect(Collectors.joining(",", "(", ")"));
        }
        if (f instanceof UnaryFormula u) return "~(" + tptp(u.formula()) + ")";
        if (f instanceof BinaryFormula b) {
            var op = switch (b.operator()) {
                case AND -> " & ";
                case OR -> " | ";
                case IMPLIES -> " => ";
                case IFF -> " <=> ";
                case NOT -> throw new IllegalStateException("NOT is unary");
            };
            return "(" + tptp(b.left()) + op + tptp(b.right()) + ")";
        }
        if (f instanceof QuantifiedFormula q) {
            var sym = q.quantifier() == Quantifier.FORALL ? "!" : "?";
            return sym + "[" + upperWord(q.variable().name()) + "] : " + tptp(q.formula());
        }
        throw new IllegalArgumentException("Not first-order: " + f.toText());
    }

    private static String tptp(Term t) {
        if (t instanceof Term.Variable v) return upperWord(v.name());
        if (t instanceof Term.Constant c) return lowerWord(c.name());
        var fa = (Term.FunctionApplication) t;
        return lowerWord(fa.name()) + fa.args().stream().map(FormulaConverters::tptp).collect(Collectors.joining(",", "(", ")"));
    }

    static String upperWord(String name) {
        var s = word(name);
        return Character.isUpperCase(s.charAt(0)) ? s : Character.isLetter(s.charAt(0))
                ? Character.toUpperCase(s.charAt(0)) + s.substring(1) : "V" + s;
    }

    static String lowerWord(String name) {
        var s = word(name);
        if (Character.isLowerCase(s.charAt(0))) return s;
        if (Character.isUpperCase(s.charAt(0))) return Character.toLowerCase(s.charAt(0)) + s.substring(1);
        return "'" + name.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private static String word(String name) {
        var sb = new StringBuilder(name.length());
        for (var i = 0; i < name.length(); i++) {
            var c = name.charAt(i);
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        return sb.isEmpty() ? "_" : sb.toString();
    }

    /**
     * A fact or a Horn clause (universally closed atoms, or an implication from a conjunction of atoms to an atom).
     * Anything else has no Prolog form.
     */
    public static Optional<String> toProlog(Formula f) {
        var body = f;
        while (body instanceof QuantifiedFormula q && q.quantifier() == Quantifier.FORALL) body = q.formula();

        if (body instanceof Predicate p) return Optional.of(prolog(p) + ".");
        if (body instanceof BinaryFormula b && b.operator() == LogicOperator.IMPLIES && b.right() instanceof Predicate head) {
            var goals = new ArrayList<Predicate>();
            if (!conjuncts(b.left(), goals)) return Optional.empty();
            return Optional.of(prolog(head) + " :- " + goals.stream().map(FormulaConverters::prolog).collect(Collectors.joining(", ")) + ".");
        }
        return Optional.empty();
    }

    private static boolean conjuncts(Formula f, List<Predicate> out) {
        if (f instanceof Predicate p) {
            out.add(p);
            return true;
        }
        return f instanceof BinaryFormula b && b.operator() == LogicOperator.AND
                && conjuncts(b.left(), out) && conjuncts(b.right(), out);
    }

    private static String prolog(Predicate p) {
        var head = lowerWord(p.name());
        if (p.args().isEmpty()) return head;
        return head + p.args().stream().map(FormulaConverters::prolog).collect(Collectors.joining(", ", "(", ")"));
    }

    private static String prolog(Term t) {
        if (t instanceof Term.Variable v) return upperWord(v.name());
        if (t instanceof Term.Constant c) return lowerWord(c.name());
        var fa = (Term.FunctionApplication) t;
        return lowerWord(fa.name()) + fa.args().stream().map(FormulaConverters::prolog).collect(Collectors.joining(", ", "(", ")"));
    }

    public static JSONObject toJson(Formula f) {
        return f.toJson();
    }
}
