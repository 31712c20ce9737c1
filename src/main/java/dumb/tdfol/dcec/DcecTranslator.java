package dumb.tdfol.dcec;

import dumb.tdfol.Formula;
import dumb.tdfol.Term;
import dumb.tdfol.parse.FormulaSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Maps DCEC S-expressions onto formulas and back.
 * <p>
 * Modal forms may carry agent and time indices before the formula, as in {@code (O agent t phi)}; the
 * formula is always the last argument and the indices are dropped.
 */
public final class DcecTranslator {

    private final Deque<String> scope = new ArrayDeque<>();

    private DcecTranslator() {
    }

    public static Formula toFormula(String text) throws FormulaSyntaxException {
        return toFormula(SexprReader.readOne(text));
    }

    public static Formula toFormula(Sexpr expr) throws FormulaSyntaxException {
        return new DcecTranslator().formula(requireNonNull(expr));
    }

    public static String toDcec(Formula f) {
        return toSexpr(f).toText();
    }

    private Formula formula(Sexpr e) throws FormulaSyntaxException {
        if (e instanceof Sexpr.Atom a) return new Formula.Predicate(a.value(), List.of());
        var l = (Sexpr.Lst) e;
        var op = l.op().orElseThrow(() -> new FormulaSyntaxException("DCEC form must start with a symbol: " + l.toText()));
        switch (op) {
            case "and", "or", "implies", "if", "iff" -> {
                arity(l, 2, Integer.MAX_VALUE);
                var acc = formula(l.get(1));
                for (var i = 2; i < l.size(); i++) {
                    var next = formula(l.get(i));
                    acc = switch (op) {
                        case "and" -> Formula.and(acc, next);
                        case "or" -> Formula.or(acc, next);
                        case "iff" -> Formula.iff(acc, next);
                        default -> Formula.implies(acc, next);
                    };
                }
                return acc;
            }
            case "not" -> {
                arity(l, 1, 1);
                return Formula.not(formula(l.get(1)));
            }
            case "forall", "exists" -> {
                arity(l, 2, 2);
                var names = boundNames(l.get(1));
                names.forEach(scope::push);
                try {
                    var body = formula(l.get(2));
                    for (var i = names.size() - 1; i >= 0; i--) {
                        var v = Term.var(names.get(i));
                        body = op.equals("forall") ? Formula.forall(v, body) : Formula.exists(v, body);
                    }
                    return body;
                } finally {
                    names.forEach(n -> scope.pop());
                }
            }
            case "O", "obligatory", "ought" -> {
                return Formula.obligation(last(l));
            }
            case "P", "permitted" -> {
                return Formula.permission(last(l));
            }
            case "F", "forbidden" -> {
                return Formula.prohibition(last(l));
            }
            case "always", "G" -> {
                return Formula.always(last(l));
            }
            case "eventually" -> {
                return Formula.eventually(last(l));
            }
            case "next", "X" -> {
                return Formula.next(last(l));
            }
            case "until", "since", "weak-until", "release" -> {
                arity(l, 2, 2);
                var left = formula(l.get(1));
                var right = formula(l.get(2));
                return switch (op) {
                    case "until" -> Formula.until(left, right);
                    case "since" -> Formula.since(left, right);
                    case "weak-until" -> Formula.weakUntil(left, right);
                    default -> Formula.release(left, right);
                };
            }
            default -> {
                var args = new ArrayList<Term>();
                for (var i = 1; i < l.size(); i++) args.add(term(l.get(i)));
                return new Formula.Predicate(op, args);
            }
        }
    }

    private Formula last(Sexpr.Lst l) throws FormulaSyntaxException {
        arity(l, 1, Integer.MAX_VALUE);
        return formula(l.get(l.size() - 1));
    }

    private static void arity(Sexpr.Lst l, int min, int max) throws FormulaSyntaxException {
        var n = l.size() - 1;
        if (n < min || n > max)
            throw new FormulaSyntaxException("Wrong number of arguments for '" + l.op().orElse("?") + "': " + l.toText());
    }

    private static List<String> boundNames(Sexpr vars) throws FormulaSyntaxException {
        var out = new ArrayList<String>();
        if (vars instanceof Sexpr.Atom a) {
            out.add(strip(a.value()));
        } else {
            for (var item : ((Sexpr.Lst) vars).items()) {
                if (!(item instanceof Sexpr.Atom a))
                    throw new FormulaSyntaxException("Malformed quantifier variable list: " + vars.toText());
                out.add(strip(a.value()));
            }
        }
        if (out.isEmpty()) throw new FormulaSyntaxException("Quantifier binds no variables");
        return out;
    }

    private static String strip(String name) {
        return name.startsWith("?") ? name.substring(1) : name;
    }

    private Term term(Sexpr e) throws FormulaSyntaxException {
        if (e instanceof Sexpr.Atom a) {
            var v = a.value();
            if (v.startsWith("?") || scope.contains(v)) return Term.var(strip(v));
            return Term.constant(v);
        }
        var l = (Sexpr.Lst) e;
        var name = l.op().orElseThrow(() -> new FormulaSyntaxException("Function term must start with a symbol: " + l.toText()));
        var args = new ArrayList<Term>();
        for (var i = 1; i < l.size(); i++) args.add(term(l.get(i)));
        return new Term.FunctionApplication(name, args);
    }

    private static Sexpr toSexpr(Formula f) {
        if (f instanceof Formula.Predicate p) {
            if (p.args().isEmpty()) return atom(p.name());
            var items = new ArrayList<Sexpr>();
            items.add(atom(p.name()));
            p.args().forEach(t -> items.add(toSexpr(t)));
            return new Sexpr.Lst(items);
        }
        if (f instanceof Formula.UnaryFormula u) return new Sexpr.Lst(atom("not"), toSexpr(u.formula()));
        if (f instanceof Formula.BinaryFormula b) {
            var op = switch (b.operator()) {
                case AND -> "and";
                case OR -> "or";
                case IFF -> "iff";
                default -> "implies";
            };
            return new Sexpr.Lst(atom(op), toSexpr(b.left()), toSexpr(b.right()));
        }
        if (f instanceof Formula.QuantifiedFormula q) {
            var op = q.quantifier() == Formula.Quantifier.FORALL ? "forall" : "exists";
            return new Sexpr.Lst(atom(op), new Sexpr.Lst(atom(q.variable().name())), toSexpr(q.formula()));
        }
        if (f instanceof Formula.DeonticFormula d) {
            var op = switch (d.operator()) {
                case OBLIGATION -> "O";
                case PERMISSION -> "P";
                case PROHIBITION -> "F";
            };
            return new Sexpr.Lst(atom(op), toSexpr(d.formula()));
        }
        if (f instanceof Formula.TemporalFormula t) {
            var op = switch (t.operator()) {
                case ALWAYS -> "always";
                case EVENTUALLY -> "eventually";
                default -> "next";
            };
            return new Sexpr.Lst(atom(op), toSexpr(t.formula()));
        }
        var bt = (Formula.BinaryTemporalFormula) f;
        var op = switch (bt.operator()) {
            case UNTIL -> "until";
            case SINCE -> "since";
            case WEAK_UNTIL -> "weak-until";
            default -> "release";
        };
        return new Sexpr.Lst(atom(op), toSexpr(bt.left()), toSexpr(bt.right()));
    }

    private static Sexpr toSexpr(Term t) {
        if (t instanceof Term.FunctionApplication fa) {
            var items = new ArrayList<Sexpr>();
            items.add(atom(fa.name()));
            fa.args().forEach(a -> items.add(toSexpr(a)));
            return new Sexpr.Lst(items);
        }
        return atom(t.name());
    }

    private static Sexpr.Atom atom(String s) {
        return new Sexpr.Atom(s);
    }
}
