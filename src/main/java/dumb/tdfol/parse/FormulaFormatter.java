package dumb.tdfol.parse;

import dumb.tdfol.Formula;
import dumb.tdfol.Term;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders formulas in the grammar accepted by {@link FormulaParser}, so that parsing the output yields an
 * equal formula. Bound variables print bare, free variables print as {@code ?x}, and constants that would
 * read back as something else are quoted.
 */
public final class FormulaFormatter {

    private static final Pattern BARE_NAME = Pattern.compile("[a-z_][A-Za-z0-9_]*");
    private static final Pattern NUMBER = Pattern.compile("[0-9]+(\\.[0-9]+)?");

    private static final int QUANTIFIED = 0, IFF = 1, IMPLIES = 2, OR = 3, AND = 4, TEMPORAL = 5, UNARY = 6, ATOM = 7;

    private final Style style;
    private final Deque<String> scope = new ArrayDeque<>();
    private final StringBuilder out = new StringBuilder();

    private FormulaFormatter(Style style) {
        this.style = style;
    }

    public static String format(Formula f) {
        return format(f, Style.UNICODE);
    }

    public static String formatAscii(Formula f) {
        return format(f, Style.ASCII);
    }

    public static String format(Formula f, Style style) {
        var ff = new FormulaFormatter(style);
        ff.write(f);
        return ff.out.toString();
    }

    public static String format(Term t) {
        var ff = new FormulaFormatter(Style.UNICODE);
        ff.term(t);
        return ff.out.toString();
    }

    private static int precedence(Formula f) {
        if (f instanceof Formula.QuantifiedFormula) return QUANTIFIED;
        if (f instanceof Formula.BinaryFormula b) return switch (b.operator()) {
            case IFF -> IFF;
            case IMPLIES -> IMPLIES;
            case OR -> OR;
            case AND -> AND;
            case NOT -> UNARY;
        };
        if (f instanceof Formula.BinaryTemporalFormula) return TEMPORAL;
        if (f instanceof Formula.Predicate) return ATOM;
        return UNARY;
    }

    private void write(Formula f) {
        if (f instanceof Formula.Predicate p) {
            out.append(p.name());
            if (!p.args().isEmpty()) {
                out.append('(');
                for (var i = 0; i < p.args().size(); i++) {
                    if (i > 0) out.append(", ");
                    term(p.args().get(i));
                }
                out.append(')');
            }
        } else if (f instanceof Formula.UnaryFormula u) {
            out.append(style.not);
            operand(u.formula());
        } else if (f instanceof Formula.BinaryFormula b) {
            var prec = precedence(b);
            var rightAssoc = b.operator() == Formula.LogicOperator.IMPLIES;
            side(b.left(), prec, rightAssoc);
            out.append(' ').append(style.symbol(b.operator())).append(' ');
            side(b.right(), prec, !rightAssoc);
        } else if (f instanceof Formula.BinaryTemporalFormula bt) {
            side(bt.left(), TEMPORAL, false);
            out.append(' ').append(letter(bt.operator())).append(' ');
            side(bt.right(), TEMPORAL, true);
        } else if (f instanceof Formula.QuantifiedFormula q) {
            quantified(q);
        } else if (f instanceof Formula.DeonticFormula d) {
            out.append(switch (d.operator()) {
                case OBLIGATION -> 'O';
                case PERMISSION -> 'P';
                case PROHIBITION -> 'F';
            });
            wrapped(d.formula());
        } else if (f instanceof Formula.TemporalFormula t) {
            switch (t.operator()) {
                case ALWAYS -> {
                    out.append(style.always);
                    operand(t.formula());
                }
                case EVENTUALLY -> {
                    out.append(style.eventually);
                    operand(t.formula());
                }
                default -> {
                    out.append('X');
                    wrapped(t.formula());
                }
            }
        }
    }

    private static char letter(Formula.TemporalOperator op) {
        return switch (op) {
            case UNTIL -> 'U';
            case SINCE -> 'S';
            case WEAK_UNTIL -> 'W';
            case RELEASE -> 'R';
            default -> throw new IllegalArgumentException(op + " is not infix");
        };
    }

    /** Operand of a letter operator: {@code O(...)}. A lowercase predicate is doubled so it is not read as a term list. */
    private void wrapped(Formula f) {
        var termLike = f instanceof Formula.Predicate p && !Character.isUpperCase(p.name().charAt(0));
        out.append(termLike ? "((" : "(");
        write(f);
        out.append(termLike ? "))" : ")");
    }

    /** Operand of a prefix symbol such as ¬ or □. */
    private void operand(Formula f) {
        if (precedence(f) < UNARY) {
            out.append('(');
            write(f);
            out.append(')');
        } else {
            write(f);
        }
    }

    private void side(Formula child, int parentPrec, boolean parenOnTie) {
        var p = precedence(child);
        var paren = p == QUANTIFIED || p < parentPrec || (p == parentPrec && parenOnTie);
        if (paren) out.append('(');
        write(child);
        if (paren) out.append(')');
    }

    private void quantified(Formula.QuantifiedFormula q) {
        var v = q.variable();
        var exists = q.quantifier() == Formula.Quantifier.EXISTS;
        out.append(exists ? style.exists : style.forall);
        out.append(isBareName(v.name()) ? v.name() : "?" + v.name());
        if (v.sort() != null) out.append(':').append(v.sort());
        out.append(style.binderEnd);
        scope.push(v.name());
        try {
            var body = q.formula();
            if (body instanceof Formula.Predicate || body instanceof Formula.QuantifiedFormula) {
                write(body);
            } else {
                out.append('(');
                write(body);
                out.append(')');
            }
        } finally {
            scope.pop();
        }
    }

    private static boolean isBareName(String name) {
        return BARE_NAME.matcher(name).matches() && !name.equals("forall") && !name.equals("exists");
    }

    private void term(Term t) {
        if (t instanceof Term.Variable v) {
            out.append(scope.contains(v.name()) && isBareName(v.name()) ? v.name() : "?" + v.name());
        } else if (t instanceof Term.Constant c) {
            var bare = (isBareName(c.name()) && !scope.contains(c.name())) || NUMBER.matcher(c.name()).matches();
            out.append(bare ? c.name() : quote(c.name()));
        } else if (t instanceof Term.FunctionApplication fa) {
            out.append(fa.name()).append('(');
            var first = true;
            for (var a : fa.args()) {
                if (!first) out.append(", ");
                term(a);
                first = false;
            }
            out.append(')');
        }
    }

    private static String quote(String s) {
        return s.chars().mapToObj(c -> switch (c) {
            case '"' -> "\\\"";
            case '\\' -> "\\\\";
            case '\n' -> "\\n";
            case '\t' -> "\\t";
            default -> String.valueOf((char) c);
        }).collect(Collectors.joining("", "\"", "\""));
    }

    public enum Style {
        UNICODE("¬", "∧", "∨", "→", "↔", "□", "◊", "∀", "∃", " "),
        ASCII("~", "&", "|", "->", "<->", "[]", "<>", "forall ", "exists ", ". ");

        final String not, and, or, implies, iff, always, eventually, forall, exists, binderEnd;

        Style(String not, String and, String or, String implies, String iff, String always, String eventually,
              String forall, String exists, String binderEnd) {
            this.not = not;
            this.and = and;
            this.or = or;
            this.implies = implies;
            this.iff = iff;
            this.always = always;
            this.eventually = eventually;
            this.forall = forall;
            this.exists = exists;
            this.binderEnd = binderEnd;
        }

        String symbol(Formula.LogicOperator op) {
            return switch (op) {
                case AND -> and;
                case OR -> or;
                case IMPLIES -> implies;
                case IFF -> iff;
                case NOT -> not;
            };
        }
    }
}
