package dumb.tdfol;

import dumb.tdfol.parse.FormulaFormatter;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * TDFOL formula AST. Every variant is an immutable record, so equality and hashing are structural.
 */
sealed public interface Formula permits Formula.Predicate, Formula.UnaryFormula, Formula.BinaryFormula,
        Formula.QuantifiedFormula, Formula.DeonticFormula, Formula.TemporalFormula, Formula.BinaryTemporalFormula {

    static Predicate atom(String name, Term... args) {
        return new Predicate(name, List.of(args));
    }

    static Formula not(Formula f) {
        return new UnaryFormula(LogicOperator.NOT, f);
    }

    static Formula and(Formula l, Formula r) {
        return new BinaryFormula(LogicOperator.AND, l, r);
    }

    static Formula or(Formula l, Formula r) {
        return new BinaryFormula(LogicOperator.OR, l, r);
    }

    static Formula implies(Formula l, Formula r) {
        return new BinaryFormula(LogicOperator.IMPLIES, l, r);
    }

    static Formula iff(Formula l, Formula r) {
        return new BinaryFormula(LogicOperator.IFF, l, r);
    }

    static Formula forall(Term.Variable v, Formula body) {
        return new QuantifiedFormula(Quantifier.FORALL, v, body);
    }

    static Formula exists(Term.Variable v, Formula body) {
        return new QuantifiedFormula(Quantifier.EXISTS, v, body);
    }

    static Formula obligation(Formula f) {
        return new DeonticFormula(DeonticOperator.OBLIGATION, f);
    }

    static Formula permission(Formula f) {
        return new DeonticFormula(DeonticOperator.PERMISSION, f);
    }

    static Formula prohibition(Formula f) {
        return new DeonticFormula(DeonticOperator.PROHIBITION, f);
    }

    static Formula always(Formula f) {
        return new TemporalFormula(TemporalOperator.ALWAYS, f);
    }

    static Formula eventually(Formula f) {
        return new TemporalFormula(TemporalOperator.EVENTUALLY, f);
    }

    static Formula next(Formula f) {
        return new TemporalFormula(TemporalOperator.NEXT, f);
    }

    static Formula until(Formula l, Formula r) {
        return new BinaryTemporalFormula(TemporalOperator.UNTIL, l, r);
    }

    static Formula since(Formula l, Formula r) {
        return new BinaryTemporalFormula(TemporalOperator.SINCE, l, r);
    }

    static Formula weakUntil(Formula l, Formula r) {
        return new BinaryTemporalFormula(TemporalOperator.WEAK_UNTIL, l, r);
    }

    static Formula release(Formula l, Formula r) {
        return new BinaryTemporalFormula(TemporalOperator.RELEASE, l, r);
    }

    Set<String> freeVariables();

    /** Capture-avoiding substitution of a term for the free occurrences of a variable. */
    Formula substitute(String variable, Term replacement);

    /** Replaces every occurrence of {@code target} (a term) with {@code replacement}. */
    Formula replaceTerm(Term target, Term replacement);

    /** Direct subformulas, left to right. */
    List<Formula> children();

    /** Terms occurring in predicate argument positions, including nested function arguments. */
    default Set<Term> terms() {
        var out = new LinkedHashSet<Term>();
        for (var f : subformulas())
            if (f instanceof Predicate p) p.args().forEach(t -> collectTerms(t, out));
        return out;
    }

    private static void collectTerms(Term t, Set<Term> out) {
        out.add(t);
        if (t instanceof Term.FunctionApplication fa) fa.args().forEach(a -> collectTerms(a, out));
    }

    /** Pre-order list of this formula and all of its subformulas. */
    default List<Formula> subformulas() {
        var out = new ArrayList<Formula>();
        var stack = new ArrayList<Formula>();
        stack.add(this);
        while (!stack.isEmpty()) {
            var f = stack.remove(stack.size() - 1);
            out.add(f);
            var c = f.children();
            for (var i = c.size() - 1; i >= 0; i--) stack.add(c.get(i));
        }
        return out;
    }

    default int size() {
        return 1 + children().stream().mapToInt(Formula::size).sum();
    }

    default boolean isModal() {
        return this instanceof DeonticFormula || this instanceof TemporalFormula || this instanceof BinaryTemporalFormula;
    }

    default boolean isAtomic() {
        return this instanceof Predicate;
    }

    default String toText() {
        return FormulaFormatter.format(this);
    }

    JSONObject toJson();

    enum LogicOperator {NOT, AND, OR, IMPLIES, IFF}

    enum Quantifier {FORALL, EXISTS}

    enum DeonticOperator {OBLIGATION, PERMISSION, PROHIBITION}

    enum TemporalOperator {
        ALWAYS(false), EVENTUALLY(false), NEXT(false),
        UNTIL(true), SINCE(true), WEAK_UNTIL(true), RELEASE(true);

        public final boolean binary;

        TemporalOperator(boolean binary) {
            this.binary = binary;
        }
    }

    record Predicate(String name, List<Term> args) implements Formula {
        public Predicate {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Predicate name must not be empty");
            args = List.copyOf(args);
        }

        public int arity() {
            return args.size();
        }

        @Override
        public Set<String> freeVariables() {
            return args.stream().flatMap(a -> a.freeVariables().stream()).collect(Collectors.toCollection(LinkedHashSet::new));
        }

        @Override
        public Formula substitute(String variable, Term replacement) {
            if (args.isEmpty()) return this;
            return new Predicate(name, args.stream().map(a -> a.substitute(variable, replacement)).toList());
        }

        @Override
        public Formula replaceTerm(Term target, Term replacement) {
            if (args.isEmpty()) return this;
            return new Predicate(name, args.stream().map(a -> a.replace(target, replacement)).toList());
        }

        @Override
        public List<Formula> children() {
            return List.of();
        }

        @Override
        public JSONObject toJson() {
            var jsonArgs = new JSONArray();
            args.forEach(a -> jsonArgs.put(a.toJson()));
            return new JSONObject().put("type", "predicate").put("name", name).put("args", jsonArgs);
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    record UnaryFormula(LogicOperator operator, Formula formula) implements Formula {
        public UnaryFormula {
            requireNonNull(formula);
            if (operator != LogicOperator.NOT)
                throw new IllegalArgumentException("Unary formula requires NOT, got " + operator);
        }

        @Override
        public Set<String> freeVariables() {
            return formula.freeVariables();
        }

        @Override
        public Formula substitute(String variable, Term replacement) {
            return new UnaryFormula(operator, formula.substitute(variable, replacement));
        }

        @Override
        public Formula replaceTerm(Term target, Term replacement) {
            return new UnaryFormula(operator, formula.replaceTerm(target, replacement));
        }

        @Override
        public List<Formula> children() {
            return List.of(formula);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "unary").put("operator", operator.name()).put("formula", formula.toJson());
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    record BinaryFormula(LogicOperator operator, Formula left, Formula right) implements Formula {
        public BinaryFormula {
            requireNonNull(operator);
            requireNonNull(left);
            requireNonNull(right);
            if (operator == LogicOperator.NOT)
                throw new IllegalArgumentException("NOT is not a binary operator");
        }

        @Override
        public Set<String> freeVariables() {
            var s = new LinkedHashSet<>(left.freeVariables());
            s.addAll(right.freeVariables());
            return s;
        }

        @Override
        public Formula substitute(String variable, Term replacement) {
            return new BinaryFormula(operator, left.substitute(variable, replacement), right.substitute(variable, replacement));
        }

        @Override
        public Formula replaceTerm(Term target, Term replacement) {
            return new BinaryFormula(operator, left.replaceTerm(target, replacement), right.replaceTerm(target, replacement));
        }

        @Override
        public List<Formula> children() {
            return List.of(left, right);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "binary").put("operator", operator.name())
                    .put("left", left.toJson()).put("right", right.toJson());
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    record QuantifiedFormula(Quantifier quantifier, Term.Variable variable, Formula formula) implements Formula {
        public QuantifiedFormula {
            requireNonNull(quantifier);
            requireNonNull(variable);
            requireNonNull(formula);
        }

        @Override
        public Set<String> freeVariables() {
            var s = new LinkedHashSet<>(formula.freeVariables());
            s.remove(variable.name());
            return s;
        }

        @Override
        public Formula substitute(String v, Term replacement) {
            if (variable.name().equals(v) || !formula.freeVariables().contains(v)) return this;
            if (replacement.freeVariables().contains(variable.name())) {
                var fresh = freshName(variable.name(), replacement, formula);
                var renamed = new Term.Variable(fresh, variable.sort());
                var body = formula.substitute(variable.name(), renamed);
                return new QuantifiedFormula(quantifier, renamed, body.substitute(v, replacement));
            }
            return new QuantifiedFormula(quantifier, variable, formula.substitute(v, replacement));
        }

        private static String freshName(String base, Term replacement, Formula body) {
            var taken = new LinkedHashSet<>(replacement.freeVariables());
            body.subformulas().forEach(f -> taken.addAll(f.freeVariables()));
            for (var i = 1; ; i++) {
                var candidate = base + i;
                if (!taken.contains(candidate)) return candidate;
            }
        }

        /** Body with the bound variable replaced by {@code t}. */
        public Formula instantiate(Term t) {
            return formula.substitute(variable.name(), t);
        }

        @Override
        public Formula replaceTerm(Term target, Term replacement) {
            if (target.freeVariables().contains(variable.name())) return this;
            return new QuantifiedFormula(quantifier, variable, formula.replaceTerm(target, replacement));
        }

        @Override
        public List<Formula> children() {
            return List.of(formula);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "quantified").put("quantifier", quantifier.name())
                    .put("variable", variable.toJson()).put("formula", formula.toJson());
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    record DeonticFormula(DeonticOperator operator, Formula formula) implements Formula {
        public DeonticFormula {
            requireNonNull(operator);
            requireNonNull(formula);
        }

        @Override
        public Set<String> freeVariables() {
            return formula.freeVariables();
        }

        @Override
        public Formula substitute(String variable, Term replacement) {
            return new DeonticFormula(operator, formula.substitute(variable, replacement));
        }

        @Override
        public Formula replaceTerm(Term target, Term replacement) {
            return new DeonticFormula(operator, formula.replaceTerm(target, replacement));
        }

        @Override
        public List<Formula> children() {
            return List.of(formula);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "deontic").put("operator", operator.name()).put("formula", formula.toJson());
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    record TemporalFormula(TemporalOperator operator, Formula formula) implements Formula {
        public TemporalFormula {
            requireNonNull(operator);
            requireNonNull(formula);
            if (operator.binary)
                throw new IllegalArgumentException(operator + " requires two operands");
        }

        @Override
        public Set<String> freeVariables() {
            return formula.freeVariables();
        }

        @Override
        public Formula substitute(String variable, Term replacement) {
            return new TemporalFormula(operator, formula.substitute(variable, replacement));
        }

        @Override
        public Formula replaceTerm(Term target, Term replacement) {
            return new TemporalFormula(operator, formula.replaceTerm(target, replacement));
        }

        @Override
        public List<Formula> children() {
            return List.of(formula);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "temporal").put("operator", operator.name()).put("formula", formula.toJson());
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    record BinaryTemporalFormula(TemporalOperator operator, Formula left, Formula right) implements Formula {
        public BinaryTemporalFormula {
            requireNonNull(operator);
            requireNonNull(left);
            requireNonNull(right);
            if (!operator.binary)
                throw new IllegalArgumentException(operator + " is not a binary temporal operator");
        }

        @Override
        public Set<String> freeVariables() {
            var s = new LinkedHashSet<>(left.freeVariables());
            s.addAll(right.freeVariables());
            return s;
        }

        @Override
        public Formula substitute(String variable, Term replacement) {
            return new BinaryTemporalFormula(operator, left.substitute(variable, replacement), right.substitute(variable, replacement));
        }

        @Override
        public Formula replaceTerm(Term target, Term replacement) {
            return new BinaryTemporalFormula(operator, left.replaceTerm(target, replacement), right.replaceTerm(target, replacement));
        }

        @Override
        public List<Formula> children() {
            return List.of(left, right);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "binary_temporal").put("operator", operator.name())
                    .put("left", left.toJson()).put("right", right.toJson());
        }

        @Override
        public String toString() {
            return toText();
        }
    }
}
