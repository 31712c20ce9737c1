package dumb.tdfol.expand;

import dumb.tdfol.Formula;
import dumb.tdfol.Formula.BinaryFormula;
import dumb.tdfol.Formula.LogicOperator;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static dumb.tdfol.expand.Expansion.branching;
import static dumb.tdfol.expand.Expansion.linear;
import static dumb.tdfol.expand.SignedFormula.neg;
import static dumb.tdfol.expand.SignedFormula.pos;

/**
 * The propositional expansion table, keyed by (operator, sign). Atoms and modal formulas have no entry.
 */
public enum ExpansionRules {
    ;

    private static final Map<LogicOperator, ExpansionRule> POSITIVE = new EnumMap<>(LogicOperator.class);
    private static final Map<LogicOperator, ExpansionRule> NEGATIVE = new EnumMap<>(LogicOperator.class);

    static {
        binary("AndPositive", LogicOperator.AND, false, b -> linear(pos(b.left()), pos(b.right())));
        binary("AndNegative", LogicOperator.AND, true, b -> branching(List.of(neg(b.left())), List.of(neg(b.right()))));
        binary("OrPositive", LogicOperator.OR, false, b -> branching(List.of(pos(b.left())), List.of(pos(b.right()))));
        binary("OrNegative", LogicOperator.OR, true, b -> linear(neg(b.left()), neg(b.right())));
        binary("ImpliesPositive", LogicOperator.IMPLIES, false, b -> branching(List.of(neg(b.left())), List.of(pos(b.right()))));
        binary("ImpliesNegative", LogicOperator.IMPLIES, true, b -> linear(pos(b.left()), neg(b.right())));
        binary("IffPositive", LogicOperator.IFF, false,
                b -> branching(List.of(pos(b.left()), pos(b.right())), List.of(neg(b.left()), neg(b.right()))));
        binary("IffNegative", LogicOperator.IFF, true,
                b -> branching(List.of(pos(b.left()), neg(b.right())), List.of(neg(b.left()), pos(b.right()))));

        var not = new Rule("Negation", LogicOperator.NOT, false,
                s -> linear(new SignedFormula(((Formula.UnaryFormula) s.formula()).formula(), !s.negated())));
        POSITIVE.put(LogicOperator.NOT, not);
        NEGATIVE.put(LogicOperator.NOT, not);
    }

    private static void binary(String name, LogicOperator op, boolean negated, Function<BinaryFormula, Expansion> fn) {
        var rule = new Rule(name, op, negated, s -> fn.apply((BinaryFormula) s.formula()));
        (negated ? NEGATIVE : POSITIVE).put(op, rule);
    }

    /** Rule for the signed formula's top-level connective, if it has one. */
    public static Optional<ExpansionRule> select(SignedFormula f) {
        var table = f.negated() ? NEGATIVE : POSITIVE;
        var formula = f.formula();
        if (formula instanceof BinaryFormula b) return Optional.ofNullable(table.get(b.operator()));
        if (formula instanceof Formula.UnaryFormula u) return Optional.ofNullable(table.get(u.operator()));
        return Optional.empty();
    }

    public static Optional<Expansion> expand(SignedFormula f) {
        return select(f).map(r -> r.expand(f));
    }

    private record Rule(String name, LogicOperator operator, boolean negated,
                        Function<SignedFormula, Expansion> fn) implements ExpansionRule {
        @Override
        public Expansion expand(SignedFormula f) {
            return fn.apply(f);
        }
    }
}
