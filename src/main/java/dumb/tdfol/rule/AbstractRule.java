package dumb.tdfol.rule;

import dumb.tdfol.Formula;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Arity and null checks shared by every rule; subclasses supply the shape test and the derivation.
 */
public abstract class AbstractRule implements InferenceRule {

    private final String name;
    private final String description;
    private final int arity;
    private final Category category;

    protected AbstractRule(Category category, String name, String description, int arity) {
        this.category = requireNonNull(category);
        this.name = requireNonNull(name);
        this.description = requireNonNull(description);
        this.arity = arity;
    }

    static InferenceRule define(Category category, String name, String description, int arity,
                                Predicate<Formula[]> shape, Function<Formula[], Formula> derivation) {
        return new Defined(category, name, description, arity, false, shape, derivation);
    }

    static InferenceRule necessitation(Category category, String name, String description,
                                       Function<Formula, Formula> derivation) {
        return new Defined(category, name, description, 1, true, p -> true, p -> derivation.apply(p[0]));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public int arity() {
        return arity;
    }

    @Override
    public Category category() {
        return category;
    }

    @Override
    public final boolean canApply(Formula... premises) {
        return premises != null && premises.length == arity
                && Arrays.stream(premises).allMatch(Objects::nonNull)
                && applicable(premises);
    }

    @Override
    public final Formula apply(Formula... premises) {
        if (!canApply(premises)) throw new RuleApplicationException(name, premises);
        return derive(premises);
    }

    protected abstract boolean applicable(Formula[] p);

    protected abstract Formula derive(Formula[] p);

    @Override
    public String toString() {
        return name;
    }

    private static final class Defined extends AbstractRule {
        private final boolean necessitation;
        private final Predicate<Formula[]> shape;
        private final Function<Formula[], Formula> derivation;

        Defined(Category category, String name, String description, int arity, boolean necessitation,
                Predicate<Formula[]> shape, Function<Formula[], Formula> derivation) {
            super(category, name, description, arity);
            this.necessitation = necessitation;
            this.shape = shape;
            this.derivation = derivation;
        }

        @Override
        public boolean necessitation() {
            return necessitation;
        }

        @Override
        protected boolean applicable(Formula[] p) {
            return shape.test(p);
        }

        @Override
        protected Formula derive(Formula[] p) {
            return derivation.apply(p);
        }
    }
}
