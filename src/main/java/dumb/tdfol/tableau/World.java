package dumb.tdfol.tableau;

import dumb.tdfol.Formula;
import dumb.tdfol.expand.SignedFormula;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A possible world of a tableau branch: formulas asserted true and formulas asserted false there.
 */
public final class World {

    private final int id;
    private final Set<Formula> formulas;
    private final Set<Formula> negatedFormulas;

    public World(int id) {
        this(id, new LinkedHashSet<>(), new LinkedHashSet<>());
    }

    private World(int id, Set<Formula> formulas, Set<Formula> negatedFormulas) {
        this.id = id;
        this.formulas = formulas;
        this.negatedFormulas = negatedFormulas;
    }

    public int id() {
        return id;
    }

    public Set<Formula> formulas() {
        return Set.copyOf(formulas);
    }

    public Set<Formula> negatedFormulas() {
        return Set.copyOf(negatedFormulas);
    }

    /** @return false if the signed formula was already present */
    public boolean add(SignedFormula f) {
        return (f.negated() ? negatedFormulas : formulas).add(f.formula());
    }

    public boolean contains(SignedFormula f) {
        return (f.negated() ? negatedFormulas : formulas).contains(f.formula());
    }

    public boolean containsAll(Iterable<SignedFormula> fs) {
        for (var f : fs) if (!contains(f)) return false;
        return true;
    }

    World copy() {
        return new World(id, new LinkedHashSet<>(formulas), new LinkedHashSet<>(negatedFormulas));
    }

    @Override
    public String toString() {
        return "w" + id + formulas + "¬" + negatedFormulas;
    }
}
