package dumb.tdfol.expand;

import java.util.List;

/**
 * Outcome of expanding one signed formula: either new obligations on the same branch, or a fork.
 */
sealed public interface Expansion permits Expansion.Linear, Expansion.Branching {

    static Linear linear(SignedFormula... formulas) {
        return new Linear(List.of(formulas));
    }

    @SafeVarargs
    static Branching branching(List<SignedFormula>... branches) {
        return new Branching(List.of(branches));
    }

    /** Alternatives; a linear expansion has exactly one. */
    List<List<SignedFormula>> branches();

    record Linear(List<SignedFormula> formulas) implements Expansion {
        public Linear {
            formulas = List.copyOf(formulas);
            if (formulas.isEmpty()) throw new IllegalArgumentException("Linear expansion needs at least one formula");
        }

        @Override
        public List<List<SignedFormula>> branches() {
            return List.of(formulas);
        }
    }

    record Branching(List<List<SignedFormula>> branches) implements Expansion {
        public Branching {
            branches = branches.stream().map(List::copyOf).toList();
            if (branches.size() < 2) throw new IllegalArgumentException("Branching expansion needs two or more branches");
        }
    }
}
