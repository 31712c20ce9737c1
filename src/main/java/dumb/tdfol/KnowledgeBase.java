package dumb.tdfol;

import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.util.Objects.requireNonNull;

/**
 * Ordered, duplicate-free axioms plus a separate sequence of theorems. Grows only; there is no removal.
 * Proof calls work against a {@link #snapshot()}, so concurrent additions never leak into a running proof.
 */
public class KnowledgeBase {

    private final LinkedHashSet<Formula> axioms = new LinkedHashSet<>();
    private final LinkedHashSet<Formula> theorems = new LinkedHashSet<>();
    private final Map<Formula, String> names = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public KnowledgeBase() {
    }

    public KnowledgeBase(Collection<Formula> axioms) {
        axioms.forEach(this::addAxiom);
    }

    /** @return true if the axiom was not already present */
    public boolean addAxiom(Formula axiom) {
        return addAxiom(axiom, null);
    }

    public boolean addAxiom(Formula axiom, @Nullable String name) {
        requireNonNull(axiom);
        lock.writeLock().lock();
        try {
            var added = axioms.add(axiom);
            if (added && name != null) names.put(axiom, name);
            return added;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean addTheorem(Formula theorem) {
        return addTheorem(theorem, null);
    }

    public boolean addTheorem(Formula theorem, @Nullable String name) {
        requireNonNull(theorem);
        lock.writeLock().lock();
        try {
            var added = theorems.add(theorem);
            if (added && name != null) names.putIfAbsent(theorem, name);
            return added;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Formula> axioms() {
        lock.readLock().lock();
        try {
            return List.copyOf(axioms);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Formula> theorems() {
        lock.readLock().lock();
        try {
            return List.copyOf(theorems);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isAxiom(Formula f) {
        lock.readLock().lock();
        try {
            return axioms.contains(f);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isTheorem(Formula f) {
        lock.readLock().lock();
        try {
            return theorems.contains(f);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<String> nameOf(Formula f) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(names.get(f));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return axioms.size() + theorems.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /** Immutable copy taken under the read lock. */
    public Snapshot snapshot() {
        lock.readLock().lock();
        try {
            return new Snapshot(List.copyOf(axioms), List.copyOf(theorems), Map.copyOf(names));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        var s = snapshot();
        return "KnowledgeBase[axioms=" + s.axioms().size() + ", theorems=" + s.theorems().size() + ']';
    }

    public record Snapshot(List<Formula> axioms, List<Formula> theorems, Map<Formula, String> names) {
        public boolean isAxiom(Formula f) {
            return axioms.contains(f);
        }

        public boolean isTheorem(Formula f) {
            return theorems.contains(f);
        }

        public boolean isEmpty() {
            return axioms.isEmpty() && theorems.isEmpty();
        }

        public int size() {
            return axioms.size() + theorems.size();
        }

        /** Axioms followed by the theorems that are not also axioms, the premise list a proof may use. */
        public List<Formula> all() {
            var out = new ArrayList<>(axioms);
            theorems.stream().filter(t -> !axioms.contains(t)).forEach(out::add);
            return out;
        }
    }
}
