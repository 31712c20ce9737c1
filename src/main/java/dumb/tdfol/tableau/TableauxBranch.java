package dumb.tdfol.tableau;

import dumb.tdfol.Formula;
import dumb.tdfol.ProofStep;
import dumb.tdfol.Term;
import dumb.tdfol.expand.SignedFormula;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * One branch of a modal tableau: a Kripke structure under construction plus the obligations still to expand.
 * Worlds are addressed by integer id; world 0 is the root.
 */
public final class TableauxBranch {

    public enum Relation {TEMPORAL, DEONTIC}

    record Pending(int world, SignedFormula formula) {
    }

    /** A box-like obligation: {@code body} must hold at every {@code relation}-successor of {@code world}. */
    record Box(int world, Relation relation, SignedFormula body, SignedFormula origin) {
    }

    /** A universal obligation and the terms it has already been instantiated with. */
    static final class Gamma {
        final int world;
        final SignedFormula formula;
        final Formula.QuantifiedFormula quantified;
        final Set<Term> used;

        Gamma(int world, SignedFormula formula, Formula.QuantifiedFormula quantified) {
            this(world, formula, quantified, new HashSet<>());
        }

        private Gamma(int world, SignedFormula formula, Formula.QuantifiedFormula quantified, Set<Term> used) {
            this.world = world;
            this.formula = formula;
            this.quantified = quantified;
            this.used = used;
        }

        Gamma copy() {
            return new Gamma(world, formula, quantified, new HashSet<>(used));
        }
    }

    private final int id;
    private final Map<Integer, World> worlds;
    private final Map<Relation, Map<Integer, Set<Integer>>> relations;
    private final Map<Integer, Integer> next;
    private final Map<Integer, Integer> parent;

    final ArrayDeque<Pending> alpha;
    final ArrayDeque<Pending> beta;
    final List<Box> boxes;
    final List<Gamma> gammas;
    final Set<Term> constants;
    private final Map<SignedFormula, Integer> unfolds;

    private boolean closed;
    private boolean incomplete;
    private int skolems;
    private @Nullable ProofStep closure;

    TableauxBranch(int id) {
        this.id = id;
        this.worlds = new LinkedHashMap<>();
        this.relations = new EnumMap<>(Relation.class);
        for (var r : Relation.values()) relations.put(r, new HashMap<>());
        this.next = new HashMap<>();
        this.parent = new HashMap<>();
        this.alpha = new ArrayDeque<>();
        this.beta = new ArrayDeque<>();
        this.boxes = new ArrayList<>();
        this.gammas = new ArrayList<>();
        this.constants = new LinkedHashSet<>();
        this.unfolds = new HashMap<>();
    }

    /** Deep copy under a new id; used when a branching expansion forks this branch. */
    TableauxBranch copy(int newId) {
        var c = new TableauxBranch(newId);
        worlds.forEach((k, w) -> c.worlds.put(k, w.copy()));
        relations.forEach((r, m) -> m.forEach((k, v) -> c.relations.get(r).put(k, new LinkedHashSet<>(v))));
        c.next.putAll(next);
        c.parent.putAll(parent);
        c.alpha.addAll(alpha);
        c.beta.addAll(beta);
        c.boxes.addAll(boxes);
        gammas.forEach(g -> c.gammas.add(g.copy()));
        c.constants.addAll(constants);
        c.unfolds.putAll(unfolds);
        c.closed = closed;
        c.incomplete = incomplete;
        c.skolems = skolems;
        c.closure = closure;
        return c;
    }

    public int id() {
        return id;
    }

    /** Creates a world; {@code parentWorld} is the world it was generated from, or -1 for the root. */
    int createWorld(int parentWorld) {
        var w = worlds.size();
        worlds.put(w, new World(w));
        if (parentWorld >= 0) parent.put(w, parentWorld);
        return w;
    }

    /** @return false if the edge already existed */
    boolean addAccessibility(int from, int to, Relation relation) {
        return relations.get(relation).computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
    }

    public Set<Integer> accessibleWorlds(int from, Relation relation) {
        var s = relations.get(relation).get(from);
        return s == null ? Set.of() : Set.copyOf(s);
    }

    @Nullable Integer next(int world) {
        return next.get(world);
    }

    void setNext(int world, int successor) {
        next.put(world, successor);
    }

    @Nullable Integer parent(int world) {
        return parent.get(world);
    }

    /** Counts one more unfolding of an eventuality; false once {@code limit} is passed. */
    boolean unfold(SignedFormula f, int limit) {
        return unfolds.merge(f, 1, Integer::sum) <= limit;
    }

    int nextSkolem() {
        return skolems++;
    }

    int skolems() {
        return skolems;
    }

    public World world(int id) {
        return worlds.get(id);
    }

    public Collection<World> worlds() {
        return Collections.unmodifiableCollection(worlds.values());
    }

    public int worldCount() {
        return worlds.size();
    }

    void close(ProofStep reason) {
        closed = true;
        closure = reason;
    }

    public boolean isClosed() {
        return closed;
    }

    void markIncomplete() {
        incomplete = true;
    }

    /** True when a bound (unfolding depth, world or term limit) cut off expansion on this branch. */
    public boolean isIncomplete() {
        return incomplete;
    }

    public Optional<ProofStep> closure() {
        return Optional.ofNullable(closure);
    }

    @Override
    public String toString() {
        return "branch" + id + (closed ? "(closed)" : "") + worlds.values();
    }
}
