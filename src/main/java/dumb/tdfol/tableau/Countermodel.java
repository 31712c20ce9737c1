package dumb.tdfol.tableau;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.tdfol.Formula;
import dumb.tdfol.tableau.TableauxBranch.Relation;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Kripke structure read off a saturated open tableau branch: each world with the formulas true and false there,
 * and the accessibility relations between worlds. World 0 is where the assumptions hold and the goal fails.
 * Reflexive logics get their self-loops made explicit.
 */
public record Countermodel(ModalLogicType logic, List<State> worlds, Map<Relation, Map<Integer, Set<Integer>>> accessibility) {

    public record State(int id, @JsonIgnore Set<Formula> holds, @JsonIgnore Set<Formula> fails) {
        public State {
            holds = Set.copyOf(holds);
            fails = Set.copyOf(fails);
        }

        @JsonProperty("satisfied")
        public List<String> satisfiedTexts() {
            return sortedTexts(holds);
        }

        @JsonProperty("falsified")
        public List<String> falsifiedTexts() {
            return sortedTexts(fails);
        }
    }

    public Countermodel {
        worlds = List.copyOf(worlds);
        var copy = new EnumMap<Relation, Map<Integer, Set<Integer>>>(Relation.class);
        accessibility.forEach((r, m) -> {
            var edges = new TreeMap<Integer, Set<Integer>>();
            m.forEach((k, v) -> edges.put(k, Collections.unmodifiableSet(new TreeSet<>(v))));
            copy.put(r, Collections.unmodifiableMap(edges));
        });
        accessibility = Collections.unmodifiableMap(copy);
    }

    public static Countermodel of(ModalLogicType logic, TableauxBranch branch) {
        if (branch.isClosed()) throw new IllegalArgumentException("Closed branch has no model: " + branch.id());
        var states = new ArrayList<State>();
        var relations = new EnumMap<Relation, Map<Integer, Set<Integer>>>(Relation.class);
        for (var r : Relation.values()) relations.put(r, new TreeMap<>());
        for (var w : branch.worlds()) {
            states.add(new State(w.id(), w.formulas(), w.negatedFormulas()));
            for (var r : Relation.values()) {
                var succ = new TreeSet<>(branch.accessibleWorlds(w.id(), r));
                if (r == Relation.TEMPORAL && logic.reflexive) succ.add(w.id());
                if (!succ.isEmpty()) relations.get(r).put(w.id(), succ);
            }
        }
        // the tableau propagates boxes along chains instead of storing the transitive edges
        if (logic.transitive) close(relations.get(Relation.TEMPORAL));
        return new Countermodel(logic, states, relations);
    }

    private static void close(Map<Integer, Set<Integer>> edges) {
        var changed = true;
        while (changed) {
            changed = false;
            for (var succ : edges.values())
                for (var v : List.copyOf(succ))
                    changed |= succ.addAll(edges.getOrDefault(v, Set.of()));
        }
    }

    public State world(int id) {
        return worlds.stream().filter(s -> s.id() == id).findFirst()
                .orElseThrow(() -> new NoSuchElementException("No world " + id));
    }

    public Set<Integer> successors(int world, Relation r) {
        return accessibility.getOrDefault(r, Map.of()).getOrDefault(world, Set.of());
    }

    public boolean isReflexive(Relation r) {
        return worlds.stream().allMatch(w -> successors(w.id(), r).contains(w.id()));
    }

    public boolean isSerial(Relation r) {
        return worlds.stream().noneMatch(w -> successors(w.id(), r).isEmpty());
    }

    public boolean isSymmetric(Relation r) {
        for (var w : worlds)
            for (var v : successors(w.id(), r))
                if (!successors(v, r).contains(w.id())) return false;
        return true;
    }

    public boolean isTransitive(Relation r) {
        for (var w : worlds)
            for (var v : successors(w.id(), r))
                if (!successors(w.id(), r).containsAll(successors(v, r))) return false;
        return true;
    }

    /** Plain-text listing: one block per world, then its outgoing edges per relation. */
    public String toText() {
        var sb = new StringBuilder();
        sb.append("Countermodel in ").append(logic).append(" with ").append(worlds.size()).append(" world(s)\n");
        for (var w : worlds) {
            sb.append("w").append(w.id()).append('\n');
            for (var f : w.satisfiedTexts()) sb.append("  ⊨ ").append(f).append('\n');
            for (var f : w.falsifiedTexts()) sb.append("  ⊭ ").append(f).append('\n');
            for (var r : Relation.values()) {
                var succ = successors(w.id(), r);
                if (succ.isEmpty()) continue;
                sb.append("  ").append(r.name().toLowerCase(Locale.ROOT)).append(" → ")
                        .append(succ.stream().map(v -> "w" + v).collect(Collectors.joining(", "))).append('\n');
            }
        }
        return sb.toString();
    }

    /** GraphViz rendering of the accessibility relations; the root world is drawn doubled. */
    public String toDot() {
        var sb = new StringBuilder("digraph countermodel {\n  rankdir=LR;\n");
        for (var w : worlds) {
            var label = new StringBuilder("w").append(w.id());
            for (var f : w.satisfiedTexts()) label.append("\\n").append(escape(f));
            for (var f : w.falsifiedTexts()) label.append("\\n¬").append(escape(f));
            sb.append("  w").append(w.id()).append(" [shape=").append(w.id() == 0 ? "doublecircle" : "circle")
                    .append(", label=\"").append(label).append("\"];\n");
        }
        accessibility.forEach((r, edges) -> edges.forEach((from, tos) -> {
            for (var to : tos)
                sb.append("  w").append(from).append(" -> w").append(to).append(" [label=\"")
                        .append(r == Relation.TEMPORAL ? "T" : "D").append("\"")
                        .append(r == Relation.DEONTIC ? ", style=dashed" : "").append("];\n");
        }));
        return sb.append("}\n").toString();
    }

    private static List<String> sortedTexts(Set<Formula> fs) {
        return fs.stream().map(Formula::toText).sorted().toList();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
