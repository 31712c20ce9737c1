package dumb.tdfol.graph;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.tdfol.Formula;
import dumb.tdfol.KnowledgeBase;
import dumb.tdfol.ProofResult;
import dumb.tdfol.util.Json;
import dumb.tdfol.util.Log;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;

/**
 * Directed graph of formulas where an edge {@code a → b} means b was derived using a.
 * <p>
 * Not thread-safe; build it from one thread, then query.
 */
public class FormulaDependencyGraph {

    private final Map<Formula, DependencyNode> nodes = new LinkedHashMap<>();
    private final Map<Formula, Map<Formula, DependencyEdge>> dependents = new HashMap<>();
    private final Map<Formula, Set<Formula>> dependencies = new HashMap<>();
    private int edgeCount;

    public static FormulaDependencyGraph fromKnowledgeBase(KnowledgeBase kb) {
        var g = new FormulaDependencyGraph();
        g.addKnowledgeBase(kb);
        return g;
    }

    public static FormulaDependencyGraph fromProof(ProofResult result) {
        var g = new FormulaDependencyGraph();
        g.addProof(result);
        return g;
    }

    public void addKnowledgeBase(KnowledgeBase kb) {
        var s = kb.snapshot();
        for (var a : s.axioms()) addNode(a, FormulaType.AXIOM, s.names().get(a));
        for (var t : s.theorems()) addNode(t, FormulaType.THEOREM, s.names().get(t));
    }

    private void addNode(Formula f, FormulaType type, @Nullable String name) {
        var meta = name == null ? Map.<String, Object>of() : Map.<String, Object>of("name", name);
        nodes.putIfAbsent(f, new DependencyNode(f, type, null, null, meta));
    }

    /** Records the goal (as GOAL, with status, method and time) and every step of the proof. */
    public void addProof(ProofResult result) {
        if (!result.isProved()) Log.warning("Adding dependencies of an unproved formula: " + result.formulaText());
        var goal = result.formula();
        nodes.putIfAbsent(goal, new DependencyNode(goal, FormulaType.GOAL, null, null, Map.of(
                "status", result.status().name(),
                "method", result.method(),
                "elapsedMillis", result.elapsedMillis())));
        for (var step : result.proofSteps())
            addFormula(step.formula(), step.premises(), step.ruleName(), step.justification(), FormulaType.DERIVED);
    }

    public void addFormula(Formula formula, Collection<Formula> dependsOn, String ruleName) {
        addFormula(formula, dependsOn, ruleName, "", FormulaType.DERIVED);
    }

    /**
     * Adds {@code formula} with an edge from each of its dependencies. Unknown dependencies become PREMISE nodes;
     * an existing PREMISE node is promoted to {@code type}, and a GOAL node keeps its type but records the rule.
     */
    public void addFormula(Formula formula, Collection<Formula> dependsOn, String ruleName, String justification, FormulaType type) {
        var existing = nodes.get(formula);
        if (existing == null || existing.type() == FormulaType.PREMISE)
            nodes.put(formula, new DependencyNode(formula, type, ruleName, justification,
                    existing == null ? Map.of() : existing.metadata()));
        else if (existing.type() == FormulaType.GOAL && existing.ruleName() == null)
            nodes.put(formula, new DependencyNode(formula, FormulaType.GOAL, ruleName, justification, existing.metadata()));

        for (var premise : dependsOn) {
            nodes.putIfAbsent(premise, new DependencyNode(premise, FormulaType.PREMISE));
            var out = dependents.computeIfAbsent(premise, k -> new LinkedHashMap<>());
            if (out.putIfAbsent(formula, new DependencyEdge(premise, formula, ruleName, justification)) == null) {
                edgeCount++;
                dependencies.computeIfAbsent(formula, k -> new LinkedHashSet<>()).add(premise);
            }
        }
    }

    public Optional<DependencyNode> node(Formula f) {
        return Optional.ofNullable(nodes.get(f));
    }

    public Collection<DependencyNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<DependencyEdge> edges() {
        var out = new ArrayList<DependencyEdge>(edgeCount);
        for (var f : nodes.keySet()) {
            var m = dependents.get(f);
            if (m != null) out.addAll(m.values());
        }
        return out;
    }

    public int size() {
        return nodes.size();
    }

    /** Formulas {@code f} was derived from directly. */
    public List<Formula> getDependencies(Formula f) {
        return List.copyOf(dependencies.getOrDefault(f, Set.of()));
    }

    /** Formulas derived directly from {@code f}. */
    public List<Formula> getDependents(Formula f) {
        var m = dependents.get(f);
        return m == null ? List.of() : List.copyOf(m.keySet());
    }

    public Set<Formula> getAllDependencies(Formula f) {
        return reach(f, this::getDependencies);
    }

    public Set<Formula> getAllDependents(Formula f) {
        return reach(f, this::getDependents);
    }

    private static Set<Formula> reach(Formula start, Function<Formula, List<Formula>> next) {
        var seen = new LinkedHashSet<Formula>();
        var queue = new ArrayDeque<>(next.apply(start));
        while (!queue.isEmpty()) {
            var f = queue.poll();
            if (seen.add(f)) queue.addAll(next.apply(f));
        }
        return seen;
    }

    /** Every cycle found by a depth-first walk, each closed by repeating its first formula. Never throws. */
    public List<List<Formula>> detectCycles() {
        var cycles = new ArrayList<List<Formula>>();
        var visited = new HashSet<Formula>();
        for (var f : nodes.keySet())
            if (!visited.contains(f)) dfs(f, visited, new LinkedHashSet<>(), new ArrayList<>(), cycles);
        return cycles;
    }

    private void dfs(Formula f, Set<Formula> visited, Set<Formula> onStack, List<Formula> path, List<List<Formula>> cycles) {
        visited.add(f);
        onStack.add(f);
        path.add(f);
        for (var d : getDependents(f)) {
            if (!visited.contains(d)) {
                dfs(d, visited, onStack, path, cycles);
            } else if (onStack.contains(d)) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(d), path.size()));
                cycle.add(d);
                cycles.add(cycle);
            }
        }
        path.remove(path.size() - 1);
        onStack.remove(f);
    }

    /** Dependencies before dependents (Kahn's algorithm). */
    public List<Formula> topologicalSort() {
        var inDegree = new HashMap<Formula, Integer>();
        for (var f : nodes.keySet()) inDegree.put(f, dependencies.getOrDefault(f, Set.of()).size());
        var queue = new ArrayDeque<Formula>();
        for (var f : nodes.keySet()) if (inDegree.get(f) == 0) queue.add(f);

        var order = new ArrayList<Formula>(nodes.size());
        while (!queue.isEmpty()) {
            var f = queue.poll();
            order.add(f);
            for (var d : getDependents(f))
                if (inDegree.merge(d, -1, Integer::sum) == 0) queue.add(d);
        }
        if (order.size() < nodes.size()) {
            var cycles = detectCycles();
            throw new CircularDependencyException(cycles.isEmpty() ? List.of() : cycles.get(0));
        }
        return order;
    }

    /** Shortest derivation path from {@code from} to {@code to}, found by breadth-first search. */
    public Optional<List<Formula>> findCriticalPath(Formula from, Formula to) {
        if (!nodes.containsKey(from) || !nodes.containsKey(to)) return Optional.empty();
        var parent = new HashMap<Formula, Formula>();
        var queue = new ArrayDeque<Formula>();
        queue.add(from);
        parent.put(from, from);
        while (!queue.isEmpty()) {
            var f = queue.poll();
            if (f.equals(to)) {
                var path = new ArrayList<Formula>();
                for (var x = to; ; x = parent.get(x)) {
                    path.add(x);
                    if (x.equals(from)) break;
                }
                Collections.reverse(path);
                return Optional.of(path);
            }
            for (var d : getDependents(f))
                if (parent.putIfAbsent(d, f) == null) queue.add(d);
        }
        return Optional.empty();
    }

    /** Every simple path from {@code from} to {@code to} of at most {@code maxLength} formulas; 0 means unbounded. */
    public List<List<Formula>> findAllPaths(Formula from, Formula to, int maxLength) {
        var out = new ArrayList<List<Formula>>();
        if (!nodes.containsKey(from) || !nodes.containsKey(to)) return out;
        var path = new ArrayList<Formula>();
        path.add(from);
        paths(from, to, maxLength, path, new HashSet<>(Set.of(from)), out);
        return out;
    }

    private void paths(Formula cur, Formula to, int maxLength, List<Formula> path, Set<Formula> onPath, List<List<Formula>> out) {
        if (maxLength > 0 && path.size() > maxLength) return;
        if (cur.equals(to)) {
            out.add(List.copyOf(path));
            return;
        }
        for (var d : getDependents(cur)) {
            if (!onPath.add(d)) continue;
            path.add(d);
            paths(d, to, maxLength, path, onPath, out);
            path.remove(path.size() - 1);
            onPath.remove(d);
        }
    }

    /** Axioms nothing derived, proved or posed as a goal depends on, even indirectly. */
    public List<Formula> findUnusedAxioms() {
        var out = new ArrayList<Formula>();
        for (var n : nodes.values()) {
            if (n.type() != FormulaType.AXIOM) continue;
            var used = getAllDependents(n.formula()).stream().anyMatch(d -> nodes.get(d).type().conclusion());
            if (!used) out.add(n.formula());
        }
        return out;
    }

    /** A premise that is already a dependency of another premise of the same derivation. */
    public record RedundantPair(Formula dependency, Formula dependent) {
    }

    public List<RedundantPair> findRedundantFormulas() {
        var out = new LinkedHashSet<RedundantPair>();
        for (var premises : dependencies.values()) {
            if (premises.size() < 2) continue;
            for (var b : premises) {
                var deps = getAllDependencies(b);
                for (var a : premises)
                    if (!a.equals(b) && deps.contains(a)) out.add(new RedundantPair(a, b));
            }
        }
        return List.copyOf(out);
    }

    public record GraphStatistics(int nodes, int edges, Map<FormulaType, Integer> nodeTypes,
                                  Map<String, Integer> edgesByRule, boolean hasCycles) {
        public int count(FormulaType t) {
            return nodeTypes.getOrDefault(t, 0);
        }
    }

    public GraphStatistics statistics() {
        var types = new EnumMap<FormulaType, Integer>(FormulaType.class);
        for (var n : nodes.values()) types.merge(n.type(), 1, Integer::sum);
        var rules = new TreeMap<String, Integer>();
        for (var e : edges()) rules.merge(e.ruleName() != null ? e.ruleName() : "unnamed", 1, Integer::sum);
        return new GraphStatistics(nodes.size(), edgeCount, types, rules, !detectCycles().isEmpty());
    }

    public record AdjacencyMatrix(List<Formula> index, int[][] matrix) {
    }

    /** {@code matrix[i][j] == 1} iff {@code index[j]} depends directly on {@code index[i]}. */
    public AdjacencyMatrix adjacencyMatrix() {
        var index = List.copyOf(nodes.keySet());
        var pos = new HashMap<Formula, Integer>();
        for (var i = 0; i < index.size(); i++) pos.put(index.get(i), i);
        var m = new int[index.size()][index.size()];
        for (var e : edges()) m[pos.get(e.from())][pos.get(e.to())] = 1;
        return new AdjacencyMatrix(index, m);
    }

    public String toCsv() {
        var a = adjacencyMatrix();
        var sb = new StringBuilder();
        for (var f : a.index()) sb.append(',').append(csv(f.toText()));
        sb.append('\n');
        for (var i = 0; i < a.index().size(); i++) {
            sb.append(csv(a.index().get(i).toText()));
            for (var x : a.matrix()[i]) sb.append(',').append(x);
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String csv(String s) {
        return '"' + s.replace("\"", "\"\"") + '"';
    }

    public String toDot() {
        return toDot(List.of());
    }

    /** GraphViz source with one cluster per formula type; formulas and edges along {@code highlightPath} are red. */
    public String toDot(List<Formula> highlightPath) {
        var highlight = new HashSet<>(highlightPath);
        var ids = new HashMap<Formula, String>();
        for (var f : nodes.keySet()) ids.put(f, "n" + ids.size());

        var sb = new StringBuilder("digraph DependencyGraph {\n");
        sb.append("  rankdir=TB;\n  node [shape=box, style=rounded];\n");
        for (var type : FormulaType.values()) {
            var members = nodes.values().stream().filter(n -> n.type() == type).toList();
            if (members.isEmpty()) continue;
            var name = type.name().toLowerCase(Locale.ROOT);
            sb.append("  subgraph cluster_").append(name).append(" {\n")
                    .append("    label=\"").append(type.name().charAt(0)).append(name.substring(1)).append("\";\n")
                    .append("    style=dashed;\n    color=gray;\n");
            for (var n : members) {
                sb.append("    ").append(ids.get(n.formula()))
                        .append(" [label=\"").append(dotEscape(label(n))).append("\", fillcolor=").append(colour(type))
                        .append(", style=\"rounded,filled\"");
                if (highlight.contains(n.formula())) sb.append(", penwidth=3, color=red");
                sb.append("];\n");
            }
            sb.append("  }\n");
        }
        for (var e : edges()) {
            sb.append("  ").append(ids.get(e.from())).append(" -> ").append(ids.get(e.to()));
            var attrs = new ArrayList<String>();
            if (e.ruleName() != null && !e.ruleName().isEmpty()) attrs.add("label=\"" + dotEscape(e.ruleName()) + "\"");
            if (highlight.contains(e.from()) && highlight.contains(e.to())) attrs.add("color=red, penwidth=2");
            if (!attrs.isEmpty()) sb.append(" [").append(String.join(", ", attrs)).append(']');
            sb.append(";\n");
        }
        return sb.append("}\n").toString();
    }

    private static String label(DependencyNode n) {
        var name = n.metadata().get("name");
        return name != null ? name.toString() : n.formula().toText();
    }

    private static String colour(FormulaType t) {
        return switch (t) {
            case AXIOM -> "lightblue";
            case THEOREM -> "lightgreen";
            case DERIVED -> "lightyellow";
            case PREMISE -> "lightgray";
            case GOAL -> "gold";
            case LEMMA -> "lightcyan";
        };
    }

    private static String dotEscape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    public ObjectNode toJson() {
        var root = Json.object();
        var ns = root.putArray("nodes");
        for (var n : nodes.values()) {
            var o = ns.addObject();
            o.put("formula", n.formula().toText());
            o.put("type", n.type().name());
            if (n.ruleName() != null) o.put("ruleName", n.ruleName());
            if (n.justification() != null) o.put("justification", n.justification());
            o.set("metadata", Json.tree(n.metadata()));
        }
        var es = root.putArray("edges");
        for (var e : edges()) {
            var o = es.addObject();
            o.put("from", e.from().toText());
            o.put("to", e.to().toText());
            if (e.ruleName() != null) o.put("ruleName", e.ruleName());
            if (e.justification() != null) o.put("justification", e.justification());
        }
        root.set("statistics", Json.tree(statistics()));
        return root;
    }

    public void exportDot(Path file, List<Formula> highlightPath) throws IOException {
        Files.writeString(file, toDot(highlightPath));
        Log.message("Exported dependency graph to " + file);
    }

    public void exportJson(Path file) throws IOException {
        Files.writeString(file, Json.write(toJson()));
        Log.message("Exported dependency graph to " + file);
    }

    public void exportCsv(Path file) throws IOException {
        Files.writeString(file, toCsv());
        Log.message("Exported adjacency matrix to " + file);
    }
}
