package dumb.tdfol.graph;

import dumb.tdfol.AbstractProverTest;
import dumb.tdfol.Formula;
import dumb.tdfol.prove.Strategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaDependencyGraphTest extends AbstractProverTest {

    private Formula axiom1, axiom2, lemma1, theorem1;
    private FormulaDependencyGraph graph;

    private void chain() {
        axiom1 = parse("A");
        axiom2 = parse("Z");
        lemma1 = parse("A | B");
        theorem1 = parse("(A | B) | C");
        kb.addAxiom(axiom1, "Axiom1");
        kb.addAxiom(axiom2, "Axiom2");
        graph = FormulaDependencyGraph.fromKnowledgeBase(kb);
        graph.addFormula(lemma1, List.of(axiom1), "DisjunctionIntroduction", "", FormulaType.LEMMA);
        graph.addFormula(theorem1, List.of(lemma1), "DisjunctionIntroduction", "", FormulaType.THEOREM);
    }

    @Test
    void criticalPathAndUnusedAxiom() {
        chain();
        assertEquals(List.of(axiom1, lemma1, theorem1), graph.findCriticalPath(axiom1, theorem1).orElseThrow());
        assertEquals(List.of(axiom2), graph.findUnusedAxioms());
        assertTrue(graph.findCriticalPath(axiom2, theorem1).isEmpty());
    }

    @Test
    void dependencyQueries() {
        chain();
        assertEquals(List.of(lemma1), graph.getDependencies(theorem1));
        assertEquals(List.of(lemma1), graph.getDependents(axiom1));
        assertEquals(Set.of(axiom1, lemma1), graph.getAllDependencies(theorem1));
        assertEquals(Set.of(lemma1, theorem1), graph.getAllDependents(axiom1));
        assertTrue(graph.getDependencies(axiom2).isEmpty());
        assertEquals("Axiom1", graph.node(axiom1).orElseThrow().metadata().get("name"));
    }

    @Test
    void topologicalOrder() {
        chain();
        var order = graph.topologicalSort();
        assertEquals(4, order.size());
        assertTrue(order.indexOf(axiom1) < order.indexOf(lemma1));
        assertTrue(order.indexOf(lemma1) < order.indexOf(theorem1));
    }

    @Test
    void cyclesAreDetectedNotFatal() {
        var a = parse("A");
        var b = parse("B");
        graph = new FormulaDependencyGraph();
        graph.addFormula(b, List.of(a), "ModusPonens");
        graph.addFormula(a, List.of(b), "ModusPonens");
        var cycles = graph.detectCycles();
        assertEquals(1, cycles.size());
        assertEquals(cycles.get(0).get(0), cycles.get(0).get(cycles.get(0).size() - 1));
        assertTrue(graph.statistics().hasCycles());
        var e = assertThrows(CircularDependencyException.class, graph::topologicalSort);
        assertFalse(e.cycle().isEmpty());
    }

    @Test
    void allPathsRespectLength() {
        var a = parse("A");
        var b = parse("B");
        var c = parse("C");
        var d = parse("D");
        graph = new FormulaDependencyGraph();
        graph.addFormula(b, List.of(a), "r");
        graph.addFormula(c, List.of(b), "r");
        graph.addFormula(d, List.of(a, c), "r");
        assertEquals(2, graph.findAllPaths(a, d, 0).size());
        assertEquals(List.of(List.of(a, d)), graph.findAllPaths(a, d, 2));
        assertEquals(List.of(a, d), graph.findCriticalPath(a, d).orElseThrow());
        assertEquals(List.of(new FormulaDependencyGraph.RedundantPair(a, c)), graph.findRedundantFormulas());
    }

    @Test
    void proofResultBecomesGraph() {
        axioms("forall x. (Human(x) -> Mortal(x))", "Human(socrates)");
        var goal = parse("Mortal(socrates)");
        var r = prover.prove(goal, Strategy.FORWARD);
        graph = FormulaDependencyGraph.fromProof(r);
        var node = graph.node(goal).orElseThrow();
        assertEquals(FormulaType.GOAL, node.type());
        assertEquals("ModusPonens", node.ruleName());
        assertEquals("PROVED", node.metadata().get("status"));
        assertEquals(2, graph.getDependencies(goal).size());
        assertEquals(1, graph.statistics().count(FormulaType.DERIVED));
        assertEquals(Map.of("ModusPonens", 2, "UniversalInstantiation", 1), graph.statistics().edgesByRule());
        assertTrue(graph.getAllDependencies(goal).contains(parse("Human(socrates)")));
    }

    @Test
    void unprovedGoalKeepsGoalType() {
        axioms("A");
        var r = prove("B");
        graph = FormulaDependencyGraph.fromProof(r);
        var node = graph.node(parse("B")).orElseThrow();
        assertEquals(FormulaType.GOAL, node.type());
        assertEquals("UNKNOWN", node.metadata().get("status"));
    }

    @Test
    void exports(@TempDir Path dir) throws IOException {
        chain();
        var m = graph.adjacencyMatrix();
        var i = m.index().indexOf(axiom1);
        var j = m.index().indexOf(lemma1);
        assertEquals(1, m.matrix()[i][j]);
        assertEquals(0, m.matrix()[j][i]);

        var dot = graph.toDot(List.of(axiom1, lemma1));
        assertTrue(dot.startsWith("digraph DependencyGraph {"));
        assertTrue(dot.contains("cluster_axiom"));
        assertTrue(dot.contains("label=\"Axiom1\""));
        assertTrue(dot.contains("color=red"));

        var json = graph.toJson();
        assertEquals(4, json.get("nodes").size());
        assertEquals(2, json.get("edges").size());
        assertEquals(4, json.get("statistics").get("nodes").asInt());

        var csv = graph.toCsv().split("\n");
        assertEquals(5, csv.length);

        graph.exportDot(dir.resolve("g.dot"), List.of());
        graph.exportJson(dir.resolve("g.json"));
        graph.exportCsv(dir.resolve("g.csv"));
        assertTrue(Files.readString(dir.resolve("g.dot")).contains("->"));
        assertTrue(Files.size(dir.resolve("g.json")) > 0);
        assertTrue(Files.readString(dir.resolve("g.csv")).contains("\"A\""));
    }
}
