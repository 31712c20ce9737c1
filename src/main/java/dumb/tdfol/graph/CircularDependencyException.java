package dumb.tdfol.graph;

import dumb.tdfol.Formula;

import java.util.List;
import java.util.stream.Collectors;

public class CircularDependencyException extends RuntimeException {

    private final transient List<Formula> cycle;

    public CircularDependencyException(List<Formula> cycle) {
        super("Circular dependency: " + cycle.stream().map(Formula::toText).collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    public List<Formula> cycle() {
        return cycle;
    }
}
