package dumb.tdfol.graph;

import dumb.tdfol.Formula;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/** {@code to} depends on {@code from}. */
public record DependencyEdge(Formula from, Formula to, @Nullable String ruleName, @Nullable String justification) {

    public DependencyEdge {
        requireNonNull(from);
        requireNonNull(to);
    }
}
