package dumb.tdfol.graph;

import dumb.tdfol.Formula;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

import static java.util.Objects.requireNonNull;

public record DependencyNode(Formula formula, FormulaType type, @Nullable String ruleName,
                             @Nullable String justification, Map<String, Object> metadata) {

    public DependencyNode {
        requireNonNull(formula);
        requireNonNull(type);
        metadata = Map.copyOf(metadata);
    }

    public DependencyNode(Formula formula, FormulaType type) {
        this(formula, type, null, null, Map.of());
    }
}
