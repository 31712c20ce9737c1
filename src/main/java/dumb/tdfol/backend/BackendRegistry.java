package dumb.tdfol.backend;

import dumb.tdfol.prove.HybridCoordinator;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import static dumb.tdfol.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Capabilities registered at startup: prover oracles, syntax bridges and an optional hybrid coordinator.
 * An unregistered capability is a normal state that lookups report as an empty {@link Optional}.
 */
public class BackendRegistry {

    private final Map<String, ProverBackend> provers = new ConcurrentHashMap<>();
    private final Map<String, SyntaxBridge> syntaxes = new ConcurrentHashMap<>();
    private final AtomicReference<HybridCoordinator> coordinator = new AtomicReference<>();

    public BackendRegistry register(ProverBackend backend) {
        provers.put(requireNonNull(backend.name()), backend);
        message("Registered prover backend: " + backend.name());
        return this;
    }

    public BackendRegistry register(SyntaxBridge bridge) {
        syntaxes.put(requireNonNull(bridge.name()), bridge);
        message("Registered syntax bridge: " + bridge.name());
        return this;
    }

    public BackendRegistry register(HybridCoordinator c) {
        coordinator.set(requireNonNull(c));
        return this;
    }

    public Optional<ProverBackend> prover(String name) {
        return Optional.ofNullable(provers.get(name));
    }

    public Optional<SyntaxBridge> syntax(String name) {
        return Optional.ofNullable(syntaxes.get(name));
    }

    public Optional<HybridCoordinator> coordinator() {
        return Optional.ofNullable(coordinator.get());
    }

    public Set<String> proverNames() {
        return Set.copyOf(provers.keySet());
    }
}
