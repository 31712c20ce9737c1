package dumb.tdfol.prove;

import dumb.tdfol.*;
import dumb.tdfol.backend.BackendRegistry;
import dumb.tdfol.backend.ParseOutcome;
import dumb.tdfol.cache.ProofCache;
import dumb.tdfol.dcec.DcecBridge;
import dumb.tdfol.parse.FormulaFormatter;
import dumb.tdfol.parse.FormulaParser;
import dumb.tdfol.parse.FormulaSyntaxException;
import dumb.tdfol.rule.InferenceRules;
import dumb.tdfol.util.Log;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Entry point: proves formulas against a knowledge base, choosing or combining strategies and consulting the
 * proof cache. {@code prove} never mutates the knowledge base and never throws for a well-formed formula;
 * strategy failures come back as UNKNOWN results.
 */
public class Prover {

    private final KnowledgeBase kb;
    private final ProofCache cache;
    private final ProverConfig config;
    private final BackendRegistry registry;
    private final Map<Strategy, ProofStrategy> strategies = new EnumMap<>(Strategy.class);

    public Prover() {
        this(new KnowledgeBase());
    }

    public Prover(KnowledgeBase kb) {
        this(kb, ProverConfig.load());
    }

    /** Uses the shared cache, sized from the configuration when this is the first use. */
    public Prover(KnowledgeBase kb, ProverConfig config) {
        this(kb, ProofCache.shared(config.cacheMaxSize(), config.cacheTtl()), config,
                new BackendRegistry().register(new DcecBridge()));
    }

    public Prover(KnowledgeBase kb, ProofCache cache, ProverConfig config, BackendRegistry registry) {
        this.kb = requireNonNull(kb);
        this.cache = requireNonNull(cache);
        this.config = requireNonNull(config);
        this.registry = requireNonNull(registry);
        strategies.put(Strategy.FORWARD, new ForwardChainingStrategy(InferenceRules.all(), config.maxKnownFormulas()));
        strategies.put(Strategy.BACKWARD, new BackwardChainingStrategy());
        strategies.put(Strategy.MODAL_TABLEAUX, new ModalTableauxStrategy(null, config.maxBranches(), config.maxWorlds()));
    }

    public KnowledgeBase kb() {
        return kb;
    }

    public ProofCache cache() {
        return cache;
    }

    public ProverConfig config() {
        return config;
    }

    public BackendRegistry registry() {
        return registry;
    }

    /** The built-in strategies in declaration order. */
    public List<ProofStrategy> strategies() {
        return List.copyOf(strategies.values());
    }

    public ProofStrategy strategy(Strategy s) {
        var found = strategies.get(s);
        if (found == null) throw new IllegalArgumentException("Not a concrete strategy: " + s);
        return found;
    }

    public boolean addAxiom(String text) throws FormulaSyntaxException {
        return kb.addAxiom(FormulaParser.parse(text, config.parseLimits()));
    }

    public boolean addAxiom(Formula f) {
        return kb.addAxiom(f);
    }

    public ProofResult prove(String text) throws FormulaSyntaxException {
        return prove(FormulaParser.parse(text, config.parseLimits()));
    }

    public ProofResult prove(String text, Strategy strategy, long timeoutMs, int maxDepth, boolean useCache)
            throws FormulaSyntaxException {
        return prove(FormulaParser.parse(text, config.parseLimits()), strategy, timeoutMs, maxDepth, useCache);
    }

    public ProofResult prove(Formula goal) {
        return prove(goal, config.strategy());
    }

    public ProofResult prove(Formula goal, Strategy strategy) {
        return prove(goal, strategy, config.timeoutMs(), config.maxDepth(), config.useCache());
    }

    public ProofResult prove(Formula goal, Strategy strategy, long timeoutMs, int maxDepth, boolean useCache) {
        requireNonNull(goal);
        requireNonNull(strategy);
        var premises = kb.snapshot();
        var scope = strategy.name() + "/" + maxDepth;
        if (useCache) {
            var hit = cache.get(goal, scope, premises);
            if (hit != null) {
                Log.debug("Cache hit for " + goal.toText());
                return hit;
            }
        }

        var start = System.nanoTime();
        var attempt = switch (strategy) {
            case AUTO -> auto(goal, timeoutMs, maxDepth);
            case HYBRID -> hybrid(goal, timeoutMs, maxDepth);
            default -> attempt(strategy(strategy), goal, timeoutMs, maxDepth);
        };
        var result = attempt.result();
        Log.message(result.status() + " " + goal.toText() + " by " + result.method()
                + " in " + (System.nanoTime() - start) / 1_000_000L + "ms");

        if (useCache && !attempt.failed() && result.status() != ProofStatus.TIMEOUT)
            cache.set(goal, scope, premises, result);
        return result;
    }

    private record Attempt(ProofResult result, boolean failed) {
    }

    private Attempt attempt(ProofStrategy s, Formula goal, long timeoutMs, int maxDepth) {
        Log.debug("Proving " + goal.toText() + " with " + s.name());
        try {
            return new Attempt(s.prove(goal, kb, timeoutMs, maxDepth), false);
        } catch (RuntimeException e) {
            Log.error("Strategy " + s.name() + " failed on " + goal.toText() + ": " + e);
            return new Attempt(ProofResult.unknown(goal, s.name(), 0, "Strategy failed: " + e.getMessage()), true);
        }
    }

    /** Applicable strategies, cheapest first; higher priority breaks ties. */
    List<ProofStrategy> ranked(Formula goal) {
        return strategies.values().stream()
                .filter(s -> s.canHandle(goal, kb))
                .sorted(Comparator.comparingDouble((ProofStrategy s) -> s.estimateCost(goal, kb))
                        .thenComparing(Comparator.comparingInt(ProofStrategy::priority).reversed()))
                .toList();
    }

    private Attempt auto(Formula goal, long timeoutMs, int maxDepth) {
        var ranked = ranked(goal);
        Log.debug("AUTO order for " + goal.toText() + ": " + ranked);
        var budget = Budget.of(timeoutMs, maxDepth);
        Attempt last = null;
        for (var s : ranked) {
            var remaining = budget.remainingMillis();
            // strategies left untried: the outcome is a timeout, not an UNKNOWN
            if (remaining <= 0) return new Attempt(ProofResult.timeout(goal, "auto", budget.elapsedMillis()), false);
            last = attempt(s, goal, remaining, maxDepth);
            if (last.result().status() != ProofStatus.UNKNOWN) return last;
        }
        if (last == null) return new Attempt(ProofResult.timeout(goal, "auto", budget.elapsedMillis()), false);
        return last;
    }

    private Attempt hybrid(Formula goal, long timeoutMs, int maxDepth) {
        var ranked = ranked(goal);
        var coordinator = registry.coordinator();
        if (coordinator.isPresent()) {
            Log.debug("Delegating " + goal.toText() + " to registered hybrid coordinator");
            try {
                return new Attempt(coordinator.get().coordinate(goal, kb, ranked, timeoutMs, maxDepth), false);
            } catch (RuntimeException e) {
                Log.error("Hybrid coordinator failed on " + goal.toText() + ": " + e);
                return new Attempt(ProofResult.unknown(goal, "hybrid", 0, "Coordinator failed: " + e.getMessage()), true);
            }
        }
        return consensus(goal, ranked, timeoutMs, maxDepth);
    }

    /** Runs every applicable strategy; the first conclusive verdict wins and the agreement ratio is reported. */
    private Attempt consensus(Formula goal, List<ProofStrategy> ranked, long timeoutMs, int maxDepth) {
        var budget = Budget.of(timeoutMs, maxDepth);
        var results = new ArrayList<ProofResult>();
        var failed = false;
        var cutShort = false;
        for (var s : ranked) {
            var remaining = budget.remainingMillis();
            if (remaining <= 0) {
                cutShort = true;
                break;
            }
            var a = attempt(s, goal, remaining, maxDepth);
            failed |= a.failed();
            results.add(a.result());
        }
        var verdict = results.stream().filter(r -> r.status().conclusive()).findFirst();
        if (verdict.isEmpty()) {
            var timedOut = cutShort || results.stream().anyMatch(r -> r.status() == ProofStatus.TIMEOUT);
            var r = timedOut || results.isEmpty()
                    ? ProofResult.timeout(goal, "hybrid", budget.elapsedMillis())
                    : ProofResult.unknown(goal, "hybrid", budget.elapsedMillis(), "No strategy reached a verdict");
            return new Attempt(r, failed);
        }
        var winner = verdict.get();
        var agree = results.stream().filter(r -> r.status() == winner.status()).count();
        var conflict = results.stream().anyMatch(r -> r.status().conclusive() && r.status() != winner.status());
        if (conflict) Log.warning("Strategies disagree on " + goal.toText());
        var msg = "consensus " + agree + "/" + results.size() + (conflict ? ", conflicting verdicts" : "");
        return new Attempt(winner.withMessage(msg), failed);
    }

    /** Asks a registered external backend; UNKNOWN with "unsupported" when none is registered under that name. */
    public ProofResult proveWithBackend(String name, Formula goal) {
        var backend = registry.prover(name);
        if (backend.isEmpty())
            return ProofResult.unknown(goal, name, 0, "unsupported: no backend named '" + name + "'");
        var start = System.nanoTime();
        try {
            var r = backend.get().prove(FormulaFormatter.formatAscii(goal));
            var elapsed = (System.nanoTime() - start) / 1_000_000L;
            var steps = r.status() == ProofStatus.PROVED
                    ? List.of(new ProofStep(goal, "Established by backend " + name, "Backend"))
                    : List.<ProofStep>of();
            return new ProofResult(r.status(), goal, steps, name, elapsed, false, r.detail());
        } catch (RuntimeException e) {
            Log.error("Backend " + name + " failed: " + e);
            return ProofResult.unknown(goal, name, (System.nanoTime() - start) / 1_000_000L, "Backend failed: " + e.getMessage());
        }
    }

    /** Parses DCEC text through the registered bridge; never throws. */
    public ParseOutcome parseDcec(String text) {
        var bridge = registry.syntax(DcecBridge.NAME);
        if (bridge.isEmpty()) return ParseOutcome.unsupported(DcecBridge.NAME);
        try {
            return ParseOutcome.success(bridge.get().parse(text));
        } catch (FormulaSyntaxException e) {
            Log.debug("DCEC parse failed: " + e.getMessage());
            return ParseOutcome.error(e.getMessage());
        } catch (RuntimeException e) {
            Log.warning("DCEC bridge failed: " + e);
            return ParseOutcome.error(String.valueOf(e.getMessage()));
        }
    }
}
