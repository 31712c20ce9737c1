package dumb.tdfol.explain;

import dumb.tdfol.Formula;
import dumb.tdfol.ProofResult;
import dumb.tdfol.ProofStep;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Human-readable renderings of a {@link ProofResult}: a numbered walk through the steps, and a tree with each
 * conclusion above the premises it was drawn from.
 */
public enum ProofExplainer {
    ;

    private static final String BRANCH = "├── ", LAST = "└── ", PIPE = "│   ", GAP = "    ";

    /**
     * Numbered steps in derivation order. A premise derived earlier in the proof is cited by its step number,
     * anything else by its text.
     */
    public static String explain(ProofResult r) {
        var sb = new StringBuilder(header(r)).append('\n');
        var steps = r.proofSteps();
        if (steps.isEmpty()) {
            sb.append("  No derivation steps.\n");
        } else {
            var numbers = new HashMap<Formula, Integer>();
            for (var i = 0; i < steps.size(); i++) {
                var s = steps.get(i);
                sb.append("  ").append(i + 1).append(". ").append(s.formula().toText())
                        .append("   by ").append(s.ruleName());
                if (!s.justification().isEmpty()) sb.append(": ").append(s.justification());
                if (!s.premises().isEmpty())
                    sb.append(" (from ").append(s.premises().stream()
                            .map(p -> numbers.containsKey(p) ? String.valueOf(numbers.get(p)) : p.toText())
                            .collect(Collectors.joining(", "))).append(')');
                sb.append('\n');
                numbers.putIfAbsent(s.formula(), i + 1);
            }
        }
        if (r.message() != null) sb.append("  ").append(r.message()).append('\n');
        if (r.countermodel() != null) sb.append(r.countermodel().toText());
        return sb.toString();
    }

    /**
     * The final step as the root, with the steps that produced its premises as children. Premises no step
     * produced are leaves marked {@code [given]}. Steps that cite no premises, as in a tableau refutation, are
     * listed flat under the header.
     */
    public static String tree(ProofResult r) {
        var sb = new StringBuilder(header(r)).append('\n');
        var steps = r.proofSteps();
        if (steps.isEmpty()) return sb.toString();

        if (steps.stream().allMatch(s -> s.premises().isEmpty())) {
            for (var i = 0; i < steps.size(); i++)
                sb.append(i == steps.size() - 1 ? LAST : BRANCH).append(label(steps.get(i))).append('\n');
            return sb.toString();
        }

        var producers = new HashMap<Formula, ProofStep>();
        for (var s : steps) producers.putIfAbsent(s.formula(), s);
        var root = steps.get(steps.size() - 1);
        sb.append(label(root)).append('\n');
        children(sb, root, producers, "", new HashSet<>(Set.of(root.formula())));
        return sb.toString();
    }

    private static void children(StringBuilder sb, ProofStep step, Map<Formula, ProofStep> producers, String indent,
                                 Set<Formula> path) {
        List<Formula> ps = step.premises();
        for (var i = 0; i < ps.size(); i++) {
            var last = i == ps.size() - 1;
            var p = ps.get(i);
            var producer = producers.get(p);
            sb.append(indent).append(last ? LAST : BRANCH);
            if (producer == null || !path.add(p)) {
                sb.append(p.toText()).append("  [given]\n");
                continue;
            }
            sb.append(label(producer)).append('\n');
            children(sb, producer, producers, indent + (last ? GAP : PIPE), path);
            path.remove(p);
        }
    }

    private static String header(ProofResult r) {
        return r.formulaText() + " is " + r.status() + " by " + r.method() + " in " + r.elapsedMillis() + " ms"
                + (r.fromCache() ? " (cached)" : "");
    }

    private static String label(ProofStep s) {
        return s.formula().toText() + "  [" + s.ruleName() + "] " + s.justification();
    }
}
