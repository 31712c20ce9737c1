package dumb.tdfol.prove;

import dumb.tdfol.Formula;
import dumb.tdfol.ProofStep;

import java.util.*;

/**
 * Arena of derivation steps addressed by integer handle. Steps may share premises, so a derivation is a DAG;
 * {@link #chain(int)} linearises the part a goal depends on.
 */
public final class ProofTrace {

    private final List<ProofStep> steps = new ArrayList<>();
    private final List<int[]> premises = new ArrayList<>();
    private final BitSet given = new BitSet();
    private final Map<Formula, Integer> handles = new HashMap<>();

    /** Records a premise taken from the knowledge base. Given formulas are not repeated in reported proofs. */
    public int given(Formula f, String justification) {
        var existing = handles.get(f);
        if (existing != null) return existing;
        var h = append(new ProofStep(f, justification, "Given"), new int[0]);
        given.set(h);
        return h;
    }

    /** Records a derived formula; returns the existing handle if the formula is already known. */
    public int derive(Formula f, String ruleName, String justification, int... premiseHandles) {
        var existing = handles.get(f);
        if (existing != null) return existing;
        var premiseFormulas = Arrays.stream(premiseHandles).mapToObj(i -> steps.get(i).formula()).toList();
        return append(new ProofStep(f, justification, ruleName, premiseFormulas), premiseHandles.clone());
    }

    private int append(ProofStep step, int[] premiseHandles) {
        var h = steps.size();
        steps.add(step);
        premises.add(premiseHandles);
        handles.put(step.formula(), h);
        return h;
    }

    public Optional<Integer> handle(Formula f) {
        return Optional.ofNullable(handles.get(f));
    }

    public boolean contains(Formula f) {
        return handles.containsKey(f);
    }

    public ProofStep step(int handle) {
        return steps.get(handle);
    }

    public int size() {
        return steps.size();
    }

    /** Derived steps the given handle depends on, premises before conclusions, ending with the handle itself. */
    public List<ProofStep> chain(int handle) {
        var out = new ArrayList<ProofStep>();
        var visited = new BitSet();
        var stack = new ArrayDeque<int[]>();
        stack.push(new int[]{handle, 0});
        while (!stack.isEmpty()) {
            var top = stack.peek();
            var h = top[0];
            if (visited.get(h)) {
                stack.pop();
                continue;
            }
            var ps = premises.get(h);
            if (top[1] < ps.length) {
                var next = ps[top[1]++];
                if (!visited.get(next)) stack.push(new int[]{next, 0});
            } else {
                stack.pop();
                visited.set(h);
                if (!given.get(h)) out.add(steps.get(h));
            }
        }
        return out;
    }
}
