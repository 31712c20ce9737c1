package dumb.tdfol.rule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the rule library.
 */
public enum InferenceRules {
    ;

    private static final List<InferenceRule> ALL;
    private static final Map<String, InferenceRule> BY_NAME = new LinkedHashMap<>();

    static {
        var all = new ArrayList<InferenceRule>();
        all.addAll(BasicRules.ALL);
        all.addAll(TemporalRules.ALL);
        all.addAll(DeonticRules.ALL);
        all.addAll(CombinedRules.ALL);
        ALL = List.copyOf(all);
        for (var r : ALL)
            if (BY_NAME.put(r.name(), r) != null) throw new IllegalStateException("Duplicate rule name: " + r.name());
    }

    public static List<InferenceRule> all() {
        return ALL;
    }

    public static List<InferenceRule> basic() {
        return BasicRules.ALL;
    }

    public static List<InferenceRule> temporal() {
        return TemporalRules.ALL;
    }

    public static List<InferenceRule> deontic() {
        return DeonticRules.ALL;
    }

    public static List<InferenceRule> combined() {
        return CombinedRules.ALL;
    }

    public static Optional<InferenceRule> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
