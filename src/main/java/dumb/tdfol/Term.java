package dumb.tdfol;

import org.jetbrains.annotations.Nullable;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * First-order terms: variables, constants and function applications.
 */
sealed public interface Term permits Term.Variable, Term.Constant, Term.FunctionApplication {

    static Variable var(String name) {
        return new Variable(name, null);
    }

    static Constant constant(String name) {
        return new Constant(name);
    }

    static FunctionApplication fn(String name, Term... args) {
        return new FunctionApplication(name, List.of(args));
    }

    String name();

    /** Names of the variables occurring in this term. */
    Set<String> freeVariables();

    /** Replaces every occurrence of the named variable. */
    Term substitute(String variable, Term replacement);

    /** Replaces every occurrence of {@code target} with {@code replacement}. */
    default Term replace(Term target, Term replacement) {
        if (this.equals(target)) return replacement;
        if (this instanceof FunctionApplication fa)
            return new FunctionApplication(fa.name(), fa.args().stream().map(a -> a.replace(target, replacement)).toList());
        return this;
    }

    default boolean isGround() {
        return freeVariables().isEmpty();
    }

    JSONObject toJson();

    record Variable(String name, @Nullable String sort) implements Term {
        public Variable {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Variable name must not be empty");
        }

        @Override
        public Set<String> freeVariables() {
            return Set.of(name);
        }

        @Override
        public Term substitute(String variable, Term replacement) {
            return name.equals(variable) ? replacement : this;
        }

        @Override
        public JSONObject toJson() {
            var j = new JSONObject().put("type", "variable").put("name", name);
            if (sort != null) j.put("sort", sort);
            return j;
        }
    }

    record Constant(String name) implements Term {
        public Constant {
            requireNonNull(name);
        }

        @Override
        public Set<String> freeVariables() {
            return Set.of();
        }

        @Override
        public Term substitute(String variable, Term replacement) {
            return this;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "constant").put("name", name);
        }
    }

    record FunctionApplication(String name, List<Term> args) implements Term {
        public FunctionApplication {
            requireNonNull(name);
            args = List.copyOf(args);
        }

        @Override
        public Set<String> freeVariables() {
            return args.stream().flatMap(a -> a.freeVariables().stream())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }

        @Override
        public Term substitute(String variable, Term replacement) {
            if (isGround()) return this;
            return new FunctionApplication(name, args.stream().map(a -> a.substitute(variable, replacement)).toList());
        }

        @Override
        public JSONObject toJson() {
            var jsonArgs = new JSONArray();
            args.forEach(a -> jsonArgs.put(a.toJson()));
            return new JSONObject().put("type", "function").put("name", name).put("args", jsonArgs);
        }
    }
}
