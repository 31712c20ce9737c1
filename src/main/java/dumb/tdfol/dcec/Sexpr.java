package dumb.tdfol.dcec;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * S-expression node of DCEC text: a symbol or a parenthesised list.
 */
sealed public interface Sexpr permits Sexpr.Atom, Sexpr.Lst {

    String toText();

    record Atom(String value) implements Sexpr {
        private static final Pattern SAFE_ATOM_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-+*/.<>=:!#%&'?]+$");

        public Atom {
            requireNonNull(value);
        }

        @Override
        public String toText() {
            var needsQuotes = value.isEmpty() || !SAFE_ATOM_PATTERN.matcher(value).matches();
            return needsQuotes ? '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"' : value;
        }
    }

    record Lst(List<Sexpr> items) implements Sexpr {
        public Lst {
            items = List.copyOf(items);
        }

        public Lst(Sexpr... items) {
            this(List.of(items));
        }

        public Sexpr get(int index) {
            return items.get(index);
        }

        public int size() {
            return items.size();
        }

        /** Head symbol, when the first item is an atom. */
        public Optional<String> op() {
            return items.isEmpty() || !(items.get(0) instanceof Atom a) ? Optional.empty() : Optional.of(a.value());
        }

        @Override
        public String toText() {
            return items.stream().map(Sexpr::toText).collect(Collectors.joining(" ", "(", ")"));
        }
    }
}
