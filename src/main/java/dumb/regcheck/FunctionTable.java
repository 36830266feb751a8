package dumb.regcheck;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Partial map from a function application {@code name(args)} to its value. No defaults: a missing entry is
 * unevaluable.
 */
public record FunctionTable(Map<Application, String> values) {
    public static final FunctionTable EMPTY = new FunctionTable(Map.of());

    public FunctionTable {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(values)));
    }

    public Optional<String> apply(String name, List<String> args) {
        return Optional.ofNullable(values.get(new Application(name, args)));
    }

    public FunctionTable with(String name, List<String> args, String value) {
        var m = new LinkedHashMap<>(values);
        m.put(new Application(name, args), value);
        return new FunctionTable(m);
    }

    public int size() {
        return values.size();
    }

    public record Application(String name, List<String> args) {
        public Application {
            requireNonNull(name);
            args = List.copyOf(requireNonNull(args));
        }

        @Override
        public String toString() {
            return name + "(" + String.join(", ", args) + ")";
        }
    }
}
