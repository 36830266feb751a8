package dumb.regcheck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Declared vocabulary: predicate and function signatures (several per name allowed) and constant types.
 * Immutable; build with {@link #builder()}.
 */
public final class TypeEnvironment {

    public static final TypeEnvironment EMPTY = builder().build();

    private final Map<String, List<Signature>> predicates;
    private final Map<String, List<Signature>> functions;
    private final Map<String, Type> constants;

    private TypeEnvironment(Map<String, List<Signature>> predicates, Map<String, List<Signature>> functions,
                            Map<String, Type> constants) {
        this.predicates = freeze(predicates);
        this.functions = freeze(functions);
        this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(constants));
    }

    private static Map<String, List<Signature>> freeze(Map<String, List<Signature>> m) {
        var copy = new LinkedHashMap<String, List<Signature>>();
        m.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Signature for {@code name} applied to {@code arity} arguments: the first registered with that arity,
     * otherwise the first registered under the name.
     */
    public Optional<Signature> predicate(String name, int arity) {
        return resolve(predicates, name, arity);
    }

    public Optional<Signature> function(String name, int arity) {
        return resolve(functions, name, arity);
    }

    public Optional<Type> constant(String name) {
        return Optional.ofNullable(constants.get(name));
    }

    private static Optional<Signature> resolve(Map<String, List<Signature>> table, String name, int arity) {
        var sigs = table.get(name);
        if (sigs == null || sigs.isEmpty()) return Optional.empty();
        return sigs.stream().filter(s -> s.arity() == arity).findFirst().or(() -> Optional.of(sigs.get(0)));
    }

    public List<Signature> predicates() {
        return predicates.values().stream().flatMap(List::stream).toList();
    }

    public List<Signature> functions() {
        return functions.values().stream().flatMap(List::stream).toList();
    }

    public Map<String, Type> constants() {
        return constants;
    }

    /**
     * Union of several environments. The first signature seen for a name and arity wins, names sorted and
     * arities in order of appearance; the first constant type seen for a name wins, in order of appearance.
     */
    public static TypeEnvironment merge(List<TypeEnvironment> envs) {
        var b = builder();
        union(envs.stream().flatMap(e -> e.predicates().stream()).toList()).forEach(b::predicate);
        union(envs.stream().flatMap(e -> e.functions().stream()).toList()).forEach(b::function);
        envs.forEach(e -> e.constants.forEach(b::constant));
        return b.build();
    }

    private static List<Signature> union(List<Signature> sigs) {
        var byName = new TreeMap<String, Map<Integer, Signature>>();
        for (var s : sigs)
            byName.computeIfAbsent(s.name(), k -> new LinkedHashMap<>()).putIfAbsent(s.arity(), s);
        return byName.values().stream().flatMap(m -> m.values().stream()).toList();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("PREDICATES\n");
        predicates().forEach(s -> sb.append(s).append('\n'));
        sb.append("\nFUNCTIONS\n");
        functions().forEach(s -> sb.append(s).append('\n'));
        sb.append("\nCONSTANTS\n");
        constants.forEach((k, v) -> sb.append(k).append(" : ").append(v).append('\n'));
        return sb.toString();
    }

    public record Signature(String name, List<Type> argTypes, Type returnType) {
        public Signature {
            requireNonNull(name);
            argTypes = List.copyOf(requireNonNull(argTypes));
            requireNonNull(returnType);
        }

        public static Signature of(String name, Type returnType, Type... argTypes) {
            return new Signature(name, List.of(argTypes), returnType);
        }

        public int arity() {
            return argTypes.size();
        }

        @Override
        public String toString() {
            return name + " : " + argTypes.stream().map(Type::toString).collect(Collectors.joining(" ")) + " -> " + returnType;
        }
    }

    public static final class Builder {
        private final Map<String, List<Signature>> predicates = new LinkedHashMap<>();
        private final Map<String, List<Signature>> functions = new LinkedHashMap<>();
        private final Map<String, Type> constants = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder predicate(Signature s) {
            predicates.computeIfAbsent(s.name(), k -> new ArrayList<>()).add(s);
            return this;
        }

        /** Predicate returning {@link Type#BOOL}. */
        public Builder predicate(String name, Type... argTypes) {
            return predicate(Signature.of(name, Type.BOOL, argTypes));
        }

        public Builder function(Signature s) {
            functions.computeIfAbsent(s.name(), k -> new ArrayList<>()).add(s);
            return this;
        }

        public Builder function(String name, Type returnType, Type... argTypes) {
            return function(Signature.of(name, returnType, argTypes));
        }

        /** The first declaration of a constant wins. */
        public Builder constant(String name, Type type) {
            constants.putIfAbsent(name, type);
            return this;
        }

        public TypeEnvironment build() {
            return new TypeEnvironment(predicates, functions, constants);
        }
    }
}
