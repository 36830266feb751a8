package dumb.regcheck;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Ground facts. Anything not listed is false.
 */
public record Facts(Set<Fact> facts) {
    public static final Facts EMPTY = new Facts(Set.of());

    public Facts {
        facts = Collections.unmodifiableSet(new LinkedHashSet<>(requireNonNull(facts)));
    }

    public static Facts of(Fact... facts) {
        return new Facts(new LinkedHashSet<>(List.of(facts)));
    }

    public boolean holds(String predicate, List<String> args) {
        return facts.contains(new Fact(predicate, args));
    }

    public Facts with(Fact f) {
        var s = new LinkedHashSet<>(facts);
        s.add(f);
        return new Facts(s);
    }

    /** Argument tuples asserted for {@code predicate}. */
    public List<List<String>> find(String predicate) {
        return facts.stream().filter(f -> f.predicate().equals(predicate)).map(Fact::args).toList();
    }

    public Set<String> predicates() {
        return facts.stream().map(Fact::predicate).collect(Collectors.toCollection(TreeSet::new));
    }

    /** Every argument of every fact, sorted. */
    public Set<String> entities() {
        return facts.stream().flatMap(f -> f.args().stream()).collect(Collectors.toCollection(TreeSet::new));
    }

    public int size() {
        return facts.size();
    }

    public record Fact(String predicate, List<String> args) {
        public Fact {
            requireNonNull(predicate);
            args = List.copyOf(requireNonNull(args));
        }

        public static Fact of(String predicate, String... args) {
            return new Fact(predicate, List.of(args));
        }

        @Override
        public String toString() {
            return predicate + "(" + String.join(", ", args) + ")";
        }
    }
}
