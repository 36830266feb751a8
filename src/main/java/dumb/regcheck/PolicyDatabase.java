package dumb.regcheck;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * The policies of one regulation, or of several merged together.
 */
public record PolicyDatabase(String name, @Nullable String version, @Nullable String effectiveDate,
                             List<PolicyEntry> policies) {

    public static final String COMBINED_NAME = "Combined Regulatory Compliance";

    public PolicyDatabase {
        requireNonNull(name);
        policies = List.copyOf(requireNonNull(policies));
    }

    public static PolicyDatabase merge(List<PolicyDatabase> dbs) {
        return new PolicyDatabase(COMBINED_NAME, "1.0", null,
                dbs.stream().flatMap(db -> db.policies().stream()).toList());
    }

    public PolicyDatabase filterByRegulation(String regulation) {
        return new PolicyDatabase(regulation, version, effectiveDate,
                policies.stream().filter(p -> p.regulation().equals(regulation)).toList());
    }

    public List<PolicyEntry> filterBySection(String section) {
        return policies.stream().filter(p -> p.section().equals(section)).toList();
    }

    public Optional<PolicyEntry> find(String id) {
        return policies.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    public List<String> ids() {
        return policies.stream().map(PolicyEntry::id).toList();
    }

    /** Distinct sections, sorted. */
    public List<String> sections() {
        return List.copyOf(policies.stream().map(PolicyEntry::section).collect(Collectors.toCollection(TreeSet::new)));
    }

    public int size() {
        return policies.size();
    }
}
