package dumb.regcheck;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Finite set of entity names quantifiers range over. Enumeration follows the given order.
 */
public record Domain(List<String> entities) {
    public static final Domain EMPTY = new Domain(List.of());

    public Domain {
        entities = List.copyOf(new LinkedHashSet<>(requireNonNull(entities)));
    }

    public static Domain of(String... entities) {
        return new Domain(List.of(entities));
    }

    public boolean has(String entity) {
        return entities.contains(entity);
    }

    public Domain with(String entity) {
        if (has(entity)) return this;
        var l = new ArrayList<>(entities);
        l.add(entity);
        return new Domain(l);
    }

    public int size() {
        return entities.size();
    }
}
