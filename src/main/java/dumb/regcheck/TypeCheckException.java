package dumb.regcheck;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A query formula failed type checking; no part of the query was evaluated.
 */
public class TypeCheckException extends RuntimeException {
    private final List<TypeError> errors;

    public TypeCheckException(List<TypeError> errors) {
        super("Query type error: " + errors.stream().map(TypeError::message).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<TypeError> errors() {
        return errors;
    }
}
