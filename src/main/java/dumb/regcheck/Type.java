package dumb.regcheck;

/**
 * Base types of the checker. Type names read from a type-system file that are not base types (PHI, Purpose, ...)
 * collapse to {@link #ENTITY}.
 */
public enum Type {
    BOOL("Bool"), INT("Int"), STRING("String"), ENTITY("Entity"), TIME("Time");

    public final String label;

    Type(String label) {
        this.label = label;
    }

    public static Type parse(String name) {
        return switch (name.trim()) {
            case "Bool" -> BOOL;
            case "Int" -> INT;
            case "String" -> STRING;
            case "Time" -> TIME;
            default -> ENTITY;
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
