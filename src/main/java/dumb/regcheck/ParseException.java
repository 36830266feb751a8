package dumb.regcheck;

/**
 * Malformed policy or formula text. Line and column are 1-based; {@code -1} when unknown.
 */
public class ParseException extends Exception {
    private final int line;
    private final int col;
    private final String context;

    public ParseException(String message) {
        this(message, -1, -1, "");
    }

    public ParseException(String message, int line, int col, String context) {
        super(message);
        this.line = line;
        this.col = col;
        this.context = context;
    }

    public int line() {
        return line;
    }

    public int col() {
        return col;
    }

    @Override
    public String getMessage() {
        var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
        var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
        return super.getMessage() + location + contextSnippet;
    }

    /** Unrecognized character, or an unterminated comment or string literal. */
    public static class LexException extends ParseException {
        private final int offending;

        public LexException(String message, int offending, int line, int col, String context) {
            super(message, line, col, context);
            this.offending = offending;
        }

        /** The offending code point, or {@code -1} at end of input. */
        public int offending() {
            return offending;
        }
    }
}
