package dumb.regcheck;

import dumb.regcheck.ParseException.LexException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Tokenizer for policy and formula text.
 * <p>
 * Each operator has a word, an ASCII and a Unicode spelling that all produce the same {@link Type}.
 * Multi-word section markers ({@code policy starts}, {@code type declaration ends}, ...) are single tokens
 * and are matched before identifiers, keywords before the generic identifier rule.
 */
public final class Lexer {
    private static final int CONTEXT_BUFFER_SIZE = 50;

    private static final Map<String, Type> KEYWORDS = Map.ofEntries(
            entry("and", Type.AND), entry("or", Type.OR), entry("not", Type.NOT),
            entry("implies", Type.IMPLIES), entry("iff", Type.IFF), entry("xor", Type.XOR),
            entry("forall", Type.FORALL), entry("exists", Type.EXISTS),
            entry("true", Type.TRUE), entry("True", Type.TRUE),
            entry("false", Type.FALSE), entry("False", Type.FALSE),
            entry("until", Type.UNTIL), entry("since", Type.SINCE),
            entry("always", Type.ALWAYS), entry("eventually", Type.EVENTUALLY), entry("next", Type.NEXT),
            entry("historically", Type.HISTORICALLY), entry("yesterday", Type.YESTERDAY), entry("once", Type.ONCE),
            entry("regulation", Type.REGULATION), entry("version", Type.VERSION),
            entry("effective_date", Type.EFFECTIVE_DATE), entry("type", Type.TYPE));

    /** Longest spelling first wherever one is a prefix of another. */
    private static final List<Map.Entry<String, Type>> SYMBOLS = List.of(
            entry("<->", Type.IFF), entry("<=>", Type.IFF),
            entry("->", Type.IMPLIES), entry("=>", Type.IMPLIES),
            entry("&&", Type.AND), entry("||", Type.OR),
            entry("!=", Type.NEQ), entry("==", Type.EQ), entry("<=", Type.LEQ), entry(">=", Type.GEQ),
            entry("@[", Type.ANNOT_START),
            entry("&", Type.AND), entry("|", Type.OR), entry("!", Type.NOT), entry("~", Type.NOT), entry("^", Type.XOR),
            entry("=", Type.EQ), entry("<", Type.LT), entry(">", Type.GT),
            entry("(", Type.LPAREN), entry(")", Type.RPAREN), entry("[", Type.LBRACKET), entry("]", Type.RBRACKET),
            entry(",", Type.COMMA), entry(".", Type.DOT), entry(";", Type.SEMI),
            entry("∧", Type.AND), entry("∨", Type.OR), entry("¬", Type.NOT),
            entry("→", Type.IMPLIES), entry("↔", Type.IFF), entry("⊕", Type.XOR),
            entry("∀", Type.FORALL), entry("∃", Type.EXISTS), entry("⊤", Type.TRUE), entry("⊥", Type.FALSE),
            entry("□", Type.ALWAYS), entry("◇", Type.EVENTUALLY), entry("○", Type.NEXT),
            entry("■", Type.HISTORICALLY), entry("●", Type.YESTERDAY), entry("⧫", Type.ONCE),
            entry("≠", Type.NEQ), entry("≤", Type.LEQ), entry("≥", Type.GEQ));

    private static final List<Section> SECTIONS = List.of(
            new Section(Type.TYPE_DECL_START, "type", "declaration", "starts"),
            new Section(Type.TYPE_DECL_END, "type", "declaration", "ends"),
            new Section(Type.POLICY_START, "policy", "starts"),
            new Section(Type.POLICY_END, "policy", "ends"));

    private final String src;
    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private Lexer(String src) {
        this.src = src;
    }

    /** The complete token stream of {@code src}, always terminated by an {@link Type#EOF} token. */
    public static List<Token> tokenize(String src) throws LexException {
        var lexer = new Lexer(src);
        var tokens = new ArrayList<Token>();
        Token t;
        do {
            t = lexer.next();
            tokens.add(t);
        } while (t.type() != Type.EOF);
        return tokens;
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private Token next() throws LexException {
        skipWhitespaceAndComments();
        if (pos >= src.length()) return new Token(Type.EOF, "", line, col);

        int startLine = line, startCol = col;
        var c = src.charAt(pos);

        if (isIdentStart(c)) {
            for (var s : SECTIONS) {
                var end = matchWords(s.words());
                if (end > 0) {
                    var text = src.substring(pos, end);
                    advance(end - pos);
                    return new Token(s.type(), text, startLine, startCol);
                }
            }
            var word = identifier();
            return new Token(KEYWORDS.getOrDefault(word, Type.IDENT), word, startLine, startCol);
        }
        if (c == '@' && pos + 1 < src.length() && isIdentStart(src.charAt(pos + 1))) {
            advance(1);
            return new Token(Type.CONST, identifier(), startLine, startCol);
        }
        if (c == '"') return new Token(Type.STRING, string(), startLine, startCol);
        if (c >= '0' && c <= '9') {
            var start = pos;
            while (pos < src.length() && src.charAt(pos) >= '0' && src.charAt(pos) <= '9') advance(1);
            return new Token(Type.INT, src.substring(start, pos), startLine, startCol);
        }
        for (var s : SYMBOLS) {
            if (src.startsWith(s.getKey(), pos)) {
                advance(s.getKey().length());
                return new Token(s.getValue(), s.getKey(), startLine, startCol);
            }
        }
        var cp = src.codePointAt(pos);
        throw error("Unrecognized character '" + Character.toString(cp) + "'", cp);
    }

    /** End offset of {@code words} separated by whitespace at the current position, or -1. */
    private int matchWords(String... words) {
        var p = pos;
        for (var i = 0; i < words.length; i++) {
            if (i > 0) {
                var ws = p;
                while (p < src.length() && Character.isWhitespace(src.charAt(p))) p++;
                if (p == ws) return -1;
            }
            if (!src.startsWith(words[i], p)) return -1;
            p += words[i].length();
            if (p < src.length() && isIdentPart(src.charAt(p))) return -1;
        }
        return p;
    }

    private String identifier() {
        var start = pos;
        while (pos < src.length() && isIdentPart(src.charAt(pos))) advance(1);
        return src.substring(start, pos);
    }

    private String string() throws LexException {
        int startLine = line, startCol = col;
        advance(1);
        var sb = new StringBuilder();
        while (true) {
            if (pos >= src.length())
                throw new LexException("Unterminated string literal", '"', startLine, startCol, context());
            var c = src.charAt(pos);
            if (c == '"') {
                advance(1);
                return sb.toString();
            }
            if (c == '\\') {
                if (pos + 1 >= src.length())
                    throw new LexException("Unterminated string literal", '"', startLine, startCol, context());
                var escaped = src.charAt(pos + 1);
                switch (escaped) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> throw error("Invalid escape sequence '\\" + escaped + "'", escaped);
                }
                advance(2);
            } else {
                sb.append(c);
                advance(1);
            }
        }
    }

    private void skipWhitespaceAndComments() throws LexException {
        while (pos < src.length()) {
            var c = src.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance(1);
            } else if (src.startsWith("(*", pos)) {
                int startLine = line, startCol = col;
                var end = src.indexOf("*)", pos + 2);
                if (end < 0) throw new LexException("Unterminated comment", '(', startLine, startCol, context());
                advance(end + 2 - pos);
            } else {
                return;
            }
        }
    }

    private void advance(int n) {
        for (var i = 0; i < n; i++) {
            if (src.charAt(pos++) == '\n') {
                line++;
                col = 1;
            } else {
                col++;
            }
        }
    }

    private String context() {
        return src.substring(Math.max(0, pos - CONTEXT_BUFFER_SIZE), pos);
    }

    private LexException error(String message, int offending) {
        return new LexException(message, offending, line, col, context());
    }

    public enum Type {
        IDENT, CONST, INT, STRING,
        TRUE, FALSE, NOT, AND, OR, IMPLIES, IFF, XOR,
        FORALL, EXISTS,
        UNTIL, SINCE, ALWAYS, EVENTUALLY, NEXT, HISTORICALLY, YESTERDAY, ONCE,
        EQ, NEQ, LT, LEQ, GT, GEQ,
        LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, DOT, SEMI, ANNOT_START,
        REGULATION, VERSION, EFFECTIVE_DATE, TYPE,
        TYPE_DECL_START, TYPE_DECL_END, POLICY_START, POLICY_END,
        EOF
    }

    public record Token(Type type, String text, int line, int col) {
        @Override
        public String toString() {
            return type == Type.EOF ? "end of input" : type + " '" + text + "'";
        }
    }

    private record Section(Type type, String... words) {
    }
}
