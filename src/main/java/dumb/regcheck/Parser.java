package dumb.regcheck;

import dumb.regcheck.Formula.BinLogical;
import dumb.regcheck.Formula.BinTemporal;
import dumb.regcheck.Formula.Bound;
import dumb.regcheck.Formula.LogicalOp;
import dumb.regcheck.Formula.Quantifier;
import dumb.regcheck.Formula.TemporalOp;
import dumb.regcheck.Formula.UnaryTemporalOp;
import dumb.regcheck.Lexer.Token;
import dumb.regcheck.Lexer.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Precedence-climbing parser producing {@link PolicyFile}s and {@link Formula}s.
 * <p>
 * Binary operators, lowest to highest: {@code iff} (right), {@code implies} (right), {@code until}/{@code since}
 * (right), {@code or}/{@code xor} (left), {@code and} (left). Comparisons, negation and unary temporal operators
 * bind tighter and are parsed in the prefix layer. Quantifiers and annotations scope over the rest of the
 * enclosing formula.
 */
public final class Parser {

    private static final Map<Type, BinaryOp> BINARY = Map.of(
            Type.IFF, new BinaryOp(1, true),
            Type.IMPLIES, new BinaryOp(2, true),
            Type.UNTIL, new BinaryOp(3, true),
            Type.SINCE, new BinaryOp(3, true),
            Type.OR, new BinaryOp(4, false),
            Type.XOR, new BinaryOp(4, false),
            Type.AND, new BinaryOp(5, false));

    private static final Map<Type, String> COMPARISON = Map.of(
            Type.EQ, "=", Type.NEQ, "!=", Type.LT, "<", Type.LEQ, "<=", Type.GT, ">", Type.GEQ, ">=");

    private static final Map<Type, UnaryTemporalOp> UNARY_TEMPORAL = Map.ofEntries(
            entry(Type.ALWAYS, UnaryTemporalOp.ALWAYS), entry(Type.EVENTUALLY, UnaryTemporalOp.EVENTUALLY),
            entry(Type.NEXT, UnaryTemporalOp.NEXT), entry(Type.HISTORICALLY, UnaryTemporalOp.HISTORICALLY),
            entry(Type.YESTERDAY, UnaryTemporalOp.YESTERDAY), entry(Type.ONCE, UnaryTemporalOp.ONCE));

    private final List<Token> tokens;
    private int pos = 0;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /** Parse a complete policy source: optional regulation header, optional type section, policy section. */
    public static PolicyFile parse(String src) throws ParseException {
        var p = new Parser(Lexer.tokenize(src));
        var file = p.policyFile();
        p.expect(Type.EOF);
        return file;
    }

    /**
     * Parse a single formula, optionally annotated with {@code @["..."]} and optionally terminated by {@code ;}.
     */
    public static Formula parseFormula(String src) throws ParseException {
        var p = new Parser(Lexer.tokenize(src));
        var f = p.annotatedFormula();
        p.accept(Type.SEMI);
        p.expect(Type.EOF);
        return f;
    }

    private PolicyFile policyFile() throws ParseException {
        var metadata = peek(Type.REGULATION) ? metadata() : null;

        var typeDecls = new ArrayList<String>();
        if (accept(Type.TYPE_DECL_START)) {
            while (accept(Type.TYPE)) typeDecls.add(expect(Type.IDENT).text());
            expect(Type.TYPE_DECL_END);
        }

        expect(Type.POLICY_START);
        var policies = new ArrayList<Formula>();
        while (!peek(Type.POLICY_END)) {
            policies.add(annotatedFormula());
            if (!accept(Type.SEMI) && !peek(Type.POLICY_END))
                throw error("Expected ';' after policy formula", current());
        }
        expect(Type.POLICY_END);
        return new PolicyFile(metadata, typeDecls, policies);
    }

    private PolicyFile.Metadata metadata() throws ParseException {
        expect(Type.REGULATION);
        var name = value("regulation name");
        String version = null, effectiveDate = null;
        if (accept(Type.VERSION)) version = value("version");
        if (accept(Type.EFFECTIVE_DATE)) effectiveDate = value("effective date");
        return new PolicyFile.Metadata(name, version, effectiveDate);
    }

    private String value(String what) throws ParseException {
        var t = current();
        if (t.type() == Type.IDENT || t.type() == Type.STRING || t.type() == Type.INT) {
            pos++;
            return t.text();
        }
        throw error("Expected " + what, t);
    }

    private Formula annotatedFormula() throws ParseException {
        if (accept(Type.ANNOT_START)) {
            var citation = expect(Type.STRING).text();
            expect(Type.RBRACKET);
            return new Formula.Annotated(formula(0), citation);
        }
        return formula(0);
    }

    private Formula formula(int minPrec) throws ParseException {
        var left = simpleFormula();
        while (true) {
            var t = current();
            var op = BINARY.get(t.type());
            if (op == null || op.prec() < minPrec) return left;
            pos++;
            var bound = (t.type() == Type.UNTIL || t.type() == Type.SINCE) ? bound() : null;
            var right = formula(op.rightAssoc() ? op.prec() : op.prec() + 1);
            left = combine(t.type(), left, right, bound);
        }
    }

    private static Formula combine(Type type, Formula l, Formula r, @Nullable Bound bound) {
        return switch (type) {
            case AND -> new BinLogical(LogicalOp.AND, l, r);
            case OR -> new BinLogical(LogicalOp.OR, l, r);
            case XOR -> new BinLogical(LogicalOp.XOR, l, r);
            case IMPLIES -> new BinLogical(LogicalOp.IMPLIES, l, r);
            case IFF -> new BinLogical(LogicalOp.IFF, l, r);
            case UNTIL -> new BinTemporal(TemporalOp.UNTIL, l, r, bound);
            case SINCE -> new BinTemporal(TemporalOp.SINCE, l, r, bound);
            default -> throw new IllegalStateException("Not a binary operator: " + type);
        };
    }

    private Formula simpleFormula() throws ParseException {
        var t = current();
        switch (t.type()) {
            case TRUE -> {
                pos++;
                return new Formula.True();
            }
            case FALSE -> {
                pos++;
                return new Formula.False();
            }
            case NOT -> {
                pos++;
                return new Formula.Not(simpleFormula());
            }
            case FORALL, EXISTS -> {
                pos++;
                var vars = new ArrayList<String>();
                do {
                    vars.add(expect(Type.IDENT).text());
                } while (accept(Type.COMMA));
                expect(Type.DOT);
                var q = t.type() == Type.FORALL ? Quantifier.FORALL : Quantifier.EXISTS;
                return new Formula.Quantified(q, vars, formula(0));
            }
            case ANNOT_START -> {
                return annotatedFormula();
            }
            case LPAREN -> {
                pos++;
                var f = formula(0);
                expect(Type.RPAREN);
                return f;
            }
            case ALWAYS, EVENTUALLY, NEXT, HISTORICALLY, YESTERDAY, ONCE -> {
                pos++;
                var bound = bound();
                return new Formula.UnTemporal(UNARY_TEMPORAL.get(t.type()), simpleFormula(), bound);
            }
            case IDENT, CONST, INT, STRING -> {
                return atom();
            }
            default -> throw error("Expected a formula", t);
        }
    }

    /** Predicate application, nullary predicate, or term comparison. */
    private Formula atom() throws ParseException {
        var start = current();
        var term = term();
        var cmp = COMPARISON.get(current().type());
        if (cmp != null) {
            pos++;
            var right = term();
            if (COMPARISON.containsKey(current().type()))
                throw error("Comparisons cannot be chained", current());
            return new Formula.Predicate(cmp, List.of(term, right));
        }
        if (term instanceof Term.Func f) return new Formula.Predicate(f.name(), f.args());
        if (term instanceof Term.Var v) return new Formula.Predicate(v.name(), List.of());
        throw error("Expected a predicate or comparison", start);
    }

    private Term term() throws ParseException {
        var t = current();
        switch (t.type()) {
            case IDENT -> {
                pos++;
                if (!accept(Type.LPAREN)) return new Term.Var(t.text());
                var args = new ArrayList<Term>();
                if (!accept(Type.RPAREN)) {
                    do {
                        args.add(term());
                    } while (accept(Type.COMMA));
                    expect(Type.RPAREN);
                }
                return new Term.Func(t.text(), args);
            }
            case CONST, INT, STRING -> {
                pos++;
                return new Term.Const(t.text());
            }
            default -> throw error("Expected a term", t);
        }
    }

    private @Nullable Bound bound() throws ParseException {
        if (!accept(Type.LBRACKET)) return null;
        var lo = integer();
        expect(Type.COMMA);
        var hi = integer();
        expect(Type.RBRACKET);
        return new Bound(lo, hi);
    }

    private int integer() throws ParseException {
        var t = expect(Type.INT);
        try {
            return Integer.parseInt(t.text());
        } catch (NumberFormatException e) {
            throw error("Integer out of range", t);
        }
    }

    private Token current() {
        return tokens.get(pos);
    }

    private boolean peek(Type type) {
        return current().type() == type;
    }

    private boolean accept(Type type) {
        if (!peek(type)) return false;
        pos++;
        return true;
    }

    private Token expect(Type type) throws ParseException {
        var t = current();
        if (t.type() != type) throw error("Expected " + type, t);
        pos++;
        return t;
    }

    private ParseException error(String message, Token found) {
        return new ParseException(message + " found " + found, found.line(), found.col(), "");
    }

    private record BinaryOp(int prec, boolean rightAssoc) {
    }
}
