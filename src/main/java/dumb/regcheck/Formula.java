package dumb.regcheck;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.regcheck.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Formulas of bounded first-order temporal logic.
 * <p>
 * Every variant renders through {@link #toText()} to source the {@link Parser} reads back as an equal formula.
 */
sealed public interface Formula permits Formula.True, Formula.False, Formula.Predicate, Formula.Not,
        Formula.BinLogical, Formula.BinTemporal, Formula.UnTemporal, Formula.Quantified, Formula.Annotated {

    Set<String> COMPARISONS = Set.of("=", "!=", "<", "<=", ">", ">=");

    static Predicate pred(String name, Term... args) {
        return new Predicate(name, List.of(args));
    }

    static Not not(Formula f) {
        return new Not(f);
    }

    static BinLogical and(Formula l, Formula r) {
        return new BinLogical(LogicalOp.AND, l, r);
    }

    static BinLogical or(Formula l, Formula r) {
        return new BinLogical(LogicalOp.OR, l, r);
    }

    static BinLogical implies(Formula l, Formula r) {
        return new BinLogical(LogicalOp.IMPLIES, l, r);
    }

    static Quantified forall(List<String> vars, Formula body) {
        return new Quantified(Quantifier.FORALL, vars, body);
    }

    String toText();

    JsonNode toJson();

    /** Predicate names occurring anywhere in this formula, in order of first occurrence. */
    default Set<String> predicates() {
        var names = new LinkedHashSet<String>();
        collectPredicates(this, names);
        return names;
    }

    private static void collectPredicates(Formula f, Set<String> names) {
        if (f instanceof Predicate p) {
            names.add(p.name());
        } else if (f instanceof Not n) {
            collectPredicates(n.body(), names);
        } else if (f instanceof BinLogical b) {
            collectPredicates(b.left(), names);
            collectPredicates(b.right(), names);
        } else if (f instanceof BinTemporal b) {
            collectPredicates(b.left(), names);
            collectPredicates(b.right(), names);
        } else if (f instanceof UnTemporal u) {
            collectPredicates(u.body(), names);
        } else if (f instanceof Quantified q) {
            collectPredicates(q.body(), names);
        } else if (f instanceof Annotated a) {
            collectPredicates(a.body(), names);
        }
    }

    private static String paren(Formula f) {
        return f instanceof Predicate p && !p.isComparison() || f instanceof True || f instanceof False ? f.toText() : "(" + f.toText() + ")";
    }

    private static ObjectNode typed(String type) {
        return Json.node().put("type", type);
    }

    private static JsonNode boundJson(@Nullable Bound bound) {
        return bound == null ? Json.the.nullNode() : Json.node().put("lower", bound.lo()).put("upper", bound.hi());
    }

    enum LogicalOp {
        AND("∧"), OR("∨"), IMPLIES("→"), IFF("↔"), XOR("⊕");

        public final String symbol;

        LogicalOp(String symbol) {
            this.symbol = symbol;
        }

        public String jsonName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    enum TemporalOp {
        UNTIL, SINCE;

        public String jsonName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    enum UnaryTemporalOp {
        ALWAYS, NEXT, EVENTUALLY, HISTORICALLY, YESTERDAY, ONCE;

        public String jsonName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    enum Quantifier {
        FORALL("∀"), EXISTS("∃");

        public final String symbol;

        Quantifier(String symbol) {
            this.symbol = symbol;
        }

        public String jsonName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Temporal interval {@code [lo,hi]}. Not validated here: ill-formed bounds are reported by the {@link TypeChecker}.
     */
    record Bound(int lo, int hi) {
        public boolean wellFormed() {
            return lo >= 0 && lo <= hi;
        }

        @Override
        public String toString() {
            return "[" + lo + "," + hi + "]";
        }

        static String text(@Nullable Bound b) {
            return b == null ? "" : b.toString();
        }
    }

    record True() implements Formula {
        @Override
        public String toText() {
            return "⊤";
        }

        @Override
        public JsonNode toJson() {
            return typed("true");
        }
    }

    record False() implements Formula {
        @Override
        public String toText() {
            return "⊥";
        }

        @Override
        public JsonNode toJson() {
            return typed("false");
        }
    }

    record Predicate(String name, List<Term> args) implements Formula {
        public Predicate {
            requireNonNull(name);
            args = List.copyOf(requireNonNull(args));
        }

        public boolean isComparison() {
            return args.size() == 2 && COMPARISONS.contains(name);
        }

        @Override
        public String toText() {
            if (isComparison()) return args.get(0).toText() + " " + name + " " + args.get(1).toText();
            if (args.isEmpty()) return name;
            return args.stream().map(Term::toText).collect(Collectors.joining(", ", name + "(", ")"));
        }

        @Override
        public JsonNode toJson() {
            var a = Json.array();
            args.forEach(t -> a.add(t.toJson()));
            var n = typed("predicate").put("name", name);
            n.set("args", a);
            return n;
        }
    }

    record Not(Formula body) implements Formula {
        public Not {
            requireNonNull(body);
        }

        @Override
        public String toText() {
            return "¬" + paren(body);
        }

        @Override
        public JsonNode toJson() {
            var n = typed("not");
            n.set("formula", body.toJson());
            return n;
        }
    }

    record BinLogical(LogicalOp op, Formula left, Formula right) implements Formula {
        public BinLogical {
            requireNonNull(op);
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public String toText() {
            return paren(left) + " " + op.symbol + " " + paren(right);
        }

        @Override
        public JsonNode toJson() {
            var n = typed("binary_logical").put("operator", op.jsonName());
            n.set("left", left.toJson());
            n.set("right", right.toJson());
            return n;
        }
    }

    record BinTemporal(TemporalOp op, Formula left, Formula right, @Nullable Bound bound) implements Formula {
        public BinTemporal {
            requireNonNull(op);
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public String toText() {
            return paren(left) + " " + op.jsonName() + Bound.text(bound) + " " + paren(right);
        }

        @Override
        public JsonNode toJson() {
            var n = typed("binary_temporal").put("operator", op.jsonName());
            n.set("left", left.toJson());
            n.set("right", right.toJson());
            n.set("bound", boundJson(bound));
            return n;
        }
    }

    record UnTemporal(UnaryTemporalOp op, Formula body, @Nullable Bound bound) implements Formula {
        public UnTemporal {
            requireNonNull(op);
            requireNonNull(body);
        }

        @Override
        public String toText() {
            return op.jsonName() + Bound.text(bound) + " " + paren(body);
        }

        @Override
        public JsonNode toJson() {
            var n = typed("unary_temporal").put("operator", op.jsonName());
            n.set("formula", body.toJson());
            n.set("bound", boundJson(bound));
            return n;
        }
    }

    record Quantified(Quantifier quantifier, List<String> vars, Formula body) implements Formula {
        public Quantified {
            requireNonNull(quantifier);
            vars = List.copyOf(requireNonNull(vars));
            requireNonNull(body);
            if (vars.isEmpty()) throw new IllegalArgumentException("Quantifier must bind at least one variable");
        }

        @Override
        public String toText() {
            return quantifier.symbol + String.join(",", vars) + ". " + body.toText();
        }

        @Override
        public JsonNode toJson() {
            var v = Json.array();
            vars.forEach(v::add);
            var n = typed("quantified").put("quantifier", quantifier.jsonName());
            n.set("variables", v);
            n.set("formula", body.toJson());
            return n;
        }
    }

    /**
     * A formula carrying a legal citation such as {@code "§164.502(a) - Uses and disclosures"}.
     */
    record Annotated(Formula body, String citation) implements Formula {
        public Annotated {
            requireNonNull(body);
            requireNonNull(citation);
        }

        /** Text before the first {@code -}, trimmed. */
        public String section() {
            var i = citation.indexOf('-');
            return (i < 0 ? citation : citation.substring(0, i)).trim();
        }

        /** Text after the first {@code -}, trimmed, or {@code "No description"}. */
        public String description() {
            var i = citation.indexOf('-');
            return i < 0 ? "No description" : citation.substring(i + 1).trim();
        }

        @Override
        public String toText() {
            return "@[" + Term.quote(citation) + "] " + body.toText();
        }

        @Override
        public JsonNode toJson() {
            var n = typed("annotated").put("citation", citation);
            n.set("formula", body.toJson());
            return n;
        }
    }
}
