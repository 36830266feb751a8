package dumb.regcheck;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Two-valued ground semantics of formulas over a finite {@link Domain}, {@link Facts} and a {@link FunctionTable}.
 * <p>
 * Closed world: a predicate whose arguments cannot all be evaluated, or whose ground tuple is not a fact, is false.
 * Temporal operators are evaluated structurally, not over a trace: {@code l until r} and {@code l since r} mean
 * {@code l ∧ r}; a unary temporal operator means its body. Bounds and operator identity are ignored here.
 * <p>
 * Quantifiers enumerate {@code |domain|^|vars|} assignments; callers bound domain size and nesting depth.
 */
public final class Evaluator {

    private final Domain domain;
    private final Facts facts;
    private final FunctionTable functions;

    public Evaluator(Domain domain, Facts facts, FunctionTable functions) {
        this.domain = requireNonNull(domain);
        this.facts = requireNonNull(facts);
        this.functions = requireNonNull(functions);
    }

    public boolean eval(Formula f) {
        return eval(Map.of(), f);
    }

    /** One verdict per formula, in order, labelled {@code Formula 1}, {@code Formula 2}, ... */
    public List<Result> evalPolicy(List<Formula> formulas) {
        var results = new ArrayList<Result>(formulas.size());
        for (var i = 0; i < formulas.size(); i++)
            results.add(new Result("Formula " + (i + 1), eval(formulas.get(i))));
        return results;
    }

    public boolean eval(Map<String, String> assignment, Formula f) {
        if (f instanceof Formula.True) return true;
        if (f instanceof Formula.False) return false;
        if (f instanceof Formula.Predicate p) return predicate(assignment, p);
        if (f instanceof Formula.Not n) return !eval(assignment, n.body());
        if (f instanceof Formula.BinLogical b) {
            return switch (b.op()) {
                case AND -> eval(assignment, b.left()) && eval(assignment, b.right());
                case OR -> eval(assignment, b.left()) || eval(assignment, b.right());
                case IMPLIES -> !eval(assignment, b.left()) || eval(assignment, b.right());
                case IFF -> eval(assignment, b.left()) == eval(assignment, b.right());
                case XOR -> eval(assignment, b.left()) != eval(assignment, b.right());
            };
        }
        if (f instanceof Formula.BinTemporal b) return eval(assignment, b.left()) && eval(assignment, b.right());
        if (f instanceof Formula.UnTemporal u) return eval(assignment, u.body());
        if (f instanceof Formula.Annotated a) return eval(assignment, a.body());
        if (f instanceof Formula.Quantified q)
            return search(q.vars(), 0, assignment, q.body(), q.quantifier() == Formula.Quantifier.FORALL);
        throw new IllegalStateException("Unhandled formula: " + f);
    }

    /**
     * Forall: true unless some assignment falsifies {@code body}. Exists: true once some assignment satisfies it.
     * Variables are bound left to right over the domain in its given order.
     */
    private boolean search(List<String> vars, int i, Map<String, String> assignment, Formula body, boolean forall) {
        if (i == vars.size()) return eval(assignment, body);
        for (var entity : domain.entities()) {
            var next = new HashMap<>(assignment);
            next.put(vars.get(i), entity);
            var r = search(vars, i + 1, next, body, forall);
            if (forall && !r) return false;
            if (!forall && r) return true;
        }
        return forall;
    }

    private boolean predicate(Map<String, String> assignment, Formula.Predicate p) {
        var values = new ArrayList<String>(p.args().size());
        for (var t : p.args()) {
            var v = term(assignment, t);
            if (v == null) return false;
            values.add(v);
        }
        if (Formula.COMPARISONS.contains(p.name()))
            return values.size() == 2 && compare(p.name(), values.get(0), values.get(1));
        return facts.holds(p.name(), values);
    }

    /** Value of {@code t}, or {@code null} if it is unevaluable. Constants evaluate to their own name. */
    public @Nullable String term(Map<String, String> assignment, Term t) {
        if (t instanceof Term.Var v) return assignment.get(v.name());
        if (t instanceof Term.Const c) return c.name();
        var f = (Term.Func) t;
        var args = new ArrayList<String>(f.args().size());
        for (var a : f.args()) {
            var v = term(assignment, a);
            if (v == null) return null;
            args.add(v);
        }
        return functions.apply(f.name(), args).orElse(null);
    }

    /** Equality compares strings; orderings compare integers and are false if either side is not one. */
    static boolean compare(String op, String a, String b) {
        if (op.equals("=")) return a.equals(b);
        if (op.equals("!=")) return !a.equals(b);
        long x, y;
        try {
            x = Long.parseLong(a.trim());
            y = Long.parseLong(b.trim());
        } catch (NumberFormatException e) {
            return false;
        }
        return switch (op) {
            case "<" -> x < y;
            case "<=" -> x <= y;
            case ">" -> x > y;
            case ">=" -> x >= y;
            default -> false;
        };
    }

    public record Result(String label, boolean value) {
        @Override
        public String toString() {
            return label + ": " + (value ? "✓ True" : "✗ False");
        }
    }
}
