package dumb.regcheck;

import dumb.regcheck.TypeError.ArityMismatch;
import dumb.regcheck.TypeError.InvalidArgumentType;
import dumb.regcheck.TypeError.InvalidQuantifierBinding;
import dumb.regcheck.TypeError.InvalidTemporalBound;
import dumb.regcheck.TypeError.TypeMismatch;
import dumb.regcheck.TypeError.UnboundVariable;
import dumb.regcheck.TypeError.UnknownConst;
import dumb.regcheck.TypeError.UnknownFunction;
import dumb.regcheck.TypeError.UnknownPredicate;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Static check of formulas against a {@link TypeEnvironment}.
 * <p>
 * Quantifiers bind each listed variable to {@link Type#ENTITY} for their whole body; an inner quantifier may
 * rebind an outer variable. Checking a single formula stops at its first error; checking a policy file
 * checks every formula.
 */
public final class TypeChecker {

    private final TypeEnvironment env;

    public TypeChecker(TypeEnvironment env) {
        this.env = requireNonNull(env);
    }

    /** Errors of {@code f}; empty when it is well typed. */
    public static List<TypeError> check(Formula f, TypeEnvironment env) {
        return new TypeChecker(env).check(f);
    }

    public static List<FormulaErrors> checkPolicyFile(PolicyFile file, TypeEnvironment env) {
        return new TypeChecker(env).checkAll(file.policies());
    }

    public List<TypeError> check(Formula f) {
        var errors = new ArrayList<TypeError>(1);
        formula(f, null, errors);
        return errors;
    }

    /** One entry per failing formula, in formula order. */
    public List<FormulaErrors> checkAll(List<Formula> formulas) {
        var out = new ArrayList<FormulaErrors>();
        for (var i = 0; i < formulas.size(); i++) {
            var errors = check(formulas.get(i));
            if (!errors.isEmpty()) out.add(new FormulaErrors(i, formulas.get(i), errors));
        }
        return out;
    }

    private boolean formula(Formula f, @Nullable Context ctx, List<TypeError> errors) {
        if (f instanceof Formula.True || f instanceof Formula.False) return true;
        if (f instanceof Formula.Predicate p) return predicate(p, ctx, errors);
        if (f instanceof Formula.Not n) return formula(n.body(), ctx, errors);
        if (f instanceof Formula.Annotated a) return formula(a.body(), ctx, errors);
        if (f instanceof Formula.BinLogical b)
            return formula(b.left(), ctx, errors) && formula(b.right(), ctx, errors);
        if (f instanceof Formula.BinTemporal b)
            return bound(b.bound(), errors) && formula(b.left(), ctx, errors) && formula(b.right(), ctx, errors);
        if (f instanceof Formula.UnTemporal u)
            return bound(u.bound(), errors) && formula(u.body(), ctx, errors);
        if (f instanceof Formula.Quantified q) {
            var seen = new HashSet<String>();
            var inner = ctx;
            for (var v : q.vars()) {
                if (!seen.add(v)) {
                    errors.add(new InvalidQuantifierBinding("variable " + v + " bound twice by the same quantifier"));
                    return false;
                }
                inner = new Context(v, Type.ENTITY, inner);
            }
            return formula(q.body(), inner, errors);
        }
        throw new IllegalStateException("Unhandled formula: " + f);
    }

    private boolean predicate(Formula.Predicate p, @Nullable Context ctx, List<TypeError> errors) {
        var sig = env.predicate(p.name(), p.args().size());
        if (sig.isEmpty() && p.isComparison()) return comparison(p, ctx, errors);
        if (sig.isEmpty()) {
            errors.add(new UnknownPredicate(p.name()));
            return false;
        }
        return arguments(p.name(), sig.get(), p.args(), ctx, errors);
    }

    /** Built-in comparisons accept any two terms of the same type. */
    private boolean comparison(Formula.Predicate p, @Nullable Context ctx, List<TypeError> errors) {
        var left = term(p.args().get(0), ctx, errors);
        if (left.isEmpty()) return false;
        var right = term(p.args().get(1), ctx, errors);
        if (right.isEmpty()) return false;
        if (left.get() != right.get()) {
            errors.add(new TypeMismatch(left.get(), right.get()));
            return false;
        }
        return true;
    }

    private boolean arguments(String name, TypeEnvironment.Signature sig, List<Term> args, @Nullable Context ctx,
                              List<TypeError> errors) {
        if (sig.arity() != args.size()) {
            errors.add(new ArityMismatch(name, sig.arity(), args.size()));
            return false;
        }
        for (var i = 0; i < args.size(); i++) {
            var t = term(args.get(i), ctx, errors);
            if (t.isEmpty()) return false;
            var expected = sig.argTypes().get(i);
            if (expected != t.get()) {
                errors.add(new InvalidArgumentType(i, expected, t.get()));
                return false;
            }
        }
        return true;
    }

    private Optional<Type> term(Term t, @Nullable Context ctx, List<TypeError> errors) {
        if (t instanceof Term.Var v) {
            var type = Context.lookup(ctx, v.name());
            if (type == null) errors.add(new UnboundVariable(v.name()));
            return Optional.ofNullable(type);
        }
        if (t instanceof Term.Const c) {
            var type = env.constant(c.name());
            if (type.isEmpty() && Term.INTEGER.matcher(c.name()).matches()) return Optional.of(Type.INT);
            if (type.isEmpty()) errors.add(new UnknownConst(c.name()));
            return type;
        }
        var f = (Term.Func) t;
        var sig = env.function(f.name(), f.args().size());
        if (sig.isEmpty()) {
            errors.add(new UnknownFunction(f.name()));
            return Optional.empty();
        }
        return arguments(f.name(), sig.get(), f.args(), ctx, errors) ? Optional.of(sig.get().returnType()) : Optional.empty();
    }

    private static boolean bound(@Nullable Formula.Bound b, List<TypeError> errors) {
        if (b == null || b.wellFormed()) return true;
        errors.add(new InvalidTemporalBound("bounds must be: 0 <= l <= u, got " + b));
        return false;
    }

    /** Scoped variable bindings; innermost first. Extending never mutates the enclosing scope. */
    private record Context(String name, Type type, @Nullable Context parent) {
        static @Nullable Type lookup(@Nullable Context ctx, String name) {
            for (var c = ctx; c != null; c = c.parent) {
                if (c.name.equals(name)) return c.type;
            }
            return null;
        }
    }

    public record FormulaErrors(int index, Formula formula, List<TypeError> errors) {
        public FormulaErrors {
            errors = List.copyOf(errors);
        }
    }
}
