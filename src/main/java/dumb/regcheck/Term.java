package dumb.regcheck;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.regcheck.util.Json;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * First-order terms: variables, constants and applied function symbols.
 */
sealed public interface Term permits Term.Var, Term.Const, Term.Func {

    Pattern IDENTIFIER = Pattern.compile("^[\\p{L}_][\\p{L}\\p{N}_]*$");
    Pattern INTEGER = Pattern.compile("^[0-9]+$");

    static Var var(String name) {
        return new Var(name);
    }

    static Const constant(String name) {
        return new Const(name);
    }

    static Func func(String name, Term... args) {
        return new Func(name, List.of(args));
    }

    /** Source text the parser reads back as an equal term. */
    String toText();

    Set<String> vars();

    JsonNode toJson();

    static String quote(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t") + '"';
    }

    record Var(String name) implements Term {
        public Var {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Variable name must not be empty");
        }

        @Override
        public String toText() {
            return name;
        }

        @Override
        public Set<String> vars() {
            return Set.of(name);
        }

        @Override
        public JsonNode toJson() {
            return Json.node().put("type", "var").put("name", name);
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    /**
     * A nullary symbol. Written {@code @name}; integer and string literals are constants too.
     */
    record Const(String name) implements Term {
        public Const {
            requireNonNull(name);
        }

        @Override
        public String toText() {
            if (INTEGER.matcher(name).matches()) return name;
            return IDENTIFIER.matcher(name).matches() ? "@" + name : quote(name);
        }

        @Override
        public Set<String> vars() {
            return Set.of();
        }

        @Override
        public JsonNode toJson() {
            return Json.node().put("type", "const").put("name", name);
        }

        @Override
        public String toString() {
            return toText();
        }
    }

    record Func(String name, List<Term> args) implements Term {
        public Func {
            requireNonNull(name);
            args = List.copyOf(requireNonNull(args));
        }

        @Override
        public String toText() {
            return args.stream().map(Term::toText).collect(Collectors.joining(", ", name + "(", ")"));
        }

        @Override
        public Set<String> vars() {
            return args.stream().flatMap(t -> t.vars().stream()).collect(Collectors.toUnmodifiableSet());
        }

        @Override
        public JsonNode toJson() {
            var a = Json.array();
            args.forEach(t -> a.add(t.toJson()));
            var n = Json.node().put("type", "func").put("name", name);
            n.set("args", a);
            return n;
        }

        @Override
        public String toString() {
            return toText();
        }
    }
}
