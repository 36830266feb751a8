package dumb.regcheck;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.regcheck.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static dumb.regcheck.util.Log.warning;

/**
 * JSON form of terms, formulas, facts and query responses, and the request handler used by external callers.
 * <p>
 * A request is {@code {"formula": "...", "facts": {"facts": [{"predicate": p, "arguments": [..]}]}, "regulation": r}};
 * {@code regulation} is optional. Failures are answered with {@code {"error": msg, "success": false}}.
 */
public final class JsonBridge {

    private JsonBridge() {
    }

    public static JsonNode toJson(Term t) {
        return t.toJson();
    }

    public static JsonNode toJson(Formula f) {
        return f.toJson();
    }

    public static JsonNode toJson(QueryEngine.QueryResponse r) {
        return r.toJson();
    }

    public static Term term(JsonNode j) {
        var type = text(j, "type");
        return switch (type) {
            case "var" -> new Term.Var(text(j, "name"));
            case "const" -> new Term.Const(text(j, "name"));
            case "func" -> new Term.Func(text(j, "name"), terms(j.get("args")));
            default -> throw new IllegalArgumentException("Invalid term JSON: " + type);
        };
    }

    public static Formula formula(JsonNode j) {
        var type = text(j, "type");
        return switch (type) {
            case "true" -> new Formula.True();
            case "false" -> new Formula.False();
            case "predicate" -> new Formula.Predicate(text(j, "name"), terms(j.get("args")));
            case "not" -> new Formula.Not(formula(member(j, "formula")));
            case "binary_logical" -> new Formula.BinLogical(op(Formula.LogicalOp.class, text(j, "operator"), "operator"),
                    formula(member(j, "left")), formula(member(j, "right")));
            case "binary_temporal" -> new Formula.BinTemporal(op(Formula.TemporalOp.class, text(j, "operator"), "temporal operator"),
                    formula(member(j, "left")), formula(member(j, "right")), bound(j.get("bound")));
            case "unary_temporal" -> new Formula.UnTemporal(op(Formula.UnaryTemporalOp.class, text(j, "operator"), "unary temporal operator"),
                    formula(member(j, "formula")), bound(j.get("bound")));
            case "quantified" -> {
                var vars = new ArrayList<String>();
                var vs = member(j, "variables");
                if (!vs.isArray()) throw new IllegalArgumentException("'variables' must be an array");
                vs.forEach(v -> vars.add(v.asText()));
                yield new Formula.Quantified(op(Formula.Quantifier.class, text(j, "quantifier"), "quantifier"), vars,
                        formula(member(j, "formula")));
            }
            case "annotated" -> new Formula.Annotated(formula(member(j, "formula")), text(j, "citation"));
            default -> throw new IllegalArgumentException("Unknown formula type: " + type);
        };
    }

    public static JsonNode factsToJson(Facts facts) {
        var list = Json.array();
        for (var f : facts.facts()) {
            var n = Json.node().put("predicate", f.predicate());
            var args = n.putArray("arguments");
            f.args().forEach(args::add);
            list.add(n);
        }
        var root = Json.node();
        root.set("facts", list);
        return root;
    }

    public static Facts facts(JsonNode j) {
        var list = member(j, "facts");
        if (!list.isArray()) throw new IllegalArgumentException("'facts' must be an array");
        var facts = new LinkedHashSet<Facts.Fact>();
        for (var f : list) {
            var args = new ArrayList<String>();
            var a = member(f, "arguments");
            if (!a.isArray()) throw new IllegalArgumentException("'arguments' must be an array");
            a.forEach(x -> args.add(x.asText()));
            facts.add(new Facts.Fact(text(f, "predicate"), args));
        }
        return new Facts(facts);
    }

    /**
     * Answers one query request. The domain is every entity mentioned by the request's facts; no function values.
     * Never throws: failures become an error payload.
     */
    public static String handle(String request, TypeEnvironment env, PolicyDatabase corpus, double minScore) {
        try {
            var req = Json.tree(request);
            var formulaText = text(req, "formula");
            var facts = facts(member(req, "facts"));
            var reg = req.get("regulation");
            @Nullable String regulation = reg == null || reg.isNull() ? null : reg.asText();

            var query = query(formulaText);
            var domain = new Domain(List.copyOf(facts.entities()));
            var response = new QueryEngine(env, minScore)
                    .process(query, regulation, new Evaluator(domain, facts, FunctionTable.EMPTY), corpus);
            return Json.str(response.toJson());
        } catch (JsonProcessingException e) {
            return error("Failed to parse query request: " + e.getOriginalMessage());
        } catch (ParseException e) {
            return error("Parse error: " + e.getMessage());
        } catch (RuntimeException e) {
            return error(e.getMessage());
        }
    }

    public static String handle(String request, TypeEnvironment env, PolicyDatabase corpus) {
        return handle(request, env, corpus, QueryEngine.DEFAULT_MIN_SCORE);
    }

    /** Reads a whole request from {@code in}. An empty input is answered with an error payload. */
    public static String handle(InputStream in, TypeEnvironment env, PolicyDatabase corpus, double minScore) {
        String input;
        try (var r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            input = r.lines().collect(Collectors.joining("\n"));
        } catch (IOException | UncheckedIOException e) {
            return error("Cannot read request: " + e.getMessage());
        }
        return input.isBlank() ? error("No input provided") : handle(input, env, corpus, minScore);
    }

    public static String handle(Path file, TypeEnvironment env, PolicyDatabase corpus, double minScore) {
        try {
            return handle(Files.readString(file), env, corpus, minScore);
        } catch (IOException e) {
            return error("Cannot read " + file + ": " + e.getMessage());
        }
    }

    public static String error(@Nullable String message) {
        warning("Query request failed: " + message);
        ObjectNode n = Json.node().put("error", message == null ? "unknown error" : message).put("success", false);
        return Json.str(n);
    }

    /** A full policy file (its first policy is the query) or a single formula. */
    static Formula query(String src) throws ParseException {
        var sections = Lexer.tokenize(src).stream().anyMatch(t -> t.type() == Lexer.Type.POLICY_START);
        if (!sections) return Parser.parseFormula(src);
        var policies = Parser.parse(src).policies();
        if (policies.isEmpty()) throw new IllegalArgumentException("No formula provided");
        return policies.get(0);
    }

    private static List<Term> terms(@Nullable JsonNode args) {
        if (args == null || args.isNull()) return List.of();
        if (!args.isArray()) throw new IllegalArgumentException("'args' must be an array");
        var ts = new ArrayList<Term>(args.size());
        args.forEach(a -> ts.add(term(a)));
        return ts;
    }

    private static Formula.@Nullable Bound bound(@Nullable JsonNode b) {
        if (b == null || b.isNull()) return null;
        return new Formula.Bound(integer(b, "lower"), integer(b, "upper"));
    }

    private static int integer(JsonNode j, String field) {
        var v = member(j, field);
        if (!v.isInt()) throw new IllegalArgumentException("Field '" + field + "' must be an integer");
        return v.intValue();
    }

    private static <E extends Enum<E>> E op(Class<E> type, String name, String what) {
        try {
            return Enum.valueOf(type, name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + what + ": " + name, e);
        }
    }

    private static JsonNode member(JsonNode j, String field) {
        var v = j.get(field);
        if (v == null || v.isNull()) throw new IllegalArgumentException("Missing field '" + field + "'");
        return v;
    }

    private static String text(JsonNode j, String field) {
        var v = member(j, field);
        if (!v.isTextual()) throw new IllegalArgumentException("Field '" + field + "' must be a string");
        return v.asText();
    }
}
