package dumb.regcheck;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.regcheck.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static dumb.regcheck.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Answers a query formula against a policy corpus: type-checks the query, ranks policies by the Jaccard similarity
 * of predicate names, evaluates every policy that clears the threshold and aggregates the verdicts.
 */
public final class QueryEngine {

    public static final double DEFAULT_MIN_SCORE = 0.1;

    private final TypeEnvironment env;
    private final double minScore;

    public QueryEngine(TypeEnvironment env) {
        this(env, DEFAULT_MIN_SCORE);
    }

    public QueryEngine(TypeEnvironment env, double minScore) {
        this.env = requireNonNull(env);
        this.minScore = minScore;
    }

    /**
     * @throws TypeCheckException if {@code query} is not well typed; nothing is evaluated in that case
     */
    public static QueryResponse process(Formula query, @Nullable String regulation, Domain domain, Facts facts,
                                        FunctionTable functions, TypeEnvironment env, PolicyDatabase corpus) {
        return new QueryEngine(env).process(query, regulation, new Evaluator(domain, facts, functions), corpus);
    }

    public QueryResponse process(Formula query, @Nullable String regulation, Evaluator evaluator, PolicyDatabase corpus) {
        var errors = TypeChecker.check(query, env);
        if (!errors.isEmpty()) throw new TypeCheckException(errors);

        var db = regulation == null ? corpus : corpus.filterByRegulation(regulation);
        var matches = findRelevant(query, db);
        message("Query matched " + matches.size() + " of " + db.size() + " policies" +
                (regulation == null ? "" : " in " + regulation));

        var evaluations = matches.stream().map(m -> evaluate(m.policy(), evaluator)).toList();
        var violations = evaluations.stream().filter(e -> !e.satisfied()).map(Evaluation::policyId).toList();
        return new QueryResponse(query, matches, evaluations, violations.isEmpty(), violations);
    }

    /** Policies scoring at least the threshold, best first; equal scores keep corpus order. */
    public List<Match> findRelevant(Formula query, PolicyDatabase db) {
        var matches = new ArrayList<Match>();
        for (var p : db.policies()) {
            var r = relevance(query, p.formula());
            if (r.score() >= minScore) matches.add(new Match(p, r.score(), r.matched()));
        }
        matches.sort(Comparator.comparingDouble(Match::score).reversed());
        return matches;
    }

    /**
     * Jaccard similarity of the predicate-name sets of two formulas; 0 when neither has predicates.
     * Terms do not contribute.
     */
    public static Relevance relevance(Formula query, Formula candidate) {
        var q = new TreeSet<>(query.predicates());
        var c = new TreeSet<>(candidate.predicates());
        var matched = new TreeSet<>(q);
        matched.retainAll(c);
        var union = new TreeSet<>(q);
        union.addAll(c);
        var score = union.isEmpty() ? 0.0 : (double) matched.size() / union.size();
        return new Relevance(score, List.copyOf(matched));
    }

    public static Evaluation evaluate(PolicyEntry p, Evaluator evaluator) {
        var result = evaluator.eval(p.formula());
        var explanation = result
                ? "Policy " + p.id() + " is satisfied by current facts"
                : "Policy " + p.id() + " is VIOLATED by current facts";
        return new Evaluation(p.id(), p.regulation(), p.section(), p.description(), p.formula().toText(), result, explanation);
    }

    public record Relevance(double score, List<String> matched) {
    }

    @JsonPropertyOrder({"policy_id", "regulation", "section", "description", "relevance_score", "matched_terms"})
    public record Match(@JsonIgnore PolicyEntry policy,
                        @JsonProperty("relevance_score") double score,
                        @JsonProperty("matched_terms") List<String> matchedTerms) {
        public Match {
            requireNonNull(policy);
            matchedTerms = List.copyOf(matchedTerms);
        }

        @JsonProperty("policy_id")
        public String policyId() {
            return policy.id();
        }

        @JsonProperty("regulation")
        public String regulation() {
            return policy.regulation();
        }

        @JsonProperty("section")
        public String section() {
            return policy.section();
        }

        @JsonProperty("description")
        public String description() {
            return policy.description();
        }
    }

    @JsonPropertyOrder({"policy_id", "regulation", "section", "description", "formula_text", "evaluation", "explanation"})
    public record Evaluation(@JsonProperty("policy_id") String policyId,
                             String regulation,
                             String section,
                             String description,
                             @JsonProperty("formula_text") String formulaText,
                             @JsonIgnore boolean satisfied,
                             String explanation) {

        @JsonProperty("evaluation")
        public Map<String, String> evaluation() {
            return Map.of("result", String.valueOf(satisfied));
        }
    }

    @JsonPropertyOrder({"query_formula", "matched_policies", "evaluations", "overall_compliant", "violations"})
    public record QueryResponse(@JsonIgnore Formula queryFormula,
                                @JsonProperty("matched_policies") List<Match> matchedPolicies,
                                List<Evaluation> evaluations,
                                @JsonProperty("overall_compliant") boolean overallCompliant,
                                List<String> violations) {
        public QueryResponse {
            requireNonNull(queryFormula);
            matchedPolicies = List.copyOf(matchedPolicies);
            evaluations = List.copyOf(evaluations);
            violations = List.copyOf(violations);
        }

        @JsonProperty("query_formula")
        public JsonNode queryFormulaJson() {
            return queryFormula.toJson();
        }

        public JsonNode toJson() {
            return Json.node(this);
        }

        /** Human-readable report of the matches, verdicts and violations. */
        public String report() {
            var sb = new StringBuilder("=== QUERY EVALUATION RESULTS ===\n\n");
            sb.append("Query Formula: ").append(queryFormula.toText()).append("\n\n");
            sb.append("Matched ").append(matchedPolicies.size()).append(" relevant policies\n\n");
            sb.append("--- POLICY EVALUATIONS ---\n\n");
            for (var e : evaluations) {
                sb.append('[').append(e.satisfied() ? "✓ COMPLIANT" : "✗ VIOLATION").append("] ")
                        .append(e.policyId()).append(" (").append(e.regulation()).append(' ').append(e.section()).append(")\n");
                sb.append("    Description: ").append(e.description()).append('\n');
                sb.append("    Formula: ").append(e.formulaText()).append('\n');
                sb.append("    ").append(e.explanation()).append("\n\n");
            }
            sb.append("--- OVERALL RESULT ---\n");
            if (overallCompliant) {
                sb.append("✓ ALL POLICIES SATISFIED - COMPLIANT\n");
            } else {
                sb.append("✗ ").append(violations.size()).append(" VIOLATIONS FOUND\n");
                violations.forEach(v -> sb.append("  - ").append(v).append('\n'));
            }
            return sb.toString();
        }
    }
}
