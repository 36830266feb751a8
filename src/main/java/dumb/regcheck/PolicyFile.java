package dumb.regcheck;

import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A parsed {@code .policy} source: optional regulation header, declared type names and the policy formulas.
 */
public record PolicyFile(@Nullable Metadata metadata, List<String> typeDecls, List<Formula> policies) {
    public PolicyFile {
        typeDecls = List.copyOf(requireNonNull(typeDecls));
        policies = List.copyOf(requireNonNull(policies));
    }

    public String toText() {
        var sb = new StringBuilder();
        if (metadata != null) sb.append(metadata.toText()).append("\n\n");
        if (!typeDecls.isEmpty()) {
            sb.append("type declaration starts\n");
            typeDecls.forEach(t -> sb.append("type ").append(t).append('\n'));
            sb.append("type declaration ends\n\n");
        }
        sb.append("policy starts\n\n");
        policies.forEach(p -> sb.append(p.toText()).append("\n;\n\n"));
        sb.append("policy ends\n");
        return sb.toString();
    }

    public record Metadata(String name, @Nullable String version, @Nullable String effectiveDate) {
        public Metadata {
            requireNonNull(name);
        }

        public String toText() {
            var sb = new StringBuilder("regulation ")
                    .append(Term.IDENTIFIER.matcher(name).matches() ? name : Term.quote(name));
            if (version != null) sb.append(" version ").append(Term.quote(version));
            if (effectiveDate != null) sb.append(" effective_date ").append(Term.quote(effectiveDate));
            return sb.toString();
        }
    }
}
