package dumb.regcheck;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import static java.util.Objects.requireNonNull;

/**
 * One compiled rule of a regulation, with its citation split into section and description.
 */
public record PolicyEntry(String id, String regulation, String section, String description,
                          @JsonIgnore Formula formula) {
    public PolicyEntry {
        requireNonNull(id);
        requireNonNull(regulation);
        requireNonNull(section);
        requireNonNull(description);
        requireNonNull(formula);
    }

    @JsonProperty("formula_ast")
    public JsonNode formulaJson() {
        return formula.toJson();
    }

    @JsonProperty("formula_text")
    public String formulaText() {
        return formula.toText();
    }
}
