package dumb.regcheck;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles {@code .policy} files into {@link PolicyDatabase}s.
 */
public final class PolicyLoader {

    public static final String EXTENSION = ".policy";

    private PolicyLoader() {
    }

    /**
     * The regulation is the header's name, otherwise the file name without its extension.
     */
    public static PolicyDatabase load(Path file) throws ParseException {
        String src;
        try {
            src = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read policy file " + file, e);
        }
        return fromFile(Parser.parse(src), regulationOf(file));
    }

    public static PolicyDatabase fromFile(PolicyFile pf, String defaultRegulation) {
        var meta = pf.metadata();
        var regulation = meta != null ? meta.name() : defaultRegulation;
        return new PolicyDatabase(regulation, meta != null ? meta.version() : null,
                meta != null ? meta.effectiveDate() : null, entries(regulation, pf.policies()));
    }

    static List<PolicyEntry> entries(String regulation, List<Formula> formulas) {
        var entries = new ArrayList<PolicyEntry>(formulas.size());
        for (var i = 0; i < formulas.size(); i++) {
            var id = regulation + "-" + i;
            if (formulas.get(i) instanceof Formula.Annotated a)
                entries.add(new PolicyEntry(id, regulation, a.section(), a.description(), a.body()));
            else
                entries.add(new PolicyEntry(id, regulation, "Policy-" + i, "Unannotated policy", formulas.get(i)));
        }
        return entries;
    }

    static String regulationOf(Path file) {
        var name = file.getFileName().toString();
        return name.endsWith(EXTENSION) ? name.substring(0, name.length() - EXTENSION.length()) : name;
    }
}
