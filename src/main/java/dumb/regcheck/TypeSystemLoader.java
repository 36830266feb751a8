package dumb.regcheck;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static dumb.regcheck.util.Log.warning;

/**
 * Reads type-system files:
 * <pre>
 * PREDICATES
 * disclose : Entity Entity PHI -> Bool
 * FUNCTIONS
 * age : Entity -> Int
 * CONSTANTS
 * physician : Entity
 * </pre>
 * Blank lines and {@code #} comments are skipped, as are malformed lines (with a warning).
 */
public final class TypeSystemLoader {

    private TypeSystemLoader() {
    }

    /** A missing file yields an empty environment. */
    public static TypeEnvironment load(Path file) {
        if (!Files.isRegularFile(file)) {
            warning("Type system file not found: " + file);
            return TypeEnvironment.EMPTY;
        }
        try {
            return parse(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read type system " + file, e);
        }
    }

    /** Missing files are skipped with a warning; for a name declared twice the first file wins. */
    public static TypeEnvironment load(List<Path> files) {
        return TypeEnvironment.merge(files.stream().map(TypeSystemLoader::load).toList());
    }

    public static TypeEnvironment parse(String text) {
        var b = TypeEnvironment.builder();
        var section = Section.NONE;
        for (var raw : text.split("\\R")) {
            var line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            switch (line) {
                case "PREDICATES" -> section = Section.PREDICATES;
                case "FUNCTIONS" -> section = Section.FUNCTIONS;
                case "CONSTANTS" -> section = Section.CONSTANTS;
                default -> {
                    switch (section) {
                        case PREDICATES -> signature(line).ifPresentOrElse(b::predicate, () -> skipped(line));
                        case FUNCTIONS -> signature(line).ifPresentOrElse(b::function, () -> skipped(line));
                        case CONSTANTS -> {
                            var parts = line.split(":", -1);
                            if (parts.length == 2 && !parts[0].isBlank() && !parts[1].isBlank())
                                b.constant(parts[0].trim(), Type.parse(parts[1]));
                            else skipped(line);
                        }
                        case NONE -> skipped(line);
                    }
                }
            }
        }
        return b.build();
    }

    /** {@code name : T1 T2 ... -> Tn} */
    static Optional<TypeEnvironment.Signature> signature(String line) {
        var parts = line.split(":", -1);
        if (parts.length != 2 || parts[0].isBlank()) return Optional.empty();
        var types = Arrays.stream(parts[1].trim().split("\\s+"))
                .filter(s -> !s.isEmpty() && !s.equals("->"))
                .map(Type::parse)
                .toList();
        if (types.isEmpty()) return Optional.empty();
        return Optional.of(new TypeEnvironment.Signature(parts[0].trim(), types.subList(0, types.size() - 1),
                types.get(types.size() - 1)));
    }

    private static void skipped(String line) {
        warning("Skipping malformed type system line: " + line);
    }

    private enum Section {NONE, PREDICATES, FUNCTIONS, CONSTANTS}
}
