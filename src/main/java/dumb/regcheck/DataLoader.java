package dumb.regcheck;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.stream.Stream;

import static dumb.regcheck.util.Log.warning;

/**
 * Reads the domain, facts and function-value files.
 * <ul>
 *     <li>domain: one entity per line</li>
 *     <li>facts: {@code predicate(arg1, arg2)} per line</li>
 *     <li>functions: {@code name(arg1, arg2) = value} per line</li>
 * </ul>
 * Blank lines and {@code #} comments are skipped; malformed lines are skipped with a warning; a missing file is empty.
 */
public final class DataLoader {

    private DataLoader() {
    }

    public static Domain domain(Path file) {
        return parseDomain(read(file));
    }

    public static Facts facts(Path file) {
        return parseFacts(read(file));
    }

    public static FunctionTable functions(Path file) {
        return parseFunctions(read(file));
    }

    public static Domain parseDomain(String text) {
        return new Domain(lines(text).toList());
    }

    public static Facts parseFacts(String text) {
        var facts = new LinkedHashSet<Facts.Fact>();
        lines(text).forEach(line -> {
            var app = application(line);
            if (app == null) warning("Skipping malformed fact: " + line);
            else facts.add(new Facts.Fact(app.name(), app.args()));
        });
        return new Facts(facts);
    }

    /** The first value given for an application wins. */
    public static FunctionTable parseFunctions(String text) {
        var values = new LinkedHashMap<FunctionTable.Application, String>();
        lines(text).forEach(line -> {
            var parts = line.split("=", -1);
            var app = parts.length == 2 ? application(parts[0].trim()) : null;
            if (app == null || parts[1].isBlank()) warning("Skipping malformed function value: " + line);
            else values.putIfAbsent(app, parts[1].trim());
        });
        return new FunctionTable(values);
    }

    /** {@code name(a, b)} */
    static FunctionTable.@Nullable Application application(String s) {
        var open = s.indexOf('(');
        if (open <= 0 || !s.endsWith(")")) return null;
        var name = s.substring(0, open).trim();
        if (name.isEmpty()) return null;
        var args = new ArrayList<String>();
        Arrays.stream(s.substring(open + 1, s.length() - 1).split(","))
                .map(String::trim).filter(a -> !a.isEmpty()).forEach(args::add);
        return new FunctionTable.Application(name, args);
    }

    private static Stream<String> lines(String text) {
        return text.lines().map(String::trim).filter(l -> !l.isEmpty() && !l.startsWith("#"));
    }

    private static String read(Path file) {
        if (!Files.isRegularFile(file)) {
            warning("Data file not found: " + file);
            return "";
        }
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }
}
