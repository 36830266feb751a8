package dumb.regcheck;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static dumb.regcheck.util.Log.error;
import static dumb.regcheck.util.Log.message;

/**
 * Keeps the compiled policies of a directory of {@code .policy} files.
 * <p>
 * Readers see an immutable snapshot; reloads replace it atomically. A file is recompiled only when
 * its modification time has advanced since it was last cached.
 */
public class PolicyManager {

    private final Path dir;
    private final Map<Path, Cached> cache = new HashMap<>();
    private volatile List<PolicyDatabase> databases = List.of();

    public PolicyManager(Path dir) {
        this.dir = dir;
    }

    public Path dir() {
        return dir;
    }

    public List<PolicyDatabase> databases() {
        return databases;
    }

    public PolicyDatabase combined() {
        return PolicyDatabase.merge(databases);
    }

    /** Loads every {@code .policy} file in the directory. Files that fail to compile are logged and skipped. */
    public synchronized void reloadAll() {
        var loaded = new ArrayList<PolicyDatabase>();
        for (var f : policyFiles()) {
            try {
                loaded.add(load(f));
            } catch (ParseException | UncheckedIOException e) {
                error("Failed to load " + f + ": " + e.getMessage());
            }
        }
        databases = List.copyOf(loaded);
        message("Loaded " + loaded.size() + " regulation(s), " + combined().size() + " policies from " + dir);
    }

    /**
     * Reloads the file the regulation was loaded from, or {@code <regulation>.policy}, replacing the database of
     * that name. Returns false if the file is missing or fails to compile, in which case the current snapshot is
     * kept.
     */
    public synchronized boolean reload(String regulation) {
        var f = source(regulation);
        if (!Files.isRegularFile(f)) return false;
        try {
            var db = load(f);
            var next = new ArrayList<PolicyDatabase>();
            next.add(db);
            databases.stream().filter(d -> !d.name().equals(db.name()) && !d.name().equals(regulation)).forEach(next::add);
            databases = List.copyOf(next);
            return true;
        } catch (ParseException | UncheckedIOException e) {
            error("Failed to reload " + regulation + ": " + e.getMessage());
            return false;
        }
    }

    public synchronized void clearCache() {
        cache.clear();
    }

    private Path source(String regulation) {
        return cache.entrySet().stream()
                .filter(e -> e.getValue().db.name().equals(regulation))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(dir.resolve(regulation + PolicyLoader.EXTENSION));
    }

    private PolicyDatabase load(Path f) throws ParseException {
        var time = modified(f);
        var c = cache.get(f);
        if (c != null && time.compareTo(c.time) <= 0) return c.db;
        var db = PolicyLoader.load(f);
        cache.put(f, new Cached(db, time));
        return db;
    }

    private List<Path> policyFiles() {
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> p.getFileName().toString().endsWith(PolicyLoader.EXTENSION))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + dir, e);
        }
    }

    private static FileTime modified(Path f) {
        try {
            return Files.getLastModifiedTime(f);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private record Cached(PolicyDatabase db, FileTime time) {
    }
}
