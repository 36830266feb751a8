package dumb.regcheck;

import dumb.regcheck.util.Log;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyManagerTests extends AbstractTest {

    @TempDir
    Path dir;

    private Path write(String name, String src, long mtimeMillis) throws IOException {
        var f = Files.writeString(dir.resolve(name), src);
        Files.setLastModifiedTime(f, FileTime.fromMillis(mtimeMillis));
        return f;
    }

    private static List<String> names(PolicyManager m) {
        return m.databases().stream().map(PolicyDatabase::name).toList();
    }

    @Test
    void loadsEveryPolicyFileAndSkipsBrokenOnes() throws IOException {
        Files.copy(resource("policies/hipaa.policy"), dir.resolve("hipaa.policy"));
        Files.copy(resource("policies/gdpr.policy"), dir.resolve("gdpr.policy"));
        write("broken.policy", "policy starts P(@bob) policy", 1_000);
        write("notes.txt", "not a policy", 1_000);

        var m = new PolicyManager(dir);
        m.reloadAll();

        assertEquals(List.of("gdpr", "HIPAA"), names(m));
        var combined = m.combined();
        assertEquals(PolicyDatabase.COMBINED_NAME, combined.name());
        assertEquals("1.0", combined.version());
        assertEquals(5, combined.size());
        assertTrue(logged.stream().anyMatch(e -> e.level() == Log.LogLevel.ERROR && e.message().contains("broken.policy")));
    }

    @Test
    void missingDirectoryIsEmpty() {
        var m = new PolicyManager(dir.resolve("absent"));
        m.reloadAll();
        assertTrue(m.databases().isEmpty());
        assertEquals(0, m.combined().size());
    }

    @Test
    void reloadRecompilesOnlyWhenModified() throws IOException {
        write("R.policy", "policy starts P(@bob) policy ends", 1_000);
        var m = new PolicyManager(dir);
        m.reloadAll();
        assertEquals(1, m.combined().size());

        write("R.policy", "policy starts P(@bob); Q(@bob) policy ends", 1_000);
        assertTrue(m.reload("R"));
        assertEquals(1, m.combined().size());

        write("R.policy", "policy starts P(@bob); Q(@bob) policy ends", 2_000);
        assertTrue(m.reload("R"));
        assertEquals(2, m.combined().size());
        assertEquals(List.of("R"), names(m));

        m.clearCache();
        write("R.policy", "policy starts true policy ends", 2_000);
        assertTrue(m.reload("R"));
        assertEquals(1, m.combined().size());
    }

    @Test
    void reloadReplacesOnlyTheNamedRegulation() throws IOException {
        write("A.policy", "policy starts P(@bob) policy ends", 1_000);
        write("B.policy", "policy starts P(@bob) policy ends", 1_000);
        var m = new PolicyManager(dir);
        m.reloadAll();

        write("B.policy", "policy starts P(@bob); P(@alice); P(@phi) policy ends", 5_000);
        assertTrue(m.reload("B"));
        assertEquals(List.of("B", "A"), names(m));
        assertEquals(4, m.combined().size());
        assertEquals(List.of("A-0"), m.combined().filterByRegulation("A").ids());
    }

    @Test
    void failedReloadKeepsSnapshot() throws IOException {
        write("A.policy", "policy starts P(@bob) policy ends", 1_000);
        var m = new PolicyManager(dir);
        m.reloadAll();
        var before = m.databases();

        write("A.policy", "policy starts P(@bob", 9_000);
        assertFalse(m.reload("A"));
        assertFalse(m.reload("Z"));
        assertEquals(before, m.databases());
    }
}
