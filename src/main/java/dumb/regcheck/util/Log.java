package dumb.regcheck.util;

import org.jetbrains.annotations.Nullable;

import java.util.function.Consumer;

/** Log lines go to stderr; stdout is reserved for command output such as JSON responses. */
public class Log {

    @Nullable
    private static volatile Consumer<Entry> listener;

    /** Route log entries to {@code listener} instead of stderr; {@code null} restores stderr. */
    public static void setListener(@Nullable Consumer<Entry> listener) {
        Log.listener = listener;
    }

    public static void message(String message) {
        message(message, LogLevel.INFO);
    }

    public static void error(String message) {
        message(message, LogLevel.ERROR);
    }

    public static void warning(String message) {
        message(message, LogLevel.WARNING);
    }

    public static void message(String message, LogLevel level) {
        var l = listener;
        if (l != null) {
            l.accept(new Entry(message, level));
        } else {
            System.err.println("[" + level + "] " + message);
        }
    }

    public enum LogLevel {
        INFO, WARNING, ERROR
    }

    public record Entry(String message, LogLevel level) {
    }
}
