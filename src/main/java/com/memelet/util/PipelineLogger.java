package com.memelet.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Static logger for {@code pipeline.log}, one file per log directory.
 * <p>
 * Line format: {@code [yyyy-MM-dd HH:mm:ss] [LEVEL] [Component] message}, followed by the stack
 * trace when there is one. Appends are serialized across all threads. The file is moved to
 * {@code pipeline.log.old} once it grows past 5 MB.
 */
public class PipelineLogger {

    public static final String LOG_FILE_NAME = "pipeline.log";
    private static final String ROTATED_FILE_NAME = "pipeline.log.old";
    private static final long ROTATE_AT_BYTES = 5L * 1024 * 1024;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Object WRITE_LOCK = new Object();

    private static final Set<Path> CREATED_DIRS = ConcurrentHashMap.newKeySet();
    // log dir -> signature -> occurrences since the last flush
    private static final Map<Path, Map<String, AtomicInteger>> RECURRING = new ConcurrentHashMap<>();

    private enum Level { INFO, WARN, ERROR, JOB, SUMMARY }

    /**
     * @param logDir    directory holding pipeline.log; nothing is written when null
     * @param component short name of the logging class, e.g. "DirectoryScanner"
     * @param error     optional, its stack trace follows the message
     */
    public static void logError(Path logDir, String component, String message, Throwable error) {
        append(logDir, Level.ERROR, component, message, error);
    }

    public static void logWarning(Path logDir, String component, String message) {
        append(logDir, Level.WARN, component, message, null);
    }

    public static void logInfo(Path logDir, String component, String message) {
        append(logDir, Level.INFO, component, message, null);
    }

    /**
     * Job lifecycle line such as {@code JOB 3f2a... START id=42}.
     */
    public static void logJobMarker(Path logDir, String component, String marker) {
        append(logDir, Level.JOB, component, marker, null);
    }

    /**
     * For errors that repeat per file during a walk. Only the first occurrence of a signature
     * (component, message, exception class and message) is written; repeats are counted until
     * {@link #flush(Path)}.
     */
    public static void logRecurringError(Path logDir, String component, String message, Throwable error) {
        if (logDir == null) return;

        int seen = RECURRING
                .computeIfAbsent(logDir, dir -> new ConcurrentHashMap<>())
                .computeIfAbsent(signatureOf(component, message, error), signature -> new AtomicInteger())
                .getAndIncrement();
        if (seen == 0) {
            append(logDir, Level.ERROR, component, message, error);
        }
    }

    /**
     * Writes one summary line per recurring error that repeated, then resets the counters.
     */
    public static void flush(Path logDir) {
        if (logDir == null) return;

        Map<String, AtomicInteger> counts = RECURRING.remove(logDir);
        if (counts == null) return;

        for (Map.Entry<String, AtomicInteger> entry : counts.entrySet()) {
            int repeats = entry.getValue().get() - 1;
            if (repeats > 0) {
                append(logDir, Level.SUMMARY, "ErrorAggregation",
                        "The following error occurred " + repeats + " additional times: " + entry.getKey(), null);
            }
        }
    }

    private static String signatureOf(String component, String message, Throwable error) {
        String signature = "[" + component + "] " + message;
        if (error == null) {
            return signature;
        }
        signature += " | " + error.getClass().getName();
        return error.getMessage() == null ? signature : signature + ": " + error.getMessage();
    }

    private static String format(Level level, String component, String message, Throwable error) {
        StringBuilder line = new StringBuilder()
                .append('[').append(LocalDateTime.now().format(TIMESTAMP)).append("] ")
                .append('[').append(level).append("] ")
                .append('[').append(component).append("] ")
                .append(message)
                .append(System.lineSeparator());
        if (error != null) {
            StringWriter trace = new StringWriter();
            error.printStackTrace(new PrintWriter(trace));
            line.append(trace);
        }
        return line.toString();
    }

    private static void append(Path logDir, Level level, String component, String message, Throwable error) {
        if (logDir == null) return;

        String entry = format(level, component, message, error);
        synchronized (WRITE_LOCK) {
            try {
                if (CREATED_DIRS.add(logDir)) {
                    Files.createDirectories(logDir);
                }
                Path logFile = logDir.resolve(LOG_FILE_NAME);
                if (Files.exists(logFile) && Files.size(logFile) > ROTATE_AT_BYTES) {
                    Files.move(logFile, logDir.resolve(ROTATED_FILE_NAME), StandardCopyOption.REPLACE_EXISTING);
                }
                Files.writeString(logFile, entry, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                System.err.println("CRITICAL: cannot write " + LOG_FILE_NAME + " in " + logDir + ": " + e);
                System.err.print(entry);
            }
        }
    }
}
