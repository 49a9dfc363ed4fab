package org.gudu0.progression.util;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Tag-based console logger used across the engine.
 * <p>
 * INFO/WARN/ERROR always print. DEBUG only prints when enabled via {@link #setDebug(boolean)}
 * (driven by {@code debugLogging} in data/config.json).
 */
public final class ConsoleLog {
    private ConsoleLog() {}

    private static volatile boolean debug = false;

    private static volatile PrintStream out = System.out;
    private static volatile PrintStream err = System.err;

    private static final String ESC = "\u001B[";

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")
                    .withZone(ZoneId.systemDefault());

    public static void setDebug(boolean enabled) {
        debug = enabled;
    }

    /** Swap output streams (tests capture log lines this way). Pass null to restore stdout/stderr. */
    public static void redirect(PrintStream newOut, PrintStream newErr) {
        out = newOut != null ? newOut : System.out;
        err = newErr != null ? newErr : System.err;
    }

    private static String line(String level, String tag, String msg) {
        return "[" + TS.format(Instant.now()) + "] [" + level + "] [" + tag + "] " + msg;
    }

    public static void info(String tag, String msg) {
        out.println(line("INFO", tag, msg));
    }

    public static void warn(String tag, String msg) {
        out.println(line(ESC + "93m" + "WARN" + ESC + "0m", tag, msg));
    }

    public static void debug(String tag, String msg) {
        if (!debug) return;
        out.println(line(ESC + "32m" + "DEBUG" + ESC + "0m", tag, msg));
    }

    public static void error(String tag, String msg) {
        err.println(line(ESC + "31m" + "ERROR" + ESC + "0m", tag, msg));
    }

    public static void error(String tag, String msg, Throwable t) {
        PrintStream e = err;
        e.println(line(ESC + "31m" + "ERROR" + ESC + "0m", tag, msg));
        if (t != null) t.printStackTrace(e);
    }
}
