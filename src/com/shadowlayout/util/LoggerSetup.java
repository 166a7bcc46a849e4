package com.shadowlayout.util;

import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging setup shared by the shadow layout packages.
 *
 * Rendering code logs per frame at FINE only, so the default INFO level keeps
 * paint loops silent. Obtain loggers with {@link #getLogger(Class)}; the first
 * call swaps the root handlers for a single console handler.
 */
public final class LoggerSetup {

    private static boolean initialized = false;

    private LoggerSetup() {
    }

    public static synchronized Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            installConsoleHandler();
            initialized = true;
        }
        return Logger.getLogger(clazz.getName());
    }

    private static void installConsoleHandler() {
        Logger root = Logger.getLogger("");
        for (Handler handler : root.getHandlers()) {
            root.removeHandler(handler);
        }
        ConsoleHandler console = new ConsoleHandler();
        console.setFormatter(new CompactFormatter());
        console.setLevel(Level.ALL);
        root.addHandler(console);
        root.setLevel(Level.INFO);
    }

    /**
     * One line per record, plus the throwable and the frame it was thrown from:
     * <pre>
     * [WARNING] 14:23:45 RenderPipeline: Unbalanced surface after frame (3 vs 1), restoring
     *     java.lang.IllegalStateException: boom @ Card.paint(Card.java:42)
     * </pre>
     */
    static class CompactFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            StringBuilder line = new StringBuilder();
            line.append('[').append(record.getLevel()).append("] ")
                .append(String.format("%tT", record.getMillis())).append(' ')
                .append(simpleClassName(record.getSourceClassName())).append(": ")
                .append(formatMessage(record))
                .append(System.lineSeparator());

            Throwable thrown = record.getThrown();
            if (thrown != null) {
                line.append("    ").append(thrown);
                StackTraceElement[] trace = thrown.getStackTrace();
                if (trace.length > 0) {
                    StackTraceElement top = trace[0];
                    line.append(" @ ")
                        .append(simpleClassName(top.getClassName())).append('.').append(top.getMethodName())
                        .append('(').append(top.getFileName()).append(':').append(top.getLineNumber()).append(')');
                }
                line.append(System.lineSeparator());
            }
            return line.toString();
        }

        static String simpleClassName(String className) {
            if (className == null) {
                return "Unknown";
            }
            int lastDot = className.lastIndexOf('.');
            return lastDot >= 0 ? className.substring(lastDot + 1) : className;
        }
    }

    /** Shows padding, geometry and skipped-frame events. */
    public static void enableDebugLogging() {
        Logger.getLogger("").setLevel(Level.FINE);
    }

    /** Warnings and errors only. */
    public static void setQuietMode() {
        Logger.getLogger("").setLevel(Level.WARNING);
    }
}
