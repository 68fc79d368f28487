package net.vortexdevelopment.tiercache.debug;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Debug logger utility that auto-detects the calling class.
 * Debug output is opt-in per class via {@link #enableDebugFor(Class[])} or globally with
 * the {@code tiercache.debug.all} system property. Warnings and errors are always printed.
 */
public class DebugLogger {

    private static final Set<String> enabledClasses = ConcurrentHashMap.newKeySet();
    private static final boolean GLOBAL_DEBUG = Boolean.getBoolean("tiercache.debug.all");

    /**
     * Enable debug logging for one or more classes.
     */
    public static void enableDebugFor(Class<?>... classes) {
        for (Class<?> clazz : classes) {
            enabledClasses.add(clazz.getName());
        }
    }

    /**
     * Check if debug logging is enabled for a class.
     */
    public static boolean isEnabled(Class<?> clazz) {
        return GLOBAL_DEBUG || enabledClasses.contains(clazz.getName());
    }

    /**
     * Log a debug message with formatted arguments. Automatically detects the calling class.
     *
     * @param format the format string
     * @param args the arguments
     */
    public static void log(String format, Object... args) {
        Class<?> callerClass = getCallerClass();
        if (callerClass != null && isEnabled(callerClass)) {
            System.out.println("[DEBUG:" + callerClass.getSimpleName() + "] " + String.format(format, args));
        }
    }

    /**
     * Log a formatted debug message for a specific class.
     *
     * @param clazz the class to log for
     * @param format the format string
     * @param args the arguments
     */
    public static void log(Class<?> clazz, String format, Object... args) {
        if (isEnabled(clazz)) {
            System.out.println("[DEBUG:" + clazz.getSimpleName() + "] " + String.format(format, args));
        }
    }

    /**
     * Print a warning to standard error regardless of the debug switches.
     */
    public static void warn(Class<?> clazz, String format, Object... args) {
        System.err.println("[WARN:" + clazz.getSimpleName() + "] " + String.format(format, args));
    }

    /**
     * Print an error with its stack trace to standard error.
     */
    public static void error(Class<?> clazz, String message, Throwable throwable) {
        System.err.println("[ERROR:" + clazz.getSimpleName() + "] " + message);
        if (throwable != null) {
            throwable.printStackTrace();
        }
    }

    /**
     * Auto-detect the calling class using StackWalker.
     */
    private static Class<?> getCallerClass() {
        try {
            return StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE)
                    .walk(frames -> frames
                            .skip(2) // Skip DebugLogger.log() and DebugLogger.getCallerClass()
                            .findFirst()
                            .map(StackWalker.StackFrame::getDeclaringClass)
                            .orElse(null));
        } catch (Exception e) {
            return null;
        }
    }

    /**
     * Clear all enabled debug classes (for testing).
     */
    public static void clearAll() {
        enabledClasses.clear();
    }
}
