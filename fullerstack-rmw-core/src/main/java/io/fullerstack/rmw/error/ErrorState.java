package io.fullerstack.rmw.error;

/**
 * Per-thread "last error" message for operations that report failure through a
 * {@link io.fullerstack.rmw.ReturnCode} instead of an exception.
 * <p>
 * Each thread sees only the messages it set itself, so callers can read the message
 * right after a failed call without coordinating with other threads.
 */
public final class ErrorState {

    private static final ThreadLocal<String> LAST_ERROR = new ThreadLocal<>();

    private ErrorState() {
    }

    /**
     * Records the error message for the calling thread, replacing any previous one.
     *
     * @param message the message to record
     */
    public static void set(String message) {
        LAST_ERROR.set(message);
    }

    /**
     * @return the calling thread's last error message, or {@code null} if none is set
     */
    public static String get() {
        return LAST_ERROR.get();
    }

    public static boolean isSet() {
        return LAST_ERROR.get() != null;
    }

    /**
     * Clears the calling thread's error message.
     */
    public static void reset() {
        LAST_ERROR.remove();
    }
}
