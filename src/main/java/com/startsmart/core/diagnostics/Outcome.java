package com.startsmart.core.diagnostics;

/**
 * Value-or-cause result of a step that is allowed to degrade instead of failing.
 */
public final class Outcome<T> {
    public final boolean success;
    public final T value;
    public final DegradationCause cause;
    public final String message;

    private Outcome(boolean success, T value, DegradationCause cause, String message) {
        this.success = success;
        this.value = value;
        this.cause = cause == null ? DegradationCause.NONE : cause;
        this.message = message == null ? "" : message;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(true, value, DegradationCause.NONE, "");
    }

    public static <T> Outcome<T> failure(DegradationCause cause, String message) {
        return new Outcome<>(false, null, cause, message);
    }

    /**
     * Degraded result that still carries a usable fallback value.
     */
    public static <T> Outcome<T> degraded(T fallback, DegradationCause cause, String message) {
        return new Outcome<>(false, fallback, cause, message);
    }
}
