package io.nextrun.schedule;

/**
 * Raised when the next schedule cannot be computed or written.
 * The {@link Kind} tells callers which step failed.
 */
public class ScheduleUpdateException extends RuntimeException {

    public enum Kind {
        /** Malformed relative time, timestamp or timezone. */
        INVALID_FORMAT,
        /** The resolved instant is not strictly in the future. */
        PAST_OR_PRESENT_TIME,
        /** The schedule identity is not configured. */
        CONFIGURATION_MISSING,
        /** The schedule does not exist in the store. */
        RESOURCE_NOT_FOUND,
        /** The store could not be read or written. */
        STORE_UNAVAILABLE,
        /** The target input is not the expected envelope/payload structure. */
        INVALID_PAYLOAD
    }

    private final Kind kind;

    public ScheduleUpdateException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScheduleUpdateException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
