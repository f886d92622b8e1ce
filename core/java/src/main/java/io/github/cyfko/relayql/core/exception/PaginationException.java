package io.github.cyfko.relayql.core.exception;

/**
 * Exception thrown when a pagination cursor cannot be used.
 * <p>
 * Reported distinctly from {@link ValidationException} so that clients can tell "retry with a fresh
 * cursor" ({@link Reason#STALE}) apart from "fix your query".
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PaginationException extends ResolutionException {

    /**
     * Why a cursor was rejected.
     */
    public enum Reason {
        /** The cursor is not a value this engine ever produced. */
        INVALID,
        /** The cursor was produced under a different filter or ordering. */
        STALE
    }

    private final Reason reason;
    private final String argument;

    public PaginationException(Reason reason, String argument, String message) {
        super(message);
        this.reason = reason;
        this.argument = argument;
    }

    public PaginationException(Reason reason, String argument, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.argument = argument;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the cursor argument ({@code after} or {@code before}) carrying the rejected cursor
     */
    public String getArgument() {
        return argument;
    }
}
