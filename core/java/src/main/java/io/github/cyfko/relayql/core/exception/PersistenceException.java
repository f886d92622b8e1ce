package io.github.cyfko.relayql.core.exception;

/**
 * Opaque wrapper around a failure of the persistence collaborator.
 * <p>
 * The resolver never retries a persistence failure; any retry policy belongs to the collaborator.
 * The original error is kept as the cause for diagnostics but is not meant to be shown to callers.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PersistenceException extends ResolutionException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
