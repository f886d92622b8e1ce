package io.github.cyfko.relayql.core.exception;

/**
 * Exception thrown when the access-control evaluator denies an operation.
 * <p>
 * The message is the denial message configured on the applicable access rule, or the generic
 * denial message of the resolver configuration. The exception deliberately carries no indication of
 * whether the denial happened before the fetch, on a fetched item, or because the item does not
 * exist.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class AccessDeniedException extends ResolutionException {

    public AccessDeniedException(String message) {
        super(message);
    }

    public AccessDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
