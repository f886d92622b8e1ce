package io.github.cyfko.relayql.core.exception;

import io.github.cyfko.relayql.core.resolver.ResolutionStage;

/**
 * Base class of every failure reported while resolving a single operation.
 * <p>
 * A resolution failure always aborts the operation that raised it and nothing else. The
 * {@link ResolutionStage} in which the failure surfaced is attached by the resolver so that
 * callers and logs can tell how far the operation progressed before it was aborted.
 * </p>
 *
 * <p><strong>Taxonomy:</strong></p>
 * <ul>
 *   <li>{@link ValidationException} - bad or unknown argument, rejected operation, malformed ordering</li>
 *   <li>{@link AccessDeniedException} - denied by the access-control evaluator</li>
 *   <li>{@link PaginationException} - undecodable or stale cursor</li>
 *   <li>{@link PersistenceException} - failure of the persistence collaborator</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class ResolutionException extends RuntimeException {

    private ResolutionStage stage;

    protected ResolutionException(String message) {
        super(message);
    }

    protected ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the stage during which this failure was raised.
     *
     * @return the failing stage, or {@code null} if raised outside of a resolver run
     */
    public ResolutionStage getStage() {
        return stage;
    }

    /**
     * Records the failing stage. The first recorded stage wins, so nested resolutions keep the
     * stage closest to the actual failure.
     *
     * @param stage stage in which the failure surfaced
     * @return this exception
     */
    public ResolutionException atStage(ResolutionStage stage) {
        if (this.stage == null) {
            this.stage = stage;
        }
        return this;
    }
}
