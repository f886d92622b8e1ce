package io.github.cyfko.relayql.jpa.strategies;

import io.github.cyfko.relayql.jpa.PredicateResolver;
import jakarta.persistence.EntityManager;

/**
 * Builds and runs one read query against the entity of a resource.
 * <p>
 * Strategies are stateless: the {@link EntityManager} is owned by the caller, which opens and closes
 * it around the call so lazy associations of the results stay reachable while they are mapped.
 * </p>
 *
 * @param <R> result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExecutionStrategy<R> {

    /**
     * @param em entity manager of the current unit of work
     * @param pr restriction of the query
     * @return the query result
     */
    R execute(EntityManager em, PredicateResolver pr);
}
