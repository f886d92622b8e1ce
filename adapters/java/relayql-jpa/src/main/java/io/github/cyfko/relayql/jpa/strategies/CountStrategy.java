package io.github.cyfko.relayql.jpa.strategies;

import io.github.cyfko.relayql.jpa.PredicateResolver;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Execution strategy that computes the number of rows matching a given filter.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * long total = new CountStrategy(Offer.class).execute(em, (root, query, cb) -> cb.isTrue(root.get("available")));
 * }</pre>
 *
 * @param entityClass entity class backing the counted resource
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CountStrategy(Class<?> entityClass) implements ExecutionStrategy<Long> {
    private static final Logger logger = Logger.getLogger(CountStrategy.class.getName());

    public CountStrategy {
        Objects.requireNonNull(entityClass, "entityClass must not be null");
    }

    @Override
    public Long execute(EntityManager em, PredicateResolver pr) {
        long startTime = System.nanoTime();

        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
        Root<?> root = countQuery.from(entityClass);

        Predicate predicate = pr.resolve(root, countQuery, cb);

        countQuery.select(cb.count(root));
        if (predicate != null) {
            countQuery.where(predicate);
        }

        Long count = em.createQuery(countQuery).getSingleResult();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Count query on %s completed in %dms: %d matches",
                entityClass.getSimpleName(), durationMs, count));

        return count;
    }
}
