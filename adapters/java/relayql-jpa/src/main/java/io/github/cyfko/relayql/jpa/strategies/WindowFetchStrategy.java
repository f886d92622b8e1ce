package io.github.cyfko.relayql.jpa.strategies;

import io.github.cyfko.relayql.core.api.Direction;
import io.github.cyfko.relayql.core.api.SortBy;
import io.github.cyfko.relayql.core.metadata.ResolvedPath;
import io.github.cyfko.relayql.core.metadata.ResourceDescriptor;
import io.github.cyfko.relayql.core.metadata.ResourceRegistry;
import io.github.cyfko.relayql.core.model.WindowSpec;
import io.github.cyfko.relayql.jpa.PredicateResolver;
import io.github.cyfko.relayql.jpa.utils.PathResolverUtils;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Execution strategy that fetches one ordered window of entities.
 * <p>
 * Sort keys crossing a to-one relation are resolved through left joins, so entities whose relation is
 * absent are kept (their key sorts as {@code NULL}). Sorting on a path that crosses a to-many relation
 * would duplicate rows and is rejected.
 * </p>
 *
 * @param registry    registry resolving sort paths
 * @param resource    resource fetched
 * @param entityClass entity class backing the resource
 * @param ordering    total ordering of the window
 * @param window      offset and limit
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record WindowFetchStrategy(ResourceRegistry registry,
                                  ResourceDescriptor resource,
                                  Class<?> entityClass,
                                  List<SortBy> ordering,
                                  WindowSpec window) implements ExecutionStrategy<List<?>> {
    private static final Logger logger = Logger.getLogger(WindowFetchStrategy.class.getName());

    public WindowFetchStrategy {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(resource, "resource must not be null");
        Objects.requireNonNull(entityClass, "entityClass must not be null");
        Objects.requireNonNull(window, "window must not be null");
        ordering = ordering == null ? List.of() : List.copyOf(ordering);
    }

    @Override
    public List<?> execute(EntityManager em, PredicateResolver pr) {
        long startTime = System.nanoTime();

        List<?> results = fetch(em, pr, entityClass);

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Window query on %s completed in %dms: %d rows for %s",
                entityClass.getSimpleName(), durationMs, results.size(), window));

        return results;
    }

    private <T> List<T> fetch(EntityManager em, PredicateResolver pr, Class<T> type) {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<T> query = cb.createQuery(type);
        Root<T> root = query.from(type);
        query.select(root);

        Predicate predicate = pr.resolve(root, query, cb);
        if (predicate != null) {
            query.where(predicate);
        }
        query.orderBy(orders(cb, root));

        TypedQuery<T> typedQuery = em.createQuery(query);
        typedQuery.setFirstResult(window.offset());
        if (!window.isUnbounded()) {
            typedQuery.setMaxResults(window.limit());
        }
        return typedQuery.getResultList();
    }

    private List<Order> orders(CriteriaBuilder cb, Root<?> root) {
        List<Order> orders = new ArrayList<>(ordering.size());
        for (SortBy sortBy : ordering) {
            ResolvedPath resolved = registry.resolvePath(resource, sortBy.path())
                    .orElseThrow(() -> new IllegalArgumentException(String.format(
                            "Sort path '%s' does not resolve on resource '%s'", sortBy.path(), resource.name())));
            if (resolved.crossesToMany()) {
                throw new IllegalArgumentException("Cannot sort on a to-many relation: " + sortBy.path());
            }
            Path<?> path = PathResolverUtils.resolvePath(root, resolved);
            orders.add(sortBy.direction() == Direction.DESC ? cb.desc(path) : cb.asc(path));
        }
        return orders;
    }
}
