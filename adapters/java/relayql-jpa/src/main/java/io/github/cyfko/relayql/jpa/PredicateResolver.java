package io.github.cyfko.relayql.jpa;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Deferred restriction of a criteria query, resolved once the root and the query exist.
 */
@FunctionalInterface
public interface PredicateResolver {

    /**
     * @param root  query root
     * @param query query being built, used to create subqueries
     * @param cb    criteria builder
     * @return the restriction, or {@code null} for none
     */
    Predicate resolve(Root<?> root, CriteriaQuery<?> query, CriteriaBuilder cb);
}
