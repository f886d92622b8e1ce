package io.github.cyfko.relayql.core.metadata;

/**
 * Collection envelope exposed for a paginated resource.
 */
public enum PaginationType {
    /** Relay connection: {@code totalCount}, {@code pageInfo}, {@code edges}. */
    CURSOR,
    /** Page envelope: {@code collection}, {@code paginationInfo}. */
    PAGE
}
