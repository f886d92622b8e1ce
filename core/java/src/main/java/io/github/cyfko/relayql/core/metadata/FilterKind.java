package io.github.cyfko.relayql.core.metadata;

/**
 * Kinds of filters a resource can declare.
 */
public enum FilterKind {
    /** String/identifier matching with a {@link MatchStrategy}; exposes {@code path} and {@code path_list}. */
    SEARCH,
    /** Exact numeric matching; exposes {@code path} and {@code path_list}. */
    NUMERIC,
    /** Exact boolean matching; exposes {@code path} only. */
    BOOLEAN,
    /** Bounds on a comparable value: {@code path: {lt, lte, gt, gte, between}}. */
    RANGE,
    /** Bounds on a temporal value: {@code path: {before, strictly_before, after, strictly_after}}. */
    DATE,
    /** Presence test, shared {@code exists: {path: Boolean}} argument. */
    EXISTS,
    /** Ordering, shared {@code order: {path: ASC|DESC}} argument. */
    ORDER;

    /**
     * @return {@code true} if the filter also accepts an ordered sequence of values under the
     *         {@code _list} suffix
     */
    public boolean supportsMultipleValues() {
        return this == SEARCH || this == NUMERIC;
    }

    /**
     * @return {@code true} if all declared paths of this kind share one structured argument
     */
    public boolean isShared() {
        return this == EXISTS || this == ORDER;
    }
}
