package io.github.cyfko.relayql.core.pagination;

import io.github.cyfko.relayql.core.model.WindowSpec;

/**
 * Bounded fetch instruction derived from a cursor window request.
 *
 * @param window      slice to fetch, including the one extra item used to detect more items
 * @param requested   number of edges requested
 * @param forward     traversal direction
 * @param totalCount  number of matching items
 * @param fingerprint fingerprint cursors are issued for
 */
public record FetchPlan(WindowSpec window, int requested, boolean forward, long totalCount, String fingerprint) {
}
