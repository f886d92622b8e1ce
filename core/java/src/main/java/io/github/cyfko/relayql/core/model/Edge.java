package io.github.cyfko.relayql.core.model;

/**
 * Connection edge: an item together with its cursor.
 *
 * @param cursor opaque position of the item under the current filter and ordering
 * @param node   the item
 * @param <T>    node type
 */
public record Edge<T>(String cursor, T node) {
}
