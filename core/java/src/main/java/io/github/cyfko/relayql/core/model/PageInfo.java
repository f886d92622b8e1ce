package io.github.cyfko.relayql.core.model;

/**
 * Relay page information of a {@link Connection}.
 * <p>
 * Cursors mark the bounds of the fetched window. When denied items are omitted from the edges, the
 * cursors still address the window bounds, so {@code after: endCursor} resumes right after the window
 * even if its last items, or all of them, were omitted.
 * </p>
 *
 * @param startCursor     cursor of the first fetched item, {@code null} when the window is empty
 * @param endCursor       cursor of the last fetched item, {@code null} when the window is empty
 * @param hasNextPage     whether items exist after the window
 * @param hasPreviousPage whether items exist before the window
 */
public record PageInfo(String startCursor, String endCursor, boolean hasNextPage, boolean hasPreviousPage) {
}
