package io.github.cyfko.relayql.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Relay connection: one window of an ordered collection.
 * <p>
 * Edges are always in ascending order of the requested ordering, whatever the traversal direction.
 * </p>
 *
 * @param totalCount number of items matching the filter, ignoring the window
 * @param pageInfo   window boundaries
 * @param edges      ordered edges
 * @param <T>        node type
 */
public record Connection<T>(long totalCount, PageInfo pageInfo, List<Edge<T>> edges) {

    public Connection {
        edges = List.copyOf(edges);
    }

    public List<T> nodes() {
        List<T> nodes = new ArrayList<>(edges.size());
        for (Edge<T> edge : edges) {
            nodes.add(edge.node());
        }
        return nodes;
    }

    /**
     * Transforms every node, keeping cursors and page information.
     *
     * @param mapper node transformation
     * @param <R>    new node type
     * @return the transformed connection
     */
    public <R> Connection<R> map(Function<? super T, ? extends R> mapper) {
        List<Edge<R>> mapped = new ArrayList<>(edges.size());
        for (Edge<T> edge : edges) {
            mapped.add(new Edge<>(edge.cursor(), mapper.apply(edge.node())));
        }
        return new Connection<>(totalCount, pageInfo, mapped);
    }
}
