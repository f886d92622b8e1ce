package io.github.cyfko.relayql.core.model;

import java.util.*;

/**
 * Field selection of an incoming operation.
 * <p>
 * A selection node carries its own arguments, so nested collection relations can be filtered and
 * paginated independently of their parent. A {@code null} children map on a node means the node
 * is a leaf.
 * </p>
 *
 * <pre>{@code
 * Selection offers = Selection.of("offers",
 *     Selection.of("totalCount"),
 *     Selection.of("edges", Selection.of("node", Selection.of("id"), Selection.of("price"))));
 * }</pre>
 *
 * @param name      selected field name
 * @param arguments arguments of the field, never {@code null}
 * @param children  selected sub-fields by name, empty for leaves
 */
public record Selection(String name, Map<String, Object> arguments, Map<String, Selection> children) {

    public Selection {
        Objects.requireNonNull(name, "name");
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        children = children == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(children));
    }

    public static Selection of(String name, Selection... children) {
        return of(name, Map.of(), children);
    }

    public static Selection of(String name, Map<String, Object> arguments, Selection... children) {
        Map<String, Selection> byName = new LinkedHashMap<>();
        for (Selection child : children) {
            byName.put(child.name(), child);
        }
        return new Selection(name, arguments, byName);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public Optional<Selection> child(String name) {
        return Optional.ofNullable(children.get(name));
    }

    public boolean selects(String name) {
        return children.containsKey(name);
    }

    /**
     * Locates the selection applying to collection nodes: {@code edges.node} for connections,
     * {@code collection} for page-based and unpaginated lists.
     *
     * @return the node selection, or this selection when neither wrapper is selected
     */
    public Selection nodeSelection() {
        Selection edgesNode = child("edges").flatMap(edges -> edges.child("node")).orElse(null);
        if (edgesNode != null) {
            return edgesNode;
        }
        return child("collection").orElse(this);
    }
}
