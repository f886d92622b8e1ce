package io.github.cyfko.relayql.core.api;

import io.github.cyfko.relayql.core.metadata.PropertyPath;

import java.util.Objects;

/**
 * Sort specification with property path and direction.
 *
 * @param path      property path to sort by, possibly across relations
 * @param direction sort direction
 */
public record SortBy(PropertyPath path, Direction direction) {
    /**
     * Canonical constructor with validation.
     */
    public SortBy {
        Objects.requireNonNull(path, "Sorting path is required");
        Objects.requireNonNull(direction, "Sorting direction is required. Either ASC or DESC");
    }

    /**
     * Creates ascending sort specification.
     *
     * @param path dotted property path
     * @return sort specification with ascending direction
     */
    public static SortBy asc(String path) {
        return new SortBy(PropertyPath.parse(path), Direction.ASC);
    }

    /**
     * Creates descending sort specification.
     *
     * @param path dotted property path
     * @return sort specification with descending direction
     */
    public static SortBy desc(String path) {
        return new SortBy(PropertyPath.parse(path), Direction.DESC);
    }

    @Override
    public String toString() {
        return path + " " + direction;
    }
}
