package io.github.cyfko.relayql.core.model;

/**
 * Bounded slice of an ordered result set, as handed to the persistence collaborator.
 *
 * @param offset zero-based index of the first item ({@code >= 0})
 * @param limit  maximum number of items to return ({@code >= 0})
 */
public record WindowSpec(int offset, int limit) {

    public WindowSpec {
        if (offset < 0) {
            throw new IllegalArgumentException("Window offset cannot be negative. Provided: " + offset);
        }
        if (limit < 0) {
            throw new IllegalArgumentException("Window limit cannot be negative. Provided: " + limit);
        }
    }

    /**
     * @return a window without upper bound, used for unpaginated collections
     */
    public static WindowSpec unbounded() {
        return new WindowSpec(0, Integer.MAX_VALUE);
    }

    public boolean isUnbounded() {
        return limit == Integer.MAX_VALUE;
    }

    @Override
    public String toString() {
        return String.format("WindowSpec{offset=%d, limit=%s}", offset, isUnbounded() ? "unbounded" : limit);
    }
}
