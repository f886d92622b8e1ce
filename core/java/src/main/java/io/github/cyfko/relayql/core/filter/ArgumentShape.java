package io.github.cyfko.relayql.core.filter;

/**
 * Shape of the value accepted by a filter argument.
 */
public enum ArgumentShape {
    /** A single scalar value. */
    SCALAR,
    /** An ordered sequence of scalar values, OR-ed together. */
    LIST,
    /** A structured value with a fixed set of accepted keys. */
    OBJECT
}
