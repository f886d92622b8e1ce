package io.github.cyfko.relayql.core.api;

import io.github.cyfko.relayql.core.metadata.PropertyPath;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Atomic condition comparing the value at a property path with an operand.
 * <p>
 * Collection operators ({@link Op#IN}, {@link Op#RANGE}, ...) take an immutable list operand;
 * {@link Op#IS_NULL} and {@link Op#NOT_NULL} take none.
 * </p>
 *
 * @param path       property path, possibly across relations
 * @param op         operator
 * @param value      operand, already coerced to the property's canonical type
 * @param ignoreCase whether text comparisons ignore case
 */
public record Comparison(PropertyPath path, Op op, Object value, boolean ignoreCase) implements Criterion {

    public Comparison {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(op, "op cannot be null");
        if (op.requiresValue() && value == null) {
            throw new IllegalArgumentException("Operator " + op + " requires a value");
        }
        if (!op.requiresValue() && value != null) {
            throw new IllegalArgumentException("Operator " + op + " does not accept a value");
        }
        if (op.supportsMultipleValues()) {
            if (!(value instanceof Collection<?> values)) {
                throw new IllegalArgumentException("Operator " + op + " requires a collection value");
            }
            value = List.copyOf(values);
        }
    }

    public static Comparison of(PropertyPath path, Op op, Object value) {
        return new Comparison(path, op, value, false);
    }

    @Override
    public String canonical() {
        return path + " " + op.getCode() + (value == null ? "" : " " + value) + (ignoreCase ? " ci" : "");
    }
}
