package io.github.cyfko.relayql.core.metadata;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Scalar types a resource field can declare.
 * <p>
 * Each type knows how to coerce an incoming argument value (as produced by the query parser) into
 * the canonical Java representation handed to the persistence collaborator. Coercion never guesses
 * across families: a string is not silently turned into a number.
 * </p>
 *
 * <table>
 *   <caption>Canonical representations</caption>
 *   <tr><th>Type</th><th>Accepted input</th><th>Canonical value</th></tr>
 *   <tr><td>{@link #ID}</td><td>String, integral Number</td><td>String or Long</td></tr>
 *   <tr><td>{@link #STRING}</td><td>String</td><td>String</td></tr>
 *   <tr><td>{@link #INT}</td><td>integral Number within int range</td><td>Integer</td></tr>
 *   <tr><td>{@link #FLOAT}</td><td>Number</td><td>Double</td></tr>
 *   <tr><td>{@link #BOOLEAN}</td><td>Boolean</td><td>Boolean</td></tr>
 *   <tr><td>{@link #DATE}</td><td>ISO-8601 date string, LocalDate</td><td>LocalDate</td></tr>
 *   <tr><td>{@link #DATETIME}</td><td>ISO-8601 date-time string, LocalDateTime</td><td>LocalDateTime</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ScalarType {
    ID,
    STRING,
    INT,
    FLOAT,
    BOOLEAN,
    DATE,
    DATETIME;

    /**
     * Coerces an argument value to the canonical representation of this type.
     *
     * @param value non-null argument value
     * @return the canonical value
     * @throws IllegalArgumentException if the value is not compatible with this type
     */
    public Object coerce(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return switch (this) {
            case ID -> {
                if (value instanceof String s) yield s;
                if (isIntegral(value)) yield ((Number) value).longValue();
                throw mismatch(value);
            }
            case STRING -> {
                if (value instanceof String s) yield s;
                throw mismatch(value);
            }
            case INT -> {
                if (isIntegral(value)) {
                    long l = ((Number) value).longValue();
                    if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                        throw new IllegalArgumentException("Value " + l + " is out of range for INT");
                    }
                    yield (int) l;
                }
                throw mismatch(value);
            }
            case FLOAT -> {
                if (value instanceof Number n) yield n.doubleValue();
                throw mismatch(value);
            }
            case BOOLEAN -> {
                if (value instanceof Boolean b) yield b;
                throw mismatch(value);
            }
            case DATE -> {
                if (value instanceof LocalDate d) yield d;
                if (value instanceof String s) yield parse(s);
                throw mismatch(value);
            }
            case DATETIME -> {
                if (value instanceof LocalDateTime d) yield d;
                if (value instanceof String s) yield parse(s);
                throw mismatch(value);
            }
        };
    }

    /**
     * Parses a textual value, as found in compound arguments such as {@code between: "10..20"}.
     *
     * @param text textual representation
     * @return the canonical value
     * @throws IllegalArgumentException if the text cannot be parsed as this type
     */
    public Object parse(String text) {
        String trimmed = text.trim();
        try {
            return switch (this) {
                case ID, STRING -> trimmed;
                case INT -> Integer.valueOf(trimmed);
                case FLOAT -> Double.valueOf(trimmed);
                case BOOLEAN -> {
                    if ("true".equalsIgnoreCase(trimmed)) yield Boolean.TRUE;
                    if ("false".equalsIgnoreCase(trimmed)) yield Boolean.FALSE;
                    throw new IllegalArgumentException("Expected true or false, got: " + text);
                }
                case DATE -> LocalDate.parse(trimmed);
                case DATETIME -> trimmed.indexOf('T') < 0
                        ? LocalDate.parse(trimmed).atStartOfDay()
                        : LocalDateTime.parse(trimmed);
            };
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Cannot parse '" + text + "' as " + this, e);
        }
    }

    /**
     * @return {@code true} for types whose values have a natural order usable by range filters
     */
    public boolean isComparable() {
        return this == INT || this == FLOAT || this == DATE || this == DATETIME;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    public boolean isTemporal() {
        return this == DATE || this == DATETIME;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
    }

    private IllegalArgumentException mismatch(Object value) {
        return new IllegalArgumentException(String.format(
                "Value of type %s is not compatible with %s", value.getClass().getSimpleName(), this));
    }
}
