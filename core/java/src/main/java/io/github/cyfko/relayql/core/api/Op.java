package io.github.cyfko.relayql.core.api;

/**
 * Comparison operators of the persistence filter specification.
 * <p>
 * Filters declared on a resource are translated into criteria over these operators; persistence
 * adapters map each operator to their native predicate.
 * </p>
 *
 * <h2>Operator Categories</h2>
 * <ul>
 *   <li><strong>Comparison:</strong> {@link #EQ}, {@link #NE}, {@link #GT}, {@link #GTE}, {@link #LT}, {@link #LTE}</li>
 *   <li><strong>Text pattern:</strong> {@link #MATCHES}, {@link #NOT_MATCHES} ({@code %} and {@code _} wildcards, {@code \} escapes the next character)</li>
 *   <li><strong>Collection:</strong> {@link #IN}, {@link #NOT_IN}</li>
 *   <li><strong>Null checks:</strong> {@link #IS_NULL}, {@link #NOT_NULL}</li>
 *   <li><strong>Range:</strong> {@link #RANGE}, {@link #NOT_RANGE} (inclusive, two-element list)</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Op {

    EQ("=", "EQ"),

    NE("!=", "NE"),

    GT(">", "GT"),

    GTE(">=", "GTE"),

    LT("<", "LT"),

    LTE("<=", "LTE"),

    MATCHES("LIKE", "MATCHES"),

    NOT_MATCHES("NOT LIKE", "NOT_MATCHES"),

    IN("IN", "IN"),

    NOT_IN("NOT IN", "NOT_IN"),

    IS_NULL("IS NULL", "IS_NULL"),

    NOT_NULL("IS NOT NULL", "NOT_NULL"),

    RANGE("BETWEEN", "RANGE"),

    NOT_RANGE("NOT BETWEEN", "NOT_RANGE");

    private final String symbol;
    private final String code;

    Op(String symbol, String code) {
        this.symbol = symbol;
        this.code = code;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getCode() {
        return code;
    }

    /**
     * Checks if this operator requires a value.
     *
     * @return {@code false} for {@link #IS_NULL} and {@link #NOT_NULL}
     */
    public boolean requiresValue() {
        return this != IS_NULL && this != NOT_NULL;
    }

    /**
     * Checks if this operator takes a collection of values.
     *
     * @return {@code true} for {@link #IN}, {@link #NOT_IN}, {@link #RANGE} and {@link #NOT_RANGE}
     */
    public boolean supportsMultipleValues() {
        return this == IN || this == NOT_IN || this == RANGE || this == NOT_RANGE;
    }
}
