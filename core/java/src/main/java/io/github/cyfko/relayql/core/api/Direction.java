package io.github.cyfko.relayql.core.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordering direction.
 */
public enum Direction {
    ASC,
    DESC;

    /**
     * Parses a direction token ({@code ASC}/{@code DESC}, case-insensitive).
     *
     * @param token caller-supplied token
     * @return the direction, empty if the token is not a direction
     */
    public static Optional<Direction> fromToken(Object token) {
        if (!(token instanceof String s)) {
            return Optional.empty();
        }
        return switch (s.trim().toUpperCase(Locale.ROOT)) {
            case "ASC" -> Optional.of(ASC);
            case "DESC" -> Optional.of(DESC);
            default -> Optional.empty();
        };
    }
}
