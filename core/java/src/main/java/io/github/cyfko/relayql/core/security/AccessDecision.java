package io.github.cyfko.relayql.core.security;

/**
 * Outcome of an access-control evaluation.
 *
 * @param granted whether access is granted
 * @param message denial message, {@code null} when granted
 */
public record AccessDecision(boolean granted, String message) {

    private static final AccessDecision GRANTED = new AccessDecision(true, null);

    public static AccessDecision grant() {
        return GRANTED;
    }

    public static AccessDecision deny(String message) {
        return new AccessDecision(false, message);
    }
}
