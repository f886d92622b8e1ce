package io.github.cyfko.relayql.core.security;

import io.github.cyfko.relayql.core.exception.ResourceDefinitionException;

/**
 * An access rule together with the message reported when it denies.
 *
 * @param rule    compiled rule
 * @param message denial message, {@code null} to use the generic one
 */
public record AccessControl(AccessRule rule, String message) {

    public AccessControl {
        if (rule == null) {
            throw new ResourceDefinitionException("access rule cannot be null");
        }
    }

    public static AccessControl of(AccessRule rule) {
        return new AccessControl(rule, null);
    }

    public static AccessControl of(AccessRule rule, String message) {
        return new AccessControl(rule, message);
    }
}
