package io.github.cyfko.relayql.core.security;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Authenticated actor on whose behalf an operation is resolved.
 * <p>
 * Supplied by the transport layer; the resolver treats it as an opaque input and only hands it to
 * access rules. Roles are compared verbatim, no prefix is added or stripped.
 * </p>
 *
 * @param name   principal name, {@code null} for anonymous callers
 * @param roles  granted roles
 * @param claims additional attributes (tenant, scopes, ...) rules may look up
 */
public record Principal(String name, Set<String> roles, Map<String, Object> claims) {

    private static final Principal ANONYMOUS = new Principal(null, Set.of(), Map.of());

    public Principal {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        claims = claims == null ? Map.of() : Map.copyOf(claims);
    }

    public static Principal anonymous() {
        return ANONYMOUS;
    }

    public static Principal of(String name, String... roles) {
        Objects.requireNonNull(name, "name cannot be null (use Principal.anonymous())");
        return new Principal(name, Set.of(roles), Map.of());
    }

    public boolean isAuthenticated() {
        return name != null;
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public Object claim(String key) {
        return claims.get(key);
    }
}
