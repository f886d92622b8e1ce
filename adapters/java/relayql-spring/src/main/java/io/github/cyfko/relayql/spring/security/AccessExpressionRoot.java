package io.github.cyfko.relayql.spring.security;

import io.github.cyfko.relayql.core.security.Principal;

import java.util.Map;
import java.util.Set;

/**
 * Root object of access expressions.
 *
 * <ul>
 *   <li>{@code user}: the acting principal ({@code user.name}, {@code user.roles}, {@code user.claims})</li>
 *   <li>{@code object}: the subject of the operation, indexed by field name ({@code object['owner']})</li>
 *   <li>{@code hasRole('X')}, {@code hasAnyRole('X', 'Y')}, {@code isAuthenticated()}</li>
 * </ul>
 */
public class AccessExpressionRoot {

    private final Principal principal;
    private final User user;
    private final Map<String, Object> object;

    AccessExpressionRoot(Principal principal, Map<String, Object> object) {
        this.principal = principal;
        this.user = new User(principal);
        this.object = object;
    }

    public User getUser() {
        return user;
    }

    public Map<String, Object> getObject() {
        return object;
    }

    public boolean hasRole(String role) {
        return principal.hasRole(role);
    }

    public boolean hasAnyRole(String... roles) {
        for (String role : roles) {
            if (principal.hasRole(role)) {
                return true;
            }
        }
        return false;
    }

    public boolean isAuthenticated() {
        return principal.isAuthenticated();
    }

    /**
     * Read-only view of the principal exposed as {@code user}.
     */
    public static final class User {
        private final Principal principal;

        private User(Principal principal) {
            this.principal = principal;
        }

        public String getName() {
            return principal.name();
        }

        public Set<String> getRoles() {
            return principal.roles();
        }

        public Map<String, Object> getClaims() {
            return principal.claims();
        }
    }
}
