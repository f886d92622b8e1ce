package io.github.cyfko.relayql.core.security;

import java.util.Map;

/**
 * Compiled access-control expression.
 * <p>
 * A rule is a pure predicate over the principal and, optionally, the subject of the operation (the
 * fetched item, or the submitted input of a create). Rules are compiled once from declarative
 * configuration; the resolver only ever calls {@link #test(Principal, Map)}.
 * </p>
 *
 * <p>A rule that needs the subject must say so through {@link #requiresSubject()}: such rules are
 * deferred until an item is available, while subject-free rules are evaluated before any fetch.</p>
 *
 * <pre>{@code
 * AccessRule adminOnly = AccessRules.hasRole("ROLE_ADMIN");
 * AccessRule ownerOrAdmin = AccessRules.ownedBy("owner").or(adminOnly);
 * }</pre>
 *
 * @see AccessRules
 * @see AccessControlEvaluator
 */
@FunctionalInterface
public interface AccessRule {

    /**
     * Evaluates the rule.
     *
     * @param principal the acting principal, never {@code null}
     * @param subject   the subject of the operation, {@code null} when evaluated before any fetch
     * @return {@code true} to grant access
     */
    boolean test(Principal principal, Map<String, Object> subject);

    /**
     * @return {@code true} if this rule reads the subject and must be evaluated per item
     */
    default boolean requiresSubject() {
        return false;
    }

    default AccessRule and(AccessRule other) {
        return AccessRules.allOf(this, other);
    }

    default AccessRule or(AccessRule other) {
        return AccessRules.anyOf(this, other);
    }

    default AccessRule negate() {
        return AccessRules.not(this);
    }
}
