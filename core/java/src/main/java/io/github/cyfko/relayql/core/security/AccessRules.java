package io.github.cyfko.relayql.core.security;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Factory of common {@link AccessRule}s.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AccessRules {

    private AccessRules() {
        throw new UnsupportedOperationException("AccessRules is a utility class and cannot be instantiated");
    }

    public static AccessRule permitAll() {
        return (principal, subject) -> true;
    }

    public static AccessRule denyAll() {
        return (principal, subject) -> false;
    }

    public static AccessRule authenticated() {
        return (principal, subject) -> principal.isAuthenticated();
    }

    public static AccessRule hasRole(String role) {
        Objects.requireNonNull(role, "role cannot be null");
        return (principal, subject) -> principal.hasRole(role);
    }

    public static AccessRule hasAnyRole(String... roles) {
        List<String> accepted = List.of(roles);
        return (principal, subject) -> accepted.stream().anyMatch(principal::hasRole);
    }

    /**
     * Builds a rule reading the subject. The predicate is never called with a {@code null} subject:
     * a missing subject denies.
     *
     * @param predicate condition over principal and subject
     * @return a subject rule
     */
    public static AccessRule onSubject(BiPredicate<Principal, Map<String, Object>> predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        return new SubjectRule(predicate);
    }

    /**
     * Grants access when the subject property equals the principal name.
     *
     * @param property subject property holding the owner name
     * @return a subject rule
     */
    public static AccessRule ownedBy(String property) {
        return onSubject((principal, subject) ->
                principal.isAuthenticated() && principal.name().equals(subject.get(property)));
    }

    public static AccessRule allOf(AccessRule... rules) {
        return new CompositeRule(List.of(rules), true);
    }

    public static AccessRule anyOf(AccessRule... rules) {
        return new CompositeRule(List.of(rules), false);
    }

    public static AccessRule not(AccessRule rule) {
        Objects.requireNonNull(rule, "rule cannot be null");
        return new AccessRule() {
            @Override
            public boolean test(Principal principal, Map<String, Object> subject) {
                return !rule.test(principal, subject);
            }

            @Override
            public boolean requiresSubject() {
                return rule.requiresSubject();
            }
        };
    }

    private record SubjectRule(BiPredicate<Principal, Map<String, Object>> predicate) implements AccessRule {
        @Override
        public boolean test(Principal principal, Map<String, Object> subject) {
            return subject != null && predicate.test(principal, subject);
        }

        @Override
        public boolean requiresSubject() {
            return true;
        }
    }

    private record CompositeRule(List<AccessRule> rules, boolean conjunction) implements AccessRule {
        @Override
        public boolean test(Principal principal, Map<String, Object> subject) {
            return conjunction
                    ? rules.stream().allMatch(rule -> rule.test(principal, subject))
                    : rules.stream().anyMatch(rule -> rule.test(principal, subject));
        }

        @Override
        public boolean requiresSubject() {
            return rules.stream().anyMatch(AccessRule::requiresSubject);
        }
    }
}
