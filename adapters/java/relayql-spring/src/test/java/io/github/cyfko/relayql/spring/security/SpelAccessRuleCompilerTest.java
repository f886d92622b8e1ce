package io.github.cyfko.relayql.spring.security;

import io.github.cyfko.relayql.core.config.ResolverConfig;
import io.github.cyfko.relayql.core.exception.AccessDeniedException;
import io.github.cyfko.relayql.core.exception.ResolutionException;
import io.github.cyfko.relayql.core.exception.ResourceDefinitionException;
import io.github.cyfko.relayql.core.security.AccessRule;
import io.github.cyfko.relayql.core.security.Principal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.expression.EvaluationException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpelAccessRuleCompiler Tests")
class SpelAccessRuleCompilerTest {

    private static final Principal ALICE = Principal.of("alice", "ROLE_USER");
    private static final Principal ADMIN = Principal.of("root", "ROLE_ADMIN");

    private final SpelAccessRuleCompiler compiler = new SpelAccessRuleCompiler();

    @Test
    @DisplayName("Role and authentication checks do not need a subject")
    void shouldCompileSubjectFreeRules() {
        AccessRule authenticated = compiler.compile("isAuthenticated()");
        AccessRule admin = compiler.compile("hasAnyRole('ROLE_ADMIN', 'ROLE_OWNER')");

        assertFalse(authenticated.requiresSubject());
        assertTrue(authenticated.test(ALICE, null));
        assertFalse(authenticated.test(Principal.anonymous(), null));
        assertTrue(admin.test(ADMIN, null));
        assertFalse(admin.test(ALICE, null));
    }

    @Test
    @DisplayName("Expressions reading the object are evaluated per item")
    void shouldCompileSubjectRule() {
        // Given
        AccessRule rule = compiler.compile("hasRole('ROLE_ADMIN') or object['owner'] == user.name");

        // When / Then
        assertTrue(rule.requiresSubject());
        assertTrue(rule.test(ALICE, Map.of("owner", "alice")));
        assertFalse(rule.test(ALICE, Map.of("owner", "bob")));
        assertTrue(rule.test(ADMIN, Map.of("owner", "bob")));
    }

    @Test
    @DisplayName("Missing values deny access")
    void shouldDenyOnNullResult() {
        AccessRule rule = compiler.compile("object['published']");

        assertFalse(rule.test(ALICE, Map.of("title", "draft")));
    }

    @Test
    @DisplayName("Invalid expressions are rejected at compile time")
    void shouldRejectInvalidExpression() {
        assertThrows(ResourceDefinitionException.class, () -> compiler.compile("hasRole('ROLE_ADMIN' or"));
        assertThrows(ResourceDefinitionException.class, () -> compiler.compile(" "));
    }

    @Test
    @DisplayName("Type references are not available to expressions and deny access")
    void shouldNotExposeTypes() {
        AccessRule rule = compiler.compile("T(java.lang.System).exit(1) == null");

        AccessDeniedException e = assertThrows(AccessDeniedException.class, () -> rule.test(ALICE, null));

        assertEquals(ResolverConfig.DEFAULT_DENIAL_MESSAGE, e.getMessage());
        assertInstanceOf(EvaluationException.class, e.getCause());
    }

    @Test
    @DisplayName("Expressions failing on the item deny access inside the resolver exception hierarchy")
    void shouldDenyOnEvaluationFailure() {
        AccessRule rule = compiler.compile("object['owner'].length() > 0");

        AccessDeniedException e = assertThrows(AccessDeniedException.class,
                () -> rule.test(ALICE, Map.of("title", "no owner")));

        assertInstanceOf(ResolutionException.class, e);
        assertInstanceOf(EvaluationException.class, e.getCause());
    }
}
