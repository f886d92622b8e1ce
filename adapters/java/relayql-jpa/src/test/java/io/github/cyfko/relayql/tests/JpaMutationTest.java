package io.github.cyfko.relayql.tests;

import io.github.cyfko.relayql.core.api.Comparison;
import io.github.cyfko.relayql.core.api.FilterSpec;
import io.github.cyfko.relayql.core.api.Op;
import io.github.cyfko.relayql.core.metadata.OperationKind;
import io.github.cyfko.relayql.core.metadata.PropertyPath;
import io.github.cyfko.relayql.core.metadata.ResourceDescriptor;
import io.github.cyfko.relayql.core.metadata.ResourceRegistry;
import io.github.cyfko.relayql.jpa.JpaPersistenceProvider;
import io.github.cyfko.relayql.jpa.exception.EntityMappingException;
import io.github.cyfko.relayql.tests.support.JpaFixtures;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import org.junit.jupiter.api.*;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JpaPersistenceProvider Mutation Tests")
class JpaMutationTest {

    private static EntityManagerFactory emf;
    private static JpaPersistenceProvider provider;
    private static ResourceDescriptor review;

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");
        ResourceRegistry registry = JpaFixtures.registry();
        provider = new JpaPersistenceProvider(emf, registry);
        review = registry.require("Review");
        JpaFixtures.seed(emf);
    }

    @AfterAll
    static void tearDown() {
        if (emf.isOpen()) emf.close();
    }

    private static long reviewsOf(String owner) {
        return provider.count(review, FilterSpec.of(Comparison.of(PropertyPath.of("owner"), Op.EQ, owner)));
    }

    @Test
    @DisplayName("Create, update and delete a review in their own transactions")
    void shouldApplyMutationLifecycle() {
        // Given
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("rating", 2);
        input.put("owner", "carol");
        input.put("book", 3L);

        // When
        Map<String, Object> created = provider.mutate(review, OperationKind.CREATE, input);
        Object id = created.get("id");
        Map<String, Object> updated = provider.mutate(review, OperationKind.UPDATE, Map.of("id", id, "rating", 1));
        Map<String, Object> stored = provider.fetchOne(review, id).orElseThrow();
        Map<String, Object> removed = provider.mutate(review, OperationKind.DELETE, Map.of("id", id));

        // Then
        assertNotNull(id);
        assertEquals(3L, created.get("book"));
        assertEquals(1, updated.get("rating"));
        assertEquals("carol", updated.get("owner"));
        assertEquals(1, stored.get("rating"));
        assertEquals(id, removed.get("id"));
        assertTrue(provider.fetchOne(review, id).isEmpty());
    }

    @Test
    @DisplayName("Identifiers in the input are never written")
    void shouldIgnoreIdentifierOnUpdate() {
        Map<String, Object> updated = provider.mutate(review, OperationKind.UPDATE, Map.of("id", 2L, "owner", "bob"));

        assertEquals(2L, updated.get("id"));
        assertEquals(3, updated.get("rating"));
    }

    @Test
    @DisplayName("A value that cannot be converted rolls the transaction back")
    void shouldRollBackOnConversionFailure() {
        // Given
        long before = reviewsOf("dave");
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("owner", "dave");
        input.put("rating", "not a number");

        // When / Then
        assertThrows(EntityMappingException.class, () -> provider.mutate(review, OperationKind.CREATE, input));
        assertEquals(before, reviewsOf("dave"));
    }

    @Test
    @DisplayName("Updating a missing row fails without side effects")
    void shouldFailOnMissingRow() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> provider.mutate(review, OperationKind.UPDATE, Map.of("id", 999L, "rating", 1)));

        assertTrue(e.getMessage().contains("999"));
    }
}
