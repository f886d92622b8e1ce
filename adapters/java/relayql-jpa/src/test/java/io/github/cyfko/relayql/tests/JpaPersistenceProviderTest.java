package io.github.cyfko.relayql.tests;

import io.github.cyfko.relayql.core.api.AnyOf;
import io.github.cyfko.relayql.core.api.Comparison;
import io.github.cyfko.relayql.core.api.FilterSpec;
import io.github.cyfko.relayql.core.api.Op;
import io.github.cyfko.relayql.core.api.SortBy;
import io.github.cyfko.relayql.core.metadata.PropertyPath;
import io.github.cyfko.relayql.core.metadata.ResourceDescriptor;
import io.github.cyfko.relayql.core.metadata.ResourceRegistry;
import io.github.cyfko.relayql.core.model.WindowSpec;
import io.github.cyfko.relayql.jpa.JpaPersistenceProvider;
import io.github.cyfko.relayql.tests.support.JpaFixtures;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JpaPersistenceProvider Tests")
class JpaPersistenceProviderTest {

    private static EntityManagerFactory emf;
    private static ResourceRegistry registry;
    private static JpaPersistenceProvider provider;

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");
        registry = JpaFixtures.registry();
        provider = new JpaPersistenceProvider(emf, registry);
        JpaFixtures.seed(emf);
    }

    @AfterAll
    static void tearDown() {
        if (emf.isOpen()) emf.close();
    }

    private static ResourceDescriptor resource(String name) {
        return registry.require(name);
    }

    private static List<Object> ids(List<Map<String, Object>> items) {
        return items.stream().map(item -> item.get("id")).toList();
    }

    private static PropertyPath path(String dotted) {
        return PropertyPath.parse(dotted);
    }

    // ============================================================================
    // Count
    // ============================================================================

    @Test
    @DisplayName("Counts offers whose related product has one of the given colors")
    void shouldCountAcrossToOneRelation() {
        FilterSpec filter = FilterSpec.of(Comparison.of(path("product.color"), Op.IN, List.of("red", "green")));

        assertEquals(4L, provider.count(resource("Offer"), filter));
    }

    @Test
    @DisplayName("An empty filter counts every row")
    void shouldCountEverything() {
        assertEquals(6L, provider.count(resource("Offer"), FilterSpec.empty()));
        assertEquals(3L, provider.count(resource("Author"), FilterSpec.empty()));
    }

    @Test
    @DisplayName("Floating point bounds are converted to the decimal column type")
    void shouldConvertRangeBounds() {
        FilterSpec filter = FilterSpec.of(Comparison.of(path("price"), Op.RANGE, List.of(20.0, 40.0)));

        assertEquals(3L, provider.count(resource("Offer"), filter));
    }

    @Test
    @DisplayName("Existence checks apply to to-one and to-many relations")
    void shouldCheckRelationExistence() {
        assertEquals(5L, provider.count(resource("Offer"),
                FilterSpec.of(Comparison.of(path("product"), Op.NOT_NULL, null))));
        assertEquals(1L, provider.count(resource("Offer"),
                FilterSpec.of(Comparison.of(path("product"), Op.IS_NULL, null))));
        assertEquals(1L, provider.count(resource("Author"),
                FilterSpec.of(Comparison.of(path("books"), Op.IS_NULL, null))));
    }

    @Test
    @DisplayName("Filters crossing a to-many relation count each owner once")
    void shouldCountDistinctOwnersAcrossToMany() {
        // Given: both of Ursula's books match
        FilterSpec filter = FilterSpec.of(new AnyOf(List.of(
                new Comparison(path("books.title"), Op.MATCHES, "%the%", true),
                new Comparison(path("books.title"), Op.MATCHES, "%CITIES%", true))));

        // When
        long count = provider.count(resource("Author"), filter);
        List<Map<String, Object>> authors = provider.fetchWindow(resource("Author"), filter,
                List.of(SortBy.asc("id")), WindowSpec.unbounded());

        // Then
        assertEquals(2L, count);
        assertEquals(List.of(1L, 2L), ids(authors));
    }

    // ============================================================================
    // Window fetch
    // ============================================================================

    @Test
    @DisplayName("Windows follow an ordering across a relation")
    void shouldFetchOrderedWindow() {
        FilterSpec filter = FilterSpec.of(Comparison.of(path("product"), Op.NOT_NULL, null));
        List<SortBy> ordering = List.of(SortBy.desc("product.releaseDate"), SortBy.asc("id"));

        List<Map<String, Object>> first = provider.fetchWindow(resource("Offer"), filter, ordering, new WindowSpec(0, 3));
        List<Map<String, Object>> rest = provider.fetchWindow(resource("Offer"), filter, ordering, new WindowSpec(3, 3));

        assertEquals(List.of(5L, 4L, 3L), ids(first));
        assertEquals(List.of(2L, 1L), ids(rest));
    }

    @Test
    @DisplayName("Items carry scalars, to-one identifiers and to-many identifier lists")
    void shouldMapEntitiesToItems() {
        List<Map<String, Object>> offers = provider.fetchWindow(resource("Offer"),
                FilterSpec.of(Comparison.of(path("id"), Op.EQ, 2L)), List.of(SortBy.asc("id")), new WindowSpec(0, 10));
        List<Map<String, Object>> authors = provider.fetchWindow(resource("Author"),
                FilterSpec.of(Comparison.of(path("name"), Op.EQ, "Ursula")), List.of(SortBy.asc("id")), new WindowSpec(0, 10));

        Map<String, Object> offer = offers.get(0);
        assertEquals(List.of("id", "price", "available", "product"), List.copyOf(offer.keySet()));
        assertEquals(0, new BigDecimal("20").compareTo((BigDecimal) offer.get("price")));
        assertEquals(Boolean.FALSE, offer.get("available"));
        assertEquals(2L, offer.get("product"));
        assertEquals(List.of(1L, 2L), authors.get(0).get("books"));
    }

    @Test
    @DisplayName("Case-insensitive patterns lower both sides")
    void shouldMatchIgnoringCase() {
        FilterSpec filter = FilterSpec.of(new Comparison(path("product.name"), Op.MATCHES, "%PRODUCT 3%", true));

        List<Map<String, Object>> offers = provider.fetchWindow(resource("Offer"), filter,
                List.of(SortBy.asc("id")), WindowSpec.unbounded());

        assertEquals(List.of(3L), ids(offers));
    }

    @Test
    @DisplayName("Relation constraints compare the referenced identifier")
    void shouldFilterOnOwnerIdentifier() {
        FilterSpec filter = FilterSpec.of(Comparison.of(path("author.id"), Op.EQ, 1L));

        List<Map<String, Object>> books = provider.fetchWindow(resource("Book"), filter,
                List.of(SortBy.asc("publishedOn"), SortBy.asc("id")), WindowSpec.unbounded());

        assertEquals(List.of(2L, 1L), ids(books));
        assertEquals(LocalDate.of(1971, 1, 1), books.get(0).get("publishedOn"));
    }

    @Test
    @DisplayName("Sorting on a to-many relation is rejected")
    void shouldRejectToManyOrdering() {
        assertThrows(IllegalArgumentException.class, () -> provider.fetchWindow(resource("Author"),
                FilterSpec.empty(), List.of(SortBy.asc("books.title")), WindowSpec.unbounded()));
    }

    // ============================================================================
    // Fetch one
    // ============================================================================

    @Test
    @DisplayName("Identifiers are converted to the entity identifier type")
    void shouldFetchOneByTextualIdentifier() {
        Optional<Map<String, Object>> book = provider.fetchOne(resource("Book"), "1");

        assertTrue(book.isPresent());
        assertEquals("The Dispossessed", book.get().get("title"));
        assertEquals(1L, book.get().get("author"));
        assertEquals(List.of(1L, 2L), book.get().get("reviews"));
    }

    @Test
    @DisplayName("A missing identifier yields an empty result")
    void shouldReturnEmptyForMissingItem() {
        assertTrue(provider.fetchOne(resource("Book"), 999L).isEmpty());
    }
}
