package io.github.cyfko.relayql.core.metadata;

import io.github.cyfko.relayql.core.exception.ResourceDefinitionException;
import io.github.cyfko.relayql.core.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResourceRegistry Tests")
class ResourceRegistryTest {

    private static ResourceDescriptor.Builder tag() {
        return ResourceDescriptor.builder("Tag")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("label", ScalarType.STRING))
                .field(FieldDescriptor.relation("offer", "Offer"))
                .defaultOperations();
    }

    // ============================================================================
    // Valid metadata
    // ============================================================================

    @Test
    @DisplayName("Should build the fixture registry")
    void shouldBuildRegistry() {
        ResourceRegistry registry = Fixtures.registry();

        assertEquals(5, registry.resources().size());
        assertTrue(registry.get("Offer").isPresent());
        assertTrue(registry.get("Unknown").isEmpty());
    }

    @Test
    @DisplayName("Should resolve paths through relations")
    void shouldResolvePathAcrossRelation() {
        ResourceRegistry registry = Fixtures.registry();

        ResolvedPath resolved = registry.resolvePath(registry.require("Offer"), PropertyPath.parse("product.releaseDate"))
                .orElseThrow();

        assertEquals(List.of("product", "releaseDate"), resolved.fields().stream().map(FieldDescriptor::name).toList());
        assertEquals(ScalarType.DATE, resolved.leaf().type());
        assertFalse(resolved.crossesToMany());
    }

    @Test
    @DisplayName("Should not resolve paths crossing a scalar")
    void shouldNotResolveThroughScalar() {
        ResourceRegistry registry = Fixtures.registry();

        assertTrue(registry.resolvePath(registry.require("Offer"), PropertyPath.parse("price.value")).isEmpty());
    }

    // ============================================================================
    // Invalid metadata
    // ============================================================================

    @Test
    @DisplayName("Should reject filters whose path does not resolve")
    void shouldRejectUnresolvableFilterPath() {
        ResourceDescriptor broken = tag()
                .filter(FilterDescriptor.search("tag.search", Map.of("offer.colour", MatchStrategy.EXACT)))
                .build();

        ResourceDefinitionException e = assertThrows(ResourceDefinitionException.class, () ->
                ResourceRegistry.of(Fixtures.product(), Fixtures.offer(), broken));
        assertTrue(e.getMessage().contains("offer.colour"));
    }

    @Test
    @DisplayName("Should reject relations to unknown resources")
    void shouldRejectUnknownTarget() {
        assertThrows(ResourceDefinitionException.class, () -> ResourceRegistry.of(tag().build()));
    }

    @Test
    @DisplayName("Should reject mappedBy that does not point back to the owner")
    void shouldRejectBadMappedBy() {
        ResourceDescriptor owner = ResourceDescriptor.builder("Shelf")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.toMany("products", "Product", "name"))
                .defaultOperations()
                .build();

        assertThrows(ResourceDefinitionException.class, () -> ResourceRegistry.of(Fixtures.product(), owner));
    }

    @Test
    @DisplayName("Should reject filter kinds incompatible with the leaf type")
    void shouldRejectIncompatibleKind() {
        ResourceDescriptor broken = ResourceDescriptor.builder("Note")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("text", ScalarType.STRING))
                .filter(FilterDescriptor.numeric("note.text", "text"))
                .defaultOperations()
                .build();

        assertThrows(ResourceDefinitionException.class, () -> ResourceRegistry.of(broken));
    }

    @Test
    @DisplayName("Should reject filters deriving the same argument name")
    void shouldRejectArgumentCollision() {
        ResourceDescriptor broken = ResourceDescriptor.builder("Note")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("score", ScalarType.INT))
                .filter(FilterDescriptor.numeric("note.score", "score"))
                .filter(FilterDescriptor.range("note.scoreRange", "score"))
                .defaultOperations()
                .build();

        ResourceDefinitionException e = assertThrows(ResourceDefinitionException.class, () -> ResourceRegistry.of(broken));
        assertTrue(e.getMessage().contains("'score'"));
    }

    @Test
    @DisplayName("Should reject filters deriving a reserved argument name")
    void shouldRejectReservedArgument() {
        ResourceDescriptor broken = ResourceDescriptor.builder("Note")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("first", ScalarType.BOOLEAN))
                .filter(FilterDescriptor.bool("note.first", "first"))
                .defaultOperations()
                .build();

        assertThrows(ResourceDefinitionException.class, () -> ResourceRegistry.of(broken));
    }

    @Test
    @DisplayName("Should reject duplicate resources and missing identifiers")
    void shouldRejectDuplicatesAndMissingIdentifier() {
        assertThrows(ResourceDefinitionException.class, () -> ResourceRegistry.of(Fixtures.product(), Fixtures.product()));
        assertThrows(ResourceDefinitionException.class, () -> ResourceDescriptor.builder("Nameless")
                .field(FieldDescriptor.scalar("label", ScalarType.STRING))
                .build());
    }

    @Test
    @DisplayName("Descriptors without an operation entry do not expose it")
    void shouldExposeOnlyDeclaredOperations() {
        ResourceDescriptor book = Fixtures.book();

        assertTrue(book.exposes(OperationKind.QUERY));
        assertTrue(book.exposes(OperationKind.CREATE));
        assertFalse(book.exposes(OperationKind.UPDATE));
        assertEquals("book", book.resourceKey());
    }
}
