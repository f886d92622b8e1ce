package io.github.cyfko.relayql.core.filter;

import io.github.cyfko.relayql.core.api.*;
import io.github.cyfko.relayql.core.exception.ValidationException;
import io.github.cyfko.relayql.core.metadata.*;
import io.github.cyfko.relayql.core.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FilterArgumentTranslator Tests")
class FilterArgumentTranslatorTest {

    private ResourceRegistry registry;
    private FilterArgumentTranslator translator;
    private ResourceDescriptor offer;

    @BeforeEach
    void setUp() {
        registry = Fixtures.registry();
        translator = new FilterArgumentTranslator(registry);
        offer = registry.require("Offer");
    }

    // ============================================================================
    // Argument derivation
    // ============================================================================

    @Test
    @DisplayName("Nested paths are joined with underscores and multi-value filters get a _list variant")
    void shouldDeriveUnderscoreJoinedNames() {
        Map<String, FilterArgument> arguments = translator.arguments(offer, OperationKind.QUERY);

        FilterArgument scalar = arguments.get("product_color");
        FilterArgument list = arguments.get("product_color_list");
        assertNotNull(scalar, "product.color should be exposed as product_color");
        assertNotNull(list, "search filters should also expose product_color_list");
        assertEquals(ArgumentShape.SCALAR, scalar.shape());
        assertEquals(ArgumentShape.LIST, list.shape());
        assertEquals(PropertyPath.parse("product.color"), list.path());
        assertEquals(ScalarType.STRING, list.valueType());
        assertEquals("offer.search", list.filter().name());
        assertFalse(arguments.keySet().stream().anyMatch(name -> name.contains(".")), "no argument name may contain a dot");
    }

    @Test
    @DisplayName("Single-value filters only expose the scalar argument")
    void shouldNotExposeListForBooleanFilters() {
        Map<String, FilterArgument> arguments = translator.arguments(offer, OperationKind.QUERY);

        assertTrue(arguments.containsKey("available"));
        assertFalse(arguments.containsKey("available_list"));
    }

    @Test
    @DisplayName("Structured arguments list their accepted keys")
    void shouldDeriveStructuredArguments() {
        Map<String, FilterArgument> arguments = translator.arguments(offer, OperationKind.QUERY);

        assertEquals(ArgumentShape.OBJECT, arguments.get("order").shape());
        assertEquals(List.of("product_releaseDate", "price"), List.copyOf(arguments.get("order").acceptedKeys()));
        assertEquals(List.of("lt", "lte", "gt", "gte", "between"), List.copyOf(arguments.get("price").acceptedKeys()));
        assertEquals(List.of("product"), List.copyOf(arguments.get("exists").acceptedKeys()));
    }

    @Test
    @DisplayName("Override filters replace the base filter set")
    void shouldUseOverrideFilters() {
        ResourceDescriptor descriptor = ResourceDescriptor.builder("Tag")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("label", ScalarType.STRING))
                .field(FieldDescriptor.scalar("weight", ScalarType.INT))
                .filter(FilterDescriptor.search("tag.label", Map.of("label", MatchStrategy.EXACT)))
                .operation(OperationKind.QUERY, OperationOverride.builder()
                        .filters(FilterDescriptor.numeric("tag.weight", "weight"))
                        .build())
                .operation(OperationKind.DELETE)
                .build();
        FilterArgumentTranslator tags = new FilterArgumentTranslator(ResourceRegistry.of(descriptor));

        assertEquals(List.of("weight", "weight_list"), List.copyOf(tags.arguments(descriptor, OperationKind.QUERY).keySet()));
        assertEquals(List.of("label", "label_list"), List.copyOf(tags.arguments(descriptor, OperationKind.DELETE).keySet()));
    }

    @Test
    @DisplayName("Derived arguments are cached per resource and operation")
    void shouldCacheArguments() {
        assertSame(translator.arguments(offer, OperationKind.QUERY), translator.arguments(offer, OperationKind.QUERY));
    }

    // ============================================================================
    // Translation
    // ============================================================================

    @Test
    @DisplayName("Offer scenario: color list and descending release date")
    void shouldTranslateOfferScenario() {
        // When
        TranslatedArguments translated = translator.translate(offer, OperationKind.QUERY, Map.of(
                "product_color_list", List.of("red", "green"),
                "order", Map.of("product_releaseDate", "DESC")));

        // Then
        assertEquals(FilterSpec.of(Comparison.of(PropertyPath.parse("product.color"), Op.IN, List.of("red", "green"))),
                translated.filter());
        assertEquals(List.of(SortBy.desc("product.releaseDate"), SortBy.asc("id")), translated.ordering());
    }

    @Test
    @DisplayName("Default ordering applies when no order argument is given")
    void shouldFallBackToDefaultOrdering() {
        TranslatedArguments translated = translator.translate(offer, OperationKind.QUERY, Map.of());

        assertTrue(translated.filter().isEmpty());
        assertEquals(List.of(SortBy.asc("product.releaseDate"), SortBy.asc("id")), translated.ordering());
    }

    @Test
    @DisplayName("Order given as a list of single-entry mappings keeps the key order")
    void shouldPreserveMultiKeyOrder() {
        TranslatedArguments translated = translator.translate(offer, OperationKind.QUERY, Map.of(
                "order", List.of(Map.of("price", "desc"), Map.of("product_releaseDate", "asc"))));

        assertEquals(List.of(SortBy.desc("price"), SortBy.asc("product.releaseDate"), SortBy.asc("id")),
                translated.ordering());
    }

    @Test
    @DisplayName("Unknown ordering key is reported as order.<key>")
    void shouldRejectUnknownOrderKey() {
        ValidationException e = assertThrows(ValidationException.class, () ->
                translator.translate(offer, OperationKind.QUERY, Map.of("order", Map.of("product_color", "ASC"))));

        assertEquals("order.product_color", e.getArgument());
    }

    @Test
    @DisplayName("Bad direction is reported as order.<key>")
    void shouldRejectBadDirection() {
        ValidationException e = assertThrows(ValidationException.class, () ->
                translator.translate(offer, OperationKind.QUERY, Map.of("order", Map.of("price", "UP"))));

        assertEquals("order.price", e.getArgument());
    }

    @Test
    @DisplayName("Unknown arguments are rejected")
    void shouldRejectUnknownArgument() {
        ValidationException e = assertThrows(ValidationException.class, () ->
                translator.translate(offer, OperationKind.QUERY, Map.of("product.color", "red")));

        assertEquals("product.color", e.getArgument());
    }

    @Test
    @DisplayName("Type mismatches name the argument")
    void shouldRejectTypeMismatch() {
        ValidationException e = assertThrows(ValidationException.class, () ->
                translator.translate(offer, OperationKind.QUERY, Map.of("available", "yes")));

        assertEquals("available", e.getArgument());
        assertTrue(e.getCause() instanceof IllegalArgumentException);
    }

    @Test
    @DisplayName("A list given to the scalar argument points to the _list variant")
    void shouldRejectListOnScalarArgument() {
        ValidationException e = assertThrows(ValidationException.class, () ->
                translator.translate(offer, OperationKind.QUERY, Map.of("product_color", List.of("red"))));

        assertEquals("product_color", e.getArgument());
        assertTrue(e.getMessage().contains("product_color_list"));
    }

    @Test
    @DisplayName("Partial strategies produce LIKE patterns, OR-ed for lists")
    void shouldTranslatePartialSearch() {
        TranslatedArguments single = translator.translate(offer, OperationKind.QUERY, Map.of("product_name", "lap"));
        TranslatedArguments many = translator.translate(offer, OperationKind.QUERY,
                Map.of("product_name_list", List.of("lap", "top")));

        PropertyPath name = PropertyPath.parse("product.name");
        assertEquals(FilterSpec.of(new Comparison(name, Op.MATCHES, "%lap%", true)), single.filter());
        assertEquals(FilterSpec.of(new AnyOf(List.of(
                new Comparison(name, Op.MATCHES, "%lap%", true),
                new Comparison(name, Op.MATCHES, "%top%", true)))), many.filter());
    }

    @Test
    @DisplayName("Wildcards and the escape character in searched text are escaped")
    void shouldEscapeSearchedText() {
        TranslatedArguments translated = translator.translate(offer, OperationKind.QUERY,
                Map.of("product_name", "50%_off\\"));

        assertEquals(FilterSpec.of(new Comparison(PropertyPath.parse("product.name"), Op.MATCHES,
                "%50\\%\\_off\\\\%", true)), translated.filter());
    }

    @Test
    @DisplayName("Range keys map to comparison operators")
    void shouldTranslateRange() {
        TranslatedArguments translated = translator.translate(offer, OperationKind.QUERY,
                Map.of("price", Map.of("between", "10..25.5")));

        assertEquals(FilterSpec.of(Comparison.of(PropertyPath.parse("price"), Op.RANGE, List.of(10.0, 25.5))),
                translated.filter());
    }

    @Test
    @DisplayName("Malformed between and unknown range keys are rejected")
    void shouldRejectBadRange() {
        ValidationException between = assertThrows(ValidationException.class, () ->
                translator.translate(offer, OperationKind.QUERY, Map.of("price", Map.of("between", "10"))));
        ValidationException key = assertThrows(ValidationException.class, () ->
                translator.translate(offer, OperationKind.QUERY, Map.of("price", Map.of("above", 10))));

        assertEquals("price.between", between.getArgument());
        assertEquals("price.above", key.getArgument());
    }

    @Test
    @DisplayName("Date keys map to inclusive and strict bounds")
    void shouldTranslateDateBounds() {
        ResourceDescriptor book = registry.require("Book");

        TranslatedArguments translated = translator.translate(book, OperationKind.QUERY,
                Map.of("publishedOn", Map.of("strictly_before", "1975-01-01")));

        assertEquals(FilterSpec.of(Comparison.of(PropertyPath.parse("publishedOn"), Op.LT, LocalDate.of(1975, 1, 1))),
                translated.filter());
    }

    @Test
    @DisplayName("Exists maps to null checks")
    void shouldTranslateExists() {
        TranslatedArguments translated = translator.translate(offer, OperationKind.QUERY,
                Map.of("exists", Map.of("product", false)));

        assertEquals(FilterSpec.of(Comparison.of(PropertyPath.parse("product"), Op.IS_NULL, null)), translated.filter());
    }

    @Test
    @DisplayName("Null values are treated as absent")
    void shouldIgnoreNullValues() {
        Map<String, Object> values = new java.util.HashMap<>();
        values.put("product_color", null);

        assertTrue(translator.translate(offer, OperationKind.QUERY, values).filter().isEmpty());
    }

    @Test
    @DisplayName("An explicit identifier ordering is not duplicated")
    void shouldNotDuplicateIdentifierTiebreaker() {
        List<SortBy> ordering = translator.totalOrdering(offer, List.of(SortBy.desc("id")));

        assertEquals(List.of(SortBy.desc("id")), ordering);
    }
}
