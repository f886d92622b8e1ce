package io.github.cyfko.relayql.core.support;

import io.github.cyfko.relayql.core.api.Direction;
import io.github.cyfko.relayql.core.metadata.*;
import io.github.cyfko.relayql.core.security.AccessRules;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resources shared by the core tests.
 *
 * <ul>
 *   <li>{@code Product} / {@code Offer}: filtering across a relation and cursor pagination.</li>
 *   <li>{@code Author} / {@code Book} / {@code Review}: operation overrides, serialization groups,
 *       access rules and nested collections. {@code Book} does not expose {@code update}.</li>
 * </ul>
 */
public final class Fixtures {

    public static final String OWNER_ONLY = "Only the owner can read this review.";
    public static final String ADMIN_ONLY = "Only admins can delete books.";

    private Fixtures() {
    }

    public static ResourceDescriptor product() {
        return ResourceDescriptor.builder("Product")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("name", ScalarType.STRING))
                .field(FieldDescriptor.scalar("color", ScalarType.STRING))
                .field(FieldDescriptor.scalar("releaseDate", ScalarType.DATE))
                .filter(FilterDescriptor.search("product.search", Map.of("name", MatchStrategy.IPARTIAL)))
                .defaultOperations()
                .build();
    }

    public static ResourceDescriptor offer() {
        Map<String, MatchStrategy> search = new LinkedHashMap<>();
        search.put("product.color", MatchStrategy.EXACT);
        search.put("product.name", MatchStrategy.IPARTIAL);
        return ResourceDescriptor.builder("Offer")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("price", ScalarType.FLOAT))
                .field(FieldDescriptor.scalar("available", ScalarType.BOOLEAN))
                .field(FieldDescriptor.relation("product", "Product"))
                .filter(FilterDescriptor.search("offer.search", search))
                .filter(FilterDescriptor.range("offer.range", "price"))
                .filter(FilterDescriptor.bool("offer.available", "available"))
                .filter(FilterDescriptor.exists("offer.exists", "product"))
                .filter(FilterDescriptor.order("offer.order", "product.releaseDate", "price"))
                .defaultOrder("product.releaseDate", Direction.ASC)
                .defaultOperations()
                .build();
    }

    public static ResourceDescriptor author() {
        return ResourceDescriptor.builder("Author")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("name", ScalarType.STRING))
                .field(FieldDescriptor.toMany("books", "Book", "author"))
                .operation(OperationKind.QUERY)
                .build();
    }

    public static ResourceDescriptor book() {
        return ResourceDescriptor.builder("Book")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("title", ScalarType.STRING).groups("book:read", "book:write"))
                .field(FieldDescriptor.scalar("isbn", ScalarType.STRING).groups("book:write"))
                .field(FieldDescriptor.scalar("summary", ScalarType.STRING).groups("book:read"))
                .field(FieldDescriptor.scalar("publishedOn", ScalarType.DATE).groups("book:read", "book:write"))
                .field(FieldDescriptor.relation("author", "Author").groups("book:read", "book:write"))
                .field(FieldDescriptor.toMany("reviews", "Review", "book").groups("book:read"))
                .filter(FilterDescriptor.search("book.search", Map.of("title", MatchStrategy.IPARTIAL)))
                .filter(FilterDescriptor.date("book.date", "publishedOn"))
                .filter(FilterDescriptor.order("book.order", "title", "publishedOn"))
                .normalizationGroups("book:read")
                .denormalizationGroups("book:write")
                .accessControl(AccessRules.authenticated())
                .pagination(PaginationOptions.cursor().itemsPerPage(2).maximumItemsPerPage(5))
                .operation(OperationKind.QUERY)
                .operation(OperationKind.CREATE, OperationOverride.builder()
                        .accessControl(AccessRules.hasRole("ROLE_EDITOR"), "Only editors can create books.")
                        .build())
                .operation(OperationKind.DELETE, OperationOverride.builder()
                        .accessControl(AccessRules.hasRole("ROLE_ADMIN"), ADMIN_ONLY)
                        .build())
                .build();
    }

    public static ResourceDescriptor review() {
        return ResourceDescriptor.builder("Review")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("rating", ScalarType.INT))
                .field(FieldDescriptor.scalar("owner", ScalarType.STRING))
                .field(FieldDescriptor.relation("book", "Book"))
                .filter(FilterDescriptor.numeric("review.rating", "rating"))
                .filter(FilterDescriptor.order("review.order", "rating"))
                .accessControl(AccessRules.ownedBy("owner"), OWNER_ONLY)
                .pagination(PaginationOptions.page().itemsPerPage(10))
                .defaultOperations()
                .build();
    }

    public static ResourceRegistry registry() {
        return ResourceRegistry.of(product(), offer(), author(), book(), review());
    }

    /**
     * Registers five products (released on consecutive days, alternating colors) and one offer each.
     */
    public static InMemoryPersistenceProvider catalog(ResourceRegistry registry) {
        InMemoryPersistenceProvider provider = new InMemoryPersistenceProvider(registry);
        String[] colors = {"red", "green", "blue", "red", "green"};
        for (int i = 1; i <= 5; i++) {
            provider.insert("Product", row("id", (long) i, "name", "Product " + i, "color", colors[i - 1],
                    "releaseDate", LocalDate.of(2024, 1, i)));
            provider.insert("Offer", row("id", (long) (10 + i), "price", 10.0 * i, "available", i % 2 == 1,
                    "product", (long) i));
        }
        return provider;
    }

    /**
     * Registers two authors, three books and reviews owned by alice and bob.
     */
    public static InMemoryPersistenceProvider library(ResourceRegistry registry) {
        InMemoryPersistenceProvider provider = new InMemoryPersistenceProvider(registry);
        provider.insert("Author", row("id", 1L, "name", "Ursula"));
        provider.insert("Author", row("id", 2L, "name", "Italo"));
        provider.insert("Book", row("id", 1L, "title", "The Dispossessed", "isbn", "978-0061054884",
                "summary", "Anarres and Urras", "publishedOn", LocalDate.of(1974, 5, 1), "author", 1L));
        provider.insert("Book", row("id", 2L, "title", "The Lathe of Heaven", "isbn", "978-0060512743",
                "summary", "Dreams change reality", "publishedOn", LocalDate.of(1971, 1, 1), "author", 1L));
        provider.insert("Book", row("id", 3L, "title", "Invisible Cities", "isbn", "978-0156453806",
                "summary", "Marco Polo and Kublai Khan", "publishedOn", LocalDate.of(1972, 11, 1), "author", 2L));
        provider.insert("Review", row("id", 1L, "rating", 5, "owner", "alice", "book", 1L));
        provider.insert("Review", row("id", 2L, "rating", 3, "owner", "bob", "book", 1L));
        provider.insert("Review", row("id", 3L, "rating", 4, "owner", "alice", "book", 3L));
        return provider;
    }

    public static Map<String, Object> row(Object... keysAndValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            row.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return row;
    }
}
