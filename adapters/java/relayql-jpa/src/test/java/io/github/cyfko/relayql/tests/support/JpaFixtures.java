package io.github.cyfko.relayql.tests.support;

import io.github.cyfko.relayql.core.api.Direction;
import io.github.cyfko.relayql.core.metadata.*;
import io.github.cyfko.relayql.core.security.AccessRules;
import io.github.cyfko.relayql.tests.entities.*;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resources mapped onto the test entities, and the rows every JPA test starts from.
 *
 * <ul>
 *   <li>Products 1..5 released on 2024-01-01..05, colors red, green, blue, red, green.</li>
 *   <li>Offers 1..5 priced 10..50 on product 1..5 (odd ones available); offer 6 has no product.</li>
 *   <li>Authors Ursula (books 1, 2), Italo (book 3) and Nobody (no book).</li>
 *   <li>Reviews 1 (5, alice) and 2 (3, bob) on book 1, review 3 (4, alice) on book 3.</li>
 * </ul>
 */
public final class JpaFixtures {

    public static final String OWNER_ONLY = "Only the owner can access this review.";

    private JpaFixtures() {
    }

    public static ResourceRegistry registry() {
        Map<String, MatchStrategy> offerSearch = new LinkedHashMap<>();
        offerSearch.put("product.color", MatchStrategy.EXACT);
        offerSearch.put("product.name", MatchStrategy.IPARTIAL);

        ResourceDescriptor product = ResourceDescriptor.builder("Product")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("name", ScalarType.STRING))
                .field(FieldDescriptor.scalar("color", ScalarType.STRING))
                .field(FieldDescriptor.scalar("releaseDate", ScalarType.DATE))
                .defaultOperations()
                .build();
        ResourceDescriptor offer = ResourceDescriptor.builder("Offer")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("price", ScalarType.FLOAT))
                .field(FieldDescriptor.scalar("available", ScalarType.BOOLEAN))
                .field(FieldDescriptor.relation("product", "Product").nullable(true))
                .filter(FilterDescriptor.search("offer.search", offerSearch))
                .filter(FilterDescriptor.range("offer.range", "price"))
                .filter(FilterDescriptor.bool("offer.available", "available"))
                .filter(FilterDescriptor.exists("offer.exists", "product"))
                .filter(FilterDescriptor.order("offer.order", "product.releaseDate", "price"))
                .defaultOperations()
                .build();
        ResourceDescriptor author = ResourceDescriptor.builder("Author")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("name", ScalarType.STRING))
                .field(FieldDescriptor.toMany("books", "Book", "author"))
                .filter(FilterDescriptor.search("author.search", Map.of("books.title", MatchStrategy.IPARTIAL)))
                .filter(FilterDescriptor.exists("author.exists", "books"))
                .operation(OperationKind.QUERY)
                .build();
        ResourceDescriptor book = ResourceDescriptor.builder("Book")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("title", ScalarType.STRING))
                .field(FieldDescriptor.scalar("isbn", ScalarType.STRING).groups("book:write"))
                .field(FieldDescriptor.scalar("publishedOn", ScalarType.DATE))
                .field(FieldDescriptor.relation("author", "Author"))
                .field(FieldDescriptor.toMany("reviews", "Review", "book"))
                .filter(FilterDescriptor.order("book.order", "title", "publishedOn"))
                .pagination(PaginationOptions.cursor().itemsPerPage(2).maximumItemsPerPage(5))
                .operation(OperationKind.QUERY)
                .build();
        ResourceDescriptor review = ResourceDescriptor.builder("Review")
                .field(FieldDescriptor.identifier("id"))
                .field(FieldDescriptor.scalar("rating", ScalarType.INT))
                .field(FieldDescriptor.scalar("owner", ScalarType.STRING))
                .field(FieldDescriptor.relation("book", "Book"))
                .filter(FilterDescriptor.numeric("review.rating", "rating"))
                .accessControl(AccessRules.ownedBy("owner"), OWNER_ONLY)
                .pagination(PaginationOptions.page().itemsPerPage(10))
                .defaultOperations()
                .build();
        return ResourceRegistry.of(product, offer, author, book, review);
    }

    public static void seed(EntityManagerFactory emf) {
        EntityManager em = emf.createEntityManager();
        em.getTransaction().begin();

        String[] colors = {"red", "green", "blue", "red", "green"};
        for (int i = 1; i <= 5; i++) {
            Product product = new Product("Product " + i, colors[i - 1], LocalDate.of(2024, 1, i));
            em.persist(product);
            em.persist(new Offer(BigDecimal.valueOf(10L * i), i % 2 == 1, product));
        }
        em.persist(new Offer(BigDecimal.valueOf(60L), false, null));

        Author ursula = new Author("Ursula");
        Author italo = new Author("Italo");
        em.persist(ursula);
        em.persist(italo);
        em.persist(new Author("Nobody"));

        Book dispossessed = new Book("The Dispossessed", "978-0061054884", LocalDate.of(1974, 5, 1), ursula);
        Book lathe = new Book("The Lathe of Heaven", "978-0060512743", LocalDate.of(1971, 1, 1), ursula);
        Book cities = new Book("Invisible Cities", "978-0156453806", LocalDate.of(1972, 11, 1), italo);
        em.persist(dispossessed);
        em.persist(lathe);
        em.persist(cities);

        em.persist(new Review(5, "alice", dispossessed));
        em.persist(new Review(3, "bob", dispossessed));
        em.persist(new Review(4, "alice", cities));

        em.getTransaction().commit();
        em.close();
    }
}
