package io.github.cyfko.relayql.core.model;

/**
 * Page-based window, used by resources whose pagination type is {@code PAGE}.
 *
 * <p>
 * The caller-facing {@code page} argument is one-based; this record stores the zero-based index.
 * </p>
 *
 * <pre>{@code
 * Pagination p = Pagination.ofDisplayPage(3, 20); // page index 2
 * p.offset();                                     // 40
 * }</pre>
 *
 * @param page zero-based page number ({@code >= 0})
 * @param size number of records per page ({@code > 0})
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Pagination(int page, int size) {

    /**
     * @throws IllegalArgumentException if {@code size <= 0} or {@code page < 0}
     */
    public Pagination {
        if (size <= 0) {
            throw new IllegalArgumentException("Page size must be positive. Provided: " + size);
        }
        if (page < 0) {
            throw new IllegalArgumentException("Page number cannot be negative. Provided: " + page);
        }
    }

    /**
     * @param displayPage one-based page number
     * @param size        page size
     * @return the pagination for that page
     */
    public static Pagination ofDisplayPage(int displayPage, int size) {
        return new Pagination(displayPage - 1, size);
    }

    /**
     * Calculates the zero-based offset for database queries.
     *
     * @return {@code page * size}
     */
    public int offset() {
        return Math.multiplyExact(page, size);
    }

    public int displayPage() {
        return page + 1;
    }

    public WindowSpec window() {
        return new WindowSpec(offset(), size);
    }

    @Override
    public String toString() {
        return String.format("Pagination{page=%d, size=%d}", page, size);
    }
}
