package io.github.cyfko.relayql.core.model;

/**
 * Pagination metadata of a page-based collection response.
 *
 * @param itemsPerPage size of each page
 * @param currentPage  current one-based page number
 * @param lastPage     one-based number of the last page ({@code 1} for an empty collection)
 * @param totalCount   total number of items across all pages
 * @param hasNextPage  whether a page exists after the current one
 */
public record PaginationInfo(int itemsPerPage, int currentPage, int lastPage, long totalCount, boolean hasNextPage) {

    /**
     * Derives the metadata of a page given the total item count.
     *
     * @param pagination requested page
     * @param totalCount number of matching items
     */
    public PaginationInfo(Pagination pagination, long totalCount) {
        this(pagination.size(),
                pagination.displayPage(),
                (int) Math.max(1, (totalCount + pagination.size() - 1) / pagination.size()),
                totalCount,
                (long) pagination.displayPage() * pagination.size() < totalCount);
    }
}
