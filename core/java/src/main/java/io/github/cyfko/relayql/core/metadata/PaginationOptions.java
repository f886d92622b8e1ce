package io.github.cyfko.relayql.core.metadata;

import io.github.cyfko.relayql.core.exception.ResourceDefinitionException;

/**
 * Per-resource pagination options.
 * <p>
 * {@code itemsPerPage} and {@code maximumItemsPerPage} override the resolver-wide defaults when set.
 * </p>
 *
 * @param enabled             whether collections of this resource are paginated at all
 * @param type                collection envelope
 * @param itemsPerPage        default page size, {@code null} to use the global default
 * @param maximumItemsPerPage upper bound on requested page sizes, {@code null} to use the global one
 */
public record PaginationOptions(boolean enabled, PaginationType type, Integer itemsPerPage, Integer maximumItemsPerPage) {

    public PaginationOptions {
        if (type == null) {
            type = PaginationType.CURSOR;
        }
        if (itemsPerPage != null && itemsPerPage < 0) {
            throw new ResourceDefinitionException("itemsPerPage cannot be negative: " + itemsPerPage);
        }
        if (maximumItemsPerPage != null && maximumItemsPerPage < 0) {
            throw new ResourceDefinitionException("maximumItemsPerPage cannot be negative: " + maximumItemsPerPage);
        }
    }

    public static PaginationOptions cursor() {
        return new PaginationOptions(true, PaginationType.CURSOR, null, null);
    }

    public static PaginationOptions page() {
        return new PaginationOptions(true, PaginationType.PAGE, null, null);
    }

    public static PaginationOptions disabled() {
        return new PaginationOptions(false, PaginationType.CURSOR, null, null);
    }

    public PaginationOptions itemsPerPage(int itemsPerPage) {
        return new PaginationOptions(enabled, type, itemsPerPage, maximumItemsPerPage);
    }

    public PaginationOptions maximumItemsPerPage(int maximumItemsPerPage) {
        return new PaginationOptions(enabled, type, itemsPerPage, maximumItemsPerPage);
    }
}
