package io.github.cyfko.relayql.core.filter;

import io.github.cyfko.relayql.core.api.FilterSpec;
import io.github.cyfko.relayql.core.api.SortBy;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of translating incoming filter arguments.
 *
 * @param filter   conditions to apply
 * @param ordering total ordering, ending with the identifier tiebreaker
 */
public record TranslatedArguments(FilterSpec filter, List<SortBy> ordering) {

    public TranslatedArguments {
        ordering = List.copyOf(ordering);
    }

    /**
     * @return the ordering in textual form, e.g. {@code product.releaseDate DESC, id ASC}
     */
    public String orderingCanonical() {
        return ordering.stream().map(SortBy::toString).collect(Collectors.joining(", "));
    }
}
