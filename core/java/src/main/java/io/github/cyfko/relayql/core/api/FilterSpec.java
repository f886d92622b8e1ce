package io.github.cyfko.relayql.core.api;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Persistence-layer filter specification: a conjunction of {@link Criterion criteria}.
 * <p>
 * An empty specification matches every item.
 * </p>
 *
 * @param criteria conditions that must all hold
 */
public record FilterSpec(List<Criterion> criteria) {

    private static final FilterSpec EMPTY = new FilterSpec(List.of());

    public FilterSpec {
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
    }

    public static FilterSpec empty() {
        return EMPTY;
    }

    public static FilterSpec of(Criterion... criteria) {
        return new FilterSpec(List.of(criteria));
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    /**
     * @param criterion additional condition
     * @return a new specification also requiring {@code criterion}
     */
    public FilterSpec and(Criterion criterion) {
        List<Criterion> extended = new ArrayList<>(criteria);
        extended.add(criterion);
        return new FilterSpec(extended);
    }

    /**
     * Order-independent textual form: two specifications holding the same criteria in a different
     * order have the same canonical form.
     *
     * @return canonical form
     */
    public String canonical() {
        return criteria.stream().map(Criterion::canonical).sorted().collect(Collectors.joining(" & "));
    }
}
