package io.github.cyfko.relayql.core.api;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Disjunction of comparisons, produced by multi-value arguments whose values cannot be expressed
 * with a single {@link Op#IN} (e.g. several partial-match patterns).
 *
 * @param alternatives comparisons, at least one of which must hold
 */
public record AnyOf(List<Comparison> alternatives) implements Criterion {

    public AnyOf {
        if (alternatives == null || alternatives.isEmpty()) {
            throw new IllegalArgumentException("AnyOf requires at least one alternative");
        }
        alternatives = List.copyOf(alternatives);
    }

    @Override
    public String canonical() {
        return alternatives.stream().map(Comparison::canonical).collect(Collectors.joining(" | ", "(", ")"));
    }
}
