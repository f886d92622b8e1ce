package io.github.cyfko.relayql.core.api;

/**
 * Single condition of a {@link FilterSpec}.
 *
 * @see Comparison
 * @see AnyOf
 */
public interface Criterion {

    /**
     * @return a deterministic textual form, used to fingerprint filter specifications
     */
    String canonical();
}
