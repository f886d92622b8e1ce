package io.github.cyfko.relayql.core.spi;

import io.github.cyfko.relayql.core.api.FilterSpec;
import io.github.cyfko.relayql.core.api.SortBy;
import io.github.cyfko.relayql.core.metadata.OperationKind;
import io.github.cyfko.relayql.core.metadata.ResourceDescriptor;
import io.github.cyfko.relayql.core.model.WindowSpec;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence collaborator of the resolver.
 * <p>
 * Items cross this boundary as maps keyed by field name. Scalar fields carry their value; a to-one
 * relation carries either the target identifier or an embedded map of the target; a to-many relation
 * carries a list of identifiers (or embedded maps).
 * </p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations must be thread-safe: the resolver issues calls concurrently.</li>
 *   <li>{@link #fetchWindow} returns items in the given ordering; the ordering is total.</li>
 *   <li>Failures are reported as runtime exceptions; the resolver wraps them into
 *       {@link io.github.cyfko.relayql.core.exception.PersistenceException} and never retries.</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface PersistenceProvider {

    /**
     * Counts the items matching a filter.
     *
     * @param resource resource queried
     * @param filter   filter specification
     * @return number of matching items
     */
    long count(ResourceDescriptor resource, FilterSpec filter);

    /**
     * Fetches one window of the matching items.
     *
     * @param resource resource queried
     * @param filter   filter specification
     * @param ordering total ordering of the result
     * @param window   offset and limit
     * @return at most {@code window.limit()} items, in order
     */
    List<Map<String, Object>> fetchWindow(ResourceDescriptor resource, FilterSpec filter, List<SortBy> ordering,
                                          WindowSpec window);

    /**
     * Fetches a single item by identifier.
     *
     * @param resource resource queried
     * @param id       identifier value
     * @return the item, empty if it does not exist
     */
    Optional<Map<String, Object>> fetchOne(ResourceDescriptor resource, Object id);

    /**
     * Applies a mutation.
     * <p>
     * For {@code CREATE} the input holds the writable fields; for {@code UPDATE} it holds the identifier
     * and the fields to change; for {@code DELETE} it holds the identifier only.
     * </p>
     *
     * @param resource resource mutated
     * @param kind     mutation kind
     * @param input    filtered input
     * @return the created or updated item, or the removed item for deletes
     */
    Map<String, Object> mutate(ResourceDescriptor resource, OperationKind kind, Map<String, Object> input);
}
