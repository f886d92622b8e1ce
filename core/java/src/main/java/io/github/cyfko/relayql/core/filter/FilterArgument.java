package io.github.cyfko.relayql.core.filter;

import io.github.cyfko.relayql.core.metadata.FilterDescriptor;
import io.github.cyfko.relayql.core.metadata.FilterKind;
import io.github.cyfko.relayql.core.metadata.MatchStrategy;
import io.github.cyfko.relayql.core.metadata.PropertyPath;
import io.github.cyfko.relayql.core.metadata.ScalarType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One argument of the query endpoint, derived from a declared filter.
 *
 * <p>Examples for a resource {@code Offer} filtering on {@code product.color}:</p>
 * <ul>
 *   <li>{@code product_color}: {@link ArgumentShape#SCALAR}, one value</li>
 *   <li>{@code product_color_list}: {@link ArgumentShape#LIST}, OR-ed values</li>
 *   <li>{@code order}: {@link ArgumentShape#OBJECT}, keys {@code product_releaseDate}, ...</li>
 * </ul>
 *
 * @param name      argument name
 * @param shape     accepted value shape
 * @param kind      kind of the originating filter
 * @param valueType type of each value (leaf type of the path, {@code BOOLEAN} for exists keys,
 *                  {@code STRING} for order directions)
 * @param path      target path, {@code null} for shared arguments ({@code order}, {@code exists})
 * @param strategy  match strategy of search filters, {@code null} otherwise
 * @param filter    originating filter, {@code null} for shared arguments which may merge several
 * @param keys      accepted keys of {@code OBJECT} arguments mapped to the path they act on
 */
public record FilterArgument(String name,
                             ArgumentShape shape,
                             FilterKind kind,
                             ScalarType valueType,
                             PropertyPath path,
                             MatchStrategy strategy,
                             FilterDescriptor filter,
                             Map<String, PropertyPath> keys) {

    public FilterArgument {
        keys = keys == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(keys));
    }

    public Set<String> acceptedKeys() {
        return keys.keySet();
    }

    public boolean isShared() {
        return path == null;
    }
}
