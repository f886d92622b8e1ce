package io.github.cyfko.relayql.core.metadata;

import io.github.cyfko.relayql.core.exception.ResourceDefinitionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable declaration of a resource filter.
 * <p>
 * A filter has a name (used to refer to it from operation overrides and diagnostics), a
 * {@link FilterKind} and an ordered set of property paths it applies to. Search filters carry a
 * {@link MatchStrategy} per path; other kinds ignore the strategy.
 * </p>
 *
 * <pre>{@code
 * FilterDescriptor.search("offer.search", Map.of("product.color", MatchStrategy.EXACT));
 * FilterDescriptor.range("offer.range", "price");
 * FilterDescriptor.order("offer.order", "id", "product.releaseDate");
 * }</pre>
 *
 * @param name       filter name
 * @param kind       filter kind
 * @param properties targeted paths, in declaration order, with their match strategy
 */
public record FilterDescriptor(String name, FilterKind kind, Map<PropertyPath, MatchStrategy> properties) {

    public FilterDescriptor {
        if (name == null || name.isBlank()) {
            throw new ResourceDefinitionException("filter name cannot be blank");
        }
        if (kind == null) {
            throw new ResourceDefinitionException("filter kind is required: " + name);
        }
        if (properties == null || properties.isEmpty()) {
            throw new ResourceDefinitionException("filter '" + name + "' must declare at least one property");
        }
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static FilterDescriptor search(String name, Map<String, MatchStrategy> properties) {
        Map<PropertyPath, MatchStrategy> parsed = new LinkedHashMap<>();
        properties.forEach((path, strategy) -> parsed.put(PropertyPath.parse(path),
                strategy == null ? MatchStrategy.EXACT : strategy));
        return new FilterDescriptor(name, FilterKind.SEARCH, parsed);
    }

    public static FilterDescriptor numeric(String name, String... paths) {
        return of(name, FilterKind.NUMERIC, paths);
    }

    public static FilterDescriptor bool(String name, String... paths) {
        return of(name, FilterKind.BOOLEAN, paths);
    }

    public static FilterDescriptor range(String name, String... paths) {
        return of(name, FilterKind.RANGE, paths);
    }

    public static FilterDescriptor date(String name, String... paths) {
        return of(name, FilterKind.DATE, paths);
    }

    public static FilterDescriptor exists(String name, String... paths) {
        return of(name, FilterKind.EXISTS, paths);
    }

    public static FilterDescriptor order(String name, String... paths) {
        return of(name, FilterKind.ORDER, paths);
    }

    private static FilterDescriptor of(String name, FilterKind kind, String... paths) {
        Map<PropertyPath, MatchStrategy> parsed = new LinkedHashMap<>();
        for (String path : paths) {
            parsed.put(PropertyPath.parse(path), MatchStrategy.EXACT);
        }
        return new FilterDescriptor(name, kind, parsed);
    }
}
