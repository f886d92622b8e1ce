package io.github.cyfko.relayql.core.filter;

import io.github.cyfko.relayql.core.api.AnyOf;
import io.github.cyfko.relayql.core.api.Comparison;
import io.github.cyfko.relayql.core.api.Criterion;
import io.github.cyfko.relayql.core.api.Direction;
import io.github.cyfko.relayql.core.api.FilterSpec;
import io.github.cyfko.relayql.core.api.Op;
import io.github.cyfko.relayql.core.api.SortBy;
import io.github.cyfko.relayql.core.exception.ResourceDefinitionException;
import io.github.cyfko.relayql.core.exception.ValidationException;
import io.github.cyfko.relayql.core.metadata.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Translates declared resource filters into endpoint arguments, and incoming argument values into a
 * {@link FilterSpec} and a total ordering.
 *
 * <h2>Argument naming</h2>
 * <ul>
 *   <li>Nested paths are joined with {@code _}: {@code product.color} becomes {@code product_color}.</li>
 *   <li>Search and numeric filters also expose {@code <path>_list}, an ordered sequence of values
 *       OR-ed together.</li>
 *   <li>Range and date filters expose one structured argument per path
 *       ({@code price: {gte: 10, lt: 20}}).</li>
 *   <li>Ordering and exists filters share one structured argument each, {@code order} and
 *       {@code exists}, keyed by the argument name of each declared path.</li>
 * </ul>
 *
 * <h2>Active filters</h2>
 * <p>
 * The filters of an operation are those of its override when the override declares a filter set,
 * otherwise the base filters of the resource. Derived argument sets are cached per resource and
 * operation; translation itself is pure.
 * </p>
 *
 * <pre>{@code
 * TranslatedArguments t = translator.translate(offer, OperationKind.QUERY, Map.of(
 *     "product_color_list", List.of("red", "green"),
 *     "order", Map.of("product_releaseDate", "DESC")));
 * // t.filter():   product.color IN [red, green]
 * // t.ordering(): product.releaseDate DESC, id ASC
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterArgumentTranslator {

    private static final Logger logger = Logger.getLogger(FilterArgumentTranslator.class.getName());

    public static final String ORDER_ARGUMENT = "order";
    public static final String EXISTS_ARGUMENT = "exists";
    public static final String LIST_SUFFIX = "_list";

    private static final Map<String, Op> RANGE_KEYS = orderedKeys(
            "lt", Op.LT, "lte", Op.LTE, "gt", Op.GT, "gte", Op.GTE, "between", Op.RANGE);
    private static final Map<String, Op> DATE_KEYS = orderedKeys(
            "before", Op.LTE, "strictly_before", Op.LT, "after", Op.GTE, "strictly_after", Op.GT);
    private static final String BETWEEN_SEPARATOR = "..";

    private final ResourceRegistry registry;
    private final Map<String, Map<String, FilterArgument>> argumentCache = new ConcurrentHashMap<>();

    public FilterArgumentTranslator(ResourceRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Returns the filters active for an operation.
     *
     * @param resource resource descriptor
     * @param kind     operation kind
     * @return override filters if declared, base filters otherwise
     */
    public static Map<String, FilterDescriptor> activeFilters(ResourceDescriptor resource, OperationKind kind) {
        return resource.operation(kind)
                .flatMap(OperationOverride::filters)
                .orElse(resource.filters());
    }

    /**
     * Derives (once) the arguments exposed by an operation.
     *
     * @param resource resource descriptor
     * @param kind     operation kind
     * @return arguments by name, in declaration order
     */
    public Map<String, FilterArgument> arguments(ResourceDescriptor resource, OperationKind kind) {
        return argumentCache.computeIfAbsent(resource.name() + "#" + kind, key -> derive(resource, kind));
    }

    /**
     * Translates incoming argument values.
     * <p>
     * {@code null} values are treated as absent. The ordering is the {@code order} argument when
     * given, else the resource default ordering, completed with the identifier ascending.
     * </p>
     *
     * @param resource resource descriptor
     * @param kind     operation kind
     * @param values   filter argument values, pagination and other resolver arguments excluded
     * @return the filter specification and the total ordering
     * @throws ValidationException on unknown arguments, unknown keys, bad directions or type mismatches
     */
    public TranslatedArguments translate(ResourceDescriptor resource, OperationKind kind, Map<String, Object> values) {
        Map<String, FilterArgument> declared = arguments(resource, kind);
        List<Criterion> criteria = new ArrayList<>();
        List<SortBy> requestedOrder = List.of();

        for (Map.Entry<String, Object> entry : values.entrySet()) {
            FilterArgument argument = declared.get(entry.getKey());
            if (argument == null) {
                throw ValidationException.unknownArgument(entry.getKey());
            }
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (argument.kind()) {
                case ORDER -> requestedOrder = translateOrder(argument, value);
                case EXISTS -> criteria.addAll(translateExists(argument, value));
                case RANGE -> criteria.addAll(translateBounds(argument, value, RANGE_KEYS));
                case DATE -> criteria.addAll(translateBounds(argument, value, DATE_KEYS));
                case SEARCH, NUMERIC, BOOLEAN -> translateMatch(argument, value).ifPresent(criteria::add);
            }
        }

        List<SortBy> ordering = totalOrdering(resource, requestedOrder.isEmpty() ? resource.defaultOrder() : requestedOrder);
        TranslatedArguments translated = new TranslatedArguments(new FilterSpec(criteria), ordering);
        logger.fine(() -> String.format("Translated arguments of %s.%s: filter=[%s], ordering=[%s]",
                resource.name(), kind.operationName(), translated.filter().canonical(), translated.orderingCanonical()));
        return translated;
    }

    /**
     * Completes an ordering with the identifier ascending, unless the identifier is already ordered.
     *
     * @param resource resource descriptor
     * @param ordering requested ordering
     * @return a total ordering
     */
    public List<SortBy> totalOrdering(ResourceDescriptor resource, List<SortBy> ordering) {
        PropertyPath identifier = PropertyPath.of(resource.identifier().name());
        List<SortBy> total = new ArrayList<>(ordering);
        boolean ordersIdentifier = total.stream().anyMatch(sortBy -> sortBy.path().equals(identifier));
        if (!ordersIdentifier) {
            total.add(new SortBy(identifier, Direction.ASC));
        }
        return total;
    }

    // ============================================================================
    // Derivation
    // ============================================================================

    private Map<String, FilterArgument> derive(ResourceDescriptor resource, OperationKind kind) {
        Map<String, FilterArgument> arguments = new LinkedHashMap<>();
        Map<String, PropertyPath> orderKeys = new LinkedHashMap<>();
        Map<String, PropertyPath> existsKeys = new LinkedHashMap<>();

        for (FilterDescriptor filter : activeFilters(resource, kind).values()) {
            for (Map.Entry<PropertyPath, MatchStrategy> property : filter.properties().entrySet()) {
                PropertyPath path = property.getKey();
                String name = path.argumentName();
                switch (filter.kind()) {
                    case ORDER -> orderKeys.putIfAbsent(name, path);
                    case EXISTS -> existsKeys.putIfAbsent(name, path);
                    case SEARCH, NUMERIC -> {
                        ScalarType type = leafType(resource, filter, path);
                        MatchStrategy strategy = filter.kind() == FilterKind.SEARCH ? property.getValue() : null;
                        put(arguments, new FilterArgument(name, ArgumentShape.SCALAR, filter.kind(), type, path,
                                strategy, filter, null));
                        put(arguments, new FilterArgument(name + LIST_SUFFIX, ArgumentShape.LIST, filter.kind(), type,
                                path, strategy, filter, null));
                    }
                    case BOOLEAN -> put(arguments, new FilterArgument(name, ArgumentShape.SCALAR, filter.kind(),
                            leafType(resource, filter, path), path, null, filter, null));
                    case RANGE, DATE -> {
                        Map<String, PropertyPath> keys = new LinkedHashMap<>();
                        (filter.kind() == FilterKind.RANGE ? RANGE_KEYS : DATE_KEYS).keySet()
                                .forEach(key -> keys.put(key, path));
                        put(arguments, new FilterArgument(name, ArgumentShape.OBJECT, filter.kind(),
                                leafType(resource, filter, path), path, null, filter, keys));
                    }
                }
            }
        }

        if (!orderKeys.isEmpty()) {
            put(arguments, new FilterArgument(ORDER_ARGUMENT, ArgumentShape.OBJECT, FilterKind.ORDER,
                    ScalarType.STRING, null, null, null, orderKeys));
        }
        if (!existsKeys.isEmpty()) {
            put(arguments, new FilterArgument(EXISTS_ARGUMENT, ArgumentShape.OBJECT, FilterKind.EXISTS,
                    ScalarType.BOOLEAN, null, null, null, existsKeys));
        }

        logger.fine(() -> String.format("Derived arguments of %s.%s: %s",
                resource.name(), kind.operationName(), arguments.keySet()));
        return Collections.unmodifiableMap(arguments);
    }

    private ScalarType leafType(ResourceDescriptor resource, FilterDescriptor filter, PropertyPath path) {
        return registry.resolvePath(resource, path)
                .map(resolved -> resolved.leaf().type())
                .orElseThrow(() -> new ResourceDefinitionException(String.format(
                        "filter '%s' of resource '%s': path '%s' does not resolve", filter.name(), resource.name(), path)));
    }

    private static void put(Map<String, FilterArgument> arguments, FilterArgument argument) {
        FilterArgument previous = arguments.putIfAbsent(argument.name(), argument);
        if (previous != null) {
            throw new ResourceDefinitionException("argument '" + argument.name() + "' is derived by several filters");
        }
    }

    // ============================================================================
    // Translation
    // ============================================================================

    private Optional<Criterion> translateMatch(FilterArgument argument, Object value) {
        boolean ignoreCase = argument.strategy() != null && argument.strategy().isCaseInsensitive();
        boolean pattern = argument.strategy() != null && !argument.strategy().isExact();

        if (argument.shape() == ArgumentShape.LIST) {
            if (!(value instanceof Collection<?> values)) {
                throw new ValidationException(argument.name(), "Argument '" + argument.name() + "' expects a list of values.");
            }
            List<Object> coerced = new ArrayList<>(values.size());
            for (Object element : values) {
                coerced.add(coerce(argument.name(), argument.valueType(), element));
            }
            if (coerced.isEmpty()) {
                return Optional.empty();
            }
            if (pattern) {
                List<Comparison> alternatives = new ArrayList<>(coerced.size());
                for (Object element : coerced) {
                    alternatives.add(new Comparison(argument.path(), Op.MATCHES,
                            argument.strategy().pattern((String) element), ignoreCase));
                }
                return Optional.of(alternatives.size() == 1 ? alternatives.get(0) : new AnyOf(alternatives));
            }
            return Optional.of(new Comparison(argument.path(), Op.IN, coerced, ignoreCase));
        }

        if (value instanceof Collection<?>) {
            String hint = argument.kind().supportsMultipleValues()
                    ? " Use '" + argument.name() + LIST_SUFFIX + "' to match several values." : "";
            throw new ValidationException(argument.name(), "Argument '" + argument.name() + "' expects a single value." + hint);
        }
        Object coerced = coerce(argument.name(), argument.valueType(), value);
        if (pattern) {
            return Optional.of(new Comparison(argument.path(), Op.MATCHES, argument.strategy().pattern((String) coerced), ignoreCase));
        }
        return Optional.of(new Comparison(argument.path(), Op.EQ, coerced, ignoreCase));
    }

    private List<Criterion> translateBounds(FilterArgument argument, Object value, Map<String, Op> operators) {
        Map<?, ?> bounds = requireObject(argument, value);
        List<Criterion> criteria = new ArrayList<>();
        for (Map.Entry<?, ?> bound : bounds.entrySet()) {
            String key = String.valueOf(bound.getKey());
            String qualified = argument.name() + "." + key;
            Op op = operators.get(key);
            if (op == null) {
                throw new ValidationException(qualified, String.format(
                        "Unknown key '%s' for argument '%s'; expected one of %s.", key, argument.name(), operators.keySet()));
            }
            if (bound.getValue() == null) {
                continue;
            }
            if (op == Op.RANGE) {
                criteria.add(Comparison.of(argument.path(), op, parseBetween(qualified, argument.valueType(), bound.getValue())));
            } else {
                criteria.add(Comparison.of(argument.path(), op, coerce(qualified, argument.valueType(), bound.getValue())));
            }
        }
        return criteria;
    }

    private List<Criterion> translateExists(FilterArgument argument, Object value) {
        Map<?, ?> entries = requireObject(argument, value);
        List<Criterion> criteria = new ArrayList<>();
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String qualified = argument.name() + "." + key;
            PropertyPath path = argument.keys().get(key);
            if (path == null) {
                throw new ValidationException(qualified, "Unknown property '" + key + "' for argument '" + argument.name() + "'.");
            }
            if (entry.getValue() == null) {
                continue;
            }
            boolean exists = (Boolean) coerce(qualified, ScalarType.BOOLEAN, entry.getValue());
            criteria.add(Comparison.of(path, exists ? Op.NOT_NULL : Op.IS_NULL, null));
        }
        return criteria;
    }

    private List<SortBy> translateOrder(FilterArgument argument, Object value) {
        List<Map<?, ?>> entries = new ArrayList<>();
        if (value instanceof Map<?, ?> map) {
            entries.add(map);
        } else if (value instanceof Collection<?> list) {
            for (Object element : list) {
                if (!(element instanceof Map<?, ?> map)) {
                    throw new ValidationException(argument.name(),
                            "Argument 'order' expects a mapping or a list of single-entry mappings.");
                }
                entries.add(map);
            }
        } else {
            throw new ValidationException(argument.name(), "Argument 'order' expects a mapping of property to ASC or DESC.");
        }

        List<SortBy> ordering = new ArrayList<>();
        Set<PropertyPath> seen = new HashSet<>();
        for (Map<?, ?> map : entries) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                String qualified = argument.name() + "." + key;
                PropertyPath path = argument.keys().get(key);
                if (path == null) {
                    throw new ValidationException(qualified, "Unknown ordering property '" + key + "'.");
                }
                Direction direction = Direction.fromToken(entry.getValue()).orElseThrow(() -> new ValidationException(
                        qualified, String.format("Invalid direction '%s' for '%s'; expected ASC or DESC.", entry.getValue(), key)));
                if (seen.add(path)) {
                    ordering.add(new SortBy(path, direction));
                }
            }
        }
        return ordering;
    }

    private static Map<?, ?> requireObject(FilterArgument argument, Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new ValidationException(argument.name(), String.format(
                    "Argument '%s' expects an object with keys %s.", argument.name(), argument.acceptedKeys()));
        }
        return map;
    }

    private static List<Object> parseBetween(String argument, ScalarType type, Object value) {
        if (value instanceof String text) {
            int separator = text.indexOf(BETWEEN_SEPARATOR);
            if (separator > 0 && separator + BETWEEN_SEPARATOR.length() < text.length()) {
                try {
                    Object lower = type.parse(text.substring(0, separator));
                    Object upper = type.parse(text.substring(separator + BETWEEN_SEPARATOR.length()));
                    return List.of(lower, upper);
                } catch (IllegalArgumentException e) {
                    throw new ValidationException(argument, "Invalid bounds for '" + argument + "': " + e.getMessage(), e);
                }
            }
        }
        throw new ValidationException(argument, "Argument '" + argument + "' expects bounds formatted as 'min..max'.");
    }

    private static Object coerce(String argument, ScalarType type, Object value) {
        if (value == null) {
            throw new ValidationException(argument, "Argument '" + argument + "' does not accept null values.");
        }
        try {
            return type.coerce(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(argument, "Invalid value for '" + argument + "': " + e.getMessage(), e);
        }
    }

    private static Map<String, Op> orderedKeys(Object... keysAndOperators) {
        Map<String, Op> keys = new LinkedHashMap<>();
        for (int i = 0; i < keysAndOperators.length; i += 2) {
            keys.put((String) keysAndOperators[i], (Op) keysAndOperators[i + 1]);
        }
        return Collections.unmodifiableMap(keys);
    }
}
