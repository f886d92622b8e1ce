package io.github.cyfko.relayql.core.metadata;

import io.github.cyfko.relayql.core.api.SortBy;
import io.github.cyfko.relayql.core.exception.ResourceDefinitionException;
import io.github.cyfko.relayql.core.utils.ValidationResult;

import java.util.*;
import java.util.logging.Logger;

/**
 * Immutable registry of the resources exposed through the query endpoint.
 * <p>
 * The registry is built once at startup. Building it validates the relation graph and every declared
 * filter and ordering so that inconsistent metadata fails fast with a
 * {@link ResourceDefinitionException} instead of surfacing on the first request.
 * </p>
 *
 * <h2>Build-time checks</h2>
 * <ul>
 *   <li>resource names are unique</li>
 *   <li>relation targets exist, and {@code mappedBy} names a relation of the target pointing back</li>
 *   <li>filter and default-order paths resolve through the relation graph</li>
 *   <li>filter leaves are compatible with the filter kind</li>
 *   <li>argument names derived from the active filter set of each exposed operation do not collide</li>
 * </ul>
 *
 * <pre>{@code
 * ResourceRegistry registry = ResourceRegistry.of(offer, product);
 * ResourceDescriptor descriptor = registry.require("Offer");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResourceRegistry {

    private static final Logger logger = Logger.getLogger(ResourceRegistry.class.getName());

    /**
     * Argument names owned by the resolver itself.
     */
    public static final Set<String> RESERVED_ARGUMENTS = Set.of(
            "id", "input", "clientMutationId", "first", "after", "last", "before", "page", "itemsPerPage");

    private final Map<String, ResourceDescriptor> resources;

    private ResourceRegistry(Map<String, ResourceDescriptor> resources) {
        this.resources = Collections.unmodifiableMap(resources);
    }

    public static ResourceRegistry of(ResourceDescriptor... descriptors) {
        return of(Arrays.asList(descriptors));
    }

    /**
     * Builds and validates a registry.
     *
     * @param descriptors resource descriptors
     * @return the validated registry
     * @throws ResourceDefinitionException if the metadata is inconsistent
     */
    public static ResourceRegistry of(Collection<ResourceDescriptor> descriptors) {
        Map<String, ResourceDescriptor> byName = new LinkedHashMap<>();
        for (ResourceDescriptor descriptor : descriptors) {
            if (byName.putIfAbsent(descriptor.name(), descriptor) != null) {
                throw new ResourceDefinitionException("duplicate resource '" + descriptor.name() + "'");
            }
        }
        ResourceRegistry registry = new ResourceRegistry(byName);
        for (ResourceDescriptor descriptor : byName.values()) {
            registry.validate(descriptor);
        }
        logger.fine(() -> "Resource registry built with resources " + byName.keySet());
        return registry;
    }

    public Optional<ResourceDescriptor> get(String name) {
        return Optional.ofNullable(resources.get(name));
    }

    /**
     * @throws ResourceDefinitionException if the resource is unknown
     */
    public ResourceDescriptor require(String name) {
        ResourceDescriptor descriptor = resources.get(name);
        if (descriptor == null) {
            throw new ResourceDefinitionException("unknown resource '" + name + "'");
        }
        return descriptor;
    }

    public Collection<ResourceDescriptor> resources() {
        return resources.values();
    }

    /**
     * Resolves a path through the relation graph starting at the given resource.
     *
     * @param resource starting resource
     * @param path     dotted path
     * @return the field of every segment, or empty if a segment does not resolve or a scalar is crossed
     */
    public Optional<ResolvedPath> resolvePath(ResourceDescriptor resource, PropertyPath path) {
        List<FieldDescriptor> fields = new ArrayList<>(path.depth());
        ResourceDescriptor current = resource;
        List<String> segments = path.segments();
        for (int i = 0; i < segments.size(); i++) {
            if (current == null) {
                return Optional.empty();
            }
            Optional<FieldDescriptor> field = current.field(segments.get(i));
            if (field.isEmpty()) {
                return Optional.empty();
            }
            fields.add(field.get());
            boolean last = i == segments.size() - 1;
            if (!last) {
                if (!field.get().isRelation()) {
                    return Optional.empty();
                }
                current = resources.get(field.get().target());
            }
        }
        return Optional.of(new ResolvedPath(path, fields));
    }

    // ============================================================================
    // Validation
    // ============================================================================

    private void validate(ResourceDescriptor descriptor) {
        for (FieldDescriptor field : descriptor.fields()) {
            if (field.isRelation()) {
                checkRelation(descriptor, field).orThrow(ResourceDefinitionException::new);
            }
        }

        for (FilterDescriptor filter : descriptor.filters().values()) {
            checkFilter(descriptor, filter).orThrow(ResourceDefinitionException::new);
        }
        for (OperationKind kind : descriptor.operations()) {
            descriptor.operation(kind).flatMap(OperationOverride::filters).ifPresent(filters ->
                    filters.values().forEach(filter ->
                            checkFilter(descriptor, filter).orThrow(ResourceDefinitionException::new)));
            checkArgumentNames(descriptor, kind).orThrow(ResourceDefinitionException::new);
        }

        for (SortBy sortBy : descriptor.defaultOrder()) {
            Optional<ResolvedPath> resolved = resolvePath(descriptor, sortBy.path());
            if (resolved.isEmpty() || resolved.get().leaf().isRelation() || resolved.get().crossesToMany()) {
                throw new ResourceDefinitionException(String.format(
                        "default order path '%s' of resource '%s' must resolve to a to-one scalar",
                        sortBy.path(), descriptor.name()));
            }
        }
    }

    private ValidationResult checkRelation(ResourceDescriptor owner, FieldDescriptor field) {
        ResourceDescriptor target = resources.get(field.target());
        if (target == null) {
            return ValidationResult.failure("relation '%s.%s' targets unknown resource '%s'",
                    owner.name(), field.name(), field.target());
        }
        if (field.mappedBy() == null) {
            return ValidationResult.success();
        }
        Optional<FieldDescriptor> inverse = target.field(field.mappedBy());
        if (inverse.isEmpty() || !inverse.get().isRelation() || inverse.get().toMany()
                || !owner.name().equals(inverse.get().target())) {
            return ValidationResult.failure("relation '%s.%s' is mapped by '%s.%s' which is not a to-one relation back to '%s'",
                    owner.name(), field.name(), target.name(), field.mappedBy(), owner.name());
        }
        return ValidationResult.success();
    }

    private ValidationResult checkFilter(ResourceDescriptor descriptor, FilterDescriptor filter) {
        for (Map.Entry<PropertyPath, MatchStrategy> entry : filter.properties().entrySet()) {
            PropertyPath path = entry.getKey();
            Optional<ResolvedPath> resolved = resolvePath(descriptor, path);
            if (resolved.isEmpty()) {
                return ValidationResult.failure("filter '%s' of resource '%s': path '%s' does not resolve",
                        filter.name(), descriptor.name(), path);
            }
            FieldDescriptor leaf = resolved.get().leaf();
            ValidationResult leafCheck = checkLeaf(filter.kind(), entry.getValue(), leaf);
            if (!leafCheck.valid()) {
                return ValidationResult.failure("filter '%s' of resource '%s': path '%s' %s",
                        filter.name(), descriptor.name(), path, leafCheck.errorMessage());
            }
            if (filter.kind() == FilterKind.ORDER && resolved.get().crossesToMany()) {
                return ValidationResult.failure("filter '%s' of resource '%s': cannot order across to-many path '%s'",
                        filter.name(), descriptor.name(), path);
            }
        }
        return ValidationResult.success();
    }

    private static ValidationResult checkLeaf(FilterKind kind, MatchStrategy strategy, FieldDescriptor leaf) {
        if (kind == FilterKind.EXISTS) {
            return ValidationResult.success();
        }
        if (leaf.isRelation()) {
            return ValidationResult.failure("ends on relation '%s'", leaf.name());
        }
        ScalarType type = leaf.type();
        return switch (kind) {
            case NUMERIC -> type.isNumeric() || type == ScalarType.ID
                    ? ValidationResult.success() : ValidationResult.failure("is not numeric (%s)", type);
            case RANGE -> type.isComparable()
                    ? ValidationResult.success() : ValidationResult.failure("is not comparable (%s)", type);
            case DATE -> type.isTemporal()
                    ? ValidationResult.success() : ValidationResult.failure("is not a date (%s)", type);
            case BOOLEAN -> type == ScalarType.BOOLEAN
                    ? ValidationResult.success() : ValidationResult.failure("is not a boolean (%s)", type);
            case SEARCH -> strategy.isExact() || type == ScalarType.STRING
                    ? ValidationResult.success()
                    : ValidationResult.failure("uses strategy %s on a non-string field (%s)", strategy, type);
            case ORDER, EXISTS -> ValidationResult.success();
        };
    }

    private static ValidationResult checkArgumentNames(ResourceDescriptor descriptor, OperationKind kind) {
        Map<String, FilterDescriptor> active = descriptor.operation(kind)
                .flatMap(OperationOverride::filters)
                .orElse(descriptor.filters());
        Map<String, String> owners = new HashMap<>();
        for (FilterDescriptor filter : active.values()) {
            if (filter.kind().isShared()) {
                continue;
            }
            for (PropertyPath path : filter.properties().keySet()) {
                List<String> names = new ArrayList<>();
                names.add(path.argumentName());
                if (filter.kind().supportsMultipleValues()) {
                    names.add(path.argumentName() + "_list");
                }
                for (String name : names) {
                    if (RESERVED_ARGUMENTS.contains(name) || "order".equals(name) || "exists".equals(name)) {
                        return ValidationResult.failure("filter '%s' of resource '%s' derives reserved argument name '%s'",
                                filter.name(), descriptor.name(), name);
                    }
                    String previous = owners.putIfAbsent(name, filter.name());
                    if (previous != null) {
                        return ValidationResult.failure(
                                "filters '%s' and '%s' of resource '%s' both derive argument '%s' for operation %s",
                                previous, filter.name(), descriptor.name(), name, kind.operationName());
                    }
                }
            }
        }
        return ValidationResult.success();
    }
}
