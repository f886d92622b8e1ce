package io.github.cyfko.relayql.core.metadata;

import io.github.cyfko.relayql.core.api.Direction;
import io.github.cyfko.relayql.core.api.SortBy;
import io.github.cyfko.relayql.core.exception.ResourceDefinitionException;
import io.github.cyfko.relayql.core.security.AccessControl;
import io.github.cyfko.relayql.core.security.AccessRule;

import java.util.*;

/**
 * Immutable description of a resource exposed through the query endpoint.
 * <p>
 * Descriptors are supplied by the metadata collaborator, built once at startup and never mutated.
 * The resolver is generic over them and never special-cases a resource by name.
 * </p>
 *
 * <h2>Base values and overrides</h2>
 * <p>
 * Filters, access control and serialization groups are declared at resource level (the base) and
 * may be replaced per operation through an {@link OperationOverride}. Only operations with an
 * override entry are exposed; {@link Builder#defaultOperations()} exposes all of them with empty
 * overrides.
 * </p>
 *
 * <pre>{@code
 * ResourceDescriptor offer = ResourceDescriptor.builder("Offer")
 *     .field(FieldDescriptor.identifier("id"))
 *     .field(FieldDescriptor.scalar("price", ScalarType.FLOAT))
 *     .field(FieldDescriptor.relation("product", "Product"))
 *     .filter(FilterDescriptor.search("offer.search", Map.of("product.color", MatchStrategy.EXACT)))
 *     .filter(FilterDescriptor.order("offer.order", "product.releaseDate"))
 *     .defaultOrder("product.releaseDate", Direction.ASC)
 *     .operation(OperationKind.QUERY)
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResourceDescriptor {

    private final String name;
    private final Map<String, FieldDescriptor> fields;
    private final FieldDescriptor identifier;
    private final Map<String, FilterDescriptor> filters;
    private final List<SortBy> defaultOrder;
    private final AccessControl accessControl;
    private final AccessControl postDenormalizeAccessControl;
    private final Set<String> normalizationGroups;
    private final Set<String> denormalizationGroups;
    private final PaginationOptions pagination;
    private final Map<OperationKind, OperationOverride> operations;

    private ResourceDescriptor(Builder builder) {
        this.name = builder.name;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.identifier = builder.fields.values().stream()
                .filter(FieldDescriptor::identifier)
                .findFirst()
                .orElseThrow(() -> new ResourceDefinitionException("resource '" + builder.name + "' declares no identifier field"));
        this.filters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.filters));
        this.defaultOrder = List.copyOf(builder.defaultOrder);
        this.accessControl = builder.accessControl;
        this.postDenormalizeAccessControl = builder.postDenormalizeAccessControl;
        this.normalizationGroups = builder.normalizationGroups == null ? null : Set.copyOf(builder.normalizationGroups);
        this.denormalizationGroups = builder.denormalizationGroups == null ? null : Set.copyOf(builder.denormalizationGroups);
        this.pagination = builder.pagination;
        this.operations = Collections.unmodifiableMap(new EnumMap<>(builder.operations));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /**
     * @return the lower-camel resource name, used as payload key of mutation results
     */
    public String resourceKey() {
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    public Collection<FieldDescriptor> fields() {
        return fields.values();
    }

    public Optional<FieldDescriptor> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public FieldDescriptor identifier() {
        return identifier;
    }

    public Map<String, FilterDescriptor> filters() {
        return filters;
    }

    public List<SortBy> defaultOrder() {
        return defaultOrder;
    }

    public Optional<AccessControl> accessControl() {
        return Optional.ofNullable(accessControl);
    }

    public Optional<AccessControl> postDenormalizeAccessControl() {
        return Optional.ofNullable(postDenormalizeAccessControl);
    }

    public Optional<Set<String>> normalizationGroups() {
        return Optional.ofNullable(normalizationGroups);
    }

    public Optional<Set<String>> denormalizationGroups() {
        return Optional.ofNullable(denormalizationGroups);
    }

    public PaginationOptions pagination() {
        return pagination;
    }

    public Set<OperationKind> operations() {
        return operations.keySet();
    }

    /**
     * @param kind operation kind
     * @return the override of that operation, empty if the operation is not exposed
     */
    public Optional<OperationOverride> operation(OperationKind kind) {
        return Optional.ofNullable(operations.get(kind));
    }

    public boolean exposes(OperationKind kind) {
        return operations.containsKey(kind);
    }

    @Override
    public String toString() {
        return String.format("ResourceDescriptor{name=%s, fields=%s, filters=%s, operations=%s}",
                name, fields.keySet(), filters.keySet(), operations.keySet());
    }

    public static final class Builder {
        private final String name;
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        private final Map<String, FilterDescriptor> filters = new LinkedHashMap<>();
        private final List<SortBy> defaultOrder = new ArrayList<>();
        private final Map<OperationKind, OperationOverride> operations = new EnumMap<>(OperationKind.class);
        private AccessControl accessControl;
        private AccessControl postDenormalizeAccessControl;
        private Set<String> normalizationGroups;
        private Set<String> denormalizationGroups;
        private PaginationOptions pagination = PaginationOptions.cursor();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new ResourceDefinitionException("resource name cannot be blank");
            }
            this.name = name;
        }

        public Builder field(FieldDescriptor field) {
            if (fields.putIfAbsent(field.name(), field) != null) {
                throw new ResourceDefinitionException("duplicate field '" + field.name() + "' in resource '" + name + "'");
            }
            return this;
        }

        public Builder filter(FilterDescriptor filter) {
            if (filters.putIfAbsent(filter.name(), filter) != null) {
                throw new ResourceDefinitionException("duplicate filter '" + filter.name() + "' in resource '" + name + "'");
            }
            return this;
        }

        public Builder defaultOrder(String path, Direction direction) {
            this.defaultOrder.add(new SortBy(PropertyPath.parse(path), direction));
            return this;
        }

        public Builder accessControl(AccessRule rule, String message) {
            this.accessControl = AccessControl.of(rule, message);
            return this;
        }

        public Builder accessControl(AccessRule rule) {
            return accessControl(rule, null);
        }

        public Builder postDenormalizeAccessControl(AccessRule rule, String message) {
            this.postDenormalizeAccessControl = AccessControl.of(rule, message);
            return this;
        }

        public Builder normalizationGroups(String... groups) {
            this.normalizationGroups = new LinkedHashSet<>(Arrays.asList(groups));
            return this;
        }

        public Builder denormalizationGroups(String... groups) {
            this.denormalizationGroups = new LinkedHashSet<>(Arrays.asList(groups));
            return this;
        }

        public Builder pagination(PaginationOptions pagination) {
            this.pagination = Objects.requireNonNull(pagination, "pagination");
            return this;
        }

        public Builder operation(OperationKind kind, OperationOverride override) {
            this.operations.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(override, "override"));
            return this;
        }

        /**
         * Exposes an operation without overriding anything.
         */
        public Builder operation(OperationKind kind) {
            return operation(kind, OperationOverride.none());
        }

        /**
         * Exposes every operation kind not declared explicitly, each falling back to the base values.
         */
        public Builder defaultOperations() {
            for (OperationKind kind : OperationKind.values()) {
                operations.putIfAbsent(kind, OperationOverride.none());
            }
            return this;
        }

        public ResourceDescriptor build() {
            long identifiers = fields.values().stream().filter(FieldDescriptor::identifier).count();
            if (identifiers != 1) {
                throw new ResourceDefinitionException(
                        "resource '" + name + "' must declare exactly one identifier field, found " + identifiers);
            }
            return new ResourceDescriptor(this);
        }
    }
}
