package io.github.cyfko.relayql.core.metadata;

import io.github.cyfko.relayql.core.security.AccessControl;
import io.github.cyfko.relayql.core.security.AccessRule;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-operation override bundle of a resource.
 * <p>
 * Every member is either declared or absent. An absent member falls back to the resource base value;
 * a declared member replaces it entirely (filters and groups are not merged with the base).
 * The presence of an override for an operation kind is what exposes that operation.
 * </p>
 *
 * <pre>{@code
 * OperationOverride.builder()
 *     .accessControl(AccessRules.hasRole("ROLE_ADMIN"), "Only admins can update books.")
 *     .denormalizationGroups("book:write")
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperationOverride {

    private static final OperationOverride NONE = builder().build();

    private final Map<String, FilterDescriptor> filters;
    private final AccessControl accessControl;
    private final AccessControl postDenormalizeAccessControl;
    private final Set<String> normalizationGroups;
    private final Set<String> denormalizationGroups;

    private OperationOverride(Builder builder) {
        this.filters = builder.filters == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.filters));
        this.accessControl = builder.accessControl;
        this.postDenormalizeAccessControl = builder.postDenormalizeAccessControl;
        this.normalizationGroups = builder.normalizationGroups == null ? null : Set.copyOf(builder.normalizationGroups);
        this.denormalizationGroups = builder.denormalizationGroups == null ? null : Set.copyOf(builder.denormalizationGroups);
    }

    /**
     * @return an override declaring nothing: every member falls back to the resource base
     */
    public static OperationOverride none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Map<String, FilterDescriptor>> filters() {
        return Optional.ofNullable(filters);
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

    @Override
    public String toString() {
        return String.format("OperationOverride{filters=%s, accessControl=%s, normalizationGroups=%s, denormalizationGroups=%s}",
                filters == null ? null : filters.keySet(), accessControl != null, normalizationGroups, denormalizationGroups);
    }

    public static final class Builder {
        private Map<String, FilterDescriptor> filters;
        private AccessControl accessControl;
        private AccessControl postDenormalizeAccessControl;
        private Set<String> normalizationGroups;
        private Set<String> denormalizationGroups;

        private Builder() {}

        /**
         * Declares the filter set of this operation. Declaring an empty set disables every base filter.
         */
        public Builder filters(Collection<FilterDescriptor> filters) {
            this.filters = new LinkedHashMap<>();
            for (FilterDescriptor filter : filters) {
                this.filters.put(filter.name(), filter);
            }
            return this;
        }

        public Builder filters(FilterDescriptor... filters) {
            return filters(Arrays.asList(filters));
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

        public OperationOverride build() {
            return new OperationOverride(this);
        }
    }
}
