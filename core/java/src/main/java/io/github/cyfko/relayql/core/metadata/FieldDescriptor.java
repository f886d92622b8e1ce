package io.github.cyfko.relayql.core.metadata;

import io.github.cyfko.relayql.core.exception.ResourceDefinitionException;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable description of a single resource field.
 * <p>
 * A field is either a scalar ({@link #type()} set) or a relation ({@link #target()} set). To-many
 * relations may name the inverse property on the target resource ({@link #mappedBy()}), which lets
 * the resolver fetch them as a nested, paginated collection.
 * </p>
 *
 * <p>Fields are created through the static factories and refined with the {@code with*}/flag
 * methods, each returning a new instance:</p>
 * <pre>{@code
 * FieldDescriptor.identifier("id");
 * FieldDescriptor.scalar("title", ScalarType.STRING).groups("book:read", "book:write");
 * FieldDescriptor.relation("author", "Author").nullable(true);
 * FieldDescriptor.toMany("reviews", "Review", "book").groups("book:read");
 * }</pre>
 *
 * @param name       property name
 * @param type       scalar type, {@code null} for relations
 * @param target     target resource name, {@code null} for scalars
 * @param toMany     whether the relation holds a collection
 * @param mappedBy   inverse property on the target resource, if any
 * @param nullable   whether the value may be absent
 * @param identifier whether this field identifies the resource
 * @param readable   whether the field can appear in output
 * @param writable   whether the field is accepted in mutation input
 * @param groups     serialization groups the field belongs to
 */
public record FieldDescriptor(
        String name,
        ScalarType type,
        String target,
        boolean toMany,
        String mappedBy,
        boolean nullable,
        boolean identifier,
        boolean readable,
        boolean writable,
        Set<String> groups
) {
    public FieldDescriptor {
        if (name == null || name.isBlank()) {
            throw new ResourceDefinitionException("field name cannot be blank");
        }
        if ((type == null) == (target == null)) {
            throw new ResourceDefinitionException(
                    "field '" + name + "' must declare exactly one of a scalar type or a relation target");
        }
        if (identifier && target != null) {
            throw new ResourceDefinitionException("identifier field '" + name + "' cannot be a relation");
        }
        if (mappedBy != null && !toMany) {
            throw new ResourceDefinitionException("mappedBy is only supported on to-many relations: " + name);
        }
        groups = groups == null ? Set.of() : Set.copyOf(groups);
    }

    public static FieldDescriptor identifier(String name) {
        return identifier(name, ScalarType.ID);
    }

    public static FieldDescriptor identifier(String name, ScalarType type) {
        return new FieldDescriptor(name, type, null, false, null, false, true, true, false, Set.of());
    }

    public static FieldDescriptor scalar(String name, ScalarType type) {
        return new FieldDescriptor(name, type, null, false, null, true, false, true, true, Set.of());
    }

    public static FieldDescriptor relation(String name, String target) {
        return new FieldDescriptor(name, null, target, false, null, true, false, true, true, Set.of());
    }

    public static FieldDescriptor toMany(String name, String target) {
        return toMany(name, target, null);
    }

    public static FieldDescriptor toMany(String name, String target, String mappedBy) {
        return new FieldDescriptor(name, null, target, true, mappedBy, true, false, true, true, Set.of());
    }

    public FieldDescriptor nullable(boolean nullable) {
        return new FieldDescriptor(name, type, target, toMany, mappedBy, nullable, identifier, readable, writable, groups);
    }

    public FieldDescriptor groups(String... groups) {
        return new FieldDescriptor(name, type, target, toMany, mappedBy, nullable, identifier, readable, writable,
                new LinkedHashSet<>(Arrays.asList(groups)));
    }

    public FieldDescriptor readOnly() {
        return new FieldDescriptor(name, type, target, toMany, mappedBy, nullable, identifier, true, false, groups);
    }

    public FieldDescriptor writeOnly() {
        return new FieldDescriptor(name, type, target, toMany, mappedBy, nullable, identifier, false, true, groups);
    }

    public boolean isRelation() {
        return target != null;
    }

    /**
     * Checks whether this field belongs to at least one of the given groups.
     *
     * @param activeGroups active group set, {@code null} meaning "no group restriction"
     * @return {@code true} if the field is eligible under the given groups
     */
    public boolean inGroups(Set<String> activeGroups) {
        if (activeGroups == null) {
            return true;
        }
        for (String group : groups) {
            if (activeGroups.contains(group)) {
                return true;
            }
        }
        return false;
    }
}
