package io.github.cyfko.relayql.core.serialization;

import io.github.cyfko.relayql.core.exception.ValidationException;
import io.github.cyfko.relayql.core.metadata.FieldDescriptor;
import io.github.cyfko.relayql.core.metadata.OperationKind;
import io.github.cyfko.relayql.core.metadata.OperationOverride;
import io.github.cyfko.relayql.core.metadata.ResourceDescriptor;

import java.util.*;
import java.util.logging.Logger;

/**
 * Picks the serialization groups of an operation and applies them to input and output.
 *
 * <h2>Group resolution</h2>
 * <ul>
 *   <li>Output: normalization groups of the operation override when declared, else the base
 *       normalization groups of the resource.</li>
 *   <li>Input (mutations only): denormalization groups of the override when declared, else the base
 *       denormalization groups. Resolved independently from the output groups.</li>
 * </ul>
 *
 * <h2>Visibility</h2>
 * <p>
 * A field is visible when it shares at least one group with the active set, or when no group set is
 * active. The identifier is always part of the output.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SerializationContextResolver {

    private static final Logger logger = Logger.getLogger(SerializationContextResolver.class.getName());

    /** Input keys handled by the resolver rather than mapped to fields. */
    public static final Set<String> INPUT_CONTROL_KEYS = Set.of("id", "clientMutationId");

    public SerializationContext resolve(ResourceDescriptor resource, OperationKind kind) {
        Optional<OperationOverride> override = resource.operation(kind);
        Set<String> output = override.flatMap(OperationOverride::normalizationGroups)
                .or(resource::normalizationGroups)
                .orElse(null);
        Set<String> input = null;
        if (kind.isMutation()) {
            input = override.flatMap(OperationOverride::denormalizationGroups)
                    .or(resource::denormalizationGroups)
                    .orElse(null);
        }
        SerializationContext context = new SerializationContext(output, input);
        logger.fine(() -> String.format("Serialization context of %s.%s: %s",
                resource.name(), kind.operationName(), context));
        return context;
    }

    /**
     * @return whether a field appears in the output under the given context
     */
    public boolean isOutputVisible(FieldDescriptor field, SerializationContext context) {
        return field.identifier() || (field.readable() && field.inGroups(context.outputGroups()));
    }

    /**
     * @return the fields of a resource visible in the output, in declaration order
     */
    public List<FieldDescriptor> outputFields(ResourceDescriptor resource, SerializationContext context) {
        List<FieldDescriptor> visible = new ArrayList<>();
        for (FieldDescriptor field : resource.fields()) {
            if (isOutputVisible(field, context)) {
                visible.add(field);
            }
        }
        return visible;
    }

    /**
     * Keeps the submitted fields accepted by the input groups.
     * <p>
     * Fields outside the input group set, or not writable, are dropped silently; scalar values are
     * coerced to the field type. Control keys ({@code id}, {@code clientMutationId}) are skipped.
     * </p>
     *
     * @param resource mutated resource
     * @param context  serialization context of the mutation
     * @param input    submitted input
     * @return accepted fields with coerced values, in submission order
     * @throws ValidationException if a key names no field, or a value does not match the field type
     */
    public Map<String, Object> filterInput(ResourceDescriptor resource, SerializationContext context,
                                           Map<String, Object> input) {
        Map<String, Object> accepted = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : input.entrySet()) {
            String key = entry.getKey();
            if (INPUT_CONTROL_KEYS.contains(key) && !isWritableField(resource, key)) {
                continue;
            }
            String argument = "input." + key;
            FieldDescriptor field = resource.field(key)
                    .orElseThrow(() -> new ValidationException(argument, "Unknown field '" + key + "' in input."));
            if (!field.writable() || !field.inGroups(context.inputGroups())) {
                logger.fine(() -> String.format("Ignoring input field %s.%s outside the input groups", resource.name(), key));
                continue;
            }
            accepted.put(key, coerce(argument, field, entry.getValue()));
        }
        return accepted;
    }

    private static boolean isWritableField(ResourceDescriptor resource, String key) {
        return resource.field(key).map(FieldDescriptor::writable).orElse(false);
    }

    private static Object coerce(String argument, FieldDescriptor field, Object value) {
        if (value == null) {
            if (!field.nullable()) {
                throw new ValidationException(argument, "Field '" + field.name() + "' cannot be null.");
            }
            return null;
        }
        if (field.isRelation()) {
            return value;
        }
        try {
            return field.type().coerce(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(argument, "Invalid value for '" + argument + "': " + e.getMessage(), e);
        }
    }
}
