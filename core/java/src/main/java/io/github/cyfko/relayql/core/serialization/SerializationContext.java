package io.github.cyfko.relayql.core.serialization;

import java.util.Set;

/**
 * Field-visibility groups active for one operation.
 * <p>
 * A {@code null} group set means "no restriction": every readable (resp. writable) field is eligible.
 * </p>
 *
 * @param outputGroups normalization groups applied to the response
 * @param inputGroups  denormalization groups applied to mutation input, {@code null} for queries
 */
public record SerializationContext(Set<String> outputGroups, Set<String> inputGroups) {

    public SerializationContext {
        outputGroups = outputGroups == null ? null : Set.copyOf(outputGroups);
        inputGroups = inputGroups == null ? null : Set.copyOf(inputGroups);
    }

    public static SerializationContext unrestricted() {
        return new SerializationContext(null, null);
    }
}
