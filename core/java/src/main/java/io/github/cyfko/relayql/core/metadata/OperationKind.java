package io.github.cyfko.relayql.core.metadata;

import java.util.Locale;
import java.util.Optional;

/**
 * Operations a resource may expose.
 */
public enum OperationKind {
    QUERY,
    CREATE,
    UPDATE,
    DELETE;

    /**
     * @return the operation name as used by callers ({@code query}, {@code create}, ...)
     */
    public String operationName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isMutation() {
        return this != QUERY;
    }

    /**
     * Looks up an operation by its caller-facing name.
     *
     * @param name operation name, case-insensitive
     * @return the matching kind, empty if the name is unknown
     */
    public static Optional<OperationKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (OperationKind kind : values()) {
            if (kind.operationName().equalsIgnoreCase(name.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
