package io.github.cyfko.relayql.core.model;

import io.github.cyfko.relayql.core.metadata.OperationKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Incoming operation, already parsed by the transport layer.
 *
 * <pre>{@code
 * OperationRequest request = OperationRequest.collectionQuery("Offer",
 *     Map.of("product_color_list", List.of("red", "green"), "first", 10),
 *     selection);
 * }</pre>
 *
 * @param resource   target resource name
 * @param operation  operation name ({@code query}, {@code create}, {@code update}, {@code delete})
 * @param collection whether a query targets the collection rather than a single item
 * @param arguments  raw argument values
 * @param selection  requested fields, {@code null} meaning every visible field
 */
public record OperationRequest(String resource, String operation, boolean collection,
                               Map<String, Object> arguments, Selection selection) {

    public OperationRequest {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(operation, "operation");
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static OperationRequest collectionQuery(String resource, Map<String, Object> arguments, Selection selection) {
        return new OperationRequest(resource, OperationKind.QUERY.operationName(), true, arguments, selection);
    }

    public static OperationRequest itemQuery(String resource, Object id, Selection selection) {
        return new OperationRequest(resource, OperationKind.QUERY.operationName(), false, idArgument(id), selection);
    }

    public static OperationRequest mutation(String resource, OperationKind kind, Map<String, Object> arguments,
                                            Selection selection) {
        return new OperationRequest(resource, kind.operationName(), false, arguments, selection);
    }

    private static Map<String, Object> idArgument(Object id) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("id", id);
        return arguments;
    }
}
