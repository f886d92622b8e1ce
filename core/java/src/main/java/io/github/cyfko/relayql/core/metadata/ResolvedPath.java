package io.github.cyfko.relayql.core.metadata;

import java.util.List;

/**
 * Property path resolved through the relation graph.
 *
 * @param path   the resolved path
 * @param fields field descriptor of each segment, in order
 */
public record ResolvedPath(PropertyPath path, List<FieldDescriptor> fields) {

    public ResolvedPath {
        fields = List.copyOf(fields);
    }

    public FieldDescriptor leaf() {
        return fields.get(fields.size() - 1);
    }

    public boolean crossesToMany() {
        return fields.stream().anyMatch(FieldDescriptor::toMany);
    }
}
