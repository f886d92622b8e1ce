package io.github.cyfko.relayql.jpa.utils;

import io.github.cyfko.relayql.core.metadata.FieldDescriptor;
import io.github.cyfko.relayql.core.metadata.ResolvedPath;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;

import java.util.List;

/**
 * Resolves property paths of a resource against a JPA criteria root.
 * <p>
 * Every relation crossed by a path is joined (left join) exactly once per {@link From}, so that
 * several criteria or sort keys sharing a relation reuse the same join.
 * </p>
 *
 * <pre>{@code
 * ResolvedPath resolved = registry.resolvePath(offer, PropertyPath.parse("product.releaseDate")).orElseThrow();
 * Path<?> releaseDate = PathResolverUtils.resolvePath(root, resolved);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PathResolverUtils {

    private PathResolverUtils() {
        throw new UnsupportedOperationException("PathResolverUtils is a utility class and cannot be instantiated");
    }

    /**
     * Joins every intermediate segment of a path and returns the leaf attribute.
     *
     * @param root     query root
     * @param resolved path resolved through the resource registry
     * @return the leaf attribute path
     */
    public static Path<?> resolvePath(From<?, ?> root, ResolvedPath resolved) {
        return owner(root, resolved).get(resolved.leaf().name());
    }

    /**
     * Joins every intermediate segment of a path and returns the {@link From} owning the leaf.
     *
     * @param root     query root
     * @param resolved path resolved through the resource registry
     * @return the join (or root) the leaf attribute belongs to
     */
    public static From<?, ?> owner(From<?, ?> root, ResolvedPath resolved) {
        List<FieldDescriptor> fields = resolved.fields();
        From<?, ?> from = root;
        for (int i = 0; i < fields.size() - 1; i++) {
            from = joinOnce(from, fields.get(i).name());
        }
        return from;
    }

    private static From<?, ?> joinOnce(From<?, ?> from, String attribute) {
        return from.getJoins().stream()
                .filter(j -> j.getAttribute().getName().equals(attribute))
                .findFirst()
                .map(j -> (From<?, ?>) j)
                .orElseGet(() -> from.join(attribute, JoinType.LEFT));
    }
}
