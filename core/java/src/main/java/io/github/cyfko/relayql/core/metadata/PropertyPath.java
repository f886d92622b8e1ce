package io.github.cyfko.relayql.core.metadata;

import io.github.cyfko.relayql.core.exception.ResourceDefinitionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Dotted property path, possibly crossing relation boundaries (e.g. {@code product.color}).
 * <p>
 * The argument name exposed to callers joins the segments with {@code _}
 * ({@code product_color}), unlike the REST-style convention which keeps the dot. The mapping from
 * a path to its argument name is fixed and one-way; reverse lookups always go through the declared
 * paths, never through splitting an argument name.
 * </p>
 *
 * @param segments non-empty list of property names
 */
public record PropertyPath(List<String> segments) {

    /** Separator used in argument names. */
    public static final String ARGUMENT_SEPARATOR = "_";

    public PropertyPath {
        if (segments == null || segments.isEmpty()) {
            throw new ResourceDefinitionException("property path cannot be empty");
        }
        for (String segment : segments) {
            if (segment == null || segment.isBlank()) {
                throw new ResourceDefinitionException("property path contains a blank segment: " + segments);
            }
        }
        segments = List.copyOf(segments);
    }

    /**
     * Parses a dotted path.
     *
     * @param dotted path such as {@code product.color}
     * @return the parsed path
     * @throws ResourceDefinitionException if the path is blank or contains an empty segment
     */
    public static PropertyPath parse(String dotted) {
        if (dotted == null || dotted.isBlank()) {
            throw new ResourceDefinitionException("property path cannot be blank");
        }
        return new PropertyPath(List.of(dotted.trim().split("\\.", -1)));
    }

    public static PropertyPath of(String... segments) {
        return new PropertyPath(List.of(segments));
    }

    /**
     * @return the argument name, segments joined with {@value #ARGUMENT_SEPARATOR}
     */
    public String argumentName() {
        return String.join(ARGUMENT_SEPARATOR, segments);
    }

    public String head() {
        return segments.get(0);
    }

    public String leaf() {
        return segments.get(segments.size() - 1);
    }

    public int depth() {
        return segments.size();
    }

    public boolean isNested() {
        return segments.size() > 1;
    }

    /**
     * @param segment property to append
     * @return a new path one level deeper
     */
    public PropertyPath child(String segment) {
        List<String> extended = new ArrayList<>(segments);
        extended.add(segment);
        return new PropertyPath(extended);
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
