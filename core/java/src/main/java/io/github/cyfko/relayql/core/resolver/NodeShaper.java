package io.github.cyfko.relayql.core.resolver;

import io.github.cyfko.relayql.core.api.Comparison;
import io.github.cyfko.relayql.core.api.Op;
import io.github.cyfko.relayql.core.config.ItemDenialPolicy;
import io.github.cyfko.relayql.core.config.ResolverConfig;
import io.github.cyfko.relayql.core.metadata.*;
import io.github.cyfko.relayql.core.model.Connection;
import io.github.cyfko.relayql.core.model.Edge;
import io.github.cyfko.relayql.core.model.PaginationInfo;
import io.github.cyfko.relayql.core.model.Selection;
import io.github.cyfko.relayql.core.security.AccessControl;
import io.github.cyfko.relayql.core.security.AccessControlEvaluator;
import io.github.cyfko.relayql.core.security.AccessDecision;
import io.github.cyfko.relayql.core.serialization.SerializationContext;
import io.github.cyfko.relayql.core.serialization.SerializationContextResolver;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Shapes fetched items into response nodes.
 *
 * <h2>Relations</h2>
 * <ul>
 *   <li>Not expanded by the selection: rendered as the target identifier (or list of identifiers).</li>
 *   <li>Expanded to-one: an embedded map is shaped directly, an identifier is fetched first.</li>
 *   <li>Expanded to-many with an inverse property: resolved as a nested collection query on the target,
 *       constrained on the inverse property, with the filter and pagination arguments of the
 *       sub-selection.</li>
 *   <li>Expanded to-many without inverse property: each element is shaped like a to-one.</li>
 * </ul>
 * <p>
 * Expansions run as independent tasks and are joined before the parent node completes. Nested items
 * are authorized with the query rule of their resource.
 * </p>
 */
final class NodeShaper {

    private static final Logger logger = Logger.getLogger(NodeShaper.class.getName());

    private final Resolver resolver;
    private final ResourceRegistry registry;
    private final AccessControlEvaluator accessControl;
    private final SerializationContextResolver serialization;
    private final ResolverConfig config;

    NodeShaper(Resolver resolver, ResourceRegistry registry, AccessControlEvaluator accessControl,
               SerializationContextResolver serialization, ResolverConfig config) {
        this.resolver = resolver;
        this.registry = registry;
        this.accessControl = accessControl;
        this.serialization = serialization;
        this.config = config;
    }

    /**
     * Shapes one item.
     *
     * @param selection node selection, {@code null} or a leaf meaning every visible field
     */
    CompletableFuture<Map<String, Object>> shape(ResolutionContext ctx, ResourceDescriptor resource,
                                                 Map<String, Object> item, Selection selection,
                                                 SerializationContext context) {
        Map<String, Object> node = new LinkedHashMap<>();
        Map<String, CompletableFuture<?>> expansions = new LinkedHashMap<>();
        boolean restricted = selection != null && !selection.isLeaf();

        for (FieldDescriptor field : serialization.outputFields(resource, context)) {
            Selection fieldSelection = restricted ? selection.child(field.name()).orElse(null) : null;
            if (restricted && fieldSelection == null && !field.identifier()) {
                continue;
            }
            Object value = item.get(field.name());
            if (!field.isRelation()) {
                node.put(field.name(), value);
                continue;
            }

            ResourceDescriptor target = registry.require(field.target());
            if (fieldSelection == null || fieldSelection.isLeaf()) {
                node.put(field.name(), identifiers(target, field, value));
                continue;
            }
            node.put(field.name(), null);
            expansions.put(field.name(), field.toMany()
                    ? expandMany(ctx, resource, item, field, target, value, fieldSelection)
                    : expandOne(ctx, target, value, fieldSelection));
        }

        if (expansions.isEmpty()) {
            return CompletableFuture.completedFuture(node);
        }
        return CompletableFuture.allOf(expansions.values().toArray(new CompletableFuture<?>[0]))
                .thenApply(done -> {
                    expansions.forEach((name, future) -> node.put(name, future.join()));
                    return node;
                });
    }

    /**
     * Shapes items concurrently, keeping their order.
     */
    CompletableFuture<List<Map<String, Object>>> shapeAll(ResolutionContext ctx, ResourceDescriptor resource,
                                                          List<Map<String, Object>> items, Selection selection,
                                                          SerializationContext context) {
        List<CompletableFuture<Map<String, Object>>> nodes = new ArrayList<>(items.size());
        for (Map<String, Object> item : items) {
            nodes.add(shape(ctx, resource, item, selection, context));
        }
        return CompletableFuture.allOf(nodes.toArray(new CompletableFuture<?>[0]))
                .thenApply(done -> {
                    List<Map<String, Object>> shaped = new ArrayList<>(nodes.size());
                    nodes.forEach(node -> shaped.add(node.join()));
                    return shaped;
                });
    }

    // ============================================================================
    // Response envelopes
    // ============================================================================

    static Map<String, Object> connection(Connection<Map<String, Object>> connection) {
        Map<String, Object> pageInfo = new LinkedHashMap<>();
        pageInfo.put("startCursor", connection.pageInfo().startCursor());
        pageInfo.put("endCursor", connection.pageInfo().endCursor());
        pageInfo.put("hasNextPage", connection.pageInfo().hasNextPage());
        pageInfo.put("hasPreviousPage", connection.pageInfo().hasPreviousPage());

        List<Map<String, Object>> edges = new ArrayList<>(connection.edges().size());
        for (Edge<Map<String, Object>> edge : connection.edges()) {
            Map<String, Object> rendered = new LinkedHashMap<>();
            rendered.put("cursor", edge.cursor());
            rendered.put("node", edge.node());
            edges.add(rendered);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("totalCount", connection.totalCount());
        result.put("pageInfo", pageInfo);
        result.put("edges", edges);
        return result;
    }

    static Map<String, Object> page(List<Map<String, Object>> nodes, PaginationInfo info) {
        Map<String, Object> paginationInfo = new LinkedHashMap<>();
        paginationInfo.put("itemsPerPage", info.itemsPerPage());
        paginationInfo.put("lastPage", info.lastPage());
        paginationInfo.put("totalCount", info.totalCount());
        paginationInfo.put("hasNextPage", info.hasNextPage());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("collection", nodes);
        result.put("paginationInfo", paginationInfo);
        return result;
    }

    static Map<String, Object> list(List<Map<String, Object>> nodes) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("collection", nodes);
        return result;
    }

    // ============================================================================
    // Relations
    // ============================================================================

    private CompletableFuture<Map<String, Object>> expandOne(ResolutionContext ctx, ResourceDescriptor target,
                                                             Object value, Selection selection) {
        if (value == null) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Map<String, Object>> source = value instanceof Map<?, ?> embedded
                ? CompletableFuture.completedFuture(asNode(embedded))
                : ctx.supplyAsync(() -> resolver.fetchOne(ctx, target, value).orElse(null));

        return source.thenCompose(item -> {
            if (item == null || !authorizeNested(ctx, target, item)) {
                return CompletableFuture.completedFuture(null);
            }
            return shape(ctx, target, item, selection.nodeSelection(), serialization.resolve(target, OperationKind.QUERY));
        });
    }

    private CompletableFuture<Object> expandMany(ResolutionContext ctx, ResourceDescriptor owner,
                                                 Map<String, Object> ownerItem, FieldDescriptor field,
                                                 ResourceDescriptor target, Object value, Selection selection) {
        if (field.mappedBy() != null) {
            String ownerId = owner.identifier().name();
            Comparison constraint = Comparison.of(PropertyPath.of(field.mappedBy(), ownerId), Op.EQ, ownerItem.get(ownerId));
            logger.fine(() -> String.format("Resolving %s.%s as nested collection of %s", owner.name(), field.name(), target.name()));
            return resolver.nestedCollection(ctx, target, selection.arguments(), selection, constraint)
                    .thenApply(Object.class::cast);
        }

        List<CompletableFuture<Map<String, Object>>> elements = new ArrayList<>();
        if (value instanceof Collection<?> values) {
            for (Object element : values) {
                elements.add(expandOne(ctx, target, element, selection));
            }
        }
        return CompletableFuture.allOf(elements.toArray(new CompletableFuture<?>[0]))
                .thenApply(done -> {
                    List<Map<String, Object>> shaped = new ArrayList<>(elements.size());
                    for (CompletableFuture<Map<String, Object>> element : elements) {
                        Map<String, Object> node = element.join();
                        if (node != null) {
                            shaped.add(node);
                        }
                    }
                    return shaped;
                });
    }

    private boolean authorizeNested(ResolutionContext ctx, ResourceDescriptor target, Map<String, Object> item) {
        Optional<AccessControl> control = accessControl.effectiveControl(target, OperationKind.QUERY);
        if (control.isEmpty()) {
            return true;
        }
        AccessDecision decision = accessControl.decide(control.get(), ctx.principal(), item);
        if (decision.granted()) {
            return true;
        }
        if (config.getItemDenialPolicy() == ItemDenialPolicy.FAIL) {
            throw accessControl.denied(decision);
        }
        logger.fine(() -> "Omitting denied nested item of " + target.name());
        return false;
    }

    private static Object identifiers(ResourceDescriptor target, FieldDescriptor field, Object value) {
        if (value == null) {
            return field.toMany() ? List.of() : null;
        }
        if (field.toMany() && value instanceof Collection<?> values) {
            List<Object> ids = new ArrayList<>(values.size());
            for (Object element : values) {
                ids.add(identifier(target, element));
            }
            return ids;
        }
        return identifier(target, value);
    }

    private static Object identifier(ResourceDescriptor target, Object value) {
        return value instanceof Map<?, ?> embedded ? embedded.get(target.identifier().name()) : value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asNode(Map<?, ?> embedded) {
        return (Map<String, Object>) embedded;
    }
}
