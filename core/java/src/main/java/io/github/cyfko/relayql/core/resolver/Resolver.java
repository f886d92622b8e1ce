package io.github.cyfko.relayql.core.resolver;

import io.github.cyfko.relayql.core.api.Criterion;
import io.github.cyfko.relayql.core.api.FilterSpec;
import io.github.cyfko.relayql.core.api.SortBy;
import io.github.cyfko.relayql.core.config.ItemDenialPolicy;
import io.github.cyfko.relayql.core.config.ResolverConfig;
import io.github.cyfko.relayql.core.exception.AccessDeniedException;
import io.github.cyfko.relayql.core.exception.PersistenceException;
import io.github.cyfko.relayql.core.exception.ResolutionException;
import io.github.cyfko.relayql.core.exception.ValidationException;
import io.github.cyfko.relayql.core.filter.FilterArgumentTranslator;
import io.github.cyfko.relayql.core.filter.TranslatedArguments;
import io.github.cyfko.relayql.core.metadata.*;
import io.github.cyfko.relayql.core.model.*;
import io.github.cyfko.relayql.core.pagination.FetchPlan;
import io.github.cyfko.relayql.core.pagination.PaginationEngine;
import io.github.cyfko.relayql.core.security.AccessControlEvaluator;
import io.github.cyfko.relayql.core.security.AccessDecision;
import io.github.cyfko.relayql.core.security.Principal;
import io.github.cyfko.relayql.core.serialization.SerializationContext;
import io.github.cyfko.relayql.core.serialization.SerializationContextResolver;
import io.github.cyfko.relayql.core.spi.PersistenceProvider;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Resolves incoming operations against the resource registry and the persistence collaborator.
 *
 * <h2>State machine</h2>
 * <p>
 * Each operation walks {@code PARSE → AUTHORIZE_COLLECTION → TRANSLATE_ARGS → PAGINATE → FETCH →
 * AUTHORIZE_ITEM → RESOLVE_SERIALIZATION_CONTEXT → SHAPE_RESPONSE} and stops at the first failure,
 * issuing no further collaborator call. The failing stage is recorded on the raised
 * {@link ResolutionException}. Mutations translate their input in {@code TRANSLATE_ARGS} and
 * authorize the target before the mutate call, which is recorded under {@code FETCH}. Every denial
 * of an operation addressed by identifier is recorded under {@code AUTHORIZE_ITEM}, so a missing
 * item and a denied one fail identically.
 * </p>
 *
 * <h2>Supported operations</h2>
 * <ul>
 *   <li>collection query: cursor connection, page-based collection or plain list, per the resource
 *       pagination options</li>
 *   <li>item query: {@code id} argument</li>
 *   <li>create, update, delete: {@code input} argument; the payload is
 *       {@code {<resourceKey>: node, clientMutationId}}</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * <p>
 * Operations share only the immutable registry. Nested relations are resolved as independent tasks on
 * the configured executor. Cancelling the future returned by {@link #resolveAsync} cancels pending
 * nested tasks, and no persistence call is issued afterwards.
 * </p>
 *
 * <pre>{@code
 * Resolver resolver = new Resolver(registry, persistenceProvider, ResolverConfig.defaults());
 * Map<String, Object> offers = resolver.resolve(
 *     OperationRequest.collectionQuery("Offer", Map.of("first", 10), null),
 *     Principal.of("alice", "ROLE_USER"));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class Resolver {

    private static final Logger logger = Logger.getLogger(Resolver.class.getName());

    public static final String ID = "id";
    public static final String INPUT = "input";
    public static final String CLIENT_MUTATION_ID = "clientMutationId";

    private static final Set<String> CURSOR_ARGUMENTS = Set.of(
            PaginationEngine.FIRST, PaginationEngine.AFTER, PaginationEngine.LAST, PaginationEngine.BEFORE);
    private static final Set<String> PAGE_ARGUMENTS = Set.of(PaginationEngine.PAGE, PaginationEngine.ITEMS_PER_PAGE);

    private final ResourceRegistry registry;
    private final PersistenceProvider persistence;
    private final ResolverConfig config;
    private final FilterArgumentTranslator translator;
    private final PaginationEngine pagination;
    private final AccessControlEvaluator accessControl;
    private final SerializationContextResolver serialization;
    private final NodeShaper shaper;

    public Resolver(ResourceRegistry registry, PersistenceProvider persistence) {
        this(registry, persistence, ResolverConfig.defaults());
    }

    public Resolver(ResourceRegistry registry, PersistenceProvider persistence, ResolverConfig config) {
        this(registry, persistence, config, new FilterArgumentTranslator(registry), new PaginationEngine(config),
                new AccessControlEvaluator(config), new SerializationContextResolver());
    }

    public Resolver(ResourceRegistry registry,
                    PersistenceProvider persistence,
                    ResolverConfig config,
                    FilterArgumentTranslator translator,
                    PaginationEngine pagination,
                    AccessControlEvaluator accessControl,
                    SerializationContextResolver serialization) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.config = Objects.requireNonNull(config, "config");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.pagination = Objects.requireNonNull(pagination, "pagination");
        this.accessControl = Objects.requireNonNull(accessControl, "accessControl");
        this.serialization = Objects.requireNonNull(serialization, "serialization");
        this.shaper = new NodeShaper(this, registry, accessControl, serialization, config);
    }

    /**
     * Resolves an operation and waits for the result.
     *
     * @param request   parsed operation
     * @param principal caller, {@code null} for anonymous
     * @return the shaped response
     * @throws ResolutionException if the operation fails
     */
    public Map<String, Object> resolve(OperationRequest request, Principal principal) {
        try {
            return resolveAsync(request, principal).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Resolves an operation asynchronously.
     *
     * @param request   parsed operation
     * @param principal caller, {@code null} for anonymous
     * @return the future response; cancelling it aborts the resolution
     */
    public CompletableFuture<Map<String, Object>> resolveAsync(OperationRequest request, Principal principal) {
        Objects.requireNonNull(request, "request");
        ResolutionContext ctx = new ResolutionContext(principal == null ? Principal.anonymous() : principal,
                config.getExecutor());
        Run run = new Run(ctx);
        long startTime = System.nanoTime();

        CompletableFuture<Map<String, Object>> execution = ctx.track(
                CompletableFuture.supplyAsync(() -> run.execute(request), config.getExecutor())
                        .thenCompose(Function.identity()));

        CompletableFuture<Map<String, Object>> result = new CompletableFuture<>();
        execution.whenComplete((value, error) -> {
            long elapsed = (System.nanoTime() - startTime) / 1_000_000;
            if (error == null) {
                logger.info(() -> String.format("Resolved %s.%s in %d ms", request.resource(), request.operation(), elapsed));
                result.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof ResolutionException failure) {
                failure.atStage(run.stage);
                logger.fine(() -> String.format("Resolution of %s.%s failed at %s after %d ms: %s",
                        request.resource(), request.operation(), failure.getStage(), elapsed, failure.getMessage()));
            }
            result.completeExceptionally(cause);
        });
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                ctx.cancel();
                logger.fine(() -> String.format("Resolution of %s.%s cancelled", request.resource(), request.operation()));
            }
        });
        return result;
    }

    // ============================================================================
    // Collaborator calls, shared with NodeShaper
    // ============================================================================

    Optional<Map<String, Object>> fetchOne(ResolutionContext ctx, ResourceDescriptor resource, Object id) {
        return persist(ctx, resource, "fetch", () -> persistence.fetchOne(resource, id));
    }

    CompletableFuture<Map<String, Object>> nestedCollection(ResolutionContext ctx, ResourceDescriptor resource,
                                                            Map<String, Object> arguments, Selection selection,
                                                            Criterion constraint) {
        Run run = new Run(ctx);
        return ctx.supplyAsync(() -> run.collection(resource, arguments, selection, constraint))
                .thenCompose(Function.identity())
                .whenComplete(run::stamp);
    }

    private <T> T persist(ResolutionContext ctx, ResourceDescriptor resource, String action, Supplier<T> call) {
        ctx.checkNotCancelled();
        try {
            return call.get();
        } catch (RuntimeException e) {
            logger.warning(() -> String.format("Persistence %s of resource %s failed: %s", action, resource.name(), e));
            throw new PersistenceException(String.format("Failed to %s resource '%s'.", action, resource.name()), e);
        }
    }

    private long count(ResolutionContext ctx, ResourceDescriptor resource, FilterSpec filter) {
        return persist(ctx, resource, "count", () -> persistence.count(resource, filter));
    }

    private List<Map<String, Object>> fetchWindow(ResolutionContext ctx, ResourceDescriptor resource, FilterSpec filter,
                                                  List<SortBy> ordering, WindowSpec window) {
        List<Map<String, Object>> items = persist(ctx, resource, "fetch",
                () -> persistence.fetchWindow(resource, filter, ordering, window));
        return items == null ? List.of() : items;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * One walk of the state machine. Nested collections use their own run so their failing stage is
     * recorded independently of the parent.
     */
    private final class Run {

        private final ResolutionContext ctx;
        private volatile ResolutionStage stage = ResolutionStage.PARSE;

        private Run(ResolutionContext ctx) {
            this.ctx = ctx;
        }

        private void enter(ResolutionStage next) {
            ctx.checkNotCancelled();
            stage = next;
        }

        /**
         * Checks the subject-free rule of an operation addressed by identifier. A denial is reported at
         * {@link ResolutionStage#AUTHORIZE_ITEM}, like a denied or missing item.
         */
        private void authorizeAddressed(ResourceDescriptor resource, OperationKind kind) {
            try {
                accessControl.authorizeCollection(resource, kind, ctx.principal());
            } catch (AccessDeniedException e) {
                throw e.atStage(ResolutionStage.AUTHORIZE_ITEM);
            }
        }

        private void stamp(Object value, Throwable error) {
            if (error != null && unwrap(error) instanceof ResolutionException failure) {
                failure.atStage(stage);
            }
        }

        CompletableFuture<Map<String, Object>> execute(OperationRequest request) {
            try {
                enter(ResolutionStage.PARSE);
                ResourceDescriptor resource = registry.get(request.resource()).orElseThrow(() ->
                        new ValidationException("resource", "Unknown resource '" + request.resource() + "'."));
                OperationKind kind = OperationKind.fromName(request.operation())
                        .filter(resource::exposes)
                        .orElseThrow(() -> ValidationException.rejectedOperation(resource.name(), request.operation()));

                if (kind == OperationKind.QUERY) {
                    return request.collection()
                            ? collection(resource, request.arguments(), request.selection(), null)
                            : item(resource, request.arguments(), request.selection());
                }
                return mutation(resource, kind, request.arguments(), request.selection());
            } catch (ResolutionException e) {
                throw e.atStage(stage);
            }
        }

        // ------------------------------------------------------------------ queries

        CompletableFuture<Map<String, Object>> collection(ResourceDescriptor resource, Map<String, Object> arguments,
                                                          Selection selection, Criterion constraint) {
            try {
                enter(ResolutionStage.PARSE);
                PaginationOptions options = resource.pagination();
                Map<String, Object> filterArguments = new LinkedHashMap<>(arguments);
                CursorWindowRequest window = null;
                if (options.enabled() && options.type() == PaginationType.CURSOR) {
                    window = PaginationEngine.windowRequest(arguments);
                    filterArguments.keySet().removeAll(CURSOR_ARGUMENTS);
                } else if (options.enabled()) {
                    filterArguments.keySet().removeAll(PAGE_ARGUMENTS);
                }

                enter(ResolutionStage.AUTHORIZE_COLLECTION);
                accessControl.authorizeCollection(resource, OperationKind.QUERY, ctx.principal());

                enter(ResolutionStage.TRANSLATE_ARGS);
                TranslatedArguments translated = translator.translate(resource, OperationKind.QUERY, filterArguments);
                if (constraint != null) {
                    translated = new TranslatedArguments(translated.filter().and(constraint), translated.ordering());
                }
                FilterSpec filter = translated.filter();
                List<SortBy> ordering = translated.ordering();
                Selection nodeSelection = selection == null ? null : selection.nodeSelection();

                if (!options.enabled()) {
                    enter(ResolutionStage.FETCH);
                    List<Map<String, Object>> items = fetchWindow(ctx, resource, filter, ordering, WindowSpec.unbounded());
                    enter(ResolutionStage.AUTHORIZE_ITEM);
                    List<Map<String, Object>> granted = authorizeItems(resource, items);
                    SerializationContext context = outputContext(resource);
                    return shaper.shapeAll(ctx, resource, granted, nodeSelection, context).thenApply(NodeShaper::list);
                }

                if (options.type() == PaginationType.PAGE) {
                    enter(ResolutionStage.PAGINATE);
                    Pagination page = pagination.page(resource, arguments);
                    long totalCount = count(ctx, resource, filter);
                    enter(ResolutionStage.FETCH);
                    List<Map<String, Object>> items = fetchWindow(ctx, resource, filter, ordering, page.window());
                    enter(ResolutionStage.AUTHORIZE_ITEM);
                    List<Map<String, Object>> granted = authorizeItems(resource, items);
                    SerializationContext context = outputContext(resource);
                    PaginationInfo info = new PaginationInfo(page, totalCount);
                    return shaper.shapeAll(ctx, resource, granted, nodeSelection, context)
                            .thenApply(nodes -> NodeShaper.page(nodes, info));
                }

                enter(ResolutionStage.PAGINATE);
                FetchPlan plan = pagination.plan(resource, translated, window, () -> count(ctx, resource, filter));
                enter(ResolutionStage.FETCH);
                List<Map<String, Object>> fetched = fetchWindow(ctx, resource, filter, ordering, plan.window());
                Connection<Map<String, Object>> connection = pagination.connect(plan, fetched);
                enter(ResolutionStage.AUTHORIZE_ITEM);
                Connection<Map<String, Object>> granted = authorizeEdges(resource, connection);
                SerializationContext context = outputContext(resource);
                return shapeConnection(resource, granted, nodeSelection, context);
            } catch (ResolutionException e) {
                throw e.atStage(stage);
            }
        }

        private CompletableFuture<Map<String, Object>> item(ResourceDescriptor resource, Map<String, Object> arguments,
                                                            Selection selection) {
            try {
                rejectUnknown(arguments, Set.of(ID));
                Object id = identifier(resource, arguments.get(ID), ID);

                enter(ResolutionStage.AUTHORIZE_COLLECTION);
                authorizeAddressed(resource, OperationKind.QUERY);

                enter(ResolutionStage.FETCH);
                Optional<Map<String, Object>> found = fetchOne(ctx, resource, id);

                enter(ResolutionStage.AUTHORIZE_ITEM);
                Map<String, Object> item = found.orElseThrow(() -> accessControl.notFound(resource, OperationKind.QUERY));
                requireGranted(accessControl.authorizeItem(resource, OperationKind.QUERY, ctx.principal(), item));

                SerializationContext context = outputContext(resource);
                return shaper.shape(ctx, resource, item, selection, context);
            } catch (ResolutionException e) {
                throw e.atStage(stage);
            }
        }

        // ------------------------------------------------------------------ mutations

        private CompletableFuture<Map<String, Object>> mutation(ResourceDescriptor resource, OperationKind kind,
                                                                Map<String, Object> arguments, Selection selection) {
            try {
                rejectUnknown(arguments, Set.of(INPUT));
                if (!(arguments.get(INPUT) instanceof Map<?, ?> rawInput)) {
                    throw new ValidationException(INPUT, "Argument 'input' is required and must be an object.");
                }
                Map<String, Object> input = new LinkedHashMap<>();
                rawInput.forEach((key, value) -> input.put(String.valueOf(key), value));
                Object clientMutationId = input.get(CLIENT_MUTATION_ID);
                String idName = resource.identifier().name();
                Object id = kind == OperationKind.CREATE ? null : identifier(resource, input.get(ID), INPUT + "." + ID);

                enter(ResolutionStage.AUTHORIZE_COLLECTION);
                if (kind == OperationKind.CREATE) {
                    accessControl.authorizeCollection(resource, kind, ctx.principal());
                } else {
                    authorizeAddressed(resource, kind);
                }

                enter(ResolutionStage.TRANSLATE_ARGS);
                SerializationContext context = serialization.resolve(resource, kind);
                Map<String, Object> accepted = kind == OperationKind.DELETE
                        ? Map.of()
                        : serialization.filterInput(resource, context, input);

                Map<String, Object> result;
                switch (kind) {
                    case CREATE -> {
                        enter(ResolutionStage.AUTHORIZE_ITEM);
                        requireGranted(accessControl.authorizeItem(resource, kind, ctx.principal(), accepted));
                        accessControl.authorizePostDenormalize(resource, kind, ctx.principal(), accepted);
                        enter(ResolutionStage.FETCH);
                        result = persist(ctx, resource, "create", () -> persistence.mutate(resource, kind, accepted));
                    }
                    case UPDATE -> {
                        enter(ResolutionStage.FETCH);
                        Optional<Map<String, Object>> found = fetchOne(ctx, resource, id);
                        enter(ResolutionStage.AUTHORIZE_ITEM);
                        Map<String, Object> existing = found.orElseThrow(() -> accessControl.notFound(resource, kind));
                        requireGranted(accessControl.authorizeItem(resource, kind, ctx.principal(), existing));
                        Map<String, Object> merged = new LinkedHashMap<>(existing);
                        merged.putAll(accepted);
                        accessControl.authorizePostDenormalize(resource, kind, ctx.principal(), merged);
                        enter(ResolutionStage.FETCH);
                        Map<String, Object> changes = new LinkedHashMap<>(accepted);
                        changes.put(idName, id);
                        result = persist(ctx, resource, "update", () -> persistence.mutate(resource, kind, changes));
                    }
                    default -> {
                        enter(ResolutionStage.FETCH);
                        Optional<Map<String, Object>> found = fetchOne(ctx, resource, id);
                        enter(ResolutionStage.AUTHORIZE_ITEM);
                        Map<String, Object> existing = found.orElseThrow(() -> accessControl.notFound(resource, kind));
                        requireGranted(accessControl.authorizeItem(resource, kind, ctx.principal(), existing));
                        enter(ResolutionStage.FETCH);
                        Map<String, Object> key = new LinkedHashMap<>();
                        key.put(idName, id);
                        persist(ctx, resource, "delete", () -> persistence.mutate(resource, kind, key));
                        result = key;
                    }
                }

                enter(ResolutionStage.RESOLVE_SERIALIZATION_CONTEXT);
                Selection nodeSelection = selection == null ? null : selection.child(resource.resourceKey()).orElse(null);
                enter(ResolutionStage.SHAPE_RESPONSE);
                CompletableFuture<Map<String, Object>> node = kind == OperationKind.DELETE
                        ? CompletableFuture.completedFuture(result)
                        : shaper.shape(ctx, resource, result, nodeSelection, context);
                return node.thenApply(shaped -> {
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put(resource.resourceKey(), shaped);
                    payload.put(CLIENT_MUTATION_ID, clientMutationId);
                    return payload;
                });
            } catch (ResolutionException e) {
                throw e.atStage(stage);
            }
        }

        // ------------------------------------------------------------------ helpers

        private SerializationContext outputContext(ResourceDescriptor resource) {
            enter(ResolutionStage.RESOLVE_SERIALIZATION_CONTEXT);
            SerializationContext context = serialization.resolve(resource, OperationKind.QUERY);
            enter(ResolutionStage.SHAPE_RESPONSE);
            return context;
        }

        private CompletableFuture<Map<String, Object>> shapeConnection(ResourceDescriptor resource,
                                                                      Connection<Map<String, Object>> connection,
                                                                      Selection nodeSelection,
                                                                      SerializationContext context) {
            return shaper.shapeAll(ctx, resource, connection.nodes(), nodeSelection, context)
                    .thenApply(nodes -> {
                        List<Edge<Map<String, Object>>> edges = new ArrayList<>(nodes.size());
                        for (int i = 0; i < nodes.size(); i++) {
                            edges.add(new Edge<>(connection.edges().get(i).cursor(), nodes.get(i)));
                        }
                        return NodeShaper.connection(new Connection<>(connection.totalCount(), connection.pageInfo(), edges));
                    });
        }

        private List<Map<String, Object>> authorizeItems(ResourceDescriptor resource, List<Map<String, Object>> items) {
            if (!accessControl.requiresItemCheck(resource, OperationKind.QUERY)) {
                return items;
            }
            List<Map<String, Object>> granted = new ArrayList<>(items.size());
            for (Map<String, Object> item : items) {
                if (isGranted(resource, item)) {
                    granted.add(item);
                }
            }
            return granted;
        }

        private Connection<Map<String, Object>> authorizeEdges(ResourceDescriptor resource,
                                                               Connection<Map<String, Object>> connection) {
            if (!accessControl.requiresItemCheck(resource, OperationKind.QUERY)) {
                return connection;
            }
            List<Edge<Map<String, Object>>> granted = new ArrayList<>(connection.edges().size());
            for (Edge<Map<String, Object>> edge : connection.edges()) {
                if (isGranted(resource, edge.node())) {
                    granted.add(edge);
                }
            }
            // page info keeps the window bounds
            return new Connection<>(connection.totalCount(), connection.pageInfo(), granted);
        }

        private boolean isGranted(ResourceDescriptor resource, Map<String, Object> item) {
            AccessDecision decision = accessControl.authorizeItem(resource, OperationKind.QUERY, ctx.principal(), item);
            if (decision.granted()) {
                return true;
            }
            if (config.getItemDenialPolicy() == ItemDenialPolicy.FAIL) {
                throw accessControl.denied(decision);
            }
            return false;
        }

        private void requireGranted(AccessDecision decision) {
            if (!decision.granted()) {
                throw accessControl.denied(decision);
            }
        }

        private void rejectUnknown(Map<String, Object> arguments, Set<String> accepted) {
            for (String name : arguments.keySet()) {
                if (!accepted.contains(name)) {
                    throw ValidationException.unknownArgument(name);
                }
            }
        }

        private Object identifier(ResourceDescriptor resource, Object value, String argument) {
            if (value == null) {
                throw new ValidationException(argument, "Argument '" + argument + "' is required.");
            }
            try {
                return resource.identifier().type().coerce(value);
            } catch (IllegalArgumentException e) {
                throw new ValidationException(argument, "Invalid identifier for '" + argument + "': " + e.getMessage(), e);
            }
        }
    }
}
