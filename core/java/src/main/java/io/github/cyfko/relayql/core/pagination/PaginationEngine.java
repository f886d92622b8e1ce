package io.github.cyfko.relayql.core.pagination;

import io.github.cyfko.relayql.core.config.ResolverConfig;
import io.github.cyfko.relayql.core.exception.ValidationException;
import io.github.cyfko.relayql.core.filter.TranslatedArguments;
import io.github.cyfko.relayql.core.metadata.PaginationOptions;
import io.github.cyfko.relayql.core.metadata.ResourceDescriptor;
import io.github.cyfko.relayql.core.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Relay-style cursor pagination.
 *
 * <h2>Window computation</h2>
 * <p>For a requested size {@code N}:</p>
 * <ul>
 *   <li>Forward: fetch {@code N+1} items starting right after the {@code after} position (or at 0).
 *       An extra item means {@code hasNextPage}; {@code hasPreviousPage} holds when the window does not
 *       start at 0.</li>
 *   <li>Backward: fetch up to {@code N+1} items ending right before the {@code before} position (or at
 *       {@code totalCount}). An extra item means {@code hasPreviousPage} and is dropped from the front;
 *       {@code hasNextPage} holds when the window ends before {@code totalCount}.</li>
 * </ul>
 * <p>
 * Edges are always returned in ascending order of the requested ordering. Each cursor encodes the
 * item position together with the fingerprint of the filter and ordering.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PaginationEngine {

    private static final Logger logger = Logger.getLogger(PaginationEngine.class.getName());

    public static final String FIRST = "first";
    public static final String AFTER = "after";
    public static final String LAST = "last";
    public static final String BEFORE = "before";
    public static final String PAGE = "page";
    public static final String ITEMS_PER_PAGE = "itemsPerPage";

    private final ResolverConfig config;

    public PaginationEngine(ResolverConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Extracts the cursor window from raw arguments.
     *
     * @param arguments raw operation arguments
     * @return the window request
     * @throws ValidationException if a count is not an integer or a cursor is not a string
     */
    public static CursorWindowRequest windowRequest(Map<String, Object> arguments) {
        return new CursorWindowRequest(
                integerArgument(arguments, FIRST),
                stringArgument(arguments, AFTER),
                integerArgument(arguments, LAST),
                stringArgument(arguments, BEFORE));
    }

    /**
     * Computes the fetch instruction of a cursor window.
     *
     * @param resource   resource paginated
     * @param translated filter and ordering of the request
     * @param request    requested window
     * @param totalCount supplies the number of items matching the filter, invoked once the request
     *                   has been validated
     * @return the fetch plan
     * @throws ValidationException if both directions are set or a count is out of bounds
     * @throws io.github.cyfko.relayql.core.exception.PaginationException if a cursor is invalid or stale
     */
    public FetchPlan plan(ResourceDescriptor resource, TranslatedArguments translated, CursorWindowRequest request,
                          LongSupplier totalCount) {
        if (request.hasForward() && request.hasBackward()) {
            String offending = request.last() != null ? LAST : BEFORE;
            throw new ValidationException(offending,
                    "Cannot combine forward (first/after) and backward (last/before) pagination.");
        }
        String fingerprint = CursorCodec.fingerprint(resource.name(), translated.filter(), translated.ordering());

        FetchPlan plan;
        if (request.hasBackward()) {
            int size = pageSize(resource, request.last(), LAST);
            Integer before = request.before() == null ? null : CursorCodec.decode(BEFORE, request.before(), fingerprint);
            long total = totalCount.getAsLong();
            long end = before == null ? total : Math.min(before, total);
            int offset = (int) Math.max(0, end - ((long) size + 1));
            plan = new FetchPlan(new WindowSpec(offset, (int) (end - offset)), size, false, total, fingerprint);
        } else {
            int size = pageSize(resource, request.first(), FIRST);
            int start = request.after() == null ? 0 : CursorCodec.decode(AFTER, request.after(), fingerprint) + 1;
            int limit = size == Integer.MAX_VALUE ? size : size + 1;
            plan = new FetchPlan(new WindowSpec(start, limit), size, true, totalCount.getAsLong(), fingerprint);
        }

        logger.fine(() -> String.format("Pagination plan for %s: %s", resource.name(), plan));
        return plan;
    }

    /**
     * Builds the connection from the items fetched for a plan.
     *
     * @param plan    the fetch plan
     * @param fetched items returned for {@code plan.window()}, in ascending order
     * @param <T>     item type
     * @return the connection, with at most {@code plan.requested()} edges
     */
    public <T> Connection<T> connect(FetchPlan plan, List<T> fetched) {
        int offset = plan.window().offset();
        boolean extra = fetched.size() > plan.requested();
        List<T> items;
        int firstPosition;
        boolean hasNext;
        boolean hasPrevious;

        if (plan.forward()) {
            items = extra ? fetched.subList(0, plan.requested()) : fetched;
            firstPosition = offset;
            hasNext = extra;
            hasPrevious = offset > 0;
        } else {
            int dropped = extra ? fetched.size() - plan.requested() : 0;
            items = fetched.subList(dropped, fetched.size());
            firstPosition = offset + dropped;
            hasNext = (long) offset + plan.window().limit() < plan.totalCount();
            hasPrevious = extra;
        }

        List<Edge<T>> edges = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            edges.add(new Edge<>(CursorCodec.encode((long) firstPosition + i, plan.fingerprint()), items.get(i)));
        }
        PageInfo pageInfo = new PageInfo(
                edges.isEmpty() ? null : edges.get(0).cursor(),
                edges.isEmpty() ? null : edges.get(edges.size() - 1).cursor(),
                hasNext,
                hasPrevious);
        return new Connection<>(plan.totalCount(), pageInfo, edges);
    }

    /**
     * Resolves the page of a page-based collection.
     *
     * @param resource  resource paginated
     * @param arguments raw arguments, {@code page} (one-based) and {@code itemsPerPage} are read
     * @return the page
     * @throws ValidationException if the page is below 1, starts beyond the addressable offsets, or the page
     *                             size is out of bounds
     */
    public Pagination page(ResourceDescriptor resource, Map<String, Object> arguments) {
        Integer page = integerArgument(arguments, PAGE);
        if (page != null && page < 1) {
            throw new ValidationException(PAGE, "Argument 'page' must be greater than or equal to 1.");
        }
        int size = pageSize(resource, integerArgument(arguments, ITEMS_PER_PAGE), ITEMS_PER_PAGE);
        if (size == 0) {
            throw new ValidationException(ITEMS_PER_PAGE, "Argument 'itemsPerPage' must be positive.");
        }
        int displayPage = page == null ? 1 : page;
        if ((long) (displayPage - 1) * size > Integer.MAX_VALUE) {
            throw new ValidationException(PAGE, String.format(
                    "Argument 'page' is too large for %d items per page.", size));
        }
        return Pagination.ofDisplayPage(displayPage, size);
    }

    /**
     * Validates a requested page size against the resource and global limits.
     *
     * @param resource  resource paginated
     * @param requested requested size, {@code null} for the default
     * @param argument  argument carrying the size
     * @return the effective size
     */
    public int pageSize(ResourceDescriptor resource, Integer requested, String argument) {
        PaginationOptions options = resource.pagination();
        Integer maximum = options.maximumItemsPerPage() != null ? options.maximumItemsPerPage() : config.getMaximumPageSize();
        if (requested == null) {
            int defaultSize = options.itemsPerPage() != null ? options.itemsPerPage() : config.getDefaultPageSize();
            return maximum == null ? defaultSize : Math.min(defaultSize, maximum);
        }
        if (requested < 0) {
            throw new ValidationException(argument, "Argument '" + argument + "' must not be negative.");
        }
        if (maximum != null && requested > maximum) {
            throw new ValidationException(argument, String.format(
                    "Argument '%s' must not exceed %d.", argument, maximum));
        }
        return requested;
    }

    private static Integer integerArgument(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            long l = ((Number) value).longValue();
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return (int) l;
            }
        }
        throw new ValidationException(name, "Argument '" + name + "' expects an integer.");
    }

    private static String stringArgument(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new ValidationException(name, "Argument '" + name + "' expects a cursor string.");
    }
}
