package io.github.cyfko.relayql.core.config;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Immutable, process-wide configuration of the resolver.
 * <p>
 * Resource-level pagination options ({@code itemsPerPage}, {@code maximumItemsPerPage}) take
 * precedence over the defaults declared here.
 * </p>
 *
 * <pre>{@code
 * ResolverConfig config = ResolverConfig.builder()
 *     .defaultPageSize(20)
 *     .maximumPageSize(100)
 *     .itemDenialPolicy(ItemDenialPolicy.OMIT)
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResolverConfig {

    public static final int DEFAULT_PAGE_SIZE = 30;
    public static final String DEFAULT_DENIAL_MESSAGE = "Access Denied.";

    private final int defaultPageSize;
    private final Integer maximumPageSize;
    private final ItemDenialPolicy itemDenialPolicy;
    private final String defaultDenialMessage;
    private final Executor executor;

    private ResolverConfig(Builder builder) {
        this.defaultPageSize = builder.defaultPageSize;
        this.maximumPageSize = builder.maximumPageSize;
        this.itemDenialPolicy = builder.itemDenialPolicy;
        this.defaultDenialMessage = builder.defaultDenialMessage;
        this.executor = builder.executor;
    }

    public static Builder builder() { return new Builder(); }

    public static ResolverConfig defaults() { return builder().build(); }

    public int getDefaultPageSize() { return defaultPageSize; }

    /**
     * @return the global maximum page size, {@code null} when unbounded
     */
    public Integer getMaximumPageSize() { return maximumPageSize; }
    public ItemDenialPolicy getItemDenialPolicy() { return itemDenialPolicy; }
    public String getDefaultDenialMessage() { return defaultDenialMessage; }
    public Executor getExecutor() { return executor; }

    @Override
    public String toString() {
        return String.format("ResolverConfig{defaultPageSize=%d, maximumPageSize=%s, itemDenialPolicy=%s}",
                defaultPageSize, maximumPageSize, itemDenialPolicy);
    }

    public static final class Builder {
        private int defaultPageSize = DEFAULT_PAGE_SIZE;
        private Integer maximumPageSize; // unbounded
        private ItemDenialPolicy itemDenialPolicy = ItemDenialPolicy.FAIL;
        private String defaultDenialMessage = DEFAULT_DENIAL_MESSAGE;
        private Executor executor = ForkJoinPool.commonPool();

        public Builder defaultPageSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("Default page size must be positive. Provided: " + size);
            }
            this.defaultPageSize = size;
            return this;
        }

        public Builder maximumPageSize(Integer size) {
            if (size != null && size <= 0) {
                throw new IllegalArgumentException("Maximum page size must be positive. Provided: " + size);
            }
            this.maximumPageSize = size;
            return this;
        }

        public Builder itemDenialPolicy(ItemDenialPolicy policy) {
            this.itemDenialPolicy = Objects.requireNonNull(policy, "itemDenialPolicy");
            return this;
        }

        public Builder defaultDenialMessage(String message) {
            this.defaultDenialMessage = Objects.requireNonNull(message, "defaultDenialMessage");
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public ResolverConfig build() {
            if (maximumPageSize != null && defaultPageSize > maximumPageSize) {
                throw new IllegalArgumentException(String.format(
                        "Default page size %d exceeds maximum page size %d", defaultPageSize, maximumPageSize));
            }
            return new ResolverConfig(this);
        }
    }
}
