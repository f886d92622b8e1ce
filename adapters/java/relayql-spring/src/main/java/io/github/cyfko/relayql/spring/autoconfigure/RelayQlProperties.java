package io.github.cyfko.relayql.spring.autoconfigure;

import io.github.cyfko.relayql.core.config.ItemDenialPolicy;
import io.github.cyfko.relayql.core.config.ResolverConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Resolver settings bound from the {@code relayql} prefix.
 *
 * <pre>
 * relayql.default-page-size=20
 * relayql.maximum-page-size=100
 * relayql.item-denial-policy=omit
 * relayql.default-denial-message=Forbidden.
 * </pre>
 */
@ConfigurationProperties(prefix = "relayql")
public class RelayQlProperties {
    private int defaultPageSize = ResolverConfig.DEFAULT_PAGE_SIZE;
    private Integer maximumPageSize;
    private ItemDenialPolicy itemDenialPolicy = ItemDenialPolicy.FAIL;
    private String defaultDenialMessage = ResolverConfig.DEFAULT_DENIAL_MESSAGE;

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public Integer getMaximumPageSize() {
        return maximumPageSize;
    }

    public void setMaximumPageSize(Integer maximumPageSize) {
        this.maximumPageSize = maximumPageSize;
    }

    public ItemDenialPolicy getItemDenialPolicy() {
        return itemDenialPolicy;
    }

    public void setItemDenialPolicy(ItemDenialPolicy itemDenialPolicy) {
        this.itemDenialPolicy = itemDenialPolicy;
    }

    public String getDefaultDenialMessage() {
        return defaultDenialMessage;
    }

    public void setDefaultDenialMessage(String defaultDenialMessage) {
        this.defaultDenialMessage = defaultDenialMessage;
    }

    /**
     * @return the resolver configuration described by these properties
     * @throws IllegalArgumentException if the page sizes are inconsistent
     */
    public ResolverConfig toResolverConfig() {
        return ResolverConfig.builder()
                .defaultPageSize(defaultPageSize)
                .maximumPageSize(maximumPageSize)
                .itemDenialPolicy(itemDenialPolicy)
                .defaultDenialMessage(defaultDenialMessage)
                .build();
    }
}
