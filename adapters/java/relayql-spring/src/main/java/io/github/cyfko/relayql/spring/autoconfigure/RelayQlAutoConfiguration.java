package io.github.cyfko.relayql.spring.autoconfigure;

import io.github.cyfko.relayql.core.config.ResolverConfig;
import io.github.cyfko.relayql.core.metadata.ResourceDescriptor;
import io.github.cyfko.relayql.core.metadata.ResourceRegistry;
import io.github.cyfko.relayql.core.resolver.Resolver;
import io.github.cyfko.relayql.core.spi.PersistenceProvider;
import io.github.cyfko.relayql.jpa.JpaPersistenceProvider;
import io.github.cyfko.relayql.spring.security.SpelAccessRuleCompiler;
import jakarta.persistence.EntityManagerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.logging.Logger;

/**
 * Auto-configuration of the resolver.
 * <p>
 * Resources are declared as {@link ResourceDescriptor} beans. When an {@link EntityManagerFactory} is
 * available and no other {@link PersistenceProvider} is defined, a {@link JpaPersistenceProvider} backs
 * the resolver.
 * </p>
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration")
@ConditionalOnClass(Resolver.class)
@EnableConfigurationProperties(RelayQlProperties.class)
public class RelayQlAutoConfiguration {
    private static final Logger logger = Logger.getLogger(RelayQlAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public ResourceRegistry resourceRegistry(ObjectProvider<ResourceDescriptor> descriptors) {
        List<ResourceDescriptor> resources = descriptors.orderedStream().toList();
        logger.info(() -> String.format("Registering %d resources: %s", resources.size(),
                resources.stream().map(ResourceDescriptor::name).toList()));
        return ResourceRegistry.of(resources);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResolverConfig resolverConfig(RelayQlProperties properties) {
        return properties.toResolverConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public SpelAccessRuleCompiler spelAccessRuleCompiler() {
        return new SpelAccessRuleCompiler();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(PersistenceProvider.class)
    public Resolver resolver(ResourceRegistry registry, PersistenceProvider persistence, ResolverConfig config) {
        return new Resolver(registry, persistence, config);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({JpaPersistenceProvider.class, EntityManagerFactory.class})
    static class JpaPersistenceConfiguration {

        @Bean
        @ConditionalOnMissingBean(PersistenceProvider.class)
        @ConditionalOnBean(EntityManagerFactory.class)
        public JpaPersistenceProvider jpaPersistenceProvider(EntityManagerFactory emf, ResourceRegistry registry) {
            return new JpaPersistenceProvider(emf, registry);
        }
    }
}
