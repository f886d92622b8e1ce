package io.github.cyfko.relayql.spring.autoconfigure;

import io.github.cyfko.relayql.core.config.ItemDenialPolicy;
import io.github.cyfko.relayql.core.config.ResolverConfig;
import io.github.cyfko.relayql.core.metadata.FieldDescriptor;
import io.github.cyfko.relayql.core.metadata.ResourceDescriptor;
import io.github.cyfko.relayql.core.metadata.ResourceRegistry;
import io.github.cyfko.relayql.core.metadata.ScalarType;
import io.github.cyfko.relayql.core.model.OperationRequest;
import io.github.cyfko.relayql.core.resolver.Resolver;
import io.github.cyfko.relayql.core.security.Principal;
import io.github.cyfko.relayql.core.spi.PersistenceProvider;
import io.github.cyfko.relayql.jpa.JpaPersistenceProvider;
import io.github.cyfko.relayql.spring.security.SpelAccessRuleCompiler;
import jakarta.persistence.EntityManagerFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("RelayQlAutoConfiguration Tests")
class RelayQlAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RelayQlAutoConfiguration.class));

    @Configuration(proxyBeanMethods = false)
    static class ResourceConfiguration {

        @Bean
        ResourceDescriptor noteResource(SpelAccessRuleCompiler compiler) {
            return ResourceDescriptor.builder("Note")
                    .field(FieldDescriptor.identifier("id"))
                    .field(FieldDescriptor.scalar("text", ScalarType.STRING))
                    .field(FieldDescriptor.scalar("owner", ScalarType.STRING))
                    .accessControl(compiler.compile("object['owner'] == user.name"), "Not your note.")
                    .defaultOperations()
                    .build();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class PersistenceConfiguration {

        @Bean
        PersistenceProvider persistenceProvider() {
            PersistenceProvider persistence = mock(PersistenceProvider.class);
            when(persistence.fetchOne(any(), any()))
                    .thenReturn(Optional.of(Map.of("id", 1L, "text", "hello", "owner", "alice")));
            return persistence;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class EntityManagerFactoryConfiguration {

        @Bean
        EntityManagerFactory entityManagerFactory() {
            return mock(EntityManagerFactory.class);
        }
    }

    // ============================================================================
    // Beans
    // ============================================================================

    @Test
    @DisplayName("Resource descriptor beans are collected into the registry")
    void shouldRegisterResourceBeans() {
        contextRunner.withUserConfiguration(ResourceConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(ResourceRegistry.class);
                    assertThat(context.getBean(ResourceRegistry.class).get("Note")).isPresent();
                    assertThat(context).doesNotHaveBean(Resolver.class);
                });
    }

    @Test
    @DisplayName("A resolver is created once a persistence provider exists")
    void shouldCreateResolverWithPersistence() {
        contextRunner.withUserConfiguration(ResourceConfiguration.class, PersistenceConfiguration.class)
                .run(context -> {
                    Resolver resolver = context.getBean(Resolver.class);

                    Map<String, Object> note = resolver.resolve(
                            OperationRequest.itemQuery("Note", 1L, null), Principal.of("alice"));

                    assertThat(note).containsEntry("text", "hello");
                });
    }

    @Test
    @DisplayName("An entity manager factory backs the resolver with the JPA provider")
    void shouldCreateJpaProvider() {
        contextRunner.withUserConfiguration(ResourceConfiguration.class, EntityManagerFactoryConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(JpaPersistenceProvider.class);
                    assertThat(context).hasSingleBean(Resolver.class);
                });
    }

    @Test
    @DisplayName("A user-defined persistence provider takes precedence over JPA")
    void shouldBackOffForUserProvider() {
        contextRunner.withUserConfiguration(ResourceConfiguration.class, PersistenceConfiguration.class,
                        EntityManagerFactoryConfiguration.class)
                .run(context -> {
                    assertThat(context).doesNotHaveBean(JpaPersistenceProvider.class);
                    assertThat(context).hasSingleBean(PersistenceProvider.class);
                });
    }

    // ============================================================================
    // Properties
    // ============================================================================

    @Test
    @DisplayName("Properties under relayql configure the resolver")
    void shouldBindProperties() {
        contextRunner.withPropertyValues(
                        "relayql.default-page-size=10",
                        "relayql.maximum-page-size=50",
                        "relayql.item-denial-policy=omit",
                        "relayql.default-denial-message=Forbidden.")
                .run(context -> {
                    ResolverConfig config = context.getBean(ResolverConfig.class);

                    assertThat(config.getDefaultPageSize()).isEqualTo(10);
                    assertThat(config.getMaximumPageSize()).isEqualTo(50);
                    assertThat(config.getItemDenialPolicy()).isEqualTo(ItemDenialPolicy.OMIT);
                    assertThat(config.getDefaultDenialMessage()).isEqualTo("Forbidden.");
                });
    }

    @Test
    @DisplayName("Inconsistent page sizes fail the context")
    void shouldRejectInconsistentPageSizes() {
        contextRunner.withPropertyValues("relayql.default-page-size=80", "relayql.maximum-page-size=50")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("Without resources the registry is empty")
    void shouldCreateEmptyRegistry() {
        contextRunner.run(context ->
                assertThat(context.getBean(ResourceRegistry.class).resources()).isEmpty());
    }
}
