package io.github.cyfko.relayql.jpa;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.cyfko.relayql.core.api.AnyOf;
import io.github.cyfko.relayql.core.api.Comparison;
import io.github.cyfko.relayql.core.api.Criterion;
import io.github.cyfko.relayql.core.api.FilterSpec;
import io.github.cyfko.relayql.core.api.SortBy;
import io.github.cyfko.relayql.core.metadata.FieldDescriptor;
import io.github.cyfko.relayql.core.metadata.OperationKind;
import io.github.cyfko.relayql.core.metadata.ResolvedPath;
import io.github.cyfko.relayql.core.metadata.ResourceDescriptor;
import io.github.cyfko.relayql.core.metadata.ResourceRegistry;
import io.github.cyfko.relayql.core.model.WindowSpec;
import io.github.cyfko.relayql.core.spi.PersistenceProvider;
import io.github.cyfko.relayql.jpa.exception.EntityMappingException;
import io.github.cyfko.relayql.jpa.strategies.CountStrategy;
import io.github.cyfko.relayql.jpa.strategies.WindowFetchStrategy;
import io.github.cyfko.relayql.jpa.utils.ReflectionUtils;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityTransaction;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import jakarta.persistence.metamodel.EntityType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * {@link PersistenceProvider} backed by a JPA {@link EntityManagerFactory}.
 *
 * <h2>Resource to entity mapping</h2>
 * <p>
 * Each resource is backed by the entity whose JPA entity name equals the resource name, unless an
 * explicit entity class is registered for it. Field names of the resource are entity property names.
 * </p>
 *
 * <h2>Queries</h2>
 * <p>
 * Every call opens its own {@link EntityManager}, which makes the provider safe for concurrent use.
 * When a filter crosses a to-many relation, matching identifiers are selected in a subquery so that
 * each entity is counted and fetched once.
 * </p>
 *
 * <h2>Mutations</h2>
 * <p>
 * Mutations run in a resource-local transaction which is rolled back when the mutation fails.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EntityManagerFactory emf = Persistence.createEntityManagerFactory("catalog");
 * PersistenceProvider persistence = new JpaPersistenceProvider(emf, registry);
 * Resolver resolver = new Resolver(registry, persistence, ResolverConfig.defaults());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaPersistenceProvider implements PersistenceProvider {
    private static final Logger logger = Logger.getLogger(JpaPersistenceProvider.class.getName());

    private final EntityManagerFactory emf;
    private final ResourceRegistry registry;
    private final Map<String, Class<?>> entityClasses = new ConcurrentHashMap<>();
    private final CriterionPredicateBuilder predicates;
    private final EntityMapper entityMapper;

    public JpaPersistenceProvider(EntityManagerFactory emf, ResourceRegistry registry) {
        this(emf, registry, Map.of(), new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    /**
     * @param emf      entity manager factory
     * @param registry resource registry
     * @param entities explicit entity class per resource name, overriding the lookup by entity name
     * @param mapper   converter of argument and input values to property types
     */
    public JpaPersistenceProvider(EntityManagerFactory emf, ResourceRegistry registry, Map<String, Class<?>> entities,
                                  ObjectMapper mapper) {
        this.emf = Objects.requireNonNull(emf, "emf must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");
        this.entityClasses.putAll(entities);
        this.predicates = new CriterionPredicateBuilder(registry, mapper);
        this.entityMapper = new EntityMapper(emf, registry, mapper, this::entityClass);
    }

    @Override
    public long count(ResourceDescriptor resource, FilterSpec filter) {
        Class<?> entityClass = entityClass(resource);
        try (EntityManager em = emf.createEntityManager()) {
            return new CountStrategy(entityClass).execute(em, restriction(resource, entityClass, filter));
        }
    }

    @Override
    public List<Map<String, Object>> fetchWindow(ResourceDescriptor resource, FilterSpec filter, List<SortBy> ordering,
                                                 WindowSpec window) {
        Class<?> entityClass = entityClass(resource);
        try (EntityManager em = emf.createEntityManager()) {
            List<?> entities = new WindowFetchStrategy(registry, resource, entityClass, ordering, window)
                    .execute(em, restriction(resource, entityClass, filter));
            List<Map<String, Object>> items = new ArrayList<>(entities.size());
            for (Object entity : entities) {
                items.add(entityMapper.toItem(resource, entity));
            }
            return items;
        }
    }

    @Override
    public Optional<Map<String, Object>> fetchOne(ResourceDescriptor resource, Object id) {
        Class<?> entityClass = entityClass(resource);
        try (EntityManager em = emf.createEntityManager()) {
            Object entity = em.find(entityClass, entityMapper.identifier(em, entityClass, id));
            logger.fine(() -> String.format("fetchOne %s[%s]: %s", resource.name(), id, entity == null ? "absent" : "found"));
            return Optional.ofNullable(entity).map(found -> entityMapper.toItem(resource, found));
        }
    }

    @Override
    public Map<String, Object> mutate(ResourceDescriptor resource, OperationKind kind, Map<String, Object> input) {
        Class<?> entityClass = entityClass(resource);
        long startTime = System.nanoTime();
        try (EntityManager em = emf.createEntityManager()) {
            EntityTransaction tx = em.getTransaction();
            tx.begin();
            try {
                Map<String, Object> result = switch (kind) {
                    case CREATE -> {
                        Object entity = ReflectionUtils.instantiate(entityClass);
                        entityMapper.apply(em, resource, entity, input);
                        em.persist(entity);
                        em.flush();
                        yield entityMapper.toItem(resource, entity);
                    }
                    case UPDATE -> {
                        Object entity = require(em, resource, entityClass, input);
                        entityMapper.apply(em, resource, entity, input);
                        em.flush();
                        yield entityMapper.toItem(resource, entity);
                    }
                    case DELETE -> {
                        Object entity = require(em, resource, entityClass, input);
                        Map<String, Object> removed = entityMapper.toItem(resource, entity);
                        em.remove(entity);
                        yield removed;
                    }
                    default -> throw new IllegalArgumentException("Not a mutation: " + kind);
                };
                tx.commit();
                long durationMs = (System.nanoTime() - startTime) / 1_000_000;
                logger.info(() -> String.format("%s on %s committed in %dms",
                        kind.operationName(), resource.name(), durationMs));
                return result;
            } catch (RuntimeException e) {
                if (tx.isActive()) {
                    tx.rollback();
                }
                throw e;
            }
        }
    }

    /**
     * Resolves the entity class backing a resource.
     *
     * @throws EntityMappingException if no entity is registered under the resource name
     */
    public Class<?> entityClass(ResourceDescriptor resource) {
        return entityClasses.computeIfAbsent(resource.name(), name -> emf.getMetamodel().getEntities().stream()
                .filter(entity -> entity.getName().equals(name))
                .findFirst()
                .<Class<?>>map(EntityType::getJavaType)
                .orElseThrow(() -> new EntityMappingException("No entity named '" + name + "' in the persistence unit")));
    }

    // ============================================================================
    // Helpers
    // ============================================================================

    private PredicateResolver restriction(ResourceDescriptor resource, Class<?> entityClass, FilterSpec filter) {
        if (filter.isEmpty()) {
            return (root, query, cb) -> null;
        }
        if (filter.criteria().stream().noneMatch(criterion -> crossesToMany(resource, criterion))) {
            return (root, query, cb) -> predicates.toPredicate(cb, root, resource, filter.criteria());
        }
        String idName = resource.identifier().name();
        return (root, query, cb) -> {
            Subquery<Object> matching = query.subquery(Object.class);
            Root<?> subRoot = matching.from(entityClass);
            matching.select(subRoot.get(idName))
                    .where(predicates.toPredicate(cb, subRoot, resource, filter.criteria()));
            return root.get(idName).in(matching);
        };
    }

    private boolean crossesToMany(ResourceDescriptor resource, Criterion criterion) {
        if (criterion instanceof AnyOf anyOf) {
            return anyOf.alternatives().stream().anyMatch(alternative -> crossesToMany(resource, alternative));
        }
        Comparison comparison = (Comparison) criterion;
        Optional<ResolvedPath> resolved = registry.resolvePath(resource, comparison.path());
        // a to-many leaf is checked for emptiness without a join
        return resolved.isPresent() && resolved.get().fields().subList(0, resolved.get().fields().size() - 1)
                .stream().anyMatch(FieldDescriptor::toMany);
    }

    private Object require(EntityManager em, ResourceDescriptor resource, Class<?> entityClass, Map<String, Object> input) {
        Object id = input.get(resource.identifier().name());
        if (id == null) {
            throw new IllegalArgumentException(resource.name() + " mutation requires an identifier");
        }
        Object entity = em.find(entityClass, entityMapper.identifier(em, entityClass, id));
        if (entity == null) {
            throw new IllegalStateException(resource.name() + " " + id + " does not exist");
        }
        return entity;
    }
}
