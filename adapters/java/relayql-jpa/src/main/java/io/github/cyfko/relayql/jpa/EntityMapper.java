package io.github.cyfko.relayql.jpa;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.relayql.core.metadata.FieldDescriptor;
import io.github.cyfko.relayql.core.metadata.ResourceDescriptor;
import io.github.cyfko.relayql.core.metadata.ResourceRegistry;
import io.github.cyfko.relayql.jpa.exception.EntityMappingException;
import io.github.cyfko.relayql.jpa.utils.ReflectionUtils;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.PersistenceUnitUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Converts entities to items and applies mutation input to entities.
 * <p>
 * An item carries every declared field of its resource. A to-one relation is represented by the
 * identifier of the referenced entity and a to-many relation by the list of identifiers. Output
 * filtering is left to the resolver.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EntityMapper {

    private final ResourceRegistry registry;
    private final ObjectMapper mapper;
    private final PersistenceUnitUtil unitUtil;
    private final Function<ResourceDescriptor, Class<?>> entityClasses;

    /**
     * @param emf           factory providing identifier access
     * @param registry      resource registry
     * @param mapper        converter of scalar values
     * @param entityClasses entity class of each resource
     */
    public EntityMapper(EntityManagerFactory emf, ResourceRegistry registry, ObjectMapper mapper,
                        Function<ResourceDescriptor, Class<?>> entityClasses) {
        this.registry = registry;
        this.mapper = mapper;
        this.unitUtil = emf.getPersistenceUnitUtil();
        this.entityClasses = entityClasses;
    }

    /**
     * Reads an entity into an item.
     *
     * @param resource resource of the entity
     * @param entity   managed entity
     * @return the item, keyed by field name in declaration order
     */
    public Map<String, Object> toItem(ResourceDescriptor resource, Object entity) {
        Map<String, Object> item = new LinkedHashMap<>();
        for (FieldDescriptor field : resource.fields()) {
            Object value = ReflectionUtils.readProperty(entity, field.name());
            if (!field.isRelation() || value == null) {
                item.put(field.name(), value);
            } else if (field.toMany()) {
                List<Object> ids = new ArrayList<>();
                for (Object element : (Collection<?>) value) {
                    ids.add(unitUtil.getIdentifier(element));
                }
                item.put(field.name(), ids);
            } else {
                item.put(field.name(), unitUtil.getIdentifier(value));
            }
        }
        return item;
    }

    /**
     * Writes input values onto an entity. The identifier is never written.
     *
     * @param em       entity manager of the current transaction, used to reference related entities
     * @param resource resource of the entity
     * @param entity   target entity
     * @param input    accepted input, keyed by field name
     * @throws EntityMappingException if a value cannot be converted to its property type
     */
    public void apply(EntityManager em, ResourceDescriptor resource, Object entity, Map<String, Object> input) {
        for (Map.Entry<String, Object> entry : input.entrySet()) {
            FieldDescriptor field = resource.field(entry.getKey()).orElse(null);
            if (field == null || field.identifier()) {
                continue;
            }
            Object value = entry.getValue();
            Object converted;
            if (value == null) {
                converted = null;
            } else if (!field.isRelation()) {
                converted = convert(value, ReflectionUtils.propertyType(entity.getClass(), field.name()), field.name());
            } else if (field.toMany()) {
                converted = references(em, field, value, ReflectionUtils.propertyType(entity.getClass(), field.name()));
            } else {
                converted = reference(em, field, value);
            }
            ReflectionUtils.writeProperty(entity, field.name(), converted);
        }
    }

    /**
     * Converts an identifier value to the identifier type of an entity.
     */
    public Object identifier(EntityManager em, Class<?> entityClass, Object id) {
        Class<?> idType = em.getMetamodel().entity(entityClass).getIdType().getJavaType();
        return convert(id, idType, "id");
    }

    private Object reference(EntityManager em, FieldDescriptor field, Object value) {
        ResourceDescriptor target = registry.require(field.target());
        Object id = value instanceof Map<?, ?> embedded ? embedded.get(target.identifier().name()) : value;
        if (id == null) {
            return null;
        }
        Class<?> targetClass = entityClasses.apply(target);
        return em.getReference(targetClass, identifier(em, targetClass, id));
    }

    private Collection<Object> references(EntityManager em, FieldDescriptor field, Object value, Class<?> propertyType) {
        if (!(value instanceof Collection<?> values)) {
            throw new EntityMappingException("Relation '" + field.name() + "' expects a list of identifiers");
        }
        Collection<Object> references = Set.class.isAssignableFrom(propertyType)
                ? new LinkedHashSet<>() : new ArrayList<>();
        for (Object element : values) {
            Object reference = reference(em, field, element);
            if (reference != null) {
                references.add(reference);
            }
        }
        return references;
    }

    private Object convert(Object value, Class<?> type, String property) {
        if (type.isInstance(value)) {
            return value;
        }
        try {
            return mapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new EntityMappingException(String.format(
                    "Cannot convert value of '%s' to %s", property, type.getSimpleName()), e);
        }
    }
}
