package io.github.cyfko.relayql.jpa;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.relayql.core.api.AnyOf;
import io.github.cyfko.relayql.core.api.Comparison;
import io.github.cyfko.relayql.core.api.Criterion;
import io.github.cyfko.relayql.core.api.Op;
import io.github.cyfko.relayql.core.metadata.FieldDescriptor;
import io.github.cyfko.relayql.core.metadata.MatchStrategy;
import io.github.cyfko.relayql.core.metadata.ResolvedPath;
import io.github.cyfko.relayql.core.metadata.ResourceDescriptor;
import io.github.cyfko.relayql.core.metadata.ResourceRegistry;
import io.github.cyfko.relayql.jpa.utils.PathResolverUtils;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Translates filter criteria into JPA criteria predicates.
 *
 * <h2>Operator mapping</h2>
 * <ul>
 *   <li>{@link Op#EQ}, {@link Op#NE}, {@link Op#GT}, {@link Op#GTE}, {@link Op#LT}, {@link Op#LTE}:
 *       binary comparisons</li>
 *   <li>{@link Op#MATCHES}, {@link Op#NOT_MATCHES}: {@code LIKE} patterns escaped with {@link MatchStrategy#ESCAPE}</li>
 *   <li>{@link Op#IN}, {@link Op#NOT_IN}: membership</li>
 *   <li>{@link Op#RANGE}, {@link Op#NOT_RANGE}: inclusive {@code BETWEEN}</li>
 *   <li>{@link Op#IS_NULL}, {@link Op#NOT_NULL}: null checks, or emptiness checks when the path
 *       ends on a to-many relation</li>
 * </ul>
 * <p>
 * Operand values are converted to the Java type of the attribute with Jackson, so a canonical
 * {@code Double} compares against a {@code BigDecimal} column and a {@code String} identifier against
 * a {@code Long} one. Case-insensitive comparisons lower both sides.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class CriterionPredicateBuilder {

    private final ResourceRegistry registry;
    private final ObjectMapper mapper;

    public CriterionPredicateBuilder(ResourceRegistry registry, ObjectMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
    }

    /**
     * Builds the conjunction of several criteria.
     *
     * @param cb       criteria builder
     * @param root     root of the resource
     * @param resource resource descriptor
     * @param criteria criteria to combine
     * @return the conjunction, {@code cb.conjunction()} when there is none
     */
    public Predicate toPredicate(CriteriaBuilder cb, From<?, ?> root, ResourceDescriptor resource,
                                 Collection<? extends Criterion> criteria) {
        List<Predicate> predicates = new ArrayList<>(criteria.size());
        for (Criterion criterion : criteria) {
            predicates.add(toPredicate(cb, root, resource, criterion));
        }
        return predicates.isEmpty() ? cb.conjunction() : cb.and(predicates.toArray(new Predicate[0]));
    }

    public Predicate toPredicate(CriteriaBuilder cb, From<?, ?> root, ResourceDescriptor resource, Criterion criterion) {
        if (criterion instanceof AnyOf anyOf) {
            List<Predicate> alternatives = new ArrayList<>(anyOf.alternatives().size());
            for (Comparison alternative : anyOf.alternatives()) {
                alternatives.add(toPredicate(cb, root, resource, alternative));
            }
            return cb.or(alternatives.toArray(new Predicate[0]));
        }
        if (criterion instanceof Comparison comparison) {
            return comparisonPredicate(cb, root, resource, comparison);
        }
        throw new IllegalArgumentException("Unsupported criterion type: " + criterion.getClass().getName());
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Predicate comparisonPredicate(CriteriaBuilder cb, From<?, ?> root, ResourceDescriptor resource,
                                          Comparison comparison) {
        ResolvedPath resolved = registry.resolvePath(resource, comparison.path())
                .orElseThrow(() -> new IllegalArgumentException(String.format(
                        "Path '%s' does not resolve on resource '%s'", comparison.path(), resource.name())));
        FieldDescriptor leaf = resolved.leaf();
        From<?, ?> owner = PathResolverUtils.owner(root, resolved);

        if (leaf.toMany()) {
            Expression<Collection<?>> collection = owner.get(leaf.name());
            return switch (comparison.op()) {
                case IS_NULL -> cb.isEmpty(collection);
                case NOT_NULL -> cb.isNotEmpty(collection);
                default -> throw new IllegalArgumentException(String.format(
                        "Operator %s is not supported on to-many relation '%s'", comparison.op(), comparison.path()));
            };
        }

        Path<?> path = owner.get(leaf.name());
        if (leaf.isRelation() && comparison.op().requiresValue()) {
            // compare the referenced identifier
            path = path.get(registry.require(leaf.target()).identifier().name());
        }
        Class<?> javaType = path.getJavaType();
        boolean ignoreCase = comparison.ignoreCase() && String.class.equals(javaType);

        Op op = comparison.op();
        return switch (op) {
            case IS_NULL -> cb.isNull(path);
            case NOT_NULL -> cb.isNotNull(path);
            case EQ -> cb.equal(text(cb, path, ignoreCase), operand(comparison.value(), javaType, ignoreCase));
            case NE -> cb.notEqual(text(cb, path, ignoreCase), operand(comparison.value(), javaType, ignoreCase));
            case GT -> cb.greaterThan((Expression<Comparable>) path, (Comparable) operand(comparison.value(), javaType, false));
            case GTE -> cb.greaterThanOrEqualTo((Expression<Comparable>) path, (Comparable) operand(comparison.value(), javaType, false));
            case LT -> cb.lessThan((Expression<Comparable>) path, (Comparable) operand(comparison.value(), javaType, false));
            case LTE -> cb.lessThanOrEqualTo((Expression<Comparable>) path, (Comparable) operand(comparison.value(), javaType, false));
            case MATCHES -> cb.like(castToStringPath(cb, path, ignoreCase), (String) operand(comparison.value(), String.class, ignoreCase), MatchStrategy.ESCAPE);
            case NOT_MATCHES -> cb.notLike(castToStringPath(cb, path, ignoreCase), (String) operand(comparison.value(), String.class, ignoreCase), MatchStrategy.ESCAPE);
            case IN -> text(cb, path, ignoreCase).in(operands(comparison, javaType, ignoreCase));
            case NOT_IN -> cb.not(text(cb, path, ignoreCase).in(operands(comparison, javaType, ignoreCase)));
            case RANGE -> buildBetweenPredicate(cb, path, operands(comparison, javaType, false));
            case NOT_RANGE -> cb.not(buildBetweenPredicate(cb, path, operands(comparison, javaType, false)));
        };
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Predicate buildBetweenPredicate(CriteriaBuilder cb, Path<?> path, List<Object> bounds) {
        if (bounds.size() != 2) {
            throw new IllegalArgumentException("RANGE operator requires exactly 2 values");
        }
        return cb.between((Expression) path, (Comparable) bounds.get(0), (Comparable) bounds.get(1));
    }

    private List<Object> operands(Comparison comparison, Class<?> javaType, boolean ignoreCase) {
        if (!(comparison.value() instanceof Collection<?> values)) {
            throw new IllegalArgumentException("Operator " + comparison.op() + " requires a collection value");
        }
        List<Object> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            converted.add(operand(value, javaType, ignoreCase));
        }
        return converted;
    }

    private Object operand(Object value, Class<?> javaType, boolean ignoreCase) {
        Object converted = javaType.isInstance(value) ? value : mapper.convertValue(value, javaType);
        if (ignoreCase && converted instanceof String s) {
            return s.toLowerCase(Locale.ROOT);
        }
        return converted;
    }

    @SuppressWarnings("unchecked")
    private static Expression<Object> text(CriteriaBuilder cb, Path<?> path, boolean ignoreCase) {
        if (ignoreCase) {
            return (Expression<Object>) (Expression<?>) cb.lower((Expression<String>) path);
        }
        return (Expression<Object>) path;
    }

    @SuppressWarnings("unchecked")
    private static Expression<String> castToStringPath(CriteriaBuilder cb, Path<?> path, boolean ignoreCase) {
        Expression<String> expression = (Expression<String>) path;
        return ignoreCase ? cb.lower(expression) : expression;
    }
}
