package io.github.cyfko.relayql.jpa.exception;

/**
 * Exception thrown when an entity cannot be converted to or from the item representation.
 *
 * <p>This typically occurs when:</p>
 * <ul>
 *   <li>A declared field has no matching property on the entity class</li>
 *   <li>The entity class has no accessible no-argument constructor</li>
 *   <li>An input value cannot be converted to the property type</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class EntityMappingException extends RuntimeException {

    public EntityMappingException(String message) {
        super(message);
    }

    public EntityMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
