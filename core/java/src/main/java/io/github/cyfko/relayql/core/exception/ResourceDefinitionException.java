package io.github.cyfko.relayql.core.exception;

/**
 * Exception thrown when resource metadata is inconsistent.
 * <p>
 * Raised while building descriptors or the {@code ResourceRegistry}, i.e. once at startup and never
 * while resolving an operation.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li>Filter or ordering path that does not resolve through the relation graph</li>
 *   <li>Relation targeting an unknown resource</li>
 *   <li>Duplicate field or resource names</li>
 *   <li>Resource without an identifier field</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ResourceDefinitionException extends RuntimeException {

    public ResourceDefinitionException(String message) {
        super(message);
    }

    public ResourceDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
