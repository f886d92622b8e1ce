package io.github.cyfko.relayql.core.exception;

/**
 * Exception thrown when an incoming operation carries an invalid argument.
 * <p>
 * Every validation failure names the offending argument. Nested arguments use a dotted notation
 * relative to the root argument, e.g. {@code order.product_releaseDate} or {@code input.title}.
 * Validation failures are never retried: the caller has to fix its query.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li>Unknown argument name or unknown key inside a structured argument</li>
 *   <li>Value type incompatible with the targeted property</li>
 *   <li>Conflicting pagination directions ({@code first} together with {@code last})</li>
 *   <li>Invalid ordering direction token</li>
 *   <li>Operation not exposed for the targeted resource</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ValidationException extends ResolutionException {

    private final String argument;

    /**
     * Creates a validation failure for the given argument.
     *
     * @param argument name of the offending argument
     * @param message  description of the failure
     */
    public ValidationException(String argument, String message) {
        super(message);
        this.argument = argument;
    }

    /**
     * Creates a validation failure for the given argument with an underlying cause.
     *
     * @param argument name of the offending argument
     * @param message  description of the failure
     * @param cause    original parsing or conversion error
     */
    public ValidationException(String argument, String message, Throwable cause) {
        super(message, cause);
        this.argument = argument;
    }

    /**
     * @return name of the offending argument
     */
    public String getArgument() {
        return argument;
    }

    public static ValidationException unknownArgument(String argument) {
        return new ValidationException(argument, "Unknown argument '" + argument + "'.");
    }

    public static ValidationException rejectedOperation(String resource, String operation) {
        return new ValidationException("operation",
                String.format("Operation '%s' is not exposed for resource '%s'.", operation, resource));
    }
}
