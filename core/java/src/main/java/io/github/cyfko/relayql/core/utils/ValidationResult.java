package io.github.cyfko.relayql.core.utils;

import java.util.function.Function;

/**
 * Outcome of a non-throwing check: valid, or invalid with a message.
 * <p>
 * Used where several checks are chained and only the first failure matters:
 * </p>
 * <pre>{@code
 * ValidationResult result = checkTarget(field).and(() -> checkMappedBy(field));
 * result.orThrow(ResourceDefinitionException::new);
 * }</pre>
 *
 * @param valid        whether the check passed
 * @param errorMessage failure message, {@code null} when valid
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ValidationResult(boolean valid, String errorMessage) {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null);

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(String format, Object... args) {
        return new ValidationResult(false, args.length == 0 ? format : String.format(format, args));
    }

    /**
     * @param next check run only when this one passed
     * @return this result if invalid, otherwise the result of {@code next}
     */
    public ValidationResult and(java.util.function.Supplier<ValidationResult> next) {
        return valid ? next.get() : this;
    }

    /**
     * Throws the exception built from the error message when invalid.
     */
    public <X extends RuntimeException> void orThrow(Function<String, X> exceptionFactory) {
        if (!valid) {
            throw exceptionFactory.apply(errorMessage);
        }
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, error=" + errorMessage + "]";
    }
}
