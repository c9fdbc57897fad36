package org.ckbtextify.api;

/**
 * Thrown when a {@link NormalizationConfig} cannot be built from the given values.
 * <p>
 * This is the only failure a caller of the normalizer can observe, and it is raised at
 * construction time, never while text is being normalized.
 */
public class InvalidConfigurationException extends RuntimeException {

    /**
     * Constructs a new exception with the specified detail message.
     * @param message The detail message.
     */
    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
