package com.repoforensics.core.config;

/**
 * Thrown when the analysis configuration is unusable, for example when the weight vector
 * does not sum to 1.0.
 *
 * <p>Configuration errors are fatal. They are raised before any input is loaded or any
 * developer state is touched.
 */
public class ConfigurationException extends RuntimeException {

    /**
     * Creates a configuration exception.
     *
     * @param message description of the problem
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates a configuration exception with a cause.
     *
     * @param message description of the problem
     * @param cause underlying error
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
