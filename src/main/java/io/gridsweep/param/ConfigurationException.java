package io.gridsweep.param;

/**
 * Invalid sweep configuration. Raised before any job is dispatched.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
