package com.example.tiltbatch;

/**
 * A required config file or persisted table is absent or invalid.
 */
public class ConfigurationException extends PipelineException {
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
