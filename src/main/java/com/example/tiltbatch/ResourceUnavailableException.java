package com.example.tiltbatch;

/**
 * No compute device is free, or the devices could not be queried at all.
 */
public class ResourceUnavailableException extends PipelineException {
    private static final long serialVersionUID = 1L;

    public ResourceUnavailableException(String message) {
        super(message);
    }

    public ResourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
