package com.example.tiltbatch;

/**
 * The identity of a work item cannot be derived from its source metadata.
 */
public class DataIntegrityException extends PipelineException {
    private static final long serialVersionUID = 1L;

    private final String source;

    public DataIntegrityException(String source, String message) {
        super(message + " (source: " + source + ")");
        this.source = source;
    }

    /**
     * Returns the offending source path as recorded in the metadata.
     */
    public String source() {
        return source;
    }
}
