package com.example.tiltbatch;

/**
 * Base type for every fatal condition of a pipeline run. None of them is retried; the operator
 * fixes the cause and re-invokes, and reconciliation skips what was already checkpointed.
 */
public class PipelineException extends Exception {
    private static final long serialVersionUID = 1L;

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
