package com.example.tiltbatch;

/**
 * Exit status and captured streams of one finished tool invocation.
 */
public record CommandResult(
        int exitCode,
        String stdout,
        String stderr
) {
    /**
     * A result counts as failed on a non-zero exit or on any error stream output, even after a
     * zero exit.
     */
    public boolean failed() {
        return exitCode != 0 || !stderr.isEmpty();
    }
}
