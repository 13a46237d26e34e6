package com.example.tiltbatch;

import java.nio.file.Path;

/**
 * Copies done tables somewhere outside the work directory. {@link #checkpointSaved(Path)} is called
 * each time a table file was moved into place and must not throw: the local file is the record of
 * progress, the copy is not.
 */
@FunctionalInterface
public interface CheckpointMirror extends AutoCloseable {
    CheckpointMirror NONE = table -> {
    };

    void checkpointSaved(Path table);

    /**
     * Publishes the latest state of every table still outstanding.
     */
    @Override
    default void close() {
    }
}
