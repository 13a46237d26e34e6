package com.example.tiltbatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mirrors done tables to S3 from a background thread.
 *
 * <p>Saves are coalesced per table: while an upload is in flight, further saves only mark their
 * table dirty, and the next upload of it reads the file as it is then. Closing the mirror uploads
 * every table still dirty, so the bucket ends with the last checkpoint of each table. A failed
 * upload is logged and not retried; the next save of that table publishes it again.
 */
public final class S3CheckpointMirror implements CheckpointMirror {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3CheckpointMirror.class);

    private final Object lock = new Object();
    private final Set<Path> dirty = new LinkedHashSet<>();
    private final ObjectStore store;
    private final Runnable release;
    private final Path workDirectory;
    private final String bucket;
    private final String prefix;
    private final Thread worker;
    private boolean closed;
    private int saves;
    private int uploads;
    private int failures;

    public S3CheckpointMirror(Path workDirectory, String bucket, String prefix, Optional<String> region) {
        this(workDirectory, bucket, prefix, s3Client(region));
    }

    private S3CheckpointMirror(Path workDirectory, String bucket, String prefix, S3Client client) {
        this(workDirectory, bucket, prefix, (key, content) -> client.putObject(
                PutObjectRequest.builder().bucket(bucket).key(key).contentType("application/json").build(),
                RequestBody.fromBytes(content)), client::close);
    }

    S3CheckpointMirror(Path workDirectory, String bucket, String prefix, ObjectStore store, Runnable release) {
        this.workDirectory = workDirectory.toAbsolutePath().normalize();
        this.bucket = bucket;
        this.prefix = prefix == null ? "" : prefix.replaceAll("/+$", "");
        this.store = store;
        this.release = release;
        this.worker = new Thread(this::run, "checkpoint-s3-mirror");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void checkpointSaved(Path table) {
        synchronized (lock) {
            if (closed) {
                LOGGER.warn("Checkpoint {} saved after the S3 mirror was closed; it will not be uploaded.", table);
                return;
            }
            saves++;
            dirty.add(table.toAbsolutePath().normalize());
            lock.notifyAll();
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            lock.notifyAll();
        }
        try {
            worker.join();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while flushing checkpoints to S3; the latest ones may be missing.", ex);
        } finally {
            release.run();
        }
        LOGGER.info("Mirrored {} checkpoint save(s) to s3://{}/{} in {} upload(s), {} failed.",
                saves, bucket, prefix, uploads, failures);
    }

    /**
     * Object key of a table: its path relative to the work directory under the prefix, or its file
     * name when it lives elsewhere.
     */
    String keyFor(Path table) {
        Path absolute = table.toAbsolutePath().normalize();
        Path relative = absolute.startsWith(workDirectory) ? workDirectory.relativize(absolute) : absolute.getFileName();
        String normalized = relative.toString().replace("\\", "/");
        return prefix.isEmpty() ? normalized : prefix + "/" + normalized;
    }

    private void run() {
        while (true) {
            List<Path> batch;
            synchronized (lock) {
                while (dirty.isEmpty() && !closed) {
                    try {
                        lock.wait();
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                        LOGGER.warn("S3 mirror worker interrupted; {} table(s) left unpublished.", dirty.size());
                        return;
                    }
                }
                if (dirty.isEmpty()) {
                    return;
                }
                batch = new ArrayList<>(dirty);
                dirty.clear();
            }
            batch.forEach(this::upload);
        }
    }

    private void upload(Path table) {
        String key = keyFor(table);
        try {
            store.put(key, Files.readAllBytes(table));
            uploads++;
            LOGGER.debug("Uploaded {} to s3://{}/{}", table, bucket, key);
        } catch (NoSuchFileException ex) {
            LOGGER.warn("Checkpoint {} vanished before it could be uploaded.", table);
        } catch (IOException | SdkException ex) {
            failures++;
            LOGGER.warn("Failed to upload {} to s3://{}/{}", table, bucket, key, ex);
        }
    }

    private static S3Client s3Client(Optional<String> region) {
        return region
                .map(Region::of)
                .map(r -> S3Client.builder().region(r).build())
                .orElseGet(() -> S3Client.builder().build());
    }

    /**
     * Destination of the uploads.
     */
    @FunctionalInterface
    interface ObjectStore {
        void put(String key, byte[] content);
    }
}
