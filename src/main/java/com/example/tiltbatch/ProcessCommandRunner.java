package com.example.tiltbatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs commands as OS processes. Both streams are drained on daemon threads while the process runs.
 */
public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final Path workingDirectory;

    /**
     * @param workingDirectory directory the tools start in, or {@code null} for the current one
     */
    public ProcessCommandRunner(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    @Override
    public RunningCommand start(List<String> command) throws IOException {
        LOGGER.debug("Running external command: {}", command);
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        Process process = builder.start();
        process.getOutputStream().close();
        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        return () -> {
            int exitCode = process.waitFor();
            return new CommandResult(exitCode, join(stdout), join(stderr));
        };
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                in.transferTo(buffer);
                return buffer.toString(StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        }, runnable -> {
            Thread thread = new Thread(runnable, "process-stream-drain");
            thread.setDaemon(true);
            thread.start();
        });
    }

    private static String join(CompletableFuture<String> stream) throws IOException, InterruptedException {
        try {
            return stream.get();
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof UncheckedIOException io) {
                throw io.getCause();
            }
            throw new IOException("Failed to capture process output", ex.getCause());
        }
    }
}
