package com.example.tiltbatch;

import java.io.IOException;
import java.util.List;

/**
 * Launches external tools. The only contract with a tool is its exit status and captured streams.
 */
@FunctionalInterface
public interface CommandRunner {
    /**
     * Starts the command without waiting for it.
     */
    RunningCommand start(List<String> command) throws IOException;

    /**
     * Starts the command and blocks until it terminates.
     */
    default CommandResult run(List<String> command) throws IOException, InterruptedException {
        return start(command).await();
    }

    /**
     * Handle of a launched command.
     */
    @FunctionalInterface
    interface RunningCommand {
        /**
         * Blocks until the command terminates. There is no timeout.
         */
        CommandResult await() throws IOException, InterruptedException;
    }
}
