package com.example.tiltbatch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Stands in for the external tools: writes the expected output when a launch is harvested, unless
 * told to fail or to stay silent for that output.
 */
final class FakeCommandRunner implements CommandRunner {
    final List<String> events = new ArrayList<>();
    final List<List<String>> launched = new ArrayList<>();
    private final Map<Path, CommandResult> failures = new HashMap<>();
    private final Set<Path> silent = new HashSet<>();
    private final Set<Path> unstartable = new HashSet<>();
    private Consumer<Path> beforeHarvest = output -> {
    };

    void failOn(Path output, CommandResult result) {
        failures.put(output.toAbsolutePath().normalize(), result);
    }

    void succeedWithoutOutput(Path output) {
        silent.add(output.toAbsolutePath().normalize());
    }

    void refuseToStart(Path output) {
        unstartable.add(output.toAbsolutePath().normalize());
    }

    void beforeHarvest(Consumer<Path> hook) {
        beforeHarvest = hook;
    }

    @Override
    public RunningCommand start(List<String> command) throws IOException {
        Path output = outputOf(command).toAbsolutePath().normalize();
        if (unstartable.contains(output)) {
            throw new IOException("No such file or directory");
        }
        launched.add(List.copyOf(command));
        events.add("start " + output.getFileName());
        return () -> {
            beforeHarvest.accept(output);
            events.add("harvest " + output.getFileName());
            CommandResult failure = failures.get(output);
            if (failure != null) {
                return failure;
            }
            if (!silent.contains(output)) {
                Files.createDirectories(output.getParent());
                Files.writeString(output, "done");
            }
            return new CommandResult(0, "finished", "");
        };
    }

    /**
     * Finds the output a tool command line would write.
     */
    static Path outputOf(List<String> command) {
        for (String flag : List.of("-OutMrc", "-output")) {
            int index = command.indexOf(flag);
            if (index >= 0) {
                return Path.of(command.get(index + 1));
            }
        }
        int root = command.indexOf("-RootName");
        int location = command.indexOf("-CurrentLocation");
        if (root >= 0 && location >= 0) {
            return Path.of(command.get(location + 1)).resolve(command.get(root + 1) + "_ali.mrc");
        }
        throw new IllegalArgumentException("No output in " + command);
    }
}
