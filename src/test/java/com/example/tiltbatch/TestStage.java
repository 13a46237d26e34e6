package com.example.tiltbatch;

import com.example.tiltbatch.metadata.DoneTable;
import com.example.tiltbatch.stage.Stage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One item per series, writing {@code series_<id>.out} under a directory.
 */
final class TestStage implements Stage {
    private final Path directory;
    private final List<Integer> series;
    private final Set<Integer> unpreparable = new HashSet<>();

    TestStage(Path directory, List<Integer> series) {
        this.directory = directory;
        this.series = series;
    }

    void failToPrepare(int seriesId) {
        unpreparable.add(seriesId);
    }

    Path outputFor(int seriesId) {
        return directory.resolve("series_" + seriesId + ".out");
    }

    WorkItem item(int seriesId) {
        return new WorkItem(seriesId, 0, List.of(directory.resolve("series_" + seriesId + ".in")), outputFor(seriesId));
    }

    @Override
    public String name() {
        return "test";
    }

    @Override
    public String tableSuffix() {
        return "test";
    }

    @Override
    public List<WorkItem> candidates(ScopeSpecification scope, DoneTable upstream) {
        List<WorkItem> items = new ArrayList<>();
        for (int id : series) {
            if (scope.contains(id)) {
                items.add(item(id));
            }
        }
        return items;
    }

    @Override
    public List<String> command(WorkItem item) throws IOException {
        if (unpreparable.contains(item.seriesId())) {
            throw new IOException("No space left on device");
        }
        return List.of("tool", "-input", item.sources().get(0).toString(),
                "-output", item.output().toString(), "-device", item.deviceId());
    }
}
