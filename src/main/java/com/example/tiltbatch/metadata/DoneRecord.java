package com.example.tiltbatch.metadata;

import com.example.tiltbatch.WorkItem;

import java.nio.file.Path;
import java.util.List;

/**
 * One completed work item as persisted in a done table.
 */
public record DoneRecord(
        String output,
        int seriesId,
        int subIndex,
        List<String> sources
) {
    public DoneRecord {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static DoneRecord from(WorkItem item) {
        return new DoneRecord(
                item.outputKey(),
                item.seriesId(),
                item.subIndex(),
                item.sources().stream().map(path -> path.toAbsolutePath().normalize().toString()).toList()
        );
    }

    public Path outputPath() {
        return Path.of(output);
    }
}
