package com.example.tiltbatch;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/**
 * One schedulable tool invocation. The expected output path is the join key against the done table.
 *
 * @param seriesId tilt series the item belongs to
 * @param subIndex image index within the series, {@code 0} for per-series stages
 * @param sources  inputs handed to the tool
 * @param output   deterministic output path
 * @param deviceId assigned compute device, {@code null} until assignment
 */
public record WorkItem(
        int seriesId,
        int subIndex,
        List<Path> sources,
        Path output,
        String deviceId
) {
    public static final Comparator<WorkItem> ORDER = Comparator
            .comparingInt(WorkItem::seriesId)
            .thenComparingInt(WorkItem::subIndex);

    public WorkItem {
        sources = List.copyOf(sources);
    }

    public WorkItem(int seriesId, int subIndex, List<Path> sources, Path output) {
        this(seriesId, subIndex, sources, output, null);
    }

    /**
     * Returns a copy of this item bound to the given device.
     */
    public WorkItem withDevice(String device) {
        return new WorkItem(seriesId, subIndex, sources, output, device);
    }

    /**
     * Output path as recorded in the done table.
     */
    public String outputKey() {
        return output.toAbsolutePath().normalize().toString();
    }
}
