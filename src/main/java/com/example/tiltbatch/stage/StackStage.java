package com.example.tiltbatch.stage;

import com.example.tiltbatch.DataIntegrityException;
import com.example.tiltbatch.ScopeSpecification;
import com.example.tiltbatch.WorkItem;
import com.example.tiltbatch.metadata.DoneRecord;
import com.example.tiltbatch.metadata.DoneTable;
import com.example.tiltbatch.metadata.MasterMetadata;
import com.example.tiltbatch.metadata.SourceImage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds one tilt stack per series from its motion-corrected images with IMOD newstack. Images
 * are stacked in ascending tilt angle order.
 */
public final class StackStage implements Stage {
    private final MasterMetadata master;
    private final String executable;
    private final SeriesLayout layout;
    private final Map<Integer, List<Double>> sortedAngles = new HashMap<>();

    public StackStage(MasterMetadata master, String executable, SeriesLayout layout) {
        this.master = master;
        this.executable = executable;
        this.layout = layout;
    }

    @Override
    public String name() {
        return "stack";
    }

    @Override
    public String tableSuffix() {
        return "stack";
    }

    @Override
    public List<WorkItem> candidates(ScopeSpecification scope, DoneTable upstream) throws DataIntegrityException {
        Map<String, Double> angles = new HashMap<>();
        for (SourceImage image : master.images()) {
            angles.put(image.seriesId() + "/" + image.imageIndex(), image.tiltAngle());
        }

        sortedAngles.clear();
        List<WorkItem> candidates = new ArrayList<>();
        for (int seriesId : upstream.seriesIds()) {
            if (!scope.contains(seriesId)) {
                continue;
            }
            List<AngledImage> images = new ArrayList<>();
            for (DoneRecord record : upstream.recordsForSeries(seriesId)) {
                Double angle = angles.get(seriesId + "/" + record.subIndex());
                if (angle == null) {
                    throw new DataIntegrityException(record.output(), "No tilt angle recorded for series "
                            + seriesId + " image " + record.subIndex());
                }
                images.add(new AngledImage(record.outputPath(), angle));
            }
            images.sort(Comparator.comparingDouble(AngledImage::angle));
            sortedAngles.put(seriesId, images.stream().map(AngledImage::angle).toList());
            candidates.add(new WorkItem(
                    seriesId,
                    0,
                    images.stream().map(AngledImage::path).toList(),
                    layout.stackFile(seriesId)
            ));
        }
        return candidates;
    }

    @Override
    public List<String> command(WorkItem item) throws IOException {
        List<Double> angles = sortedAngles.get(item.seriesId());
        if (angles == null) {
            throw new IllegalStateException("Series " + item.seriesId() + " was not prepared for stacking");
        }
        Files.createDirectories(layout.seriesFolder(item.seriesId()));

        Path rawtlt = layout.seriesFile(item.seriesId(), ".rawtlt");
        Files.writeString(rawtlt, angles.stream().map(String::valueOf).collect(Collectors.joining("\n")) + "\n");

        Path fileInList = layout.seriesFile(item.seriesId(), "_sources.txt");
        Files.writeString(fileInList, fileInList(item.sources()));

        return List.of(
                executable,
                "-fileinlist", fileInList.toString(),
                "-output", item.output().toString()
        );
    }

    /**
     * newstack file-in list: image count, then each file followed by its section list ({@code 0}).
     */
    static String fileInList(List<Path> sources) {
        StringBuilder builder = new StringBuilder().append(sources.size()).append('\n');
        for (Path source : sources) {
            builder.append(source).append('\n').append("0\n");
        }
        return builder.toString();
    }

    private record AngledImage(Path path, double angle) {
    }
}
