package com.example.tiltbatch.stage;

import com.example.tiltbatch.DataIntegrityException;
import com.example.tiltbatch.ScopeSpecification;
import com.example.tiltbatch.WorkItem;
import com.example.tiltbatch.metadata.DoneTable;
import com.example.tiltbatch.metadata.FrameDose;
import com.example.tiltbatch.metadata.MasterMetadata;
import com.example.tiltbatch.metadata.SourceImage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Motion correction of every raw movie with MotionCor2, one item per movie.
 */
public final class MotionCorrStage implements Stage {
    private final MasterMetadata master;
    private final MotionCorrSettings settings;
    private final Map<String, SourceImage> imagesByKey = new HashMap<>();

    public MotionCorrStage(MasterMetadata master, MotionCorrSettings settings) {
        this.master = master;
        this.settings = settings;
    }

    @Override
    public String name() {
        return "motioncorr";
    }

    @Override
    public String tableSuffix() {
        return "mc2";
    }

    @Override
    public List<WorkItem> candidates(ScopeSpecification scope, DoneTable upstream) throws DataIntegrityException {
        imagesByKey.clear();
        List<WorkItem> candidates = new ArrayList<>();
        for (SourceImage image : master.images()) {
            String key = key(image.seriesId(), image.imageIndex());
            SourceImage previous = imagesByKey.putIfAbsent(key, image);
            if (previous != null) {
                throw new DataIntegrityException(image.path().toString(),
                        "Series " + image.seriesId() + " image " + image.imageIndex() + " is also listed for " + previous.path());
            }
            if (scope.contains(image.seriesId())) {
                candidates.add(new WorkItem(image.seriesId(), image.imageIndex(), List.of(image.path()), outputFor(image)));
            }
        }
        return candidates;
    }

    @Override
    public List<String> command(WorkItem item) throws IOException {
        SourceImage image = imagesByKey.get(key(item.seriesId(), item.subIndex()));
        if (image == null) {
            throw new IllegalStateException("No source image for series " + item.seriesId() + " image " + item.subIndex());
        }
        Files.createDirectories(settings.outputDirectory());

        List<String> command = new ArrayList<>(List.of(
                settings.executable(),
                "-" + inputFlag(), item.sources().get(0).toString(),
                "-OutMrc", item.output().toString(),
                "-Gpu", item.deviceId(),
                "-GpuMemUsage", String.valueOf(settings.gpuMemoryUsage()),
                "-Gain", settings.gainReference(),
                "-Tol", String.valueOf(settings.tolerance()),
                "-Patch", settings.patchSize().stream().map(String::valueOf).collect(Collectors.joining(",")),
                "-Iter", String.valueOf(settings.maxIterations()),
                "-Group", settings.useSubgroups() ? "1" : "0",
                "-FtBin", String.valueOf(settings.desiredPixelSize() / settings.pixelSize()),
                "-PixSize", String.valueOf(settings.pixelSize()),
                "-Throw", String.valueOf(settings.discardFramesTop()),
                "-Trunc", String.valueOf(settings.discardFramesBottom())
        ));
        Optional<FrameDose> frameDose = image.frameDose();
        if (frameDose.isPresent()) {
            Path integrationFile = integrationFileFor(item.output());
            FrameDose dose = frameDose.get();
            Files.writeString(integrationFile, dose.numFrames() + " " + dose.dsFactor() + " " + dose.dosePerFrame());
            command.add("-FmIntFile");
            command.add(integrationFile.toString());
        }
        return command;
    }

    Path outputFor(SourceImage image) {
        String name = String.format("%s_%03d_%s.mrc", settings.outputPrefix(), image.seriesId(), image.tiltAngle());
        return settings.outputDirectory().resolve(name);
    }

    static Path integrationFileFor(Path output) {
        return output.resolveSibling(output.getFileName() + ".fmint.txt");
    }

    private String inputFlag() {
        String type = settings.inputFileType();
        String flag = "In" + Character.toUpperCase(type.charAt(0)) + type.substring(1);
        return type.equals("tif") ? flag + "f" : flag;
    }

    private static String key(int seriesId, int imageIndex) {
        return seriesId + "/" + imageIndex;
    }
}
