package com.example.tiltbatch;

import com.example.tiltbatch.metadata.MasterMetadata;
import com.example.tiltbatch.stage.AlignSettings;
import com.example.tiltbatch.stage.MotionCorrSettings;
import com.example.tiltbatch.stage.SeriesLayout;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Settings and metadata for tests that drive the real stages against fake tools.
 */
public final class TestConfigs {
    private TestConfigs() {
    }

    public static PipelineConfig config(Path workDirectory, ScopeSpecification scope) {
        return new PipelineConfig(
                "proj",
                workDirectory,
                scope,
                1,
                "nvidia-smi",
                motionCorr(workDirectory.resolve("motioncor")),
                "newstack",
                layout(workDirectory.resolve("stacks")),
                align(),
                false,
                Optional.empty(),
                Optional.empty(),
                Optional.empty()
        );
    }

    public static MotionCorrSettings motionCorr(Path outputDirectory) {
        return new MotionCorrSettings(
                "MotionCor2",
                outputDirectory,
                "proj",
                "tif",
                "nogain",
                1.1,
                2.2,
                0.5,
                List.of(5, 5, 20),
                10,
                true,
                0,
                0,
                1.0
        );
    }

    public static SeriesLayout layout(Path outputDirectory) {
        return new SeriesLayout(outputDirectory, "proj", "");
    }

    public static AlignSettings align() {
        return new AlignSettings(
                "batchruntomo",
                8,
                true,
                2.2,
                86.0,
                10.0,
                "/usr/local/IMOD/SystemTemplate/cryoSample.adoc",
                4,
                false,
                true,
                4,
                List.of(680, 680),
                List.of(24, 24),
                List.of(2, 2),
                4,
                true,
                1,
                AlignSettings.MagOption.FIXED,
                AlignSettings.TiltOption.FIXED,
                AlignSettings.RotationOption.GROUP,
                AlignSettings.BeamTiltOption.FIXED,
                false,
                true
        );
    }

    /**
     * Master metadata with {@code imagesPerSeries} movies per series at tilt angles descending
     * from {@code +3 * (imagesPerSeries - 1)} in steps of 3 degrees, listed in acquisition order.
     */
    public static MasterMetadata master(Path rawDirectory, List<Integer> series, int imagesPerSeries) {
        List<String> paths = new ArrayList<>();
        List<Integer> ids = new ArrayList<>();
        List<Integer> indices = new ArrayList<>();
        List<Double> angles = new ArrayList<>();
        for (int seriesId : series) {
            for (int index = 1; index <= imagesPerSeries; index++) {
                paths.add(rawDirectory.resolve(String.format("proj_%03d_%03d.tif", seriesId, index)).toString());
                ids.add(seriesId);
                indices.add(index);
                angles.add(3.0 * (imagesPerSeries - index));
            }
        }
        return new MasterMetadata(paths, ids, indices, angles, null, null, null);
    }
}
