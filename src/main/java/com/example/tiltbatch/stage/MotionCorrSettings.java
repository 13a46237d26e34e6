package com.example.tiltbatch.stage;

import java.nio.file.Path;
import java.util.List;

/**
 * MotionCor2 settings.
 */
public record MotionCorrSettings(
        String executable,
        Path outputDirectory,
        String outputPrefix,
        String inputFileType,
        String gainReference,
        double pixelSize,
        double desiredPixelSize,
        double tolerance,
        List<Integer> patchSize,
        int maxIterations,
        boolean useSubgroups,
        int discardFramesTop,
        int discardFramesBottom,
        double gpuMemoryUsage
) {
    public MotionCorrSettings {
        patchSize = List.copyOf(patchSize);
    }
}
