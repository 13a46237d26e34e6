package com.example.tiltbatch.metadata;

import java.nio.file.Path;
import java.util.Optional;

/**
 * A raw movie with the identity fields read from the master metadata.
 */
public record SourceImage(
        Path path,
        int seriesId,
        int imageIndex,
        double tiltAngle,
        Optional<FrameDose> frameDose
) {
}
