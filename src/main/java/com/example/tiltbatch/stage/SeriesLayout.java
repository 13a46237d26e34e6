package com.example.tiltbatch.stage;

import java.nio.file.Path;

/**
 * Where the per-series stack and alignment files live:
 * {@code <outputDirectory>/<rootName>_<ts><suffix>/<rootName>_<ts><suffix>.<ext>}, with the
 * series id zero-padded to two digits.
 */
public record SeriesLayout(
        Path outputDirectory,
        String rootName,
        String suffix
) {
    public String rootFor(int seriesId) {
        return String.format("%s_%02d", rootName, seriesId);
    }

    public String seriesName(int seriesId) {
        return rootFor(seriesId) + suffix;
    }

    public Path seriesFolder(int seriesId) {
        return outputDirectory.resolve(seriesName(seriesId));
    }

    public Path seriesFile(int seriesId, String nameSuffix) {
        return seriesFolder(seriesId).resolve(seriesName(seriesId) + nameSuffix);
    }

    public Path stackFile(int seriesId) {
        return seriesFile(seriesId, ".st");
    }

    public Path alignedFile(int seriesId) {
        return seriesFile(seriesId, "_ali.mrc");
    }
}
