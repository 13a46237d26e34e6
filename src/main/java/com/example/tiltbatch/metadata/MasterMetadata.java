package com.example.tiltbatch.metadata;

import com.example.tiltbatch.DataIntegrityException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Per-movie metadata of a project in column layout. The dose columns are optional and, when
 * present, must match {@code file_paths} in length.
 */
public record MasterMetadata(
        @JsonProperty("file_paths") List<String> filePaths,
        @JsonProperty("ts") List<Integer> seriesIds,
        @JsonProperty("image_idx") List<Integer> imageIndices,
        @JsonProperty("angles") List<Double> angles,
        @JsonProperty("num_frames") List<Integer> numFrames,
        @JsonProperty("ds_factor") List<Integer> dsFactors,
        @JsonProperty("frame_dose") List<Double> frameDoses
) {
    /**
     * Series ids of the listed movies, ignoring rows without one.
     */
    public SortedSet<Integer> knownSeries() {
        SortedSet<Integer> known = new TreeSet<>();
        int rows = filePaths == null ? 0 : filePaths.size();
        for (int row = 0; row < rows; row++) {
            Integer id = cell(seriesIds, row);
            if (id != null) {
                known.add(id);
            }
        }
        return known;
    }

    /**
     * Converts the columns into rows.
     *
     * @throws DataIntegrityException if a column present differs in length from {@code file_paths},
     *                                or a row lacks its series id, image index or tilt angle
     */
    public List<SourceImage> images() throws DataIntegrityException {
        List<String> paths = filePaths == null ? List.of() : filePaths;
        checkLength("ts", seriesIds, paths.size());
        checkLength("image_idx", imageIndices, paths.size());
        checkLength("angles", angles, paths.size());
        checkLength("num_frames", numFrames, paths.size());
        checkLength("ds_factor", dsFactors, paths.size());
        checkLength("frame_dose", frameDoses, paths.size());
        List<SourceImage> images = new ArrayList<>(paths.size());
        for (int row = 0; row < paths.size(); row++) {
            String source = paths.get(row);
            if (source == null || source.isBlank()) {
                throw new DataIntegrityException("row " + row, "Master metadata row has no file path");
            }
            Integer seriesId = cell(seriesIds, row);
            if (seriesId == null) {
                throw new DataIntegrityException(source, "Failed to get tilt series number");
            }
            Integer imageIndex = cell(imageIndices, row);
            if (imageIndex == null) {
                throw new DataIntegrityException(source, "Failed to get image index");
            }
            Double angle = cell(angles, row);
            if (angle == null) {
                throw new DataIntegrityException(source, "Failed to get tilt angle");
            }
            images.add(new SourceImage(Path.of(source), seriesId, imageIndex, angle, frameDose(row)));
        }
        return images;
    }

    private static void checkLength(String name, List<?> column, int rows) throws DataIntegrityException {
        if (column != null && column.size() != rows) {
            throw new DataIntegrityException("column " + name,
                    "Master metadata column has " + column.size() + " value(s) for " + rows + " file path(s)");
        }
    }

    private Optional<FrameDose> frameDose(int row) {
        Integer frames = cell(numFrames, row);
        Integer ds = cell(dsFactors, row);
        Double dose = cell(frameDoses, row);
        if (frames == null || ds == null || dose == null) {
            return Optional.empty();
        }
        return Optional.of(new FrameDose(frames, ds, dose));
    }

    private static <T> T cell(List<T> column, int row) {
        if (column == null || row >= column.size()) {
            return null;
        }
        return column.get(row);
    }
}
