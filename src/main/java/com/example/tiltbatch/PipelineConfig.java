package com.example.tiltbatch;

import com.example.tiltbatch.stage.AlignSettings;
import com.example.tiltbatch.stage.MotionCorrSettings;
import com.example.tiltbatch.stage.SeriesLayout;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Immutable runtime settings for a pipeline run.
 */
public record PipelineConfig(
        String projectName,
        Path workDirectory,
        ScopeSpecification scope,
        int jobsPerDevice,
        String deviceQueryExecutable,
        MotionCorrSettings motionCorr,
        String newstackExecutable,
        SeriesLayout seriesLayout,
        AlignSettings align,
        boolean s3SyncEnabled,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
    public Path masterMetadataPath() {
        return workDirectory.resolve(projectName + "_master_md.json");
    }

    public Path doneTablePath(String tableSuffix) {
        return workDirectory.resolve(projectName + "_" + tableSuffix + "_mdout.json");
    }
}
