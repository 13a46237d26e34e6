package com.example.tiltbatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Frees disk space once a project is aligned: removes the motion-corrected images and IMOD's
 * intermediary files. Done tables are left as they are.
 */
public final class Cleanup {
    private static final Logger LOGGER = LoggerFactory.getLogger(Cleanup.class);

    private final PipelineConfig config;

    public Cleanup(PipelineConfig config) {
        this.config = config;
    }

    /**
     * Returns the number of files deleted.
     */
    public int run() throws IOException {
        int deleted = 0;
        Path motionCorrOutput = config.motionCorr().outputDirectory();
        if (Files.isDirectory(motionCorrOutput)) {
            LOGGER.info("Deleting {} folder and its contents...", motionCorrOutput);
            deleted += deleteTree(motionCorrOutput);
        }

        Path stacks = config.seriesLayout().outputDirectory();
        if (Files.isDirectory(stacks)) {
            LOGGER.info("Deleting intermediary IMOD files...");
            List<Path> intermediary;
            try (Stream<Path> files = Files.walk(stacks, 2)) {
                intermediary = files.filter(Files::isRegularFile).filter(Cleanup::isIntermediary).toList();
            }
            for (Path file : intermediary) {
                Files.delete(file);
                deleted++;
            }
        }
        LOGGER.info("Cleanup removed {} file(s).", deleted);
        return deleted;
    }

    static boolean isIntermediary(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith("~") || name.contains("_full_rec.");
    }

    private static int deleteTree(Path root) throws IOException {
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(root)) {
            entries = walk.sorted(Comparator.reverseOrder()).toList();
        }
        int files = 0;
        for (Path entry : entries) {
            if (Files.isRegularFile(entry)) {
                files++;
            }
            Files.delete(entry);
        }
        return files;
    }
}
