package com.example.tiltbatch;

import com.example.tiltbatch.stage.AlignSettings;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    private static final String MINIMAL = """
            {
              "projectName": "tomo_",
              "motionCorr": { "pixelSize": 1.1 },
              "align": { "adocTemplate": "/opt/IMOD/cryoSample.adoc" }
            }
            """;

    @Test
    void appliesDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-defaults");
        Path file = write(dir, MINIMAL);

        PipelineConfig config = new ConfigLoader().load(file);

        assertEquals("tomo_", config.projectName());
        assertEquals(file.toAbsolutePath().getParent(), config.workDirectory());
        assertTrue(config.scope().isAll());
        assertEquals(1, config.jobsPerDevice());
        assertEquals("nvidia-smi", config.deviceQueryExecutable());
        assertEquals(config.workDirectory().resolve("motioncor"), config.motionCorr().outputDirectory());
        assertEquals(1.1, config.motionCorr().desiredPixelSize());
        assertEquals(List.of(5, 5, 20), config.motionCorr().patchSize());
        assertEquals("tif", config.motionCorr().inputFileType());
        assertEquals("tomo", config.seriesLayout().rootName());
        assertEquals(config.workDirectory().resolve("stacks"), config.seriesLayout().outputDirectory());
        assertEquals("newstack", config.newstackExecutable());
        assertEquals(AlignSettings.RotationOption.GROUP, config.align().rotationOption());
        assertEquals(1.1, config.align().pixelSize());
        assertFalse(config.s3SyncEnabled());
        assertEquals(config.workDirectory().resolve("tomo__mc2_mdout.json"), config.doneTablePath("mc2"));
    }

    @Test
    void readsExplicitSettings() throws Exception {
        Path dir = Files.createTempDirectory("config-explicit");
        Path file = write(dir, """
                {
                  "projectName": "tomo",
                  "workDirectory": "work",
                  "processList": [4, 2, 2],
                  "jobsPerDevice": 2,
                  "motionCorr": {
                    "pixelSize": 0.85, "desiredPixelSize": 1.7, "inputFileType": "EER",
                    "outputDirectory": "/scratch/mc2", "patchSize": [7, 5, 10]
                  },
                  "stack": { "rootName": "lamella", "suffix": "_bin1" },
                  "align": {
                    "adocTemplate": "/opt/IMOD/cryoSample.adoc",
                    "rotationOption": "one", "magOption": "All", "numPatches": [12, 16]
                  }
                }
                """);

        PipelineConfig config = new ConfigLoader().load(file);

        assertEquals(dir.toAbsolutePath().resolve("work"), config.workDirectory());
        assertEquals(ScopeSpecification.of(2, 4), config.scope());
        assertEquals(Optional.of(List.of(2, 4)), config.scope().seriesIds());
        assertEquals(2, config.jobsPerDevice());
        assertEquals("eer", config.motionCorr().inputFileType());
        assertEquals(Path.of("/scratch/mc2"), config.motionCorr().outputDirectory());
        assertEquals(List.of(7, 5, 10), config.motionCorr().patchSize());
        assertEquals("lamella_03_bin1", config.seriesLayout().seriesName(3));
        assertEquals(AlignSettings.RotationOption.ONE, config.align().rotationOption());
        assertEquals(AlignSettings.MagOption.ALL, config.align().magOption());
        assertEquals(List.of(12, 16), config.align().numPatches());
        assertEquals(1.7, config.align().pixelSize());
    }

    @Test
    void rejectsMissingFile() throws Exception {
        Path dir = Files.createTempDirectory("config-missing");

        assertThrows(ConfigurationException.class, () -> new ConfigLoader().load(dir.resolve("absent.json")));
    }

    @Test
    void rejectsMalformedJson() throws Exception {
        Path file = write(Files.createTempDirectory("config-malformed"), "{ \"projectName\": ");

        assertThrows(ConfigurationException.class, () -> new ConfigLoader().load(file));
    }

    @Test
    void rejectsIllegalProjectName() throws Exception {
        Path file = write(Files.createTempDirectory("config-name"), MINIMAL.replace("tomo_", "tomo/1"));

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> new ConfigLoader().load(file));
        assertTrue(ex.getMessage().contains("Illegal character (/)"));
    }

    @Test
    void requiresMotionCorrPixelSize() throws Exception {
        Path file = write(Files.createTempDirectory("config-pixel"), MINIMAL.replace("\"pixelSize\": 1.1", "\"pixelSize\": 0"));

        assertThrows(ConfigurationException.class, () -> new ConfigLoader().load(file));
    }

    @Test
    void rejectsUnknownInputFileType() throws Exception {
        Path file = write(Files.createTempDirectory("config-type"),
                MINIMAL.replace("\"pixelSize\": 1.1", "\"pixelSize\": 1.1, \"inputFileType\": \"dm4\""));

        assertThrows(ConfigurationException.class, () -> new ConfigLoader().load(file));
    }

    @Test
    void rejectsUnknownSolverOption() throws Exception {
        Path file = write(Files.createTempDirectory("config-option"),
                MINIMAL.replace("\"adocTemplate\"", "\"tiltOption\": \"sometimes\", \"adocTemplate\""));

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> new ConfigLoader().load(file));
        assertTrue(ex.getMessage().contains("align.tiltOption"));
    }

    @Test
    void rejectsPatchSizeWithoutTwoValues() throws Exception {
        Path file = write(Files.createTempDirectory("config-pair"),
                MINIMAL.replace("\"adocTemplate\"", "\"patchSize\": [680], \"adocTemplate\""));

        assertThrows(ConfigurationException.class, () -> new ConfigLoader().load(file));
    }

    @Test
    void requiresBucketWhenSyncIsEnabled() throws Exception {
        Path file = write(Files.createTempDirectory("config-s3"),
                MINIMAL.replace("\"projectName\"", "\"s3SyncEnabled\": true, \"projectName\""));

        assertThrows(ConfigurationException.class, () -> new ConfigLoader().load(file));
    }

    private static Path write(Path dir, String json) throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, json);
        return file;
    }
}
