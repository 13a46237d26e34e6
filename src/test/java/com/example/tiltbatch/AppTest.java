package com.example.tiltbatch;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AppTest {
    private static final String CONFIG = """
            {
              "projectName": "proj",
              "motionCorr": { "pixelSize": 1.1 },
              "align": { "adocTemplate": "/opt/IMOD/cryoSample.adoc" }
            }
            """;

    @Test
    void failsWithoutArguments() {
        assertEquals(1, App.execute(new String[0]));
    }

    @Test
    void failsOnMissingConfig() throws Exception {
        Path dir = Files.createTempDirectory("app-missing");

        assertEquals(1, App.execute(new String[]{dir.resolve("config.json").toString()}));
    }

    @Test
    void failsOnUnknownCommand() throws Exception {
        Path config = project("app-command");

        assertEquals(1, App.execute(new String[]{config.toString(), "reconstruct"}));
    }

    @Test
    void cleansAnEmptyProject() throws Exception {
        Path config = project("app-cleanup");

        assertEquals(0, App.execute(new String[]{config.toString(), "cleanup"}));
    }

    @Test
    void unreadableCheckpointEndsTheRunWithFailureStatus() throws Exception {
        Path config = project("app-io");
        Path dir = config.getParent();
        Files.writeString(dir.resolve("proj_master_md.json"), """
                {"file_paths": ["/raw/a.tif"], "ts": [1], "image_idx": [1], "angles": [0.0]}
                """);
        Files.createDirectories(dir.resolve("proj_mc2_mdout.json"));

        assertEquals(1, App.execute(new String[]{config.toString(), "run"}));
    }

    private static Path project(String name) throws Exception {
        Path config = Files.createTempDirectory(name).resolve("config.json");
        Files.writeString(config, CONFIG);
        return config;
    }
}
