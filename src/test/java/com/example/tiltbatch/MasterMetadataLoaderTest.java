package com.example.tiltbatch;

import com.example.tiltbatch.metadata.MasterMetadata;
import com.example.tiltbatch.metadata.SourceImage;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MasterMetadataLoaderTest {
    @Test
    void readsColumnsIntoImages() throws Exception {
        Path file = Files.createTempDirectory("master").resolve("proj_master_md.json");
        Files.writeString(file, """
                {
                  "file_paths": ["/raw/proj_002_001.tif", "/raw/proj_001_001.tif", "/raw/proj_001_002.tif"],
                  "ts": [2, 1, 1],
                  "image_idx": [1, 1, 2],
                  "angles": [0.0, -3.0, 3.0],
                  "num_frames": [10, 10, 10],
                  "ds_factor": [1, 1, 1],
                  "frame_dose": [0.3, 0.3, 0.3],
                  "extra_column": ["ignored", "ignored", "ignored"]
                }
                """);

        MasterMetadata master = new MasterMetadataLoader().load(file);
        List<SourceImage> images = master.images();

        assertEquals(List.of(1, 2), List.copyOf(master.knownSeries()));
        assertEquals(3, images.size());
        assertEquals(Path.of("/raw/proj_001_002.tif"), images.get(2).path());
        assertEquals(3.0, images.get(2).tiltAngle());
        assertEquals(10, images.get(0).frameDose().orElseThrow().numFrames());
    }

    @Test
    void rejectsMissingFile() throws Exception {
        Path dir = Files.createTempDirectory("master-missing");

        assertThrows(ConfigurationException.class, () -> new MasterMetadataLoader().load(dir.resolve("absent.json")));
    }

    @Test
    void rejectsMetadataWithoutImages() throws Exception {
        Path file = Files.createTempDirectory("master-empty").resolve("md.json");
        Files.writeString(file, "{\"file_paths\": []}");

        assertThrows(ConfigurationException.class, () -> new MasterMetadataLoader().load(file));
    }

    @Test
    void namesTheMovieWithoutSeriesNumber() throws Exception {
        Path file = Files.createTempDirectory("master-null").resolve("md.json");
        Files.writeString(file, """
                {"file_paths": ["/raw/a.tif", "/raw/b.tif"], "ts": [1, null], "image_idx": [1, 2], "angles": [0.0, 3.0]}
                """);
        MasterMetadata master = new MasterMetadataLoader().load(file);

        DataIntegrityException ex = assertThrows(DataIntegrityException.class, master::images);
        assertEquals("/raw/b.tif", ex.source());
        assertTrue(ex.getMessage().contains("Failed to get tilt series number"));
    }

    @Test
    void rejectsShortDoseColumns() throws Exception {
        Path file = Files.createTempDirectory("master-dose").resolve("md.json");
        Files.writeString(file, """
                {
                  "file_paths": ["/raw/a.tif", "/raw/b.tif"],
                  "ts": [1, 1], "image_idx": [1, 2], "angles": [0.0, 3.0],
                  "num_frames": [10], "ds_factor": [1], "frame_dose": [0.3]
                }
                """);
        MasterMetadata master = new MasterMetadataLoader().load(file);

        DataIntegrityException ex = assertThrows(DataIntegrityException.class, master::images);
        assertEquals("column num_frames", ex.source());
    }

    @Test
    void rejectsSeriesColumnLongerThanFilePaths() throws Exception {
        Path file = Files.createTempDirectory("master-long").resolve("md.json");
        Files.writeString(file, """
                {"file_paths": ["/raw/a.tif"], "ts": [1, 7], "image_idx": [1], "angles": [0.0]}
                """);
        MasterMetadata master = new MasterMetadataLoader().load(file);

        assertEquals(List.of(1), List.copyOf(master.knownSeries()));
        DataIntegrityException ex = assertThrows(DataIntegrityException.class, master::images);
        assertEquals("column ts", ex.source());
    }
}
