package com.example.tiltbatch;

import com.example.tiltbatch.metadata.DoneTable;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetadataStoreTest {
    @Test
    void startsEmptyWithoutACheckpoint() throws Exception {
        Path dir = Files.createTempDirectory("store-empty");

        assertTrue(new MetadataStore(dir.resolve("proj_mc2_mdout.json")).load().isEmpty());
    }

    @Test
    void writesParallelColumns() throws Exception {
        Path dir = Files.createTempDirectory("store-columns");
        MetadataStore store = new MetadataStore(dir.resolve("nested").resolve("proj_mc2_mdout.json"));
        DoneTable table = DoneTable.empty()
                .append(new WorkItem(1, 3, List.of(dir.resolve("a.tif")), dir.resolve("a.mrc")))
                .append(new WorkItem(2, 5, List.of(dir.resolve("b.tif")), dir.resolve("b.mrc")));

        store.save(table);

        JsonNode json = new ObjectMapper().readTree(store.path().toFile());
        assertEquals(2, json.get("output").size());
        assertEquals(List.of(1, 2), List.of(json.get("ts").get(0).asInt(), json.get("ts").get(1).asInt()));
        assertEquals(5, json.get("sub_index").get(1).asInt());
        assertEquals(table, store.load());
        try (var files = Files.list(store.path().getParent())) {
            assertEquals(1L, files.count());
        }
    }

    @Test
    void deduplicatesRowsOnLoad() throws Exception {
        Path dir = Files.createTempDirectory("store-dedupe");
        Path file = dir.resolve("done.json");
        Files.writeString(file, """
                {
                  "output": ["/data/a.mrc", "/data/b.mrc", "/data/a.mrc"],
                  "ts": [1, 2, 1],
                  "sub_index": [0, 0, 0],
                  "sources": [["/raw/a.tif"], ["/raw/b.tif"], ["/raw/a.tif"]]
                }
                """);

        DoneTable table = new MetadataStore(file).load();

        assertEquals(2, table.size());
        assertEquals(List.of(1, 2), new ArrayList<>(table.seriesIds()));
    }

    @Test
    void rejectsColumnsOfDifferentLengths() throws Exception {
        Path dir = Files.createTempDirectory("store-corrupt");
        Path file = dir.resolve("done.json");
        Files.writeString(file, "{\"output\": [\"/data/a.mrc\"], \"ts\": [], \"sub_index\": [0]}");

        assertThrows(ConfigurationException.class, () -> new MetadataStore(file).load());
    }

    @Test
    void rejectsTruncatedCheckpoint() throws Exception {
        Path dir = Files.createTempDirectory("store-truncated");
        Path file = dir.resolve("done.json");
        Files.writeString(file, "{\"output\": [\"/data/a.mrc\"");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> new MetadataStore(file).load());
        assertTrue(ex.getMessage().contains(file.toString()));
    }

    @Test
    void reportsEveryCheckpointToTheMirror() throws Exception {
        Path dir = Files.createTempDirectory("store-sync");
        List<Path> synced = new ArrayList<>();
        MetadataStore store = new MetadataStore(dir.resolve("done.json"), synced::add);

        store.save(DoneTable.empty());
        store.save(DoneTable.empty().append(new WorkItem(1, 0, List.of(), dir.resolve("a.mrc"))));

        assertEquals(List.of(store.path(), store.path()), synced);
    }
}
