package com.example.tiltbatch;

import com.example.tiltbatch.metadata.DoneTable;
import com.example.tiltbatch.metadata.DoneTableDocument;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Persists one stage's done table to a single JSON file. Every save rewrites the whole table.
 */
public final class MetadataStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataStore.class);

    private final ObjectMapper mapper;
    private final Path tablePath;
    private final CheckpointMirror mirror;

    public MetadataStore(Path tablePath) {
        this(tablePath, CheckpointMirror.NONE);
    }

    public MetadataStore(Path tablePath, CheckpointMirror mirror) {
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.tablePath = tablePath;
        this.mirror = mirror == null ? CheckpointMirror.NONE : mirror;
    }

    /**
     * Returns the persisted table, deduplicated, or an empty table if none was written yet.
     *
     * @throws ConfigurationException if the file is not a readable done table
     */
    public DoneTable load() throws IOException, ConfigurationException {
        if (!Files.exists(tablePath)) {
            return DoneTable.empty();
        }
        try (Reader reader = Files.newBufferedReader(tablePath)) {
            DoneTableDocument document = mapper.readValue(reader, DoneTableDocument.class);
            return document == null ? DoneTable.empty() : DoneTable.of(document.toRecords());
        } catch (JacksonException ex) {
            throw new ConfigurationException("Done table " + tablePath + " is not valid JSON: " + ex.getOriginalMessage(), ex);
        } catch (IllegalStateException ex) {
            throw new ConfigurationException("Done table " + tablePath + " is corrupt: " + ex.getMessage(), ex);
        }
    }

    /**
     * Writes the table next to its final location and moves it into place, so a crash mid-write
     * leaves the previous checkpoint intact.
     */
    public void save(DoneTable table) throws IOException {
        Path parent = tablePath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, tablePath.getFileName().toString(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), DoneTableDocument.from(table));
            try {
                Files.move(temp, tablePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, tablePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        LOGGER.debug("Checkpointed {} done rows to {}", table.size(), tablePath);
        mirror.checkpointSaved(tablePath);
    }

    /**
     * Exposes the underlying table file path.
     */
    public Path path() {
        return tablePath;
    }
}
