package com.example.tiltbatch;

import com.example.tiltbatch.metadata.MasterMetadata;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the per-movie master metadata a project starts from.
 */
public class MasterMetadataLoader {
    private final ObjectMapper mapper;

    public MasterMetadataLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public MasterMetadata load(Path path) throws IOException, ConfigurationException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Master metadata not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path)) {
            MasterMetadata metadata = mapper.readValue(reader, MasterMetadata.class);
            if (metadata == null || metadata.filePaths() == null || metadata.filePaths().isEmpty()) {
                throw new ConfigurationException("Master metadata " + path + " lists no images.");
            }
            return metadata;
        } catch (JacksonException ex) {
            throw new ConfigurationException("Master metadata " + path + " is not valid: " + ex.getOriginalMessage(), ex);
        }
    }
}
