package com.mnp.stats.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the optional reference files at the archive root.
 */
final class ReferenceFiles {

    private ReferenceFiles() {
        // Utility class
    }

    /**
     * The JSON object in {@code file}, or empty when the file does not exist.
     *
     * @throws ArchiveLoadException if the file exists but is unreadable or not a JSON object
     */
    static Optional<JsonNode> readObject(ObjectMapper mapper, Path file) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(file));
        } catch (JsonProcessingException e) {
            throw new ArchiveLoadException(file, "Malformed reference file", e);
        } catch (IOException e) {
            throw new ArchiveLoadException(file, "Failed to read reference file", e);
        }
        if (root == null || !root.isObject()) {
            throw new ArchiveLoadException(file, "Reference file must be a JSON object", null);
        }
        return Optional.of(root);
    }
}
