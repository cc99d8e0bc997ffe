package com.mnp.stats.alias;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mnp.stats.util.FileWriteUtil;

/**
 * Reads and writes the machine alias store ({@code machine_variations.json}).
 */
public class AliasStore {
    private static final Logger log = LoggerFactory.getLogger(AliasStore.class);

    private static final String NEW_MACHINES = "new_machines";
    private static final String ADD_VARIATIONS = "add_variations";

    private final ObjectMapper mapper;

    public AliasStore() {
        this(new ObjectMapper());
    }

    public AliasStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Loads the store.
     *
     * @throws AliasStoreException if the file is missing, unreadable or not a JSON object
     */
    public AliasDocument load(Path path) {
        JsonNode root = readTree(path, "Alias store not found", "Malformed alias store");
        if (!root.isObject()) {
            throw new AliasStoreException(path, "Alias store must be a JSON object", null);
        }
        AliasDocument document = new AliasDocument((ObjectNode) root);
        log.info("Loaded machine variations for {} machines from {}", document.size(), path);
        return document;
    }

    public AliasIndex loadIndex(Path path) {
        return load(path).toIndex();
    }

    /**
     * Writes the store back with a trailing newline.
     */
    public void save(AliasDocument document, Path path) {
        try {
            String json = mapper.writer(new AliasStorePrettyPrinter()).writeValueAsString(document.getRoot());
            FileWriteUtil.safeWriteString(path, json + "\n");
            log.info("Saved {} machines to {}", document.size(), path);
        } catch (IOException e) {
            throw new AliasStoreException(path, "Failed to write alias store", e);
        }
    }

    /**
     * Reads a change set file of the form
     * {@code {"new_machines": {key: entry}, "add_variations": {key: [variation, ...]}}}.
     */
    public AliasChangeSet readChangeSet(Path path) {
        JsonNode root = readTree(path, "Change set not found", "Malformed change set");
        if (!root.isObject()) {
            throw new AliasStoreException(path, "Change set must be a JSON object", null);
        }

        AliasChangeSet.AliasChangeSetBuilder builder = AliasChangeSet.builder();

        JsonNode newMachines = root.path(NEW_MACHINES);
        if (newMachines.isObject()) {
            AliasDocument additions = new AliasDocument((ObjectNode) newMachines);
            additions.entries().forEach(builder::newMachine);
        }

        JsonNode addVariations = root.path(ADD_VARIATIONS);
        if (addVariations.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = addVariations.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                List<String> variations = new ArrayList<>();
                field.getValue().forEach(v -> {
                    if (v.isTextual()) {
                        variations.add(v.asText());
                    }
                });
                builder.addVariation(field.getKey(), variations);
            }
        }
        return builder.build();
    }

    /**
     * Writes a change set in the shape {@link #readChangeSet(Path)} accepts.
     */
    public void writeChangeSet(AliasChangeSet changes, Path path) {
        try {
            FileWriteUtil.safeWriteString(path, toJson(changes) + "\n");
        } catch (IOException e) {
            throw new AliasStoreException(path, "Failed to write change set", e);
        }
    }

    /**
     * The change set as pretty-printed JSON, in the layout of the store.
     */
    public String toJson(AliasChangeSet changes) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        AliasDocument additions = new AliasDocument(root.putObject(NEW_MACHINES));
        changes.getNewMachines().forEach(additions::putEntry);
        ObjectNode addVariations = root.putObject(ADD_VARIATIONS);
        changes.getAddVariations().forEach((key, variations) -> {
            ArrayNode array = addVariations.putArray(key);
            variations.forEach(array::add);
        });
        return mapper.writer(new AliasStorePrettyPrinter()).writeValueAsString(root);
    }

    private JsonNode readTree(Path path, String missingMessage, String malformedMessage) {
        try {
            return mapper.readTree(Files.readString(path));
        } catch (NoSuchFileException e) {
            throw new AliasStoreException(path, missingMessage, e);
        } catch (JsonProcessingException e) {
            throw new AliasStoreException(path, malformedMessage, e);
        } catch (IOException e) {
            throw new AliasStoreException(path, "Failed to read", e);
        }
    }
}
