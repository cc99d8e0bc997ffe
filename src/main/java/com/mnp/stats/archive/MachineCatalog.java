package com.mnp.stats.archive;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Official machine names from {@code machines.json}.
 */
public class MachineCatalog {
    private static final Logger log = LoggerFactory.getLogger(MachineCatalog.class);

    public static final String FILE_NAME = "machines.json";

    private final Map<String, String> names;

    public MachineCatalog(Map<String, String> names) {
        this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
    }

    public static MachineCatalog empty() {
        return new MachineCatalog(Map.of());
    }

    public static MachineCatalog load(Path archiveRoot, ObjectMapper mapper) {
        Path file = archiveRoot.resolve(FILE_NAME);
        Optional<JsonNode> root = ReferenceFiles.readObject(mapper, file);
        if (root.isEmpty()) {
            log.warn("{} not found in {}", FILE_NAME, archiveRoot);
            return empty();
        }
        Map<String, String> names = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.get().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode info = field.getValue();
            names.put(field.getKey(), info.isObject() ? info.path("name").asText(field.getKey()) : field.getKey());
        }
        return new MachineCatalog(names);
    }

    public Optional<String> officialName(String key) {
        return Optional.ofNullable(names.get(key));
    }

    public int size() {
        return names.size();
    }
}
