package com.mnp.stats.archive;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Venue metadata from {@code venues.json}: display name, home team and current machines.
 */
public class VenueCatalog {
    private static final Logger log = LoggerFactory.getLogger(VenueCatalog.class);

    public static final String FILE_NAME = "venues.json";

    @Value
    @Builder
    public static class Venue {
        String key;
        String name;
        String homeTeam;
        @Singular
        List<String> machines;
    }

    private final Map<String, Venue> venues;

    public VenueCatalog(Map<String, Venue> venues) {
        this.venues = Collections.unmodifiableMap(new LinkedHashMap<>(venues));
    }

    public static VenueCatalog empty() {
        return new VenueCatalog(Map.of());
    }

    public static VenueCatalog load(Path archiveRoot, ObjectMapper mapper) {
        Path file = archiveRoot.resolve(FILE_NAME);
        Optional<JsonNode> root = ReferenceFiles.readObject(mapper, file);
        if (root.isEmpty()) {
            log.debug("No {} in {}", FILE_NAME, archiveRoot);
            return empty();
        }

        Map<String, Venue> venues = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.get().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            List<String> machines = new ArrayList<>();
            node.path("machines").forEach(m -> {
                if (m.isTextual()) {
                    machines.add(m.asText());
                }
            });
            venues.put(field.getKey(), Venue.builder()
                    .key(field.getKey())
                    .name(node.path("name").asText(field.getKey()))
                    .homeTeam(node.hasNonNull("home_team") ? node.get("home_team").asText() : null)
                    .machines(machines)
                    .build());
        }
        log.debug("Loaded metadata for {} venues from {}", venues.size(), file);
        return new VenueCatalog(venues);
    }

    public Optional<Venue> venue(String key) {
        return Optional.ofNullable(venues.get(key));
    }

    /**
     * Display name of the venue, or the key itself when unknown.
     */
    public String name(String key) {
        return venue(key).map(Venue::getName).orElse(key);
    }

    public List<String> machines(String key) {
        return venue(key).map(Venue::getMachines).orElse(List.of());
    }

    public int size() {
        return venues.size();
    }
}
