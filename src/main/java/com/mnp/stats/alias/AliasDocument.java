package com.mnp.stats.alias;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The alias store as a JSON tree.
 *
 * Edits touch only the nodes they change, so keys keep their insertion order
 * and entries nobody edited are written back exactly as they were read,
 * including fields this tool does not model.
 */
public class AliasDocument {
    private static final Logger log = LoggerFactory.getLogger(AliasDocument.class);

    static final String NAME = "name";
    static final String MANUFACTURER = "manufacturer";
    static final String YEAR = "year";
    static final String VARIATIONS = "variations";

    private final ObjectNode root;

    public AliasDocument(ObjectNode root) {
        this.root = root;
    }

    ObjectNode getRoot() {
        return root;
    }

    public boolean containsKey(String key) {
        return root.has(key);
    }

    public int size() {
        return root.size();
    }

    /**
     * Entries in store order. Non-object values are skipped.
     */
    public List<MachineEntry> entries() {
        List<MachineEntry> entries = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isObject()) {
                log.warn("Alias store entry '{}' is not an object, skipped", field.getKey());
                continue;
            }
            entries.add(toEntry(field.getKey(), field.getValue()));
        }
        return entries;
    }

    public Optional<MachineEntry> entry(String key) {
        JsonNode node = root.get(key);
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        return Optional.of(toEntry(key, node));
    }

    public AliasIndex toIndex() {
        return AliasIndex.build(entries());
    }

    /**
     * Appends a new entry at the end of the store.
     */
    public void putEntry(MachineEntry entry) {
        ObjectNode node = root.putObject(entry.getKey());
        node.put(NAME, entry.getDisplayName());
        entry.getManufacturerOptional().ifPresent(m -> node.put(MANUFACTURER, m));
        entry.getYearOptional().ifPresent(y -> node.put(YEAR, y));
        ArrayNode variations = node.putArray(VARIATIONS);
        entry.getVariations().forEach(variations::add);
    }

    /**
     * Appends a variation to an existing entry, creating its variation list if absent.
     */
    public void appendVariation(String key, String variation) {
        JsonNode node = root.get(key);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("No alias entry for key: " + key);
        }
        ObjectNode entry = (ObjectNode) node;
        JsonNode variations = entry.get(VARIATIONS);
        if (variations == null || !variations.isArray()) {
            variations = entry.putArray(VARIATIONS);
        }
        ((ArrayNode) variations).add(variation);
    }

    private static MachineEntry toEntry(String key, JsonNode node) {
        MachineEntry.MachineEntryBuilder builder = MachineEntry.builder()
                .key(key)
                .name(textOrNull(node.get(NAME)))
                .manufacturer(textOrNull(node.get(MANUFACTURER)));

        JsonNode year = node.get(YEAR);
        if (year != null && year.canConvertToInt() && year.asInt() > 0) {
            builder.year(year.asInt());
        }

        JsonNode variations = node.get(VARIATIONS);
        if (variations != null && variations.isArray()) {
            for (JsonNode v : variations) {
                if (v.isTextual()) {
                    builder.variation(v.asText());
                }
            }
        }
        return builder.build();
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) return null;
        String text = node.asText();
        return text.isEmpty() ? null : text;
    }
}
