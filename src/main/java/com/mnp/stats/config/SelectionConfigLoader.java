package com.mnp.stats.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mnp.stats.statistics.OutlierFilter;

/**
 * Reads a report selection from a JSON config file.
 *
 * Recognised fields:
 * <pre>
 * season            22 | "22" | "21,22" | [21, 22]
 * target_venue      "T4B" | {"key": "T4B"} | {"code": "T4B"}
 * team / team1      "DTP" | {"key": "DTP"}
 * team2 / opponent  "JUP" | {"key": "JUP"}
 * target_machine(s) "MM" | "MM,TZ" | ["MM"] | "auto"
 * current_machines  ["MM", "TZ"]   (implies the current-machines filter)
 * ipr_filter        {"min_ipr": 3, "max_ipr": 5}
 * outlier_filter    {"method": "iqr", "iqr_multiplier": 1.5,
 *                    "lower_percentile": 1, "upper_percentile": 99,
 *                    "min_score": 0, "max_score": 1000000000}
 * score_reliability {"rounds_1_4": {"reliable_positions": [1, 2, 3, 4]},
 *                    "rounds_2_3": {"reliable_positions": [1, 2]}}
 * </pre>
 * Percentile bounds are given on the 0..100 scale.
 */
public class SelectionConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(SelectionConfigLoader.class);

    static final String AUTO = "auto";

    private final ObjectMapper mapper;

    public SelectionConfigLoader() {
        this(new ObjectMapper());
    }

    public SelectionConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ReportSelection load(Path path) {
        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(path));
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException(path, "Malformed config file", e);
        } catch (IOException e) {
            throw new ConfigLoadException(path, "Failed to read config file", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigLoadException(path, "Config file must be a JSON object", null);
        }
        ReportSelection selection;
        try {
            selection = parse(root);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(path, e.getMessage(), e);
        }
        log.debug("Loaded selection from {}: {}", path, selection);
        return selection;
    }

    ReportSelection parse(JsonNode root) {
        ReportSelection.ReportSelectionBuilder builder = ReportSelection.builder();

        for (String season : textList(root.path("season"))) {
            try {
                builder.season(Integer.parseInt(season.replace("'", "").replace("\"", "")));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid season in config: " + season, e);
            }
        }

        builder.venue(key(root.path("target_venue")));
        builder.team(key(root.has("team") ? root.path("team") : root.path("team1")));
        builder.opponent(key(root.has("opponent") ? root.path("opponent") : root.path("team2")));

        JsonNode machines = root.has("target_machines") ? root.path("target_machines") : root.path("target_machine");
        textList(machines).stream()
                .filter(m -> !AUTO.equalsIgnoreCase(m))
                .forEach(builder::machine);

        JsonNode current = root.path("current_machines");
        if (current.isArray() && current.size() > 0) {
            textList(current).forEach(builder::machine);
            builder.currentMachinesOnly(true);
        }

        JsonNode ipr = root.path("ipr_filter");
        if (ipr.isObject()) {
            builder.minIpr(optionalInt(ipr.path("min_ipr")));
            builder.maxIpr(optionalInt(ipr.path("max_ipr")));
        }

        JsonNode reliability = root.path("score_reliability");
        builder.doublesPositions(positions(reliability.path("rounds_1_4"), 4));
        builder.singlesPositions(positions(reliability.path("rounds_2_3"), 2));

        JsonNode outliers = root.path("outlier_filter");
        if (outliers.isObject() && outliers.size() > 0) {
            builder.outlierFilter(parseOutlierFilter(outliers));
        }
        return builder.build();
    }

    OutlierFilter parseOutlierFilter(JsonNode node) {
        String method = node.path("method").asText("iqr").toUpperCase(Locale.ROOT);
        OutlierFilter.OutlierFilterBuilder builder = OutlierFilter.none().toBuilder();
        try {
            builder.method(OutlierFilter.Method.valueOf(method));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown outlier filter method: " + node.path("method").asText(), e);
        }
        if (node.has("iqr_multiplier")) {
            builder.iqrMultiplier(node.get("iqr_multiplier").asDouble());
        }
        if (node.has("lower_percentile")) {
            builder.lowerPercentile(node.get("lower_percentile").asDouble() / 100.0);
        }
        if (node.has("upper_percentile")) {
            builder.upperPercentile(node.get("upper_percentile").asDouble() / 100.0);
        }
        if (node.has("min_score")) {
            builder.minScore(node.get("min_score").asLong());
        }
        if (node.has("max_score")) {
            builder.maxScore(node.get("max_score").asLong());
        }
        return builder.build();
    }

    private static List<Integer> positions(JsonNode rounds, int seats) {
        List<Integer> positions = new ArrayList<>();
        for (String value : textList(rounds.path("reliable_positions"))) {
            int position;
            try {
                position = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid reliable position in config: " + value, e);
            }
            if (position < 1 || position > seats) {
                throw new IllegalArgumentException("Reliable position must be between 1 and " + seats + ". Got: "
                        + position);
            }
            positions.add(position);
        }
        return positions;
    }

    private static String key(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isObject()) {
            JsonNode key = node.has("key") ? node.get("key") : node.get("code");
            return key != null && !key.isNull() ? key.asText() : null;
        }
        return null;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(v -> values.add(v.asText().strip()));
        } else if (node.isTextual()) {
            for (String part : node.asText().split(",")) {
                if (!part.isBlank()) {
                    values.add(part.strip());
                }
            }
        } else if (node.isNumber()) {
            values.add(node.asText());
        }
        return values;
    }

    private static Integer optionalInt(JsonNode node) {
        return node.canConvertToInt() ? node.asInt() : null;
    }
}
