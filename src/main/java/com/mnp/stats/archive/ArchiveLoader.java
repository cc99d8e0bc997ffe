package com.mnp.stats.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mnp.stats.archive.model.MatchRecord;

/**
 * Reads match records from an archive laid out as {@code <root>/season-<N>/matches/*.json}.
 */
public class ArchiveLoader {
    private static final Logger log = LoggerFactory.getLogger(ArchiveLoader.class);

    private final Path archiveRoot;
    private final ObjectMapper mapper;
    private final MatchRecordParser parser = new MatchRecordParser();

    public ArchiveLoader(Path archiveRoot) {
        this(archiveRoot, new ObjectMapper());
    }

    public ArchiveLoader(Path archiveRoot, ObjectMapper mapper) {
        this.archiveRoot = archiveRoot;
        this.mapper = mapper;
    }

    public Path getArchiveRoot() {
        return archiveRoot;
    }

    public Path seasonDirectory(int season) {
        return archiveRoot.resolve("season-" + season).resolve("matches");
    }

    /**
     * Match files of one season sorted by file name. A missing season directory yields no files.
     *
     * @throws ArchiveLoadException if the archive root itself does not exist
     */
    public List<Path> discoverMatchFiles(int season) {
        if (!Files.isDirectory(archiveRoot)) {
            throw new ArchiveLoadException(archiveRoot, "Archive directory not found", null);
        }
        Path dir = seasonDirectory(season);
        if (!Files.isDirectory(dir)) {
            log.warn("No matches directory for season {}: {}", season, dir);
            return List.of();
        }
        try (Stream<Path> stream = Files.walk(dir, 1)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isMatchFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArchiveLoadException(dir, "Failed to list match files", e);
        }
    }

    public List<MatchRecord> loadSeason(int season) {
        List<MatchRecord> matches = new ArrayList<>();
        for (Path file : discoverMatchFiles(season)) {
            matches.add(parser.parse(readTree(file), season));
        }
        log.debug("Loaded {} matches for season {}", matches.size(), season);
        return matches;
    }

    public List<MatchRecord> loadSeasons(Collection<Integer> seasons) {
        List<MatchRecord> matches = new ArrayList<>();
        for (int season : seasons) {
            matches.addAll(loadSeason(season));
        }
        log.info("Loaded {} matches from seasons {}", matches.size(), seasons);
        return matches;
    }

    JsonNode readTree(Path file) {
        try {
            return mapper.readTree(Files.readString(file));
        } catch (JsonProcessingException e) {
            throw new ArchiveLoadException(file, "Malformed match file", e);
        } catch (IOException e) {
            throw new ArchiveLoadException(file, "Failed to read match file", e);
        }
    }

    private boolean isMatchFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
