package com.mnp.stats.report;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.VenueCatalog;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.archive.model.TeamRecord;
import com.mnp.stats.archive.model.VenueRecord;
import com.mnp.stats.config.ReportSelection;
import com.mnp.stats.util.FileWriteUtil;

import freemarker.template.TemplateException;

/**
 * Loads the selected seasons, lets the concrete report fold them, and writes the Markdown output.
 *
 * Archive load failures propagate as {@link com.mnp.stats.archive.ArchiveLoadException};
 * rendering and write failures are returned as a failed {@link ReportResult}.
 */
public abstract class ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(ReportGenerator.class);

    static final DateTimeFormatter GENERATED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    protected final ReportContext context;

    protected ReportGenerator(ReportContext context) {
        this.context = context;
    }

    public abstract String getName();

    public ReportResult generate(ReportSelection selection) {
        RunDiagnostics diagnostics = new RunDiagnostics();
        try {
            log.info("Generating {} report for {}", getName(), selection.seasonsTitle());
            List<MatchRecord> matches = context.getArchive().loadSeasons(selection.getSeasons());

            ReportResult.ReportResultBuilder result = ReportResult.builder()
                    .success(true)
                    .reportName(getName());
            produce(matches, selection, diagnostics, result);

            return result
                    .skippedGames(diagnostics.getSkippedGames())
                    .skippedRounds(diagnostics.getSkippedRounds())
                    .warnings(diagnostics.getWarnings().size())
                    .build();
        } catch (IOException | TemplateException e) {
            log.error("{} report failed", getName(), e);
            return ReportResult.failure(e.getMessage());
        }
    }

    protected abstract void produce(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
                                    ReportResult.ReportResultBuilder result) throws IOException, TemplateException;

    protected Path write(String fileName, String templateName, Map<String, Object> model)
            throws IOException, TemplateException {
        String content = context.getRenderer().render(templateName, model);
        Path file = context.getOutputDir().resolve(fileName);
        FileWriteUtil.safeWriteString(file, content);
        log.info("Report saved to: {}", file);
        return file;
    }

    protected Map<String, Object> baseModel(ReportSelection selection) {
        Map<String, Object> model = new HashMap<>();
        model.put("generatedOn", LocalDateTime.now(context.getClock()).format(GENERATED_FORMAT));
        model.put("seasonsTitle", selection.seasonsTitle());
        return model;
    }

    /**
     * Team display name as recorded in the matches, or the key.
     */
    protected String teamName(List<MatchRecord> matches, String teamKey) {
        return matches.stream()
                .flatMap(m -> Stream.of(m.getHome(), m.getAway()))
                .filter(Objects::nonNull)
                .filter(t -> teamKey.equals(t.getKey()))
                .map(TeamRecord::getName)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(teamKey);
    }

    /**
     * Venue display name from the venue catalog, then from the matches, else the key.
     */
    protected String venueName(List<MatchRecord> matches, String venueKey) {
        return context.getVenues().venue(venueKey)
                .map(VenueCatalog.Venue::getName)
                .or(() -> matches.stream()
                        .map(MatchRecord::getVenue)
                        .filter(Objects::nonNull)
                        .filter(v -> venueKey.equals(v.getKey()))
                        .map(VenueRecord::getName)
                        .filter(Objects::nonNull)
                        .findFirst())
                .orElse(venueKey);
    }

    protected static boolean atVenue(MatchRecord match, String venueKey) {
        return venueKey == null || (match.getVenue() != null && venueKey.equals(match.getVenue().getKey()));
    }
}
