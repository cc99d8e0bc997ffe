package com.mnp.stats.report;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mnp.stats.alias.AliasChangeSet;
import com.mnp.stats.alias.AliasStore;
import com.mnp.stats.alias.AliasStoreException;
import com.mnp.stats.alias.MachineEntry;
import com.mnp.stats.archive.RunDiagnostics;
import com.mnp.stats.archive.model.GameRecord;
import com.mnp.stats.archive.model.MatchRecord;
import com.mnp.stats.archive.model.RoundRecord;
import com.mnp.stats.config.ReportSelection;

/**
 * Machine labels used in the selected seasons that the alias store cannot resolve.
 *
 * Writes suggested entries as a change set that {@code update-aliases} accepts.
 * Every match is scanned, finished or not.
 */
public class MissingMachinesReport extends ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(MissingMachinesReport.class);

    private final AliasStore aliasStore;

    public MissingMachinesReport(ReportContext context) {
        this(context, new AliasStore());
    }

    public MissingMachinesReport(ReportContext context, AliasStore aliasStore) {
        super(context);
        this.aliasStore = aliasStore;
    }

    @Override
    public String getName() {
        return "missing-machines";
    }

    @Override
    protected void produce(List<MatchRecord> matches, ReportSelection selection, RunDiagnostics diagnostics,
                           ReportResult.ReportResultBuilder result) {
        Map<String, Integer> missing = findMissing(matches);
        result.matchesProcessed(matches.size()).rowsReported(missing.size());

        if (missing.isEmpty()) {
            log.info("No missing machines found: every machine used in {} resolves", selection.seasonsTitle());
            return;
        }

        log.info("Found {} missing machines:", missing.size());
        List<MachineEntry> suggestions = new ArrayList<>();
        missing.forEach((label, uses) -> {
            MachineEntry entry = suggest(label);
            log.info("  {} -> {} ({} games)", String.format("%-20s", label), entry.getDisplayName(), uses);
            suggestions.add(entry);
        });

        AliasChangeSet changes = AliasChangeSet.builder().newMachines(suggestions).build();
        Path file = context.getOutputDir().resolve("missing_machines_season_" + selection.seasonsCode() + ".json");
        aliasStore.writeChangeSet(changes, file);
        log.info("Suggested entries:{}{}", System.lineSeparator(), changesJson(changes, file));
        log.info("Suggested entries saved to: {}", file);
        log.info("Review them, then apply with: update-aliases --changes {}", file);
        result.outputFile(file);
    }

    private String changesJson(AliasChangeSet changes, Path file) {
        try {
            return aliasStore.toJson(changes);
        } catch (JsonProcessingException e) {
            throw new AliasStoreException(file, "Failed to render change set", e);
        }
    }

    /**
     * Unresolved labels, trimmed and sorted, with the number of games using each.
     */
    Map<String, Integer> findMissing(List<MatchRecord> matches) {
        Map<String, Integer> missing = new TreeMap<>();
        for (MatchRecord match : matches) {
            for (RoundRecord round : match.getRounds()) {
                for (GameRecord game : round.getGames()) {
                    String label = game.getMachine() == null ? "" : game.getMachine().strip();
                    if (label.isEmpty() || context.getResolver().resolve(label).isKnown()) {
                        continue;
                    }
                    missing.merge(label, 1, Integer::sum);
                }
            }
        }
        return missing;
    }

    /**
     * Suggested entry: the official name when {@code machines.json} knows the key,
     * with the lower-cased key and the name as variations.
     */
    MachineEntry suggest(String label) {
        String name = context.getMachineCatalog().officialName(label).orElse(label);
        MachineEntry.MachineEntryBuilder entry = MachineEntry.builder()
                .key(label)
                .name(name)
                .variation(label.toLowerCase(Locale.ROOT));
        if (!name.equalsIgnoreCase(label)) {
            entry.variation(name);
        }
        return entry.build();
    }
}
