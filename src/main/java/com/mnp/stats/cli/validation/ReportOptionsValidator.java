package com.mnp.stats.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.mnp.stats.cli.exception.OptionsValidationException;
import com.mnp.stats.cli.model.CommonOptions;
import com.mnp.stats.cli.model.ReportRequirement;
import com.mnp.stats.cli.model.SelectionOptions;
import com.mnp.stats.cli.model.ValidatedReportOptions;
import com.mnp.stats.config.ConfigLoadException;
import com.mnp.stats.config.ReportSelection;
import com.mnp.stats.config.SelectionConfigLoader;
import com.mnp.stats.statistics.OutlierFilter;

/**
 * Merges command-line options over the optional config file and checks the result.
 */
public class ReportOptionsValidator {

    private final SelectionConfigLoader configLoader;

    public ReportOptionsValidator() {
        this(new SelectionConfigLoader());
    }

    public ReportOptionsValidator(SelectionConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    public ValidatedReportOptions validate(CommonOptions c, SelectionOptions s, Set<ReportRequirement> requirements) {
        List<String> errors = new ArrayList<>();

        if (!existsDirectory(c.getArchiveDir())) {
            errors.add("Archive directory does not exist or is not a directory: " + c.getArchiveDir());
        }
        if (c.getVariationsFile() == null || !Files.isRegularFile(c.getVariationsFile())) {
            errors.add("Machine variations file does not exist: " + c.getVariationsFile());
        }

        ReportSelection fromConfig = ReportSelection.builder().build();
        if (c.getConfig() != null) {
            if (!Files.isRegularFile(c.getConfig())) {
                errors.add("Config file does not exist: " + c.getConfig());
            } else {
                try {
                    fromConfig = configLoader.load(c.getConfig());
                } catch (ConfigLoadException | IllegalArgumentException e) {
                    errors.add(e.getMessage());
                }
            }
        }

        ReportSelection selection = fromCommandLine(c, s, errors).withDefaults(fromConfig);

        if (selection.getSeasons().isEmpty()) {
            errors.add("At least one season is required (--season / -s or \"season\" in the config).");
        }
        for (Integer season : selection.getSeasons()) {
            if (season == null || season <= 0) {
                errors.add("Season must be a positive number. Got: " + season);
            }
        }
        if (requirements.contains(ReportRequirement.VENUE) && isBlank(selection.getVenue())) {
            errors.add("Venue is required (--venue).");
        }
        if (requirements.contains(ReportRequirement.TEAM) && isBlank(selection.getTeam())) {
            errors.add("Team is required (--team / -t).");
        }
        if (requirements.contains(ReportRequirement.OPPONENT) && isBlank(selection.getOpponent())) {
            errors.add("Opponent team is required (--opponent).");
        }
        if (requirements.contains(ReportRequirement.MACHINES) && selection.getMachines().isEmpty()) {
            errors.add("At least one machine is required (--machine / -m).");
        }
        if (!isBlank(selection.getTeam()) && selection.getTeam().equals(selection.getOpponent())) {
            errors.add("Team and opponent must differ. Got: " + selection.getTeam());
        }
        if (selection.getMinIpr() != null && selection.getMaxIpr() != null
                && selection.getMinIpr() > selection.getMaxIpr()) {
            errors.add("--min-ipr must not exceed --max-ipr. Got: " + selection.getMinIpr() + " > "
                    + selection.getMaxIpr());
        }
        validatePositions("--doubles-positions", selection.getDoublesPositions(), 4, errors);
        validatePositions("--singles-positions", selection.getSinglesPositions(), 2, errors);
        validateOutlierFilter(selection.getOutlierFilter(), errors);

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        Path outputDir = c.getOutputDir().toAbsolutePath().normalize();
        return new ValidatedReportOptions(c.getArchiveDir(), c.getVariationsFile(), outputDir, selection);
    }

    private static ReportSelection fromCommandLine(CommonOptions c, SelectionOptions s, List<String> errors) {
        ReportSelection.ReportSelectionBuilder builder = ReportSelection.builder()
                .venue(s.getVenue())
                .team(s.getTeam())
                .opponent(s.getOpponent())
                .minIpr(s.getMinIpr())
                .maxIpr(s.getMaxIpr())
                .currentMachinesOnly(s.isCurrentMachinesOnly());
        if (c.getSeasons() != null) {
            builder.seasons(c.getSeasons());
        }
        if (s.getMachines() != null) {
            s.getMachines().stream().map(String::trim).filter(m -> !m.isEmpty()).forEach(builder::machine);
        }
        if (s.getDoublesPositions() != null) {
            builder.doublesPositions(s.getDoublesPositions());
        }
        if (s.getSinglesPositions() != null) {
            builder.singlesPositions(s.getSinglesPositions());
        }
        if (s.getOutlierMethod() != null) {
            builder.outlierFilter(outlierFilter(s));
        } else if (s.getIqrMultiplier() != null || s.getLowerPercentile() != null || s.getUpperPercentile() != null
                || s.getMinScore() != null || s.getMaxScore() != null) {
            errors.add("Outlier bounds need an --outlier-method.");
        }
        return builder.build();
    }

    private static OutlierFilter outlierFilter(SelectionOptions s) {
        OutlierFilter.OutlierFilterBuilder builder = OutlierFilter.builder().method(s.getOutlierMethod());
        if (s.getIqrMultiplier() != null) {
            builder.iqrMultiplier(s.getIqrMultiplier());
        }
        if (s.getLowerPercentile() != null) {
            builder.lowerPercentile(s.getLowerPercentile() / 100.0);
        }
        if (s.getUpperPercentile() != null) {
            builder.upperPercentile(s.getUpperPercentile() / 100.0);
        }
        if (s.getMinScore() != null) {
            builder.minScore(s.getMinScore());
        }
        if (s.getMaxScore() != null) {
            builder.maxScore(s.getMaxScore());
        }
        return builder.build();
    }

    private static void validateOutlierFilter(OutlierFilter f, List<String> errors) {
        switch (f.getMethod()) {
            case IQR -> {
                if (f.getIqrMultiplier() <= 0) {
                    errors.add("IQR multiplier must be > 0. Got: " + f.getIqrMultiplier());
                }
            }
            case PERCENTILE -> {
                if (f.getLowerPercentile() < 0 || f.getUpperPercentile() > 1
                        || f.getLowerPercentile() >= f.getUpperPercentile()) {
                    errors.add("Percentile bounds must satisfy 0 <= lower < upper <= 100. Got: "
                            + f.getLowerPercentile() * 100 + ", " + f.getUpperPercentile() * 100);
                }
            }
            case ABSOLUTE -> {
                if (f.getMinScore() > f.getMaxScore()) {
                    errors.add("--min-score must not exceed --max-score. Got: " + f.getMinScore() + " > "
                            + f.getMaxScore());
                }
            }
            case NONE -> {
                // no bounds to check
            }
        }
    }

    private static void validatePositions(String option, List<Integer> positions, int seats, List<String> errors) {
        for (Integer position : positions) {
            if (position == null || position < 1 || position > seats) {
                errors.add(option + " values must be between 1 and " + seats + ". Got: " + position);
            }
        }
    }

    private static boolean existsDirectory(Path p) {
        return p != null && Files.exists(p) && Files.isDirectory(p);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
