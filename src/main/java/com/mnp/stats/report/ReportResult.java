package com.mnp.stats.report;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of one report run.
 */
@Data
@Builder
public class ReportResult {
    private boolean success;
    private String errorMessage;
    private String reportName;
    @Singular
    private List<Path> outputFiles;

    private int matchesProcessed;
    private int gamesCounted;
    private int rowsReported;
    private int skippedGames;
    private int skippedRounds;
    private int warnings;

    public static ReportResult failure(String errorMessage) {
        return ReportResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
