package com.mnp.stats.report;

import java.nio.file.Path;
import java.time.Clock;

import com.mnp.stats.alias.MachineResolver;
import com.mnp.stats.archive.ArchiveLoader;
import com.mnp.stats.archive.MachineCatalog;
import com.mnp.stats.archive.VenueCatalog;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Collaborators shared by every report of one run.
 */
@Value
@Builder
public class ReportContext {
    @NonNull
    ArchiveLoader archive;
    @NonNull
    MachineResolver resolver;
    @Builder.Default
    VenueCatalog venues = VenueCatalog.empty();
    @Builder.Default
    MachineCatalog machineCatalog = MachineCatalog.empty();
    @Builder.Default
    ReportRenderer renderer = new ReportRenderer();
    @NonNull
    Path outputDir;
    @Builder.Default
    Clock clock = Clock.systemDefaultZone();
}
