package com.id.spectra.modules.pipeline.service;

import com.id.spectra.model.DatasetMetadata;
import com.id.spectra.model.HeaderInfo;
import com.id.spectra.model.Integration;
import com.id.spectra.model.SpectralDataset;
import com.id.spectra.modules.jobs.model.JobStage;
import com.id.spectra.modules.jobs.model.ProgressUpdate;
import com.id.spectra.modules.loader.model.LoadedFile;
import com.id.spectra.modules.loader.model.ScanResult;
import com.id.spectra.modules.loader.service.IntegrationLoader;
import com.id.spectra.modules.pipeline.logic.MetadataAssembler;
import com.id.spectra.modules.pipeline.logic.ProgressWindow;
import com.id.spectra.modules.pipeline.model.PipelineCancelledException;
import com.id.spectra.modules.pipeline.model.ProgressListener;
import com.id.spectra.modules.regrid.logic.VariabilityNormalizer;
import com.id.spectra.modules.regrid.model.RegridResult;
import com.id.spectra.modules.regrid.service.Regridder;
import com.id.spectra.modules.regrid.service.TimeInterpolator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Runs scan, read, regrid, optional time interpolation and normalization over a batch of
 * spectral files, reporting progress along the way.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private static final int INTERPOLATION_REPORT_EVERY = 50;

    private final IntegrationLoader integrationLoader;
    private final Regridder regridder;
    private final TimeInterpolator timeInterpolator;

    public PipelineOrchestrator(IntegrationLoader integrationLoader,
                                Regridder regridder,
                                TimeInterpolator timeInterpolator) {
        this.integrationLoader = integrationLoader;
        this.regridder = regridder;
        this.timeInterpolator = timeInterpolator;
    }

    /**
     * @param files            - spectral files of the batch, any order
     * @param useInterpolation - resample onto a uniform time grid after regridding
     * @param listener         - progress sink
     * @param cancelled        - polled between files, regridded integrations and stages
     * @return the regridded and normalized dataset
     * @throws IllegalStateException       when no integration could be read or the spectra do not overlap
     * @throws PipelineCancelledException when {@code cancelled} turns true
     */
    public SpectralDataset process(List<Path> files,
                                   boolean useInterpolation,
                                   ProgressListener listener,
                                   BooleanSupplier cancelled) {
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
        BooleanSupplier isCancelled = cancelled == null ? () -> false : cancelled;

        // Scan
        progress.onProgress(ProgressUpdate.of(ProgressWindow.SCAN.start(), "Scanning files...", JobStage.SCAN));
        List<ScanResult> scans = scan(files);
        int totalFiles = scans.size();
        int estimate = scans.stream().mapToInt(ScanResult::count).sum();
        log.info("Scanned files: {} valid files, {} total integrations", totalFiles, estimate);
        progress.onProgress(ProgressUpdate.builder()
                .percent(ProgressWindow.SCAN.end())
                .message("Found %d integrations in %d files".formatted(estimate, totalFiles))
                .stage(JobStage.SCAN)
                .processedIntegrations(0)
                .totalIntegrations(estimate)
                .build());
        checkCancelled(isCancelled);

        // Read
        List<Integration> integrations = new ArrayList<>();
        List<HeaderInfo> headers = new ArrayList<>();
        AtomicInteger processed = new AtomicInteger();
        for (int i = 0; i < scans.size(); i++) {
            ScanResult scan = scans.get(i);
            int fileNumber = i + 1;
            log.info("Processing file {}/{}: {} ({} expected integrations)",
                    fileNumber, totalFiles, scan.path().getFileName(), scan.count());

            Optional<LoadedFile> loaded = integrationLoader.load(scan.path(), (done, totalHint) -> {
                int count = processed.incrementAndGet();
                progress.onProgress(ProgressUpdate.builder()
                        .percent(ProgressWindow.READ.percentFor(count, estimate))
                        .message("Reading %d/%d - %d/%d integrations".formatted(fileNumber, totalFiles, done, scan.count()))
                        .stage(JobStage.READ)
                        .processedIntegrations(count)
                        .totalIntegrations(estimate)
                        .build());
            });
            checkCancelled(isCancelled);
            if (loaded.isPresent()) {
                integrations.addAll(loaded.get().integrations());
                headers.add(loaded.get().headerInfo());
            } else {
                log.error("No integrations returned from {}", scan.path().getFileName());
            }
            progress.onProgress(ProgressUpdate.builder()
                    .percent(ProgressWindow.READ.percentFor(processed.get(), estimate))
                    .message("Loaded %d/%d files".formatted(fileNumber, totalFiles))
                    .stage(JobStage.READ)
                    .processedIntegrations(processed.get())
                    .totalIntegrations(estimate)
                    .build());
        }
        log.info("Total integrations collected: {}", integrations.size());
        if (integrations.isEmpty()) {
            throw new IllegalStateException("No valid integrations found in files");
        }

        // Regrid
        progress.onProgress(ProgressUpdate.of(ProgressWindow.REGRID.start(), "Regridding integrations...", JobStage.REGRID));
        RegridResult regridded = regridder.regrid(integrations, (done, total, throughput) -> {
            checkCancelled(isCancelled);
            progress.onProgress(ProgressUpdate.builder()
                    .percent(ProgressWindow.REGRID.percentFor(done, total))
                    .message("Regridding %d/%d integrations".formatted(done, total))
                    .stage(JobStage.REGRID)
                    .throughput(throughput)
                    .build());
        });

        // Interpolate
        if (useInterpolation) {
            progress.onProgress(ProgressUpdate.of(ProgressWindow.INTERPOLATE.start(), "Interpolating across time...", JobStage.INTERPOLATE));
            int rows = regridded.fluxRaw().length;
            regridded = timeInterpolator.interpolate(regridded, done -> {
                if (done % INTERPOLATION_REPORT_EVERY == 0) {
                    progress.onProgress(ProgressUpdate.of(ProgressWindow.INTERPOLATE.percentFor(done, rows),
                            "Interpolating across time...", JobStage.INTERPOLATE));
                }
            });
            checkCancelled(isCancelled);
        }

        // Normalize
        progress.onProgress(ProgressUpdate.of(ProgressWindow.FINALIZE, "Computing variability & metadata...", JobStage.FINALIZE));
        double[][] normalized = VariabilityNormalizer.normalize(regridded.fluxRaw());
        DatasetMetadata metadata = MetadataAssembler.assemble(headers, integrations.size(), files.size(),
                regridded.commonWavelength(), regridded.timeHours(), useInterpolation);

        log.info("Processing complete: {} integrations, {} time points, {} wavelength points",
                integrations.size(), regridded.timeHours().length, regridded.commonWavelength().length);
        return SpectralDataset.builder()
                .commonWavelength(regridded.commonWavelength())
                .fluxRaw(regridded.fluxRaw())
                .fluxNormalized(normalized)
                .errorRaw(regridded.errorRaw())
                .timeHours(regridded.timeHours())
                .metadata(metadata)
                .build();
    }

    private List<ScanResult> scan(List<Path> files) {
        List<ScanResult> scans = new ArrayList<>();
        for (Path file : files) {
            if (!integrationLoader.isSupported(file)) {
                continue;
            }
            ScanResult scan = integrationLoader.scan(file);
            if (scan.count() > 0) {
                scans.add(scan);
            } else {
                log.warn("Dropping {}: no integrations found while scanning", file.getFileName());
            }
        }
        // Unknown first timestamps sort last
        scans.sort(Comparator.comparing(ScanResult::firstTime, Comparator.nullsLast(Comparator.naturalOrder())));
        return scans;
    }

    private static void checkCancelled(BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            throw new PipelineCancelledException();
        }
    }
}
