package com.id.spectra.modules.jobs.logic;

import com.id.spectra.model.DatasetMetadata;
import com.id.spectra.model.SpectralDataset;
import com.id.spectra.modules.cache.service.DatasetCache;
import com.id.spectra.modules.jobs.model.DisplayGrid;
import com.id.spectra.modules.jobs.model.JobOptions;
import com.id.spectra.modules.jobs.model.JobResultPayload;
import com.id.spectra.modules.jobs.model.JobStage;
import com.id.spectra.modules.jobs.model.JobSubmission;
import com.id.spectra.modules.jobs.model.ProgressUpdate;
import com.id.spectra.modules.jobs.model.SpectraJob;
import com.id.spectra.modules.jobs.service.UploadStorage;
import com.id.spectra.modules.pipeline.logic.DatasetRangeFilter;
import com.id.spectra.modules.pipeline.logic.DatasetSampler;
import com.id.spectra.modules.pipeline.model.PipelineCancelledException;
import com.id.spectra.modules.pipeline.model.RangeFilterOutcome;
import com.id.spectra.modules.pipeline.service.DisplayGridBuilder;
import com.id.spectra.modules.pipeline.service.PipelineOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@Scope(BeanDefinition.SCOPE_PROTOTYPE)
@Slf4j
public class SpectraJobRunner {

    private final DatasetCache datasetCache;
    private final PipelineOrchestrator pipelineOrchestrator;
    private final ArchiveExtractor archiveExtractor;
    private final DisplayGridBuilder displayGridBuilder;
    private final UploadStorage uploadStorage;

    public SpectraJobRunner(DatasetCache datasetCache,
                            PipelineOrchestrator pipelineOrchestrator,
                            ArchiveExtractor archiveExtractor,
                            DisplayGridBuilder displayGridBuilder,
                            UploadStorage uploadStorage) {
        this.datasetCache = datasetCache;
        this.pipelineOrchestrator = pipelineOrchestrator;
        this.archiveExtractor = archiveExtractor;
        this.displayGridBuilder = displayGridBuilder;
        this.uploadStorage = uploadStorage;
    }

    public void run(SpectraJob job, JobSubmission submission) {
        String shortId = job.getId().substring(0, Math.min(8, job.getId().length()));
        JobOptions options = submission.options() == null ? JobOptions.builder().build() : submission.options();
        boolean useInterpolation = options.isUseInterpolation();
        Path archive = submission.archive();
        Path jobDir = null;
        log.info("Job {}: starting on {} (interpolation={})", shortId, archive.getFileName(), useInterpolation);
        try {
            jobDir = uploadStorage.createJobDir(job.getId());

            // Cache check
            job.update(ProgressUpdate.of(2.0, "Checking cache...", JobStage.SCAN));
            Optional<SpectralDataset> cached = datasetCache.get(archive, useInterpolation);
            SpectralDataset dataset;
            if (cached.isPresent()) {
                log.info("Job {}: cache hit", shortId);
                job.update(ProgressUpdate.of(60.0, "Loaded from cache", JobStage.READ));
                dataset = cached.get();
            } else {
                log.info("Job {}: cache miss, processing from scratch", shortId);
                job.update(ProgressUpdate.of(3.0, "Extracting archive...", JobStage.SCAN));
                List<Path> files = archiveExtractor.extract(archive, jobDir.resolve("unzipped"));
                if (files.isEmpty()) {
                    throw new IllegalStateException("No valid FITS/H5 files found in archive.");
                }
                dataset = pipelineOrchestrator.process(files, useInterpolation, job::update, job::isCancellationRequested);
                checkCancelled(job);

                job.update(ProgressUpdate.of(93.0, "Caching processed data...", JobStage.FINALIZE));
                datasetCache.set(archive, useInterpolation, dataset);
            }

            // Sample
            Integer target = options.getNumIntegrations();
            if (target != null && target > 0 && target < dataset.timeCount()) {
                job.update(ProgressUpdate.of(94.0, "Sampling to %d integrations...".formatted(target), JobStage.FINALIZE));
                dataset = DatasetSampler.sample(dataset, target);
            }
            checkCancelled(job);

            // Filter
            job.update(ProgressUpdate.of(95.0, "Applying filters...", JobStage.FINALIZE));
            RangeFilterOutcome filtered = DatasetRangeFilter.apply(dataset, options.getWavelengthRange(), options.getTimeRange());
            dataset = filtered.dataset();
            if (filtered.applied()) {
                log.info("Job {}: ranges applied: {}", shortId, String.join("; ", filtered.rangeInfo()));
            }

            // Display
            job.update(ProgressUpdate.of(96.0, "Building display grid...", JobStage.FINALIZE));
            List<String> displayWarnings = new ArrayList<>();
            DisplayGrid display = displayGridBuilder.build(dataset, options, displayWarnings);
            if (!displayWarnings.isEmpty()) {
                dataset = SpectralDataset.builder()
                        .from(dataset)
                        .metadata(withWarnings(dataset, displayWarnings))
                        .build();
            }
            checkCancelled(job);

            job.complete(JobResultPayload.builder()
                    .jobId(job.getId())
                    .wavelength(dataset.getCommonWavelength())
                    .fluxRaw(dataset.getFluxRaw())
                    .fluxNormalized(dataset.getFluxNormalized())
                    .errorRaw(dataset.getErrorRaw())
                    .timeHours(dataset.getTimeHours())
                    .metadata(dataset.getMetadata())
                    .display(display)
                    .fromCache(cached.isPresent())
                    .build());
            log.info("Job {}: completed successfully", shortId);
        } catch (PipelineCancelledException e) {
            job.markCancelled();
            log.info("Job {}: cancelled", shortId);
        } catch (Exception e) {
            job.fail(e.getMessage());
            log.error("Job {}: background job failed: {}", shortId, e.getMessage(), e);
        } finally {
            cleanup(shortId, jobDir, archive, submission.demo());
        }
    }

    private static void checkCancelled(SpectraJob job) {
        if (job.isCancellationRequested()) {
            throw new PipelineCancelledException();
        }
    }

    private static DatasetMetadata withWarnings(SpectralDataset dataset, List<String> warnings) {
        return dataset.getMetadata().withWarnings(warnings);
    }

    private static void cleanup(String shortId, Path jobDir, Path archive, boolean demo) {
        if (jobDir != null) {
            try {
                FileSystemUtils.deleteRecursively(jobDir);
            } catch (IOException e) {
                log.warn("Job {}: failed removing scratch directory {}", shortId, jobDir, e);
            }
        }
        if (!demo) {
            try {
                Files.deleteIfExists(archive);
            } catch (IOException e) {
                log.warn("Job {}: failed removing upload {}", shortId, archive.getFileName(), e);
            }
        }
    }
}
