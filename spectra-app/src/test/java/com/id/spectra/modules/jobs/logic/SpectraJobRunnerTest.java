package com.id.spectra.modules.jobs.logic;

import com.id.spectra.model.DatasetMetadata;
import com.id.spectra.model.SpectralDataset;
import com.id.spectra.modules.cache.service.DatasetCache;
import com.id.spectra.modules.jobs.model.CustomBand;
import com.id.spectra.modules.jobs.model.JobOptions;
import com.id.spectra.modules.jobs.model.JobResultPayload;
import com.id.spectra.modules.jobs.model.JobStatus;
import com.id.spectra.modules.jobs.model.JobSubmission;
import com.id.spectra.modules.jobs.model.SpectraJob;
import com.id.spectra.modules.jobs.model.ValueRange;
import com.id.spectra.modules.jobs.service.UploadStorage;
import com.id.spectra.modules.pipeline.model.PipelineCancelledException;
import com.id.spectra.modules.pipeline.service.DisplayGridBuilder;
import com.id.spectra.modules.pipeline.service.PipelineOrchestrator;
import com.id.spectra.modules.regrid.logic.VariabilityNormalizer;
import com.id.spectra.modules.regrid.service.RowWorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpectraJobRunnerTest {

    @TempDir
    Path tempDir;

    @Mock
    private DatasetCache datasetCache;

    @Mock
    private PipelineOrchestrator pipelineOrchestrator;

    @Mock
    private ArchiveExtractor archiveExtractor;

    @Mock
    private UploadStorage uploadStorage;

    private RowWorkerPool rowWorkerPool;
    private SpectraJobRunner runner;
    private Path archive;
    private Path jobDir;

    @BeforeEach
    void setUp() throws Exception {
        rowWorkerPool = new RowWorkerPool(2);
        runner = new SpectraJobRunner(datasetCache, pipelineOrchestrator, archiveExtractor,
                new DisplayGridBuilder(rowWorkerPool, 1000, 0.5), uploadStorage);
        archive = Files.writeString(tempDir.resolve("upload.zip"), "zip bytes");
        jobDir = Files.createDirectory(tempDir.resolve("job"));
        when(uploadStorage.createJobDir(any())).thenReturn(jobDir);
    }

    @AfterEach
    void tearDown() {
        rowWorkerPool.shutdown();
    }

    private static SpectralDataset dataset(int times) {
        double[][] flux = new double[3][times];
        double[][] error = new double[3][times];
        double[] time = new double[times];
        for (int t = 0; t < times; t++) {
            time[t] = t * 0.1;
            for (int w = 0; w < 3; w++) {
                flux[w][t] = 100.0 + w + (t % 3);
                error[w][t] = 1.0;
            }
        }
        return SpectralDataset.builder()
                .commonWavelength(new double[]{1.0, 1.5, 2.0})
                .fluxRaw(flux)
                .fluxNormalized(VariabilityNormalizer.normalize(flux))
                .errorRaw(error)
                .timeHours(time)
                .metadata(DatasetMetadata.builder().totalIntegrations(times).plottedIntegrations(times).build())
                .build();
    }

    @Test
    void cacheMissRunsPipelineAndStoresResult() throws Exception {
        SpectraJob job = new SpectraJob("job-miss", Clock.systemUTC());
        SpectralDataset dataset = dataset(10);
        Path fits = tempDir.resolve("a.fits");
        when(datasetCache.get(archive, true)).thenReturn(Optional.empty());
        when(archiveExtractor.extract(eq(archive), any())).thenReturn(List.of(fits));
        when(pipelineOrchestrator.process(eq(List.of(fits)), eq(true), any(), any())).thenReturn(dataset);

        runner.run(job, new JobSubmission(archive, false, JobOptions.builder().useInterpolation(true).build()));

        assertEquals(JobStatus.DONE, job.getStatus());
        JobResultPayload payload = job.getResult();
        assertFalse(payload.isFromCache());
        assertEquals("job-miss", payload.getJobId());
        assertEquals(10, payload.getTimeHours().length);
        assertNotNull(payload.getDisplay());
        verify(datasetCache).set(archive, true, dataset);
        assertFalse(Files.exists(jobDir));
        assertFalse(Files.exists(archive));
    }

    @Test
    void cacheHitSkipsPipelineThenSamplesAndFilters() {
        SpectraJob job = new SpectraJob("job-hit", Clock.systemUTC());
        when(datasetCache.get(archive, false)).thenReturn(Optional.of(dataset(20)));
        JobOptions options = JobOptions.builder()
                .numIntegrations(10)
                .wavelengthRange(new ValueRange(1.2, 2.0))
                .build();

        runner.run(job, new JobSubmission(archive, false, options));

        assertEquals(JobStatus.DONE, job.getStatus());
        JobResultPayload payload = job.getResult();
        assertTrue(payload.isFromCache());
        assertEquals(10, payload.getTimeHours().length);
        assertEquals(2, payload.getWavelength().length);
        assertEquals(10, payload.getMetadata().getPlottedIntegrations());
        assertEquals("Wavelength: 1.200 - 2.000 um", payload.getMetadata().getUserRanges());
        verify(pipelineOrchestrator, never()).process(anyList(), anyBoolean(), any(), any());
        verify(datasetCache, never()).set(any(), anyBoolean(), any());
    }

    @Test
    void displayWarningsLandInMetadata() {
        SpectraJob job = new SpectraJob("job-bands", Clock.systemUTC());
        when(datasetCache.get(archive, false)).thenReturn(Optional.of(dataset(5)));
        JobOptions options = JobOptions.builder()
                .customBands(List.of(new CustomBand("inverted", 2.0, 1.0)))
                .build();

        runner.run(job, new JobSubmission(archive, false, options));

        List<String> warnings = job.getResult().getMetadata().getWarnings();
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("inverted"));
    }

    @Test
    void pipelineFailureFailsJobAndCleansUp() throws Exception {
        SpectraJob job = new SpectraJob("job-fail", Clock.systemUTC());
        when(datasetCache.get(archive, false)).thenReturn(Optional.empty());
        when(archiveExtractor.extract(eq(archive), any())).thenReturn(List.of(tempDir.resolve("a.fits")));
        when(pipelineOrchestrator.process(anyList(), anyBoolean(), any(), any()))
                .thenThrow(new IllegalStateException("No valid integrations found in files"));

        runner.run(job, new JobSubmission(archive, false, null));

        assertEquals(JobStatus.ERROR, job.getStatus());
        assertEquals("No valid integrations found in files", job.getMessage());
        assertNull(job.getResult());
        assertFalse(Files.exists(jobDir));
        assertFalse(Files.exists(archive));
    }

    @Test
    void archiveWithoutSpectralFilesFails() throws Exception {
        SpectraJob job = new SpectraJob("job-empty", Clock.systemUTC());
        when(datasetCache.get(archive, false)).thenReturn(Optional.empty());
        when(archiveExtractor.extract(eq(archive), any())).thenReturn(List.of());

        runner.run(job, new JobSubmission(archive, false, null));

        assertEquals(JobStatus.ERROR, job.getStatus());
        assertEquals("No valid FITS/H5 files found in archive.", job.getMessage());
    }

    @Test
    void cancelledPipelineMarksJobCancelled() throws Exception {
        SpectraJob job = new SpectraJob("job-cancel", Clock.systemUTC());
        when(datasetCache.get(archive, false)).thenReturn(Optional.empty());
        when(archiveExtractor.extract(eq(archive), any())).thenReturn(List.of(tempDir.resolve("a.fits")));
        when(pipelineOrchestrator.process(anyList(), anyBoolean(), any(), any()))
                .thenThrow(new PipelineCancelledException());

        runner.run(job, new JobSubmission(archive, false, null));

        assertEquals(JobStatus.CANCELLED, job.getStatus());
        assertEquals("Job cancelled", job.getMessage());
    }

    @Test
    void demoArchiveIsKept() {
        SpectraJob job = new SpectraJob("job-demo", Clock.systemUTC());
        when(datasetCache.get(archive, false)).thenReturn(Optional.of(dataset(4)));

        runner.run(job, new JobSubmission(archive, true, null));

        assertEquals(JobStatus.DONE, job.getStatus());
        assertTrue(Files.exists(archive));
    }
}
