package com.id.spectra.modules.pipeline.service;

import com.id.spectra.config.AppConfig;
import com.id.spectra.model.HeaderInfo;
import com.id.spectra.model.Integration;
import com.id.spectra.model.SpectralDataset;
import com.id.spectra.modules.jobs.model.JobStage;
import com.id.spectra.modules.jobs.model.ProgressUpdate;
import com.id.spectra.modules.loader.model.IntegrationCallback;
import com.id.spectra.modules.loader.model.LoadedFile;
import com.id.spectra.modules.loader.model.ScanResult;
import com.id.spectra.modules.loader.service.IntegrationLoader;
import com.id.spectra.modules.pipeline.model.PipelineCancelledException;
import com.id.spectra.modules.regrid.service.Regridder;
import com.id.spectra.modules.regrid.service.RowWorkerPool;
import com.id.spectra.modules.regrid.service.TimeInterpolator;
import com.id.spectra.modules.visits.logic.VisitSegmenter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    private static final double MINUTE_MJD = 1.0 / 1440.0;

    @Mock
    private IntegrationLoader integrationLoader;

    @Mock
    private AppConfig appConfig;

    private RowWorkerPool rowWorkerPool;
    private PipelineOrchestrator orchestrator;
    private final Map<Path, List<Integration>> files = new LinkedHashMap<>();

    @BeforeEach
    void setUp() {
        when(appConfig.getWavelengthPoints()).thenReturn(25);
        rowWorkerPool = new RowWorkerPool(2);
        orchestrator = new PipelineOrchestrator(integrationLoader, new Regridder(appConfig), new TimeInterpolator(rowWorkerPool));
    }

    @AfterEach
    void tearDown() {
        rowWorkerPool.shutdown();
    }

    private static List<Integration> integrations(int count, double startMjd) {
        List<Integration> out = new ArrayList<>();
        double[] wave = IntStream.range(0, 20).mapToDouble(i -> 1.0 + i * 0.05).toArray();
        for (int k = 0; k < count; k++) {
            double level = 100.0 + (k % 5);
            double[] flux = IntStream.range(0, 20).mapToDouble(i -> level).toArray();
            double[] error = IntStream.range(0, 20).mapToDouble(i -> 1.0).toArray();
            out.add(new Integration(wave, flux, error, startMjd + k * MINUTE_MJD));
        }
        return out;
    }

    private void stubLoader() {
        when(integrationLoader.isSupported(any())).thenAnswer(inv -> files.containsKey(inv.<Path>getArgument(0)));
        when(integrationLoader.scan(any())).thenAnswer(inv -> {
            List<Integration> content = files.get(inv.<Path>getArgument(0));
            return new ScanResult(inv.getArgument(0), content.size(), content.isEmpty() ? null : content.get(0).time());
        });
        when(integrationLoader.load(any(), any())).thenAnswer(inv -> {
            Path path = inv.getArgument(0);
            IntegrationCallback callback = inv.getArgument(1);
            List<Integration> content = files.get(path);
            for (int i = 0; i < content.size(); i++) {
                callback.onIntegration(i + 1, content.size());
            }
            HeaderInfo header = HeaderInfo.builder().filename(path.toString()).target("WASP-39").build();
            return Optional.of(new LoadedFile(content, header));
        });
    }

    @Test
    void processesBatchAcrossFilesWithMonotonicProgress() {
        // Handed over out of time order
        files.put(Path.of("c.h5"), integrations(100, 60000.0 + 100 * MINUTE_MJD));
        files.put(Path.of("a.fits"), integrations(50, 60000.0));
        files.put(Path.of("b.fits"), integrations(50, 60000.0 + 50 * MINUTE_MJD));
        stubLoader();
        List<ProgressUpdate> updates = new ArrayList<>();

        SpectralDataset dataset = orchestrator.process(new ArrayList<>(files.keySet()), false, updates::add, () -> false);

        assertEquals(200, dataset.timeCount());
        assertEquals(25, dataset.wavelengthCount());
        assertEquals(200, dataset.getMetadata().getTotalIntegrations());
        assertEquals(3, dataset.getMetadata().getFilesProcessed());
        assertEquals(List.of("WASP-39"), dataset.getMetadata().getTargets());
        assertEquals(1, VisitSegmenter.segment(dataset.getTimeHours(), 0.5).size());
        assertEquals(0.0, dataset.getTimeHours()[0], 1e-9);

        ProgressUpdate scanned = updates.stream()
                .filter(u -> u.getTotalIntegrations() != null)
                .findFirst()
                .orElseThrow();
        assertEquals(200, scanned.getTotalIntegrations());
        assertEquals(200, updates.stream()
                .filter(u -> u.getStage() == JobStage.READ)
                .mapToInt(ProgressUpdate::getProcessedIntegrations)
                .max()
                .orElse(0));
        double previous = 0;
        for (ProgressUpdate update : updates) {
            assertTrue(update.getPercent() >= previous, "percent went back at " + update);
            previous = update.getPercent();
        }
        assertEquals(JobStage.FINALIZE, updates.get(updates.size() - 1).getStage());
    }

    @Test
    void interpolationProducesUniformTimeAxis() {
        List<Integration> gapped = integrations(10, 60000.0);
        gapped.addAll(integrations(10, 60001.0));
        files.put(Path.of("a.fits"), gapped);
        stubLoader();

        SpectralDataset dataset = orchestrator.process(List.of(Path.of("a.fits")), true, null, null);

        double[] time = dataset.getTimeHours();
        assertEquals(20, time.length);
        double step = time[1] - time[0];
        for (int i = 2; i < time.length; i++) {
            assertEquals(step, time[i] - time[i - 1], 1e-9);
        }
        assertTrue(dataset.getMetadata().isInterpolated());
    }

    @Test
    void failsWhenNoFileYieldsIntegrations() {
        when(integrationLoader.isSupported(any())).thenReturn(true);
        when(integrationLoader.scan(any())).thenReturn(new ScanResult(Path.of("a.fits"), 5, 60000.0));
        when(integrationLoader.load(any(), any())).thenReturn(Optional.empty());

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> orchestrator.process(List.of(Path.of("a.fits")), false, null, null));
        assertEquals("No valid integrations found in files", error.getMessage());
    }

    @Test
    void stopsBetweenFilesOnceCancelled() {
        files.put(Path.of("a.fits"), integrations(10, 60000.0));
        files.put(Path.of("b.fits"), integrations(10, 60001.0));
        stubLoader();
        AtomicInteger polls = new AtomicInteger();

        assertThrows(PipelineCancelledException.class, () -> orchestrator.process(
                new ArrayList<>(files.keySet()), false, null, () -> polls.incrementAndGet() > 1));
        verify(integrationLoader, times(1)).load(any(), any());
    }

    @Test
    void unsupportedFilesAreIgnored() {
        files.put(Path.of("a.fits"), integrations(10, 60000.0));
        stubLoader();

        SpectralDataset dataset = orchestrator.process(List.of(Path.of("notes.txt"), Path.of("a.fits")), false, null, null);

        assertEquals(10, dataset.timeCount());
    }
}
