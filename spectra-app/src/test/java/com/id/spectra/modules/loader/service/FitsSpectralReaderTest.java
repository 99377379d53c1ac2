package com.id.spectra.modules.loader.service;

import com.id.spectra.model.Integration;
import com.id.spectra.modules.loader.container.InMemoryFitsContainer;
import com.id.spectra.modules.loader.container.InMemoryFitsHdu;
import com.id.spectra.modules.loader.logic.FitsNames;
import com.id.spectra.modules.loader.model.LoadedFile;
import com.id.spectra.modules.loader.model.ScanResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class FitsSpectralReaderTest {

    private static final Path FILE = Path.of("jw01366_x1dints.fits");
    private static final double[] WAVE = IntStream.range(0, 12).mapToDouble(i -> 1.0 + i * 0.1).toArray();
    private static final double[] FLUX = IntStream.range(0, 12).mapToDouble(i -> 100.0 + i).toArray();

    private static InMemoryFitsHdu intTimes(double... mids) {
        return new InMemoryFitsHdu(FitsNames.INT_TIMES, 1).scalarColumn(FitsNames.INT_MID_MJD, mids);
    }

    private static FitsSpectralReader reader(InMemoryFitsContainer container) {
        return new FitsSpectralReader(path -> container);
    }

    @Test
    void supportsFitsExtensionOnly() {
        FitsSpectralReader reader = reader(new InMemoryFitsContainer());

        assertTrue(reader.supports(Path.of("A.FITS")));
        assertFalse(reader.supports(Path.of("a.h5")));
    }

    @Test
    void scanReportsIntegrationCountAndFirstTime() {
        InMemoryFitsContainer container = new InMemoryFitsContainer(InMemoryFitsHdu.primary(),
                intTimes(60000.5, 60000.6, 60000.7));

        ScanResult scan = reader(container).scan(FILE);

        assertEquals(3, scan.count());
        assertEquals(60000.5, scan.firstTime());
        assertTrue(container.isClosed());
    }

    @Test
    void scanOfUnreadableFileIsEmpty() {
        FitsSpectralReader reader = new FitsSpectralReader(path -> {
            throw new IOException("corrupt");
        });

        assertEquals(0, reader.scan(FILE).count());
    }

    @Test
    void loadsIndexedExtensionsWithTimesFromIntTimes() {
        InMemoryFitsContainer container = new InMemoryFitsContainer(
                InMemoryFitsHdu.primary().header("TARGNAME", "WASP-39"),
                intTimes(60000.1, 60000.2),
                new InMemoryFitsHdu(FitsNames.EXTRACT1D, 1)
                        .scalarColumn(FitsNames.WAVELENGTH, WAVE)
                        .scalarColumn(FitsNames.FLUX, FLUX)
                        .scalarColumn(FitsNames.FLUX_ERROR, FLUX),
                new InMemoryFitsHdu(FitsNames.EXTRACT1D, 2)
                        .scalarColumn(FitsNames.WAVELENGTH, WAVE)
                        .scalarColumn(FitsNames.FLUX, FLUX));
        List<Integer> progress = new ArrayList<>();

        Optional<LoadedFile> loaded = reader(container).load(FILE, (done, total) -> progress.add(done));

        assertTrue(loaded.isPresent());
        List<Integration> integrations = loaded.get().integrations();
        assertEquals(2, integrations.size());
        assertEquals(60000.2, integrations.get(1).time());
        assertEquals(FLUX[0], integrations.get(0).error()[0]);
        assertTrue(Double.isNaN(integrations.get(1).error()[0]));
        assertEquals("WASP-39", loaded.get().headerInfo().getTarget());
        assertEquals(List.of(1, 2), progress);
    }

    @Test
    void loadsSingleIndexedExtensionWithScalarColumns() {
        InMemoryFitsContainer container = new InMemoryFitsContainer(InMemoryFitsHdu.primary(),
                intTimes(60000.4),
                new InMemoryFitsHdu(FitsNames.EXTRACT1D, 1)
                        .scalarColumn(FitsNames.WAVELENGTH, WAVE)
                        .scalarColumn(FitsNames.FLUX, FLUX));

        LoadedFile loaded = reader(container).load(FILE, null).orElseThrow();

        assertEquals(1, loaded.integrations().size());
        Integration integration = loaded.integrations().get(0);
        assertEquals(WAVE.length, integration.wavelength().length);
        assertArrayEquals(FLUX, integration.flux());
        assertEquals(60000.4, integration.time());
    }

    @Test
    void loadsSeparateTimeTable() {
        InMemoryFitsContainer container = new InMemoryFitsContainer(InMemoryFitsHdu.primary(),
                intTimes(60000.1, 60000.2, 60000.3),
                new InMemoryFitsHdu(FitsNames.EXTRACT1D, 1)
                        .column(FitsNames.WAVELENGTH, WAVE, WAVE, WAVE)
                        .column(FitsNames.FLUX, FLUX, FLUX, FLUX));

        LoadedFile loaded = reader(container).load(FILE, null).orElseThrow();

        assertEquals(3, loaded.integrations().size());
        assertEquals(60000.3, loaded.integrations().get(2).time());
    }

    @Test
    void loadsEmbeddedTimeTableUsingRowTimestamps() {
        InMemoryFitsContainer container = new InMemoryFitsContainer(InMemoryFitsHdu.primary(),
                intTimes(1.0, 2.0),
                new InMemoryFitsHdu(FitsNames.EXTRACT1D, 1)
                        .column(FitsNames.WAVELENGTH, WAVE, WAVE)
                        .column(FitsNames.FLUX, FLUX, FLUX)
                        .scalarColumn("MJD-AVG", 60001.0, 60001.5));

        LoadedFile loaded = reader(container).load(FILE, null).orElseThrow();

        assertEquals(2, loaded.integrations().size());
        assertEquals(60001.5, loaded.integrations().get(1).time());
    }

    @Test
    void missingIntTimesYieldsNothing() {
        InMemoryFitsContainer container = new InMemoryFitsContainer(InMemoryFitsHdu.primary(),
                new InMemoryFitsHdu(FitsNames.EXTRACT1D, 1)
                        .column(FitsNames.WAVELENGTH, WAVE)
                        .column(FitsNames.FLUX, FLUX));

        assertTrue(reader(container).load(FILE, null).isEmpty());
    }

    @Test
    void fileWithOnlyUnusableIntegrationsYieldsNothing() {
        double[] nan = new double[12];
        Arrays.fill(nan, Double.NaN);
        InMemoryFitsContainer container = new InMemoryFitsContainer(InMemoryFitsHdu.primary(),
                intTimes(60000.1),
                new InMemoryFitsHdu(FitsNames.EXTRACT1D, 1)
                        .scalarColumn(FitsNames.WAVELENGTH, WAVE)
                        .scalarColumn(FitsNames.FLUX, nan),
                new InMemoryFitsHdu(FitsNames.EXTRACT1D, 2)
                        .scalarColumn(FitsNames.WAVELENGTH, WAVE)
                        .scalarColumn(FitsNames.FLUX, nan));

        assertTrue(reader(container).load(FILE, null).isEmpty());
    }
}
