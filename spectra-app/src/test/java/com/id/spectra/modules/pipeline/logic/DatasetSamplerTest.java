package com.id.spectra.modules.pipeline.logic;

import com.id.spectra.model.DatasetMetadata;
import com.id.spectra.model.SpectralDataset;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class DatasetSamplerTest {

    static SpectralDataset dataset(int wavelengths, int times) {
        double[] wave = IntStream.range(0, wavelengths).mapToDouble(i -> 1.0 + i * 0.1).toArray();
        double[] time = IntStream.range(0, times).mapToDouble(t -> t * 0.1).toArray();
        double[][] flux = new double[wavelengths][times];
        for (int w = 0; w < wavelengths; w++) {
            for (int t = 0; t < times; t++) {
                flux[w][t] = w * 1000 + t;
            }
        }
        return SpectralDataset.builder()
                .commonWavelength(wave)
                .fluxRaw(flux)
                .fluxNormalized(flux)
                .errorRaw(flux)
                .timeHours(time)
                .metadata(DatasetMetadata.builder().totalIntegrations(times).plottedIntegrations(times).build())
                .build();
    }

    @Test
    void keepsEvenlyStridedColumns() {
        SpectralDataset source = dataset(3, 10);

        SpectralDataset sampled = DatasetSampler.sample(source, 4);

        assertArrayEquals(new int[]{0, 2, 5, 7}, DatasetSampler.indices(10, 4));
        assertEquals(4, sampled.timeCount());
        assertEquals(3, sampled.wavelengthCount());
        assertEquals(2005.0, sampled.getFluxRaw()[2][2]);
        assertEquals(0.7, sampled.getTimeHours()[3], 1e-12);
        assertEquals(4, sampled.getMetadata().getPlottedIntegrations());
        assertEquals(10, source.getMetadata().getPlottedIntegrations());
    }

    @Test
    void targetNotBelowCountLeavesDatasetAlone() {
        SpectralDataset source = dataset(2, 5);

        assertSame(source, DatasetSampler.sample(source, 5));
        assertSame(source, DatasetSampler.sample(source, null));
        assertSame(source, DatasetSampler.sample(source, 0));
    }
}
