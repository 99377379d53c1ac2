package com.id.spectra.modules.pipeline.logic;

import com.id.spectra.model.DatasetMetadata;
import com.id.spectra.model.SpectralDataset;
import lombok.extern.slf4j.Slf4j;

import java.util.stream.IntStream;

/**
 * Even-stride down-sampling along time.
 */
@Slf4j
public final class DatasetSampler {

    private DatasetSampler() {
    }

    /**
     * @param dataset - source dataset, left untouched
     * @param target  - wanted number of time columns; null, non-positive or not smaller than the
     *                current count means no sampling
     * @return a new dataset keeping columns floor(i * n / target), or the source itself
     */
    public static SpectralDataset sample(SpectralDataset dataset, Integer target) {
        int n = dataset.timeCount();
        if (target == null || target <= 0 || target >= n) {
            return dataset;
        }
        int[] columns = indices(n, target);
        int[] rows = IntStream.range(0, dataset.wavelengthCount()).toArray();
        DatasetMetadata metadata = dataset.getMetadata().toBuilder()
                .plottedIntegrations(target)
                .build();
        log.info("Sampled {} to {} integrations", n, target);
        return SpectralDataset.builder()
                .from(dataset)
                .select(rows, columns)
                .metadata(metadata)
                .build();
    }

    static int[] indices(int n, int target) {
        int[] columns = new int[target];
        for (int i = 0; i < target; i++) {
            columns[i] = (int) ((long) i * n / target);
        }
        return columns;
    }
}
