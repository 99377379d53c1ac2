package com.id.spectra.modules.pipeline.service;

import com.id.spectra.config.AppConfig;
import com.id.spectra.model.SpectralDataset;
import com.id.spectra.modules.jobs.model.CustomBand;
import com.id.spectra.modules.jobs.model.DisplayGrid;
import com.id.spectra.modules.jobs.model.JobOptions;
import com.id.spectra.modules.jobs.model.ZAxisDisplay;
import com.id.spectra.modules.regrid.logic.NanStats;
import com.id.spectra.modules.regrid.logic.RowMedianBinner;
import com.id.spectra.modules.regrid.logic.VariabilityNormalizer;
import com.id.spectra.modules.regrid.service.RowWorkerPool;
import com.id.spectra.modules.visits.logic.VisitSegmenter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a finalized dataset into the arrays the charting layer draws.
 */
@Slf4j
@Service
public class DisplayGridBuilder {

    private final RowWorkerPool rowWorkerPool;
    private final int maxTimeColumns;
    private final double gapThresholdHours;

    @Autowired
    public DisplayGridBuilder(RowWorkerPool rowWorkerPool, AppConfig appConfig) {
        this(rowWorkerPool, appConfig.getDisplayMaxTimeColumns(), appConfig.getVisitGapThresholdHours());
    }

    public DisplayGridBuilder(RowWorkerPool rowWorkerPool, int maxTimeColumns, double gapThresholdHours) {
        this.rowWorkerPool = rowWorkerPool;
        this.maxTimeColumns = maxTimeColumns;
        this.gapThresholdHours = gapThresholdHours;
    }

    /**
     * @param dataset  - sampled and filtered dataset
     * @param options  - display options of the job
     * @param warnings - receives a message per dropped custom band
     */
    public DisplayGrid build(SpectralDataset dataset, JobOptions options, List<String> warnings) {
        ZAxisDisplay mode = options.getDisplayMode() == null ? ZAxisDisplay.VARIABILITY : options.getDisplayMode();
        double[][] raw = dataset.getFluxRaw();
        double[][] z;
        double[][] errors;
        if (mode == ZAxisDisplay.FLUX) {
            z = raw;
            errors = dataset.getErrorRaw();
        } else {
            z = percentDeviation(dataset.getFluxNormalized());
            errors = relativeErrors(raw, dataset.getErrorRaw());
        }

        double[] reference = new double[raw.length];
        for (int w = 0; w < raw.length; w++) {
            reference[w] = NanStats.nanMedian(raw[w]);
        }

        // Bin along time
        double[] time = dataset.getTimeHours();
        int binSize = RowMedianBinner.binSize(time.length, maxTimeColumns);
        if (binSize > 1) {
            int bins = time.length / binSize;
            z = rowWorkerPool.mapRows(z, row -> RowMedianBinner.bin(row, bins), null);
            errors = rowWorkerPool.mapRows(errors, row -> RowMedianBinner.bin(row, bins), null);
            double[] binnedTime = new double[bins];
            for (int j = 0; j < bins; j++) {
                binnedTime[j] = time[j * binSize];
            }
            time = binnedTime;
            log.info("Display grid binned by {} to {} time columns", binSize, bins);
        }

        return DisplayGrid.builder()
                .mode(mode)
                .wavelength(dataset.getCommonWavelength())
                .timeHours(time)
                .z(z)
                .errors(errors)
                .referenceSpectrum(reference)
                .visits(VisitSegmenter.segment(time, gapThresholdHours, dataset.getMetadata().isInterpolated()))
                .binSize(binSize)
                .colorscale(options.getColorscale())
                .colorRange(options.getVariabilityRange())
                .customBands(validBands(options.getCustomBands(), warnings))
                .build();
    }

    private static double[][] percentDeviation(double[][] normalized) {
        double[][] out = new double[normalized.length][];
        for (int w = 0; w < normalized.length; w++) {
            out[w] = new double[normalized[w].length];
            for (int t = 0; t < out[w].length; t++) {
                out[w][t] = (normalized[w][t] - 1.0) * 100.0;
            }
        }
        return out;
    }

    private static double[][] relativeErrors(double[][] raw, double[][] error) {
        double[][] out = new double[error.length][];
        for (int w = 0; w < error.length; w++) {
            double divisor = VariabilityNormalizer.rowDivisor(raw[w]);
            out[w] = new double[error[w].length];
            for (int t = 0; t < out[w].length; t++) {
                out[w][t] = error[w][t] / divisor * 100.0;
            }
        }
        return out;
    }

    private static List<CustomBand> validBands(List<CustomBand> bands, List<String> warnings) {
        List<CustomBand> valid = new ArrayList<>();
        if (bands == null) {
            return valid;
        }
        for (CustomBand band : bands) {
            if (band.start() >= band.end()) {
                String warning = String.format(Locale.ROOT, "Ignoring custom band %s: start %s is not below end %s",
                        band.name(), band.start(), band.end());
                log.warn(warning);
                warnings.add(warning);
            } else {
                valid.add(band);
            }
        }
        return valid;
    }
}
