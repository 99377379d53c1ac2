package com.id.spectra.modules.pipeline.logic;

import com.id.spectra.model.DatasetMetadata;
import com.id.spectra.model.SpectralDataset;
import com.id.spectra.modules.jobs.model.ValueRange;
import com.id.spectra.modules.pipeline.model.RangeFilterOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.IntStream;

@Slf4j
public final class DatasetRangeFilter {

    private static final String WAVELENGTH_INFO = "Wavelength: %.3f - %.3f um";
    private static final String TIME_INFO = "Time: %.2f - %.2f hours";

    private DatasetRangeFilter() {
    }

    public static RangeFilterOutcome apply(SpectralDataset dataset, ValueRange wavelengthRange, ValueRange timeRange) {
        List<String> rangeInfo = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        int[] rows = select(dataset.getCommonWavelength(), wavelengthRange, "wavelength", WAVELENGTH_INFO, rangeInfo, warnings);
        int[] columns = select(dataset.getTimeHours(), timeRange, "time", TIME_INFO, rangeInfo, warnings);
        if (rangeInfo.isEmpty() && warnings.isEmpty()) {
            return new RangeFilterOutcome(dataset, rangeInfo, warnings);
        }

        DatasetMetadata metadata = dataset.getMetadata().toBuilder()
                .userRanges(rangeInfo.isEmpty() ? null : String.join("; ", rangeInfo))
                .build()
                .withWarnings(warnings);
        SpectralDataset filtered = SpectralDataset.builder()
                .from(dataset)
                .select(rows, columns)
                .metadata(metadata)
                .build();
        log.info("Wavelength filtering: {} -> {} points", dataset.wavelengthCount(), filtered.wavelengthCount());
        log.info("Time filtering: {} -> {} points", dataset.timeCount(), filtered.timeCount());
        return new RangeFilterOutcome(filtered, rangeInfo, warnings);
    }

    private static int[] select(double[] axis, ValueRange range, String name, String infoFormat,
                                List<String> rangeInfo, List<String> warnings) {
        int[] all = IntStream.range(0, axis.length).toArray();
        if (range == null || range.isEmpty() || axis.length == 0) {
            return all;
        }
        double dataMin = Double.POSITIVE_INFINITY;
        double dataMax = Double.NEGATIVE_INFINITY;
        for (double v : axis) {
            dataMin = Math.min(dataMin, v);
            dataMax = Math.max(dataMax, v);
        }
        double min = Math.max(range.min() != null ? range.min() : dataMin, dataMin);
        double max = Math.min(range.max() != null ? range.max() : dataMax, dataMax);

        int[] kept = min < max
                ? IntStream.range(0, axis.length).filter(i -> axis[i] >= min && axis[i] <= max).toArray()
                : new int[0];
        if (kept.length == 0) {
            String warning = String.format(Locale.ROOT, "Invalid %s range: %s to %s, using full range", name, min, max);
            log.warn(warning);
            warnings.add(warning);
            return all;
        }
        rangeInfo.add(String.format(Locale.ROOT, infoFormat, min, max));
        return kept;
    }
}
