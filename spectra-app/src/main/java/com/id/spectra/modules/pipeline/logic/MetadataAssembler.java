package com.id.spectra.modules.pipeline.logic;

import com.id.spectra.model.DatasetMetadata;
import com.id.spectra.model.HeaderInfo;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

public final class MetadataAssembler {

    private MetadataAssembler() {
    }

    public static DatasetMetadata assemble(List<HeaderInfo> headers,
                                           int integrations,
                                           int filesProcessed,
                                           double[] wavelength,
                                           double[] timeHours,
                                           boolean interpolated) {
        return DatasetMetadata.builder()
                .totalIntegrations(integrations)
                .plottedIntegrations(integrations)
                .filesProcessed(filesProcessed)
                .wavelengthRange(String.format(Locale.ROOT, "%.3f-%.3f um",
                        wavelength[0], wavelength[wavelength.length - 1]))
                .timeRange(String.format(Locale.ROOT, "%.2f-%.2f hours",
                        min(timeHours), max(timeHours)))
                .targets(distinct(headers, HeaderInfo::getTarget))
                .instruments(distinct(headers, HeaderInfo::getInstrument))
                .filters(distinct(headers, HeaderInfo::getFilter))
                .gratings(distinct(headers, HeaderInfo::getGrating))
                .fluxUnit(headers.isEmpty() ? HeaderInfo.UNKNOWN : headers.get(0).getFluxUnit())
                .interpolated(interpolated)
                .build();
    }

    private static List<String> distinct(List<HeaderInfo> headers, Function<HeaderInfo, String> field) {
        LinkedHashSet<String> values = new LinkedHashSet<>();
        for (HeaderInfo header : headers) {
            values.add(field.apply(header));
        }
        return new ArrayList<>(values);
    }

    private static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        return min;
    }

    private static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return max;
    }
}
