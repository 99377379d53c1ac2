package com.id.spectra.modules.loader.logic;

import com.id.spectra.model.HeaderInfo;
import com.id.spectra.modules.loader.container.FitsContainer;
import com.id.spectra.modules.loader.container.FitsHdu;

import java.util.Locale;
import java.util.Optional;

public final class FitsHeaderReader {

    public static final String DEFAULT_FLUX_UNIT = "MJy";
    private static final int MAX_COLUMN_INDEX = 9;

    private FitsHeaderReader() {
    }

    public static HeaderInfo read(FitsContainer container, String filename) {
        FitsHdu primary = container.primary();
        return HeaderInfo.builder()
                .filename(filename)
                .target(primary.header("TARGNAME").orElse(HeaderInfo.UNKNOWN))
                .instrument(primary.header("INSTRUME").orElse(HeaderInfo.UNKNOWN))
                .filter(primary.header("FILTER").orElse(HeaderInfo.UNKNOWN))
                .grating(primary.header("GRATING").orElse(HeaderInfo.UNKNOWN))
                .obsDate(primary.header("DATE-OBS").orElse(HeaderInfo.UNKNOWN))
                .exposureTime(primary.header("EXPTIME").orElse(HeaderInfo.UNKNOWN))
                .fluxUnit(resolveFluxUnit(container))
                .build();
    }

    static String resolveFluxUnit(FitsContainer container) {
        Optional<String> unit = container.primary().header("BUNIT");
        if (unit.isPresent()) {
            return unit.get();
        }
        Optional<FitsHdu> extract = container.find(FitsNames.EXTRACT1D);
        if (extract.isEmpty()) {
            return DEFAULT_FLUX_UNIT;
        }
        unit = extract.get().header("BUNIT");
        if (unit.isPresent()) {
            return unit.get();
        }
        for (int i = 1; i <= MAX_COLUMN_INDEX; i++) {
            Optional<String> columnUnit = extract.get().header("TUNIT" + i);
            String columnType = extract.get().header("TTYPE" + i).orElse("");
            if (columnUnit.isPresent() && columnType.toLowerCase(Locale.ROOT).contains("flux")) {
                return columnUnit.get();
            }
        }
        return DEFAULT_FLUX_UNIT;
    }
}
