package com.id.spectra.modules.loader.logic;

import java.util.List;

public final class FitsNames {

    public static final String INT_TIMES = "INT_TIMES";
    public static final String INT_MID_MJD = "int_mid_MJD_UTC";
    public static final String EXTRACT1D = "EXTRACT1D";
    public static final String WAVELENGTH = "WAVELENGTH";
    public static final String FLUX = "FLUX";
    public static final String FLUX_ERROR = "FLUX_ERROR";

    // Fallback order for per-row timestamps
    public static final List<String> TIME_COLUMNS = List.of("MJD-AVG", "MJD-BEG", "MJD-END");

    private FitsNames() {
    }
}
