package com.id.spectra.modules.loader.logic;

import com.id.spectra.modules.loader.container.ColumnarContainer;
import com.id.spectra.modules.loader.model.FieldCandidate;
import com.id.spectra.modules.loader.model.SpectralQuantity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ColumnarLayouts {

    private static final Map<SpectralQuantity, List<FieldCandidate>> CANDIDATES = new EnumMap<>(SpectralQuantity.class);

    static {
        CANDIDATES.put(SpectralQuantity.FLUX, List.of(
                FieldCandidate.of("calibrated_optspec"),
                FieldCandidate.of("stdspec"),
                FieldCandidate.of("optspec")));
        CANDIDATES.put(SpectralQuantity.WAVELENGTH, List.of(
                FieldCandidate.of("eureka_wave_1d"),
                FieldCandidate.of("wave_1d"),
                FieldCandidate.of("wavelength"),
                FieldCandidate.of("wave")));
        CANDIDATES.put(SpectralQuantity.TIME, List.of(
                FieldCandidate.of("time"),
                FieldCandidate.of("bmjd"),
                FieldCandidate.of("mjd"),
                FieldCandidate.of("bjd"),
                FieldCandidate.of("time_bjd"),
                FieldCandidate.of("time_mjd")));
        // stdvar holds a variance
        CANDIDATES.put(SpectralQuantity.ERROR, List.of(
                FieldCandidate.of("calibrated_opterr"),
                FieldCandidate.of("stdvar", Math::sqrt),
                FieldCandidate.of("error"),
                FieldCandidate.of("flux_error"),
                FieldCandidate.of("sigma")));
    }

    private ColumnarLayouts() {
    }

    public static List<FieldCandidate> candidates(SpectralQuantity quantity) {
        return CANDIDATES.get(quantity);
    }

    public static Optional<FieldCandidate> resolve(ColumnarContainer container, SpectralQuantity quantity) {
        return candidates(quantity).stream()
                .filter(candidate -> container.has(candidate.name()))
                .findFirst();
    }
}
