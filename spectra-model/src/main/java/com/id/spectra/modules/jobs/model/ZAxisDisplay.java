package com.id.spectra.modules.jobs.model;

import java.util.Locale;

public enum ZAxisDisplay {
    VARIABILITY,
    FLUX;

    public static ZAxisDisplay resolve(String raw) {
        if (raw == null || raw.isBlank()) {
            return VARIABILITY;
        }
        try {
            return ZAxisDisplay.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return VARIABILITY;
        }
    }
}
