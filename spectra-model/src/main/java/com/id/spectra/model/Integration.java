package com.id.spectra.model;

import java.util.Objects;

public record Integration(double[] wavelength, double[] flux, double[] error, double time) {

    public Integration {
        Objects.requireNonNull(wavelength, "wavelength");
        Objects.requireNonNull(flux, "flux");
        Objects.requireNonNull(error, "error");
        if (wavelength.length != flux.length || flux.length != error.length) {
            throw new IllegalArgumentException("Integration arrays differ in length: wavelength=%d, flux=%d, error=%d"
                    .formatted(wavelength.length, flux.length, error.length));
        }
    }

    public int size() {
        return wavelength.length;
    }

    public double minWavelength() {
        double min = Double.POSITIVE_INFINITY;
        for (double w : wavelength) {
            min = Math.min(min, w);
        }
        return min;
    }

    public double maxWavelength() {
        double max = Double.NEGATIVE_INFINITY;
        for (double w : wavelength) {
            max = Math.max(max, w);
        }
        return max;
    }
}
