package com.id.spectra.modules.jobs.model;

public record ValueRange(Double min, Double max) {

    public boolean isEmpty() {
        return min == null && max == null;
    }

    public static ValueRange of(Double min, Double max) {
        if (min == null && max == null) {
            return null;
        }
        return new ValueRange(min, max);
    }
}
