package com.id.spectra.modules.jobs.model;

public record CustomBand(String name, double start, double end) {
}
