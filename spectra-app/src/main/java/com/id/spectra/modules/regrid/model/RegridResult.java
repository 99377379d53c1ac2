package com.id.spectra.modules.regrid.model;

public record RegridResult(double[] commonWavelength, double[][] fluxRaw, double[][] errorRaw, double[] timeHours) {
}
