package com.id.spectra.utils;

import com.id.spectra.model.DatasetMetadata;
import com.id.spectra.model.SpectralDataset;

public class SpectralDatasetBuilder {

    private double[] commonWavelength;
    private double[][] fluxRaw;
    private double[][] fluxNormalized;
    private double[][] errorRaw;
    private double[] timeHours;
    private DatasetMetadata metadata;

    public SpectralDatasetBuilder commonWavelength(double[] commonWavelength) {
        this.commonWavelength = commonWavelength;
        return this;
    }

    public SpectralDatasetBuilder fluxRaw(double[][] fluxRaw) {
        this.fluxRaw = fluxRaw;
        return this;
    }

    public SpectralDatasetBuilder fluxNormalized(double[][] fluxNormalized) {
        this.fluxNormalized = fluxNormalized;
        return this;
    }

    public SpectralDatasetBuilder errorRaw(double[][] errorRaw) {
        this.errorRaw = errorRaw;
        return this;
    }

    public SpectralDatasetBuilder timeHours(double[] timeHours) {
        this.timeHours = timeHours;
        return this;
    }

    public SpectralDatasetBuilder metadata(DatasetMetadata metadata) {
        this.metadata = metadata;
        return this;
    }

    /**
     * Starts a builder from an existing dataset; arrays are shared, so callers replacing a matrix
     * must pass a fresh one.
     *
     * @param source - dataset to copy references from
     * @return this builder
     */
    public SpectralDatasetBuilder from(SpectralDataset source) {
        this.commonWavelength = source.getCommonWavelength();
        this.fluxRaw = source.getFluxRaw();
        this.fluxNormalized = source.getFluxNormalized();
        this.errorRaw = source.getErrorRaw();
        this.timeHours = source.getTimeHours();
        this.metadata = source.getMetadata();
        return this;
    }

    /**
     * Keeps only the given wavelength rows and time columns of every matrix and axis.
     *
     * @param rows    - wavelength indices to keep, ascending
     * @param columns - time indices to keep, ascending
     * @return this builder
     */
    public SpectralDatasetBuilder select(int[] rows, int[] columns) {
        this.commonWavelength = pick(commonWavelength, rows);
        this.timeHours = pick(timeHours, columns);
        this.fluxRaw = pick(fluxRaw, rows, columns);
        this.fluxNormalized = pick(fluxNormalized, rows, columns);
        this.errorRaw = pick(errorRaw, rows, columns);
        return this;
    }

    public SpectralDataset build() {
        return new SpectralDataset(commonWavelength, fluxRaw, fluxNormalized, errorRaw, timeHours, metadata);
    }

    private static double[] pick(double[] source, int[] indices) {
        double[] out = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            out[i] = source[indices[i]];
        }
        return out;
    }

    private static double[][] pick(double[][] source, int[] rows, int[] columns) {
        double[][] out = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            out[r] = pick(source[rows[r]], columns);
        }
        return out;
    }
}
