package com.id.spectra.model;

import com.id.spectra.utils.SpectralDatasetBuilder;
import lombok.Getter;

/**
 * The regridded product of a batch of files. Matrices are indexed [wavelength][time] and all
 * share the (commonWavelength.length, timeHours.length) shape.
 * <p>
 * Instances are never mutated once built; filtered or sampled views are new datasets. The getters
 * hand out the backing arrays, which may be shared with the dataset this one was derived from, so
 * callers must treat them as read-only.
 */
@Getter
public class SpectralDataset {

    private final double[] commonWavelength;
    private final double[][] fluxRaw;
    private final double[][] fluxNormalized;
    private final double[][] errorRaw;
    private final double[] timeHours;
    private final DatasetMetadata metadata;

    public SpectralDataset(double[] commonWavelength,
                           double[][] fluxRaw,
                           double[][] fluxNormalized,
                           double[][] errorRaw,
                           double[] timeHours,
                           DatasetMetadata metadata) {
        if (commonWavelength == null || timeHours == null) {
            throw new IllegalArgumentException("Wavelength and time axes are required");
        }
        checkShape("fluxRaw", fluxRaw, commonWavelength.length, timeHours.length);
        checkShape("fluxNormalized", fluxNormalized, commonWavelength.length, timeHours.length);
        checkShape("errorRaw", errorRaw, commonWavelength.length, timeHours.length);
        this.commonWavelength = commonWavelength;
        this.fluxRaw = fluxRaw;
        this.fluxNormalized = fluxNormalized;
        this.errorRaw = errorRaw;
        this.timeHours = timeHours;
        this.metadata = metadata == null ? new DatasetMetadata() : metadata;
    }

    public static SpectralDatasetBuilder builder() {
        return new SpectralDatasetBuilder();
    }

    public int wavelengthCount() {
        return commonWavelength.length;
    }

    public int timeCount() {
        return timeHours.length;
    }

    private static void checkShape(String name, double[][] matrix, int rows, int cols) {
        if (matrix == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (matrix.length != rows) {
            throw new IllegalArgumentException("%s has %d rows, expected %d".formatted(name, matrix.length, rows));
        }
        for (int r = 0; r < matrix.length; r++) {
            if (matrix[r] == null || matrix[r].length != cols) {
                throw new IllegalArgumentException("%s row %d does not have %d columns".formatted(name, r, cols));
            }
        }
    }
}
