package com.id.spectra.modules.regrid.logic;

import lombok.extern.slf4j.Slf4j;

/**
 * Divides each wavelength row by its own median over time, so a steady source sits at 1.0.
 */
@Slf4j
public final class VariabilityNormalizer {

    private VariabilityNormalizer() {
    }

    /**
     * @param fluxRaw - [wavelength][time] flux
     * @return new [wavelength][time] matrix; rows with a zero median are divided by 1, all-NaN rows stay NaN
     */
    public static double[][] normalize(double[][] fluxRaw) {
        double[][] out = new double[fluxRaw.length][];
        for (int w = 0; w < fluxRaw.length; w++) {
            double median = rowDivisor(fluxRaw[w]);
            double[] row = new double[fluxRaw[w].length];
            for (int t = 0; t < row.length; t++) {
                row[t] = fluxRaw[w][t] / median;
            }
            out[w] = row;
        }
        log.info("Normalized flux range: {} to {}", minOf(out), maxOf(out));
        return out;
    }

    /**
     * @return the row's NaN-ignoring median, with 0 replaced by 1
     */
    public static double rowDivisor(double[] row) {
        double median = NanStats.nanMedian(row);
        return median == 0.0 ? 1.0 : median;
    }

    private static double minOf(double[][] matrix) {
        double min = Double.NaN;
        for (double[] row : matrix) {
            double rowMin = NanStats.nanMin(row);
            if (!Double.isNaN(rowMin) && (Double.isNaN(min) || rowMin < min)) {
                min = rowMin;
            }
        }
        return min;
    }

    private static double maxOf(double[][] matrix) {
        double max = Double.NaN;
        for (double[] row : matrix) {
            double rowMax = NanStats.nanMax(row);
            if (!Double.isNaN(rowMax) && (Double.isNaN(max) || rowMax > max)) {
                max = rowMax;
            }
        }
        return max;
    }
}
