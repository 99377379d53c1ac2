package com.id.spectra.modules.regrid.logic;

import java.util.Arrays;

/**
 * Statistics that ignore NaN samples. All return NaN when no finite-or-infinite value is left.
 */
public final class NanStats {

    private NanStats() {
    }

    public static double nanMedian(double[] values) {
        return nanMedian(values, 0, values.length);
    }

    /**
     * Median of values[from, to) ignoring NaN.
     */
    public static double nanMedian(double[] values, int from, int to) {
        double[] kept = new double[to - from];
        int n = 0;
        for (int i = from; i < to; i++) {
            if (!Double.isNaN(values[i])) {
                kept[n++] = values[i];
            }
        }
        if (n == 0) {
            return Double.NaN;
        }
        Arrays.sort(kept, 0, n);
        int mid = n / 2;
        return n % 2 == 1 ? kept[mid] : (kept[mid - 1] + kept[mid]) / 2.0;
    }

    public static double nanMin(double[] values) {
        double min = Double.NaN;
        for (double v : values) {
            if (!Double.isNaN(v) && (Double.isNaN(min) || v < min)) {
                min = v;
            }
        }
        return min;
    }

    public static double nanMax(double[] values) {
        double max = Double.NaN;
        for (double v : values) {
            if (!Double.isNaN(v) && (Double.isNaN(max) || v > max)) {
                max = v;
            }
        }
        return max;
    }
}
