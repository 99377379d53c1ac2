package com.id.spectra.modules.regrid.logic;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Piecewise-linear 1-D interpolation.
 */
public final class LinearInterpolator {

    private LinearInterpolator() {
    }

    /**
     * Samples the polyline through (xs, ys) at each target. Unsorted xs are sorted first.
     *
     * @param xs          - sample positions
     * @param ys          - sample values, same length as xs
     * @param targets     - positions to evaluate
     * @param extrapolate - extend the first/last segment beyond the sample range instead of
     *                    returning NaN
     * @return one value per target
     */
    public static double[] interpolate(double[] xs, double[] ys, double[] targets, boolean extrapolate) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("x and y differ in length: %d vs %d".formatted(xs.length, ys.length));
        }
        double[] out = new double[targets.length];
        if (xs.length == 0) {
            Arrays.fill(out, Double.NaN);
            return out;
        }

        double[] x = xs;
        double[] y = ys;
        if (!isSorted(xs)) {
            int[] order = IntStream.range(0, xs.length)
                    .boxed()
                    .sorted(Comparator.comparingDouble(i -> xs[i]))
                    .mapToInt(Integer::intValue)
                    .toArray();
            x = new double[xs.length];
            y = new double[ys.length];
            for (int i = 0; i < order.length; i++) {
                x[i] = xs[order[i]];
                y[i] = ys[order[i]];
            }
        }

        int last = x.length - 1;
        for (int t = 0; t < targets.length; t++) {
            double target = targets[t];
            if (Double.isNaN(target)) {
                out[t] = Double.NaN;
            } else if (last == 0) {
                out[t] = (extrapolate || target == x[0]) ? y[0] : Double.NaN;
            } else if (target < x[0] || target > x[last]) {
                if (!extrapolate) {
                    out[t] = Double.NaN;
                } else if (target < x[0]) {
                    out[t] = segment(x, y, 0, target);
                } else {
                    out[t] = segment(x, y, last - 1, target);
                }
            } else {
                int lo = Arrays.binarySearch(x, target);
                if (lo >= 0) {
                    out[t] = y[lo];
                } else {
                    int insertion = -lo - 1;
                    out[t] = segment(x, y, insertion - 1, target);
                }
            }
        }
        return out;
    }

    private static double segment(double[] x, double[] y, int i, double target) {
        double dx = x[i + 1] - x[i];
        if (dx == 0) {
            return y[i];
        }
        return y[i] + (y[i + 1] - y[i]) * (target - x[i]) / dx;
    }

    private static boolean isSorted(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[i - 1]) {
                return false;
            }
        }
        return true;
    }

    /**
     * {@code count} evenly spaced values from start to end, both included.
     */
    public static double[] linspace(double start, double end, int count) {
        double[] out = new double[count];
        if (count == 1) {
            out[0] = start;
            return out;
        }
        double step = (end - start) / (count - 1);
        for (int i = 0; i < count; i++) {
            out[i] = start + step * i;
        }
        out[count - 1] = end;
        return out;
    }
}
