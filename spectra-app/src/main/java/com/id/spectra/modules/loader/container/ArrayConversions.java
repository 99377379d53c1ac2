package com.id.spectra.modules.loader.container;

import java.lang.reflect.Array;

/**
 * Converts the loosely typed arrays handed out by container libraries into double vectors.
 */
public final class ArrayConversions {

    private ArrayConversions() {
    }

    /**
     * Flattens any numeric (possibly nested) array into a row-major double vector.
     *
     * @param data - primitive or nested array, or a boxed number
     * @return flattened values
     */
    public static double[] flatten(Object data) {
        if (data == null) {
            return new double[0];
        }
        if (data instanceof double[] doubles) {
            return doubles.clone();
        }
        if (data instanceof Number number) {
            return new double[]{number.doubleValue()};
        }
        if (!data.getClass().isArray()) {
            throw new IllegalArgumentException("Not a numeric array: " + data.getClass().getName());
        }
        int length = Array.getLength(data);
        if (length > 0 && Array.get(data, 0) != null && Array.get(data, 0).getClass().isArray()) {
            double[][] parts = new double[length][];
            int total = 0;
            for (int i = 0; i < length; i++) {
                parts[i] = flatten(Array.get(data, i));
                total += parts[i].length;
            }
            double[] out = new double[total];
            int offset = 0;
            for (double[] part : parts) {
                System.arraycopy(part, 0, out, offset, part.length);
                offset += part.length;
            }
            return out;
        }
        double[] out = new double[length];
        for (int i = 0; i < length; i++) {
            out[i] = ((Number) Array.get(data, i)).doubleValue();
        }
        return out;
    }

    /**
     * Splits an array into per-row vectors. Nested arrays keep their outer dimension; a flat
     * array is cut into {@code rows} equal slices.
     *
     * @param data - primitive or nested array
     * @param rows - expected number of rows
     * @return one vector per row
     */
    public static double[][] toRows(Object data, int rows) {
        if (data == null) {
            return new double[0][];
        }
        if (data.getClass().isArray() && Array.getLength(data) > 0
                && Array.get(data, 0) != null && Array.get(data, 0).getClass().isArray()) {
            int length = Array.getLength(data);
            double[][] out = new double[length][];
            for (int i = 0; i < length; i++) {
                out[i] = flatten(Array.get(data, i));
            }
            return out;
        }
        double[] flat = flatten(data);
        if (rows <= 0 || flat.length % rows != 0) {
            throw new IllegalArgumentException("Cannot split %d values into %d rows".formatted(flat.length, rows));
        }
        int width = flat.length / rows;
        double[][] out = new double[rows][width];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(flat, r * width, out[r], 0, width);
        }
        return out;
    }
}
