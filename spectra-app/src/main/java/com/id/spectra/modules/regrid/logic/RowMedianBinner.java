package com.id.spectra.modules.regrid.logic;

/**
 * Median-binning of a row into a fixed number of consecutive, nearly equal bins.
 */
public final class RowMedianBinner {

    private RowMedianBinner() {
    }

    /**
     * @return max(1, length / target)
     */
    public static int binSize(int length, int target) {
        if (target <= 0) {
            return 1;
        }
        return Math.max(1, length / target);
    }

    /**
     * Splits [0, n) at edges j * n / bins and takes the NaN-ignoring median of each bin.
     *
     * @param row  - values to bin
     * @param bins - number of bins, at most row.length
     * @return one median per bin
     */
    public static double[] bin(double[] row, int bins) {
        int n = row.length;
        double[] out = new double[bins];
        for (int j = 0; j < bins; j++) {
            int from = (int) Math.ceil((double) j * n / bins);
            int to = j == bins - 1 ? n : (int) Math.ceil((double) (j + 1) * n / bins);
            out[j] = NanStats.nanMedian(row, from, to);
        }
        return out;
    }
}
