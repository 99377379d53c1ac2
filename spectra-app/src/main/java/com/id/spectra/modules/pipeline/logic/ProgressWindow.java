package com.id.spectra.modules.pipeline.logic;

public record ProgressWindow(double start, double end) {

    public static final ProgressWindow SCAN = new ProgressWindow(2.0, 10.0);
    public static final ProgressWindow READ = new ProgressWindow(10.0, 60.0);
    public static final ProgressWindow REGRID = new ProgressWindow(60.0, 88.0);
    public static final ProgressWindow INTERPOLATE = new ProgressWindow(88.0, 92.0);
    public static final double FINALIZE = 92.0;

    public double percentFor(long done, long total) {
        if (total <= 0) {
            return start;
        }
        double fraction = Math.min(1.0, Math.max(0.0, (double) done / total));
        return start + (end - start) * fraction;
    }
}
