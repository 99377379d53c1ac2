package com.id.spectra.modules.loader.logic;

import com.id.spectra.model.Integration;
import com.id.spectra.modules.loader.model.IntegrationCallback;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Filters raw per-integration samples and accumulates the usable integrations of one file.
 * Samples with a non-finite flux or wavelength are dropped; integrations left with fewer than
 * {@value #MIN_VALID_SAMPLES} samples are skipped.
 */
@Slf4j
public class IntegrationCollector {

    public static final int MIN_VALID_SAMPLES = 10;
    private static final int VERBOSE_INTEGRATIONS = 3;

    private final String filename;
    private final IntegrationCallback callback;
    private final List<Integration> integrations = new ArrayList<>();
    private int skipped;

    public IntegrationCollector(String filename, IntegrationCallback callback) {
        this.filename = filename;
        this.callback = callback == null ? IntegrationCallback.NONE : callback;
    }

    /**
     * @param index      - 1-based integration index in the file
     * @param totalHint  - integrations the file announces
     * @param wavelength - raw wavelength samples
     * @param flux       - raw flux samples
     * @param error      - raw error samples, or null when the file has none
     * @param time       - integration time (MJD)
     * @return true when the integration was kept
     */
    public boolean accept(int index, int totalHint, double[] wavelength, double[] flux, double[] error, double time) {
        int length = Math.min(wavelength.length, flux.length);
        double[] err = error;
        if (err == null || err.length < length) {
            err = new double[length];
            Arrays.fill(err, Double.NaN);
        }

        int valid = 0;
        for (int i = 0; i < length; i++) {
            if (Double.isFinite(flux[i]) && Double.isFinite(wavelength[i])) {
                valid++;
            }
        }
        if (index <= VERBOSE_INTEGRATIONS) {
            log.info("{}: integration {} has {}/{} valid flux points, time={}", filename, index, valid, length, time);
        }
        if (valid < MIN_VALID_SAMPLES) {
            log.warn("{}: skipping integration {}, only {} valid points", filename, index, valid);
            skipped++;
            return false;
        }

        double[] w = new double[valid];
        double[] f = new double[valid];
        double[] e = new double[valid];
        int k = 0;
        for (int i = 0; i < length; i++) {
            if (Double.isFinite(flux[i]) && Double.isFinite(wavelength[i])) {
                w[k] = wavelength[i];
                f[k] = flux[i];
                e[k] = err[i];
                k++;
            }
        }
        integrations.add(new Integration(w, f, e, time));
        callback.onIntegration(index, totalHint);
        return true;
    }

    public void skip(int index, String reason) {
        log.warn("{}: skipping integration {}, {}", filename, index, reason);
        skipped++;
    }

    public List<Integration> integrations() {
        return integrations;
    }

    public int skipped() {
        return skipped;
    }

    public boolean isEmpty() {
        return integrations.isEmpty();
    }
}
