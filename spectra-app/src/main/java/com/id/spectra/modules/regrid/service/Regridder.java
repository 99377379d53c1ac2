package com.id.spectra.modules.regrid.service;

import com.id.spectra.config.AppConfig;
import com.id.spectra.model.Integration;
import com.id.spectra.modules.regrid.logic.LinearInterpolator;
import com.id.spectra.modules.regrid.model.RegridListener;
import com.id.spectra.modules.regrid.model.RegridResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
public class Regridder {

    private static final double HOURS_PER_DAY = 24.0;

    private final int wavelengthPoints;

    @Autowired
    public Regridder(AppConfig appConfig) {
        this(appConfig.getWavelengthPoints());
    }

    Regridder(int wavelengthPoints) {
        if (wavelengthPoints < 2) {
            throw new IllegalArgumentException("Wavelength grid needs at least 2 points, got " + wavelengthPoints);
        }
        this.wavelengthPoints = wavelengthPoints;
    }

    public int getWavelengthPoints() {
        return wavelengthPoints;
    }

    public RegridResult regrid(List<Integration> integrations, RegridListener listener) {
        if (integrations.isEmpty()) {
            throw new IllegalArgumentException("No integrations to regrid");
        }
        List<Integration> sorted = new ArrayList<>(integrations);
        sorted.sort(Comparator.comparingDouble(Integration::time));

        // Intersection of all ranges
        double minWavelength = Double.NEGATIVE_INFINITY;
        double maxWavelength = Double.POSITIVE_INFINITY;
        for (Integration integration : sorted) {
            minWavelength = Math.max(minWavelength, integration.minWavelength());
            maxWavelength = Math.min(maxWavelength, integration.maxWavelength());
        }
        if (!(minWavelength < maxWavelength)) {
            throw new IllegalStateException("Integrations share no common wavelength range (%.4f - %.4f)"
                    .formatted(minWavelength, maxWavelength));
        }
        double[] grid = LinearInterpolator.linspace(minWavelength, maxWavelength, wavelengthPoints);
        log.info("Common wavelength grid: {} points, {} - {} um", wavelengthPoints, minWavelength, maxWavelength);

        int count = sorted.size();
        double[][] flux = new double[wavelengthPoints][count];
        double[][] error = new double[wavelengthPoints][count];
        double[] timeHours = new double[count];
        double t0 = sorted.get(0).time();
        RegridListener callback = listener == null ? RegridListener.NONE : listener;

        long start = System.nanoTime();
        for (int k = 0; k < count; k++) {
            Integration integration = sorted.get(k);
            double[] f = LinearInterpolator.interpolate(integration.wavelength(), integration.flux(), grid, false);
            double[] e = LinearInterpolator.interpolate(integration.wavelength(), integration.error(), grid, false);
            for (int w = 0; w < wavelengthPoints; w++) {
                flux[w][k] = f[w];
                error[w][k] = e[w];
            }
            timeHours[k] = (integration.time() - t0) * HOURS_PER_DAY;

            double elapsed = (System.nanoTime() - start) / 1e9;
            callback.onIntegration(k + 1, count, elapsed > 0 ? (k + 1) / elapsed : null);
        }
        return new RegridResult(grid, flux, error, timeHours);
    }
}
