package com.id.spectra.modules.regrid.service;

import com.id.spectra.modules.regrid.logic.LinearInterpolator;
import com.id.spectra.modules.regrid.model.RegridResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.IntConsumer;

/**
 * Resamples regridded data onto a uniform time axis of the same length, filling observation
 * gaps. Edges are extrapolated along time only.
 */
@Slf4j
@Service
public class TimeInterpolator {

    private final RowWorkerPool rowWorkerPool;

    public TimeInterpolator(RowWorkerPool rowWorkerPool) {
        this.rowWorkerPool = rowWorkerPool;
    }

    /**
     * @param source    - regridded data on the observed time axis
     * @param onRowDone - running count of finished flux rows, may be null
     * @return same wavelength grid, uniform time axis
     */
    public RegridResult interpolate(RegridResult source, IntConsumer onRowDone) {
        double[] observed = source.timeHours();
        if (observed.length < 2) {
            return source;
        }
        double[] grid = LinearInterpolator.linspace(observed[0], observed[observed.length - 1], observed.length);
        log.info("Interpolating {} rows onto a uniform {}-point time grid", source.fluxRaw().length, grid.length);

        double[][] flux = rowWorkerPool.mapRows(source.fluxRaw(),
                row -> LinearInterpolator.interpolate(observed, row, grid, true), onRowDone);
        double[][] error = rowWorkerPool.mapRows(source.errorRaw(),
                row -> LinearInterpolator.interpolate(observed, row, grid, true), null);
        return new RegridResult(source.commonWavelength(), flux, error, grid);
    }
}
