package com.id.spectra.modules.loader.logic;

import com.id.spectra.modules.loader.container.FitsHdu;

import java.io.IOException;

record TableRows(double[][] wavelength, double[][] flux, double[][] error) {

    static TableRows read(FitsHdu table) throws IOException {
        double[][] error = table.hasColumn(FitsNames.FLUX_ERROR) ? table.rows(FitsNames.FLUX_ERROR) : null;
        return new TableRows(table.rows(FitsNames.WAVELENGTH), table.rows(FitsNames.FLUX), error);
    }

    int count() {
        return Math.min(wavelength.length, flux.length);
    }

    double[] wavelength(int row) {
        return wavelength[row];
    }

    double[] flux(int row) {
        return flux[row];
    }

    double[] error(int row) {
        return error == null || row >= error.length ? null : error[row];
    }
}
