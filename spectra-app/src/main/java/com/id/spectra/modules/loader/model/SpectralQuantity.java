package com.id.spectra.modules.loader.model;

public enum SpectralQuantity {
    FLUX,
    WAVELENGTH,
    TIME,
    ERROR
}
