package com.id.spectra.modules.loader.model;

public enum FitsLayout {
    EMBEDDED_TIME_TABLE,
    SEPARATE_TIME_TABLE,
    INDEXED_EXTENSIONS
}
