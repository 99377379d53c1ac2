package com.id.spectra.modules.loader.model;

import java.nio.file.Path;

public record ScanResult(Path path, int count, Double firstTime) {

    public static ScanResult empty(Path path) {
        return new ScanResult(path, 0, null);
    }
}
