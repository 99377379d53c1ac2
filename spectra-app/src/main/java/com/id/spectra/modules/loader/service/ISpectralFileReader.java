package com.id.spectra.modules.loader.service;

import com.id.spectra.modules.loader.model.IntegrationCallback;
import com.id.spectra.modules.loader.model.LoadedFile;
import com.id.spectra.modules.loader.model.ScanResult;

import java.nio.file.Path;
import java.util.Optional;

public interface ISpectralFileReader {

    boolean supports(Path path);

    ScanResult scan(Path path);

    Optional<LoadedFile> load(Path path, IntegrationCallback callback);
}
