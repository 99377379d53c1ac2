package com.id.spectra.modules.loader.service;

import com.id.spectra.modules.loader.model.IntegrationCallback;
import com.id.spectra.modules.loader.model.LoadedFile;
import com.id.spectra.modules.loader.model.ScanResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class IntegrationLoader {

    private final List<ISpectralFileReader> readers;

    public IntegrationLoader(List<ISpectralFileReader> readers) {
        this.readers = readers;
    }

    public boolean isSupported(Path path) {
        return reader(path).isPresent();
    }

    public ScanResult scan(Path path) {
        return reader(path)
                .map(reader -> reader.scan(path))
                .orElseGet(() -> ScanResult.empty(path));
    }

    public Optional<LoadedFile> load(Path path, IntegrationCallback callback) {
        Optional<ISpectralFileReader> reader = reader(path);
        if (reader.isEmpty()) {
            log.warn("Unsupported file type: {}", path.getFileName());
            return Optional.empty();
        }
        return reader.get().load(path, callback == null ? IntegrationCallback.NONE : callback);
    }

    private Optional<ISpectralFileReader> reader(Path path) {
        return readers.stream()
                .filter(reader -> reader.supports(path))
                .findFirst();
    }
}
