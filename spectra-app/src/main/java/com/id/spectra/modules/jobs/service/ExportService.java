package com.id.spectra.modules.jobs.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.spectra.modules.cache.service.DatasetCache;
import com.id.spectra.modules.jobs.model.JobResultPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class ExportService {

    private final DatasetCache datasetCache;
    private final UploadStorage uploadStorage;
    private final ObjectMapper objectMapper;

    public Optional<String> exportPayload(JobResultPayload payload) {
        Path file = uploadStorage.createScratchFile("export_", ".json");
        try {
            objectMapper.writeValue(file.toFile(), payload);
        } catch (IOException e) {
            deleteQuietly(file);
            throw new UncheckedIOException("Failed to write export for job " + payload.getJobId(), e);
        }
        Optional<String> token = datasetCache.putArtifact(file, "spectra_" + payload.getJobId() + ".json");
        if (token.isEmpty()) {
            deleteQuietly(file);
        }
        return token;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed removing export file {}", file, e);
        }
    }
}
