package com.id.spectra.modules.jobs.service;

import com.id.spectra.config.AppConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class UploadStorage {

    private final AppConfig appConfig;

    public Path store(MultipartFile upload) {
        Path target = workDir().resolve("upload_" + UUID.randomUUID().toString().replace("-", "") + extension(upload));
        try {
            upload.transferTo(target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store upload " + upload.getOriginalFilename(), e);
        }
        log.info("Stored upload {} as {}", upload.getOriginalFilename(), target.getFileName());
        return target;
    }

    public Path createJobDir(String jobId) {
        try {
            return Files.createTempDirectory(workDir(), "job_" + jobId.substring(0, Math.min(8, jobId.length())) + "_");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create job directory for " + jobId, e);
        }
    }

    public Path createScratchFile(String prefix, String suffix) {
        try {
            return Files.createTempFile(workDir(), prefix, suffix);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create scratch file", e);
        }
    }

    public Optional<Path> demoArchive() {
        String configured = appConfig.getDemoArchive();
        if (configured == null || configured.isBlank()) {
            return Optional.empty();
        }
        Path path = Paths.get(configured);
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }

    private Path workDir() {
        Path dir = Paths.get(appConfig.getJobsWorkDir());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create work directory " + dir, e);
        }
        return dir;
    }

    private static String extension(MultipartFile upload) {
        String name = upload.getOriginalFilename();
        if (name == null) {
            return ".zip";
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".fits")) {
            return ".fits";
        }
        if (lower.endsWith(".h5")) {
            return ".h5";
        }
        return ".zip";
    }
}
