package com.id.spectra.modules.cache.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.id.spectra.config.AppConfig;
import com.id.spectra.model.SpectralDataset;
import com.id.spectra.modules.cache.logic.CacheEvictionPolicy;
import com.id.spectra.modules.cache.logic.CacheKeyHasher;
import com.id.spectra.modules.cache.logic.DatasetBlobCodec;
import com.id.spectra.modules.cache.model.CacheEntryMetadata;
import com.id.spectra.modules.cache.model.CacheStats;
import com.id.spectra.modules.cache.model.CachedArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Content-addressed disk cache of processed datasets, plus short-lived artifact files.
 * <p>
 * Every entry is a blob and a JSON sidecar named after its key in one flat directory. Failures
 * never reach the caller: reads degrade to a miss, writes to a no-op.
 */
@Slf4j
@Service
public class DatasetCache {

    private static final String META_SUFFIX = "_meta.json";
    private static final String DATASET_SUFFIX = ".dataset";
    private static final String ARTIFACT_SUFFIX = ".artifact";
    private static final String TMP_SUFFIX = ".tmp";
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final Path cacheDir;
    private final double ttlHours;
    private final long maxSizeBytes;
    private final long artifactTtlSeconds;
    private final ObjectMapper objectMapper;
    private final DatasetBlobCodec codec;
    private final Clock clock;
    private final Object lock = new Object();

    @Autowired
    public DatasetCache(AppConfig appConfig, ObjectMapper objectMapper) {
        this(Paths.get(appConfig.getCacheDir()), appConfig.getCacheTtlHours(), appConfig.getCacheMaxSizeBytes(),
                appConfig.getArtifactTtlMinutes() * 60, objectMapper, Clock.systemUTC());
    }

    public DatasetCache(Path cacheDir, double ttlHours, long maxSizeBytes, long artifactTtlSeconds,
                        ObjectMapper objectMapper, Clock clock) {
        this.cacheDir = cacheDir;
        this.ttlHours = ttlHours;
        this.maxSizeBytes = maxSizeBytes;
        this.artifactTtlSeconds = artifactTtlSeconds;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.codec = new DatasetBlobCodec(objectMapper);
        this.clock = clock;
        try {
            Files.createDirectories(cacheDir);
        } catch (IOException e) {
            log.error("Cannot create cache directory {}: {}", cacheDir, e.getMessage(), e);
        }
        log.info("Cache initialized: {} (TTL: {}h, max size: {} bytes)", cacheDir, ttlHours, maxSizeBytes);
    }

    /**
     * @param file             - input whose bytes identify the entry
     * @param useInterpolation - second half of the key
     * @return the stored dataset, or empty on miss, expiry or any read failure
     */
    public Optional<SpectralDataset> get(Path file, boolean useInterpolation) {
        try {
            String key = CacheKeyHasher.hash(file, useInterpolation);
            synchronized (lock) {
                Path blob = blobPath(key, DATASET_SUFFIX);
                Path meta = metaPath(key);
                if (!Files.exists(blob) || !Files.exists(meta)) {
                    log.info("Cache miss: key {}... not found", shortKey(key));
                    return Optional.empty();
                }
                CacheEntryMetadata metadata = readMeta(meta);
                double age = now() - metadata.getTimestamp();
                if (age > ttlHours * 3600) {
                    log.info("Cache expired: key {}... (age {}h)", shortKey(key), String.format("%.1f", age / 3600));
                    removeEntry(key);
                    return Optional.empty();
                }

                SpectralDataset dataset;
                try (InputStream in = Files.newInputStream(blob)) {
                    dataset = codec.read(in);
                }
                metadata.setLastAccess(now());
                metadata.setAccessCount(metadata.getAccessCount() + 1);
                writeMeta(key, metadata);
                log.info("Cache HIT: key {}... (size {} MB)", shortKey(key),
                        String.format("%.1f", metadata.getSize() / BYTES_PER_MB));
                return Optional.of(dataset);
            }
        } catch (Exception e) {
            log.error("Error reading cache for {}: {}", file.getFileName(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Stores the dataset under the key of (file bytes, flag) and trims the cache to its size cap.
     */
    public void set(Path file, boolean useInterpolation, SpectralDataset dataset) {
        try {
            String key = CacheKeyHasher.hash(file, useInterpolation);
            synchronized (lock) {
                Path blob = blobPath(key, DATASET_SUFFIX);
                Path tmp = cacheDir.resolve(key + DATASET_SUFFIX + TMP_SUFFIX);
                try (OutputStream out = Files.newOutputStream(tmp)) {
                    codec.write(dataset, out);
                }
                Files.move(tmp, blob, StandardCopyOption.REPLACE_EXISTING);

                double now = now();
                CacheEntryMetadata metadata = CacheEntryMetadata.builder()
                        .kind(CacheEntryMetadata.KIND_DATASET)
                        .cacheKey(key)
                        .timestamp(now)
                        .lastAccess(now)
                        .accessCount(0)
                        .size(Files.size(blob))
                        .originalFile(file.getFileName().toString())
                        .useInterpolation(useInterpolation)
                        .dataInfo(new CacheEntryMetadata.DataInfo(dataset.wavelengthCount(), dataset.timeCount(),
                                dataset.getMetadata().getTotalIntegrations()))
                        .build();
                writeMeta(key, metadata);
                log.info("Cached {}... : {} MB ({} wavelengths, {} time points)", shortKey(key),
                        String.format("%.1f", metadata.getSize() / BYTES_PER_MB),
                        dataset.wavelengthCount(), dataset.timeCount());
                enforceSizeLimit();
            }
        } catch (Exception e) {
            log.error("Error writing cache for {}: {}", file.getFileName(), e.getMessage(), e);
        }
    }

    /**
     * Moves {@code source} into the cache under a fresh token valid for the artifact TTL.
     *
     * @return the token, or empty when the file could not be stored
     */
    public Optional<String> putArtifact(Path source, String downloadName) {
        String token = UUID.randomUUID().toString().replace("-", "");
        try {
            synchronized (lock) {
                Path blob = blobPath(token, ARTIFACT_SUFFIX);
                Files.move(source, blob, StandardCopyOption.REPLACE_EXISTING);
                double now = now();
                writeMeta(token, CacheEntryMetadata.builder()
                        .kind(CacheEntryMetadata.KIND_ARTIFACT)
                        .cacheKey(token)
                        .timestamp(now)
                        .lastAccess(now)
                        .size(Files.size(blob))
                        .originalFile(downloadName)
                        .ttlSeconds(artifactTtlSeconds)
                        .build());
                enforceSizeLimit();
            }
            return Optional.of(token);
        } catch (Exception e) {
            log.error("Error storing artifact {}: {}", downloadName, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public Optional<CachedArtifact> getArtifact(String token) {
        if (token == null || !token.matches("[0-9a-f]{32}")) {
            return Optional.empty();
        }
        try {
            synchronized (lock) {
                Path blob = blobPath(token, ARTIFACT_SUFFIX);
                Path meta = metaPath(token);
                if (!Files.exists(blob) || !Files.exists(meta)) {
                    return Optional.empty();
                }
                CacheEntryMetadata metadata = readMeta(meta);
                if (isExpired(metadata)) {
                    removeEntry(token);
                    return Optional.empty();
                }
                metadata.setLastAccess(now());
                metadata.setAccessCount(metadata.getAccessCount() + 1);
                writeMeta(token, metadata);
                return Optional.of(new CachedArtifact(token, blob, metadata.getOriginalFile()));
            }
        } catch (Exception e) {
            log.error("Error reading artifact {}: {}", token, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Removes every expired entry, datasets and artifacts alike.
     *
     * @return number of entries removed
     */
    @Scheduled(fixedDelayString = "${spectra.jobs.sweep-interval-ms:60000}")
    public int purgeExpired() {
        int removed = 0;
        synchronized (lock) {
            for (CacheEntryMetadata entry : listEntries()) {
                if (isExpired(entry)) {
                    removeEntry(entry.getCacheKey());
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Purged {} expired cache entries", removed);
        }
        return removed;
    }

    /**
     * @return number of files deleted
     */
    public int clear() {
        int removed = 0;
        synchronized (lock) {
            try (DirectoryStream<Path> files = Files.newDirectoryStream(cacheDir)) {
                for (Path path : files) {
                    if (Files.isRegularFile(path)) {
                        Files.delete(path);
                        removed++;
                    }
                }
            } catch (IOException e) {
                log.error("Error clearing cache: {}", e.getMessage(), e);
            }
        }
        log.info("Cache cleared: {} files removed", removed);
        return removed;
    }

    public CacheStats stats() {
        List<CacheEntryMetadata> entries;
        synchronized (lock) {
            entries = listEntries();
        }
        entries.sort(Comparator.comparingDouble(CacheEntryMetadata::getLastAccess).reversed());
        return new CacheStats(entries.size(), CacheEvictionPolicy.totalSize(entries), maxSizeBytes, ttlHours,
                cacheDir.toString(), entries);
    }

    private void enforceSizeLimit() {
        List<CacheEntryMetadata> entries = listEntries();
        List<CacheEntryMetadata> victims = CacheEvictionPolicy.selectVictims(entries, maxSizeBytes);
        if (victims.isEmpty()) {
            return;
        }
        log.warn("Cache size {} bytes exceeds limit of {} bytes, removing {} oldest entries",
                CacheEvictionPolicy.totalSize(entries), maxSizeBytes, victims.size());
        for (CacheEntryMetadata victim : victims) {
            removeEntry(victim.getCacheKey());
        }
    }

    private boolean isExpired(CacheEntryMetadata entry) {
        double ttlSeconds = entry.getTtlSeconds() != null ? entry.getTtlSeconds() : ttlHours * 3600;
        return now() - entry.getTimestamp() > ttlSeconds;
    }

    private List<CacheEntryMetadata> listEntries() {
        List<CacheEntryMetadata> entries = new ArrayList<>();
        try (DirectoryStream<Path> metas = Files.newDirectoryStream(cacheDir, "*" + META_SUFFIX)) {
            for (Path meta : metas) {
                try {
                    entries.add(readMeta(meta));
                } catch (IOException e) {
                    log.warn("Could not read cache metadata {}: {}", meta.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Error listing cache directory {}: {}", cacheDir, e.getMessage(), e);
        }
        return entries;
    }

    private void removeEntry(String key) {
        for (Path path : List.of(blobPath(key, DATASET_SUFFIX), blobPath(key, ARTIFACT_SUFFIX), metaPath(key))) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.error("Error removing cache file {}: {}", path.getFileName(), e.getMessage());
            }
        }
    }

    private CacheEntryMetadata readMeta(Path meta) throws IOException {
        return objectMapper.readValue(meta.toFile(), CacheEntryMetadata.class);
    }

    private void writeMeta(String key, CacheEntryMetadata metadata) throws IOException {
        Path tmp = cacheDir.resolve(key + META_SUFFIX + TMP_SUFFIX);
        objectMapper.writeValue(tmp.toFile(), metadata);
        Files.move(tmp, metaPath(key), StandardCopyOption.REPLACE_EXISTING);
    }

    private Path blobPath(String key, String suffix) {
        return cacheDir.resolve(key + suffix);
    }

    private Path metaPath(String key) {
        return cacheDir.resolve(key + META_SUFFIX);
    }

    private double now() {
        return clock.millis() / 1000.0;
    }

    private static String shortKey(String key) {
        return key.substring(0, Math.min(12, key.length()));
    }
}
