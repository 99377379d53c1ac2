package com.id.spectra.modules.cache.model;

import java.util.List;

public record CacheStats(
        int entryCount,
        long totalSizeBytes,
        long maxSizeBytes,
        double ttlHours,
        String cacheDir,
        List<CacheEntryMetadata> entries
) {
}
