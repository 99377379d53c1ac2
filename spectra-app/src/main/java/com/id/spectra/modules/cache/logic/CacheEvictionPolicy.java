package com.id.spectra.modules.cache.logic;

import com.id.spectra.modules.cache.model.CacheEntryMetadata;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Least-recently-accessed eviction. Once the total exceeds the cap, entries go oldest access
 * first until the total is at most {@value #LOW_WATER_MARK} of the cap.
 */
public final class CacheEvictionPolicy {

    public static final double LOW_WATER_MARK = 0.8;

    private CacheEvictionPolicy() {
    }

    public static long totalSize(List<CacheEntryMetadata> entries) {
        return entries.stream().mapToLong(CacheEntryMetadata::getSize).sum();
    }

    /**
     * @return entries to delete, in deletion order; empty when the total is within the cap
     */
    public static List<CacheEntryMetadata> selectVictims(List<CacheEntryMetadata> entries, long maxSizeBytes) {
        long total = totalSize(entries);
        List<CacheEntryMetadata> victims = new ArrayList<>();
        if (total <= maxSizeBytes) {
            return victims;
        }
        double target = maxSizeBytes * LOW_WATER_MARK;
        List<CacheEntryMetadata> byAccess = new ArrayList<>(entries);
        byAccess.sort(Comparator.comparingDouble(CacheEntryMetadata::getLastAccess));
        for (CacheEntryMetadata entry : byAccess) {
            if (total <= target) {
                break;
            }
            victims.add(entry);
            total -= entry.getSize();
        }
        return victims;
    }
}
