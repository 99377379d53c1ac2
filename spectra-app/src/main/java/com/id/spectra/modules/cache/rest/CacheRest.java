package com.id.spectra.modules.cache.rest;

import com.id.spectra.modules.cache.model.CacheStats;
import com.id.spectra.modules.cache.service.DatasetCache;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("cache")
public class CacheRest {

    private final DatasetCache datasetCache;

    public CacheRest(DatasetCache datasetCache) {
        this.datasetCache = datasetCache;
    }

    @GetMapping("stats")
    public CacheStats getStats() {
        return datasetCache.stats();
    }

    @DeleteMapping
    public Map<String, Integer> clear() {
        return Map.of("removed", datasetCache.clear());
    }
}
