package com.id.spectra.modules.cache.rest;

import com.id.spectra.modules.cache.model.CacheEntryMetadata;
import com.id.spectra.modules.cache.model.CacheStats;
import com.id.spectra.modules.cache.service.DatasetCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CacheRest.class)
@AutoConfigureMockMvc(addFilters = false)
class CacheRestTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DatasetCache datasetCache;

    @Test
    void statsListEntriesWithSidecarNames() throws Exception {
        CacheEntryMetadata entry = CacheEntryMetadata.builder()
                .cacheKey("abc")
                .size(2048)
                .originalFile("batch.zip")
                .useInterpolation(true)
                .build();
        when(datasetCache.stats()).thenReturn(new CacheStats(1, 2048, 10_737_418_240L, 24, "/tmp/spectra_cache", List.of(entry)));

        mockMvc.perform(get("/cache/stats").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entryCount").value(1))
                .andExpect(jsonPath("$.maxSizeBytes").value(10_737_418_240L))
                .andExpect(jsonPath("$.entries[0].cache_key").value("abc"))
                .andExpect(jsonPath("$.entries[0].original_file").value("batch.zip"));
    }

    @Test
    void clearReportsRemovedFiles() throws Exception {
        when(datasetCache.clear()).thenReturn(6);

        mockMvc.perform(delete("/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(6));

        verify(datasetCache).clear();
    }
}
