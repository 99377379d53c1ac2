package com.id.spectra.modules.cache.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheEntryMetadata {

    public static final String KIND_DATASET = "dataset";
    public static final String KIND_ARTIFACT = "artifact";

    @Builder.Default
    private String kind = KIND_DATASET;
    @JsonProperty("cache_key")
    private String cacheKey;
    private double timestamp;
    @JsonProperty("last_access")
    private double lastAccess;
    @JsonProperty("access_count")
    private long accessCount;
    private long size;
    @JsonProperty("original_file")
    private String originalFile;
    @JsonProperty("use_interpolation")
    private Boolean useInterpolation;
    @JsonProperty("ttl_seconds")
    private Long ttlSeconds;
    @JsonProperty("data_info")
    private DataInfo dataInfo;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DataInfo {
        @JsonProperty("wavelength_points")
        private int wavelengthPoints;
        @JsonProperty("time_points")
        private int timePoints;
        @JsonProperty("total_integrations")
        private int totalIntegrations;
    }
}
