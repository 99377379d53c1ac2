package com.id.spectra.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Getter
public class AppConfig {

    @Value("${spectra.cache.dir:${java.io.tmpdir}/spectra_cache}")
    private String cacheDir;

    @Value("${spectra.cache.ttl-hours:24}")
    private double cacheTtlHours;

    @Value("${spectra.cache.max-size-bytes:10737418240}")
    private long cacheMaxSizeBytes;

    @Value("${spectra.cache.artifact-ttl-minutes:10}")
    private long artifactTtlMinutes;

    @Value("${spectra.regrid.wavelength-points:1000}")
    private int wavelengthPoints;

    @Value("${spectra.regrid.worker-threads:0}")
    private int rowWorkerThreads;

    @Value("${spectra.visits.gap-threshold-hours:0.5}")
    private double visitGapThresholdHours;

    @Value("${spectra.display.max-time-columns:1000}")
    private int displayMaxTimeColumns;

    @Value("${spectra.jobs.max-history:100}")
    private int jobsMaxHistory;

    @Value("${spectra.jobs.retention-minutes:60}")
    private long jobsRetentionMinutes;

    @Value("${spectra.jobs.work-dir:${java.io.tmpdir}/spectra_jobs}")
    private String jobsWorkDir;

    @Value("${spectra.demo.archive:}")
    private String demoArchive;
}
