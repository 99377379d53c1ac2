package com.id.spectra.modules.jobs.model;

import java.time.Instant;

public record JobView(
        String id,
        JobStatus status,
        double percent,
        JobStage stage,
        String message,
        Integer processedIntegrations,
        Integer totalIntegrations,
        Double throughput,
        Integer etaSeconds,
        Instant startedAt,
        Instant completedAt
) {
}
