package com.id.spectra.modules.jobs.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
public class ProgressUpdate {

    private final Double percent;
    private final String message;
    private final JobStatus status;
    private final JobStage stage;
    private final Integer processedIntegrations;
    private final Integer totalIntegrations;
    private final Double throughput;
    private final Integer etaSeconds;

    public static ProgressUpdate of(double percent, String message, JobStage stage) {
        return ProgressUpdate.builder()
                .percent(percent)
                .message(message)
                .stage(stage)
                .build();
    }
}
