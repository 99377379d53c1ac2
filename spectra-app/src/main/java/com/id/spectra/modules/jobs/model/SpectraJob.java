package com.id.spectra.modules.jobs.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one processing job. Every change goes through {@link #update(ProgressUpdate)},
 * which keeps the percent below 100 until the job is done and never lets it go backwards.
 */
public class SpectraJob {

    private static final double MAX_RUNNING_PERCENT = 99.0;

    private final String id;
    private final Clock clock;
    private final Instant startedAt;
    private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);

    private JobStatus status = JobStatus.RUNNING;
    private double percent;
    private JobStage stage = JobStage.QUEUED;
    private String message = "Starting";
    private Integer processedIntegrations = 0;
    private Integer totalIntegrations;
    private Double throughput;
    private Integer etaSeconds;
    private Instant completedAt;
    private volatile JobResultPayload result;

    public SpectraJob(String id, Clock clock) {
        this.id = Objects.requireNonNull(id, "id");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.instant();
    }

    public String getId() {
        return id;
    }

    /**
     * Applies the non-null fields of {@code update}. Ignored once the job reached a terminal status.
     */
    public synchronized void update(ProgressUpdate update) {
        if (isTerminal(status)) {
            return;
        }
        if (update.getStatus() != null) {
            status = update.getStatus();
        }
        if (update.getPercent() != null) {
            double p = Math.max(0.0, Math.min(100.0, update.getPercent()));
            if (status != JobStatus.DONE) {
                p = Math.min(MAX_RUNNING_PERCENT, p);
            }
            percent = Math.max(percent, p);

            double fraction = percent / 100.0;
            if (update.getEtaSeconds() != null) {
                etaSeconds = update.getEtaSeconds();
            } else if (fraction > 0.0 && fraction < 1.0) {
                double elapsed = Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;
                etaSeconds = (int) Math.max(0.0, elapsed * (1.0 - fraction) / Math.max(1e-6, fraction));
            } else {
                etaSeconds = null;
            }
        }
        if (update.getMessage() != null) {
            message = update.getMessage();
        }
        if (update.getStage() != null) {
            stage = update.getStage();
        }
        if (update.getProcessedIntegrations() != null) {
            processedIntegrations = update.getProcessedIntegrations();
        }
        if (update.getTotalIntegrations() != null) {
            totalIntegrations = update.getTotalIntegrations();
        }
        if (update.getThroughput() != null) {
            throughput = update.getThroughput();
        }
        if (isTerminal(status)) {
            completedAt = clock.instant();
        }
    }

    /**
     * Stores the payload and moves the job to DONE at 100%.
     */
    public void complete(JobResultPayload payload) {
        this.result = payload;
        update(ProgressUpdate.builder()
                .percent(100.0)
                .message("Done")
                .status(JobStatus.DONE)
                .stage(JobStage.DONE)
                .build());
    }

    public void fail(String reason) {
        update(ProgressUpdate.builder()
                .message(reason == null ? "Processing error" : reason)
                .status(JobStatus.ERROR)
                .stage(JobStage.ERROR)
                .build());
    }

    public void markCancelled() {
        update(ProgressUpdate.builder()
                .message("Job cancelled")
                .status(JobStatus.CANCELLED)
                .stage(JobStage.ERROR)
                .build());
    }

    public void requestCancel() {
        cancellationRequested.set(true);
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized String getMessage() {
        return message;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public boolean isActive() {
        return !isTerminal(getStatus());
    }

    public JobResultPayload getResult() {
        return result;
    }

    public synchronized JobView toView() {
        return new JobView(
                id,
                status,
                percent,
                stage,
                message,
                processedIntegrations,
                totalIntegrations,
                throughput,
                etaSeconds,
                startedAt,
                completedAt
        );
    }

    private static boolean isTerminal(JobStatus status) {
        return status == JobStatus.DONE || status == JobStatus.ERROR || status == JobStatus.CANCELLED;
    }
}
