package com.id.spectra.modules.jobs.service;

import com.id.spectra.config.AppConfig;
import com.id.spectra.modules.jobs.logic.SpectraJobRunner;
import com.id.spectra.modules.jobs.model.JobStatus;
import com.id.spectra.modules.jobs.model.JobSubmission;
import com.id.spectra.modules.jobs.model.JobView;
import com.id.spectra.modules.jobs.model.ResultLookup;
import com.id.spectra.modules.jobs.model.SpectraJob;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Owns the job table. Every submission runs at once on its own thread; polling only reads the
 * in-memory table.
 */
@Slf4j
@Service
public class JobManager {

    private final ObjectProvider<SpectraJobRunner> runnerProvider;
    private final ConcurrentHashMap<String, SpectraJob> jobs = new ConcurrentHashMap<>();
    private final Deque<String> jobOrder = new ConcurrentLinkedDeque<>();
    private final ExecutorService executorService = Executors.newCachedThreadPool();
    private final int maxHistory;
    private final Duration retention;
    private final Clock clock;

    @Autowired
    public JobManager(ObjectProvider<SpectraJobRunner> runnerProvider, AppConfig appConfig) {
        this(runnerProvider, appConfig.getJobsMaxHistory(), Duration.ofMinutes(appConfig.getJobsRetentionMinutes()),
                Clock.systemUTC());
    }

    public JobManager(ObjectProvider<SpectraJobRunner> runnerProvider, int maxHistory, Duration retention, Clock clock) {
        this.runnerProvider = runnerProvider;
        this.maxHistory = maxHistory;
        this.retention = retention;
        this.clock = clock;
    }

    public String submit(JobSubmission submission) {
        SpectraJob job = new SpectraJob(UUID.randomUUID().toString().replace("-", ""), clock);
        registerJob(job);

        SpectraJobRunner runner = runnerProvider.getObject();
        CompletableFuture
                .runAsync(() -> runner.run(job, submission), executorService)
                .whenComplete((unused, throwable) -> {
                    if (throwable != null) {
                        job.fail(throwable.getMessage());
                        log.error("Job {} terminated unexpectedly", job.getId(), throwable);
                    }
                });
        log.info("Submitted job {} for {}", job.getId(), submission.archive().getFileName());
        return job.getId();
    }

    public Optional<JobView> poll(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(SpectraJob::toView);
    }

    public ResultLookup fetchResult(String jobId) {
        SpectraJob job = jobs.get(jobId);
        if (job == null) {
            return ResultLookup.notFound();
        }
        JobStatus status = job.getStatus();
        return switch (status) {
            case RUNNING -> ResultLookup.notReady();
            case ERROR, CANCELLED -> ResultLookup.failed(job.getMessage());
            case DONE -> job.getResult() != null
                    ? ResultLookup.ready(job.getResult())
                    : ResultLookup.failed("no payload");
        };
    }

    /**
     * Asks a running job to stop at its next checkpoint.
     *
     * @return the job's current view, empty for an unknown job
     */
    public Optional<JobView> cancel(String jobId) {
        SpectraJob job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }
        if (job.isActive()) {
            job.requestCancel();
            log.info("Cancellation requested for job {}", jobId);
        }
        return Optional.of(job.toView());
    }

    /**
     * Evicts finished jobs that completed longer than the retention period ago.
     */
    @Scheduled(fixedDelayString = "${spectra.jobs.sweep-interval-ms:60000}")
    public void sweepExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        Iterator<String> it = jobOrder.iterator();
        while (it.hasNext()) {
            String id = it.next();
            SpectraJob job = jobs.get(id);
            if (job == null) {
                it.remove();
                continue;
            }
            Instant completedAt = job.getCompletedAt();
            if (!job.isActive() && completedAt != null && completedAt.isBefore(cutoff)) {
                jobs.remove(id);
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Evicted {} finished jobs older than {}", removed, retention);
        }
    }

    public int size() {
        return jobs.size();
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdownNow();
    }

    private void registerJob(SpectraJob job) {
        jobs.put(job.getId(), job);
        jobOrder.addLast(job.getId());
        pruneHistory();
    }

    private void pruneHistory() {
        int attempts = 0;
        while (jobOrder.size() > maxHistory && attempts < jobOrder.size()) {
            String oldestId = jobOrder.pollFirst();
            if (oldestId == null) {
                break;
            }
            SpectraJob oldestJob = jobs.get(oldestId);
            if (oldestJob != null && oldestJob.isActive()) {
                jobOrder.addLast(oldestId);
            } else {
                jobs.remove(oldestId);
            }
            attempts++;
        }
    }
}
