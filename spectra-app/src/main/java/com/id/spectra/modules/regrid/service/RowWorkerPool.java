package com.id.spectra.modules.regrid.service;

import com.id.spectra.config.AppConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;
import java.util.function.UnaryOperator;

@Slf4j
@Service
public class RowWorkerPool {

    private static final int ROWS_PER_TASK = 16;

    private final ExecutorService executor;
    private final int threads;

    @Autowired
    public RowWorkerPool(AppConfig appConfig) {
        this(appConfig.getRowWorkerThreads());
    }

    public RowWorkerPool(int configuredThreads) {
        this.threads = configuredThreads > 0 ? configuredThreads : Runtime.getRuntime().availableProcessors();
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread thread = new Thread(r, "row-worker-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
        log.info("Row worker pool started with {} threads", threads);
    }

    public int getThreads() {
        return threads;
    }

    public double[][] mapRows(double[][] rows, UnaryOperator<double[]> rowFunction, IntConsumer onRowDone) {
        double[][] out = new double[rows.length][];
        AtomicInteger done = new AtomicInteger();
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int from = 0; from < rows.length; from += ROWS_PER_TASK) {
            int start = from;
            int end = Math.min(rows.length, from + ROWS_PER_TASK);
            tasks.add(() -> {
                for (int r = start; r < end; r++) {
                    out[r] = rowFunction.apply(rows[r]);
                    int finished = done.incrementAndGet();
                    if (onRowDone != null) {
                        onRowDone.accept(finished);
                    }
                }
                return null;
            });
        }

        try {
            List<Future<Void>> futures = executor.invokeAll(tasks);
            for (Future<Void> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing rows", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Row processing failed: " + cause.getMessage(), cause);
        }
        return out;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
