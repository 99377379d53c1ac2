package com.id.spectra.modules.regrid.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RowWorkerPoolTest {

    private final RowWorkerPool pool = new RowWorkerPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Test
    void keepsRowOrderAcrossWorkers() {
        double[][] rows = new double[100][];
        for (int r = 0; r < rows.length; r++) {
            rows[r] = new double[]{r};
        }
        Set<String> threads = ConcurrentHashMap.newKeySet();
        AtomicInteger lastCount = new AtomicInteger();

        double[][] out = pool.mapRows(rows, row -> {
            threads.add(Thread.currentThread().getName());
            return new double[]{row[0] * 2};
        }, done -> lastCount.accumulateAndGet(done, Math::max));

        for (int r = 0; r < rows.length; r++) {
            assertEquals(r * 2.0, out[r][0]);
        }
        assertEquals(100, lastCount.get());
        assertTrue(threads.stream().allMatch(name -> name.startsWith("row-worker-")));
    }

    @Test
    void rowFailurePropagates() {
        double[][] rows = {{1.0}, {2.0}};

        assertThrows(IllegalArgumentException.class, () -> pool.mapRows(rows, row -> {
            throw new IllegalArgumentException("bad row");
        }, null));
    }

    @Test
    void nonPositiveThreadCountUsesProcessors() {
        RowWorkerPool auto = new RowWorkerPool(0);
        try {
            assertEquals(Runtime.getRuntime().availableProcessors(), auto.getThreads());
        } finally {
            auto.shutdown();
        }
    }
}
