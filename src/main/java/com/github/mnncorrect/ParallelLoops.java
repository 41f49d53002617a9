/*
 * MIT License
 *
 * Copyright (c) 2025 mnn-correct contributors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.mnncorrect;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits an index range {@code [0, count)} into contiguous blocks, one per
 * worker, and runs them on a short-lived thread pool. With one worker the
 * block runs on the calling thread.
 */
final class ParallelLoops {
    private static final Logger log = LoggerFactory.getLogger(ParallelLoops.class);

    /** Body of one worker; {@code worker} is the block number. */
    @FunctionalInterface
    interface RangeTask {
        void run(int worker, int from, int to);
    }

    private ParallelLoops() {}

    /** Number of blocks {@link #process} will use for the given request. */
    static int workerCount(int threads, int count) {
        return Math.max(1, Math.min(threads, count));
    }

    static void process(int threads, int count, RangeTask task) {
        final int workers = workerCount(threads, count);
        final int[] cutoffs = getCutoffs(count, workers);
        if (workers == 1) {
            task.run(0, 0, count);
            return;
        }

        AtomicInteger threadNumber = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "mnncorrect-worker-" + threadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<?>> futures = new ArrayList<>(workers);
            for (int w = 0; w < workers; w++) {
                final int worker = w;
                futures.add(pool.submit(() -> task.run(worker, cutoffs[worker], cutoffs[worker + 1])));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for workers", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.debug("Worker failed", cause);
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Worker failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    private static int[] getCutoffs(int count, int workers) {
        int[] bounds = new int[workers + 1];
        for (int z = 0; z < workers; z++) {
            bounds[z] = (int) ((long) count * z / workers);
        }
        bounds[workers] = count;
        return bounds;
    }
}
