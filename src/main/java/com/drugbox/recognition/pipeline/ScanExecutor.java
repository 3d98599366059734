package com.drugbox.recognition.pipeline;

import com.drugbox.recognition.core.model.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Fans region work out over a fixed worker pool and gathers it back in region order.
 *
 * <p>Each region has its own deadline. A region that fails or overruns is handed to the
 * error mapper, so one region never takes down the scan. Canceled regions are left out
 * of the returned list.</p>
 */
public class ScanExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScanExecutor.class);

    private final ExecutorService workers;
    private final Duration regionTimeout;

    public ScanExecutor(int workerThreads, Duration regionTimeout) {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0");
        }
        this.workers = Executors.newFixedThreadPool(workerThreads, namedThreads("drugbox-region-"));
        this.regionTimeout = regionTimeout;
    }

    public <T> List<T> runAll(List<Region> regions, Function<Region, T> task,
                              BiFunction<Region, Throwable, T> onError, ScanHandle handle) {
        List<CompletableFuture<T>> futures = new ArrayList<>(regions.size());
        for (Region region : regions) {
            CompletableFuture<T> future = CompletableFuture
                    .supplyAsync(() -> task.apply(region), workers)
                    .orTimeout(regionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            handle.register(future);
            futures.add(future);
        }

        List<T> results = new ArrayList<>(regions.size());
        int canceled = 0;
        for (int i = 0; i < futures.size(); i++) {
            Region region = regions.get(i);
            try {
                results.add(futures.get(i).join());
            } catch (CancellationException e) {
                canceled++;
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof CancellationException) {
                    canceled++;
                    continue;
                }
                log.warn("scan.region.failed regionId={} error={}", region.id(), cause.toString());
                results.add(onError.apply(region, cause));
            }
        }
        if (canceled > 0) {
            log.info("scan.regions.canceled scanId={} canceled={}", handle.getScanId(), canceled);
        }
        return results;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Pool for calls to external services, kept apart from region workers so a blocked
     * service cannot starve region scheduling.
     */
    public static ExecutorService newIoPool(int threads) {
        return Executors.newFixedThreadPool(threads, namedThreads("drugbox-io-"));
    }
}
