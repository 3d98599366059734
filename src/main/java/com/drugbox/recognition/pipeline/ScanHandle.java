package com.drugbox.recognition.pipeline;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-flight region work of one scan. Canceling completes every outstanding region
 * future with a cancellation, so the scan returns without those regions.
 */
public class ScanHandle {

    private final String scanId;
    private final List<CompletableFuture<?>> futures = new CopyOnWriteArrayList<>();
    private volatile boolean canceled;

    public ScanHandle(String scanId) {
        this.scanId = scanId;
    }

    public String getScanId() {
        return scanId;
    }

    void register(CompletableFuture<?> future) {
        futures.add(future);
        if (canceled) {
            future.cancel(true);
        }
    }

    public void cancel() {
        canceled = true;
        for (CompletableFuture<?> future : futures) {
            future.cancel(true);
        }
    }

    public boolean isCanceled() {
        return canceled;
    }
}
