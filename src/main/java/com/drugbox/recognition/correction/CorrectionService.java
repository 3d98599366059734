package com.drugbox.recognition.correction;

import com.drugbox.recognition.audit.AuditAction;
import com.drugbox.recognition.audit.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Queues corrections and forwards them to the registered consumers on a single
 * background thread, in submission order. Nothing in the running pipeline changes
 * until a consumer absorbs the record.
 */
public class CorrectionService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CorrectionService.class);

    private final CorrectionQueue queue;
    private final AuditService auditService;
    private final List<CorrectionConsumer> consumers = new CopyOnWriteArrayList<>();
    private final ExecutorService dispatcher;
    private volatile CompletableFuture<Void> lastDispatch = CompletableFuture.completedFuture(null);

    public CorrectionService(CorrectionQueue queue, AuditService auditService) {
        this.queue = queue;
        this.auditService = auditService;
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "drugbox-correction-dispatch");
            t.setDaemon(true);
            return t;
        });
    }

    public void addConsumer(CorrectionConsumer consumer) {
        consumers.add(consumer);
    }

    /**
     * Queues the record and schedules its dispatch.
     *
     * @return future completing once every consumer has seen the record
     */
    public synchronized CompletableFuture<Void> submit(CorrectionRecord record) {
        queue.submit(record);
        Map<String, Object> details = new HashMap<>();
        details.put("correctionId", record.id());
        details.put("kind", record.kind().name());
        details.put("correctedName", record.correctedName());
        auditService.record(AuditAction.CORRECTION_SUBMITTED, record.regionId(), details);
        log.info("correction.submitted correctionId={} regionId={} kind={} correctedName='{}'",
                record.id(), record.regionId(), record.kind(), record.correctedName());

        CompletableFuture<Void> dispatch = CompletableFuture.runAsync(() -> dispatch(record), dispatcher);
        lastDispatch = dispatch;
        return dispatch;
    }

    /**
     * Waits until everything submitted so far has been dispatched.
     *
     * @return false if the wait timed out
     */
    public boolean awaitDispatched(Duration timeout) {
        try {
            lastDispatch.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            // per-record failures are recorded on the queue
            return true;
        }
    }

    public CorrectionQueue getQueue() {
        return queue;
    }

    private void dispatch(CorrectionRecord record) {
        for (CorrectionConsumer consumer : consumers) {
            try {
                consumer.accept(record);
            } catch (RuntimeException e) {
                queue.markFailed(record.id(), consumer.getClass().getSimpleName() + ": " + e.getMessage());
                log.warn("correction.dispatch.failed correctionId={} consumer={} error={}",
                        record.id(), consumer.getClass().getSimpleName(), e.getMessage());
                return;
            }
        }
        queue.markDispatched(record.id());
        auditService.record(AuditAction.CORRECTION_DISPATCHED, record.regionId(),
                Map.of("correctionId", record.id(), "consumers", consumers.size()));
        log.debug("correction.dispatched correctionId={} consumers={}", record.id(), consumers.size());
    }

    @Override
    public void close() {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
