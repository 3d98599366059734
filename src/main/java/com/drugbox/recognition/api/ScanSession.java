package com.drugbox.recognition.api;

import com.drugbox.recognition.aggregate.MultiDrugResult;
import com.drugbox.recognition.core.model.ImageSource;
import com.drugbox.recognition.logging.LogContext;
import com.drugbox.recognition.pipeline.ScanHandle;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caller-owned state of a scanning session: its id, source and the results of earlier
 * scans. A session can cancel the scan it is running, so a new image can be processed
 * without waiting for the old one.
 */
public class ScanSession {

    private final String sessionId;
    private final ImageSource source;
    private final List<MultiDrugResult> history = new CopyOnWriteArrayList<>();
    private final AtomicReference<ScanHandle> current = new AtomicReference<>();

    public ScanSession(String sessionId, ImageSource source) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId is required");
        this.source = Objects.requireNonNull(source, "source is required");
    }

    public static ScanSession create(ImageSource source) {
        return new ScanSession(LogContext.generateId(), source);
    }

    public String getSessionId() {
        return sessionId;
    }

    public ImageSource getSource() {
        return source;
    }

    /**
     * Results of completed scans, oldest first.
     */
    public List<MultiDrugResult> getHistory() {
        return List.copyOf(history);
    }

    public Optional<MultiDrugResult> getLastResult() {
        List<MultiDrugResult> snapshot = getHistory();
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot.get(snapshot.size() - 1));
    }

    /**
     * Cancels in-flight region work of the running scan, if any. That scan returns with
     * the regions that finished.
     *
     * @return true if a scan was running
     */
    public boolean requestRescan() {
        ScanHandle handle = current.get();
        if (handle == null) {
            return false;
        }
        handle.cancel();
        return true;
    }

    public boolean isScanning() {
        return current.get() != null;
    }

    ScanHandle begin(String scanId) {
        ScanHandle handle = new ScanHandle(scanId);
        ScanHandle previous = current.getAndSet(handle);
        if (previous != null) {
            previous.cancel();
        }
        return handle;
    }

    void end(ScanHandle handle) {
        current.compareAndSet(handle, null);
    }

    void record(MultiDrugResult result) {
        history.add(result);
    }
}
