package com.drugbox.recognition.correction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link CorrectionQueue} for tests and single-process use.
 */
public class InMemoryCorrectionQueue implements CorrectionQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCorrectionQueue.class);

    private final ConcurrentMap<String, CorrectionRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CorrectionStatus> statuses = new ConcurrentHashMap<>();

    @Override
    public CorrectionRecord submit(CorrectionRecord record) {
        records.put(record.id(), record);
        statuses.put(record.id(), CorrectionStatus.PENDING);
        log.debug("Queued correction {} (region={}, kind={})", record.id(), record.regionId(), record.kind());
        return record;
    }

    @Override
    public Optional<CorrectionRecord> get(String correctionId) {
        return Optional.ofNullable(records.get(correctionId));
    }

    @Override
    public Optional<CorrectionStatus> status(String correctionId) {
        return Optional.ofNullable(statuses.get(correctionId));
    }

    @Override
    public List<CorrectionRecord> pending() {
        return records.values().stream()
                .filter(r -> statuses.get(r.id()) == CorrectionStatus.PENDING)
                .sorted(Comparator.comparing(CorrectionRecord::timestamp))
                .toList();
    }

    @Override
    public void markDispatched(String correctionId) {
        transition(correctionId, CorrectionStatus.DISPATCHED);
    }

    @Override
    public void markFailed(String correctionId, String reason) {
        transition(correctionId, CorrectionStatus.FAILED);
        log.warn("Correction {} failed: {}", correctionId, reason);
    }

    @Override
    public long countPending() {
        return statuses.values().stream().filter(s -> s == CorrectionStatus.PENDING).count();
    }

    private void transition(String correctionId, CorrectionStatus target) {
        CorrectionStatus current = statuses.get(correctionId);
        if (current == null) {
            throw new IllegalArgumentException("Correction not found: " + correctionId);
        }
        if (current != CorrectionStatus.PENDING) {
            throw new IllegalStateException("Correction is not pending: " + correctionId);
        }
        statuses.put(correctionId, target);
    }
}
