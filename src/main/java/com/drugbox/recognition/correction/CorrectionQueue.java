package com.drugbox.recognition.correction;

import java.util.List;
import java.util.Optional;

/**
 * Holds submitted corrections until every consumer has received them.
 */
public interface CorrectionQueue {

    CorrectionRecord submit(CorrectionRecord record);

    Optional<CorrectionRecord> get(String correctionId);

    Optional<CorrectionStatus> status(String correctionId);

    /**
     * Pending corrections, oldest first.
     */
    List<CorrectionRecord> pending();

    void markDispatched(String correctionId);

    void markFailed(String correctionId, String reason);

    long countPending();
}
