package com.drugbox.recognition.correction;

/**
 * An owner of persistent state that learns from corrections (the catalog, the visual store).
 */
@FunctionalInterface
public interface CorrectionConsumer {

    void accept(CorrectionRecord record);
}
