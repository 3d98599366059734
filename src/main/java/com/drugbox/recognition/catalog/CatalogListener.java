package com.drugbox.recognition.catalog;

/**
 * Notified after the catalog content changes, so derived state can be dropped.
 */
@FunctionalInterface
public interface CatalogListener {

    void onCatalogChanged(String entryId);
}
