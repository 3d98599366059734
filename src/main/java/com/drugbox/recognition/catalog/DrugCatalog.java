package com.drugbox.recognition.catalog;

import com.drugbox.recognition.core.model.CatalogEntry;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to the drug catalog. Implementations must be safe for concurrent reads
 * from many region workers.
 */
public interface DrugCatalog {

    Optional<CatalogEntry> findById(String entryId);

    /**
     * Keys whose normalized text equals {@code normalizedKey}.
     */
    List<CatalogKey> lookupByKey(String normalizedKey);

    /**
     * Snapshot of every searchable key.
     */
    List<CatalogKey> keys();

    List<CatalogEntry> listByCategory(String category);

    Set<String> categories();

    int size();

    /**
     * Registers a listener fired after any content change. Read-only catalogs may ignore it.
     */
    default void addListener(CatalogListener listener) {
    }
}
