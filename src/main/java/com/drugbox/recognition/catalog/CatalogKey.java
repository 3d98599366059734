package com.drugbox.recognition.catalog;

import java.util.Objects;

/**
 * One searchable form of a catalog entry: its canonical name or one of its brand aliases,
 * already normalized.
 *
 * @param key     normalized text
 * @param entryId owning catalog entry
 * @param brand   true when this key comes from a brand alias
 * @param surface the alias or name as written in the catalog
 */
public record CatalogKey(String key, String entryId, boolean brand, String surface) {

    public CatalogKey {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(entryId, "entryId is required");
        surface = surface != null ? surface : key;
    }
}
