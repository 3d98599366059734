package com.drugbox.recognition.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A drug known to the catalog.
 *
 * @param id           stable identifier
 * @param name         canonical (generic) display name
 * @param brandAliases brand names that resolve to this entry
 * @param category     therapeutic category used for per-category thresholds
 * @param atcCode      ATC classification code, may be empty
 * @param usageCount   how often this drug has been confirmed; used as the last tie-breaker
 */
public record CatalogEntry(
        String id,
        String name,
        List<String> brandAliases,
        String category,
        String atcCode,
        long usageCount
) {
    public CatalogEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        brandAliases = brandAliases != null ? List.copyOf(brandAliases) : List.of();
        category = category != null ? category : "";
        atcCode = atcCode != null ? atcCode : "";
        if (usageCount < 0) {
            throw new IllegalArgumentException("usageCount must be >= 0");
        }
    }

    public CatalogEntry withUsageCount(long count) {
        return new CatalogEntry(id, name, brandAliases, category, atcCode, count);
    }

    public CatalogEntry withAlias(String alias) {
        if (brandAliases.contains(alias)) {
            return this;
        }
        List<String> aliases = new java.util.ArrayList<>(brandAliases);
        aliases.add(alias);
        return new CatalogEntry(id, name, aliases, category, atcCode, usageCount);
    }
}
