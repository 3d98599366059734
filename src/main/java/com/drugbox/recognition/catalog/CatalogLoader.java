package com.drugbox.recognition.catalog;

import com.drugbox.recognition.core.model.CatalogEntry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads catalog entries from a JSON array.
 *
 * <pre>
 * [{"name": "Metformin", "brandAliases": ["Glucophage"], "atcCode": "A10BA02", "usageCount": 3}]
 * </pre>
 *
 * <p>{@code id} defaults to the lower-cased name; {@code category} defaults to the one
 * implied by {@code atcCode}.</p>
 */
public class CatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private final ObjectMapper objectMapper;

    public CatalogLoader() {
        this(new ObjectMapper());
    }

    public CatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<CatalogEntry> load(InputStream input) {
        List<CatalogRecord> records;
        try {
            records = objectMapper.readValue(input, new TypeReference<List<CatalogRecord>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read drug catalog", e);
        }
        List<CatalogEntry> entries = new ArrayList<>(records.size());
        int skipped = 0;
        for (CatalogRecord record : records) {
            if (record.name() == null || record.name().isBlank()) {
                skipped++;
                continue;
            }
            String id = record.id() != null ? record.id() : record.name().trim().toLowerCase(Locale.ROOT);
            String category = record.category() != null && !record.category().isBlank()
                    ? record.category().toLowerCase(Locale.ROOT)
                    : TherapeuticCategory.fromAtcCode(record.atcCode());
            entries.add(new CatalogEntry(id, record.name().trim(), record.brandAliases(), category,
                    record.atcCode(), record.usageCount() != null ? record.usageCount() : 0L));
        }
        log.info("catalog.loaded entries={} skipped={}", entries.size(), skipped);
        return entries;
    }

    public List<CatalogEntry> loadResource(String resourcePath) {
        try (InputStream in = CatalogLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Catalog resource not found: " + resourcePath);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close catalog resource " + resourcePath, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogRecord(String id, String name, List<String> brandAliases, String category,
                         String atcCode, Long usageCount) {
    }
}
