package com.drugbox.recognition.catalog;

import com.drugbox.recognition.core.model.CatalogEntry;
import com.drugbox.recognition.correction.CorrectionConsumer;
import com.drugbox.recognition.correction.CorrectionKind;
import com.drugbox.recognition.correction.CorrectionRecord;
import com.drugbox.recognition.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Reference catalog held in memory.
 *
 * <p>Acts as the catalog owner for corrections: a name edit adds the misread text as an
 * alias of the corrected entry, and any confirmed correction raises the entry's usage
 * count. Listeners are notified after every change.</p>
 */
public class InMemoryDrugCatalog implements DrugCatalog, CorrectionConsumer {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDrugCatalog.class);

    private final NormalizationEngine normalizer;
    private final Map<String, CatalogEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, List<CatalogKey>> keyIndex = new ConcurrentHashMap<>();
    private final List<CatalogListener> listeners = new CopyOnWriteArrayList<>();

    public InMemoryDrugCatalog(NormalizationEngine normalizer) {
        this.normalizer = normalizer;
    }

    public InMemoryDrugCatalog(NormalizationEngine normalizer, Collection<CatalogEntry> initial) {
        this(normalizer);
        initial.forEach(this::add);
    }

    /**
     * Adds or replaces an entry and re-indexes its keys.
     */
    public synchronized void add(CatalogEntry entry) {
        CatalogEntry previous = entries.put(entry.id(), entry);
        if (previous != null) {
            unindex(previous);
        }
        index(entry);
        fireChanged(entry.id());
    }

    @Override
    public Optional<CatalogEntry> findById(String entryId) {
        return Optional.ofNullable(entries.get(entryId));
    }

    /**
     * Finds an entry by canonical name or alias, in any spelling that normalizes the same.
     */
    public Optional<CatalogEntry> findByName(String name) {
        return lookupByKey(normalizer.normalize(name)).stream()
                .sorted(Comparator.comparing(CatalogKey::brand))
                .map(k -> entries.get(k.entryId()))
                .filter(java.util.Objects::nonNull)
                .findFirst();
    }

    @Override
    public List<CatalogKey> lookupByKey(String normalizedKey) {
        if (normalizedKey == null || normalizedKey.isEmpty()) {
            return List.of();
        }
        return List.copyOf(keyIndex.getOrDefault(normalizedKey, List.of()));
    }

    @Override
    public List<CatalogKey> keys() {
        return keyIndex.values().stream()
                .flatMap(List::stream)
                .sorted(Comparator.comparing(CatalogKey::key).thenComparing(CatalogKey::entryId))
                .toList();
    }

    @Override
    public List<CatalogEntry> listByCategory(String category) {
        return entries.values().stream()
                .filter(e -> e.category().equalsIgnoreCase(category))
                .sorted(Comparator.comparing(CatalogEntry::name))
                .collect(Collectors.toList());
    }

    @Override
    public Set<String> categories() {
        return entries.values().stream()
                .map(CatalogEntry::category)
                .filter(c -> !c.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void addListener(CatalogListener listener) {
        listeners.add(listener);
    }

    public synchronized void recordUsage(String entryId) {
        CatalogEntry entry = entries.get(entryId);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown catalog entry: " + entryId);
        }
        entries.put(entryId, entry.withUsageCount(entry.usageCount() + 1));
        fireChanged(entryId);
    }

    public synchronized void addAlias(String entryId, String alias) {
        CatalogEntry entry = entries.get(entryId);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown catalog entry: " + entryId);
        }
        String key = normalizer.normalize(alias);
        if (key.isEmpty() || key.equals(normalizer.normalize(entry.name()))) {
            return;
        }
        add(entry.withAlias(alias));
        log.info("catalog.alias.added entryId={} alias='{}'", entryId, alias);
    }

    @Override
    public void accept(CorrectionRecord record) {
        if (record.kind() == CorrectionKind.REJECTED) {
            log.debug("catalog.correction.ignored correctionId={} kind={}", record.id(), record.kind());
            return;
        }
        CatalogEntry target = findByName(record.correctedName()).orElse(null);
        if (target == null) {
            target = new CatalogEntry(UUID.randomUUID().toString(), record.correctedName().trim(),
                    List.of(), TherapeuticCategory.GENERAL, "", 0);
            add(target);
            log.info("catalog.entry.created entryId={} name='{}' correctionId={}",
                    target.id(), target.name(), record.id());
        }
        if (record.kind() == CorrectionKind.NAME_EDIT && !record.originalText().isBlank()) {
            for (String line : record.originalText().split("\\R")) {
                if (!normalizer.normalize(line).isEmpty()) {
                    addAlias(target.id(), line.trim());
                }
            }
        }
        recordUsage(target.id());
    }

    private void index(CatalogEntry entry) {
        addKey(new CatalogKey(normalizer.normalize(entry.name()), entry.id(), false, entry.name()));
        for (String alias : entry.brandAliases()) {
            addKey(new CatalogKey(normalizer.normalize(alias), entry.id(), true, alias));
        }
    }

    private void addKey(CatalogKey key) {
        if (key.key().isEmpty()) {
            return;
        }
        keyIndex.compute(key.key(), (k, existing) -> {
            List<CatalogKey> list = existing != null ? new ArrayList<>(existing) : new ArrayList<>();
            if (!list.contains(key)) {
                list.add(key);
            }
            return List.copyOf(list);
        });
    }

    private void unindex(CatalogEntry entry) {
        keyIndex.replaceAll((k, list) -> list.stream()
                .filter(ck -> !ck.entryId().equals(entry.id()))
                .toList());
        keyIndex.values().removeIf(List::isEmpty);
    }

    private void fireChanged(String entryId) {
        for (CatalogListener listener : listeners) {
            try {
                listener.onCatalogChanged(entryId);
            } catch (RuntimeException e) {
                log.warn("catalog.listener.failed entryId={} error={}", entryId, e.getMessage());
            }
        }
    }
}
