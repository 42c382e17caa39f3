package com.ryuqq.lifecycle.adapter.inmemory.store;

import com.ryuqq.lifecycle.core.exception.FeatureNotFoundException;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.spi.FeatureStore;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link FeatureStore} for tests and embedding.
 *
 * <p>Records are immutable, so the map holds them directly; a save replaces the
 * slug's entry in one {@link ConcurrentHashMap#put} and readers never observe a
 * partially written record.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No schema migration (records are always at the current version)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InMemoryFeatureStore implements FeatureStore {

    private final ConcurrentHashMap<String, FeatureRecord> records = new ConcurrentHashMap<>();

    @Override
    public FeatureRecord load(String slug) {
        requireSlug(slug);
        FeatureRecord record = records.get(slug);
        if (record == null) {
            throw new FeatureNotFoundException(slug);
        }
        return record;
    }

    @Override
    public void save(FeatureRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        records.put(record.slug(), record);
    }

    @Override
    public boolean exists(String slug) {
        requireSlug(slug);
        return records.containsKey(slug);
    }

    @Override
    public List<FeatureRecord> findByProduct(String productId) {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId cannot be null or blank");
        }
        return records.values().stream()
            .filter(record -> record.productId().equals(productId))
            .sorted(Comparator.comparing(FeatureRecord::slug))
            .collect(Collectors.toList());
    }

    /**
     * Number of stored records.
     */
    public int size() {
        return records.size();
    }

    /**
     * Removes every record. Test cleanup only; the {@link FeatureStore} contract has no deletion.
     */
    public void clear() {
        records.clear();
    }

    private static void requireSlug(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug cannot be null or blank");
        }
    }
}
