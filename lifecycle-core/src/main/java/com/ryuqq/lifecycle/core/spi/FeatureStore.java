package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.exception.FeatureNotFoundException;
import com.ryuqq.lifecycle.core.model.FeatureRecord;

import java.util.List;

/**
 * Persistent storage SPI for feature records.
 *
 * <p>A small key-value contract keyed by feature slug. The engine performs a
 * read-modify-write per operation through this interface and never caches records.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic save: a failed or interrupted save never leaves a partial record visible to {@link #load}</li>
 *   <li>Last-writer-wins: concurrent saves of the same slug are not coordinated; the last completed save wins</li>
 *   <li>No deletion: records are retained in every phase, including terminal ones</li>
 *   <li>Older schema versions are migrated in memory on load; the stored form changes only on the next save</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface FeatureStore {

    /**
     * Loads the record stored under the given slug.
     *
     * @param slug the feature slug
     * @return the stored record, migrated to the current schema version
     * @throws IllegalArgumentException if slug is null or blank
     * @throws FeatureNotFoundException if no record exists for slug
     * @throws com.ryuqq.lifecycle.core.exception.PersistenceException if the record cannot be read
     */
    FeatureRecord load(String slug);

    /**
     * Saves the record under its slug, replacing any previous version.
     *
     * @param record the record to store
     * @throws IllegalArgumentException if record is null
     * @throws com.ryuqq.lifecycle.core.exception.PersistenceException if the record cannot be written
     */
    void save(FeatureRecord record);

    /**
     * Checks whether a record exists for the given slug.
     *
     * @param slug the feature slug
     * @return true if a record is stored under slug
     */
    boolean exists(String slug);

    /**
     * Returns all records of one product, ordered by slug.
     *
     * @param productId the product id
     * @return the product's records (empty if none)
     */
    List<FeatureRecord> findByProduct(String productId);
}
