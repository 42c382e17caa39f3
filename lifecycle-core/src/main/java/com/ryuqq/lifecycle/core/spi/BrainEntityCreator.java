package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.model.FeatureRecord;

/**
 * Creates the knowledge-base entity for a newly started feature.
 *
 * <p>Invoked once per feature, right after the record is created and before it is first saved.
 * The returned reference is stored in the {@code initialization} phase entry metadata.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BrainEntityCreator {

    /**
     * Creates the entity.
     *
     * @param feature the new feature record
     * @return the entity reference
     */
    String create(FeatureRecord feature);

    /**
     * Entity name derived from the title: words capitalised and joined with underscores
     * ({@code "OTP checkout recovery" → "OTP_Checkout_Recovery"}).
     *
     * @param title the feature title
     * @return the entity name
     */
    static String entityName(String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        StringBuilder sb = new StringBuilder();
        for (String word : title.trim().split("\\s+")) {
            String cleaned = word.replaceAll("[^A-Za-z0-9]", "");
            if (cleaned.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('_');
            }
            sb.append(Character.toUpperCase(cleaned.charAt(0))).append(cleaned.substring(1));
        }
        return sb.toString();
    }
}
