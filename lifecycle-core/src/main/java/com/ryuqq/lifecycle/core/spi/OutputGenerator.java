package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.model.FeatureRecord;

import java.util.List;
import java.util.Map;

/**
 * Downstream generator of final feature artifacts (PRD, summaries, tickets).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OutputGenerator {

    /**
     * Generates output documents for a feature in OUTPUT_GENERATION.
     *
     * @param feature the approved feature record
     * @param documents raw track documents keyed by name
     * @return paths of the generated artifacts
     */
    List<String> generate(FeatureRecord feature, Map<String, String> documents);
}
