package com.ryuqq.lifecycle.core.track.engineering;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 기록된 작업 추정치.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param size 규모
 * @param confidence 신뢰도
 * @param breakdown 항목별 세부 추정 (예: "backend" → "M")
 * @param estimatedBy 추정자
 * @param estimatedAt 추정 시각
 */
public record Estimate(
    EstimateSize size,
    EstimateConfidence confidence,
    Map<String, String> breakdown,
    String estimatedBy,
    Instant estimatedAt
) {

    public Estimate {
        if (size == null) {
            throw new IllegalArgumentException("size cannot be null");
        }
        if (confidence == null) {
            throw new IllegalArgumentException("confidence cannot be null");
        }
        if (estimatedAt == null) {
            throw new IllegalArgumentException("estimatedAt cannot be null");
        }
        breakdown = breakdown == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }
}
