package com.ryuqq.lifecycle.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 감사 추적(audit trail)의 결정 기록.
 *
 * <p>decisions는 append-only이며 기록된 결정은 수정/삭제되지 않습니다.</p>
 *
 * <p><strong>phase 값 예시:</strong> "decision_gate", "business_case", "archived"</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param phase 결정이 내려진 단계
 * @param decision 결정 내용
 * @param rationale 근거 (null 허용)
 * @param decidedBy 결정자
 * @param timestamp 결정 시각
 * @param metadata 부가 정보 (예: outcome, forced, bypassed_blockers)
 */
public record Decision(
    String phase,
    String decision,
    String rationale,
    String decidedBy,
    Instant timestamp,
    Map<String, Object> metadata
) {

    public Decision {
        if (phase == null || phase.isBlank()) {
            throw new IllegalArgumentException("phase cannot be null or blank");
        }
        if (decision == null || decision.isBlank()) {
            throw new IllegalArgumentException("decision cannot be null or blank");
        }
        if (decidedBy == null || decidedBy.isBlank()) {
            throw new IllegalArgumentException("decidedBy cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
