package com.ryuqq.lifecycle.core.model;

import com.ryuqq.lifecycle.core.statemachine.Phase;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * phase_history의 한 항목.
 *
 * <p>열린 항목(exitedAt == null)은 현재 Phase를 나타냅니다.
 * 항목은 닫히기만 하며 다른 필드는 재작성되지 않습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param phase Phase
 * @param enteredAt 진입 시각
 * @param exitedAt 이탈 시각 (열린 항목이면 null)
 * @param metadata 부가 정보 (불변)
 */
public record PhaseEntry(Phase phase, Instant enteredAt, Instant exitedAt, Map<String, Object> metadata) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException phase/enteredAt 누락 또는 exitedAt이 enteredAt보다 앞선 경우
     */
    public PhaseEntry {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (enteredAt == null) {
            throw new IllegalArgumentException("enteredAt cannot be null");
        }
        if (exitedAt != null && exitedAt.isBefore(enteredAt)) {
            throw new IllegalArgumentException(
                "exitedAt (" + exitedAt + ") cannot precede enteredAt (" + enteredAt + ") for phase " + phase);
        }
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * 새 열린 항목 생성.
     *
     * @param phase 진입할 Phase
     * @param at 진입 시각
     * @param metadata 메타데이터 (null 허용)
     * @return 열린 PhaseEntry
     */
    public static PhaseEntry open(Phase phase, Instant at, Map<String, Object> metadata) {
        return new PhaseEntry(phase, at, null, metadata);
    }

    /**
     * 항목 닫기.
     *
     * @param at 이탈 시각
     * @return 닫힌 PhaseEntry
     * @throws IllegalStateException 이미 닫힌 항목인 경우
     */
    public PhaseEntry close(Instant at) {
        if (exitedAt != null) {
            throw new IllegalStateException("Phase entry already closed: " + phase);
        }
        return new PhaseEntry(phase, enteredAt, at, metadata);
    }
}
