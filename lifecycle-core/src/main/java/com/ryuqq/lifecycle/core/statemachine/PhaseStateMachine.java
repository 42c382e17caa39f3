package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.model.PhaseEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * FeatureRecord.current_phase를 움직이는 최상위 상태 머신.
 *
 * <p>전이에 성공하면 현재 이력 항목을 닫고(exited_at) 새 항목을 엽니다.
 * 이력은 append/close만 허용되며 기존 항목은 재작성되지 않습니다.</p>
 *
 * <p><strong>멱등성:</strong> {@code advance(record, record.currentPhase(), ...)}는
 * 레코드를 그대로 반환합니다 (외부 호출 재시도 대비).</p>
 *
 * <p><strong>단조성:</strong> 시계가 뒤로 가더라도 exited_at/entered_at은 직전 entered_at보다
 * 앞서지 않도록 보정됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class PhaseStateMachine {

    // Utility class - prevent instantiation
    private PhaseStateMachine() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Phase 전이 실행.
     *
     * @param record 대상 레코드
     * @param target 목표 Phase
     * @param metadata 새 이력 항목의 메타데이터 (null 허용)
     * @param at 전이 시각
     * @return 전이된 레코드 (target이 현재 Phase이면 입력 레코드 그대로)
     * @throws IllegalArgumentException record, target, at이 null인 경우
     * @throws com.ryuqq.lifecycle.core.exception.InvalidPhaseTransitionException 테이블에 없는 전이인 경우
     */
    public static FeatureRecord advance(FeatureRecord record, Phase target, Map<String, Object> metadata, Instant at) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }

        if (record.currentPhase() == target) {
            return record;
        }

        PhaseTransition.validate(record.currentPhase(), target);

        List<PhaseEntry> history = new ArrayList<>(record.phaseHistory());
        Instant effective = at;
        if (!history.isEmpty()) {
            int lastIndex = history.size() - 1;
            PhaseEntry open = history.get(lastIndex);
            if (effective.isBefore(open.enteredAt())) {
                effective = open.enteredAt();
            }
            history.set(lastIndex, open.close(effective));
        }
        history.add(PhaseEntry.open(target, effective, metadata));

        return record.withPhase(target, history);
    }
}
