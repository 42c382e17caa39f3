package com.ryuqq.lifecycle.application.engine;

import com.ryuqq.lifecycle.core.gate.DecisionResult;
import com.ryuqq.lifecycle.core.gate.TrackGateResult;
import com.ryuqq.lifecycle.core.model.FeatureRecord;

import java.util.List;

/**
 * check_feature의 읽기 전용 결과.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param record 현재 레코드
 * @param trackGates Track별 게이트 결과 (Context, Design, Business Case, Engineering 순)
 * @param readiness Decision Gate 준비 상태 (전체 Track + 교차 검사)
 */
public record FeatureSnapshot(FeatureRecord record, List<TrackGateResult> trackGates, DecisionResult readiness) {

    public FeatureSnapshot {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (readiness == null) {
            throw new IllegalArgumentException("readiness cannot be null");
        }
        trackGates = trackGates == null ? List.of() : List.copyOf(trackGates);
    }
}
