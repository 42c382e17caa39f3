package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.track.TrackCommand;

import java.util.Map;

/**
 * 추정치 기록. 기존 추정치는 대체되고 추정 요청은 해소됩니다.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param size 규모
 * @param confidence 신뢰도
 * @param breakdown 세부 추정 (null 허용)
 * @param actor 실행자
 */
public record RecordEstimate(EstimateSize size, EstimateConfidence confidence, Map<String, String> breakdown, String actor)
    implements EngineeringCommand {

    public RecordEstimate {
        if (size == null) {
            throw new IllegalArgumentException("size cannot be null");
        }
        if (confidence == null) {
            throw new IllegalArgumentException("confidence cannot be null");
        }
        breakdown = breakdown == null ? Map.of() : Map.copyOf(breakdown);
        TrackCommand.requireActor(actor);
    }
}
