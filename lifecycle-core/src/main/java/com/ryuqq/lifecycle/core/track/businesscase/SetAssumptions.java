package com.ryuqq.lifecycle.core.track.businesscase;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * 기준 지표/영향 가정/ROI 기록. null 필드는 기존 값을 유지합니다.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param baselineMetrics 기준 지표
 * @param impactAssumptions 영향 가정
 * @param roiAnalysis ROI 분석
 * @param actor 실행자
 */
public record SetAssumptions(String baselineMetrics, String impactAssumptions, String roiAnalysis, String actor)
    implements BusinessCaseCommand {

    public SetAssumptions {
        if (isBlank(baselineMetrics) && isBlank(impactAssumptions) && isBlank(roiAnalysis)) {
            throw new IllegalArgumentException("At least one of baselineMetrics, impactAssumptions, roiAnalysis is required");
        }
        TrackCommand.requireActor(actor);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
