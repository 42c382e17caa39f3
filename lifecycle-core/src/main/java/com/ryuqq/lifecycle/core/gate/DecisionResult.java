package com.ryuqq.lifecycle.core.gate;

import java.util.ArrayList;
import java.util.List;

/**
 * Decision Gate 검증 결과.
 *
 * <p>Track별 결과와 교차 검사(차단 의존성, 완화 안 된 고영향 위험)를 모두 통과해야 READY 입니다.</p>
 *
 * @param status READY 또는 NOT_READY
 * @param trackResults Track별 결과 (Context, Design, Business Case, Engineering 순)
 * @param crossChecks 교차 검사 결과
 * @param blockers 정렬된 blocker 메시지
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record DecisionResult(
    DecisionStatus status,
    List<TrackGateResult> trackResults,
    List<GateCheck> crossChecks,
    List<String> blockers
) {

    static final String CROSS_CHECK_LABEL = "Decision Gate";

    public DecisionResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        trackResults = trackResults == null ? List.of() : List.copyOf(trackResults);
        crossChecks = crossChecks == null ? List.of() : List.copyOf(crossChecks);
        blockers = blockers == null ? List.of() : List.copyOf(blockers);
    }

    /**
     * Track 결과와 교차 검사로부터 결과 조립.
     *
     * @param trackResults Track별 결과
     * @param crossChecks 교차 검사
     * @return DecisionResult
     */
    public static DecisionResult aggregate(List<TrackGateResult> trackResults, List<GateCheck> crossChecks) {
        List<String> blockers = new ArrayList<>();
        for (TrackGateResult result : trackResults) {
            blockers.addAll(result.blockers());
        }
        for (GateCheck check : crossChecks) {
            if (check.isBlocker()) {
                blockers.add("[" + CROSS_CHECK_LABEL + "] " + check.message());
            }
        }
        DecisionStatus status = blockers.isEmpty() ? DecisionStatus.READY : DecisionStatus.NOT_READY;
        return new DecisionResult(status, trackResults, crossChecks, blockers);
    }

    public boolean ready() {
        return status == DecisionStatus.READY;
    }
}
