package com.ryuqq.lifecycle.core.track.businesscase;

import com.ryuqq.lifecycle.core.track.TrackState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Business Case Track 상태와 사실.
 *
 * <p>승인 기록은 검토 라운드별로 유지되며, 상태 판단에는 현재 라운드의 기록만 사용됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param status 도출된 상태
 * @param version 반영된 변경 횟수
 * @param metadata 부가 정보
 * @param started 시작 여부
 * @param blockedReason 차단 사유 (없으면 null)
 * @param baselineMetrics 기준 지표
 * @param impactAssumptions 영향 가정
 * @param roiAnalysis ROI 분석 (참고 사항)
 * @param submitted 현재 라운드 승인 요청 여부
 * @param round 현재 검토 라운드 (1부터)
 * @param approvals 전체 승인 기록
 */
public record BusinessCaseTrackState(
    BusinessCaseStatus status,
    int version,
    Map<String, String> metadata,
    boolean started,
    String blockedReason,
    String baselineMetrics,
    String impactAssumptions,
    String roiAnalysis,
    boolean submitted,
    int round,
    List<Approval> approvals
) implements TrackState<BusinessCaseStatus> {

    public BusinessCaseTrackState {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative");
        }
        if (round <= 0) {
            throw new IllegalArgumentException("round must be positive (current: " + round + ")");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        approvals = approvals == null ? List.of() : List.copyOf(approvals);
    }

    public static BusinessCaseTrackState initial() {
        return new BusinessCaseTrackState(BusinessCaseStatus.NOT_STARTED, 0, Map.of(), false, null,
            null, null, null, false, 1, List.of());
    }

    /**
     * 현재 라운드의 승인 기록.
     *
     * @return 현재 라운드 기록
     */
    public List<Approval> currentRoundApprovals() {
        List<Approval> result = new ArrayList<>();
        for (Approval approval : approvals) {
            if (approval.round() == round) {
                result.add(approval);
            }
        }
        return result;
    }

    BusinessCaseTrackState withStatus(BusinessCaseStatus newStatus, int newVersion) {
        return new BusinessCaseTrackState(newStatus, newVersion, metadata, started, blockedReason,
            baselineMetrics, impactAssumptions, roiAnalysis, submitted, round, approvals);
    }

    BusinessCaseTrackState withLifecycle(boolean newStarted, String newBlockedReason, Map<String, String> newMetadata) {
        return new BusinessCaseTrackState(status, version, newMetadata, newStarted, newBlockedReason,
            baselineMetrics, impactAssumptions, roiAnalysis, submitted, round, approvals);
    }

    BusinessCaseTrackState withAssumptions(String baseline, String impact, String roi) {
        return new BusinessCaseTrackState(status, version, metadata, true, blockedReason,
            baseline, impact, roi, submitted, round, approvals);
    }

    BusinessCaseTrackState withSubmitted(boolean newSubmitted) {
        return new BusinessCaseTrackState(status, version, metadata, true, blockedReason,
            baselineMetrics, impactAssumptions, roiAnalysis, newSubmitted, round, approvals);
    }

    BusinessCaseTrackState withApprovals(List<Approval> newApprovals) {
        return new BusinessCaseTrackState(status, version, metadata, true, blockedReason,
            baselineMetrics, impactAssumptions, roiAnalysis, submitted, round, newApprovals);
    }

    BusinessCaseTrackState nextRound(Map<String, String> newMetadata) {
        return new BusinessCaseTrackState(status, version, newMetadata, true, blockedReason,
            baselineMetrics, impactAssumptions, roiAnalysis, false, round + 1, approvals);
    }
}
