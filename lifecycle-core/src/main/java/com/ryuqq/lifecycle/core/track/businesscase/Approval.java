package com.ryuqq.lifecycle.core.track.businesscase;

import java.time.Instant;

/**
 * 승인자 한 명의 승인/반려 기록.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param approver 승인자
 * @param approved 승인이면 true, 반려면 false
 * @param comment 의견 (null 허용)
 * @param round 기록된 검토 라운드
 * @param recordedAt 기록 시각
 */
public record Approval(String approver, boolean approved, String comment, int round, Instant recordedAt) {

    public Approval {
        if (approver == null || approver.isBlank()) {
            throw new IllegalArgumentException("approver cannot be null or blank");
        }
        if (round <= 0) {
            throw new IllegalArgumentException("round must be positive (current: " + round + ")");
        }
        if (recordedAt == null) {
            throw new IllegalArgumentException("recordedAt cannot be null");
        }
    }
}
