package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.track.TrackStatus;

/**
 * Engineering Track 상태.
 *
 * <p>COMPLETE는 종료 상태가 아닙니다. 완료 후 새 ADR 제안이나 완화되지 않은 고영향 위험이
 * 기록되면 IN_PROGRESS로 다시 열립니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum EngineeringStatus implements TrackStatus {

    NOT_STARTED("not_started"),
    IN_PROGRESS("in_progress"),

    /**
     * 추정 요청 후 아직 추정치가 기록되지 않음.
     */
    ESTIMATION_PENDING("estimation_pending"),
    BLOCKED("blocked"),
    COMPLETE("complete");

    private final String wireName;

    EngineeringStatus(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public boolean isTerminal() {
        return false;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
