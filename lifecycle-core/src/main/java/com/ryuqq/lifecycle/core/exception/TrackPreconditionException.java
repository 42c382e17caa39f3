package com.ryuqq.lifecycle.core.exception;

import com.ryuqq.lifecycle.core.track.TrackType;

/**
 * Track 변경 명령의 사전 조건 위반.
 *
 * <p>예: 낮은 버전 재제출, 존재하지 않는 ADR 결정, 반려된 Business Case에 승인 기록.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class TrackPreconditionException extends LifecycleException {

    private final TrackType track;

    public TrackPreconditionException(TrackType track, String message) {
        super(ErrorCategory.VALIDATION, "TRACK_PRECONDITION_FAILED", "[" + track.getLabel() + "] " + message);
        this.track = track;
    }

    public TrackType getTrack() {
        return track;
    }
}
