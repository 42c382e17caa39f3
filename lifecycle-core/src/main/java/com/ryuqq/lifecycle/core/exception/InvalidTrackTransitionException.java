package com.ryuqq.lifecycle.core.exception;

import com.ryuqq.lifecycle.core.track.TrackType;

/**
 * Track 상태 테이블에 없는 전이 시도.
 *
 * <p>사실(fact) 변경으로 도출된 새 상태가 허용되지 않으면 발생하며,
 * 이 경우 변경은 반영되지 않습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InvalidTrackTransitionException extends LifecycleException {

    private final TrackType track;
    private final String from;
    private final String to;

    public InvalidTrackTransitionException(TrackType track, Object from, Object to) {
        super(ErrorCategory.VALIDATION, "INVALID_TRACK_TRANSITION",
            String.format("Invalid %s track transition: %s → %s", track.getLabel(), from, to));
        this.track = track;
        this.from = String.valueOf(from);
        this.to = String.valueOf(to);
    }

    public TrackType getTrack() {
        return track;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }
}
