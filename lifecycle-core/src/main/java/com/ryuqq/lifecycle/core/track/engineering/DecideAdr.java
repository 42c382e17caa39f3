package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * ADR 결정.
 *
 * <p>허용: PROPOSED → ACCEPTED/REJECTED, ACCEPTED → DEPRECATED.
 * SUPERSEDED는 {@link CreateAdr#supersedes()}로만 설정됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param number ADR 번호
 * @param status 결정 상태
 * @param actor 실행자
 */
public record DecideAdr(int number, AdrStatus status, String actor) implements EngineeringCommand {

    public DecideAdr {
        if (number <= 0) {
            throw new IllegalArgumentException("number must be positive (current: " + number + ")");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        TrackCommand.requireActor(actor);
    }
}
