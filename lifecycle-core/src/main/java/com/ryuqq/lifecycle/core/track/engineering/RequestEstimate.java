package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * 추정 요청 (ESTIMATION_PENDING).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param actor 실행자
 */
public record RequestEstimate(String actor) implements EngineeringCommand {

    public RequestEstimate {
        TrackCommand.requireActor(actor);
    }
}
