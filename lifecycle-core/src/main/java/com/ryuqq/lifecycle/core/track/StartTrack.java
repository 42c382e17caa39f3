package com.ryuqq.lifecycle.core.track;

/**
 * Track 시작. 이미 시작된 Track에는 no-op.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param actor 실행자
 */
public record StartTrack(String actor) implements TrackCommand {

    public StartTrack {
        TrackCommand.requireActor(actor);
    }
}
