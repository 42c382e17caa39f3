package com.ryuqq.lifecycle.core.track;

/**
 * Track 차단 해제.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param actor 실행자
 */
public record UnblockTrack(String actor) implements TrackCommand {

    public UnblockTrack {
        TrackCommand.requireActor(actor);
    }
}
