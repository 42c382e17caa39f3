package com.ryuqq.lifecycle.core.track;

/**
 * Track 차단 사유 기록.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param reason 차단 사유
 * @param actor 실행자
 */
public record BlockTrack(String reason, String actor) implements TrackCommand {

    public BlockTrack {
        TrackCommand.requireText(reason, "reason");
        TrackCommand.requireActor(actor);
    }
}
