package com.ryuqq.lifecycle.core.track.design;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * 와이어프레임 참조 기록.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param ref 참조
 * @param actor 실행자
 */
public record AttachWireframes(String ref, String actor) implements DesignCommand {

    public AttachWireframes {
        TrackCommand.requireText(ref, "ref");
        TrackCommand.requireActor(actor);
    }
}
