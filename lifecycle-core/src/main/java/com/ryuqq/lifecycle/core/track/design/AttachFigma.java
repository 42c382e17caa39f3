package com.ryuqq.lifecycle.core.track.design;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * Figma 참조 기록. URL 형식은 게이트에서 참고 사항으로만 검사됩니다.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param ref 참조
 * @param actor 실행자
 */
public record AttachFigma(String ref, String actor) implements DesignCommand {

    public AttachFigma {
        TrackCommand.requireText(ref, "ref");
        TrackCommand.requireActor(actor);
    }
}
