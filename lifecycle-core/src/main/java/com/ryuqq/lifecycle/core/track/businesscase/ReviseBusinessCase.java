package com.ryuqq.lifecycle.core.track.businesscase;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * 반려된 Business Case를 다음 라운드로 재개.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param reason 재개 사유 (null 허용)
 * @param actor 실행자
 */
public record ReviseBusinessCase(String reason, String actor) implements BusinessCaseCommand {

    public ReviseBusinessCase {
        TrackCommand.requireActor(actor);
    }
}
