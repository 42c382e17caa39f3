package com.ryuqq.lifecycle.core.track.businesscase;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * 현재 라운드 승인 요청.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param actor 실행자
 */
public record SubmitForApproval(String actor) implements BusinessCaseCommand {

    public SubmitForApproval {
        TrackCommand.requireActor(actor);
    }
}
