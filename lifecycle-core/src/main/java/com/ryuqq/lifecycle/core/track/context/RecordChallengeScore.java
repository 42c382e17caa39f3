package com.ryuqq.lifecycle.core.track.context;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * 현재 버전에 대한 challenge 점수 기록.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param score 점수 (0~100)
 * @param actor 실행자
 */
public record RecordChallengeScore(int score, String actor) implements ContextCommand {

    public RecordChallengeScore {
        requireScore(score);
        TrackCommand.requireActor(actor);
    }

    static void requireScore(int score) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("challenge score must be between 0 and 100 (current: " + score + ")");
        }
    }
}
