package com.ryuqq.lifecycle.core.track.context;

import com.ryuqq.lifecycle.core.track.TrackCommand;

import java.util.Set;

/**
 * Context 문서 버전 제출.
 *
 * <p>버전은 현재 버전과 같거나(재제출) 하나 높아야 합니다.
 * challengeScore를 함께 주면 해당 버전의 challenge 1회로 기록됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param version 문서 버전 (1~3)
 * @param documentRef 문서 참조
 * @param challengeScore challenge 점수 (0~100, null 허용)
 * @param sections 포함된 섹션 (null이면 기존 유지)
 * @param actor 실행자
 */
public record SubmitContextVersion(
    int version,
    String documentRef,
    Integer challengeScore,
    Set<ContextSection> sections,
    String actor
) implements ContextCommand {

    public SubmitContextVersion {
        if (version < 1 || version > 3) {
            throw new IllegalArgumentException("version must be between 1 and 3 (current: " + version + ")");
        }
        TrackCommand.requireText(documentRef, "documentRef");
        if (challengeScore != null) {
            RecordChallengeScore.requireScore(challengeScore);
        }
        sections = sections == null ? null : Set.copyOf(sections);
        TrackCommand.requireActor(actor);
    }
}
