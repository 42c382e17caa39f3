package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * 의존성 추가 (PENDING 상태).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param name 이름
 * @param description 설명 (null 허용)
 * @param blocking Decision Gate 진행을 막는지 여부
 * @param actor 실행자
 */
public record AddDependency(String name, String description, boolean blocking, String actor)
    implements EngineeringCommand {

    public AddDependency {
        TrackCommand.requireText(name, "name");
        TrackCommand.requireActor(actor);
    }
}
