package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * 의존성 상태 갱신.
 *
 * <p>blocking이 null이면 상태에서 결정됩니다: READY → false, BLOCKED → true, PENDING → 기존 값.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param name 이름
 * @param status 새 상태
 * @param blocking blocking 플래그 (null 허용)
 * @param actor 실행자
 */
public record UpdateDependency(String name, DependencyStatus status, Boolean blocking, String actor)
    implements EngineeringCommand {

    public UpdateDependency {
        TrackCommand.requireText(name, "name");
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        TrackCommand.requireActor(actor);
    }
}
