package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * 컴포넌트 추가.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param name 이름
 * @param description 설명 (null 허용)
 * @param actor 실행자
 */
public record AddComponent(String name, String description, String actor) implements EngineeringCommand {

    public AddComponent {
        TrackCommand.requireText(name, "name");
        TrackCommand.requireActor(actor);
    }
}
