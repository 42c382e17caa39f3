package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * 위험 추가. 식별자는 "R-{순번}"으로 부여됩니다.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param description 설명
 * @param impact 영향도
 * @param likelihood 발생 가능성
 * @param mitigation 완화 방안 (null 허용)
 * @param owner 담당자 (null 허용)
 * @param actor 실행자
 */
public record AddRisk(
    String description,
    RiskLevel impact,
    RiskLevel likelihood,
    String mitigation,
    String owner,
    String actor
) implements EngineeringCommand {

    public AddRisk {
        TrackCommand.requireText(description, "description");
        if (impact == null) {
            throw new IllegalArgumentException("impact cannot be null");
        }
        if (likelihood == null) {
            throw new IllegalArgumentException("likelihood cannot be null");
        }
        TrackCommand.requireActor(actor);
    }
}
