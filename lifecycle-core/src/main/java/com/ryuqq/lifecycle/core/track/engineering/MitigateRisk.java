package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * 위험 완화 방안 기록.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param riskId 위험 식별자
 * @param mitigation 완화 방안
 * @param actor 실행자
 */
public record MitigateRisk(String riskId, String mitigation, String actor) implements EngineeringCommand {

    public MitigateRisk {
        TrackCommand.requireText(riskId, "riskId");
        TrackCommand.requireText(mitigation, "mitigation");
        TrackCommand.requireActor(actor);
    }
}
