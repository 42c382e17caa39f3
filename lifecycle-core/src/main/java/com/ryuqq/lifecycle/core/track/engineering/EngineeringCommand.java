package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * Engineering Track 전용 명령.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public sealed interface EngineeringCommand extends TrackCommand
    permits AddComponent, CreateAdr, DecideAdr, RecordEstimate, RequestEstimate,
            AddRisk, MitigateRisk, AddDependency, UpdateDependency {
}
