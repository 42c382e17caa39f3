package com.ryuqq.lifecycle.core.track.context;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * Context Track 전용 명령.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public sealed interface ContextCommand extends TrackCommand
    permits SubmitContextVersion, RecordChallengeScore {
}
