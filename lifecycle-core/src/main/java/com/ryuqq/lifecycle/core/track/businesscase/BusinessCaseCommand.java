package com.ryuqq.lifecycle.core.track.businesscase;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * Business Case Track 전용 명령.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public sealed interface BusinessCaseCommand extends TrackCommand
    permits SetAssumptions, SubmitForApproval, RecordApproval, ReviseBusinessCase {
}
