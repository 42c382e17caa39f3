package com.ryuqq.lifecycle.core.track.context;

import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.track.TrackCommand;
import com.ryuqq.lifecycle.core.track.TrackStateMachine;
import com.ryuqq.lifecycle.core.track.TrackTransitionTable;
import com.ryuqq.lifecycle.core.track.TrackType;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.lifecycle.core.track.context.ContextStatus.*;

/**
 * Context Track 상태 머신.
 *
 * <p><strong>상태 도출 규칙 (우선순위 순):</strong></p>
 * <ol>
 *   <li>차단 사유 있음 → BLOCKED</li>
 *   <li>제출 버전 없음 → 시작했으면 IN_PROGRESS, 아니면 NOT_STARTED</li>
 *   <li>현재 버전 점수 없음 → PENDING_CHALLENGE</li>
 *   <li>v3 이고 점수 ≥ contextApprovedThreshold → COMPLETE</li>
 *   <li>그 외 → IN_PROGRESS</li>
 * </ol>
 *
 * <p><strong>사전 조건:</strong></p>
 * <ul>
 *   <li>낮은 버전 재제출 거부 (COMPLETE 이후 포함)</li>
 *   <li>버전 건너뛰기 거부 (v1 → v3)</li>
 *   <li>버전당 challenge 횟수는 contextMaxChallengeIterations 이하</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ContextTrackMachine extends TrackStateMachine<ContextStatus, ContextTrackState> {

    private static final TrackTransitionTable<ContextStatus> TABLE =
        TrackTransitionTable.builder(TrackType.CONTEXT, ContextStatus.class)
            .allow(NOT_STARTED, IN_PROGRESS, PENDING_CHALLENGE, BLOCKED)
            .allow(IN_PROGRESS, PENDING_CHALLENGE, COMPLETE, BLOCKED)
            .allow(PENDING_CHALLENGE, IN_PROGRESS, COMPLETE, BLOCKED)
            .allow(BLOCKED, IN_PROGRESS, PENDING_CHALLENGE, COMPLETE)
            .build();

    private final GateConfig config;

    public ContextTrackMachine(GateConfig config) {
        super(TrackType.CONTEXT, TABLE);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    public static TrackTransitionTable<ContextStatus> transitionTable() {
        return TABLE;
    }

    @Override
    public ContextTrackState initialState() {
        return ContextTrackState.initial();
    }

    @Override
    protected ContextTrackState mutate(ContextTrackState current, TrackCommand command, Instant at) {
        if (command instanceof SubmitContextVersion submit) {
            return submit(current, submit);
        }
        if (command instanceof RecordChallengeScore challenge) {
            return challenge(current, challenge);
        }
        throw unsupported(command);
    }

    private ContextTrackState submit(ContextTrackState current, SubmitContextVersion submit) {
        int currentVersion = current.version();
        int version = submit.version();
        if (version < currentVersion) {
            throw precondition(String.format(
                "Cannot submit v%d: current version is v%d", version, currentVersion));
        }
        if (version > currentVersion + 1) {
            throw precondition(String.format(
                "Cannot skip from v%d to v%d", currentVersion, version));
        }

        boolean sameVersion = version == currentVersion;
        int scored = submit.challengeScore() == null ? 0 : 1;
        int iterations = sameVersion ? current.challengeIterations() + scored : scored;
        requireIterationsWithinLimit(version, iterations);

        Set<ContextSection> sections = submit.sections() != null ? submit.sections() : current.sections();
        return current.withSubmission(version, submit.documentRef(), submit.challengeScore(), iterations, sections);
    }

    private ContextTrackState challenge(ContextTrackState current, RecordChallengeScore challenge) {
        if (current.version() == 0) {
            throw precondition("No context document submitted to challenge");
        }
        int iterations = current.challengeIterations() + 1;
        requireIterationsWithinLimit(current.version(), iterations);
        return current.withChallenge(challenge.score(), iterations);
    }

    private void requireIterationsWithinLimit(int version, int iterations) {
        if (iterations > config.contextMaxChallengeIterations()) {
            throw precondition(String.format(
                "Challenge iteration limit of %d reached for v%d", config.contextMaxChallengeIterations(), version));
        }
    }

    @Override
    public ContextStatus deriveStatus(ContextTrackState state) {
        if (state.blockedReason() != null) {
            return BLOCKED;
        }
        if (state.version() == 0) {
            return state.started() ? IN_PROGRESS : NOT_STARTED;
        }
        if (state.challengeScore() == null) {
            return PENDING_CHALLENGE;
        }
        if (state.version() == 3 && state.challengeScore() >= config.contextApprovedThreshold()) {
            return COMPLETE;
        }
        return IN_PROGRESS;
    }

    @Override
    protected ContextTrackState withLifecycle(ContextTrackState state, boolean started, String blockedReason,
                                              Map<String, String> metadata) {
        return state.withLifecycle(started, blockedReason, metadata);
    }

    @Override
    protected ContextTrackState withStatus(ContextTrackState state, ContextStatus status) {
        return state.withStatus(status);
    }

    @Override
    protected ContextTrackState settle(ContextTrackState previous, ContextTrackState mutated, ContextStatus status) {
        return mutated.withStatus(status);
    }
}
