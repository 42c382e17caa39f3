package com.ryuqq.lifecycle.core.track.design;

import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.track.TrackCommand;
import com.ryuqq.lifecycle.core.track.TrackStateMachine;
import com.ryuqq.lifecycle.core.track.TrackTransitionTable;
import com.ryuqq.lifecycle.core.track.TrackType;

import java.time.Instant;
import java.util.Map;

import static com.ryuqq.lifecycle.core.track.design.DesignStatus.*;

/**
 * Design Track 상태 머신.
 *
 * <p><strong>상태 도출 규칙 (우선순위 순):</strong></p>
 * <ol>
 *   <li>차단 사유 있음 → BLOCKED</li>
 *   <li>스펙 + Figma (figmaRequired=false 이면 스펙만) → COMPLETE</li>
 *   <li>Figma 있음 → FIGMA_ATTACHED</li>
 *   <li>와이어프레임 있음 → WIREFRAMES_READY</li>
 *   <li>시작했거나 스펙 있음 → IN_PROGRESS</li>
 *   <li>그 외 → NOT_STARTED</li>
 * </ol>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class DesignTrackMachine extends TrackStateMachine<DesignStatus, DesignTrackState> {

    private static final TrackTransitionTable<DesignStatus> TABLE =
        TrackTransitionTable.builder(TrackType.DESIGN, DesignStatus.class)
            .allow(NOT_STARTED, IN_PROGRESS, WIREFRAMES_READY, FIGMA_ATTACHED, COMPLETE, BLOCKED)
            .allow(IN_PROGRESS, WIREFRAMES_READY, FIGMA_ATTACHED, COMPLETE, BLOCKED)
            .allow(WIREFRAMES_READY, FIGMA_ATTACHED, COMPLETE, BLOCKED)
            .allow(FIGMA_ATTACHED, COMPLETE, BLOCKED)
            .allow(BLOCKED, IN_PROGRESS, WIREFRAMES_READY, FIGMA_ATTACHED, COMPLETE)
            .build();

    private final GateConfig config;

    public DesignTrackMachine(GateConfig config) {
        super(TrackType.DESIGN, TABLE);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    public static TrackTransitionTable<DesignStatus> transitionTable() {
        return TABLE;
    }

    @Override
    public DesignTrackState initialState() {
        return DesignTrackState.initial();
    }

    @Override
    protected DesignTrackState mutate(DesignTrackState current, TrackCommand command, Instant at) {
        if (command instanceof AttachDesignSpec spec) {
            return current.withSpecRef(spec.ref());
        }
        if (command instanceof AttachFigma figma) {
            return current.withFigmaRef(figma.ref());
        }
        if (command instanceof AttachWireframes wireframes) {
            return current.withWireframesRef(wireframes.ref());
        }
        throw unsupported(command);
    }

    @Override
    public DesignStatus deriveStatus(DesignTrackState state) {
        if (state.blockedReason() != null) {
            return BLOCKED;
        }
        boolean hasSpec = state.specRef() != null;
        boolean hasFigma = state.figmaRef() != null;
        if (hasSpec && (hasFigma || !config.figmaRequired())) {
            return COMPLETE;
        }
        if (hasFigma) {
            return FIGMA_ATTACHED;
        }
        if (state.wireframesRef() != null) {
            return WIREFRAMES_READY;
        }
        return state.started() || hasSpec ? IN_PROGRESS : NOT_STARTED;
    }

    @Override
    protected DesignTrackState withLifecycle(DesignTrackState state, boolean started, String blockedReason,
                                             Map<String, String> metadata) {
        return state.withLifecycle(started, blockedReason, metadata);
    }

    @Override
    protected DesignTrackState withStatus(DesignTrackState state, DesignStatus status) {
        return state.withStatus(status, state.version());
    }

    @Override
    protected DesignTrackState settle(DesignTrackState previous, DesignTrackState mutated, DesignStatus status) {
        return mutated.withStatus(status, previous.version() + 1);
    }
}
