package com.ryuqq.lifecycle.core.track;

import com.ryuqq.lifecycle.core.track.businesscase.BusinessCaseTrackState;
import com.ryuqq.lifecycle.core.track.context.ContextTrackState;
import com.ryuqq.lifecycle.core.track.design.DesignTrackState;
import com.ryuqq.lifecycle.core.track.engineering.EngineeringTrackState;

/**
 * Feature의 네 Track 상태 묶음.
 *
 * <p>키(Track 종류)는 생성 시 고정되며 값만 Track 명령으로 교체됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param context Context Track
 * @param design Design Track
 * @param businessCase Business Case Track
 * @param engineering Engineering Track
 */
public record Tracks(
    ContextTrackState context,
    DesignTrackState design,
    BusinessCaseTrackState businessCase,
    EngineeringTrackState engineering
) {

    public Tracks {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (design == null) {
            throw new IllegalArgumentException("design cannot be null");
        }
        if (businessCase == null) {
            throw new IllegalArgumentException("businessCase cannot be null");
        }
        if (engineering == null) {
            throw new IllegalArgumentException("engineering cannot be null");
        }
    }

    /**
     * 모든 Track이 NOT_STARTED인 초기 묶음.
     *
     * @return 초기 Tracks
     */
    public static Tracks initial() {
        return new Tracks(
            ContextTrackState.initial(),
            DesignTrackState.initial(),
            BusinessCaseTrackState.initial(),
            EngineeringTrackState.initial());
    }

    /**
     * Track 종류로 상태 조회.
     *
     * @param type Track 종류
     * @return 해당 Track 상태
     */
    public TrackState<?> state(TrackType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return switch (type) {
            case CONTEXT -> context;
            case DESIGN -> design;
            case BUSINESS_CASE -> businessCase;
            case ENGINEERING -> engineering;
        };
    }

    public Tracks withContext(ContextTrackState state) {
        return new Tracks(state, design, businessCase, engineering);
    }

    public Tracks withDesign(DesignTrackState state) {
        return new Tracks(context, state, businessCase, engineering);
    }

    public Tracks withBusinessCase(BusinessCaseTrackState state) {
        return new Tracks(context, design, state, engineering);
    }

    public Tracks withEngineering(EngineeringTrackState state) {
        return new Tracks(context, design, businessCase, state);
    }
}
