package com.ryuqq.lifecycle.core.track;

import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.track.businesscase.BusinessCaseTrackMachine;
import com.ryuqq.lifecycle.core.track.context.ContextTrackMachine;
import com.ryuqq.lifecycle.core.track.design.DesignTrackMachine;
import com.ryuqq.lifecycle.core.track.engineering.EngineeringTrackMachine;

import java.time.Instant;

/**
 * Track 종류별 상태 머신으로 명령을 라우팅.
 *
 * <p>하나의 {@link GateConfig}로 네 상태 머신을 구성합니다. 제품마다 설정이 다르므로
 * 제품 단위로 생성해서 사용합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class TrackDispatcher {

    private final ContextTrackMachine contextMachine;
    private final DesignTrackMachine designMachine;
    private final BusinessCaseTrackMachine businessCaseMachine;
    private final EngineeringTrackMachine engineeringMachine;

    public TrackDispatcher(GateConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.contextMachine = new ContextTrackMachine(config);
        this.designMachine = new DesignTrackMachine(config);
        this.businessCaseMachine = new BusinessCaseTrackMachine(config);
        this.engineeringMachine = new EngineeringTrackMachine(config);
    }

    /**
     * 지정 Track에 명령 적용.
     *
     * @param tracks 현재 Tracks
     * @param type 대상 Track
     * @param command 명령
     * @param at 명령 시각
     * @return 갱신된 Tracks (변화가 없으면 입력 그대로)
     */
    public Tracks apply(Tracks tracks, TrackType type, TrackCommand command, Instant at) {
        if (tracks == null) {
            throw new IllegalArgumentException("tracks cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Tracks next = switch (type) {
            case CONTEXT -> tracks.withContext(contextMachine.apply(tracks.context(), command, at));
            case DESIGN -> tracks.withDesign(designMachine.apply(tracks.design(), command, at));
            case BUSINESS_CASE -> tracks.withBusinessCase(businessCaseMachine.apply(tracks.businessCase(), command, at));
            case ENGINEERING -> tracks.withEngineering(engineeringMachine.apply(tracks.engineering(), command, at));
        };
        return next.equals(tracks) ? tracks : next;
    }

    /**
     * 네 Track의 status를 기록된 사실에 맞춰 보정.
     *
     * @param tracks 보정할 Tracks
     * @return 보정된 Tracks (모두 일치하면 입력 그대로)
     * @see com.ryuqq.lifecycle.core.track.TrackStateMachine#reconcile
     */
    public Tracks reconcile(Tracks tracks) {
        if (tracks == null) {
            throw new IllegalArgumentException("tracks cannot be null");
        }
        Tracks next = tracks
            .withContext(contextMachine.reconcile(tracks.context()))
            .withDesign(designMachine.reconcile(tracks.design()))
            .withBusinessCase(businessCaseMachine.reconcile(tracks.businessCase()))
            .withEngineering(engineeringMachine.reconcile(tracks.engineering()));
        return next.equals(tracks) ? tracks : next;
    }

    public ContextTrackMachine context() {
        return contextMachine;
    }

    public DesignTrackMachine design() {
        return designMachine;
    }

    public BusinessCaseTrackMachine businessCase() {
        return businessCaseMachine;
    }

    public EngineeringTrackMachine engineering() {
        return engineeringMachine;
    }
}
