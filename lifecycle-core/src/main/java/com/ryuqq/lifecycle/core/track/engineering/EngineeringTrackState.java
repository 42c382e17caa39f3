package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.track.TrackState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engineering Track 상태와 사실.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param status 도출된 상태
 * @param version 반영된 변경 횟수
 * @param metadata 부가 정보
 * @param started 시작 여부
 * @param blockedReason 차단 사유 (없으면 null)
 * @param components 식별된 컴포넌트
 * @param adrs ADR 목록 (번호 순)
 * @param estimate 추정치 (없으면 null)
 * @param estimateRequested 추정 요청 여부
 * @param risks 위험 목록
 * @param dependencies 의존성 목록
 */
public record EngineeringTrackState(
    EngineeringStatus status,
    int version,
    Map<String, String> metadata,
    boolean started,
    String blockedReason,
    List<Component> components,
    List<Adr> adrs,
    Estimate estimate,
    boolean estimateRequested,
    List<Risk> risks,
    List<Dependency> dependencies
) implements TrackState<EngineeringStatus> {

    public EngineeringTrackState {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        components = components == null ? List.of() : List.copyOf(components);
        adrs = adrs == null ? List.of() : List.copyOf(adrs);
        risks = risks == null ? List.of() : List.copyOf(risks);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static EngineeringTrackState initial() {
        return new EngineeringTrackState(EngineeringStatus.NOT_STARTED, 0, Map.of(), false, null,
            List.of(), List.of(), null, false, List.of(), List.of());
    }

    /**
     * 아직 결정되지 않은(PROPOSED) ADR.
     *
     * @return PROPOSED ADR 목록
     */
    public List<Adr> proposedAdrs() {
        List<Adr> proposed = new ArrayList<>();
        for (Adr adr : adrs) {
            if (adr.status() == AdrStatus.PROPOSED) {
                proposed.add(adr);
            }
        }
        return proposed;
    }

    /**
     * 완화 방안 없는 고영향 위험.
     *
     * @return 위험 목록
     */
    public List<Risk> unmitigatedHighImpactRisks() {
        List<Risk> result = new ArrayList<>();
        for (Risk risk : risks) {
            if (risk.unmitigatedHighImpact()) {
                result.add(risk);
            }
        }
        return result;
    }

    /**
     * blocking 플래그가 켜진 의존성.
     *
     * @return 의존성 목록
     */
    public List<Dependency> blockingDependencies() {
        List<Dependency> result = new ArrayList<>();
        for (Dependency dependency : dependencies) {
            if (dependency.blocking()) {
                result.add(dependency);
            }
        }
        return result;
    }

    EngineeringTrackState withStatus(EngineeringStatus newStatus, int newVersion) {
        return new EngineeringTrackState(newStatus, newVersion, metadata, started, blockedReason,
            components, adrs, estimate, estimateRequested, risks, dependencies);
    }

    EngineeringTrackState withLifecycle(boolean newStarted, String newBlockedReason, Map<String, String> newMetadata) {
        return new EngineeringTrackState(status, version, newMetadata, newStarted, newBlockedReason,
            components, adrs, estimate, estimateRequested, risks, dependencies);
    }

    EngineeringTrackState withComponents(List<Component> newComponents) {
        return new EngineeringTrackState(status, version, metadata, true, blockedReason,
            newComponents, adrs, estimate, estimateRequested, risks, dependencies);
    }

    EngineeringTrackState withAdrs(List<Adr> newAdrs) {
        return new EngineeringTrackState(status, version, metadata, true, blockedReason,
            components, newAdrs, estimate, estimateRequested, risks, dependencies);
    }

    EngineeringTrackState withEstimate(Estimate newEstimate, boolean requested) {
        return new EngineeringTrackState(status, version, metadata, true, blockedReason,
            components, adrs, newEstimate, requested, risks, dependencies);
    }

    EngineeringTrackState withRisks(List<Risk> newRisks) {
        return new EngineeringTrackState(status, version, metadata, true, blockedReason,
            components, adrs, estimate, estimateRequested, newRisks, dependencies);
    }

    EngineeringTrackState withDependencies(List<Dependency> newDependencies) {
        return new EngineeringTrackState(status, version, metadata, true, blockedReason,
            components, adrs, estimate, estimateRequested, risks, newDependencies);
    }
}
