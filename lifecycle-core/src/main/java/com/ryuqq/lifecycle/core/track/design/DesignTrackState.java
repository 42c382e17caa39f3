package com.ryuqq.lifecycle.core.track.design;

import com.ryuqq.lifecycle.core.track.TrackState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Design Track 상태와 사실.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param status 도출된 상태
 * @param version 반영된 변경 횟수
 * @param metadata 부가 정보
 * @param started 시작 여부
 * @param blockedReason 차단 사유 (없으면 null)
 * @param specRef 디자인 스펙 문서 참조
 * @param figmaRef Figma 참조
 * @param wireframesRef 와이어프레임 참조
 */
public record DesignTrackState(
    DesignStatus status,
    int version,
    Map<String, String> metadata,
    boolean started,
    String blockedReason,
    String specRef,
    String figmaRef,
    String wireframesRef
) implements TrackState<DesignStatus> {

    public DesignTrackState {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static DesignTrackState initial() {
        return new DesignTrackState(DesignStatus.NOT_STARTED, 0, Map.of(), false, null, null, null, null);
    }

    DesignTrackState withStatus(DesignStatus newStatus, int newVersion) {
        return new DesignTrackState(newStatus, newVersion, metadata, started, blockedReason, specRef, figmaRef, wireframesRef);
    }

    DesignTrackState withLifecycle(boolean newStarted, String newBlockedReason, Map<String, String> newMetadata) {
        return new DesignTrackState(status, version, newMetadata, newStarted, newBlockedReason, specRef, figmaRef, wireframesRef);
    }

    DesignTrackState withSpecRef(String ref) {
        return new DesignTrackState(status, version, metadata, true, blockedReason, ref, figmaRef, wireframesRef);
    }

    DesignTrackState withFigmaRef(String ref) {
        return new DesignTrackState(status, version, metadata, true, blockedReason, specRef, ref, wireframesRef);
    }

    DesignTrackState withWireframesRef(String ref) {
        return new DesignTrackState(status, version, metadata, true, blockedReason, specRef, figmaRef, ref);
    }
}
