package com.ryuqq.lifecycle.core.track.context;

import com.ryuqq.lifecycle.core.track.TrackState;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Context Track 상태와 사실.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param status 도출된 상태
 * @param version 제출된 문서 버전 (0 = 미제출, 1~3)
 * @param metadata 부가 정보
 * @param started 시작 여부
 * @param blockedReason 차단 사유 (없으면 null)
 * @param documentRef 현재 버전 문서 참조
 * @param challengeScore 현재 버전 challenge 점수 (없으면 null)
 * @param challengeIterations 현재 버전 challenge 횟수
 * @param sections 현재 버전에 포함된 섹션
 */
public record ContextTrackState(
    ContextStatus status,
    int version,
    Map<String, String> metadata,
    boolean started,
    String blockedReason,
    String documentRef,
    Integer challengeScore,
    int challengeIterations,
    Set<ContextSection> sections
) implements TrackState<ContextStatus> {

    public ContextTrackState {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (version < 0 || version > 3) {
            throw new IllegalArgumentException("Context version must be between 0 and 3 (current: " + version + ")");
        }
        if (challengeIterations < 0) {
            throw new IllegalArgumentException("challengeIterations cannot be negative");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        EnumSet<ContextSection> copy = EnumSet.noneOf(ContextSection.class);
        if (sections != null) {
            copy.addAll(sections);
        }
        sections = Collections.unmodifiableSet(copy);
    }

    public static ContextTrackState initial() {
        return new ContextTrackState(ContextStatus.NOT_STARTED, 0, Map.of(), false, null, null, null, 0, Set.of());
    }

    ContextTrackState withStatus(ContextStatus newStatus) {
        return new ContextTrackState(newStatus, version, metadata, started, blockedReason,
            documentRef, challengeScore, challengeIterations, sections);
    }

    ContextTrackState withLifecycle(boolean newStarted, String newBlockedReason, Map<String, String> newMetadata) {
        return new ContextTrackState(status, version, newMetadata, newStarted, newBlockedReason,
            documentRef, challengeScore, challengeIterations, sections);
    }

    ContextTrackState withSubmission(int newVersion, String newDocumentRef, Integer newScore,
                                     int newIterations, Set<ContextSection> newSections) {
        return new ContextTrackState(status, newVersion, metadata, true, blockedReason,
            newDocumentRef, newScore, newIterations, newSections);
    }

    ContextTrackState withChallenge(int score, int iterations) {
        return new ContextTrackState(status, version, metadata, started, blockedReason,
            documentRef, score, iterations, sections);
    }
}
