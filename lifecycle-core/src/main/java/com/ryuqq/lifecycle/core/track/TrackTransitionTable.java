package com.ryuqq.lifecycle.core.track;

import com.ryuqq.lifecycle.core.exception.InvalidTrackTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Track별 명시적 상태 전이 테이블.
 *
 * <p>테이블에 없는 전이는 모두 거부됩니다. 자기 자신으로의 전이(상태 변화 없는 사실 변경)는
 * 항상 허용됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TrackTransitionTable&lt;DesignStatus&gt; table = TrackTransitionTable.builder(TrackType.DESIGN, DesignStatus.class)
 *     .allow(NOT_STARTED, IN_PROGRESS, BLOCKED)
 *     .allow(IN_PROGRESS, COMPLETE, BLOCKED)
 *     .build();
 *
 * table.validate(NOT_STARTED, COMPLETE); // InvalidTrackTransitionException
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param <S> Track별 상태 enum
 */
public final class TrackTransitionTable<S extends Enum<S> & TrackStatus> {

    private final TrackType track;
    private final Map<S, Set<S>> transitions;

    private TrackTransitionTable(TrackType track, Map<S, Set<S>> transitions) {
        this.track = track;
        this.transitions = transitions;
    }

    /**
     * 빌더 생성.
     *
     * @param track Track 종류
     * @param statusType 상태 enum 클래스
     * @param <S> 상태 enum
     * @return 빌더
     */
    public static <S extends Enum<S> & TrackStatus> Builder<S> builder(TrackType track, Class<S> statusType) {
        if (track == null) {
            throw new IllegalArgumentException("track cannot be null");
        }
        if (statusType == null) {
            throw new IllegalArgumentException("statusType cannot be null");
        }
        return new Builder<>(track, statusType);
    }

    public TrackType getTrack() {
        return track;
    }

    /**
     * from에서 허용된 다음 상태 목록.
     *
     * @param from 현재 상태
     * @return 허용된 상태 집합 (불변)
     */
    public Set<S> allowedTargets(S from) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        return transitions.get(from);
    }

    /**
     * 전이 허용 여부.
     *
     * @param from 현재 상태
     * @param to 다음 상태
     * @return 허용되면 true
     */
    public boolean isAllowed(S from, S to) {
        if (from == null || to == null) {
            return false;
        }
        return from == to || transitions.get(from).contains(to);
    }

    /**
     * 전이 검증.
     *
     * @param from 현재 상태
     * @param to 다음 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws InvalidTrackTransitionException 테이블에 없는 전이인 경우
     */
    public void validate(S from, S to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!isAllowed(from, to)) {
            throw new InvalidTrackTransitionException(track, from, to);
        }
    }

    /**
     * 전이 테이블 빌더.
     *
     * @param <S> 상태 enum
     */
    public static final class Builder<S extends Enum<S> & TrackStatus> {

        private final TrackType track;
        private final Class<S> statusType;
        private final Map<S, Set<S>> transitions;

        private Builder(TrackType track, Class<S> statusType) {
            this.track = track;
            this.statusType = statusType;
            this.transitions = new EnumMap<>(statusType);
            for (S status : statusType.getEnumConstants()) {
                transitions.put(status, EnumSet.noneOf(statusType));
            }
        }

        /**
         * from → targets 전이 허용.
         *
         * @param from 출발 상태
         * @param targets 도착 상태들
         * @return this
         * @throws IllegalStateException from이 종료 상태인 경우
         */
        @SafeVarargs
        public final Builder<S> allow(S from, S... targets) {
            if (from == null) {
                throw new IllegalArgumentException("from cannot be null");
            }
            if (from.isTerminal()) {
                throw new IllegalStateException(
                    String.format("Terminal state %s of %s track cannot have outgoing transitions", from, track.getLabel()));
            }
            for (S target : targets) {
                transitions.get(from).add(target);
            }
            return this;
        }

        /**
         * 불변 테이블 생성.
         *
         * @return 전이 테이블
         */
        public TrackTransitionTable<S> build() {
            Map<S, Set<S>> frozen = new EnumMap<>(statusType);
            transitions.forEach((from, targets) -> {
                EnumSet<S> copy = EnumSet.noneOf(statusType);
                copy.addAll(targets);
                frozen.put(from, Collections.unmodifiableSet(copy));
            });
            return new TrackTransitionTable<>(track, Collections.unmodifiableMap(frozen));
        }
    }
}
