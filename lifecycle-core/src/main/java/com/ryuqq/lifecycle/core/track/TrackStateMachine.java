package com.ryuqq.lifecycle.core.track;

import com.ryuqq.lifecycle.core.exception.InvalidPayloadException;
import com.ryuqq.lifecycle.core.exception.TrackPreconditionException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Track 상태 머신 공통 골격.
 *
 * <p>모든 변경은 다음 순서로 처리됩니다:</p>
 * <ol>
 *   <li>명령을 사실(fact)에 반영 (공통 명령은 여기서, Track별 명령은 {@link #mutate})</li>
 *   <li>반영된 사실로부터 상태 도출 ({@link #deriveStatus})</li>
 *   <li>이전 상태 → 도출 상태를 전이 테이블로 검증</li>
 *   <li>검증 통과 시에만 새 상태 반환 ({@link #settle})</li>
 * </ol>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>status는 항상 사실의 순수 함수이며 직접 설정되지 않음</li>
 *   <li>검증 실패 시 입력 상태는 변경되지 않음 (새 객체를 만들 뿐)</li>
 *   <li>사실 변화가 없는 명령은 입력 상태를 그대로 반환</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param <S> Track별 상태 enum
 * @param <T> Track별 상태 record
 */
public abstract class TrackStateMachine<S extends Enum<S> & TrackStatus, T extends TrackState<S>> {

    private final TrackType trackType;
    private final TrackTransitionTable<S> transitionTable;

    protected TrackStateMachine(TrackType trackType, TrackTransitionTable<S> transitionTable) {
        if (trackType == null) {
            throw new IllegalArgumentException("trackType cannot be null");
        }
        if (transitionTable == null) {
            throw new IllegalArgumentException("transitionTable cannot be null");
        }
        this.trackType = trackType;
        this.transitionTable = transitionTable;
    }

    public TrackType getTrackType() {
        return trackType;
    }

    public TrackTransitionTable<S> getTransitionTable() {
        return transitionTable;
    }

    /**
     * 생성 시점의 초기 상태 (NOT_STARTED).
     *
     * @return 초기 상태
     */
    public abstract T initialState();

    /**
     * 명령 적용.
     *
     * @param current 현재 상태
     * @param command 명령
     * @param at 명령 시각
     * @return 새 상태 (변화가 없으면 current)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws InvalidPayloadException 이 Track이 지원하지 않는 명령인 경우
     * @throws TrackPreconditionException 명령 사전 조건 위반
     * @throws com.ryuqq.lifecycle.core.exception.InvalidTrackTransitionException 도출 상태로의 전이가 허용되지 않는 경우
     */
    public final T apply(T current, TrackCommand command, Instant at) {
        if (current == null) {
            throw new IllegalArgumentException("current cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }

        T mutated;
        if (command instanceof StartTrack) {
            mutated = current.started()
                ? current
                : withLifecycle(current, true, current.blockedReason(),
                    withEntries(current.metadata(), "started_by", command.actor(), "started_at", at.toString()));
        } else if (command instanceof BlockTrack block) {
            mutated = withLifecycle(current, true, block.reason(),
                withEntries(current.metadata(), "blocked_by", command.actor(), "blocked_at", at.toString()));
        } else if (command instanceof UnblockTrack) {
            if (current.blockedReason() == null) {
                throw precondition("Track is not blocked");
            }
            mutated = withLifecycle(current, true, null,
                withEntries(current.metadata(), "unblocked_by", command.actor(), "unblocked_at", at.toString()));
        } else {
            mutated = mutate(current, command, at);
        }

        if (mutated.equals(current)) {
            return current;
        }

        S next = deriveStatus(mutated);
        transitionTable.validate(current.status(), next);
        return settle(current, mutated, next);
    }

    /**
     * status를 기록된 사실에 맞춰 보정.
     *
     * <p>전이 테이블 검증과 버전 증가 없이 도출 상태로 교체합니다. 구 스키마에서 읽어 들인
     * 상태처럼 명령을 거치지 않고 만들어진 상태에만 사용합니다.</p>
     *
     * @param state 보정할 상태
     * @return 도출 상태를 가진 상태 (이미 일치하면 입력 그대로)
     * @throws IllegalArgumentException state가 null인 경우
     */
    public final T reconcile(T state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        S derived = deriveStatus(state);
        return derived == state.status() ? state : withStatus(state, derived);
    }

    /**
     * Track별 명령을 사실에 반영.
     *
     * <p>반환 값의 status/version은 아직 갱신되지 않은 상태여야 합니다.</p>
     *
     * @param current 현재 상태
     * @param command Track별 명령
     * @param at 명령 시각
     * @return 사실이 반영된 상태
     */
    protected abstract T mutate(T current, TrackCommand command, Instant at);

    /**
     * 기록된 사실로부터 상태 도출.
     *
     * @param state 상태 (status 필드는 무시됨)
     * @return 도출된 상태
     */
    public abstract S deriveStatus(T state);

    /**
     * 공통 생명주기 사실(started, blockedReason, metadata) 교체.
     */
    protected abstract T withLifecycle(T state, boolean started, String blockedReason, Map<String, String> metadata);

    /**
     * status만 교체 (버전 유지).
     */
    protected abstract T withStatus(T state, S status);

    /**
     * 도출된 상태와 버전을 확정.
     *
     * @param previous 명령 적용 전 상태
     * @param mutated 사실이 반영된 상태
     * @param status 검증된 새 상태
     * @return 확정된 상태
     */
    protected abstract T settle(T previous, T mutated, S status);

    protected InvalidPayloadException unsupported(TrackCommand command) {
        return new InvalidPayloadException(
            "Command " + command.getClass().getSimpleName() + " is not supported by the " + trackType.getLabel() + " track");
    }

    protected TrackPreconditionException precondition(String message) {
        return new TrackPreconditionException(trackType, message);
    }

    protected static Map<String, String> withEntries(Map<String, String> metadata, String... keyValues) {
        Map<String, String> copy = new LinkedHashMap<>(metadata);
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            copy.put(keyValues[i], keyValues[i + 1]);
        }
        return copy;
    }
}
