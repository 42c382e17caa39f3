package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.exception.InvalidPhaseTransitionException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phase 전이 테이블 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>INITIALIZATION → SIGNAL_ANALYSIS → CONTEXT_DOC → PARALLEL_TRACKS</li>
 *   <li>PARALLEL_TRACKS → DECISION_GATE → OUTPUT_GENERATION → COMPLETE</li>
 *   <li>DECISION_GATE → PARALLEL_TRACKS (유일한 역방향 전이, 반려 시)</li>
 *   <li>비종료 Phase → ARCHIVED, DEFERRED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 Phase(COMPLETE, ARCHIVED, DEFERRED)에서는 어떤 Phase로도 전이 불가</li>
 *   <li>자기 자신으로의 전이는 테이블 검증 대상이 아님 ({@link PhaseStateMachine}에서 no-op 처리)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    // Utility class - prevent instantiation
    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 현재 Phase에서 도달 가능한 Phase 목록.
     *
     * @param from 현재 Phase
     * @return 허용된 다음 Phase 집합 (종료 Phase이면 빈 집합)
     * @throws IllegalArgumentException from이 null인 경우
     */
    public static Set<Phase> allowedTargets(Phase from) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        if (from.isTerminal()) {
            return EnumSet.noneOf(Phase.class);
        }

        EnumSet<Phase> targets = EnumSet.of(Phase.ARCHIVED, Phase.DEFERRED);
        switch (from) {
            case INITIALIZATION -> targets.add(Phase.SIGNAL_ANALYSIS);
            case SIGNAL_ANALYSIS -> targets.add(Phase.CONTEXT_DOC);
            case CONTEXT_DOC -> targets.add(Phase.PARALLEL_TRACKS);
            case PARALLEL_TRACKS -> targets.add(Phase.DECISION_GATE);
            case DECISION_GATE -> {
                targets.add(Phase.OUTPUT_GENERATION);
                targets.add(Phase.PARALLEL_TRACKS);
            }
            case OUTPUT_GENERATION -> targets.add(Phase.COMPLETE);
            default -> {
                // 종료 Phase는 위에서 처리
            }
        }
        return targets;
    }

    /**
     * 전이 허용 여부.
     *
     * @param from 현재 Phase
     * @param to 목표 Phase
     * @return 테이블에 있는 전이이면 true
     */
    public static boolean isAllowed(Phase from, Phase to) {
        if (from == null || to == null) {
            return false;
        }
        return allowedTargets(from).contains(to);
    }

    /**
     * 전이가 유효한지 검증.
     *
     * @param from 현재 Phase
     * @param to 목표 Phase
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws InvalidPhaseTransitionException 유효하지 않은 전이인 경우
     */
    public static void validate(Phase from, Phase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        // 종료 Phase에서는 어디로도 전이 불가
        if (from.isTerminal()) {
            throw new InvalidPhaseTransitionException(from, to,
                String.format("Cannot transition from terminal phase: %s → %s", from, to));
        }

        if (!allowedTargets(from).contains(to)) {
            throw new InvalidPhaseTransitionException(from, to);
        }
    }
}
