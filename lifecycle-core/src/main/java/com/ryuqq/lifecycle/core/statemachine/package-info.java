/**
 * Phase 상태 머신.
 *
 * <p>{@link com.ryuqq.lifecycle.core.statemachine.Phase}의 전이 규칙
 * ({@link com.ryuqq.lifecycle.core.statemachine.PhaseTransition})과
 * FeatureRecord 이력 관리({@link com.ryuqq.lifecycle.core.statemachine.PhaseStateMachine})를 담당합니다.</p>
 *
 * <p><strong>핵심 불변식:</strong></p>
 * <ul>
 *   <li>역방향 전이는 DECISION_GATE → PARALLEL_TRACKS 하나뿐</li>
 *   <li>종료 Phase에서는 전이 불가, 이력 보존</li>
 *   <li>phase_history는 연속적이고 겹치지 않으며 시간 순으로 증가</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.statemachine;
