/**
 * Quality Gate 평가와 Decision Gate.
 *
 * <p>{@link com.ryuqq.lifecycle.core.gate.QualityGateEvaluator}가 Track별 검사를 수행하고,
 * {@link com.ryuqq.lifecycle.core.gate.DecisionGateController}가 이를 모아 GO/NO-GO를 결정합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.gate;
