/**
 * Feature Lifecycle Engine 진입점.
 *
 * <p>{@link com.ryuqq.lifecycle.application.engine.FeatureEngine}은 외부 호출자(CLI, 에이전트 도구)가
 * 사용하는 단일 facade입니다. 각 작업은 레코드를 읽고, core 규칙을 적용한 뒤, 변경이 있을 때만 저장합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.engine.DefaultFeatureEngine} - FeatureStore, GateConfigProvider, Clock 조합</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.application.engine;
