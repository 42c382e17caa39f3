/**
 * 엔진 예외 계층.
 *
 * <p>{@link com.ryuqq.lifecycle.core.exception.LifecycleException}을 최상위로 하며,
 * {@link com.ryuqq.lifecycle.core.exception.ErrorCategory}로 검증/정책/영속성 오류를 구분합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.exception;
