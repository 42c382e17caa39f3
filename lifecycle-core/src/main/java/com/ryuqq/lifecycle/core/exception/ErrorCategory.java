package com.ryuqq.lifecycle.core.exception;

/**
 * 엔진 오류 분류.
 *
 * <p><strong>분류별 처리 방침:</strong></p>
 * <ul>
 *   <li>VALIDATION: 호출자 입력 오류. 즉시 보고, 자동 재시도 없음</li>
 *   <li>POLICY: 예상된 정책 결과 (게이트 미충족 등). 실패로 로깅하지 않음</li>
 *   <li>PERSISTENCE: 저장소 손상/스키마 불일치. 해당 작업은 치명적으로 실패</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    /**
     * 입력 검증 오류.
     */
    VALIDATION,

    /**
     * 게이트/정책 결과.
     */
    POLICY,

    /**
     * 영속성 오류.
     */
    PERSISTENCE
}
