/**
 * Track 상태 머신 공통 골격.
 *
 * <p>하위 패키지(context, design, businesscase, engineering)가 Track별 상태, 명령, 머신을 정의합니다.
 * 상태는 기록된 사실로부터 도출되며 전이 테이블로 검증됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.track;
