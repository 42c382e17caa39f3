package com.ryuqq.lifecycle.core.track;

/**
 * Track별 상태 enum이 구현하는 공통 계약.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface TrackStatus {

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태에서는 어떤 상태로도 전이할 수 없습니다.</p>
     *
     * @return 종료 상태이면 true
     */
    boolean isTerminal();
}
