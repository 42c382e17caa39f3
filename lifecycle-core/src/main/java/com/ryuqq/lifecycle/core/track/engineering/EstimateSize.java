package com.ryuqq.lifecycle.core.track.engineering;

/**
 * 작업 규모 추정치 (T-shirt size).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum EstimateSize {

    /**
     * 1~2주.
     */
    S,

    /**
     * 2~4주.
     */
    M,

    /**
     * 1~2개월.
     */
    L,

    /**
     * 2개월 이상.
     */
    XL
}
