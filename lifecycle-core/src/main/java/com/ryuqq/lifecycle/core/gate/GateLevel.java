package com.ryuqq.lifecycle.core.gate;

/**
 * Gate 검사 수준.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum GateLevel {

    /**
     * 통과해야 진행 가능.
     */
    BLOCKING,

    /**
     * Track/Decision 완료에 필요하지만 중간 작업은 막지 않음.
     */
    REQUIRED,

    /**
     * 보고만 하고 막지 않음.
     */
    ADVISORY;

    /**
     * 실패 시 blocker로 보고되는 수준인지 확인.
     *
     * @return BLOCKING 또는 REQUIRED이면 true
     */
    public boolean blocksOnFailure() {
        return this != ADVISORY;
    }
}
