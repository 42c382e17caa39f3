package com.ryuqq.lifecycle.core.gate;

/**
 * Decision Gate 준비 상태.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum DecisionStatus {
    READY,
    NOT_READY
}
