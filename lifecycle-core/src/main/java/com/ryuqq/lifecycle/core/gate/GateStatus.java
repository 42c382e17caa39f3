package com.ryuqq.lifecycle.core.gate;

/**
 * Track 단위 Gate 결과.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum GateStatus {
    PASS,
    INCOMPLETE
}
