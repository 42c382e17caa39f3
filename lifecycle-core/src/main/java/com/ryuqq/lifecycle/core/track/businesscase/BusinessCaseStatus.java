package com.ryuqq.lifecycle.core.track.businesscase;

import com.ryuqq.lifecycle.core.track.TrackStatus;

/**
 * Business Case Track 상태.
 *
 * <pre>
 * NOT_STARTED ──► IN_PROGRESS ──► PENDING_APPROVAL ──► APPROVED (종료)
 *                     ▲                  │
 *                     │ (revise)         ▼
 *                     └──────────── REJECTED
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum BusinessCaseStatus implements TrackStatus {

    NOT_STARTED("not_started"),
    IN_PROGRESS("in_progress"),
    PENDING_APPROVAL("pending_approval"),
    APPROVED("approved"),
    REJECTED("rejected"),
    BLOCKED("blocked");

    private final String wireName;

    BusinessCaseStatus(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public boolean isTerminal() {
        return this == APPROVED;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
