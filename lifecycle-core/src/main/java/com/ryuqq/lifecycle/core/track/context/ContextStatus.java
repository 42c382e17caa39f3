package com.ryuqq.lifecycle.core.track.context;

import com.ryuqq.lifecycle.core.track.TrackStatus;

/**
 * Context Track 상태.
 *
 * <pre>
 * NOT_STARTED ──► IN_PROGRESS ◄──► PENDING_CHALLENGE
 *                     │                  │
 *                     └──────► COMPLETE ◄┘   (v3 + 점수 ≥ approved)
 *
 * 비종료 상태 ◄──► BLOCKED
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum ContextStatus implements TrackStatus {

    NOT_STARTED("not_started"),
    IN_PROGRESS("in_progress"),

    /**
     * 문서가 제출되었으나 현재 버전의 challenge 점수가 아직 없음.
     */
    PENDING_CHALLENGE("pending_challenge"),
    BLOCKED("blocked"),
    COMPLETE("complete");

    private final String wireName;

    ContextStatus(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public boolean isTerminal() {
        return this == COMPLETE;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
