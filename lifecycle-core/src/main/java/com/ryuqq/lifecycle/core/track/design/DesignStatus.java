package com.ryuqq.lifecycle.core.track.design;

import com.ryuqq.lifecycle.core.track.TrackStatus;

/**
 * Design Track 상태.
 *
 * <p>COMPLETE는 디자인 스펙 + Figma 참조가 모두 기록되어야 도달합니다
 * (figmaRequired=false 이면 스펙만으로 충분). 와이어프레임은 참고 사항입니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum DesignStatus implements TrackStatus {

    NOT_STARTED("not_started"),
    IN_PROGRESS("in_progress"),
    WIREFRAMES_READY("wireframes_ready"),
    FIGMA_ATTACHED("figma_attached"),
    BLOCKED("blocked"),
    COMPLETE("complete");

    private final String wireName;

    DesignStatus(String wireName) {
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
