package com.ryuqq.lifecycle.core.track.engineering;

/**
 * 외부 의존성.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param name 이름 (Track 내 고유)
 * @param description 설명 (null 허용)
 * @param status 상태
 * @param blocking Decision Gate 진행을 막는지 여부
 */
public record Dependency(String name, String description, DependencyStatus status, boolean blocking) {

    public Dependency {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }
}
