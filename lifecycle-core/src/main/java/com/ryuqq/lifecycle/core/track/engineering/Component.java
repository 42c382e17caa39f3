package com.ryuqq.lifecycle.core.track.engineering;

/**
 * 영향받는 시스템 컴포넌트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param name 컴포넌트 이름 (Track 내 고유)
 * @param description 설명 (null 허용)
 */
public record Component(String name, String description) {

    public Component {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }
}
