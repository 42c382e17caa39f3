package com.ryuqq.lifecycle.core.track.engineering;

/**
 * 외부 의존성 상태. READY가 되면 blocking 플래그가 해제됩니다.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum DependencyStatus {

    PENDING("pending"),
    READY("ready"),
    BLOCKED("blocked");

    private final String wireName;

    DependencyStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 저장 포맷 이름으로 조회 (대소문자 무시).
     *
     * @param value 이름
     * @return 상수
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static DependencyStatus fromWireName(String value) {
        if (value != null) {
            for (DependencyStatus candidate : values()) {
                if (candidate.wireName.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unknown DependencyStatus: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
