package com.ryuqq.lifecycle.core.track.engineering;

/**
 * 위험 영향도/발생 가능성 수준.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum RiskLevel {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    RiskLevel(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 저장 포맷 이름으로 조회 (대소문자 무시).
     *
     * @param value 이름
     * @return 상수
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static RiskLevel fromWireName(String value) {
        if (value != null) {
            for (RiskLevel candidate : values()) {
                if (candidate.wireName.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unknown RiskLevel: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
