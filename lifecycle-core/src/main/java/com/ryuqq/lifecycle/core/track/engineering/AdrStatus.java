package com.ryuqq.lifecycle.core.track.engineering;

/**
 * ADR 상태. PROPOSED가 하나라도 남아 있으면 Engineering Track은 COMPLETE가 될 수 없습니다.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum AdrStatus {

    PROPOSED("proposed"),
    ACCEPTED("accepted"),
    REJECTED("rejected"),
    DEPRECATED("deprecated"),
    SUPERSEDED("superseded");

    private final String wireName;

    AdrStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 저장 포맷 이름으로 조회 (대소문자 무시).
     *
     * @param value 이름
     * @return 상수
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static AdrStatus fromWireName(String value) {
        if (value != null) {
            for (AdrStatus candidate : values()) {
                if (candidate.wireName.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Unknown AdrStatus: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
