package com.ryuqq.lifecycle.core.track;

/**
 * 네 개의 독립 Track 종류.
 *
 * <p>선언 순서(Context, Design, Business Case, Engineering)가 게이트 보고서의
 * blocker 정렬 순서입니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum TrackType {

    CONTEXT("context", "Context"),
    DESIGN("design", "Design"),
    BUSINESS_CASE("business_case", "Business Case"),
    ENGINEERING("engineering", "Engineering");

    private final String wireName;
    private final String label;

    TrackType(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    /**
     * 보고서용 표시 이름 (예: "Business Case").
     *
     * @return 표시 이름
     */
    public String getLabel() {
        return label;
    }

    /**
     * 저장 포맷 이름으로 조회.
     *
     * @param value 소문자 이름 또는 상수 이름 (대소문자 무시)
     * @return TrackType
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static TrackType fromWireName(String value) {
        if (value != null) {
            for (TrackType type : values()) {
                if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown track: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
