package com.ryuqq.lifecycle.core.model;

/**
 * Feature에 첨부되는 외부 산출물 종류.
 *
 * <p>{@link #toString()}은 저장 포맷의 키 이름을 반환합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum ArtifactType {

    FIGMA("figma"),
    WIREFRAMES("wireframes"),
    JIRA_EPIC("jira_epic"),
    CONFLUENCE_PAGE("confluence_page"),
    GDOCS("gdocs");

    private final String wireName;

    ArtifactType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 저장 포맷 이름으로 조회.
     *
     * @param value 소문자 이름 또는 상수 이름 (대소문자 무시)
     * @return ArtifactType
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static ArtifactType fromWireName(String value) {
        if (value != null) {
            for (ArtifactType type : values()) {
                if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown artifact type: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
