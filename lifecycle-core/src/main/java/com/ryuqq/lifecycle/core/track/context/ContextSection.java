package com.ryuqq.lifecycle.core.track.context;

/**
 * Context 문서 섹션.
 *
 * <p>STAKEHOLDERS를 제외한 섹션은 게이트 통과에 필요합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum ContextSection {

    PROBLEM_STATEMENT("problem_statement", true),
    SUCCESS_METRICS("success_metrics", true),
    SCOPE("scope", true),
    STAKEHOLDERS("stakeholders", false);

    private final String wireName;
    private final boolean required;

    ContextSection(String wireName, boolean required) {
        this.wireName = wireName;
        this.required = required;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * 저장 포맷 이름으로 조회.
     *
     * @param value 소문자 이름 또는 상수 이름 (대소문자 무시)
     * @return ContextSection
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static ContextSection fromWireName(String value) {
        if (value != null) {
            for (ContextSection section : values()) {
                if (section.wireName.equalsIgnoreCase(value) || section.name().equalsIgnoreCase(value)) {
                    return section;
                }
            }
        }
        throw new IllegalArgumentException("Unknown context section: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
