package com.ryuqq.lifecycle.core.track.engineering;

/**
 * 식별된 위험.
 *
 * <p>영향도 HIGH인 위험은 비어 있지 않은 mitigation이 있어야 완화된 것으로 봅니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param id 식별자 (예: "R-1")
 * @param description 설명
 * @param impact 영향도
 * @param likelihood 발생 가능성
 * @param mitigation 완화 방안 (null 허용)
 * @param owner 담당자 (null 허용)
 */
public record Risk(
    String id,
    String description,
    RiskLevel impact,
    RiskLevel likelihood,
    String mitigation,
    String owner
) {

    public Risk {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (impact == null) {
            throw new IllegalArgumentException("impact cannot be null");
        }
        if (likelihood == null) {
            throw new IllegalArgumentException("likelihood cannot be null");
        }
    }

    /**
     * 완화 방안 없는 고영향 위험인지 확인.
     *
     * @return impact가 HIGH이고 mitigation이 비어 있으면 true
     */
    public boolean unmitigatedHighImpact() {
        return impact == RiskLevel.HIGH && (mitigation == null || mitigation.isBlank());
    }

    Risk withMitigation(String newMitigation) {
        return new Risk(id, description, impact, likelihood, newMitigation, owner);
    }
}
