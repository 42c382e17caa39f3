package com.ryuqq.lifecycle.core.track.engineering;

import java.time.Instant;

/**
 * Architecture Decision Record.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param number ADR 번호 (1부터)
 * @param title 제목
 * @param status 상태
 * @param context 배경 (null 허용)
 * @param decision 결정 내용 (null 허용)
 * @param supersedes 대체한 ADR 번호 (없으면 null)
 * @param createdAt 생성 시각
 */
public record Adr(
    int number,
    String title,
    AdrStatus status,
    String context,
    String decision,
    Integer supersedes,
    Instant createdAt
) {

    public Adr {
        if (number <= 0) {
            throw new IllegalArgumentException("number must be positive (current: " + number + ")");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    /**
     * 표시용 식별자 (예: "ADR-003").
     *
     * @return 식별자
     */
    public String label() {
        return String.format("ADR-%03d", number);
    }

    Adr withStatus(AdrStatus newStatus) {
        return new Adr(number, title, newStatus, context, decision, supersedes, createdAt);
    }
}
