package com.ryuqq.lifecycle.application.engine;

/**
 * Feature 시작 요청.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param title Feature 제목
 * @param productId 제품 ID
 * @param priority 우선순위 (null 허용, 예: P1)
 * @param organization 조직 (null 허용)
 * @param createdBy 요청자
 * @param confirmDuplicate true이면 중복 후보가 있어도 생성
 * @param slugOverride 직접 지정한 slug (null이면 제품 ID와 제목에서 생성)
 */
public record StartFeatureRequest(
    String title,
    String productId,
    String priority,
    String organization,
    String createdBy,
    boolean confirmDuplicate,
    String slugOverride
) {

    public StartFeatureRequest {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId cannot be null or blank");
        }
        if (createdBy == null || createdBy.isBlank()) {
            throw new IllegalArgumentException("createdBy cannot be null or blank");
        }
        title = title.trim();
        productId = productId.trim();
    }

    /**
     * 최소 인자 요청 (우선순위, 조직, slug 지정 없음).
     */
    public static StartFeatureRequest of(String title, String productId, String createdBy) {
        return new StartFeatureRequest(title, productId, null, null, createdBy, false, null);
    }

    /**
     * 중복 후보를 확인한 뒤 다시 보내는 요청.
     */
    public StartFeatureRequest confirmed() {
        return new StartFeatureRequest(title, productId, priority, organization, createdBy, true, slugOverride);
    }
}
