package com.ryuqq.lifecycle.core.alias;

/**
 * 중복 후보 Feature.
 *
 * @param slug 기존 Feature slug
 * @param title 기존 Feature 제목
 * @param matchedText 가장 높은 유사도를 보인 제목 또는 별칭
 * @param similarity Jaccard 유사도
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record DuplicateCandidate(String slug, String title, String matchedText, double similarity) {

    public DuplicateCandidate {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug cannot be null or blank");
        }
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("similarity must be between 0.0 and 1.0 (current: " + similarity + ")");
        }
    }
}
