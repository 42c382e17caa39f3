package com.ryuqq.lifecycle.core.alias;

import com.ryuqq.lifecycle.core.model.FeatureRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * 제목/별칭 기반 중복 Feature 탐지.
 *
 * <p>같은 제품의 기존 Feature 제목과 별칭 각각에 대해 Jaccard 유사도를 계산하고,
 * 가장 높은 값이 임계값 이상이면 후보로 반환합니다.</p>
 *
 * <p><strong>결정성:</strong> 후보는 유사도 내림차순, 같으면 slug 오름차순으로 정렬됩니다.
 * 입력 레코드 순서와 무관하게 같은 제목에는 같은 결과를 돌려줍니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class AliasIndex {

    private final TitleNormalizer normalizer;
    private final double threshold;

    public AliasIndex(TitleNormalizer normalizer, double threshold) {
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer cannot be null");
        }
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in (0.0, 1.0] (current: " + threshold + ")");
        }
        this.normalizer = normalizer;
        this.threshold = threshold;
    }

    /**
     * 중복 후보 조회.
     *
     * @param productId 제품 ID
     * @param title 새 Feature 제목
     * @param records 기존 레코드 (다른 제품 레코드는 무시)
     * @return 정렬된 후보 목록 (없으면 빈 목록)
     */
    public List<DuplicateCandidate> findDuplicates(String productId, String title, Collection<FeatureRecord> records) {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId cannot be null or blank");
        }
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        Set<String> query = normalizer.tokens(title);
        List<DuplicateCandidate> candidates = new ArrayList<>();
        if (query.isEmpty()) {
            return candidates;
        }

        for (FeatureRecord record : records) {
            if (!productId.equals(record.productId())) {
                continue;
            }
            String bestText = record.title();
            double best = TitleNormalizer.jaccard(query, normalizer.tokens(record.title()));
            for (String alias : record.aliases()) {
                double score = TitleNormalizer.jaccard(query, normalizer.tokens(alias));
                if (score > best) {
                    best = score;
                    bestText = alias;
                }
            }
            if (best >= threshold) {
                candidates.add(new DuplicateCandidate(record.slug(), record.title(), bestText, best));
            }
        }

        candidates.sort(Comparator.comparingDouble(DuplicateCandidate::similarity).reversed()
            .thenComparing(DuplicateCandidate::slug));
        return candidates;
    }

    public double getThreshold() {
        return threshold;
    }
}
