package com.ryuqq.lifecycle.core.alias;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 중복 탐지를 위한 제목 정규화.
 *
 * <p>소문자화 → 영숫자 외 문자를 공백으로 치환 → 토큰화 → 불용어 제거 순으로 처리합니다.
 * 결과는 토큰 집합이므로 단어 순서와 반복은 유사도에 영향을 주지 않습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class TitleNormalizer {

    private static final Set<String> STOPWORDS = Set.of(
        "the", "a", "an", "for", "to", "of", "in", "on", "with", "and", "or", "but",
        "is", "are", "be", "was", "were",
        "feature", "project", "initiative", "improvement", "implementation");

    /**
     * 제목을 토큰 집합으로 정규화.
     *
     * @param title 제목 (null이면 빈 집합)
     * @return 입력 순서를 유지한 토큰 집합
     */
    public Set<String> tokens(String title) {
        Set<String> tokens = new LinkedHashSet<>();
        if (title == null) {
            return tokens;
        }
        String cleaned = title.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
        if (cleaned.isEmpty()) {
            return tokens;
        }
        for (String token : cleaned.split(" ")) {
            if (!STOPWORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * 정규화된 제목 문자열 (토큰을 공백 하나로 연결).
     *
     * @param title 제목
     * @return 정규화된 제목
     */
    public String normalize(String title) {
        return String.join(" ", tokens(title));
    }

    /**
     * 두 제목의 Jaccard 유사도.
     *
     * @param left 제목
     * @param right 제목
     * @return 0.0 ~ 1.0 (둘 다 토큰이 없으면 0.0)
     */
    public double similarity(String left, String right) {
        return jaccard(tokens(left), tokens(right));
    }

    static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new LinkedHashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new LinkedHashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }
}
