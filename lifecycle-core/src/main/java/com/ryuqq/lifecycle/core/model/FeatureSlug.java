package com.ryuqq.lifecycle.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Feature의 고유 식별자 (저장소 키).
 *
 * <p>제품 ID 앞 세 글자와 제목을 slug화한 값으로 생성됩니다.
 * 예: {@code ("meal-kit", "OTP Checkout Recovery") → "mea-otp-checkout-recovery"}</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~120자</li>
 *   <li>패턴: 소문자 영숫자 토큰을 하이픈(-) 하나로 연결</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class FeatureSlug {

    private static final String PATTERN = "^[a-z0-9]+(-[a-z0-9]+)*$";
    private static final int MAX_LENGTH = 120;
    private static final int PREFIX_LENGTH = 3;

    private final String value;

    private FeatureSlug(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("FeatureSlug cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("FeatureSlug length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches(PATTERN)) {
            throw new IllegalArgumentException(
                "FeatureSlug contains invalid characters: '" + value + "'. Only lowercase alphanumeric tokens joined by single hyphens are allowed");
        }
        this.value = value;
    }

    /**
     * FeatureSlug 생성.
     *
     * @param value slug 값
     * @return FeatureSlug 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static FeatureSlug of(String value) {
        return new FeatureSlug(value);
    }

    /**
     * 제품 ID와 제목으로 slug 생성.
     *
     * <ol>
     *   <li>prefix: 제품 ID 앞 세 글자 (소문자)</li>
     *   <li>제목: 소문자화, 공백 → 하이픈, 영숫자/하이픈 외 제거</li>
     *   <li>연속 하이픈 정리</li>
     * </ol>
     *
     * @param productId 제품 ID
     * @param title Feature 제목
     * @return 생성된 FeatureSlug
     * @throws IllegalArgumentException 인자가 비어 있거나 slug화 결과가 비어 있는 경우
     */
    public static FeatureSlug generate(String productId, String title) {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId cannot be null or blank");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }

        String trimmedProduct = productId.trim();
        String prefix = trimmedProduct.substring(0, Math.min(PREFIX_LENGTH, trimmedProduct.length()));
        String titlePart = slugify(title);
        if (titlePart.isEmpty()) {
            throw new IllegalArgumentException("title '" + title + "' does not contain any slug characters");
        }

        String candidate = slugify(prefix) + "-" + titlePart;
        String slug = Arrays.stream(candidate.split("-"))
            .filter(token -> !token.isEmpty())
            .collect(Collectors.joining("-"));
        if (slug.length() > MAX_LENGTH) {
            slug = slug.substring(0, MAX_LENGTH).replaceAll("-+$", "");
        }
        return new FeatureSlug(slug);
    }

    private static String slugify(String text) {
        String lowered = text.toLowerCase(Locale.ROOT).replace(' ', '-');
        StringBuilder sb = new StringBuilder(lowered.length());
        for (char c : lowered.toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-') {
                sb.append(c);
            }
        }
        return Arrays.stream(sb.toString().split("-"))
            .filter(token -> !token.isEmpty())
            .collect(Collectors.joining("-"));
    }

    /**
     * FeatureSlug 값 조회.
     *
     * @return slug 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FeatureSlug that = (FeatureSlug) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureSlug{" + value + '}';
    }
}
