package com.ryuqq.lifecycle.core.model;

/**
 * 제품 식별자.
 *
 * <p>Feature는 제품 단위로 그룹화되며, 게이트 설정과 중복 탐지의 범위가 됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영숫자로 시작, 영숫자/하이픈(-)/언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ProductId {

    private final String value;

    private ProductId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ProductId cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("ProductId length cannot exceed 64 characters");
        }
        if (!value.matches("^[a-zA-Z0-9][a-zA-Z0-9\\-_]*$")) {
            throw new IllegalArgumentException("ProductId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * ProductId 생성.
     *
     * @param value 제품 ID 값
     * @return ProductId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ProductId of(String value) {
        return new ProductId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProductId productId = (ProductId) o;
        return value.equals(productId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ProductId{" + value + '}';
    }
}
