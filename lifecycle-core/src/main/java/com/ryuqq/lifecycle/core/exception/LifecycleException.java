package com.ryuqq.lifecycle.core.exception;

/**
 * Feature Lifecycle 엔진 예외의 최상위 타입.
 *
 * <p>모든 엔진 예외는 unchecked이며, 호출자가 분기할 수 있도록
 * {@link ErrorCategory}와 안정적인 오류 코드를 함께 제공합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public abstract class LifecycleException extends RuntimeException {

    private final ErrorCategory category;
    private final String errorCode;

    protected LifecycleException(ErrorCategory category, String errorCode, String message) {
        super(message);
        this.category = category;
        this.errorCode = errorCode;
    }

    protected LifecycleException(ErrorCategory category, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.errorCode = errorCode;
    }

    /**
     * 오류 분류 조회.
     *
     * @return 오류 분류
     */
    public ErrorCategory getCategory() {
        return category;
    }

    /**
     * 오류 코드 조회 (예: "FEATURE_NOT_FOUND").
     *
     * @return 오류 코드
     */
    public String getErrorCode() {
        return errorCode;
    }
}
