package com.ryuqq.lifecycle.core.exception;

/**
 * 잘못된 요청 payload (누락 필드, 타입 불일치, 알 수 없는 action 등).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InvalidPayloadException extends LifecycleException {

    public InvalidPayloadException(String message) {
        super(ErrorCategory.VALIDATION, "INVALID_PAYLOAD", message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(ErrorCategory.VALIDATION, "INVALID_PAYLOAD", message, cause);
    }
}
