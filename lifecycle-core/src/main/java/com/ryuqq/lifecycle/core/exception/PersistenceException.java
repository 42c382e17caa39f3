package com.ryuqq.lifecycle.core.exception;

/**
 * 저장소 I/O 실패.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class PersistenceException extends LifecycleException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCategory.PERSISTENCE, "PERSISTENCE_FAILURE", message, cause);
    }

    protected PersistenceException(String errorCode, String message, Throwable cause) {
        super(ErrorCategory.PERSISTENCE, errorCode, message, cause);
    }
}
