package com.ryuqq.lifecycle.core.exception;

/**
 * 저장된 레코드를 해석할 수 없음.
 *
 * <p>엔진은 손상된 레코드를 추측하거나 초기화하지 않고 원본 상태를 그대로 보고합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class CorruptRecordException extends PersistenceException {

    private final String source;

    public CorruptRecordException(String source, String message, Throwable cause) {
        super("CORRUPT_RECORD", "Corrupt feature record " + source + ": " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
