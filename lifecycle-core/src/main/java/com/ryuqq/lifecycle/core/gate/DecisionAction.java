package com.ryuqq.lifecycle.core.gate;

import java.util.Locale;

/**
 * Decision Gate 동작.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum DecisionAction {
    APPROVE,
    REJECT;

    /**
     * 대소문자 무관 파싱 ("approve", "reject").
     *
     * @param value 동작 이름
     * @return DecisionAction
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static DecisionAction parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown decision action: " + value + " (expected approve or reject)", e);
        }
    }
}
